package org.yuho.logic;

import java.util.Optional;

/**
 * Immutable chain of quantifier bindings. {@link #bind} returns a new link, so each recursion
 * level sees exactly the bindings of its enclosing quantifiers and the innermost wins.
 */
public final class BoundVariables
{
	public static final BoundVariables EMPTY = new BoundVariables(null, null, null, null);

	private final String name;
	private final String smtName;
	private final Sort sort;
	private final BoundVariables outer;

	private BoundVariables(String name, String smtName, Sort sort, BoundVariables outer)
	{
		this.name = name;
		this.smtName = smtName;
		this.sort = sort;
		this.outer = outer;
	}

	public BoundVariables bind(String variable, String smtVariable, Sort variableSort)
	{
		return new BoundVariables(variable, smtVariable, variableSort, this);
	}

	public Optional<Binding> lookup(String variable)
	{
		for (BoundVariables link = this; link.name != null; link = link.outer)
		{
			if (link.name.equals(variable))
			{
				return Optional.of(new Binding(link.name, link.smtName, link.sort));
			}
		}
		return Optional.empty();
	}

	public boolean isBound(String variable)
	{
		return lookup(variable).isPresent();
	}

	public record Binding(String name, String smtName, Sort sort)
	{
		public SExpr toSExpr()
		{
			return SExpr.name(smtName);
		}
	}
}
