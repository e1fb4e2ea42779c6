package org.yuho.semantic.symbol;

import org.yuho.ast.Span;

/**
 * A named type definition stored in the environment's arena. The id is its arena index.
 */
public abstract class TypeSymbol implements Symbol
{
	public static final int NO_ID = -1;

	private final String name;
	private final Span span;
	private int id = NO_ID;

	protected TypeSymbol(String name, Span span)
	{
		this.name = name;
		this.span = span;
	}

	@Override
	public String getName()
	{
		return name;
	}

	public Span getSpan()
	{
		return span;
	}

	public int getId()
	{
		return id;
	}

	public void setId(int id)
	{
		if (this.id != NO_ID)
		{
			throw new IllegalStateException("Type '" + name + "' is already registered with id " + this.id);
		}
		this.id = id;
	}

	@Override
	public String toString()
	{
		return getClass().getSimpleName() + "(" + name + "#" + id + ")";
	}
}
