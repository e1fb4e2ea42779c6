package org.yuho.semantic.symbol;

import java.util.Optional;

/**
 * Nested scopes for variables, parameters and quantifier-bound names. Owned by a single
 * checker invocation, so it is not thread-safe.
 */
public class ScopeStack
{
	public enum DefineResult
	{
		/** New name, nothing hidden. */
		DEFINED,
		/** Already defined in the innermost scope; the old symbol is kept. */
		DUPLICATE,
		/** Defined, hiding a symbol of an enclosing scope. */
		SHADOWS
	}

	private final Scope globalScope = new Scope(null);
	private Scope current = globalScope;
	private int depth = 0;

	public void push()
	{
		current = new Scope(current);
		depth++;
	}

	public void pop()
	{
		if (current == globalScope)
		{
			throw new IllegalStateException("Cannot pop the global scope");
		}
		current = current.getEnclosingScope();
		depth--;
	}

	public DefineResult define(Symbol symbol)
	{
		if (current.resolveLocally(symbol.getName()).isPresent())
		{
			return DefineResult.DUPLICATE;
		}
		boolean shadows = current.getEnclosingScope() != null
				&& current.getEnclosingScope().resolve(symbol.getName()).isPresent();
		current.define(symbol);
		return shadows ? DefineResult.SHADOWS : DefineResult.DEFINED;
	}

	public Optional<Symbol> resolve(String name)
	{
		return current.resolve(name);
	}

	public Scope getGlobalScope()
	{
		return globalScope;
	}

	public Scope getCurrent()
	{
		return current;
	}

	public int getDepth()
	{
		return depth;
	}
}
