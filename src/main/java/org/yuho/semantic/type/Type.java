// File: src/main/java/org/yuho/semantic/type/Type.java
package org.yuho.semantic.type;

import org.yuho.semantic.symbol.Symbol;

public interface Type extends Symbol
{
	@Override
	String getName();

	/**
	 * Direct assignability rules of this type. Wrappers on either side are peeled by
	 * {@link #isAssignable(Type, Type)}, which is what callers should use.
	 */
	boolean isAssignableTo(Type other);

	@Override
	default Type getType()
	{
		return this;
	}

	default boolean isNumeric()
	{
		return false;
	}

	default boolean isInteger()
	{
		return false;
	}

	default boolean isBoolean()
	{
		return false;
	}

	default boolean isDate()
	{
		return false;
	}

	default boolean isError()
	{
		return false;
	}

	/**
	 * The type with refinement, non-empty and temporal wrappers removed.
	 */
	default Type unwrap()
	{
		return this;
	}

	static boolean isAssignable(Type from, Type to)
	{
		if (from.isError() || to.isError() || from.equals(to))
		{
			return true;
		}
		if (to instanceof UnionType union)
		{
			return isAssignable(from, union.getLeft()) || isAssignable(from, union.getRight());
		}
		if (to.unwrap() != to)
		{
			return isAssignable(from, to.unwrap());
		}
		if (from.unwrap() != from)
		{
			return isAssignable(from.unwrap(), to);
		}
		return from.isAssignableTo(to);
	}
}
