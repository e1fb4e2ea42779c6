package org.yuho.logic;

import org.yuho.semantic.type.Type;

/**
 * The solver sort a source type is encoded as. Struct types become uninterpreted sorts and enums
 * become datatypes; {@code type} keeps the source type for field lookup on struct sorts.
 */
public record Sort(String name, Kind kind, Type type)
{
	public enum Kind
	{
		BUILTIN, UNINTERPRETED, DATATYPE
	}

	public static final Sort INT = new Sort("Int", Kind.BUILTIN, null);
	public static final Sort REAL = new Sort("Real", Kind.BUILTIN, null);
	public static final Sort BOOL = new Sort("Bool", Kind.BUILTIN, null);
	public static final Sort STRING = new Sort("String", Kind.BUILTIN, null);

	public static Sort uninterpreted(Type type)
	{
		return new Sort(type.getName(), Kind.UNINTERPRETED, type);
	}

	public static Sort datatype(Type type)
	{
		return new Sort(type.getName(), Kind.DATATYPE, type);
	}

	public boolean isArithmetic()
	{
		return this.equals(INT) || this.equals(REAL);
	}

	public SExpr toSExpr()
	{
		return kind == Kind.BUILTIN ? SExpr.sym(name) : SExpr.name(name);
	}

	@Override
	public boolean equals(Object obj)
	{
		return obj instanceof Sort other && other.name.equals(name) && other.kind == kind;
	}

	@Override
	public int hashCode()
	{
		return name.hashCode();
	}

	@Override
	public String toString()
	{
		return toSExpr().toString();
	}
}
