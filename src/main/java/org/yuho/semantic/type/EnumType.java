package org.yuho.semantic.type;

import org.yuho.semantic.symbol.EnumSymbol;

public class EnumType implements Type
{
	private final EnumSymbol symbol;

	public EnumType(EnumSymbol symbol)
	{
		this.symbol = symbol;
	}

	public EnumSymbol getSymbol()
	{
		return symbol;
	}

	@Override
	public String getName()
	{
		return symbol.getName();
	}

	@Override
	public boolean isAssignableTo(Type other)
	{
		return other instanceof EnumType otherEnum && otherEnum.symbol == symbol;
	}

	@Override
	public boolean equals(Object obj)
	{
		return obj instanceof EnumType other && other.symbol == symbol;
	}

	@Override
	public int hashCode()
	{
		return symbol.getName().hashCode();
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
