// File: src/main/java/org/yuho/semantic/type/StructType.java
package org.yuho.semantic.type;

import org.yuho.semantic.TypeEnvironment;
import org.yuho.semantic.symbol.FieldSymbol;
import org.yuho.semantic.symbol.StructSymbol;
import org.yuho.semantic.symbol.TypeSymbol;

import java.util.List;
import java.util.Objects;

public class StructType implements Type
{
	private final StructSymbol symbol;
	private final TypeEnvironment environment;

	public StructType(StructSymbol symbol, TypeEnvironment environment)
	{
		this.symbol = symbol;
		this.environment = environment;
	}

	public StructSymbol getSymbol()
	{
		return symbol;
	}

	public List<FieldSymbol> getFields()
	{
		return symbol.getEffectiveFields();
	}

	@Override
	public String getName()
	{
		return symbol.getName();
	}

	/**
	 * A struct is assignable to itself and to any ancestor in its parent chain.
	 */
	@Override
	public boolean isAssignableTo(Type other)
	{
		if (!(other instanceof StructType target))
		{
			return false;
		}
		StructSymbol current = symbol;
		// The arena size bounds the walk even if a cycle slipped through.
		for (int steps = 0; current != null && steps <= environment.size(); steps++)
		{
			if (current == target.symbol)
			{
				return true;
			}
			if (!current.hasParent())
			{
				return false;
			}
			TypeSymbol parent = environment.getById(current.getParentId());
			current = parent instanceof StructSymbol parentStruct ? parentStruct : null;
		}
		return false;
	}

	@Override
	public boolean equals(Object obj)
	{
		if (this == obj)
		{
			return true;
		}
		if (obj == null || getClass() != obj.getClass())
		{
			return false;
		}
		return symbol == ((StructType) obj).symbol;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(symbol.getName(), symbol.getId());
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
