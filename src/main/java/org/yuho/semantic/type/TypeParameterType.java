// File: src/main/java/org/yuho/semantic/type/TypeParameterType.java
package org.yuho.semantic.type;

import org.yuho.semantic.symbol.TypeParameterSymbol;

import java.util.Objects;

/**
 * Represents the "type" of a type parameter (e.g., T).
 * This allows 'T' to be used as a field type inside the generic struct body.
 */
public class TypeParameterType implements Type
{
	private final TypeParameterSymbol symbol;

	public TypeParameterType(TypeParameterSymbol symbol)
	{
		this.symbol = symbol;
	}

	public TypeParameterSymbol getSymbol()
	{
		return symbol;
	}

	@Override
	public String getName()
	{
		return symbol.getName();
	}

	/**
	 * A type parameter is only assignable to itself; concrete assignability is decided after substitution.
	 */
	@Override
	public boolean isAssignableTo(Type other)
	{
		return this.equals(other);
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
		TypeParameterType that = (TypeParameterType) obj;
		// Two TypeParameterTypes are equal if they refer to the *exact same symbol*
		return symbol.equals(that.symbol);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(symbol);
	}
}
