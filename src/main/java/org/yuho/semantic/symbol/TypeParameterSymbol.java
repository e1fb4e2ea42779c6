// File: src/main/java/org/yuho/semantic/symbol/TypeParameterSymbol.java
package org.yuho.semantic.symbol;

import org.yuho.semantic.type.Type;
import org.yuho.semantic.type.TypeParameterType;

/**
 * Represents a type parameter variable (e.g., 'T' in struct Box<T>).
 * It is resolvable only inside its declaring struct, alias or function.
 */
public class TypeParameterSymbol implements Symbol
{
	private final String name;
	private final Type type;

	public TypeParameterSymbol(String name)
	{
		this.name = name;
		this.type = new TypeParameterType(this);
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public Type getType()
	{
		return type;
	}
}
