// File: src/main/java/org/yuho/semantic/type/ArrayType.java
package org.yuho.semantic.type;

import java.util.Objects;

public class ArrayType implements Type
{
	private final Type elementType;

	public ArrayType(Type elementType)
	{
		this.elementType = elementType;
	}

	public Type getElementType()
	{
		return elementType;
	}

	@Override
	public String getName()
	{
		return "[" + elementType.getName() + "]";
	}

	@Override
	public boolean isAssignableTo(Type other)
	{
		return other instanceof ArrayType otherArray && Type.isAssignable(elementType, otherArray.elementType);
	}

	@Override
	public boolean equals(Object obj)
	{
		return obj instanceof ArrayType other && elementType.equals(other.elementType);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash("array", elementType);
	}
}
