package org.yuho.semantic.type;

import java.util.Objects;

public class NonEmptyType implements Type
{
	private final Type inner;

	public NonEmptyType(Type inner)
	{
		this.inner = inner;
	}

	public Type getInner()
	{
		return inner;
	}

	@Override
	public String getName()
	{
		return "NonEmpty<" + inner.getName() + ">";
	}

	@Override
	public Type unwrap()
	{
		return inner.unwrap();
	}

	@Override
	public boolean isAssignableTo(Type other)
	{
		return Type.isAssignable(inner, other);
	}

	@Override
	public boolean equals(Object obj)
	{
		return obj instanceof NonEmptyType other && inner.equals(other.inner);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash("nonEmpty", inner);
	}
}
