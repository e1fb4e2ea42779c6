package org.yuho.semantic.type;

import java.util.Objects;

public class UnionType implements Type
{
	private final Type left;
	private final Type right;

	public UnionType(Type left, Type right)
	{
		this.left = left;
		this.right = right;
	}

	public Type getLeft()
	{
		return left;
	}

	public Type getRight()
	{
		return right;
	}

	@Override
	public String getName()
	{
		return left.getName() + " | " + right.getName();
	}

	/**
	 * A union flows into a target only if both alternatives do.
	 */
	@Override
	public boolean isAssignableTo(Type other)
	{
		return Type.isAssignable(left, other) && Type.isAssignable(right, other);
	}

	@Override
	public boolean equals(Object obj)
	{
		return obj instanceof UnionType other && left.equals(other.left) && right.equals(other.right);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(left, right);
	}
}
