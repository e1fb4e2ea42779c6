package org.yuho.semantic.type;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A numeric base type restricted to a range. Either bound may be null (unbounded);
 * {@code Positive<T>} is the exclusive lower bound zero.
 */
public class RefinementType implements Type
{
	private final Type base;
	private final BigDecimal lower;
	private final BigDecimal upper;
	private final boolean lowerExclusive;

	public RefinementType(Type base, BigDecimal lower, BigDecimal upper, boolean lowerExclusive)
	{
		this.base = base;
		this.lower = lower;
		this.upper = upper;
		this.lowerExclusive = lowerExclusive;
	}

	public static RefinementType bounded(Type base, BigDecimal lower, BigDecimal upper)
	{
		return new RefinementType(base, lower, upper, false);
	}

	public static RefinementType positive(Type base)
	{
		return new RefinementType(base, BigDecimal.ZERO, null, true);
	}

	public Type getBase()
	{
		return base;
	}

	public BigDecimal getLower()
	{
		return lower;
	}

	public BigDecimal getUpper()
	{
		return upper;
	}

	public boolean isLowerExclusive()
	{
		return lowerExclusive;
	}

	public RefinementType withBase(Type newBase)
	{
		return new RefinementType(newBase, lower, upper, lowerExclusive);
	}

	public boolean contains(BigDecimal value)
	{
		if (lower != null)
		{
			int cmp = value.compareTo(lower);
			if (cmp < 0 || (lowerExclusive && cmp == 0))
			{
				return false;
			}
		}
		return upper == null || value.compareTo(upper) <= 0;
	}

	public String describeRange()
	{
		String low = lower == null ? "-inf" : lower.toPlainString();
		String high = upper == null ? "+inf" : upper.toPlainString();
		return (lowerExclusive ? "(" : "[") + low + ", " + high + "]";
	}

	@Override
	public String getName()
	{
		if (lowerExclusive && upper == null && lower != null && lower.signum() == 0)
		{
			return "Positive<" + base.getName() + ">";
		}
		return "Bounded<" + base.getName() + ", " + describeRange() + ">";
	}

	@Override
	public Type unwrap()
	{
		return base.unwrap();
	}

	@Override
	public boolean isAssignableTo(Type other)
	{
		return Type.isAssignable(base, other);
	}

	@Override
	public boolean isNumeric()
	{
		return base.isNumeric();
	}

	@Override
	public boolean isInteger()
	{
		return base.isInteger();
	}

	@Override
	public boolean equals(Object obj)
	{
		if (this == obj)
		{
			return true;
		}
		if (!(obj instanceof RefinementType that))
		{
			return false;
		}
		return lowerExclusive == that.lowerExclusive && base.equals(that.base)
				&& Objects.equals(lower, that.lower) && Objects.equals(upper, that.upper);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(base, lower, upper, lowerExclusive);
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
