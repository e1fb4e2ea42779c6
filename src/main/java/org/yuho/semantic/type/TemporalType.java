package org.yuho.semantic.type;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A value that only holds inside a validity window; {@code ValidDate<after, before>} is a
 * temporal date. Bounds are null when open.
 */
public class TemporalType implements Type
{
	private final Type inner;
	private final LocalDate validFrom;
	private final LocalDate validUntil;

	public TemporalType(Type inner, LocalDate validFrom, LocalDate validUntil)
	{
		this.inner = inner;
		this.validFrom = validFrom;
		this.validUntil = validUntil;
	}

	public Type getInner()
	{
		return inner;
	}

	public LocalDate getValidFrom()
	{
		return validFrom;
	}

	public LocalDate getValidUntil()
	{
		return validUntil;
	}

	@Override
	public String getName()
	{
		return "Temporal<" + inner.getName() + ", " + validFrom + ", " + validUntil + ">";
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
	public boolean isDate()
	{
		return inner.isDate();
	}

	@Override
	public boolean equals(Object obj)
	{
		if (!(obj instanceof TemporalType that))
		{
			return false;
		}
		return inner.equals(that.inner) && Objects.equals(validFrom, that.validFrom) && Objects.equals(validUntil, that.validUntil);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(inner, validFrom, validUntil);
	}
}
