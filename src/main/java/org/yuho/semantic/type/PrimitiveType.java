// File: src/main/java/org/yuho/semantic/type/PrimitiveType.java
package org.yuho.semantic.type;

import org.yuho.ast.type.PrimitiveKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

public class PrimitiveType implements Type
{
	// --- Canonical Type Instances ---
	public static final PrimitiveType INT = new PrimitiveType(PrimitiveKind.INT);
	public static final PrimitiveType FLOAT = new PrimitiveType(PrimitiveKind.FLOAT);
	public static final PrimitiveType BOOL = new PrimitiveType(PrimitiveKind.BOOL);
	public static final PrimitiveType STRING = new PrimitiveType(PrimitiveKind.STRING);
	public static final PrimitiveType MONEY = new PrimitiveType(PrimitiveKind.MONEY);
	public static final PrimitiveType DATE = new PrimitiveType(PrimitiveKind.DATE);
	public static final PrimitiveType DURATION = new PrimitiveType(PrimitiveKind.DURATION);
	public static final PrimitiveType PERCENT = new PrimitiveType(PrimitiveKind.PERCENT);
	public static final PrimitiveType PASS = new PrimitiveType(PrimitiveKind.PASS);

	private static final Map<PrimitiveKind, PrimitiveType> BY_KIND;
	private static final Map<PrimitiveKind, Set<PrimitiveKind>> WIDENING_MAP = new EnumMap<>(PrimitiveKind.class);

	static
	{
		Map<PrimitiveKind, PrimitiveType> map = new EnumMap<>(PrimitiveKind.class);
		for (PrimitiveType type : new PrimitiveType[]{INT, FLOAT, BOOL, STRING, MONEY, DATE, DURATION, PERCENT, PASS})
		{
			map.put(type.kind, type);
		}
		BY_KIND = Collections.unmodifiableMap(map);

		// An integer literal is a valid amount, rate or real number.
		WIDENING_MAP.put(PrimitiveKind.INT, Set.of(PrimitiveKind.FLOAT, PrimitiveKind.MONEY, PrimitiveKind.PERCENT));
		WIDENING_MAP.put(PrimitiveKind.FLOAT, Set.of(PrimitiveKind.MONEY, PrimitiveKind.PERCENT));
	}

	public static PrimitiveType of(PrimitiveKind kind)
	{
		return BY_KIND.get(kind);
	}

	private final PrimitiveKind kind;

	private PrimitiveType(PrimitiveKind kind)
	{
		this.kind = kind;
	}

	public PrimitiveKind getKind()
	{
		return kind;
	}

	@Override
	public String getName()
	{
		return kind.getKeyword();
	}

	@Override
	public boolean isAssignableTo(Type other)
	{
		if (this.equals(other))
		{
			return true;
		}
		if (other instanceof PrimitiveType otherPrimitive)
		{
			Set<PrimitiveKind> allowed = WIDENING_MAP.get(kind);
			return allowed != null && allowed.contains(otherPrimitive.kind);
		}
		// A citation may be written as its plain text form.
		return this == STRING && other instanceof CitationType;
	}

	@Override
	public boolean isNumeric()
	{
		return kind.isNumeric();
	}

	@Override
	public boolean isInteger()
	{
		return this == INT;
	}

	@Override
	public boolean isBoolean()
	{
		return this == BOOL;
	}

	@Override
	public boolean isDate()
	{
		return this == DATE;
	}

	/**
	 * Ordered types accept comparison constraints.
	 */
	public boolean isComparable()
	{
		return isNumeric() || this == DATE || this == DURATION;
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
