package org.yuho.ast.type;

import java.util.Optional;

public enum PrimitiveKind
{
	INT("int"),
	FLOAT("float"),
	BOOL("bool"),
	STRING("string"),
	MONEY("money"),
	DATE("date"),
	DURATION("duration"),
	PERCENT("percent"),
	PASS("pass");

	private final String keyword;

	PrimitiveKind(String keyword)
	{
		this.keyword = keyword;
	}

	public String getKeyword()
	{
		return keyword;
	}

	public boolean isNumeric()
	{
		return this == INT || this == FLOAT || this == MONEY || this == PERCENT;
	}

	public static Optional<PrimitiveKind> fromKeyword(String keyword)
	{
		for (PrimitiveKind kind : values())
		{
			if (kind.keyword.equals(keyword))
			{
				return Optional.of(kind);
			}
		}
		return Optional.empty();
	}
}
