package org.yuho.conflict;

public enum ConflictKind
{
	ENUM_CONFLICT("EnumConflict"),
	STRUCT_CONFLICT("StructConflict"),
	LEGAL_TEST_CONFLICT("LegalTestConflict");

	private final String displayName;

	ConflictKind(String displayName)
	{
		this.displayName = displayName;
	}

	public String getDisplayName()
	{
		return displayName;
	}

	@Override
	public String toString()
	{
		return displayName;
	}
}
