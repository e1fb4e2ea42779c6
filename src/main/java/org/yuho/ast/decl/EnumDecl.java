package org.yuho.ast.decl;

import org.yuho.ast.Span;

import java.util.List;

/**
 * An enum; when {@code mutuallyExclusive} is set, functions returning it must pick one variant per path.
 */
public record EnumDecl(String name, List<String> variants, boolean mutuallyExclusive, Span span) implements Item
{
	public EnumDecl
	{
		variants = List.copyOf(variants);
	}

	@Override
	public <R> R accept(Visitor<R> visitor)
	{
		return visitor.visitEnum(this);
	}
}
