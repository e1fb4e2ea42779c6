package org.yuho.ast.decl;

import org.yuho.ast.Span;

import java.util.List;

public record LegalTestDecl(String name, List<Requirement> requirements, Span span) implements Item
{
	public LegalTestDecl
	{
		requirements = List.copyOf(requirements);
	}

	@Override
	public <R> R accept(Visitor<R> visitor)
	{
		return visitor.visitLegalTest(this);
	}
}
