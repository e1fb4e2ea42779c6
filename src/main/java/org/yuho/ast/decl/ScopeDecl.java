package org.yuho.ast.decl;

import org.yuho.ast.Span;

import java.util.List;

public record ScopeDecl(String name, List<Item> items, Span span) implements Item
{
	public ScopeDecl
	{
		items = List.copyOf(items);
	}

	@Override
	public <R> R accept(Visitor<R> visitor)
	{
		return visitor.visitScope(this);
	}
}
