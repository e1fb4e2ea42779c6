package org.yuho.ast.decl;

import org.yuho.ast.Span;
import org.yuho.ast.type.TypeRef;

import java.util.List;

public record TypeAliasDecl(String name, List<String> typeParameters, TypeRef target, Span span) implements Item
{
	public TypeAliasDecl
	{
		typeParameters = List.copyOf(typeParameters);
	}

	@Override
	public <R> R accept(Visitor<R> visitor)
	{
		return visitor.visitTypeAlias(this);
	}
}
