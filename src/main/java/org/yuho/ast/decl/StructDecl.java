package org.yuho.ast.decl;

import org.yuho.ast.Span;

import java.util.List;

/**
 * {@code struct Name<T...> extends Parent { fields }}. {@code parent} is null when there is none.
 */
public record StructDecl(String name, List<String> typeParameters, List<FieldDecl> fields, String parent, Span span) implements Item
{
	public StructDecl
	{
		typeParameters = List.copyOf(typeParameters);
		fields = List.copyOf(fields);
	}

	public boolean isGeneric()
	{
		return !typeParameters.isEmpty();
	}

	@Override
	public <R> R accept(Visitor<R> visitor)
	{
		return visitor.visitStruct(this);
	}
}
