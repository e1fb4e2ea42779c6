package org.yuho.ast.decl;

import org.yuho.ast.Span;
import org.yuho.ast.type.Constraint;
import org.yuho.ast.type.TypeRef;

import java.util.List;

public record FieldDecl(String name, TypeRef type, List<Constraint> constraints, Span span)
{
	public FieldDecl
	{
		constraints = List.copyOf(constraints);
	}
}
