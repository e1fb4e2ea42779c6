package org.yuho.ast.decl;

import org.yuho.ast.Span;
import org.yuho.ast.stmt.Stmt;
import org.yuho.ast.type.TypeRef;

import java.util.List;

/**
 * {@code fn name<T>(params) : ReturnType { body }}. A null {@code returnType} means {@code pass}.
 */
public record FunctionDecl(String name, List<String> typeParameters, List<Param> parameters, TypeRef returnType,
						   List<Stmt> body, Span span) implements Item
{
	public FunctionDecl
	{
		typeParameters = List.copyOf(typeParameters);
		parameters = List.copyOf(parameters);
		body = List.copyOf(body);
	}

	@Override
	public <R> R accept(Visitor<R> visitor)
	{
		return visitor.visitFunction(this);
	}
}
