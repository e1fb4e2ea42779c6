package org.yuho.ast.decl;

import org.yuho.ast.Span;

/**
 * A top-level (or scope-level) declaration.
 */
public sealed interface Item permits StructDecl, EnumDecl, TypeAliasDecl, FunctionDecl, VariableDecl,
		LegalTestDecl, PrincipleDecl, ScopeDecl
{
	String name();

	Span span();

	<R> R accept(Visitor<R> visitor);

	interface Visitor<R>
	{
		R visitStruct(StructDecl decl);

		R visitEnum(EnumDecl decl);

		R visitTypeAlias(TypeAliasDecl decl);

		R visitFunction(FunctionDecl decl);

		R visitVariable(VariableDecl decl);

		R visitLegalTest(LegalTestDecl decl);

		R visitPrinciple(PrincipleDecl decl);

		R visitScope(ScopeDecl decl);
	}
}
