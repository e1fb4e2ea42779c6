package org.yuho.ast.decl;

import org.yuho.ast.Span;
import org.yuho.ast.expr.Expr;

/**
 * A named first-order statement meant for the solver, usually rooted in a quantifier.
 */
public record PrincipleDecl(String name, Expr body, Span span) implements Item
{
	@Override
	public <R> R accept(Visitor<R> visitor)
	{
		return visitor.visitPrinciple(this);
	}
}
