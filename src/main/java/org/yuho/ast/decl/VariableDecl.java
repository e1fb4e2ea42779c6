package org.yuho.ast.decl;

import org.yuho.ast.Span;
import org.yuho.ast.expr.Expr;
import org.yuho.ast.type.TypeRef;

/**
 * {@code Type name := value}; used both at top level and as a statement. {@code value} may be null.
 */
public record VariableDecl(String name, TypeRef type, Expr value, Span span) implements Item
{
	@Override
	public <R> R accept(Visitor<R> visitor)
	{
		return visitor.visitVariable(this);
	}
}
