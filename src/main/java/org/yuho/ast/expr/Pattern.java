package org.yuho.ast.expr;

import org.yuho.ast.Span;

public sealed interface Pattern
{
	Span span();

	record Literal(Expr.Literal value, Span span) implements Pattern
	{
	}

	/**
	 * Binds the scrutinee to {@code name} inside the arm.
	 */
	record Binding(String name, Span span) implements Pattern
	{
	}

	record Wildcard(Span span) implements Pattern
	{
	}

	/**
	 * {@code satisfies LegalTest}: matches when every requirement of the named test holds.
	 */
	record Satisfies(String legalTest, Span span) implements Pattern
	{
	}
}
