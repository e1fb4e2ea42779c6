package org.yuho.ast.expr;

import org.yuho.ast.Span;

/**
 * What the exhaustiveness check needs from an arm, shared by match expressions and match statements.
 */
public interface Arm
{
	Pattern pattern();

	/**
	 * The {@code where} guard, or null.
	 */
	Expr guard();

	Span span();

	default boolean isWildcard()
	{
		return pattern() instanceof Pattern.Wildcard && guard() == null;
	}
}
