package org.yuho.semantic;

import org.yuho.ast.Span;

/**
 * A single diagnostic: what went wrong, a readable message and where.
 */
public record SemanticError(ErrorKind kind, String message, Span span)
{
	public SemanticError
	{
		if (kind == null)
		{
			throw new IllegalArgumentException("kind must not be null");
		}
		span = span == null ? Span.NONE : span;
	}

	@Override
	public String toString()
	{
		return kind.getDisplayName() + " at " + span + ": " + message;
	}
}
