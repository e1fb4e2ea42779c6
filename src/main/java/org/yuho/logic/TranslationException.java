package org.yuho.logic;

import org.yuho.ast.Span;
import org.yuho.semantic.ErrorKind;
import org.yuho.semantic.SemanticError;

/**
 * Aborts the translation of one principle. Other principles are unaffected.
 */
public class TranslationException extends Exception
{
	private final ErrorKind kind;
	private final Span span;

	public TranslationException(ErrorKind kind, String message, Span span)
	{
		super(message);
		this.kind = kind;
		this.span = span == null ? Span.NONE : span;
	}

	public ErrorKind getKind()
	{
		return kind;
	}

	public Span getSpan()
	{
		return span;
	}

	public SemanticError toSemanticError()
	{
		return new SemanticError(kind, getMessage(), span);
	}
}
