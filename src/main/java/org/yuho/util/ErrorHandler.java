package org.yuho.util;

import org.yuho.ast.Span;
import org.yuho.semantic.ErrorKind;
import org.yuho.semantic.SemanticError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the diagnostics of one compilation unit in the order they are found.
 * Every error is also echoed through {@link Debug}.
 */
public class ErrorHandler
{
	private final String unitName;
	private final List<SemanticError> errors = new ArrayList<>();
	private final List<String> warnings = new ArrayList<>();

	public ErrorHandler(String unitName)
	{
		this.unitName = unitName == null ? "" : unitName;
	}

	public void logError(ErrorKind kind, Span span, String msg)
	{
		SemanticError error = new SemanticError(kind, msg, span);
		String err = String.format("[Semantic Error] %s %s - line %d:%d - %s",
				unitName, kind.getDisplayName(), error.span().line(), error.span().column(), msg);
		Debug.logError(err);
		errors.add(error);
	}

	public void add(SemanticError error)
	{
		logError(error.kind(), error.span(), error.message());
	}

	public void logWarning(Span span, String msg)
	{
		Span at = span == null ? Span.NONE : span;
		Debug.logWarning(String.format("[Warning] %s - line %d:%d - %s", unitName, at.line(), at.column(), msg));
		warnings.add(msg);
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}

	public List<SemanticError> getErrors()
	{
		return Collections.unmodifiableList(errors);
	}

	public List<String> getWarnings()
	{
		return Collections.unmodifiableList(warnings);
	}

	public String getUnitName()
	{
		return unitName;
	}
}
