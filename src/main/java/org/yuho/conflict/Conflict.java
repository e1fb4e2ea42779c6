package org.yuho.conflict;

import org.yuho.ast.Span;
import org.yuho.semantic.ErrorKind;
import org.yuho.semantic.SemanticError;

import java.util.List;

/**
 * Two declarations of the same name that disagree. {@code locationA} belongs to the first program
 * of the check, {@code locationB} to the second. The member lists are copied out of both programs.
 */
public record Conflict(ConflictKind kind, String name, Span locationA, Span locationB,
					   List<String> membersA, List<String> membersB, String description)
{
	public Conflict
	{
		membersA = List.copyOf(membersA);
		membersB = List.copyOf(membersB);
	}

	public SemanticError toSemanticError()
	{
		return new SemanticError(ErrorKind.CONFLICT_DETECTED, description, locationA);
	}
}
