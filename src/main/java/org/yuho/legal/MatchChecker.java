package org.yuho.legal;

import org.yuho.ast.Span;
import org.yuho.ast.expr.Arm;
import org.yuho.ast.expr.Pattern;
import org.yuho.semantic.ErrorKind;
import org.yuho.semantic.SemanticError;
import org.yuho.semantic.TypeEnvironment;

import java.util.ArrayList;
import java.util.List;

/**
 * Exhaustiveness of match expressions and statements. A match is exhaustive when it ends in a
 * single unguarded wildcard arm; anything after that arm can never run.
 */
public class MatchChecker
{
	private final TypeEnvironment environment;

	public MatchChecker(TypeEnvironment environment)
	{
		this.environment = environment;
	}

	public static boolean isExhaustive(List<? extends Arm> arms)
	{
		return arms.stream().anyMatch(Arm::isWildcard);
	}

	public List<SemanticError> checkMatchExhaustiveness(List<? extends Arm> arms, Span matchSpan)
	{
		List<SemanticError> errors = new ArrayList<>();
		boolean wildcardSeen = false;
		for (Arm arm : arms)
		{
			if (wildcardSeen)
			{
				errors.add(new SemanticError(ErrorKind.UNREACHABLE_CASE,
						"Unreachable case: a preceding wildcard arm already matches every value", arm.span()));
			}
			if (arm.pattern() instanceof Pattern.Satisfies satisfies && environment.getLegalTest(satisfies.legalTest()).isEmpty())
			{
				errors.add(new SemanticError(ErrorKind.UNDEFINED_SYMBOL,
						"Undefined legal test '" + satisfies.legalTest() + "' in 'satisfies' pattern", satisfies.span()));
			}
			if (arm.isWildcard())
			{
				wildcardSeen = true;
			}
		}
		if (!wildcardSeen)
		{
			errors.add(new SemanticError(ErrorKind.NON_EXHAUSTIVE_MATCH,
					"Non-exhaustive match: add a wildcard arm 'case _ :=' to cover the remaining values", matchSpan));
		}
		return errors;
	}
}
