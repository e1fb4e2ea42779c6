package org.yuho.legal;

import org.yuho.semantic.ErrorKind;
import org.yuho.semantic.SemanticError;
import org.yuho.semantic.symbol.FieldSymbol;
import org.yuho.semantic.symbol.LegalTestSymbol;
import org.yuho.semantic.type.Type;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates legal test definitions and evaluates them against a set of facts.
 * A legal test is a plain conjunction: it holds only if every requirement holds.
 */
public final class LegalTestEngine
{
	private LegalTestEngine()
	{
	}

	/**
	 * Every requirement must be declared {@code bool} and named once.
	 *
	 * @return the problems found, empty when the definition is valid
	 */
	public static List<SemanticError> evaluateTestDefinition(LegalTestSymbol test)
	{
		List<SemanticError> errors = new ArrayList<>();
		Set<String> seen = new HashSet<>();
		for (FieldSymbol requirement : test.getRequirements())
		{
			if (!seen.add(requirement.name()))
			{
				errors.add(new SemanticError(ErrorKind.DUPLICATE_DEFINITION,
						"Requirement '" + requirement.name() + "' is declared twice in legal test '" + test.getName() + "'",
						requirement.span()));
				continue;
			}
			Type type = requirement.type();
			// Unresolvable types were already reported by the type checker
			if (!type.isError() && !type.unwrap().isBoolean())
			{
				errors.add(new SemanticError(ErrorKind.NON_BOOLEAN_REQUIREMENT,
						"Requirement '" + requirement.name() + "' of legal test '" + test.getName()
								+ "' must be 'bool', got '" + type.getName() + "'",
						requirement.span()));
			}
		}
		return errors;
	}

	/**
	 * {@code r1 && r2 && ... && rn}. A requirement missing from {@code facts} does not hold.
	 */
	public static boolean satisfies(LegalTestSymbol test, Map<String, Boolean> facts)
	{
		for (FieldSymbol requirement : test.getRequirements())
		{
			if (!Boolean.TRUE.equals(facts.get(requirement.name())))
			{
				return false;
			}
		}
		return true;
	}

	/**
	 * Names of the requirements that keep {@code test} from holding, in declaration order.
	 */
	public static List<String> unmetRequirements(LegalTestSymbol test, Map<String, Boolean> facts)
	{
		List<String> unmet = new ArrayList<>();
		for (FieldSymbol requirement : test.getRequirements())
		{
			if (!Boolean.TRUE.equals(facts.get(requirement.name())))
			{
				unmet.add(requirement.name());
			}
		}
		return unmet;
	}
}
