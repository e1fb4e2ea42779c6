package org.yuho.verify;

import org.yuho.semantic.SemanticError;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Verification of every principle in one program. A principle that could not be translated has
 * an entry in {@code translationErrors} instead of a result.
 */
public record ProgramVerification(String programName, List<VerificationResult> results, Map<String, SemanticError> translationErrors)
{
	public ProgramVerification
	{
		results = List.copyOf(results);
		translationErrors = Collections.unmodifiableMap(new LinkedHashMap<>(translationErrors));
	}

	public Optional<VerificationResult> getResult(String principleName)
	{
		return results.stream().filter(r -> r.getPrincipleName().equals(principleName)).findFirst();
	}

	public boolean allValid()
	{
		return translationErrors.isEmpty() && results.stream().allMatch(VerificationResult::isValid);
	}
}
