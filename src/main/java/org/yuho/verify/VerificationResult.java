package org.yuho.verify;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of verifying one principle. On {@link Verdict#INVALID} the counterexample holds one
 * value for every constant of the solver's model. For satisfiability checks it holds the witness.
 */
public final class VerificationResult
{
	private final String principleName;
	private final Verdict verdict;
	private final Map<String, String> counterexample;
	private final String logicalForm;
	private final long elapsedMs;
	private final String reason;

	public VerificationResult(String principleName, Verdict verdict, Map<String, String> counterexample,
							  String logicalForm, long elapsedMs, String reason)
	{
		this.principleName = principleName;
		this.verdict = verdict;
		this.counterexample = counterexample == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(counterexample));
		this.logicalForm = logicalForm;
		this.elapsedMs = elapsedMs;
		this.reason = reason;
	}

	public String getPrincipleName()
	{
		return principleName;
	}

	public Verdict getVerdict()
	{
		return verdict;
	}

	public boolean isValid()
	{
		return verdict == Verdict.VALID;
	}

	public Map<String, String> getCounterexample()
	{
		return counterexample;
	}

	/**
	 * The formula as SMT-LIB text, for audit.
	 */
	public String getLogicalForm()
	{
		return logicalForm;
	}

	public long getElapsedMs()
	{
		return elapsedMs;
	}

	/**
	 * Why the solver gave up, for {@link Verdict#UNKNOWN} and {@link Verdict#TIMED_OUT}.
	 */
	public Optional<String> getReason()
	{
		return Optional.ofNullable(reason);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(principleName).append(": ").append(verdict);
		if (!counterexample.isEmpty())
		{
			sb.append(' ').append(counterexample);
		}
		if (reason != null)
		{
			sb.append(" (").append(reason).append(')');
		}
		return sb.toString();
	}
}
