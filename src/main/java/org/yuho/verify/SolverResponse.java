package org.yuho.verify;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw answer of a backend to one check: the status and, when satisfiable, the model as a flat
 * map from constant name to value text.
 */
public record SolverResponse(Status status, Map<String, String> model, String reason)
{
	public enum Status
	{
		SAT, UNSAT, UNKNOWN, TIMEOUT
	}

	public SolverResponse
	{
		model = model == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(model));
	}

	public static SolverResponse sat(Map<String, String> model)
	{
		return new SolverResponse(Status.SAT, model, null);
	}

	public static SolverResponse unsat()
	{
		return new SolverResponse(Status.UNSAT, Map.of(), null);
	}

	public static SolverResponse unknown(String reason)
	{
		return new SolverResponse(Status.UNKNOWN, Map.of(), reason);
	}

	public static SolverResponse timeout()
	{
		return new SolverResponse(Status.TIMEOUT, Map.of(), "timeout");
	}
}
