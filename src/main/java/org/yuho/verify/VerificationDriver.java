package org.yuho.verify;

import org.yuho.ast.decl.PrincipleDecl;
import org.yuho.logic.LogicalForm;
import org.yuho.logic.QuantifierTranslator;
import org.yuho.logic.TranslationException;
import org.yuho.semantic.SemanticError;
import org.yuho.semantic.TypeEnvironment;
import org.yuho.semantic.TypedProgram;
import org.yuho.semantic.symbol.LegalTestSymbol;
import org.yuho.util.Debug;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Submits logical forms to an {@link SmtSolver} and interprets the answers.
 * <p>
 * The solver call is the only blocking step of the core. It runs on a worker thread and the
 * driver waits at most the timeout plus {@link #GRACE_MS}; a solver still running after that is
 * cancelled and the result is {@link Verdict#TIMED_OUT}. The driver never retries.
 */
public class VerificationDriver implements AutoCloseable
{
	public static final long GRACE_MS = 1000;

	private final SmtSolver solver;
	private final ExecutorService executor;

	public VerificationDriver(SmtSolver solver)
	{
		this.solver = solver;
		this.executor = Executors.newCachedThreadPool(r ->
		{
			Thread thread = new Thread(r, "yuho-solver");
			thread.setDaemon(true);
			return thread;
		});
	}

	public VerificationResult verify(LogicalForm form, long timeoutMs)
	{
		if (timeoutMs <= 0)
		{
			throw new IllegalArgumentException("Timeout must be positive, got " + timeoutMs);
		}
		String audit = form.toSmtLib();
		long start = System.nanoTime();
		Future<SolverResponse> pending = executor.submit(() -> solver.check(form, timeoutMs));
		SolverResponse response;
		try
		{
			response = pending.get(timeoutMs + GRACE_MS, TimeUnit.MILLISECONDS);
		}
		catch (TimeoutException e)
		{
			pending.cancel(true);
			Debug.logWarning("Solver '" + solver.getName() + "' did not answer within " + timeoutMs + " ms on '" + form.getName() + "'");
			return new VerificationResult(form.getName(), Verdict.TIMED_OUT, null, audit, elapsedSince(start), "timeout");
		}
		catch (InterruptedException e)
		{
			pending.cancel(true);
			Thread.currentThread().interrupt();
			return new VerificationResult(form.getName(), Verdict.UNKNOWN, null, audit, elapsedSince(start), "interrupted");
		}
		catch (ExecutionException e)
		{
			Throwable cause = e.getCause() == null ? e : e.getCause();
			Debug.logWarning("Solver '" + solver.getName() + "' failed on '" + form.getName() + "': " + cause.getMessage());
			return new VerificationResult(form.getName(), Verdict.UNKNOWN, null, audit, elapsedSince(start), cause.getMessage());
		}

		VerificationResult result = interpret(form, response, audit, elapsedSince(start));
		Debug.logInfo("Verified '" + form.getName() + "': " + result);
		return result;
	}

	static VerificationResult interpret(LogicalForm form, SolverResponse response, String audit, long elapsedMs)
	{
		boolean validity = form.getGoal() == LogicalForm.Goal.VALIDITY;
		return switch (response.status())
		{
			// For validity the query is the negation: unsat means nothing contradicts the formula
			case UNSAT -> new VerificationResult(form.getName(), validity ? Verdict.VALID : Verdict.INVALID, null, audit, elapsedMs, null);
			case SAT -> new VerificationResult(form.getName(), validity ? Verdict.INVALID : Verdict.VALID, response.model(), audit, elapsedMs, null);
			case TIMEOUT -> new VerificationResult(form.getName(), Verdict.TIMED_OUT, null, audit, elapsedMs, response.reason());
			case UNKNOWN -> new VerificationResult(form.getName(), Verdict.UNKNOWN, null, audit, elapsedMs, response.reason());
		};
	}

	/**
	 * Translates and verifies each principle of {@code program} on its own. A principle that
	 * fails to translate is recorded and does not stop the others.
	 */
	public ProgramVerification verifyProgram(TypedProgram program, long timeoutMs)
	{
		QuantifierTranslator translator = new QuantifierTranslator(program);
		List<VerificationResult> results = new ArrayList<>();
		Map<String, SemanticError> failures = new LinkedHashMap<>();
		for (PrincipleDecl principle : program.getPrinciples())
		{
			LogicalForm form;
			try
			{
				form = translator.translate(principle);
			}
			catch (TranslationException e)
			{
				Debug.logError("[Translation Error] " + program.getName() + " " + e.getKind() + " - principle '"
						+ principle.name() + "' - " + e.getMessage());
				failures.put(principle.name(), e.toSemanticError());
				continue;
			}
			results.add(verify(form, timeoutMs));
		}
		return new ProgramVerification(program.getName(), results, failures);
	}

	/**
	 * Whether all requirements of {@code test} can hold together. {@link Verdict#VALID} means
	 * satisfiable, with a witness in the counterexample map.
	 */
	public VerificationResult checkLegalTestSatisfiable(LegalTestSymbol test, TypeEnvironment environment, long timeoutMs)
			throws TranslationException
	{
		return verify(new QuantifierTranslator(environment).translateLegalTest(test), timeoutMs);
	}

	private static long elapsedSince(long startNanos)
	{
		return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
	}

	@Override
	public void close()
	{
		executor.shutdownNow();
	}
}
