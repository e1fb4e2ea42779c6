package org.yuho.batch;

import org.yuho.ast.Program;
import org.yuho.conflict.ConflictDetector;
import org.yuho.conflict.ConflictReport;
import org.yuho.semantic.CheckResult;
import org.yuho.semantic.SemanticAnalyzer;
import org.yuho.semantic.TypedProgram;
import org.yuho.util.CoreOptions;
import org.yuho.util.Debug;
import org.yuho.verify.ProgramVerification;
import org.yuho.verify.SmtSolver;
import org.yuho.verify.SolverFactory;
import org.yuho.verify.VerificationDriver;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs independent units of work on a fixed pool: one program's analysis, one pair's conflict
 * check, or one program's verification per task. Units share no mutable state; each analysis
 * builds its own type environment. Results come back in input order.
 */
public class BatchAnalyzer implements AutoCloseable
{
	private final ExecutorService pool;
	private final VerificationDriver driver;
	private final long timeoutMs;

	public BatchAnalyzer(CoreOptions options)
	{
		this(options.getJobs(), SolverFactory.create(options), options.getTimeoutMs());
	}

	public BatchAnalyzer(int jobs, SmtSolver solver, long timeoutMs)
	{
		if (jobs < 1)
		{
			throw new IllegalArgumentException("Job count must be at least 1, got " + jobs);
		}
		AtomicInteger counter = new AtomicInteger();
		this.pool = Executors.newFixedThreadPool(jobs, r ->
		{
			Thread thread = new Thread(r, "yuho-batch-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		});
		this.driver = new VerificationDriver(solver);
		this.timeoutMs = timeoutMs;
	}

	public List<CheckResult> analyzeAll(List<Program> programs) throws InterruptedException
	{
		Debug.logInfo("Analyzing " + programs.size() + " program(s)...");
		List<Callable<CheckResult>> tasks = new ArrayList<>();
		for (Program program : programs)
		{
			tasks.add(() -> new SemanticAnalyzer().analyze(program));
		}
		return runAll(tasks);
	}

	/**
	 * Conflict reports for every unordered pair that has conflicts, in pair order.
	 */
	public List<ConflictReport> checkConflicts(List<Program> programs) throws InterruptedException
	{
		ConflictDetector detector = new ConflictDetector();
		List<Callable<Optional<ConflictReport>>> tasks = new ArrayList<>();
		for (int i = 0; i < programs.size(); i++)
		{
			for (int j = i + 1; j < programs.size(); j++)
			{
				Program a = programs.get(i);
				Program b = programs.get(j);
				tasks.add(() -> detector.checkConflict(a, b));
			}
		}
		List<ConflictReport> reports = new ArrayList<>();
		for (Optional<ConflictReport> report : runAll(tasks))
		{
			report.ifPresent(reports::add);
		}
		return reports;
	}

	public List<ProgramVerification> verifyAll(List<TypedProgram> programs) throws InterruptedException
	{
		List<Callable<ProgramVerification>> tasks = new ArrayList<>();
		for (TypedProgram program : programs)
		{
			tasks.add(() -> driver.verifyProgram(program, timeoutMs));
		}
		return runAll(tasks);
	}

	private <T> List<T> runAll(List<Callable<T>> tasks) throws InterruptedException
	{
		List<Future<T>> futures = new ArrayList<>();
		for (Callable<T> task : tasks)
		{
			futures.add(pool.submit(task));
		}
		List<T> results = new ArrayList<>();
		try
		{
			for (Future<T> future : futures)
			{
				results.add(future.get());
			}
		}
		catch (ExecutionException e)
		{
			cancel(futures);
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException runtime)
			{
				throw runtime;
			}
			if (cause instanceof Error error)
			{
				throw error;
			}
			throw new IllegalStateException("Batch unit failed: " + cause, cause);
		}
		catch (InterruptedException e)
		{
			cancel(futures);
			throw e;
		}
		return results;
	}

	private static <T> void cancel(List<Future<T>> futures)
	{
		for (Future<T> future : futures)
		{
			future.cancel(true);
		}
	}

	/**
	 * Abandons units that have not started. Running solver calls end at their own timeout.
	 */
	@Override
	public void close()
	{
		pool.shutdownNow();
		driver.close();
	}
}
