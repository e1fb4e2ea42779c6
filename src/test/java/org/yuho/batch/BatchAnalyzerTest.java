package org.yuho.batch;

import org.junit.jupiter.api.Test;
import org.yuho.TestPrograms;
import org.yuho.ast.Program;
import org.yuho.conflict.ConflictReport;
import org.yuho.logic.LogicalForm;
import org.yuho.semantic.CheckResult;
import org.yuho.semantic.ErrorKind;
import org.yuho.semantic.TypedProgram;
import org.yuho.verify.ProgramVerification;
import org.yuho.verify.SmtSolver;
import org.yuho.verify.SolverResponse;
import org.yuho.verify.Verdict;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BatchAnalyzerTest
{
	/**
	 * Reports every validity query as proven.
	 */
	private static final SmtSolver PROVER = new SmtSolver()
	{
		@Override
		public String getName()
		{
			return "prover";
		}

		@Override
		public SolverResponse check(LogicalForm form, long timeoutMs)
		{
			return SolverResponse.unsat();
		}
	};

	@Test
	void resultsKeepInputOrder() throws InterruptedException
	{
		List<Program> programs = List.of(
				TestPrograms.load("statute_theft"),
				TestPrograms.program("bad", "{\"kind\":\"legalTest\",\"name\":\"Cheating\",\"requirements\":["
						+ "{\"name\":\"deception\",\"type\":\"bool\"},{\"name\":\"amount\",\"type\":\"int\"}]}"),
				TestPrograms.load("status_a"),
				TestPrograms.load("all_positive"));

		try (BatchAnalyzer batch = new BatchAnalyzer(3, PROVER, 1000))
		{
			List<CheckResult> results = batch.analyzeAll(programs);
			assertEquals(4, results.size());
			assertTrue(results.get(0).isSuccess(), () -> results.get(0).getErrors().toString());
			assertTrue(results.get(1).hasError(ErrorKind.NON_BOOLEAN_REQUIREMENT));
			assertTrue(results.get(2).isSuccess());
			assertEquals("all_positive", results.get(3).getCheckedProgram().getName());
		}
	}

	@Test
	void verifiesPassingPrograms() throws InterruptedException
	{
		try (BatchAnalyzer batch = new BatchAnalyzer(2, PROVER, 1000))
		{
			List<TypedProgram> typed = new ArrayList<>();
			for (CheckResult result : batch.analyzeAll(List.of(TestPrograms.load("all_positive"), TestPrograms.load("statute_theft"))))
			{
				typed.add(result.getTypedProgram().orElseThrow());
			}
			List<ProgramVerification> verifications = batch.verifyAll(typed);
			assertEquals(List.of("all_positive", "statute_theft"),
					List.of(verifications.get(0).programName(), verifications.get(1).programName()));
			assertEquals(2, verifications.get(0).results().size());
			assertTrue(verifications.get(0).allValid());
			assertEquals(Verdict.VALID, verifications.get(1).getResult("TheftNeedsIntent").orElseThrow().getVerdict());
		}
	}

	@Test
	void conflictsPerPair() throws InterruptedException
	{
		try (BatchAnalyzer batch = new BatchAnalyzer(4, PROVER, 1000))
		{
			List<ConflictReport> reports = batch.checkConflicts(List.of(
					TestPrograms.load("status_a"), TestPrograms.load("statute_theft"), TestPrograms.load("status_b")));
			assertEquals(1, reports.size());
			assertEquals("status_a", reports.get(0).fileA());
			assertEquals("status_b", reports.get(0).fileB());
			assertEquals(2, reports.get(0).getConflictCount());
		}
	}

	@Test
	void rejectsNonPositiveJobCount()
	{
		assertThrows(IllegalArgumentException.class, () -> new BatchAnalyzer(0, PROVER, 1000));
	}
}
