package org.yuho.verify;

import org.junit.jupiter.api.Test;
import org.yuho.TestPrograms;
import org.yuho.ast.Program;
import org.yuho.logic.LogicalForm;
import org.yuho.logic.QuantifierTranslator;
import org.yuho.logic.TranslationException;
import org.yuho.semantic.CheckResult;
import org.yuho.semantic.ErrorKind;
import org.yuho.semantic.TypeChecker;
import org.yuho.semantic.TypedProgram;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VerificationDriverTest
{
	private static final String ELEVEN_DEEP = "{\"kind\":\"principle\",\"name\":\"P\",\"body\":"
			+ nest(List.of("x", "y", "z", "a", "b", "c", "d", "e", "f", "g", "h"),
			"{\"kind\":\"binary\",\"op\":\"<\",\"left\":{\"kind\":\"ident\",\"name\":\"x\"},\"right\":{\"kind\":\"ident\",\"name\":\"h\"}}")
			+ "}";

	private static String nest(List<String> variables, String body)
	{
		String result = body;
		for (int i = variables.size() - 1; i >= 0; i--)
		{
			result = "{\"kind\":\"forall\",\"var\":\"" + variables.get(i) + "\",\"type\":\"int\",\"body\":" + result + "}";
		}
		return result;
	}

	private static TypedProgram typed(Program program)
	{
		CheckResult result = new TypeChecker().check(program);
		assertTrue(result.isSuccess(), () -> result.getErrors().toString());
		return result.getTypedProgram().orElseThrow();
	}

	private static LogicalForm allPositive() throws TranslationException
	{
		TypedProgram program = typed(TestPrograms.load("all_positive"));
		return new QuantifierTranslator(program).translate(program.findPrinciple("AllPositive").orElseThrow());
	}

	@Test
	void depthOverflowNeverReachesTheSolver()
	{
		StubSolver solver = StubSolver.always(SolverResponse.unsat());
		try (VerificationDriver driver = new VerificationDriver(solver))
		{
			ProgramVerification verification = driver.verifyProgram(typed(TestPrograms.program("deep", ELEVEN_DEEP)), 5000);
			assertTrue(verification.results().isEmpty());
			assertEquals(ErrorKind.QUANTIFIER_DEPTH_EXCEEDED, verification.translationErrors().get("P").kind());
			assertFalse(verification.allValid());
		}
		assertEquals(0, solver.getCalls());
	}

	@Test
	void satisfiableNegationIsInvalidWithCounterexample() throws TranslationException
	{
		StubSolver solver = StubSolver.always(SolverResponse.sat(Map.of("x", "0")));
		try (VerificationDriver driver = new VerificationDriver(solver))
		{
			VerificationResult result = driver.verify(allPositive(), 5000);
			assertEquals(Verdict.INVALID, result.getVerdict());
			assertFalse(result.isValid());
			assertEquals(Map.of("x", "0"), result.getCounterexample());
			assertEquals("AllPositive", result.getPrincipleName());
			assertTrue(result.getLogicalForm().contains("(forall ((x Int)) (> x 0))"));
		}
		assertEquals(List.of("(not (> x 0))"), solver.getQueries());
	}

	@Test
	void unsatisfiableNegationIsValid() throws TranslationException
	{
		try (VerificationDriver driver = new VerificationDriver(StubSolver.always(SolverResponse.unsat())))
		{
			VerificationResult result = driver.verify(allPositive(), 5000);
			assertEquals(Verdict.VALID, result.getVerdict());
			assertTrue(result.getCounterexample().isEmpty());
		}
	}

	@Test
	void unknownIsNotInvalid() throws TranslationException
	{
		try (VerificationDriver driver = new VerificationDriver(StubSolver.always(SolverResponse.unknown("incomplete quantifiers"))))
		{
			VerificationResult result = driver.verify(allPositive(), 5000);
			assertEquals(Verdict.UNKNOWN, result.getVerdict());
			assertEquals("incomplete quantifiers", result.getReason().orElseThrow());
		}
	}

	@Test
	void backendTimeoutIsTimedOut() throws TranslationException
	{
		try (VerificationDriver driver = new VerificationDriver(StubSolver.always(SolverResponse.timeout())))
		{
			assertEquals(Verdict.TIMED_OUT, driver.verify(allPositive(), 5000).getVerdict());
		}
	}

	@Test
	void hangingSolverIsCutOff() throws TranslationException
	{
		StubSolver slow = new StubSolver((form, timeoutMs) ->
		{
			try
			{
				Thread.sleep(60_000);
			}
			catch (InterruptedException e)
			{
				Thread.currentThread().interrupt();
				throw new SolverException("interrupted", e);
			}
			return SolverResponse.unsat();
		});
		try (VerificationDriver driver = new VerificationDriver(slow))
		{
			long start = System.nanoTime();
			VerificationResult result = driver.verify(allPositive(), 100);
			long waitedMs = (System.nanoTime() - start) / 1_000_000;
			assertEquals(Verdict.TIMED_OUT, result.getVerdict());
			assertTrue(waitedMs < 100 + VerificationDriver.GRACE_MS + 2000, "waited " + waitedMs + " ms");
		}
		assertEquals(1, slow.getCalls());
	}

	@Test
	void solverFailureIsUnknown() throws TranslationException
	{
		StubSolver broken = new StubSolver((form, timeoutMs) ->
		{
			throw new SolverException("solver crashed");
		});
		try (VerificationDriver driver = new VerificationDriver(broken))
		{
			VerificationResult result = driver.verify(allPositive(), 5000);
			assertEquals(Verdict.UNKNOWN, result.getVerdict());
			assertEquals("solver crashed", result.getReason().orElseThrow());
		}
	}

	@Test
	void timeoutMustBePositive() throws TranslationException
	{
		LogicalForm form = allPositive();
		try (VerificationDriver driver = new VerificationDriver(StubSolver.always(SolverResponse.unsat())))
		{
			assertThrows(IllegalArgumentException.class, () -> driver.verify(form, 0));
		}
	}

	@Test
	void everyPrincipleIsVerifiedIndependently()
	{
		Program program = TestPrograms.program("mixed", ELEVEN_DEEP,
				"{\"kind\":\"principle\",\"name\":\"Trivial\",\"body\":{\"kind\":\"forall\",\"var\":\"q\",\"type\":\"bool\","
						+ "\"body\":{\"kind\":\"binary\",\"op\":\"||\",\"left\":{\"kind\":\"ident\",\"name\":\"q\"},"
						+ "\"right\":{\"kind\":\"unary\",\"op\":\"!\",\"operand\":{\"kind\":\"ident\",\"name\":\"q\"}}}}}");
		StubSolver solver = StubSolver.always(SolverResponse.unsat());
		try (VerificationDriver driver = new VerificationDriver(solver))
		{
			ProgramVerification verification = driver.verifyProgram(typed(program), 5000);
			assertEquals(1, verification.results().size());
			assertEquals(Verdict.VALID, verification.getResult("Trivial").orElseThrow().getVerdict());
			assertTrue(verification.getResult("P").isEmpty());
			assertTrue(verification.translationErrors().containsKey("P"));
		}
		assertEquals(1, solver.getCalls());
	}

	@Test
	void oversizedDurationFailsOnlyItsOwnPrinciple()
	{
		String big = "{\"kind\":\"principle\",\"name\":\"Big\",\"body\":{\"kind\":\"forall\",\"var\":\"d\",\"type\":\"duration\","
				+ "\"body\":{\"kind\":\"binary\",\"op\":\">=\",\"left\":{\"kind\":\"ident\",\"name\":\"d\"},"
				+ "\"right\":{\"kind\":\"duration\",\"value\":\"99999999999999999999 days\"}}}}";
		String ok = "{\"kind\":\"principle\",\"name\":\"Ok\",\"body\":{\"kind\":\"forall\",\"var\":\"n\",\"type\":\"int\","
				+ "\"body\":{\"kind\":\"binary\",\"op\":\">=\",\"left\":{\"kind\":\"ident\",\"name\":\"n\"},"
				+ "\"right\":{\"kind\":\"ident\",\"name\":\"n\"}}}}";
		StubSolver solver = StubSolver.always(SolverResponse.unsat());
		try (VerificationDriver driver = new VerificationDriver(solver))
		{
			ProgramVerification verification = driver.verifyProgram(typed(TestPrograms.program("durations", big, ok)), 5000);
			assertEquals(ErrorKind.UNSUPPORTED_EXPRESSION, verification.translationErrors().get("Big").kind());
			assertEquals(1, verification.results().size());
			assertEquals("Ok", verification.results().get(0).getPrincipleName());
			assertEquals(Verdict.VALID, verification.results().get(0).getVerdict());
		}
		assertEquals(1, solver.getCalls());
	}

	@Test
	void satisfiableLegalTestIsValid() throws TranslationException
	{
		TypedProgram program = typed(TestPrograms.load("statute_theft"));
		StubSolver solver = StubSolver.always(SolverResponse.sat(Map.of("dishonest_intent", "true", "moved", "true",
				"without_consent", "true")));
		try (VerificationDriver driver = new VerificationDriver(solver))
		{
			VerificationResult result = driver.checkLegalTestSatisfiable(
					program.getEnvironment().getLegalTest("TheftTest").orElseThrow(), program.getEnvironment(), 5000);
			assertEquals(Verdict.VALID, result.getVerdict());
			assertEquals(3, result.getCounterexample().size());
		}
		assertEquals(List.of("(and dishonest_intent moved without_consent)"), solver.getQueries());
	}
}
