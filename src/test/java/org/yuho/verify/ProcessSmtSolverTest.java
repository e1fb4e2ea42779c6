package org.yuho.verify;

import org.junit.jupiter.api.Test;
import org.yuho.TestPrograms;
import org.yuho.logic.LogicalForm;
import org.yuho.logic.QuantifierTranslator;
import org.yuho.semantic.TypeChecker;
import org.yuho.semantic.TypedProgram;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProcessSmtSolverTest
{
	@Test
	void scriptWrapsQueryInSolverCommands() throws Exception
	{
		TypedProgram program = new TypeChecker().check(TestPrograms.load("all_positive")).getTypedProgram().orElseThrow();
		LogicalForm form = new QuantifierTranslator(program).translate(program.findPrinciple("AllPositive").orElseThrow());
		String script = ProcessSmtSolver.buildScript(form);
		assertTrue(script.startsWith("(set-option :produce-models true)\n(set-logic ALL)\n"));
		int assertion = script.indexOf("(assert (not (> x 0)))");
		int checkSat = script.indexOf("(check-sat)");
		assertTrue(assertion > 0 && checkSat > assertion, script);
		assertTrue(script.endsWith("(get-model)\n(exit)\n"));
	}

	@Test
	void parsesSatWithModel() throws SolverException
	{
		String stdout = "sat\n(:reason-unknown \"\")\n(\n  (define-fun x () Int\n    (- 1))\n)\n";
		SolverResponse response = ProcessSmtSolver.parseOutput(stdout, "");
		assertEquals(SolverResponse.Status.SAT, response.status());
		assertEquals(Map.of("x", "-1"), response.model());
	}

	@Test
	void parsesUnsatIgnoringModelError() throws SolverException
	{
		String stdout = "unsat\n(:reason-unknown \"\")\n(error \"line 5 column 10: model is not available\")\n";
		assertEquals(SolverResponse.Status.UNSAT, ProcessSmtSolver.parseOutput(stdout, "").status());
	}

	@Test
	void parsesUnknownReason() throws SolverException
	{
		SolverResponse response = ProcessSmtSolver.parseOutput("unknown\n(:reason-unknown \"incomplete\")\n", "");
		assertEquals(SolverResponse.Status.UNKNOWN, response.status());
		assertEquals("incomplete", response.reason());

		SolverResponse timeout = ProcessSmtSolver.parseOutput("unknown\n(:reason-unknown \"timeout\")\n", "");
		assertEquals(SolverResponse.Status.TIMEOUT, timeout.status());
	}

	@Test
	void errorBeforeAnswerFails()
	{
		SolverException e = assertThrows(SolverException.class,
				() -> ProcessSmtSolver.parseOutput("(error \"unknown constant y\")\nsat\n", ""));
		assertTrue(e.getMessage().contains("unknown constant y"));
		assertThrows(SolverException.class, () -> ProcessSmtSolver.parseOutput("", "segfault"));
	}

	@Test
	void missingExecutableIsSolverException() throws Exception
	{
		TypedProgram program = new TypeChecker().check(TestPrograms.load("all_positive")).getTypedProgram().orElseThrow();
		LogicalForm form = new QuantifierTranslator(program).translate(program.findPrinciple("AllPositive").orElseThrow());
		ProcessSmtSolver solver = new ProcessSmtSolver(List.of("yuho-no-such-solver-binary"));
		assertThrows(SolverException.class, () -> solver.check(form, 1000));
	}

	@Test
	void emptyCommandIsRejected()
	{
		assertThrows(IllegalArgumentException.class, () -> new ProcessSmtSolver(List.of()));
	}
}
