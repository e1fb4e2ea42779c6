package org.yuho.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CoreOptionsTest
{
	@AfterEach
	void resetDebug()
	{
		Debug.ENABLE_DEBUG = false;
	}

	@Test
	void defaults()
	{
		CoreOptions options = CoreOptions.parse(new String[0]);
		assertEquals(CoreOptions.DEFAULT_TIMEOUT_MS, options.getTimeoutMs());
		assertEquals(CoreOptions.SolverKind.Z3, options.getSolverKind());
		assertEquals(List.of("z3", "-in"), options.getSolverCommand());
		assertTrue(options.getJobs() >= 1);
		assertFalse(options.isVerbose());
		assertFalse(options.isHelp());
	}

	@Test
	void parsesAllOptions()
	{
		CoreOptions options = CoreOptions.parse(new String[] {
				"--timeout", "250", "-j", "3", "--solver", "process", "--solver-command", "cvc5 --lang smt2",
				"-v", "a.json", "b.json"
		});
		assertEquals(250, options.getTimeoutMs());
		assertEquals(3, options.getJobs());
		assertEquals(CoreOptions.SolverKind.PROCESS, options.getSolverKind());
		assertEquals(List.of("cvc5", "--lang", "smt2"), options.getSolverCommand());
		assertTrue(options.isVerbose());
		assertTrue(Debug.ENABLE_DEBUG);
		assertEquals(List.of("a.json", "b.json"), options.getInputFiles());
	}

	@Test
	void helpStopsParsing()
	{
		CoreOptions options = CoreOptions.parse(new String[] {"-h", "--bogus"});
		assertTrue(options.isHelp());
	}

	@ParameterizedTest
	@ValueSource(strings = {"0", "-5", "abc", "99999999999"})
	void rejectsBadTimeout(String value)
	{
		assertThrows(IllegalArgumentException.class, () -> CoreOptions.parse(new String[] {"--timeout", value}));
	}

	@Test
	void rejectsUnknownSolverAndOption()
	{
		assertThrows(IllegalArgumentException.class, () -> CoreOptions.parse(new String[] {"--solver", "yices"}));
		assertThrows(IllegalArgumentException.class, () -> CoreOptions.parse(new String[] {"--frobnicate"}));
		assertThrows(IllegalArgumentException.class, () -> CoreOptions.parse(new String[] {"--jobs"}));
	}
}
