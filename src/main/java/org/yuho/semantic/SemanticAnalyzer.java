package org.yuho.semantic;

import org.yuho.ast.Program;
import org.yuho.legal.LegalChecker;
import org.yuho.util.Debug;
import org.yuho.util.ErrorHandler;

/**
 * Front end of the core: type checking followed by the legal-logic checks, reporting into one
 * error list per program.
 */
public class SemanticAnalyzer
{
	private final TypeChecker typeChecker = new TypeChecker();

	public CheckResult analyze(Program program)
	{
		ErrorHandler errorHandler = new ErrorHandler(program.name());
		CheckResult typed = typeChecker.check(program, errorHandler);

		// --- PASS 4: Legal checks ---
		Debug.logDebug("PASS 4: Legal checks...");
		LegalChecker legalChecker = new LegalChecker(typed.getEnvironment(), errorHandler);
		legalChecker.check(program.items());

		if (errorHandler.hasErrors())
		{
			Debug.logError("Errors encountered during analysis of '" + program.name() + "'.");
		}
		else
		{
			Debug.logInfo("Analysis of '" + program.name() + "' completed successfully.");
		}
		return CheckResult.of(typed.getCheckedProgram(), errorHandler.getErrors());
	}
}
