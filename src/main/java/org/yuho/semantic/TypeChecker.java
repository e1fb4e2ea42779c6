package org.yuho.semantic;

import org.yuho.ast.Program;
import org.yuho.util.Debug;
import org.yuho.util.ErrorHandler;

/**
 * Entry point of the type checker. Every call builds a fresh {@link TypeEnvironment} and scope
 * stack, so a checker instance holds no state between programs and may be shared across threads.
 */
public class TypeChecker
{
	public CheckResult check(Program program)
	{
		return check(program, new ErrorHandler(program.name()));
	}

	/**
	 * Runs all passes over {@code program}, reporting into {@code errorHandler}. Errors from one
	 * pass do not stop the next one; the error type keeps cascades quiet.
	 */
	public CheckResult check(Program program, ErrorHandler errorHandler)
	{
		Debug.logDebug("Starting semantic analysis of '" + program.name() + "' (" + program.items().size() + " item(s))...");
		TypeEnvironment environment = new TypeEnvironment();
		TypeResolver resolver = new TypeResolver(environment, errorHandler);

		// --- PASS 1: Discovery ---
		Debug.logDebug("PASS 1: Discovering declarations...");
		SymbolTableBuilder builder = new SymbolTableBuilder(environment, errorHandler, resolver);
		builder.discover(program.items());

		// --- PASS 2: Define members ---
		Debug.logDebug("PASS 2: Defining members...");
		builder.defineMembers();

		// --- PASS 3: Type checking ---
		Debug.logDebug("PASS 3: Type checking...");
		TypeCheckVisitor typeChecker = new TypeCheckVisitor(environment, errorHandler, resolver);
		typeChecker.check(program.items());

		TypedProgram typed = new TypedProgram(program, environment, typeChecker.getResolvedTypes(),
				builder.getPrinciples(), errorHandler.getWarnings());
		if (errorHandler.hasErrors())
		{
			Debug.logError("Type checking of '" + program.name() + "' found " + errorHandler.getErrors().size() + " error(s).");
		}
		else
		{
			Debug.logDebug("Type checking of '" + program.name() + "' completed successfully.");
		}
		return CheckResult.of(typed, errorHandler.getErrors());
	}
}
