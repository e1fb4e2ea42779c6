package org.yuho.verify;

import org.yuho.logic.LogicalForm;

/**
 * An SMT backend. Implementations must honor {@code timeoutMs} themselves where they can; the
 * driver enforces it from the outside as well.
 */
public interface SmtSolver
{
	String getName();

	/**
	 * Checks {@link LogicalForm#getQuery()} together with the form's declarations.
	 */
	SolverResponse check(LogicalForm form, long timeoutMs) throws SolverException;
}
