package org.yuho.verify;

/**
 * A backend failed to produce an answer: the solver could not be started, rejected its input or
 * crashed. The driver reports it as an {@link Verdict#UNKNOWN} verdict.
 */
public class SolverException extends Exception
{
	public SolverException(String message)
	{
		super(message);
	}

	public SolverException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
