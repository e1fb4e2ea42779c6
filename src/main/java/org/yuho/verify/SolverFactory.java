package org.yuho.verify;

import org.yuho.util.CoreOptions;

public final class SolverFactory
{
	private SolverFactory()
	{
	}

	public static SmtSolver create(CoreOptions options)
	{
		return switch (options.getSolverKind())
		{
			case Z3 -> new Z3Solver();
			case PROCESS -> new ProcessSmtSolver(options.getSolverCommand());
		};
	}
}
