package org.yuho.verify;

import org.yuho.logic.LogicalForm;
import org.yuho.logic.SExpr;
import org.yuho.util.Debug;
import org.yuho.util.ProcessUtils;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Any SMT-LIB 2 solver executable that reads a script from stdin, such as {@code z3 -in} or
 * {@code cvc5 --lang smt2}.
 */
public class ProcessSmtSolver implements SmtSolver
{
	private final List<String> command;

	public ProcessSmtSolver(List<String> command)
	{
		if (command == null || command.isEmpty())
		{
			throw new IllegalArgumentException("Solver command cannot be empty");
		}
		this.command = List.copyOf(command);
	}

	@Override
	public String getName()
	{
		return command.get(0);
	}

	@Override
	public SolverResponse check(LogicalForm form, long timeoutMs) throws SolverException
	{
		String script = buildScript(form);
		ProcessUtils.ProcessOutput output;
		try
		{
			output = ProcessUtils.executeWithInput(command, script, timeoutMs);
		}
		catch (IOException e)
		{
			throw new SolverException("Failed to run solver '" + String.join(" ", command) + "': " + e.getMessage(), e);
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			throw new SolverException("Interrupted while waiting for solver '" + getName() + "'", e);
		}

		if (output.timedOut())
		{
			Debug.logWarning("Solver '" + getName() + "' timed out after " + timeoutMs + " ms on '" + form.getName() + "'");
			return SolverResponse.timeout();
		}
		return parseOutput(output.stdout(), output.stderr());
	}

	static String buildScript(LogicalForm form)
	{
		return "(set-option :produce-models true)\n"
				+ "(set-logic ALL)\n"
				+ form.toQueryScript()
				+ "(check-sat)\n"
				+ "(get-info :reason-unknown)\n"
				+ "(get-model)\n"
				+ "(exit)\n";
	}

	/**
	 * The first answer line is the status; what follows it is the reason and the model. Errors
	 * printed after an {@code unsat} (there is no model to get) are ignored.
	 */
	static SolverResponse parseOutput(String stdout, String stderr) throws SolverException
	{
		List<SExpr> answers = SmtModelParser.parse(stdout);
		for (int i = 0; i < answers.size(); i++)
		{
			SExpr answer = answers.get(i);
			String text = answer.toString();
			switch (text)
			{
				case "unsat":
					return SolverResponse.unsat();
				case "sat":
					return SolverResponse.sat(modelAfter(answers, i));
				case "unknown":
					String reason = reasonAfter(answers, i);
					return Z3Solver.isTimeout(reason) ? SolverResponse.timeout() : SolverResponse.unknown(reason);
				default:
					if (text.startsWith("(error"))
					{
						throw new SolverException("Solver error: " + text);
					}
			}
		}
		throw new SolverException("Solver produced no answer" + (stderr == null || stderr.isBlank() ? "" : ": " + stderr.trim()));
	}

	private static Map<String, String> modelAfter(List<SExpr> answers, int statusIndex) throws SolverException
	{
		StringBuilder rest = new StringBuilder();
		for (int i = statusIndex + 1; i < answers.size(); i++)
		{
			rest.append(answers.get(i)).append('\n');
		}
		return SmtModelParser.parseModel(rest.toString());
	}

	private static String reasonAfter(List<SExpr> answers, int statusIndex)
	{
		for (int i = statusIndex + 1; i < answers.size(); i++)
		{
			if (answers.get(i) instanceof SExpr.SList list && list.getItems().size() == 2
					&& list.getItems().get(0).equals(SExpr.sym(":reason-unknown")))
			{
				return SExpr.unquote(list.getItems().get(1).toString()).replace("\"", "");
			}
		}
		return "unknown";
	}
}
