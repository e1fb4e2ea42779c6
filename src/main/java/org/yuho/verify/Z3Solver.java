package org.yuho.verify;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import org.yuho.logic.LogicalForm;
import org.yuho.util.Debug;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * In-process Z3. Each check runs in its own {@link Context}, so checks on different threads never
 * share native state.
 */
public class Z3Solver implements SmtSolver
{
	@Override
	public String getName()
	{
		return "z3";
	}

	@Override
	public SolverResponse check(LogicalForm form, long timeoutMs) throws SolverException
	{
		String script = form.toQueryScript();
		Debug.logDebug("Z3 query for '" + form.getName() + "':\n" + script);
		try (Context ctx = new Context())
		{
			Solver solver = ctx.mkSolver();
			Params params = ctx.mkParams();
			params.add("timeout", (int) Math.min(Integer.MAX_VALUE, timeoutMs));
			solver.setParameters(params);

			BoolExpr[] assertions = ctx.parseSMTLIB2String(script, null, null, null, null);
			solver.add(assertions);

			Status status = solver.check();
			switch (status)
			{
				case UNSATISFIABLE:
					return SolverResponse.unsat();
				case SATISFIABLE:
					return SolverResponse.sat(readModel(solver.getModel()));
				default:
					String reason = solver.getReasonUnknown();
					if (isTimeout(reason))
					{
						return SolverResponse.timeout();
					}
					return SolverResponse.unknown(reason);
			}
		}
		catch (Z3Exception e)
		{
			throw new SolverException("Z3 rejected the query for '" + form.getName() + "': " + e.getMessage(), e);
		}
		catch (UnsatisfiedLinkError e)
		{
			throw new SolverException("Z3 native library could not be loaded: " + e.getMessage(), e);
		}
	}

	private static Map<String, String> readModel(Model model) throws SolverException
	{
		Map<String, String> values = new LinkedHashMap<>();
		for (FuncDecl<?> decl : model.getConstDecls())
		{
			Expr<?> value = model.getConstInterp(decl);
			String name = decl.getName().toString();
			values.put(unquote(name), value == null ? "?" : SmtModelParser.renderValue(value.toString()));
		}
		return values;
	}

	private static String unquote(String name)
	{
		return name.length() >= 2 && name.startsWith("|") && name.endsWith("|") ? name.substring(1, name.length() - 1) : name;
	}

	static boolean isTimeout(String reason)
	{
		if (reason == null)
		{
			return false;
		}
		String lower = reason.toLowerCase(Locale.ROOT);
		return lower.contains("timeout") || lower.contains("canceled") || lower.contains("cancelled");
	}
}
