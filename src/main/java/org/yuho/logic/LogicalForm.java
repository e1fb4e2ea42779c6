package org.yuho.logic;

import java.util.ArrayList;
import java.util.List;

/**
 * Solver-independent form of one principle.
 * <p>
 * The outermost run of {@code forall} quantifiers is kept apart as {@link #getUniversals()} so the
 * driver can check validity with a single ground query: the universals become free constants and
 * {@code (not matrix)} is asserted. An unsatisfiable query means the principle is valid and a model
 * of it is a counterexample.
 */
public final class LogicalForm
{
	public enum Goal
	{
		/** The formula must hold for every assignment. */
		VALIDITY,
		/** Some assignment must make the formula true. */
		SATISFIABILITY
	}

	public record Constant(String name, String smtName, Sort sort)
	{
		public SExpr declaration()
		{
			return SExpr.call("declare-const", SExpr.name(smtName), sort.toSExpr());
		}
	}

	private final String name;
	private final Goal goal;
	private final List<SExpr> declarations;
	private final List<Constant> universals;
	private final List<Constant> freeConstants;
	private final SExpr matrix;
	private final List<String> warnings;

	public LogicalForm(String name, Goal goal, List<SExpr> declarations, List<Constant> universals,
					   List<Constant> freeConstants, SExpr matrix, List<String> warnings)
	{
		this.name = name;
		this.goal = goal;
		this.declarations = List.copyOf(declarations);
		this.universals = List.copyOf(universals);
		this.freeConstants = List.copyOf(freeConstants);
		this.matrix = matrix;
		this.warnings = List.copyOf(warnings);
	}

	public String getName()
	{
		return name;
	}

	public Goal getGoal()
	{
		return goal;
	}

	/**
	 * Sort, datatype and uninterpreted function declarations, in dependency order.
	 */
	public List<SExpr> getDeclarations()
	{
		return declarations;
	}

	public List<Constant> getUniversals()
	{
		return universals;
	}

	public List<Constant> getFreeConstants()
	{
		return freeConstants;
	}

	public SExpr getMatrix()
	{
		return matrix;
	}

	public List<String> getWarnings()
	{
		return warnings;
	}

	/**
	 * The closed formula with its universal prefix restored.
	 */
	public SExpr getFormula()
	{
		if (universals.isEmpty())
		{
			return matrix;
		}
		List<SExpr> binders = new ArrayList<>();
		for (Constant universal : universals)
		{
			binders.add(SExpr.list(SExpr.name(universal.smtName()), universal.sort().toSExpr()));
		}
		return SExpr.call("forall", SExpr.list(binders), matrix);
	}

	/**
	 * The assertion a solver checks: the negated matrix for validity, the formula itself for
	 * satisfiability.
	 */
	public SExpr getQuery()
	{
		return goal == Goal.VALIDITY ? SExpr.not(matrix) : matrix;
	}

	/**
	 * Declarations, constants and the query assertion, without solver commands.
	 */
	public String toQueryScript()
	{
		StringBuilder sb = new StringBuilder();
		appendDeclarations(sb);
		for (Constant universal : universals)
		{
			sb.append(universal.declaration()).append('\n');
		}
		sb.append(SExpr.call("assert", getQuery())).append('\n');
		return sb.toString();
	}

	/**
	 * The formula as SMT-LIB text, for audit.
	 */
	public String toSmtLib()
	{
		StringBuilder sb = new StringBuilder();
		sb.append("; ").append(goal == Goal.VALIDITY ? "principle " : "legal test ").append(name).append('\n');
		appendDeclarations(sb);
		sb.append(SExpr.call("assert", getFormula())).append('\n');
		return sb.toString();
	}

	private void appendDeclarations(StringBuilder sb)
	{
		for (SExpr declaration : declarations)
		{
			sb.append(declaration).append('\n');
		}
		for (Constant constant : freeConstants)
		{
			sb.append(constant.declaration()).append('\n');
		}
	}

	@Override
	public String toString()
	{
		return toSmtLib();
	}
}
