package org.yuho.ast.stmt;

import org.yuho.ast.Span;
import org.yuho.ast.decl.VariableDecl;
import org.yuho.ast.expr.Arm;
import org.yuho.ast.expr.Expr;
import org.yuho.ast.expr.Pattern;

import java.util.List;

public sealed interface Stmt
{
	Span span();

	<R> R accept(Visitor<R> visitor);

	interface Visitor<R>
	{
		R visitDeclare(Declare stmt);

		R visitAssignment(Assignment stmt);

		R visitReturn(Return stmt);

		R visitMatch(Match stmt);

		R visitIf(If stmt);

		R visitPass(Pass stmt);
	}

	record Declare(VariableDecl declaration) implements Stmt
	{
		public Span span()
		{
			return declaration.span();
		}

		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitDeclare(this);
		}
	}

	record Assignment(String target, Expr value, Span span) implements Stmt
	{
		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitAssignment(this);
		}
	}

	/**
	 * {@code return value}; value is null for a bare return.
	 */
	record Return(Expr value, Span span) implements Stmt
	{
		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitReturn(this);
		}
	}

	record MatchCase(Pattern pattern, Expr guard, List<Stmt> body, Span span) implements Arm
	{
		public MatchCase
		{
			body = List.copyOf(body);
		}
	}

	record Match(Expr scrutinee, List<MatchCase> cases, Span span) implements Stmt
	{
		public Match
		{
			cases = List.copyOf(cases);
		}

		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitMatch(this);
		}
	}

	/**
	 * {@code elseBranch} is null when there is no else.
	 */
	record If(Expr condition, List<Stmt> thenBranch, List<Stmt> elseBranch, Span span) implements Stmt
	{
		public If
		{
			thenBranch = List.copyOf(thenBranch);
			elseBranch = elseBranch == null ? null : List.copyOf(elseBranch);
		}

		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitIf(this);
		}
	}

	record Pass(Span span) implements Stmt
	{
		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitPass(this);
		}
	}
}
