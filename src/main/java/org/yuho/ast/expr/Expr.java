package org.yuho.ast.expr;

import org.yuho.ast.Span;
import org.yuho.ast.type.TypeRef;

import java.util.List;

public sealed interface Expr
{
	Span span();

	<R> R accept(Visitor<R> visitor);

	interface Visitor<R>
	{
		R visitLiteral(Literal expr);

		R visitIdentifier(Identifier expr);

		R visitBinary(Binary expr);

		R visitUnary(Unary expr);

		R visitCall(Call expr);

		R visitFieldAccess(FieldAccess expr);

		R visitStructInit(StructInit expr);

		R visitMatch(Match expr);

		R visitQuantified(Quantified expr);
	}

	enum LiteralKind
	{
		INT, FLOAT, BOOL, STRING, MONEY, PERCENT, DATE, DURATION, PASS
	}

	enum BinaryOp
	{
		ADD("+"), SUB("-"), MUL("*"), DIV("/"), MOD("%"),
		EQ("=="), NE("!="), LT("<"), GT(">"), LE("<="), GE(">="),
		AND("&&"), OR("||");

		private final String symbol;

		BinaryOp(String symbol)
		{
			this.symbol = symbol;
		}

		public String getSymbol()
		{
			return symbol;
		}

		public boolean isArithmetic()
		{
			return this == ADD || this == SUB || this == MUL || this == DIV || this == MOD;
		}

		public boolean isComparison()
		{
			return this == EQ || this == NE || this == LT || this == GT || this == LE || this == GE;
		}

		public boolean isLogical()
		{
			return this == AND || this == OR;
		}

		public static BinaryOp fromSymbol(String symbol)
		{
			for (BinaryOp op : values())
			{
				if (op.symbol.equals(symbol))
				{
					return op;
				}
			}
			throw new IllegalArgumentException("Unknown binary operator: " + symbol);
		}
	}

	enum UnaryOp
	{
		NOT, NEG
	}

	enum QuantifierKind
	{
		FORALL, EXISTS
	}

	/**
	 * A literal kept in its source spelling. Money is the bare amount ({@code "1500.00"}), percent
	 * the number without the sign, dates as written, durations like {@code "2 years"}.
	 */
	record Literal(LiteralKind kind, String text, Span span) implements Expr
	{
		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitLiteral(this);
		}
	}

	record Identifier(String name, Span span) implements Expr
	{
		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitIdentifier(this);
		}
	}

	record Binary(BinaryOp op, Expr left, Expr right, Span span) implements Expr
	{
		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitBinary(this);
		}
	}

	record Unary(UnaryOp op, Expr operand, Span span) implements Expr
	{
		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitUnary(this);
		}
	}

	record Call(String function, List<Expr> arguments, Span span) implements Expr
	{
		public Call
		{
			arguments = List.copyOf(arguments);
		}

		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitCall(this);
		}
	}

	/**
	 * {@code target.field}. Also how {@code Enum.Variant} arrives from the parser.
	 */
	record FieldAccess(Expr target, String field, Span span) implements Expr
	{
		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitFieldAccess(this);
		}
	}

	record FieldInit(String name, Expr value, Span span)
	{
	}

	record StructInit(String typeName, List<FieldInit> fields, Span span) implements Expr
	{
		public StructInit
		{
			fields = List.copyOf(fields);
		}

		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitStructInit(this);
		}
	}

	record MatchArm(Pattern pattern, Expr guard, Expr consequence, Span span) implements Arm
	{
	}

	record Match(Expr scrutinee, List<MatchArm> arms, Span span) implements Expr
	{
		public Match
		{
			arms = List.copyOf(arms);
		}

		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitMatch(this);
		}
	}

	record Quantified(QuantifierKind kind, String variable, TypeRef variableType, Expr body, Span span) implements Expr
	{
		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitQuantified(this);
		}
	}
}
