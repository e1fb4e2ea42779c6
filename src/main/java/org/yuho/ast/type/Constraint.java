package org.yuho.ast.type;

import org.yuho.ast.Span;
import org.yuho.ast.expr.Expr;

/**
 * A restriction on a field's own value, e.g. {@code money amount where > 0}.
 */
public sealed interface Constraint
{
	Span span();

	enum Comparator
	{
		GT(">"), LT("<"), GE(">="), LE("<="), EQ("=="), NE("!=");

		private final String symbol;

		Comparator(String symbol)
		{
			this.symbol = symbol;
		}

		public String getSymbol()
		{
			return symbol;
		}

		public static Comparator fromSymbol(String symbol)
		{
			for (Comparator c : values())
			{
				if (c.symbol.equals(symbol))
				{
					return c;
				}
			}
			throw new IllegalArgumentException("Unknown comparator: " + symbol);
		}
	}

	record Comparison(Comparator comparator, Expr value, Span span) implements Constraint
	{
	}

	record InRange(Expr min, Expr max, Span span) implements Constraint
	{
	}

	record And(Constraint left, Constraint right, Span span) implements Constraint
	{
	}

	record Or(Constraint left, Constraint right, Span span) implements Constraint
	{
	}

	record Not(Constraint inner, Span span) implements Constraint
	{
	}

	record Before(Expr date, Span span) implements Constraint
	{
	}

	record After(Expr date, Span span) implements Constraint
	{
	}

	record Between(Expr start, Expr end, Span span) implements Constraint
	{
	}

	/**
	 * An opaque named predicate; accepted as-is and never evaluated.
	 */
	record Custom(String name, Span span) implements Constraint
	{
	}
}
