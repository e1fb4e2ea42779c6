package org.yuho.semantic;

import org.yuho.ast.expr.Expr;
import org.yuho.ast.type.Constraint;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Folds literal expressions at check time so constraints and refinement bounds can be
 * verified against constants. Anything that is not a constant is left alone.
 */
public final class ConstantEvaluator
{
	/**
	 * A folded constant. Exactly one of the payload fields is meaningful, selected by {@code kind}.
	 */
	public record Value(Expr.LiteralKind kind, BigDecimal number, boolean bool, String text, LocalDate date)
	{
		static Value number(Expr.LiteralKind kind, BigDecimal number)
		{
			return new Value(kind, number, false, null, null);
		}

		public boolean isNumeric()
		{
			return number != null;
		}

		public String render()
		{
			return switch (kind)
			{
				case BOOL -> Boolean.toString(bool);
				case DATE -> date.toString();
				case STRING, DURATION, PASS -> text;
				default -> number.toPlainString();
			};
		}
	}

	private ConstantEvaluator()
	{
	}

	public static Optional<Value> evaluate(Expr expr)
	{
		if (expr instanceof Expr.Literal literal)
		{
			return literal(literal);
		}
		if (expr instanceof Expr.Unary unary)
		{
			Optional<Value> inner = evaluate(unary.operand());
			if (inner.isEmpty())
			{
				return Optional.empty();
			}
			Value value = inner.get();
			if (unary.op() == Expr.UnaryOp.NEG && value.isNumeric())
			{
				return Optional.of(Value.number(value.kind(), value.number().negate()));
			}
			if (unary.op() == Expr.UnaryOp.NOT && value.kind() == Expr.LiteralKind.BOOL)
			{
				return Optional.of(new Value(Expr.LiteralKind.BOOL, null, !value.bool(), null, null));
			}
			return Optional.empty();
		}
		if (expr instanceof Expr.Binary binary && binary.op().isArithmetic())
		{
			Optional<Value> left = evaluate(binary.left());
			Optional<Value> right = evaluate(binary.right());
			if (left.isEmpty() || right.isEmpty())
			{
				return Optional.empty();
			}
			return arithmetic(binary.op(), left.get(), right.get());
		}
		return Optional.empty();
	}

	private static Optional<Value> literal(Expr.Literal literal)
	{
		try
		{
			return switch (literal.kind())
			{
				case INT, FLOAT, MONEY, PERCENT -> Optional.of(Value.number(literal.kind(), new BigDecimal(literal.text().trim())));
				case BOOL -> Optional.of(new Value(Expr.LiteralKind.BOOL, null, Boolean.parseBoolean(literal.text().trim()), null, null));
				case STRING, DURATION, PASS -> Optional.of(new Value(literal.kind(), null, false, literal.text(), null));
				case DATE -> DateParser.parse(literal.text()).map(d -> new Value(Expr.LiteralKind.DATE, null, false, null, d));
			};
		}
		catch (NumberFormatException e)
		{
			return Optional.empty();
		}
	}

	private static Optional<Value> arithmetic(Expr.BinaryOp op, Value left, Value right)
	{
		if (!left.isNumeric() || !right.isNumeric() || left.kind() != right.kind())
		{
			return Optional.empty();
		}
		BigDecimal l = left.number();
		BigDecimal r = right.number();
		boolean integral = left.kind() == Expr.LiteralKind.INT;
		BigDecimal result;
		switch (op)
		{
			case ADD -> result = l.add(r);
			case SUB -> result = l.subtract(r);
			case MUL -> result = l.multiply(r);
			case DIV ->
			{
				if (r.signum() == 0)
				{
					return Optional.empty();
				}
				result = integral ? new BigDecimal(l.toBigInteger().divide(r.toBigInteger())) : l.divide(r, MathContext.DECIMAL64);
			}
			case MOD ->
			{
				if (r.signum() == 0 || !integral)
				{
					return Optional.empty();
				}
				result = new BigDecimal(l.toBigInteger().remainder(r.toBigInteger()));
			}
			default ->
			{
				return Optional.empty();
			}
		}
		return Optional.of(Value.number(left.kind(), result));
	}

	/**
	 * Orders two constants of comparable kinds. Numeric kinds compare with each other.
	 */
	public static Optional<Integer> compare(Value left, Value right)
	{
		if (left.isNumeric() && right.isNumeric())
		{
			return Optional.of(left.number().compareTo(right.number()));
		}
		if (left.kind() != right.kind())
		{
			return Optional.empty();
		}
		return switch (left.kind())
		{
			case DATE -> Optional.of(left.date().compareTo(right.date()));
			case BOOL -> Optional.of(Boolean.compare(left.bool(), right.bool()));
			case STRING -> Optional.of(left.text().compareTo(right.text()));
			default -> Optional.empty();
		};
	}

	/**
	 * True unless {@code value} provably violates {@code constraint}. Bounds that are not
	 * constants, and custom predicates, count as satisfied.
	 */
	public static boolean satisfies(Constraint constraint, Value value)
	{
		if (constraint instanceof Constraint.Comparison comparison)
		{
			Optional<Integer> cmp = compareTo(value, comparison.value());
			if (cmp.isEmpty())
			{
				return true;
			}
			int c = cmp.get();
			return switch (comparison.comparator())
			{
				case GT -> c > 0;
				case LT -> c < 0;
				case GE -> c >= 0;
				case LE -> c <= 0;
				case EQ -> c == 0;
				case NE -> c != 0;
			};
		}
		if (constraint instanceof Constraint.InRange range)
		{
			return within(value, range.min(), range.max());
		}
		if (constraint instanceof Constraint.Between between)
		{
			return within(value, between.start(), between.end());
		}
		if (constraint instanceof Constraint.Before before)
		{
			return compareTo(value, before.date()).map(c -> c < 0).orElse(true);
		}
		if (constraint instanceof Constraint.After after)
		{
			return compareTo(value, after.date()).map(c -> c > 0).orElse(true);
		}
		if (constraint instanceof Constraint.And and)
		{
			return satisfies(and.left(), value) && satisfies(and.right(), value);
		}
		if (constraint instanceof Constraint.Or or)
		{
			return satisfies(or.left(), value) || satisfies(or.right(), value);
		}
		if (constraint instanceof Constraint.Not not)
		{
			return !satisfies(not.inner(), value);
		}
		return true;
	}

	private static boolean within(Value value, Expr min, Expr max)
	{
		Optional<Integer> low = compareTo(value, min);
		Optional<Integer> high = compareTo(value, max);
		if (low.isEmpty() || high.isEmpty())
		{
			return true;
		}
		return low.get() >= 0 && high.get() <= 0;
	}

	private static Optional<Integer> compareTo(Value value, Expr bound)
	{
		return evaluate(bound).flatMap(b -> compare(value, b));
	}
}
