package org.yuho.logic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * An SMT-LIB 2 term: a symbol or a parenthesized list. {@link #toString()} renders solver input.
 */
public abstract class SExpr
{
	private static final Pattern SIMPLE_SYMBOL = Pattern.compile("[A-Za-z_~!@$%^&*+=<>?/-][A-Za-z0-9_~!@$%^&*+=<>?/-]*");
	private static final Pattern NUMERAL = Pattern.compile("-?[0-9]+(\\.[0-9]+)?");

	// Reserved words plus the core, arithmetic and string theory symbols the translator emits.
	private static final Set<String> RESERVED = Set.of(
			"par", "_", "!", "as", "let", "exists", "forall", "match", "NUMERAL", "DECIMAL", "STRING",
			"true", "false", "not", "=>", "and", "or", "xor", "=", "distinct", "ite",
			"+", "-", "*", "/", "div", "mod", "abs", "<", "<=", ">", ">=", "to_real", "to_int", "is_int");

	public static SExpr sym(String name)
	{
		return new Symbol(name);
	}

	/**
	 * A user-supplied name, quoted with {@code |...|} when it is not a plain SMT-LIB symbol.
	 */
	public static SExpr name(String name)
	{
		return new Symbol(quote(name));
	}

	/**
	 * True for names that mean something to the solver on their own and must not be declared.
	 */
	public static boolean isReserved(String name)
	{
		return RESERVED.contains(name);
	}

	public static String quote(String name)
	{
		if (SIMPLE_SYMBOL.matcher(name).matches() && !NUMERAL.matcher(name).matches() && !isReserved(name))
		{
			return name;
		}
		return "|" + name.replace("|", "") + "|";
	}

	public static String unquote(String symbol)
	{
		if (symbol.length() >= 2 && symbol.startsWith("|") && symbol.endsWith("|"))
		{
			return symbol.substring(1, symbol.length() - 1);
		}
		return symbol;
	}

	public static SExpr num(long value)
	{
		return value < 0 ? call("-", new Symbol(String.valueOf(-value))) : new Symbol(String.valueOf(value));
	}

	public static SExpr str(String text)
	{
		return new Symbol("\"" + text.replace("\"", "\"\"") + "\"");
	}

	public static SExpr list(List<SExpr> items)
	{
		return new SList(items);
	}

	public static SExpr list(SExpr... items)
	{
		return new SList(Arrays.asList(items));
	}

	public static SExpr call(String function, SExpr... args)
	{
		return call(function, Arrays.asList(args));
	}

	public static SExpr call(String function, List<SExpr> args)
	{
		List<SExpr> items = new ArrayList<>();
		items.add(new Symbol(function));
		items.addAll(args);
		return new SList(items);
	}

	public static SExpr and(List<SExpr> args)
	{
		if (args.size() > 1)
		{
			return call("and", args);
		}
		else if (args.size() == 1)
		{
			return args.get(0);
		}
		return new Symbol("true");
	}

	public static SExpr not(SExpr arg)
	{
		return call("not", arg);
	}

	public static SExpr implies(SExpr premise, SExpr conclusion)
	{
		return call("=>", premise, conclusion);
	}

	public abstract <T> T accept(Visitor<T> visitor);

	public static final class Symbol extends SExpr
	{
		private final String name;

		public Symbol(String name)
		{
			this.name = name;
		}

		public String getName()
		{
			return name;
		}

		@Override
		public <T> T accept(Visitor<T> visitor)
		{
			return visitor.visit(this);
		}

		@Override
		public boolean equals(Object obj)
		{
			return obj instanceof Symbol other && other.name.equals(name);
		}

		@Override
		public int hashCode()
		{
			return name.hashCode();
		}

		@Override
		public String toString()
		{
			return name;
		}
	}

	public static final class SList extends SExpr
	{
		private final List<SExpr> items;

		public SList(List<SExpr> items)
		{
			this.items = List.copyOf(items);
		}

		public List<SExpr> getItems()
		{
			return items;
		}

		@Override
		public <T> T accept(Visitor<T> visitor)
		{
			return visitor.visit(this);
		}

		@Override
		public boolean equals(Object obj)
		{
			return obj instanceof SList other && other.items.equals(items);
		}

		@Override
		public int hashCode()
		{
			return items.hashCode();
		}

		@Override
		public String toString()
		{
			StringBuilder sb = new StringBuilder("(");
			for (int i = 0; i < items.size(); i++)
			{
				if (i > 0)
				{
					sb.append(' ');
				}
				sb.append(items.get(i));
			}
			return sb.append(')').toString();
		}
	}

	public interface Visitor<T>
	{
		T visit(Symbol symbol);

		T visit(SList list);
	}
}
