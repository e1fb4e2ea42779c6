package org.yuho.verify;

import org.yuho.logic.SExpr;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads solver output: the S-expressions printed by {@code (get-model)} and single values.
 */
public final class SmtModelParser
{
	private SmtModelParser()
	{
	}

	/**
	 * Collects every constant ({@code define-fun} without parameters) of a model. Names are
	 * returned unquoted; values go through {@link #renderValue(SExpr)}.
	 */
	public static Map<String, String> parseModel(String text) throws SolverException
	{
		Map<String, String> model = new LinkedHashMap<>();
		for (SExpr expr : parse(text))
		{
			collect(expr, model);
		}
		return model;
	}

	private static void collect(SExpr expr, Map<String, String> model)
	{
		if (!(expr instanceof SExpr.SList list))
		{
			return;
		}
		List<SExpr> items = list.getItems();
		if (items.size() == 5 && items.get(0).equals(SExpr.sym("define-fun"))
				&& items.get(2) instanceof SExpr.SList params && params.getItems().isEmpty())
		{
			model.put(SExpr.unquote(items.get(1).toString()), renderValue(items.get(4)));
			return;
		}
		for (SExpr item : items)
		{
			collect(item, model);
		}
	}

	/**
	 * Flattens solver value syntax: {@code (- 3)} becomes {@code -3}, {@code (/ 1.0 2.0)} becomes
	 * {@code 1.0/2.0}, quoted symbols lose their bars.
	 */
	public static String renderValue(SExpr value)
	{
		if (value instanceof SExpr.SList list)
		{
			List<SExpr> items = list.getItems();
			if (items.size() == 2 && items.get(0).equals(SExpr.sym("-")))
			{
				return "-" + renderValue(items.get(1));
			}
			if (items.size() == 3 && items.get(0).equals(SExpr.sym("/")))
			{
				return renderValue(items.get(1)) + "/" + renderValue(items.get(2));
			}
			return value.toString();
		}
		return SExpr.unquote(value.toString());
	}

	public static String renderValue(String text) throws SolverException
	{
		List<SExpr> parsed = parse(text);
		return parsed.size() == 1 ? renderValue(parsed.get(0)) : text.trim();
	}

	/**
	 * Reads a sequence of S-expressions. String literals and {@code |quoted|} symbols are kept as
	 * single symbols; {@code ;} comments are skipped.
	 */
	public static List<SExpr> parse(String text) throws SolverException
	{
		List<SExpr> top = new ArrayList<>();
		Deque<List<SExpr>> open = new ArrayDeque<>();
		int i = 0;
		while (i < text.length())
		{
			char c = text.charAt(i);
			if (Character.isWhitespace(c))
			{
				i++;
			}
			else if (c == ';')
			{
				while (i < text.length() && text.charAt(i) != '\n')
				{
					i++;
				}
			}
			else if (c == '(')
			{
				open.push(new ArrayList<>());
				i++;
			}
			else if (c == ')')
			{
				if (open.isEmpty())
				{
					throw new SolverException("Unbalanced ')' in solver output at offset " + i);
				}
				SExpr list = SExpr.list(open.pop());
				add(list, open, top);
				i++;
			}
			else
			{
				int end = atomEnd(text, i);
				add(SExpr.sym(text.substring(i, end)), open, top);
				i = end;
			}
		}
		if (!open.isEmpty())
		{
			throw new SolverException("Unterminated list in solver output");
		}
		return top;
	}

	private static void add(SExpr expr, Deque<List<SExpr>> open, List<SExpr> top)
	{
		if (open.isEmpty())
		{
			top.add(expr);
		}
		else
		{
			open.peek().add(expr);
		}
	}

	private static int atomEnd(String text, int start) throws SolverException
	{
		char first = text.charAt(start);
		if (first == '"' || first == '|')
		{
			int i = start + 1;
			while (i < text.length())
			{
				if (text.charAt(i) == first)
				{
					// "" is an escaped quote inside a string literal
					if (first == '"' && i + 1 < text.length() && text.charAt(i + 1) == '"')
					{
						i += 2;
						continue;
					}
					return i + 1;
				}
				i++;
			}
			throw new SolverException("Unterminated " + (first == '"' ? "string" : "quoted symbol") + " in solver output");
		}
		int i = start;
		while (i < text.length())
		{
			char c = text.charAt(i);
			if (Character.isWhitespace(c) || c == '(' || c == ')' || c == ';')
			{
				break;
			}
			i++;
		}
		return i;
	}
}
