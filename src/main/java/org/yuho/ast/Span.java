package org.yuho.ast;

/**
 * A line/column range in the original source, copied from the parser's nodes.
 * Lines and columns are 1-based; {@link #NONE} marks synthesized nodes.
 */
public record Span(int line, int column, int endLine, int endColumn)
{
	public static final Span NONE = new Span(0, 0, 0, 0);

	public static Span at(int line, int column)
	{
		return new Span(line, column, line, column);
	}

	public boolean isKnown()
	{
		return line > 0;
	}

	@Override
	public String toString()
	{
		if (!isKnown())
		{
			return "<unknown>";
		}
		return line + ":" + column + "-" + endLine + ":" + endColumn;
	}
}
