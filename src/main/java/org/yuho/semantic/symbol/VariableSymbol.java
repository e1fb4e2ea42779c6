// File: src/main/java/org/yuho/semantic/symbol/VariableSymbol.java
package org.yuho.semantic.symbol;

import org.yuho.ast.Span;
import org.yuho.semantic.type.Type;

public class VariableSymbol implements Symbol
{
	public enum Kind
	{
		GLOBAL, LOCAL, PARAMETER, QUANTIFIED, PATTERN
	}

	private final String name;
	private final Type type;
	private final Kind kind;
	private final Span span;

	public VariableSymbol(String name, Type type, Kind kind, Span span)
	{
		this.name = name;
		this.type = type;
		this.kind = kind;
		this.span = span;
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public Type getType()
	{
		return type;
	}

	public Kind getKind()
	{
		return kind;
	}

	public Span getSpan()
	{
		return span;
	}
}
