package org.yuho.semantic.symbol;

import org.yuho.ast.Span;
import org.yuho.ast.type.Constraint;
import org.yuho.semantic.type.Type;

import java.util.List;

/**
 * A resolved struct field or legal-test requirement. {@code owner} names the declaring struct,
 * which differs from the struct being checked for inherited fields.
 */
public record FieldSymbol(String name, Type type, List<Constraint> constraints, String owner, Span span) implements Symbol
{
	public FieldSymbol
	{
		constraints = List.copyOf(constraints);
	}

	public FieldSymbol withType(Type newType)
	{
		return new FieldSymbol(name, newType, constraints, owner, span);
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
}
