package org.yuho.ast.type;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a type reference in source syntax. Two references print the same exactly when they
 * are written the same, wherever they appear.
 */
public final class TypeRefPrinter implements TypeRef.Visitor<String>
{
	private static final TypeRefPrinter INSTANCE = new TypeRefPrinter();

	private TypeRefPrinter()
	{
	}

	public static String print(TypeRef type)
	{
		return type == null ? "pass" : type.accept(INSTANCE);
	}

	@Override
	public String visitPrimitive(TypeRef.Primitive type)
	{
		return type.kind().getKeyword();
	}

	@Override
	public String visitNamed(TypeRef.Named type)
	{
		return type.name();
	}

	@Override
	public String visitGeneric(TypeRef.Generic type)
	{
		List<String> args = new ArrayList<>();
		for (TypeRef arg : type.arguments())
		{
			args.add(arg.accept(this));
		}
		return type.name() + "<" + String.join(", ", args) + ">";
	}

	@Override
	public String visitTypeVariable(TypeRef.TypeVariable type)
	{
		return type.name();
	}

	@Override
	public String visitBounded(TypeRef.Bounded type)
	{
		return "Bounded<" + type.base().accept(this) + ", " + bound(type.lower()) + ", " + bound(type.upper()) + ">";
	}

	@Override
	public String visitPositive(TypeRef.Positive type)
	{
		return "Positive<" + type.inner().accept(this) + ">";
	}

	@Override
	public String visitNonEmpty(TypeRef.NonEmpty type)
	{
		return "NonEmpty<" + type.inner().accept(this) + ">";
	}

	@Override
	public String visitArray(TypeRef.Array type)
	{
		return "[" + type.element().accept(this) + "]";
	}

	@Override
	public String visitUnion(TypeRef.Union type)
	{
		return type.left().accept(this) + " | " + type.right().accept(this);
	}

	@Override
	public String visitCitation(TypeRef.Citation type)
	{
		return "Citation<\"" + type.section() + "\", \"" + type.subsection() + "\", \"" + type.act() + "\">";
	}

	@Override
	public String visitTemporal(TypeRef.Temporal type)
	{
		return "Temporal<" + type.inner().accept(this) + ", " + type.validFrom() + ", " + type.validUntil() + ">";
	}

	@Override
	public String visitValidDate(TypeRef.ValidDate type)
	{
		return "ValidDate<" + type.after() + ", " + type.before() + ">";
	}

	@Override
	public String visitMoney(TypeRef.Money type)
	{
		return "Money<" + type.currency() + ">";
	}

	private static String bound(BigDecimal value)
	{
		return value == null ? "_" : value.stripTrailingZeros().toPlainString();
	}
}
