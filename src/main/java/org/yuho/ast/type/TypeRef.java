package org.yuho.ast.type;

import org.yuho.ast.Span;

import java.math.BigDecimal;
import java.util.List;

/**
 * A type as written in source, before resolution against the type environment.
 */
public sealed interface TypeRef
{
	Span span();

	<R> R accept(Visitor<R> visitor);

	interface Visitor<R>
	{
		R visitPrimitive(Primitive type);

		R visitNamed(Named type);

		R visitGeneric(Generic type);

		R visitTypeVariable(TypeVariable type);

		R visitBounded(Bounded type);

		R visitPositive(Positive type);

		R visitNonEmpty(NonEmpty type);

		R visitArray(Array type);

		R visitUnion(Union type);

		R visitCitation(Citation type);

		R visitTemporal(Temporal type);

		R visitValidDate(ValidDate type);

		R visitMoney(Money type);
	}

	record Primitive(PrimitiveKind kind, Span span) implements TypeRef
	{
		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitPrimitive(this);
		}
	}

	/**
	 * A bare name: a struct, enum, alias, or a type parameter of the enclosing generic declaration.
	 */
	record Named(String name, Span span) implements TypeRef
	{
		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitNamed(this);
		}
	}

	record Generic(String name, List<TypeRef> arguments, Span span) implements TypeRef
	{
		public Generic
		{
			arguments = List.copyOf(arguments);
		}

		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitGeneric(this);
		}
	}

	record TypeVariable(String name, Span span) implements TypeRef
	{
		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitTypeVariable(this);
		}
	}

	/**
	 * {@code BoundedInt<lower, upper>} and friends; either bound may be absent.
	 */
	record Bounded(TypeRef base, BigDecimal lower, BigDecimal upper, Span span) implements TypeRef
	{
		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitBounded(this);
		}
	}

	record Positive(TypeRef inner, Span span) implements TypeRef
	{
		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitPositive(this);
		}
	}

	record NonEmpty(TypeRef inner, Span span) implements TypeRef
	{
		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitNonEmpty(this);
		}
	}

	record Array(TypeRef element, Span span) implements TypeRef
	{
		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitArray(this);
		}
	}

	record Union(TypeRef left, TypeRef right, Span span) implements TypeRef
	{
		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitUnion(this);
		}
	}

	record Citation(String section, String subsection, String act, Span span) implements TypeRef
	{
		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitCitation(this);
		}
	}

	/**
	 * A value type with an optional validity window; bounds are date strings as written.
	 */
	record Temporal(TypeRef inner, String validFrom, String validUntil, Span span) implements TypeRef
	{
		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitTemporal(this);
		}
	}

	record ValidDate(String after, String before, Span span) implements TypeRef
	{
		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitValidDate(this);
		}
	}

	record Money(String currency, Span span) implements TypeRef
	{
		public <R> R accept(Visitor<R> visitor)
		{
			return visitor.visitMoney(this);
		}
	}
}
