package org.yuho.semantic;

import org.yuho.ast.Span;
import org.yuho.ast.type.TypeRef;
import org.yuho.semantic.symbol.AliasSymbol;
import org.yuho.semantic.symbol.EnumSymbol;
import org.yuho.semantic.symbol.StructSymbol;
import org.yuho.semantic.symbol.TypeParameterSymbol;
import org.yuho.semantic.symbol.TypeSymbol;
import org.yuho.semantic.type.ArrayType;
import org.yuho.semantic.type.CitationType;
import org.yuho.semantic.type.ErrorType;
import org.yuho.semantic.type.GenericType;
import org.yuho.semantic.type.NonEmptyType;
import org.yuho.semantic.type.PrimitiveType;
import org.yuho.semantic.type.RefinementType;
import org.yuho.semantic.type.TemporalType;
import org.yuho.semantic.type.Type;
import org.yuho.semantic.type.UnionType;
import org.yuho.util.ErrorHandler;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns written {@link TypeRef}s into semantic {@link Type}s, reporting every problem it finds
 * along the way. Each written type should be resolved once so that its errors are reported once.
 */
public class TypeResolver
{
	// T, U, K2: what a type variable looks like when it reaches us as a bare name.
	private static final Pattern TYPE_VARIABLE_NAME = Pattern.compile("[A-Z][0-9]*");

	private final TypeEnvironment environment;
	private final ErrorHandler errorHandler;

	public TypeResolver(TypeEnvironment environment, ErrorHandler errorHandler)
	{
		this.environment = environment;
		this.errorHandler = errorHandler;
	}

	public Type resolve(TypeRef ref, List<TypeParameterSymbol> typeParameters)
	{
		return ref.accept(new Visitor(typeParameters, ErrorKind.UNDEFINED_SYMBOL));
	}

	public Type resolve(TypeRef ref)
	{
		return resolve(ref, List.of());
	}

	/**
	 * Resolves the bound type of a quantifier: an unknown name is {@code UnboundQuantifierType}
	 * rather than an ordinary undefined symbol.
	 */
	public Type resolveQuantifierType(TypeRef ref, List<TypeParameterSymbol> typeParameters)
	{
		return ref.accept(new Visitor(typeParameters, ErrorKind.UNBOUND_QUANTIFIER_TYPE));
	}

	/**
	 * Resolves (once) and returns the target of an alias. A cycle through aliases is reported on
	 * the alias where it was detected.
	 */
	public Type resolveAlias(AliasSymbol alias)
	{
		switch (alias.getState())
		{
			case RESOLVED:
				return alias.getTargetType();
			case RESOLVING:
				errorHandler.logError(ErrorKind.CIRCULAR_INHERITANCE, alias.getSpan(),
						"Type alias '" + alias.getName() + "' refers to itself");
				alias.resolveTo(ErrorType.INSTANCE);
				return ErrorType.INSTANCE;
			default:
				alias.markResolving();
				Type target = resolve(alias.getDeclaration().target(), alias.getTypeParameters());
				if (alias.getState() == AliasSymbol.State.RESOLVING)
				{
					alias.resolveTo(target);
				}
				return alias.getTargetType();
		}
	}

	public static boolean looksLikeTypeVariable(String name)
	{
		return TYPE_VARIABLE_NAME.matcher(name).matches();
	}

	private final class Visitor implements TypeRef.Visitor<Type>
	{
		private final List<TypeParameterSymbol> typeParameters;
		private final ErrorKind unknownNameKind;

		Visitor(List<TypeParameterSymbol> typeParameters, ErrorKind unknownNameKind)
		{
			this.typeParameters = typeParameters;
			this.unknownNameKind = unknownNameKind;
		}

		private Optional<TypeParameterSymbol> typeParameter(String name)
		{
			for (TypeParameterSymbol param : typeParameters)
			{
				if (param.getName().equals(name))
				{
					return Optional.of(param);
				}
			}
			return Optional.empty();
		}

		@Override
		public Type visitPrimitive(TypeRef.Primitive type)
		{
			return PrimitiveType.of(type.kind());
		}

		@Override
		public Type visitNamed(TypeRef.Named type)
		{
			Optional<TypeParameterSymbol> param = typeParameter(type.name());
			if (param.isPresent())
			{
				return param.get().getType();
			}

			Optional<TypeSymbol> symbol = environment.lookupType(type.name());
			if (symbol.isEmpty())
			{
				if (unknownNameKind == ErrorKind.UNDEFINED_SYMBOL && looksLikeTypeVariable(type.name()))
				{
					errorHandler.logError(ErrorKind.UNBOUND_TYPE_VARIABLE, type.span(),
							"Type variable '" + type.name() + "' is not declared");
				}
				else
				{
					reportUnknown(type.name(), type.span());
				}
				return ErrorType.INSTANCE;
			}
			return instantiate(symbol.get(), List.of(), type.span());
		}

		@Override
		public Type visitGeneric(TypeRef.Generic type)
		{
			List<Type> args = new ArrayList<>();
			for (TypeRef arg : type.arguments())
			{
				args.add(arg.accept(this));
			}
			Optional<TypeSymbol> symbol = environment.lookupType(type.name());
			if (symbol.isEmpty())
			{
				reportUnknown(type.name(), type.span());
				return ErrorType.INSTANCE;
			}
			return instantiate(symbol.get(), args, type.span());
		}

		private void reportUnknown(String name, Span span)
		{
			String message = unknownNameKind == ErrorKind.UNBOUND_QUANTIFIER_TYPE
					? "Quantifier ranges over unknown type '" + name + "'"
					: "Undefined type '" + name + "'";
			errorHandler.logError(unknownNameKind, span, message);
		}

		private Type instantiate(TypeSymbol symbol, List<Type> args, Span span)
		{
			if (symbol instanceof StructSymbol struct)
			{
				int expected = struct.getTypeParameters().size();
				if (expected != args.size())
				{
					reportArity(struct.getName(), expected, args.size(), span);
					return ErrorType.INSTANCE;
				}
				return expected == 0 ? struct.getType() : new GenericType(struct, args);
			}
			if (symbol instanceof AliasSymbol alias)
			{
				int expected = alias.getTypeParameters().size();
				if (expected != args.size())
				{
					reportArity(alias.getName(), expected, args.size(), span);
					return ErrorType.INSTANCE;
				}
				Type target = resolveAlias(alias);
				Map<TypeParameterSymbol, Type> bindings = new HashMap<>();
				for (int i = 0; i < expected; i++)
				{
					bindings.put(alias.getTypeParameters().get(i), args.get(i));
				}
				return GenericType.substitute(target, bindings);
			}
			if (symbol instanceof EnumSymbol enumSymbol)
			{
				if (!args.isEmpty())
				{
					reportArity(enumSymbol.getName(), 0, args.size(), span);
					return ErrorType.INSTANCE;
				}
				return enumSymbol.getType();
			}
			return ErrorType.INSTANCE;
		}

		private void reportArity(String name, int expected, int got, Span span)
		{
			errorHandler.logError(ErrorKind.ARITY_MISMATCH, span,
					String.format("Type '%s' expects %d type argument(s) but got %d", name, expected, got));
		}

		@Override
		public Type visitTypeVariable(TypeRef.TypeVariable type)
		{
			Optional<TypeParameterSymbol> param = typeParameter(type.name());
			if (param.isEmpty())
			{
				errorHandler.logError(ErrorKind.UNBOUND_TYPE_VARIABLE, type.span(),
						"Type variable '" + type.name() + "' is not declared");
				return ErrorType.INSTANCE;
			}
			return param.get().getType();
		}

		@Override
		public Type visitBounded(TypeRef.Bounded type)
		{
			Type base = type.base().accept(this);
			if (!base.isError() && !base.isNumeric())
			{
				errorHandler.logError(ErrorKind.INVALID_CONSTRAINT, type.span(),
						"Bounded type requires a numeric base, got '" + base.getName() + "'");
				return ErrorType.INSTANCE;
			}
			BigDecimal lower = type.lower();
			BigDecimal upper = type.upper();
			if (lower != null && upper != null && lower.compareTo(upper) > 0)
			{
				errorHandler.logError(ErrorKind.OUT_OF_BOUNDS, type.span(),
						"Lower bound " + lower.toPlainString() + " is greater than upper bound " + upper.toPlainString());
				return ErrorType.INSTANCE;
			}
			return RefinementType.bounded(base, lower, upper);
		}

		@Override
		public Type visitPositive(TypeRef.Positive type)
		{
			Type inner = type.inner().accept(this);
			if (!inner.isError() && !inner.isNumeric())
			{
				errorHandler.logError(ErrorKind.INVALID_CONSTRAINT, type.span(),
						"Positive<T> requires a numeric type, got '" + inner.getName() + "'");
				return ErrorType.INSTANCE;
			}
			return RefinementType.positive(inner);
		}

		@Override
		public Type visitNonEmpty(TypeRef.NonEmpty type)
		{
			return new NonEmptyType(type.inner().accept(this));
		}

		@Override
		public Type visitArray(TypeRef.Array type)
		{
			return new ArrayType(type.element().accept(this));
		}

		@Override
		public Type visitUnion(TypeRef.Union type)
		{
			return new UnionType(type.left().accept(this), type.right().accept(this));
		}

		@Override
		public Type visitCitation(TypeRef.Citation type)
		{
			checkCitationPart("section", type.section(), type.span());
			checkCitationPart("subsection", type.subsection(), type.span());
			checkCitationPart("act", type.act(), type.span());
			return new CitationType(nullToEmpty(type.section()), nullToEmpty(type.subsection()), nullToEmpty(type.act()));
		}

		private void checkCitationPart(String part, String value, Span span)
		{
			if (value == null || value.isBlank())
			{
				errorHandler.logError(ErrorKind.INVALID_CITATION, span, "Citation " + part + " cannot be empty");
			}
		}

		@Override
		public Type visitTemporal(TypeRef.Temporal type)
		{
			Type inner = type.inner().accept(this);
			LocalDate[] window = window("valid_from", type.validFrom(), "valid_until", type.validUntil(), type.span());
			return new TemporalType(inner, window[0], window[1]);
		}

		@Override
		public Type visitValidDate(TypeRef.ValidDate type)
		{
			LocalDate[] window = window("after", type.after(), "before", type.before(), type.span());
			return new TemporalType(PrimitiveType.DATE, window[0], window[1]);
		}

		private LocalDate[] window(String fromName, String from, String untilName, String until, Span span)
		{
			LocalDate fromDate = date(fromName, from, span);
			LocalDate untilDate = date(untilName, until, span);
			if (fromDate != null && untilDate != null && !fromDate.isBefore(untilDate))
			{
				errorHandler.logError(ErrorKind.INVALID_TEMPORAL_WINDOW, span,
						"'" + fromName + "' (" + fromDate + ") must be before '" + untilName + "' (" + untilDate + ")");
			}
			return new LocalDate[]{fromDate, untilDate};
		}

		private LocalDate date(String name, String text, Span span)
		{
			if (text == null)
			{
				return null;
			}
			Optional<LocalDate> parsed = DateParser.parse(text);
			if (parsed.isEmpty())
			{
				errorHandler.logError(ErrorKind.INVALID_TEMPORAL_WINDOW, span,
						"Invalid '" + name + "' date '" + text + "', expected " + DateParser.EXPECTED_FORMATS);
				return null;
			}
			return parsed.get();
		}

		@Override
		public Type visitMoney(TypeRef.Money type)
		{
			return PrimitiveType.MONEY;
		}
	}

	private static String nullToEmpty(String value)
	{
		return value == null ? "" : value;
	}
}
