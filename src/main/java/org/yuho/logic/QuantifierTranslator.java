package org.yuho.logic;

import org.yuho.ast.Span;
import org.yuho.ast.decl.PrincipleDecl;
import org.yuho.ast.expr.Expr;
import org.yuho.ast.type.TypeRef;
import org.yuho.semantic.ConstantEvaluator;
import org.yuho.semantic.ErrorKind;
import org.yuho.semantic.SemanticError;
import org.yuho.semantic.TypeEnvironment;
import org.yuho.semantic.TypeResolver;
import org.yuho.semantic.TypedProgram;
import org.yuho.semantic.symbol.EnumSymbol;
import org.yuho.semantic.symbol.FieldSymbol;
import org.yuho.semantic.symbol.FunctionSymbol;
import org.yuho.semantic.symbol.LegalTestSymbol;
import org.yuho.semantic.symbol.VariableSymbol;
import org.yuho.semantic.type.CitationType;
import org.yuho.semantic.type.EnumType;
import org.yuho.semantic.type.GenericType;
import org.yuho.semantic.type.NonEmptyType;
import org.yuho.semantic.type.PrimitiveType;
import org.yuho.semantic.type.RefinementType;
import org.yuho.semantic.type.StructType;
import org.yuho.semantic.type.TemporalType;
import org.yuho.semantic.type.Type;
import org.yuho.util.Debug;
import org.yuho.util.ErrorHandler;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lowers principles to {@link LogicalForm}s.
 * <p>
 * The translator holds no per-call state: every {@link #translate} call gets its own
 * {@link Context}, the bound variables are an immutable chain and the quantifier depth is passed
 * down explicitly. Struct types become uninterpreted sorts, enums become datatypes, function calls
 * and field accesses become uninterpreted function applications.
 */
public class QuantifierTranslator
{
	public static final int MAX_DEPTH = 10;

	private static final Pattern DURATION = Pattern.compile("\\s*(-?\\d+)\\s*([a-zA-Z]+)\\s*");

	private final TypeEnvironment environment;
	private final TypedProgram program;

	public QuantifierTranslator(TypedProgram program)
	{
		this.environment = program.getEnvironment();
		this.program = program;
	}

	public QuantifierTranslator(TypeEnvironment environment)
	{
		this.environment = environment;
		this.program = null;
	}

	/**
	 * A solver term and the sort it has.
	 */
	private record Term(SExpr expr, Sort sort)
	{
	}

	/**
	 * The sort of a binder and the range guards its type adds, as {@code (op var bound)} pairs.
	 */
	private record Encoding(Sort sort, List<Guard> guards)
	{
		Encoding(Sort sort)
		{
			this(sort, List.of());
		}

		List<SExpr> guardsOn(SExpr variable)
		{
			List<SExpr> conjuncts = new ArrayList<>();
			for (Guard guard : guards)
			{
				conjuncts.add(SExpr.call(guard.op(), variable, guard.bound()));
			}
			return conjuncts;
		}
	}

	private record Guard(String op, SExpr bound)
	{
	}

	/**
	 * Declarations and names collected while translating one formula.
	 */
	private final class Context
	{
		private final Map<String, SExpr> declarations = new LinkedHashMap<>();
		private final Map<String, LogicalForm.Constant> freeConstants = new LinkedHashMap<>();
		private final Map<String, String> functionNames = new HashMap<>();
		private final Set<String> usedNames = new HashSet<>();
		private final List<String> warnings = new ArrayList<>();

		String fresh(String name)
		{
			String candidate = name;
			int suffix = 1;
			while (SExpr.isReserved(candidate) || !usedNames.add(candidate))
			{
				candidate = name + "!" + suffix++;
			}
			return candidate;
		}

		void warn(String warning)
		{
			Debug.logWarning("[Translation] " + warning);
			warnings.add(warning);
		}

		Sort declareSort(Type type)
		{
			Sort sort = Sort.uninterpreted(type);
			declarations.putIfAbsent("sort " + sort.name(), SExpr.call("declare-sort", sort.toSExpr(), SExpr.num(0)));
			return sort;
		}

		Sort declareDatatype(EnumType type, Span span) throws TranslationException
		{
			EnumSymbol symbol = type.getSymbol();
			if (symbol.getVariants().isEmpty())
			{
				throw new TranslationException(ErrorKind.UNSUPPORTED_EXPRESSION,
						"Enum '" + symbol.getName() + "' has no variants and cannot be encoded", span);
			}
			Sort sort = Sort.datatype(type);
			if (!declarations.containsKey("sort " + sort.name()))
			{
				List<SExpr> constructors = new ArrayList<>();
				for (String variant : distinctVariants(symbol))
				{
					constructors.add(SExpr.list(SExpr.name(symbol.getName() + "." + variant)));
				}
				declarations.put("sort " + sort.name(), SExpr.call("declare-datatypes",
						SExpr.list(SExpr.list(sort.toSExpr(), SExpr.num(0))),
						SExpr.list(SExpr.list(constructors))));
			}
			return sort;
		}

		Term constant(String name, Sort sort)
		{
			LogicalForm.Constant constant = freeConstants.get(name);
			if (constant == null)
			{
				constant = new LogicalForm.Constant(name, fresh(name), sort);
				freeConstants.put(name, constant);
			}
			return new Term(SExpr.name(constant.smtName()), constant.sort());
		}

		String declareFunction(String name, List<Sort> parameters, Sort result)
		{
			String smtName = functionNames.get(name);
			if (smtName == null)
			{
				smtName = fresh(name);
				functionNames.put(name, smtName);
				List<SExpr> parameterSorts = new ArrayList<>();
				for (Sort parameter : parameters)
				{
					parameterSorts.add(parameter.toSExpr());
				}
				declarations.put("fun " + smtName,
						SExpr.call("declare-fun", SExpr.name(smtName), SExpr.list(parameterSorts), result.toSExpr()));
			}
			return smtName;
		}

		Term selector(Sort owner, FieldSymbol field, Term target, Span span) throws TranslationException
		{
			Sort fieldSort = encode(field.type(), span, this).sort();
			String smtName = owner.name() + "." + field.name();
			declarations.putIfAbsent("fun " + smtName,
					SExpr.call("declare-fun", SExpr.name(smtName), SExpr.list(owner.toSExpr()), fieldSort.toSExpr()));
			return new Term(SExpr.call(SExpr.quote(smtName), target.expr()), fieldSort);
		}
	}

	/**
	 * Duplicate variants are reported by the legal checker; the datatype keeps the first.
	 */
	private static Set<String> distinctVariants(EnumSymbol symbol)
	{
		return new LinkedHashSet<>(symbol.getVariants());
	}

	// --- Entry points ---

	/**
	 * Translates one principle. The leading {@code forall}s become the universal prefix.
	 *
	 * @throws TranslationException on nesting deeper than {@link #MAX_DEPTH}, an unknown bound type
	 *                              or a construct with no logical meaning
	 */
	public LogicalForm translate(PrincipleDecl principle) throws TranslationException
	{
		Debug.logDebug("Translating principle '" + principle.name() + "'...");
		Context ctx = new Context();
		List<LogicalForm.Constant> universals = new ArrayList<>();
		List<SExpr> guards = new ArrayList<>();
		BoundVariables bound = BoundVariables.EMPTY;
		int depth = 0;

		Expr body = principle.body();
		while (body instanceof Expr.Quantified quantified && quantified.kind() == Expr.QuantifierKind.FORALL)
		{
			depth = enter(quantified, depth);
			Encoding encoding = encodeBinder(quantified, ctx);
			String smtName = bindName(quantified, bound, ctx);
			bound = bound.bind(quantified.variable(), smtName, encoding.sort());
			universals.add(new LogicalForm.Constant(quantified.variable(), smtName, encoding.sort()));
			guards.addAll(encoding.guardsOn(SExpr.name(smtName)));
			body = quantified.body();
		}

		Term matrix = requireBool(translate(body, bound, depth, ctx), body);
		SExpr guarded = guards.isEmpty() ? matrix.expr() : SExpr.implies(SExpr.and(guards), matrix.expr());
		return new LogicalForm(principle.name(), LogicalForm.Goal.VALIDITY, List.copyOf(ctx.declarations.values()),
				universals, List.copyOf(ctx.freeConstants.values()), guarded, ctx.warnings);
	}

	/**
	 * The conjunction of a legal test's requirements, each a free boolean constant, as a
	 * satisfiability goal.
	 */
	public LogicalForm translateLegalTest(LegalTestSymbol test) throws TranslationException
	{
		Context ctx = new Context();
		List<SExpr> conjuncts = new ArrayList<>();
		for (FieldSymbol requirement : test.getRequirements())
		{
			if (!requirement.type().unwrap().isBoolean())
			{
				throw new TranslationException(ErrorKind.NON_BOOLEAN_REQUIREMENT,
						"Requirement '" + requirement.name() + "' of legal test '" + test.getName() + "' is not boolean",
						requirement.span());
			}
			conjuncts.add(ctx.constant(requirement.name(), Sort.BOOL).expr());
		}
		return new LogicalForm(test.getName(), LogicalForm.Goal.SATISFIABILITY, List.copyOf(ctx.declarations.values()),
				List.of(), List.copyOf(ctx.freeConstants.values()), SExpr.and(conjuncts), ctx.warnings);
	}

	// --- Expressions ---

	private Term translate(Expr expr, BoundVariables bound, int depth, Context ctx) throws TranslationException
	{
		if (expr instanceof Expr.Literal literal)
		{
			return literal(literal);
		}
		else if (expr instanceof Expr.Identifier identifier)
		{
			return identifier(identifier, bound, ctx);
		}
		else if (expr instanceof Expr.Binary binary)
		{
			return binary(binary, bound, depth, ctx);
		}
		else if (expr instanceof Expr.Unary unary)
		{
			Term operand = translate(unary.operand(), bound, depth, ctx);
			if (unary.op() == Expr.UnaryOp.NOT)
			{
				return new Term(SExpr.not(requireBool(operand, unary.operand()).expr()), Sort.BOOL);
			}
			if (!operand.sort().isArithmetic())
			{
				throw mismatch(unary, "Unary '-' needs a numeric operand, got " + operand.sort());
			}
			return new Term(SExpr.call("-", operand.expr()), operand.sort());
		}
		else if (expr instanceof Expr.Call call)
		{
			return call(call, bound, depth, ctx);
		}
		else if (expr instanceof Expr.FieldAccess access)
		{
			return fieldAccess(access, bound, depth, ctx);
		}
		else if (expr instanceof Expr.Quantified quantified)
		{
			return quantified(quantified, bound, depth, ctx);
		}
		else if (expr instanceof Expr.StructInit)
		{
			throw new TranslationException(ErrorKind.UNSUPPORTED_EXPRESSION,
					"Struct literals cannot appear in a principle", expr.span());
		}
		else if (expr instanceof Expr.Match)
		{
			throw new TranslationException(ErrorKind.UNSUPPORTED_EXPRESSION,
					"Match expressions cannot appear in a principle", expr.span());
		}
		throw new TranslationException(ErrorKind.UNSUPPORTED_EXPRESSION,
				"Unsupported expression " + expr.getClass().getSimpleName(), expr.span());
	}

	private Term quantified(Expr.Quantified quantified, BoundVariables bound, int depth, Context ctx) throws TranslationException
	{
		int level = enter(quantified, depth);
		Encoding encoding = encodeBinder(quantified, ctx);
		String smtName = bindName(quantified, bound, ctx);
		BoundVariables inner = bound.bind(quantified.variable(), smtName, encoding.sort());
		Term body = requireBool(translate(quantified.body(), inner, level, ctx), quantified.body());

		SExpr variable = SExpr.name(smtName);
		List<SExpr> guards = encoding.guardsOn(variable);
		boolean universal = quantified.kind() == Expr.QuantifierKind.FORALL;
		SExpr matrix = body.expr();
		if (!guards.isEmpty())
		{
			SExpr guard = SExpr.and(guards);
			matrix = universal ? SExpr.implies(guard, matrix) : SExpr.call("and", guard, matrix);
		}
		SExpr binder = SExpr.list(SExpr.list(variable, encoding.sort().toSExpr()));
		return new Term(SExpr.call(universal ? "forall" : "exists", binder, matrix), Sort.BOOL);
	}

	private static int enter(Expr.Quantified quantified, int depth) throws TranslationException
	{
		int level = depth + 1;
		if (level > MAX_DEPTH)
		{
			throw new TranslationException(ErrorKind.QUANTIFIER_DEPTH_EXCEEDED, "Quantifier nesting depth exceeds "
					+ MAX_DEPTH + " at '" + quantified.variable() + "'", quantified.span());
		}
		return level;
	}

	private static String bindName(Expr.Quantified quantified, BoundVariables bound, Context ctx)
	{
		if (bound.isBound(quantified.variable()))
		{
			ctx.warn("Quantified variable '" + quantified.variable() + "' shadows an outer binding");
		}
		return ctx.fresh(quantified.variable());
	}

	private Term literal(Expr.Literal literal) throws TranslationException
	{
		Optional<ConstantEvaluator.Value> value = ConstantEvaluator.evaluate(literal);
		if (value.isEmpty())
		{
			throw new TranslationException(ErrorKind.UNSUPPORTED_EXPRESSION,
					"Cannot encode literal '" + literal.text() + "'", literal.span());
		}
		return switch (literal.kind())
		{
			case INT -> new Term(numeral(value.get().number(), Sort.INT, RoundingMode.DOWN), Sort.INT);
			case FLOAT, MONEY, PERCENT -> new Term(numeral(value.get().number(), Sort.REAL, RoundingMode.DOWN), Sort.REAL);
			case BOOL -> new Term(SExpr.sym(Boolean.toString(value.get().bool())), Sort.BOOL);
			case STRING -> new Term(SExpr.str(value.get().text()), Sort.STRING);
			case DATE -> new Term(SExpr.num(value.get().date().toEpochDay()), Sort.INT);
			case DURATION -> new Term(SExpr.num(durationDays(literal)), Sort.INT);
			case PASS -> throw new TranslationException(ErrorKind.UNSUPPORTED_EXPRESSION,
					"'pass' has no logical meaning", literal.span());
		};
	}

	private Term identifier(Expr.Identifier identifier, BoundVariables bound, Context ctx) throws TranslationException
	{
		Optional<BoundVariables.Binding> binding = bound.lookup(identifier.name());
		if (binding.isPresent())
		{
			return new Term(binding.get().toSExpr(), binding.get().sort());
		}
		Optional<VariableSymbol> global = environment.getGlobal(identifier.name());
		if (global.isPresent() && global.get().getType() != null && !global.get().getType().isError())
		{
			return ctx.constant(identifier.name(), encode(global.get().getType(), identifier.span(), ctx).sort());
		}
		Optional<EnumSymbol> owner = environment.findEnumByVariant(identifier.name());
		if (owner.isPresent())
		{
			return variant(owner.get(), identifier.name(), identifier.span(), ctx);
		}
		Optional<Type> inferred = program == null ? Optional.empty() : program.typeOf(identifier);
		if (inferred.isPresent() && !inferred.get().isError())
		{
			return ctx.constant(identifier.name(), encode(inferred.get(), identifier.span(), ctx).sort());
		}
		return ctx.constant(identifier.name(), Sort.INT);
	}

	private Term variant(EnumSymbol owner, String variant, Span span, Context ctx) throws TranslationException
	{
		Sort sort = ctx.declareDatatype((EnumType) owner.getType(), span);
		return new Term(SExpr.name(owner.getName() + "." + variant), sort);
	}

	private Term binary(Expr.Binary binary, BoundVariables bound, int depth, Context ctx) throws TranslationException
	{
		Term left = translate(binary.left(), bound, depth, ctx);
		Term right = translate(binary.right(), bound, depth, ctx);
		Expr.BinaryOp op = binary.op();

		if (op.isLogical())
		{
			requireBool(left, binary.left());
			requireBool(right, binary.right());
			return new Term(SExpr.call(op == Expr.BinaryOp.AND ? "and" : "or", left.expr(), right.expr()), Sort.BOOL);
		}

		if (left.sort().isArithmetic() && right.sort().isArithmetic() && !left.sort().equals(right.sort()))
		{
			left = toReal(left);
			right = toReal(right);
		}

		if (op == Expr.BinaryOp.EQ || op == Expr.BinaryOp.NE)
		{
			if (!left.sort().equals(right.sort()))
			{
				throw mismatch(binary, "Cannot compare " + left.sort() + " with " + right.sort());
			}
			return new Term(SExpr.call(op == Expr.BinaryOp.EQ ? "=" : "distinct", left.expr(), right.expr()), Sort.BOOL);
		}

		if (!left.sort().isArithmetic() || !right.sort().isArithmetic())
		{
			throw mismatch(binary, "Operator '" + op.getSymbol() + "' needs numeric operands, got "
					+ left.sort() + " and " + right.sort());
		}
		if (op.isComparison())
		{
			return new Term(SExpr.call(op.getSymbol(), left.expr(), right.expr()), Sort.BOOL);
		}

		Sort sort = left.sort();
		String function = switch (op)
		{
			case ADD -> "+";
			case SUB -> "-";
			case MUL -> "*";
			case DIV -> sort.equals(Sort.INT) ? "div" : "/";
			case MOD -> "mod";
			default -> throw mismatch(binary, "Unexpected operator '" + op.getSymbol() + "'");
		};
		if (op == Expr.BinaryOp.MOD && !sort.equals(Sort.INT))
		{
			throw mismatch(binary, "Operator '%' needs integer operands");
		}
		return new Term(SExpr.call(function, left.expr(), right.expr()), sort);
	}

	private static Term toReal(Term term)
	{
		if (term.sort().equals(Sort.INT))
		{
			return new Term(SExpr.call("to_real", term.expr()), Sort.REAL);
		}
		return term;
	}

	private Term call(Expr.Call call, BoundVariables bound, int depth, Context ctx) throws TranslationException
	{
		Optional<FunctionSymbol> function = environment.getFunction(call.function());
		if (function.isEmpty())
		{
			throw new TranslationException(ErrorKind.UNDEFINED_SYMBOL, "Undefined function '" + call.function() + "'", call.span());
		}
		List<VariableSymbol> parameters = function.get().getParameters();
		if (parameters.size() != call.arguments().size())
		{
			throw mismatch(call, "Function '" + call.function() + "' expects " + parameters.size() + " argument(s)");
		}

		List<Sort> parameterSorts = new ArrayList<>();
		List<SExpr> arguments = new ArrayList<>();
		for (int i = 0; i < parameters.size(); i++)
		{
			Sort expected = encode(parameters.get(i).getType(), call.span(), ctx).sort();
			Term argument = translate(call.arguments().get(i), bound, depth, ctx);
			if (expected.equals(Sort.REAL))
			{
				argument = toReal(argument);
			}
			if (!argument.sort().equals(expected))
			{
				throw mismatch(call, "Argument " + (i + 1) + " of '" + call.function() + "' must be " + expected);
			}
			parameterSorts.add(expected);
			arguments.add(argument.expr());
		}
		Sort result = encode(function.get().getReturnType(), call.span(), ctx).sort();
		String smtName = ctx.declareFunction(call.function(), parameterSorts, result);
		if (arguments.isEmpty())
		{
			return new Term(SExpr.name(smtName), result);
		}
		return new Term(SExpr.call(SExpr.quote(smtName), arguments), result);
	}

	private Term fieldAccess(Expr.FieldAccess access, BoundVariables bound, int depth, Context ctx) throws TranslationException
	{
		if (access.target() instanceof Expr.Identifier owner && !bound.isBound(owner.name())
				&& environment.getGlobal(owner.name()).isEmpty())
		{
			Optional<EnumSymbol> enumSymbol = environment.getEnum(owner.name());
			if (enumSymbol.isPresent())
			{
				if (!enumSymbol.get().hasVariant(access.field()))
				{
					throw new TranslationException(ErrorKind.UNDEFINED_SYMBOL,
							"Enum '" + owner.name() + "' has no variant '" + access.field() + "'", access.span());
				}
				return variant(enumSymbol.get(), access.field(), access.span(), ctx);
			}
		}

		Term target = translate(access.target(), bound, depth, ctx);
		Type type = target.sort().type();
		List<FieldSymbol> fields;
		if (type instanceof StructType struct)
		{
			fields = struct.getFields();
		}
		else if (type instanceof GenericType generic)
		{
			fields = generic.getFields();
		}
		else
		{
			throw new TranslationException(ErrorKind.UNSUPPORTED_EXPRESSION,
					"Field access on a value of sort " + target.sort(), access.span());
		}
		for (FieldSymbol field : fields)
		{
			if (field.name().equals(access.field()))
			{
				return ctx.selector(target.sort(), field, target, access.span());
			}
		}
		throw new TranslationException(ErrorKind.INVALID_FIELD,
				"Struct '" + type.getName() + "' has no field '" + access.field() + "'", access.span());
	}

	// --- Types ---

	/**
	 * Resolves a binder's declared type. Any name that does not resolve makes the whole principle
	 * untranslatable.
	 */
	private Encoding encodeBinder(Expr.Quantified quantified, Context ctx) throws TranslationException
	{
		TypeRef ref = quantified.variableType();
		ErrorHandler scratch = new ErrorHandler("translation of '" + quantified.variable() + "'");
		Type type = new TypeResolver(environment, scratch).resolveQuantifierType(ref, List.of());
		if (scratch.hasErrors())
		{
			SemanticError first = scratch.getErrors().get(0);
			boolean unbound = first.kind() == ErrorKind.UNBOUND_QUANTIFIER_TYPE || first.kind() == ErrorKind.UNDEFINED_SYMBOL
					|| first.kind() == ErrorKind.UNBOUND_TYPE_VARIABLE;
			throw new TranslationException(unbound ? ErrorKind.UNBOUND_QUANTIFIER_TYPE : first.kind(),
					"Cannot bind '" + quantified.variable() + "': " + first.message(), quantified.span());
		}
		return encode(type, quantified.span(), ctx);
	}

	private Encoding encode(Type type, Span span, Context ctx) throws TranslationException
	{
		if (type instanceof RefinementType refinement)
		{
			Encoding base = encode(refinement.getBase(), span, ctx);
			List<Guard> guards = new ArrayList<>(base.guards());
			// On Int a fractional bound rounds inward, so the guard admits only integers inside the range.
			if (refinement.getLower() != null)
			{
				boolean exclusive = refinement.isLowerExclusive();
				RoundingMode mode = exclusive ? RoundingMode.FLOOR : RoundingMode.CEILING;
				guards.add(new Guard(exclusive ? ">" : ">=", numeral(refinement.getLower(), base.sort(), mode)));
			}
			if (refinement.getUpper() != null)
			{
				guards.add(new Guard("<=", numeral(refinement.getUpper(), base.sort(), RoundingMode.FLOOR)));
			}
			return new Encoding(base.sort(), guards);
		}
		if (type instanceof TemporalType temporal)
		{
			return encode(temporal.getInner(), span, ctx);
		}
		if (type instanceof NonEmptyType nonEmpty)
		{
			return encode(nonEmpty.getInner(), span, ctx);
		}
		if (type instanceof PrimitiveType primitive)
		{
			return switch (primitive.getKind())
			{
				case INT, DATE, DURATION -> new Encoding(Sort.INT);
				case FLOAT, MONEY, PERCENT -> new Encoding(Sort.REAL);
				case BOOL -> new Encoding(Sort.BOOL);
				case STRING -> new Encoding(Sort.STRING);
				case PASS -> throw new TranslationException(ErrorKind.UNSUPPORTED_EXPRESSION,
						"Type 'pass' has no logical encoding", span);
			};
		}
		if (type instanceof CitationType)
		{
			return new Encoding(Sort.STRING);
		}
		if (type instanceof StructType || type instanceof GenericType)
		{
			return new Encoding(ctx.declareSort(type));
		}
		if (type instanceof EnumType enumType)
		{
			return new Encoding(ctx.declareDatatype(enumType, span));
		}
		throw new TranslationException(ErrorKind.UNSUPPORTED_EXPRESSION,
				"Type '" + type.getName() + "' has no logical encoding", span);
	}

	// --- Helpers ---

	/**
	 * A bound as an SMT literal of {@code sort}. On Int the value is rounded with {@code intRounding}
	 * before the sign is split off.
	 */
	static SExpr numeral(BigDecimal value, Sort sort, RoundingMode intRounding)
	{
		BigDecimal exact = sort.equals(Sort.REAL) ? value : value.setScale(0, intRounding);
		String text;
		if (sort.equals(Sort.REAL))
		{
			text = exact.abs().stripTrailingZeros().toPlainString();
			if (!text.contains("."))
			{
				text = text + ".0";
			}
		}
		else
		{
			text = exact.abs().toPlainString();
		}
		SExpr literal = SExpr.sym(text);
		return exact.signum() < 0 ? SExpr.call("-", literal) : literal;
	}

	/**
	 * Durations are encoded as a number of days, with months of 30 days and years of 365.
	 */
	static long durationDays(Expr.Literal literal) throws TranslationException
	{
		Matcher matcher = DURATION.matcher(literal.text());
		if (matcher.matches())
		{
			String unit = matcher.group(2).toLowerCase(Locale.ROOT);
			if (unit.endsWith("s"))
			{
				unit = unit.substring(0, unit.length() - 1);
			}
			try
			{
				long amount = Long.parseLong(matcher.group(1));
				switch (unit)
				{
					case "day":
						return amount;
					case "week":
						return Math.multiplyExact(amount, 7L);
					case "month":
						return Math.multiplyExact(amount, 30L);
					case "year":
						return Math.multiplyExact(amount, 365L);
					default:
						break;
				}
			}
			catch (NumberFormatException | ArithmeticException e)
			{
				throw new TranslationException(ErrorKind.UNSUPPORTED_EXPRESSION,
						"Duration '" + literal.text() + "' is out of range", literal.span());
			}
		}
		throw new TranslationException(ErrorKind.UNSUPPORTED_EXPRESSION,
				"Cannot encode duration '" + literal.text() + "'", literal.span());
	}

	private static Term requireBool(Term term, Expr expr) throws TranslationException
	{
		if (!term.sort().equals(Sort.BOOL))
		{
			throw new TranslationException(ErrorKind.TYPE_MISMATCH, "Expected a boolean formula, got " + term.sort(), expr.span());
		}
		return term;
	}

	private static TranslationException mismatch(Expr expr, String message)
	{
		return new TranslationException(ErrorKind.TYPE_MISMATCH, message, expr.span());
	}
}
