package org.yuho.semantic;

import org.yuho.ast.Span;
import org.yuho.ast.decl.EnumDecl;
import org.yuho.ast.decl.FunctionDecl;
import org.yuho.ast.decl.Item;
import org.yuho.ast.decl.LegalTestDecl;
import org.yuho.ast.decl.PrincipleDecl;
import org.yuho.ast.decl.ScopeDecl;
import org.yuho.ast.decl.StructDecl;
import org.yuho.ast.decl.TypeAliasDecl;
import org.yuho.ast.decl.VariableDecl;
import org.yuho.ast.expr.Expr;
import org.yuho.ast.expr.Pattern;
import org.yuho.ast.stmt.Stmt;
import org.yuho.ast.type.Constraint;
import org.yuho.semantic.symbol.EnumSymbol;
import org.yuho.semantic.symbol.FieldSymbol;
import org.yuho.semantic.symbol.FunctionSymbol;
import org.yuho.semantic.symbol.ScopeStack;
import org.yuho.semantic.symbol.StructSymbol;
import org.yuho.semantic.symbol.Symbol;
import org.yuho.semantic.symbol.TypeParameterSymbol;
import org.yuho.semantic.symbol.VariableSymbol;
import org.yuho.semantic.type.ErrorType;
import org.yuho.semantic.type.GenericType;
import org.yuho.semantic.type.PrimitiveType;
import org.yuho.semantic.type.RefinementType;
import org.yuho.semantic.type.StructType;
import org.yuho.semantic.type.TemporalType;
import org.yuho.semantic.type.Type;
import org.yuho.semantic.type.TypeParameterType;
import org.yuho.util.ErrorHandler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * This visitor performs the final pass, type-checking all declarations, statements and
 * expressions against the environment built by {@link SymbolTableBuilder}.
 */
public class TypeCheckVisitor implements Item.Visitor<Void>, Stmt.Visitor<Void>, Expr.Visitor<Type>
{
	private final TypeEnvironment environment;
	private final ErrorHandler errorHandler;
	private final TypeResolver resolver;
	private final ScopeStack scopes = new ScopeStack();
	private final Map<Expr, Type> resolvedTypes = new IdentityHashMap<>();

	private FunctionSymbol currentFunction;
	private List<TypeParameterSymbol> typeParameters = List.of();

	public TypeCheckVisitor(TypeEnvironment environment, ErrorHandler errorHandler, TypeResolver resolver)
	{
		this.environment = environment;
		this.errorHandler = errorHandler;
		this.resolver = resolver;
	}

	public void check(List<Item> items)
	{
		for (Item item : items)
		{
			item.accept(this);
		}
	}

	public Map<Expr, Type> getResolvedTypes()
	{
		return resolvedTypes;
	}

	private Type note(Expr expr, Type type)
	{
		resolvedTypes.put(expr, type);
		return type;
	}

	private void logError(ErrorKind kind, Span span, String msg)
	{
		errorHandler.logError(kind, span, msg);
	}

	// --- Items ---

	@Override
	public Void visitStruct(StructDecl decl)
	{
		Optional<StructSymbol> symbol = environment.getStruct(decl.name());
		if (symbol.isEmpty() || symbol.get().getDeclaration() != decl)
		{
			return null; // duplicate declaration, already reported
		}
		for (FieldSymbol field : symbol.get().getOwnFields())
		{
			for (Constraint constraint : field.constraints())
			{
				validateConstraint(constraint, field.type(), field.name());
			}
		}
		return null;
	}

	@Override
	public Void visitEnum(EnumDecl decl)
	{
		return null;
	}

	@Override
	public Void visitTypeAlias(TypeAliasDecl decl)
	{
		return null;
	}

	@Override
	public Void visitFunction(FunctionDecl decl)
	{
		Optional<FunctionSymbol> symbol = environment.getFunction(decl.name());
		if (symbol.isEmpty() || symbol.get().getDeclaration() != decl)
		{
			return null;
		}
		currentFunction = symbol.get();
		typeParameters = currentFunction.getTypeParameters();
		scopes.push();
		for (VariableSymbol param : currentFunction.getParameters())
		{
			if (scopes.define(param) == ScopeStack.DefineResult.DUPLICATE)
			{
				logError(ErrorKind.DUPLICATE_DEFINITION, param.getSpan(),
						"Parameter '" + param.getName() + "' of '" + decl.name() + "' is declared twice");
			}
		}
		for (Stmt stmt : decl.body())
		{
			stmt.accept(this);
		}
		scopes.pop();
		currentFunction = null;
		typeParameters = List.of();
		return null;
	}

	@Override
	public Void visitVariable(VariableDecl decl)
	{
		Optional<VariableSymbol> global = environment.getGlobal(decl.name());
		if (global.isEmpty() || decl.value() == null)
		{
			return null;
		}
		Type declared = global.get().getType();
		Type valueType = decl.value().accept(this);
		checkAssignable(valueType, declared, decl.span(), "Cannot initialize '" + decl.name() + "'");
		checkConstantBounds(declared, decl.value(), decl.span());
		return null;
	}

	@Override
	public Void visitLegalTest(LegalTestDecl decl)
	{
		// Requirements are resolved by the builder and judged by the legal-test engine.
		return null;
	}

	@Override
	public Void visitPrinciple(PrincipleDecl decl)
	{
		Type type = decl.body().accept(this);
		if (!isBoolean(type))
		{
			logError(ErrorKind.TYPE_MISMATCH, decl.span(),
					"Principle '" + decl.name() + "' must be a boolean statement, got '" + type.getName() + "'");
		}
		return null;
	}

	@Override
	public Void visitScope(ScopeDecl decl)
	{
		check(decl.items());
		return null;
	}

	// --- Statements ---

	@Override
	public Void visitDeclare(Stmt.Declare stmt)
	{
		VariableDecl decl = stmt.declaration();
		Type declared = resolver.resolve(decl.type(), typeParameters);
		if (decl.value() != null)
		{
			Type valueType = decl.value().accept(this);
			checkAssignable(valueType, declared, decl.span(), "Cannot initialize '" + decl.name() + "'");
			checkConstantBounds(declared, decl.value(), decl.span());
		}
		define(new VariableSymbol(decl.name(), declared, VariableSymbol.Kind.LOCAL, decl.span()));
		return null;
	}

	@Override
	public Void visitAssignment(Stmt.Assignment stmt)
	{
		Type valueType = stmt.value().accept(this);
		Optional<Type> target = lookupVariable(stmt.target());
		if (target.isEmpty())
		{
			logError(ErrorKind.UNDEFINED_SYMBOL, stmt.span(), "Cannot assign to undeclared variable '" + stmt.target() + "'");
			return null;
		}
		checkAssignable(valueType, target.get(), stmt.span(), "Cannot assign to '" + stmt.target() + "'");
		checkConstantBounds(target.get(), stmt.value(), stmt.span());
		return null;
	}

	@Override
	public Void visitReturn(Stmt.Return stmt)
	{
		Type expected = currentFunction == null ? PrimitiveType.PASS : currentFunction.getReturnType();
		if (stmt.value() == null)
		{
			if (expected != PrimitiveType.PASS && !expected.isError())
			{
				logError(ErrorKind.TYPE_MISMATCH, stmt.span(), "Missing return value of type '" + expected.getName() + "'");
			}
			return null;
		}
		Type valueType = stmt.value().accept(this);
		checkAssignable(valueType, expected, stmt.span(), "Invalid return value");
		checkConstantBounds(expected, stmt.value(), stmt.span());
		return null;
	}

	@Override
	public Void visitMatch(Stmt.Match stmt)
	{
		Type scrutinee = stmt.scrutinee().accept(this);
		for (Stmt.MatchCase matchCase : stmt.cases())
		{
			scopes.push();
			checkPattern(matchCase.pattern(), scrutinee);
			checkGuard(matchCase.guard());
			for (Stmt inner : matchCase.body())
			{
				inner.accept(this);
			}
			scopes.pop();
		}
		return null;
	}

	@Override
	public Void visitIf(Stmt.If stmt)
	{
		Type condition = stmt.condition().accept(this);
		if (!isBoolean(condition))
		{
			logError(ErrorKind.TYPE_MISMATCH, stmt.condition().span(), "Condition must be 'bool', got '" + condition.getName() + "'");
		}
		checkBlock(stmt.thenBranch());
		if (stmt.elseBranch() != null)
		{
			checkBlock(stmt.elseBranch());
		}
		return null;
	}

	@Override
	public Void visitPass(Stmt.Pass stmt)
	{
		return null;
	}

	private void checkBlock(List<Stmt> block)
	{
		scopes.push();
		for (Stmt stmt : block)
		{
			stmt.accept(this);
		}
		scopes.pop();
	}

	// --- Expressions ---

	@Override
	public Type visitLiteral(Expr.Literal expr)
	{
		Type type = switch (expr.kind())
		{
			case INT -> PrimitiveType.INT;
			case FLOAT -> PrimitiveType.FLOAT;
			case BOOL -> PrimitiveType.BOOL;
			case STRING -> PrimitiveType.STRING;
			case MONEY -> PrimitiveType.MONEY;
			case PERCENT -> PrimitiveType.PERCENT;
			case DATE -> PrimitiveType.DATE;
			case DURATION -> PrimitiveType.DURATION;
			case PASS -> PrimitiveType.PASS;
		};
		if (expr.kind() == Expr.LiteralKind.DATE && DateParser.parse(expr.text()).isEmpty())
		{
			logError(ErrorKind.TYPE_MISMATCH, expr.span(),
					"Invalid date literal '" + expr.text() + "', expected " + DateParser.EXPECTED_FORMATS);
		}
		return note(expr, type);
	}

	@Override
	public Type visitIdentifier(Expr.Identifier expr)
	{
		Optional<Type> variable = lookupVariable(expr.name());
		if (variable.isPresent())
		{
			return note(expr, variable.get());
		}
		Optional<EnumSymbol> owner = environment.findEnumByVariant(expr.name());
		if (owner.isPresent())
		{
			return note(expr, owner.get().getType());
		}
		logError(ErrorKind.UNDEFINED_SYMBOL, expr.span(), "Undefined variable '" + expr.name() + "'");
		return note(expr, ErrorType.INSTANCE);
	}

	@Override
	public Type visitBinary(Expr.Binary expr)
	{
		Type left = expr.left().accept(this);
		Type right = expr.right().accept(this);
		if (left.isError() || right.isError())
		{
			return note(expr, ErrorType.INSTANCE);
		}
		Expr.BinaryOp op = expr.op();
		Type l = left.unwrap();
		Type r = right.unwrap();

		if (op.isArithmetic())
		{
			Optional<Type> temporal = temporalArithmetic(op, l, r);
			if (temporal.isPresent())
			{
				return note(expr, temporal.get());
			}
			if (l.isNumeric() && r.isNumeric())
			{
				return note(expr, widen(l, r));
			}
			return note(expr, operatorMismatch(expr, "numeric", left, right));
		}

		if (op.isLogical())
		{
			if (l.isBoolean() && r.isBoolean())
			{
				return note(expr, PrimitiveType.BOOL);
			}
			return note(expr, operatorMismatch(expr, "boolean", left, right));
		}

		// Comparisons
		boolean compatible = Type.isAssignable(left, right) || Type.isAssignable(right, left);
		if (op == Expr.BinaryOp.EQ || op == Expr.BinaryOp.NE)
		{
			if (compatible)
			{
				return note(expr, PrimitiveType.BOOL);
			}
			return note(expr, operatorMismatch(expr, "compatible", left, right));
		}
		if (compatible && isOrdered(l) && isOrdered(r))
		{
			return note(expr, PrimitiveType.BOOL);
		}
		return note(expr, operatorMismatch(expr, "ordered, compatible", left, right));
	}

	private Type operatorMismatch(Expr.Binary expr, String requirement, Type left, Type right)
	{
		logError(ErrorKind.TYPE_MISMATCH, expr.span(), "Operator '" + expr.op().getSymbol() + "' requires " + requirement
				+ " operands, got '" + left.getName() + "' and '" + right.getName() + "'");
		return ErrorType.INSTANCE;
	}

	private static Optional<Type> temporalArithmetic(Expr.BinaryOp op, Type l, Type r)
	{
		boolean additive = op == Expr.BinaryOp.ADD || op == Expr.BinaryOp.SUB;
		if (!additive)
		{
			return Optional.empty();
		}
		if (l == PrimitiveType.DATE && r == PrimitiveType.DATE && op == Expr.BinaryOp.SUB)
		{
			return Optional.of(PrimitiveType.DURATION);
		}
		if (l == PrimitiveType.DATE && r == PrimitiveType.DURATION)
		{
			return Optional.of(PrimitiveType.DATE);
		}
		if (l == PrimitiveType.DURATION && r == PrimitiveType.DURATION)
		{
			return Optional.of(PrimitiveType.DURATION);
		}
		return Optional.empty();
	}

	private static Type widen(Type l, Type r)
	{
		return rank(l) >= rank(r) ? l : r;
	}

	private static int rank(Type type)
	{
		if (type == PrimitiveType.MONEY)
		{
			return 3;
		}
		if (type == PrimitiveType.PERCENT)
		{
			return 2;
		}
		if (type == PrimitiveType.FLOAT)
		{
			return 1;
		}
		return 0;
	}

	private static boolean isOrdered(Type type)
	{
		return type instanceof PrimitiveType primitive && primitive.isComparable();
	}

	@Override
	public Type visitUnary(Expr.Unary expr)
	{
		Type operand = expr.operand().accept(this);
		if (operand.isError())
		{
			return note(expr, ErrorType.INSTANCE);
		}
		if (expr.op() == Expr.UnaryOp.NOT)
		{
			if (operand.unwrap().isBoolean())
			{
				return note(expr, PrimitiveType.BOOL);
			}
			logError(ErrorKind.TYPE_MISMATCH, expr.span(), "Operator '!' requires a boolean operand, got '" + operand.getName() + "'");
			return note(expr, ErrorType.INSTANCE);
		}
		if (operand.unwrap().isNumeric())
		{
			return note(expr, operand.unwrap());
		}
		logError(ErrorKind.TYPE_MISMATCH, expr.span(), "Unary '-' requires a numeric operand, got '" + operand.getName() + "'");
		return note(expr, ErrorType.INSTANCE);
	}

	@Override
	public Type visitCall(Expr.Call expr)
	{
		List<Type> argTypes = new ArrayList<>();
		for (Expr arg : expr.arguments())
		{
			argTypes.add(arg.accept(this));
		}
		Optional<FunctionSymbol> function = environment.getFunction(expr.function());
		if (function.isEmpty())
		{
			logError(ErrorKind.UNDEFINED_SYMBOL, expr.span(), "Undefined function '" + expr.function() + "'");
			return note(expr, ErrorType.INSTANCE);
		}
		List<VariableSymbol> params = function.get().getParameters();
		if (params.size() != argTypes.size())
		{
			logError(ErrorKind.TYPE_MISMATCH, expr.span(), "Function '" + expr.function() + "' expects " + params.size()
					+ " argument(s), got " + argTypes.size());
			return note(expr, function.get().getReturnType());
		}

		Map<TypeParameterSymbol, Type> bindings = new HashMap<>();
		for (int i = 0; i < params.size(); i++)
		{
			Type paramType = params.get(i).getType();
			if (paramType instanceof TypeParameterType typeParam && !argTypes.get(i).isError())
			{
				bindings.putIfAbsent(typeParam.getSymbol(), argTypes.get(i));
			}
			Type expected = GenericType.substitute(paramType, bindings);
			if (!Type.isAssignable(argTypes.get(i), expected))
			{
				logError(ErrorKind.TYPE_MISMATCH, expr.arguments().get(i).span(), "Argument " + (i + 1) + " of '" + expr.function()
						+ "' expects '" + expected.getName() + "', got '" + argTypes.get(i).getName() + "'");
			}
		}
		return note(expr, GenericType.substitute(function.get().getReturnType(), bindings));
	}

	@Override
	public Type visitFieldAccess(Expr.FieldAccess expr)
	{
		// Enum.Variant, unless the name is shadowed by a variable
		if (expr.target() instanceof Expr.Identifier id && lookupVariable(id.name()).isEmpty())
		{
			Optional<EnumSymbol> enumSymbol = environment.getEnum(id.name());
			if (enumSymbol.isPresent())
			{
				note(id, enumSymbol.get().getType());
				if (!enumSymbol.get().hasVariant(expr.field()))
				{
					logError(ErrorKind.UNDEFINED_SYMBOL, expr.span(), "Enum '" + id.name() + "' has no variant '" + expr.field() + "'");
					return note(expr, ErrorType.INSTANCE);
				}
				return note(expr, enumSymbol.get().getType());
			}
		}

		Type target = expr.target().accept(this);
		Type unwrapped = target.unwrap();
		if (unwrapped.isError())
		{
			return note(expr, ErrorType.INSTANCE);
		}
		List<FieldSymbol> fields;
		if (unwrapped instanceof StructType struct)
		{
			fields = struct.getFields();
		}
		else if (unwrapped instanceof GenericType generic)
		{
			fields = generic.getFields();
		}
		else
		{
			logError(ErrorKind.TYPE_MISMATCH, expr.span(), "Type '" + target.getName() + "' has no fields");
			return note(expr, ErrorType.INSTANCE);
		}
		for (FieldSymbol field : fields)
		{
			if (field.name().equals(expr.field()))
			{
				return note(expr, field.type());
			}
		}
		logError(ErrorKind.INVALID_FIELD, expr.span(), "Struct '" + unwrapped.getName() + "' has no field '" + expr.field() + "'");
		return note(expr, ErrorType.INSTANCE);
	}

	@Override
	public Type visitStructInit(Expr.StructInit expr)
	{
		Optional<StructSymbol> lookup = environment.getStruct(expr.typeName());
		if (lookup.isEmpty())
		{
			for (Expr.FieldInit init : expr.fields())
			{
				init.value().accept(this);
			}
			logError(ErrorKind.UNDEFINED_SYMBOL, expr.span(), "Undefined struct '" + expr.typeName() + "'");
			return note(expr, ErrorType.INSTANCE);
		}
		StructSymbol struct = lookup.get();
		Map<TypeParameterSymbol, Type> bindings = new HashMap<>();
		Set<String> provided = new HashSet<>();

		for (Expr.FieldInit init : expr.fields())
		{
			Type valueType = init.value().accept(this);
			if (!provided.add(init.name()))
			{
				logError(ErrorKind.DUPLICATE_DEFINITION, init.span(), "Field '" + init.name() + "' is initialized twice");
				continue;
			}
			Optional<FieldSymbol> field = struct.findField(init.name());
			if (field.isEmpty())
			{
				logError(ErrorKind.INVALID_FIELD, init.span(), "Struct '" + struct.getName() + "' has no field '" + init.name() + "'");
				continue;
			}
			Type fieldType = field.get().type();
			if (fieldType instanceof TypeParameterType typeParam && !valueType.isError())
			{
				bindings.putIfAbsent(typeParam.getSymbol(), valueType);
			}
			fieldType = GenericType.substitute(fieldType, bindings);
			checkAssignable(valueType, fieldType, init.span(), "Field '" + init.name() + "' of '" + struct.getName() + "'");
			checkConstantBounds(fieldType, init.value(), init.span());
			checkFieldConstraints(field.get(), init.value(), init.span());
		}

		for (FieldSymbol field : struct.getEffectiveFields())
		{
			if (!provided.contains(field.name()))
			{
				logError(ErrorKind.MISSING_FIELD, expr.span(),
						"Missing field '" + field.name() + "' in initialization of '" + struct.getName() + "'");
			}
		}

		if (!struct.isGeneric())
		{
			return note(expr, struct.getType());
		}
		List<Type> args = new ArrayList<>();
		for (TypeParameterSymbol param : struct.getTypeParameters())
		{
			args.add(bindings.getOrDefault(param, ErrorType.INSTANCE));
		}
		return note(expr, new GenericType(struct, args));
	}

	@Override
	public Type visitMatch(Expr.Match expr)
	{
		Type scrutinee = expr.scrutinee().accept(this);
		Type result = null;
		for (Expr.MatchArm arm : expr.arms())
		{
			scopes.push();
			checkPattern(arm.pattern(), scrutinee);
			checkGuard(arm.guard());
			Type armType = arm.consequence().accept(this);
			scopes.pop();

			if (result == null || result.isError())
			{
				result = armType;
			}
			else if (!Type.isAssignable(armType, result) && !Type.isAssignable(result, armType))
			{
				logError(ErrorKind.TYPE_MISMATCH, arm.span(), "Match arm yields '" + armType.getName()
						+ "' but earlier arms yield '" + result.getName() + "'");
			}
		}
		return note(expr, result == null ? PrimitiveType.PASS : result);
	}

	@Override
	public Type visitQuantified(Expr.Quantified expr)
	{
		Type boundType = resolver.resolveQuantifierType(expr.variableType(), typeParameters);
		scopes.push();
		define(new VariableSymbol(expr.variable(), boundType, VariableSymbol.Kind.QUANTIFIED, expr.span()));
		Type body = expr.body().accept(this);
		scopes.pop();
		if (!isBoolean(body))
		{
			String keyword = expr.kind() == Expr.QuantifierKind.FORALL ? "forall" : "exists";
			logError(ErrorKind.TYPE_MISMATCH, expr.body().span(), "Body of '" + keyword + " " + expr.variable()
					+ "' must be boolean, got '" + body.getName() + "'");
		}
		return note(expr, PrimitiveType.BOOL);
	}

	// --- Helpers ---

	private Optional<Type> lookupVariable(String name)
	{
		Optional<Symbol> local = scopes.resolve(name);
		if (local.isPresent())
		{
			return Optional.ofNullable(local.get().getType());
		}
		return environment.getGlobal(name).map(VariableSymbol::getType);
	}

	private void define(VariableSymbol variable)
	{
		switch (scopes.define(variable))
		{
			case DUPLICATE -> logError(ErrorKind.DUPLICATE_DEFINITION, variable.getSpan(),
					"Variable '" + variable.getName() + "' is already defined in this scope");
			case SHADOWS -> errorHandler.logWarning(variable.getSpan(),
					"'" + variable.getName() + "' shadows an outer binding");
			default ->
			{
			}
		}
	}

	private void checkPattern(Pattern pattern, Type scrutinee)
	{
		if (pattern instanceof Pattern.Literal literal)
		{
			Type type = literal.value().accept(this);
			if (!Type.isAssignable(type, scrutinee) && !Type.isAssignable(scrutinee, type))
			{
				logError(ErrorKind.TYPE_MISMATCH, pattern.span(), "Pattern of type '" + type.getName()
						+ "' can never match a value of type '" + scrutinee.getName() + "'");
			}
		}
		else if (pattern instanceof Pattern.Binding binding)
		{
			define(new VariableSymbol(binding.name(), scrutinee, VariableSymbol.Kind.PATTERN, binding.span()));
		}
	}

	private void checkGuard(Expr guard)
	{
		if (guard == null)
		{
			return;
		}
		Type type = guard.accept(this);
		if (!isBoolean(type))
		{
			logError(ErrorKind.TYPE_MISMATCH, guard.span(), "Match guard must be 'bool', got '" + type.getName() + "'");
		}
	}

	private static boolean isBoolean(Type type)
	{
		return type.isError() || type.unwrap().isBoolean();
	}

	private void checkAssignable(Type from, Type to, Span span, String context)
	{
		if (!Type.isAssignable(from, to))
		{
			logError(ErrorKind.TYPE_MISMATCH, span, context + ": expected '" + to.getName() + "', got '" + from.getName() + "'");
		}
	}

	/**
	 * A constant stored in a refinement type must lie inside its range.
	 */
	private void checkConstantBounds(Type declared, Expr value, Span span)
	{
		Type type = declared;
		while (type instanceof TemporalType temporal)
		{
			type = temporal.getInner();
		}
		if (!(type instanceof RefinementType refinement))
		{
			return;
		}
		Optional<ConstantEvaluator.Value> constant = ConstantEvaluator.evaluate(value);
		if (constant.isPresent() && constant.get().isNumeric() && !refinement.contains(constant.get().number()))
		{
			logError(ErrorKind.OUT_OF_BOUNDS, span, "Value " + constant.get().render() + " is outside the range "
					+ refinement.describeRange() + " of '" + refinement.getName() + "'");
		}
	}

	private void checkFieldConstraints(FieldSymbol field, Expr value, Span span)
	{
		Optional<ConstantEvaluator.Value> constant = ConstantEvaluator.evaluate(value);
		if (constant.isEmpty())
		{
			return;
		}
		for (Constraint constraint : field.constraints())
		{
			if (!ConstantEvaluator.satisfies(constraint, constant.get()))
			{
				logError(ErrorKind.CONSTRAINT_VIOLATION, span, "Value " + constant.get().render() + " for field '" + field.name()
						+ "' violates constraint '" + describe(constraint) + "' declared in '" + field.owner() + "'");
			}
		}
	}

	private void validateConstraint(Constraint constraint, Type type, String fieldName)
	{
		if (type.isError())
		{
			return;
		}
		Type base = type.unwrap();
		if (constraint instanceof Constraint.Comparison comparison)
		{
			comparison.value().accept(this);
			if (!isOrdered(base))
			{
				invalidConstraint(constraint, type, fieldName);
			}
		}
		else if (constraint instanceof Constraint.InRange range)
		{
			range.min().accept(this);
			range.max().accept(this);
			if (!base.isNumeric())
			{
				invalidConstraint(constraint, type, fieldName);
			}
		}
		else if (constraint instanceof Constraint.And and)
		{
			validateConstraint(and.left(), type, fieldName);
			validateConstraint(and.right(), type, fieldName);
		}
		else if (constraint instanceof Constraint.Or or)
		{
			validateConstraint(or.left(), type, fieldName);
			validateConstraint(or.right(), type, fieldName);
		}
		else if (constraint instanceof Constraint.Not not)
		{
			validateConstraint(not.inner(), type, fieldName);
		}
		else if (constraint instanceof Constraint.Before || constraint instanceof Constraint.After
				|| constraint instanceof Constraint.Between)
		{
			if (!type.isDate())
			{
				invalidConstraint(constraint, type, fieldName);
			}
		}
	}

	private void invalidConstraint(Constraint constraint, Type type, String fieldName)
	{
		logError(ErrorKind.INVALID_CONSTRAINT, constraint.span(), "Constraint '" + describe(constraint)
				+ "' on field '" + fieldName + "' is not supported for type '" + type.getName() + "'");
	}

	static String describe(Constraint constraint)
	{
		if (constraint instanceof Constraint.Comparison c)
		{
			return c.comparator().getSymbol() + " " + render(c.value());
		}
		if (constraint instanceof Constraint.InRange r)
		{
			return "in range " + render(r.min()) + ".." + render(r.max());
		}
		if (constraint instanceof Constraint.Between b)
		{
			return "between " + render(b.start()) + " and " + render(b.end());
		}
		if (constraint instanceof Constraint.Before b)
		{
			return "before " + render(b.date());
		}
		if (constraint instanceof Constraint.After a)
		{
			return "after " + render(a.date());
		}
		if (constraint instanceof Constraint.And a)
		{
			return "(" + describe(a.left()) + ") and (" + describe(a.right()) + ")";
		}
		if (constraint instanceof Constraint.Or o)
		{
			return "(" + describe(o.left()) + ") or (" + describe(o.right()) + ")";
		}
		if (constraint instanceof Constraint.Not n)
		{
			return "not (" + describe(n.inner()) + ")";
		}
		return ((Constraint.Custom) constraint).name();
	}

	private static String render(Expr expr)
	{
		return ConstantEvaluator.evaluate(expr).map(ConstantEvaluator.Value::render).orElse("<expr>");
	}
}
