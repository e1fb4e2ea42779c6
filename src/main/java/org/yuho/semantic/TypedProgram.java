package org.yuho.semantic;

import org.yuho.ast.Program;
import org.yuho.ast.decl.PrincipleDecl;
import org.yuho.ast.expr.Expr;
import org.yuho.semantic.type.Type;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A program that passed the type checker, with the environment built for it and the type of
 * every checked expression (keyed by node identity).
 */
public final class TypedProgram
{
	private final Program program;
	private final TypeEnvironment environment;
	private final Map<Expr, Type> expressionTypes;
	private final List<PrincipleDecl> principles;
	private final List<String> warnings;

	public TypedProgram(Program program, TypeEnvironment environment, Map<Expr, Type> expressionTypes,
						List<PrincipleDecl> principles, List<String> warnings)
	{
		this.program = program;
		this.environment = environment;
		this.expressionTypes = Collections.unmodifiableMap(new IdentityHashMap<>(expressionTypes));
		this.principles = List.copyOf(principles);
		this.warnings = List.copyOf(warnings);
	}

	public String getName()
	{
		return program.name();
	}

	public Program getProgram()
	{
		return program;
	}

	public TypeEnvironment getEnvironment()
	{
		return environment;
	}

	public Optional<Type> typeOf(Expr expr)
	{
		return Optional.ofNullable(expressionTypes.get(expr));
	}

	public List<PrincipleDecl> getPrinciples()
	{
		return principles;
	}

	public Optional<PrincipleDecl> findPrinciple(String name)
	{
		return principles.stream().filter(p -> p.name().equals(name)).findFirst();
	}

	public List<String> getWarnings()
	{
		return warnings;
	}
}
