package org.yuho.semantic;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of {@link TypeChecker#check}: a typed program, or every error found. The environment is
 * exposed either way so later passes can keep reporting on a failed unit.
 */
public final class CheckResult
{
	private final TypedProgram program;
	private final List<SemanticError> errors;

	private CheckResult(TypedProgram program, List<SemanticError> errors)
	{
		this.program = program;
		this.errors = List.copyOf(errors);
	}

	static CheckResult of(TypedProgram program, List<SemanticError> errors)
	{
		return new CheckResult(program, errors);
	}

	public boolean isSuccess()
	{
		return errors.isEmpty();
	}

	public Optional<TypedProgram> getTypedProgram()
	{
		return isSuccess() ? Optional.of(program) : Optional.empty();
	}

	/**
	 * The checked program whether or not it has errors. Only for passes that tolerate errors.
	 */
	public TypedProgram getCheckedProgram()
	{
		return program;
	}

	public TypeEnvironment getEnvironment()
	{
		return program.getEnvironment();
	}

	public List<SemanticError> getErrors()
	{
		return errors;
	}

	public List<String> getWarnings()
	{
		return program.getWarnings();
	}

	public boolean hasError(ErrorKind kind)
	{
		return errors.stream().anyMatch(e -> e.kind() == kind);
	}
}
