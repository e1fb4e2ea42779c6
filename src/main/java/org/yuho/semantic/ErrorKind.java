package org.yuho.semantic;

/**
 * Every kind of diagnostic the core can report. The display name is the
 * stable identifier tools match on.
 */
public enum ErrorKind
{
	UNBOUND_TYPE_VARIABLE("UnboundTypeVariableError"),
	ARITY_MISMATCH("ArityMismatchError"),
	DUPLICATE_FIELD("DuplicateFieldError"),
	CIRCULAR_INHERITANCE("CircularInheritanceError"),
	OUT_OF_BOUNDS("OutOfBoundsError"),
	INVALID_CITATION("InvalidCitationError"),
	INVALID_TEMPORAL_WINDOW("InvalidTemporalWindowError"),
	NON_BOOLEAN_REQUIREMENT("NonBooleanRequirementError"),
	NON_EXHAUSTIVE_MATCH("NonExhaustiveMatchError"),
	AMBIGUOUS_VARIANT_PATH("AmbiguousVariantPathError"),
	QUANTIFIER_DEPTH_EXCEEDED("QuantifierDepthExceededError"),
	UNBOUND_QUANTIFIER_TYPE("UnboundQuantifierType"),
	CONFLICT_DETECTED("ConflictDetected"),
	UNDEFINED_SYMBOL("UndefinedSymbolError"),
	DUPLICATE_DEFINITION("DuplicateDefinitionError"),
	TYPE_MISMATCH("TypeMismatchError"),
	INVALID_FIELD("InvalidFieldError"),
	MISSING_FIELD("MissingFieldError"),
	UNREACHABLE_CASE("UnreachableCaseError"),
	CONSTRAINT_VIOLATION("ConstraintViolationError"),
	INVALID_CONSTRAINT("InvalidConstraintError"),
	UNSUPPORTED_EXPRESSION("UnsupportedExpressionError");

	private final String displayName;

	ErrorKind(String displayName)
	{
		this.displayName = displayName;
	}

	public String getDisplayName()
	{
		return displayName;
	}

	@Override
	public String toString()
	{
		return displayName;
	}
}
