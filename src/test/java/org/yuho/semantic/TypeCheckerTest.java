package org.yuho.semantic;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.yuho.TestPrograms;
import org.yuho.ast.Program;
import org.yuho.semantic.symbol.FieldSymbol;
import org.yuho.semantic.symbol.StructSymbol;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TypeCheckerTest
{
	private static final String BOX = """
			{"kind":"struct","name":"Box","typeParams":["T"],"fields":[{"name":"value","type":"T"}]}""";

	private final TypeChecker checker = new TypeChecker();

	private CheckResult check(String... items)
	{
		return checker.check(TestPrograms.program("test", items));
	}

	private static List<ErrorKind> kinds(CheckResult result)
	{
		return result.getErrors().stream().map(SemanticError::kind).collect(Collectors.toList());
	}

	private static String declaration(String name, String type)
	{
		return "{\"kind\":\"declaration\",\"name\":\"" + name + "\",\"type\":" + type + "}";
	}

	private static String declaration(String name, String type, String value)
	{
		return "{\"kind\":\"declaration\",\"name\":\"" + name + "\",\"type\":" + type + ",\"value\":" + value + "}";
	}

	// --- Generics ---

	@Test
	void genericStructWithMatchingArity()
	{
		CheckResult result = check(BOX, declaration("b", "{\"kind\":\"generic\",\"name\":\"Box\",\"args\":[\"int\"]}"));
		assertTrue(result.isSuccess(), () -> result.getErrors().toString());
		assertTrue(result.getTypedProgram().isPresent());
	}

	@Test
	void genericStructWithTooManyArguments()
	{
		CheckResult result = check(BOX, declaration("b", "{\"kind\":\"generic\",\"name\":\"Box\",\"args\":[\"int\",\"string\"]}"));
		assertEquals(List.of(ErrorKind.ARITY_MISMATCH), kinds(result));
		assertEquals("Type 'Box' expects 1 type argument(s) but got 2", result.getErrors().get(0).message());
		assertTrue(result.getTypedProgram().isEmpty());
	}

	@ParameterizedTest
	@ValueSource(ints = {0, 1, 2, 3})
	void arityMustMatchDeclaredParameters(int k)
	{
		String pair = "{\"kind\":\"struct\",\"name\":\"Pair\",\"typeParams\":[\"A\",\"B\"],"
				+ "\"fields\":[{\"name\":\"first\",\"type\":\"A\"},{\"name\":\"second\",\"type\":\"B\"}]}";
		String args = String.join(",", java.util.Collections.nCopies(k, "\"int\""));
		CheckResult result = check(pair, declaration("p", "{\"kind\":\"generic\",\"name\":\"Pair\",\"args\":[" + args + "]}"));
		if (k == 2)
		{
			assertTrue(result.isSuccess(), () -> result.getErrors().toString());
		}
		else
		{
			assertEquals(List.of(ErrorKind.ARITY_MISMATCH), kinds(result));
			assertTrue(result.getErrors().get(0).message().endsWith("expects 2 type argument(s) but got " + k));
		}
	}

	@Test
	void typeArgumentsOnNonGenericStruct()
	{
		CheckResult result = check("{\"kind\":\"struct\",\"name\":\"Plain\",\"fields\":[{\"name\":\"x\",\"type\":\"int\"}]}",
				declaration("p", "{\"kind\":\"generic\",\"name\":\"Plain\",\"args\":[\"int\"]}"));
		assertEquals("Type 'Plain' expects 0 type argument(s) but got 1", result.getErrors().get(0).message());
	}

	@Test
	void undeclaredTypeVariableInField()
	{
		CheckResult result = check("{\"kind\":\"struct\",\"name\":\"Holder\",\"fields\":[{\"name\":\"item\",\"type\":\"T\"}]}");
		assertEquals(List.of(ErrorKind.UNBOUND_TYPE_VARIABLE), kinds(result));
		assertTrue(result.getErrors().get(0).message().contains("'T'"));
	}

	@Test
	void genericFieldAccessIsSubstituted()
	{
		CheckResult result = check(BOX,
				declaration("b", "{\"kind\":\"generic\",\"name\":\"Box\",\"args\":[\"int\"]}"),
				declaration("n", "\"int\"", "{\"kind\":\"field\",\"target\":{\"kind\":\"ident\",\"name\":\"b\"},\"field\":\"value\"}"));
		assertTrue(result.isSuccess(), () -> result.getErrors().toString());
	}

	// --- Inheritance ---

	@Test
	void childInheritsParentFieldsFirst()
	{
		CheckResult result = checker.check(TestPrograms.load("statute_theft"));
		assertTrue(result.isSuccess(), () -> result.getErrors().toString());

		StructSymbol theft = result.getEnvironment().getStruct("Theft").orElseThrow();
		List<String> names = theft.getEffectiveFields().stream().map(FieldSymbol::name).collect(Collectors.toList());
		assertEquals(List.of("property_involved", "value", "dishonest_intent", "moved"), names);
		assertEquals("DishonestAct", theft.findField("value").orElseThrow().owner());
	}

	@Test
	void effectiveFieldSetIsUnionWithoutRepeats()
	{
		CheckResult result = check(
				"{\"kind\":\"struct\",\"name\":\"Base\",\"fields\":[{\"name\":\"a\",\"type\":\"int\"}]}",
				"{\"kind\":\"struct\",\"name\":\"Mid\",\"parent\":\"Base\",\"fields\":[{\"name\":\"b\",\"type\":\"bool\"}]}",
				"{\"kind\":\"struct\",\"name\":\"Leaf\",\"parent\":\"Mid\",\"fields\":[{\"name\":\"c\",\"type\":\"string\"}]}");
		assertTrue(result.isSuccess(), () -> result.getErrors().toString());

		TypeEnvironment env = result.getEnvironment();
		for (StructSymbol struct : env.getStructs())
		{
			List<String> names = struct.getEffectiveFields().stream().map(FieldSymbol::name).collect(Collectors.toList());
			assertEquals(names.size(), names.stream().distinct().count());
			if (struct.hasParent())
			{
				StructSymbol parent = (StructSymbol) env.getById(struct.getParentId());
				for (FieldSymbol field : parent.getEffectiveFields())
				{
					assertTrue(names.contains(field.name()), field.name() + " missing from " + struct.getName());
				}
			}
		}
		assertEquals(3, env.getStruct("Leaf").orElseThrow().getEffectiveFields().size());
	}

	@Test
	void inheritedFieldRedeclaredIsDuplicate()
	{
		CheckResult result = check(
				"{\"kind\":\"struct\",\"name\":\"DishonestAct\",\"fields\":[{\"name\":\"property_involved\",\"type\":\"bool\"}]}",
				"{\"kind\":\"struct\",\"name\":\"Theft\",\"parent\":\"DishonestAct\",\"fields\":["
						+ "{\"name\":\"dishonest_intent\",\"type\":\"bool\"},{\"name\":\"property_involved\",\"type\":\"bool\"}]}");
		assertEquals(List.of(ErrorKind.DUPLICATE_FIELD), kinds(result));
		assertTrue(result.getErrors().get(0).message().contains("'property_involved'"));
	}

	@Test
	void cyclicParentsAreCircular()
	{
		CheckResult result = check(
				"{\"kind\":\"struct\",\"name\":\"A\",\"parent\":\"B\",\"fields\":[]}",
				"{\"kind\":\"struct\",\"name\":\"B\",\"parent\":\"A\",\"fields\":[]}");
		assertFalse(result.isSuccess());
		assertTrue(kinds(result).stream().allMatch(k -> k == ErrorKind.CIRCULAR_INHERITANCE), kinds(result)::toString);
	}

	@Test
	void selfParentIsCircular()
	{
		CheckResult result = check("{\"kind\":\"struct\",\"name\":\"Loop\",\"parent\":\"Loop\",\"fields\":[]}");
		assertEquals(List.of(ErrorKind.CIRCULAR_INHERITANCE), kinds(result));
	}

	@Test
	void unknownParentIsUndefined()
	{
		CheckResult result = check("{\"kind\":\"struct\",\"name\":\"Orphan\",\"parent\":\"Nobody\",\"fields\":[]}");
		assertEquals(List.of(ErrorKind.UNDEFINED_SYMBOL), kinds(result));
	}

	@Test
	void inheritedConstraintAppliesToChildLiteral()
	{
		String parent = "{\"kind\":\"struct\",\"name\":\"Act\",\"fields\":[{\"name\":\"fine\",\"type\":\"int\","
				+ "\"constraints\":[{\"kind\":\">=\",\"value\":{\"kind\":\"int\",\"value\":\"0\"}}]}]}";
		String child = "{\"kind\":\"struct\",\"name\":\"Fraud\",\"parent\":\"Act\",\"fields\":[{\"name\":\"victim\",\"type\":\"string\"}]}";
		String init = "{\"kind\":\"structInit\",\"type\":\"Fraud\",\"fields\":["
				+ "{\"name\":\"fine\",\"value\":{\"kind\":\"unary\",\"op\":\"-\",\"operand\":{\"kind\":\"int\",\"value\":\"5\"}}},"
				+ "{\"name\":\"victim\",\"value\":{\"kind\":\"string\",\"value\":\"Ann\"}}]}";
		CheckResult result = check(parent, child, declaration("f", "\"Fraud\"", init));
		assertEquals(List.of(ErrorKind.CONSTRAINT_VIOLATION), kinds(result));
		assertTrue(result.getErrors().get(0).message().contains("'Act'"));
	}

	// --- Refinements ---

	@ParameterizedTest
	@CsvSource({"0,10,true", "5,5,true", "-3,3,true", "10,0,false", "1.5,1.25,false"})
	void refinementBoundsMustBeOrdered(String lower, String upper, boolean valid)
	{
		CheckResult result = check(declaration("r",
				"{\"kind\":\"bounded\",\"base\":\"float\",\"lower\":" + lower + ",\"upper\":" + upper + "}"));
		if (valid)
		{
			assertTrue(result.isSuccess(), () -> result.getErrors().toString());
		}
		else
		{
			assertEquals(List.of(ErrorKind.OUT_OF_BOUNDS), kinds(result));
		}
	}

	@ParameterizedTest
	@CsvSource({"0,true", "150,true", "75,true", "151,false", "-1,false"})
	void refinementBoundsCheckedOnAssignment(int value, boolean valid)
	{
		String literal = value < 0
				? "{\"kind\":\"unary\",\"op\":\"-\",\"operand\":{\"kind\":\"int\",\"value\":\"" + (-value) + "\"}}"
				: "{\"kind\":\"int\",\"value\":\"" + value + "\"}";
		CheckResult result = check(declaration("age", "{\"kind\":\"bounded\",\"lower\":0,\"upper\":150}", literal));
		assertEquals(valid, result.isSuccess(), () -> result.getErrors().toString());
		if (!valid)
		{
			assertEquals(List.of(ErrorKind.OUT_OF_BOUNDS), kinds(result));
		}
	}

	@Test
	void positiveRequiresNumericBase()
	{
		CheckResult result = check(declaration("p", "{\"kind\":\"positive\",\"inner\":\"string\"}"));
		assertEquals(List.of(ErrorKind.INVALID_CONSTRAINT), kinds(result));
	}

	// --- Domain types ---

	@Test
	void citationPartsMustBeNonEmpty()
	{
		CheckResult ok = check(declaration("c", "{\"kind\":\"citation\",\"section\":\"415\",\"subsection\":\"1\",\"act\":\"Penal Code\"}"));
		assertTrue(ok.isSuccess(), () -> ok.getErrors().toString());

		CheckResult bad = check(declaration("c", "{\"kind\":\"citation\",\"section\":\"415\",\"subsection\":\"\",\"act\":\"\"}"));
		assertEquals(List.of(ErrorKind.INVALID_CITATION, ErrorKind.INVALID_CITATION), kinds(bad));
	}

	@ParameterizedTest
	@CsvSource({
			"01-01-2020, 31-12-2020, true",
			"2020-01-01, 2021-01-01, true",
			"01/15/2020, 2020-02-01, true",
			"2021-01-01, 2020-01-01, false",
			"2020-01-01, 2020-01-01, false",
			"2020-13-45, 2021-01-01, false"
	})
	void temporalWindowMustBeOrdered(String from, String until, boolean valid)
	{
		CheckResult result = check(declaration("t",
				"{\"kind\":\"temporal\",\"inner\":\"int\",\"validFrom\":\"" + from + "\",\"validUntil\":\"" + until + "\"}"));
		if (valid)
		{
			assertTrue(result.isSuccess(), () -> result.getErrors().toString());
		}
		else
		{
			assertEquals(List.of(ErrorKind.INVALID_TEMPORAL_WINDOW), kinds(result));
		}
	}

	@Test
	void openTemporalWindowIsAccepted()
	{
		CheckResult result = check(declaration("t", "{\"kind\":\"temporal\",\"inner\":\"money\",\"validFrom\":\"2019-06-01\"}"));
		assertTrue(result.isSuccess(), () -> result.getErrors().toString());
	}

	// --- Symbols and expressions ---

	@Test
	void duplicateTopLevelNames()
	{
		CheckResult result = check(
				"{\"kind\":\"struct\",\"name\":\"Dup\",\"fields\":[]}",
				"{\"kind\":\"enum\",\"name\":\"Dup\",\"variants\":[\"A\"]}");
		assertEquals(List.of(ErrorKind.DUPLICATE_DEFINITION), kinds(result));
	}

	@Test
	void structInitReportsMissingAndUnknownFields()
	{
		String struct = "{\"kind\":\"struct\",\"name\":\"Person\",\"fields\":[{\"name\":\"name\",\"type\":\"string\"},{\"name\":\"age\",\"type\":\"int\"}]}";
		String init = "{\"kind\":\"structInit\",\"type\":\"Person\",\"fields\":["
				+ "{\"name\":\"name\",\"value\":{\"kind\":\"string\",\"value\":\"Bo\"}},"
				+ "{\"name\":\"height\",\"value\":{\"kind\":\"int\",\"value\":\"180\"}}]}";
		CheckResult result = check(struct, declaration("p", "\"Person\"", init));
		assertTrue(result.hasError(ErrorKind.INVALID_FIELD));
		assertTrue(result.hasError(ErrorKind.MISSING_FIELD));
	}

	@Test
	void mismatchedInitializer()
	{
		CheckResult result = check(declaration("x", "\"int\"", "{\"kind\":\"string\",\"value\":\"hello\"}"));
		assertEquals(List.of(ErrorKind.TYPE_MISMATCH), kinds(result));
	}

	@Test
	void intWidensToMoney()
	{
		CheckResult result = check(declaration("fine", "\"money\"",
				"{\"kind\":\"binary\",\"op\":\"*\",\"left\":{\"kind\":\"money\",\"value\":\"100\"},\"right\":{\"kind\":\"int\",\"value\":\"2\"}}"));
		assertTrue(result.isSuccess(), () -> result.getErrors().toString());
	}

	@Test
	void undefinedIdentifierInPrinciple()
	{
		CheckResult result = check("{\"kind\":\"principle\",\"name\":\"P\",\"body\":"
				+ "{\"kind\":\"forall\",\"var\":\"x\",\"type\":\"int\",\"body\":"
				+ "{\"kind\":\"binary\",\"op\":\"<\",\"left\":{\"kind\":\"ident\",\"name\":\"x\"},\"right\":{\"kind\":\"ident\",\"name\":\"limit\"}}}}");
		assertEquals(List.of(ErrorKind.UNDEFINED_SYMBOL), kinds(result));
	}

	@Test
	void quantifierBodyMustBeBoolean()
	{
		CheckResult result = check("{\"kind\":\"principle\",\"name\":\"P\",\"body\":"
				+ "{\"kind\":\"exists\",\"var\":\"x\",\"type\":\"int\",\"body\":"
				+ "{\"kind\":\"binary\",\"op\":\"+\",\"left\":{\"kind\":\"ident\",\"name\":\"x\"},\"right\":{\"kind\":\"int\",\"value\":\"1\"}}}}");
		assertTrue(result.hasError(ErrorKind.TYPE_MISMATCH));
	}

	@Test
	void quantifierOverUnknownType()
	{
		CheckResult result = check("{\"kind\":\"principle\",\"name\":\"P\",\"body\":"
				+ "{\"kind\":\"forall\",\"var\":\"c\",\"type\":\"Contract\",\"body\":{\"kind\":\"bool\",\"value\":\"true\"}}}");
		assertEquals(List.of(ErrorKind.UNBOUND_QUANTIFIER_TYPE), kinds(result));
	}

	@Test
	void errorsAccumulateAcrossPasses()
	{
		Program program = TestPrograms.program("many",
				"{\"kind\":\"struct\",\"name\":\"A\",\"parent\":\"Missing\",\"fields\":[]}",
				declaration("c", "{\"kind\":\"citation\",\"section\":\"\",\"subsection\":\"1\",\"act\":\"X\"}"),
				declaration("n", "\"int\"", "{\"kind\":\"bool\",\"value\":\"true\"}"));
		CheckResult result = checker.check(program);
		assertEquals(List.of(ErrorKind.UNDEFINED_SYMBOL, ErrorKind.INVALID_CITATION, ErrorKind.TYPE_MISMATCH), kinds(result));
	}

	@Test
	void freshEnvironmentPerCheck()
	{
		Program program = TestPrograms.program("twice", BOX);
		CheckResult first = checker.check(program);
		CheckResult second = checker.check(program);
		assertTrue(first.isSuccess());
		assertTrue(second.isSuccess());
		assertNotSame(first.getEnvironment(), second.getEnvironment());
	}
}
