package org.yuho.logic;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.yuho.TestPrograms;
import org.yuho.ast.Program;
import org.yuho.ast.Span;
import org.yuho.ast.decl.PrincipleDecl;
import org.yuho.ast.expr.Expr;
import org.yuho.semantic.CheckResult;
import org.yuho.semantic.ErrorKind;
import org.yuho.semantic.TypeChecker;
import org.yuho.semantic.TypedProgram;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QuantifierTranslatorTest
{
	private static TypedProgram typed(Program program)
	{
		CheckResult result = new TypeChecker().check(program);
		assertTrue(result.isSuccess(), () -> result.getErrors().toString());
		return result.getTypedProgram().orElseThrow();
	}

	private static LogicalForm translate(TypedProgram program, String principle) throws TranslationException
	{
		PrincipleDecl decl = program.findPrinciple(principle).orElseThrow();
		return new QuantifierTranslator(program).translate(decl);
	}

	private static String principle(String name, String body)
	{
		return "{\"kind\":\"principle\",\"name\":\"" + name + "\",\"body\":" + body + "}";
	}

	private static String quantifier(String kind, String variable, String type, String body)
	{
		return "{\"kind\":\"" + kind + "\",\"var\":\"" + variable + "\",\"type\":" + type + ",\"body\":" + body + "}";
	}

	private static String ident(String name)
	{
		return "{\"kind\":\"ident\",\"name\":\"" + name + "\"}";
	}

	private static String binary(String op, String left, String right)
	{
		return "{\"kind\":\"binary\",\"op\":\"" + op + "\",\"left\":" + left + ",\"right\":" + right + "}";
	}

	private static String intLiteral(long value)
	{
		return "{\"kind\":\"int\",\"value\":\"" + value + "\"}";
	}

	/**
	 * {@code forall x, forall y, ... , first < last} over the given variable names.
	 */
	private static String nestedForall(List<String> variables)
	{
		String body = binary("<", ident(variables.get(0)), ident(variables.get(variables.size() - 1)));
		for (int i = variables.size() - 1; i >= 0; i--)
		{
			body = quantifier("forall", variables.get(i), "\"int\"", body);
		}
		return body;
	}

	private static List<String> variables(int count)
	{
		List<String> names = new ArrayList<>();
		for (int i = 1; i <= count; i++)
		{
			names.add("v" + i);
		}
		return names;
	}

	// --- Depth ---

	@ParameterizedTest
	@ValueSource(ints = {1, 2, 5, 9, 10})
	void nestingUpToTenTranslates(int depth) throws TranslationException
	{
		TypedProgram program = typed(TestPrograms.program("deep", principle("Deep", nestedForall(variables(depth)))));
		LogicalForm form = translate(program, "Deep");
		assertEquals(depth, form.getUniversals().size());
	}

	@Test
	void elevenNestedQuantifiersExceedTheBound()
	{
		List<String> names = List.of("x", "y", "z", "a", "b", "c", "d", "e", "f", "g", "h");
		TypedProgram program = typed(TestPrograms.program("p", principle("P", nestedForall(names))));
		TranslationException e = assertThrows(TranslationException.class, () -> translate(program, "P"));
		assertEquals(ErrorKind.QUANTIFIER_DEPTH_EXCEEDED, e.getKind());
		assertEquals("Quantifier nesting depth exceeds 10 at 'h'", e.getMessage());
		assertEquals(ErrorKind.QUANTIFIER_DEPTH_EXCEEDED, e.toSemanticError().kind());
	}

	@Test
	void existentialsCountTowardsDepth()
	{
		String body = binary("==", ident("v1"), ident("v11"));
		for (int i = 11; i >= 1; i--)
		{
			body = quantifier(i % 2 == 0 ? "exists" : "forall", "v" + i, "\"int\"", body);
		}
		TypedProgram program = typed(TestPrograms.program("mixed", principle("Mixed", body)));
		TranslationException e = assertThrows(TranslationException.class, () -> translate(program, "Mixed"));
		assertEquals(ErrorKind.QUANTIFIER_DEPTH_EXCEEDED, e.getKind());
	}

	// --- Encoding ---

	@Test
	void universalPrefixBecomesConstants() throws TranslationException
	{
		LogicalForm form = translate(typed(TestPrograms.load("all_positive")), "AllPositive");
		assertEquals(LogicalForm.Goal.VALIDITY, form.getGoal());
		assertEquals(1, form.getUniversals().size());
		assertEquals(Sort.INT, form.getUniversals().get(0).sort());
		assertEquals("(> x 0)", form.getMatrix().toString());
		assertEquals("(not (> x 0))", form.getQuery().toString());
		assertEquals("(forall ((x Int)) (> x 0))", form.getFormula().toString());

		String script = form.toQueryScript();
		assertTrue(script.contains("(declare-const x Int)"), script);
		assertTrue(script.endsWith("(assert (not (> x 0)))\n"), script);
		assertTrue(form.toSmtLib().contains("(assert (forall ((x Int)) (> x 0)))"));
	}

	@Test
	void refinementAddsImplicationGuard() throws TranslationException
	{
		String body = quantifier("forall", "x", "{\"kind\":\"bounded\",\"lower\":0,\"upper\":10}",
				binary(">=", ident("x"), intLiteral(0)));
		LogicalForm form = translate(typed(TestPrograms.program("r", principle("R", body))), "R");
		assertEquals("(=> (and (>= x 0) (<= x 10)) (>= x 0))", form.getMatrix().toString());
	}

	@Test
	void fractionalIntBoundsRoundInward() throws TranslationException
	{
		String body = quantifier("forall", "x", "{\"kind\":\"bounded\",\"base\":\"int\",\"lower\":0.5,\"upper\":2.5}",
				binary(">=", ident("x"), intLiteral(1)));
		LogicalForm form = translate(typed(TestPrograms.program("frac", principle("F", body))), "F");
		assertEquals("(=> (and (>= x 1) (<= x 2)) (>= x 1))", form.getMatrix().toString());
	}

	@Test
	void negativeFractionalIntBoundsRoundInward() throws TranslationException
	{
		String body = quantifier("forall", "x", "{\"kind\":\"bounded\",\"base\":\"int\",\"lower\":-2.5,\"upper\":-0.5}",
				binary(">=", ident("x"), ident("x")));
		LogicalForm form = translate(typed(TestPrograms.program("neg", principle("N", body))), "N");
		assertEquals("(=> (and (>= x (- 2)) (<= x (- 1))) (>= x x))", form.getMatrix().toString());
	}

	@Test
	void numeralRoundsOnlyIntSorts()
	{
		assertEquals("0", QuantifierTranslator.numeral(new BigDecimal("0.5"), Sort.INT, RoundingMode.FLOOR).toString());
		assertEquals("1", QuantifierTranslator.numeral(new BigDecimal("0.5"), Sort.INT, RoundingMode.CEILING).toString());
		assertEquals("0", QuantifierTranslator.numeral(new BigDecimal("-0.5"), Sort.INT, RoundingMode.CEILING).toString());
		assertEquals("(- 1)", QuantifierTranslator.numeral(new BigDecimal("-0.5"), Sort.INT, RoundingMode.FLOOR).toString());
		assertEquals("(- 2.5)", QuantifierTranslator.numeral(new BigDecimal("-2.5"), Sort.REAL, RoundingMode.FLOOR).toString());
		assertEquals("3.0", QuantifierTranslator.numeral(new BigDecimal("3"), Sort.REAL, RoundingMode.CEILING).toString());
	}

	@Test
	void durationsAreCountedInDays() throws TranslationException
	{
		assertEquals(14, QuantifierTranslator.durationDays(new Expr.Literal(Expr.LiteralKind.DURATION, "2 weeks", Span.NONE)));
		assertEquals(365, QuantifierTranslator.durationDays(new Expr.Literal(Expr.LiteralKind.DURATION, "1 year", Span.NONE)));
	}

	@ParameterizedTest
	@ValueSource(strings = {"99999999999999999999 days", "30000000000000000 years", "9223372036854775807 weeks"})
	void outOfRangeDurationIsUnsupported(String text)
	{
		TranslationException e = assertThrows(TranslationException.class,
				() -> QuantifierTranslator.durationDays(new Expr.Literal(Expr.LiteralKind.DURATION, text, Span.NONE)));
		assertEquals(ErrorKind.UNSUPPORTED_EXPRESSION, e.getKind());
	}

	@Test
	void existentialRefinementAddsConjunctionGuard() throws TranslationException
	{
		String inner = quantifier("exists", "y", "{\"kind\":\"positive\",\"inner\":\"int\"}",
				binary(">", ident("y"), ident("x")));
		String body = quantifier("forall", "x", "\"int\"", inner);
		LogicalForm form = translate(typed(TestPrograms.program("e", principle("E", body))), "E");
		assertEquals("(exists ((y Int)) (and (> y 0) (> y x)))", form.getMatrix().toString());
	}

	@Test
	void mixedIntAndRealArePromoted() throws TranslationException
	{
		String body = quantifier("forall", "m", "\"money\"", binary(">=", ident("m"), intLiteral(0)));
		LogicalForm form = translate(typed(TestPrograms.program("money", principle("M", body))), "M");
		assertEquals(Sort.REAL, form.getUniversals().get(0).sort());
		assertEquals("(>= m (to_real 0))", form.getMatrix().toString());
	}

	@Test
	void innerBindingShadowsOuter() throws TranslationException
	{
		String body = quantifier("forall", "x", "\"int\"",
				quantifier("exists", "x", "\"bool\"", ident("x")));
		LogicalForm form = translate(typed(TestPrograms.program("s", principle("S", body))), "S");
		assertEquals(List.of("Quantified variable 'x' shadows an outer binding"), form.getWarnings());
		assertEquals("(exists ((x!1 Bool)) x!1)", form.getMatrix().toString());
	}

	@Test
	void bindersNamedLikeSolverSymbolsAreRenamed() throws TranslationException
	{
		String body = quantifier("forall", "div", "\"int\"", binary(">=", binary("*", ident("div"), ident("div")), intLiteral(0)));
		LogicalForm form = translate(typed(TestPrograms.program("reserved", principle("D", body))), "D");
		assertEquals("div", form.getUniversals().get(0).name());
		assertEquals("div!1", form.getUniversals().get(0).smtName());
		assertEquals("(>= (* div!1 div!1) 0)", form.getMatrix().toString());
	}

	@Test
	void structFieldsBecomeSelectors() throws TranslationException
	{
		LogicalForm form = translate(typed(TestPrograms.load("statute_theft")), "TheftNeedsIntent");
		List<String> declarations = form.getDeclarations().stream().map(SExpr::toString).toList();
		assertTrue(declarations.contains("(declare-sort Theft 0)"), declarations::toString);
		assertTrue(declarations.contains("(declare-fun |Theft.moved| (Theft) Bool)"), declarations::toString);
		assertEquals("(or (not (|Theft.moved| t)) true)", form.getMatrix().toString());
	}

	@Test
	void enumsBecomeDatatypes() throws TranslationException
	{
		String verdict = "{\"kind\":\"enum\",\"name\":\"Verdict\",\"variants\":[\"Guilty\",\"NotGuilty\"]}";
		String guilty = "{\"kind\":\"field\",\"target\":" + ident("Verdict") + ",\"field\":\"Guilty\"}";
		String body = quantifier("forall", "v", "\"Verdict\"",
				binary("||", binary("==", ident("v"), guilty), binary("!=", ident("v"), guilty)));
		LogicalForm form = translate(typed(TestPrograms.program("en", verdict, principle("Total", body))), "Total");
		assertEquals("(declare-datatypes ((Verdict 0)) (((|Verdict.Guilty|) (|Verdict.NotGuilty|))))",
				form.getDeclarations().get(0).toString());
		assertEquals("(or (= v |Verdict.Guilty|) (distinct v |Verdict.Guilty|))", form.getMatrix().toString());
	}

	@Test
	void globalsBecomeFreeConstants() throws TranslationException
	{
		String limit = "{\"kind\":\"declaration\",\"name\":\"limit\",\"type\":\"int\"}";
		String body = quantifier("forall", "x", "\"int\"", binary("<", ident("x"), ident("limit")));
		LogicalForm form = translate(typed(TestPrograms.program("g", limit, principle("G", body))), "G");
		assertEquals(1, form.getFreeConstants().size());
		assertEquals("limit", form.getFreeConstants().get(0).name());
		assertTrue(form.toQueryScript().contains("(declare-const limit Int)"));
	}

	@Test
	void unknownBinderTypeIsUnbound()
	{
		Program program = TestPrograms.program("u",
				principle("U", quantifier("forall", "c", "\"Contract\"", "{\"kind\":\"bool\",\"value\":\"true\"}")));
		CheckResult checked = new TypeChecker().check(program);
		PrincipleDecl decl = (PrincipleDecl) program.items().get(0);
		TranslationException e = assertThrows(TranslationException.class,
				() -> new QuantifierTranslator(checked.getEnvironment()).translate(decl));
		assertEquals(ErrorKind.UNBOUND_QUANTIFIER_TYPE, e.getKind());
	}

	@Test
	void matchHasNoLogicalMeaning()
	{
		String match = "{\"kind\":\"match\",\"scrutinee\":" + ident("x") + ",\"arms\":["
				+ "{\"pattern\":{\"kind\":\"wildcard\"},\"consequence\":{\"kind\":\"bool\",\"value\":\"true\"}}]}";
		Program program = TestPrograms.program("m", principle("M", quantifier("forall", "x", "\"int\"", match)));
		CheckResult checked = new TypeChecker().check(program);
		PrincipleDecl decl = (PrincipleDecl) program.items().get(0);
		TranslationException e = assertThrows(TranslationException.class,
				() -> new QuantifierTranslator(checked.getEnvironment()).translate(decl));
		assertEquals(ErrorKind.UNSUPPORTED_EXPRESSION, e.getKind());
	}

	@Test
	void legalTestIsSatisfiabilityGoal() throws TranslationException
	{
		TypedProgram program = typed(TestPrograms.load("statute_theft"));
		LogicalForm form = new QuantifierTranslator(program)
				.translateLegalTest(program.getEnvironment().getLegalTest("TheftTest").orElseThrow());
		assertEquals(LogicalForm.Goal.SATISFIABILITY, form.getGoal());
		assertEquals(3, form.getFreeConstants().size());
		assertEquals("(and dishonest_intent moved without_consent)", form.getQuery().toString());
	}
}
