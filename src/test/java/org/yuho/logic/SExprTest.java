package org.yuho.logic;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SExprTest
{
	@Test
	void plainNamesStayUnquoted()
	{
		assertEquals("x", SExpr.name("x").toString());
		assertEquals("dishonest_intent", SExpr.name("dishonest_intent").toString());
	}

	@Test
	void namesWithDotsOrDigitsFirstAreQuoted()
	{
		assertEquals("|Theft.moved|", SExpr.name("Theft.moved").toString());
		assertEquals("|42|", SExpr.name("42").toString());
		assertEquals("Theft.moved", SExpr.unquote("|Theft.moved|"));
		assertEquals("x", SExpr.unquote("x"));
	}

	@ParameterizedTest
	@ValueSource(strings = {"div", "mod", "and", "not", "forall", "let", "true", "distinct", "to_real"})
	void solverSymbolsAreQuoted(String name)
	{
		assertTrue(SExpr.isReserved(name));
		assertEquals("|" + name + "|", SExpr.name(name).toString());
	}

	@Test
	void operatorsInCallsStayBare()
	{
		assertEquals("(div x 2)", SExpr.call("div", SExpr.sym("x"), SExpr.num(2)).toString());
		assertFalse(SExpr.isReserved("divisor"));
	}

	@Test
	void negativeNumeralsUseUnaryMinus()
	{
		assertEquals("(- 7)", SExpr.num(-7).toString());
		assertEquals("7", SExpr.num(7).toString());
	}

	@Test
	void stringsEscapeQuotes()
	{
		assertEquals("\"say \"\"hi\"\"\"", SExpr.str("say \"hi\"").toString());
	}

	@Test
	void conjunctionCollapses()
	{
		SExpr a = SExpr.sym("a");
		SExpr b = SExpr.sym("b");
		assertEquals("true", SExpr.and(List.of()).toString());
		assertEquals("a", SExpr.and(List.of(a)).toString());
		assertEquals("(and a b)", SExpr.and(List.of(a, b)).toString());
		assertEquals("(=> a (not b))", SExpr.implies(a, SExpr.not(b)).toString());
	}

	@Test
	void structuralEquality()
	{
		assertEquals(SExpr.call("+", SExpr.sym("x"), SExpr.num(1)), SExpr.call("+", SExpr.sym("x"), SExpr.num(1)));
		assertNotEquals(SExpr.sym("x"), SExpr.list(SExpr.sym("x")));
	}

	@Test
	void bindingsShadowWithoutMutation()
	{
		BoundVariables outer = BoundVariables.EMPTY.bind("x", "x", Sort.INT);
		BoundVariables inner = outer.bind("x", "x!1", Sort.BOOL);
		assertEquals("x!1", inner.lookup("x").orElseThrow().smtName());
		assertEquals(Sort.INT, outer.lookup("x").orElseThrow().sort());
		assertFalse(BoundVariables.EMPTY.isBound("x"));
		assertTrue(inner.lookup("y").isEmpty());
	}
}
