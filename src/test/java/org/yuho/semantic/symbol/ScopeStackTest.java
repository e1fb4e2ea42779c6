package org.yuho.semantic.symbol;

import org.junit.jupiter.api.Test;
import org.yuho.ast.Span;
import org.yuho.semantic.type.PrimitiveType;

import static org.junit.jupiter.api.Assertions.*;

class ScopeStackTest
{
	private static VariableSymbol variable(String name)
	{
		return new VariableSymbol(name, PrimitiveType.INT, VariableSymbol.Kind.LOCAL, Span.NONE);
	}

	@Test
	void innerScopeShadowsAndPopRestores()
	{
		ScopeStack scopes = new ScopeStack();
		assertEquals(ScopeStack.DefineResult.DEFINED, scopes.define(variable("x")));
		scopes.push();
		assertEquals(ScopeStack.DefineResult.SHADOWS, scopes.define(variable("x")));
		assertEquals(ScopeStack.DefineResult.DUPLICATE, scopes.define(variable("x")));
		assertEquals(1, scopes.getDepth());
		scopes.pop();
		assertEquals(0, scopes.getDepth());
		assertTrue(scopes.resolve("x").isPresent());
	}

	@Test
	void globalScopeCannotBePopped()
	{
		assertThrows(IllegalStateException.class, () -> new ScopeStack().pop());
	}
}
