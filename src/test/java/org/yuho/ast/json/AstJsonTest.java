package org.yuho.ast.json;

import com.google.gson.JsonParseException;
import org.junit.jupiter.api.Test;
import org.yuho.TestPrograms;
import org.yuho.ast.Program;
import org.yuho.ast.Span;
import org.yuho.ast.decl.EnumDecl;
import org.yuho.ast.decl.FunctionDecl;
import org.yuho.ast.decl.PrincipleDecl;
import org.yuho.ast.decl.StructDecl;
import org.yuho.ast.decl.VariableDecl;
import org.yuho.ast.expr.Expr;
import org.yuho.ast.stmt.Stmt;
import org.yuho.ast.type.PrimitiveKind;
import org.yuho.ast.type.TypeRef;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class AstJsonTest
{
	@Test
	void decodesStructWithParentAndSpans()
	{
		Program program = TestPrograms.load("statute_theft");
		assertEquals("statute_theft", program.name());

		StructDecl theft = (StructDecl) program.items().get(1);
		assertEquals("Theft", theft.name());
		assertEquals("DishonestAct", theft.parent());
		assertEquals(2, theft.fields().size());
		assertEquals(new Span(6, 1, 9, 2), theft.span());
		assertEquals(Span.at(7, 5), theft.fields().get(0).span());
	}

	@Test
	void plainStringTypesBecomePrimitiveOrNamed()
	{
		Program program = TestPrograms.load("statute_theft");
		StructDecl dishonest = (StructDecl) program.items().get(0);
		TypeRef bool = dishonest.fields().get(0).type();
		assertInstanceOf(TypeRef.Primitive.class, bool);
		assertEquals(PrimitiveKind.BOOL, ((TypeRef.Primitive) bool).kind());

		FunctionDecl judge = (FunctionDecl) program.items().get(4);
		assertInstanceOf(TypeRef.Named.class, judge.returnType());
		assertInstanceOf(Stmt.If.class, judge.body().get(0));
		assertNotNull(((Stmt.If) judge.body().get(0)).elseBranch());
	}

	@Test
	void decodesEnumFlagsAndQuantifiers()
	{
		Program program = TestPrograms.load("statute_theft");
		EnumDecl verdict = (EnumDecl) program.items().get(2);
		assertTrue(verdict.mutuallyExclusive());

		PrincipleDecl principle = (PrincipleDecl) program.items().get(6);
		Expr.Quantified forall = assertInstanceOf(Expr.Quantified.class, principle.body());
		assertEquals(Expr.QuantifierKind.FORALL, forall.kind());
		assertEquals("t", forall.variable());
	}

	@Test
	void decodesBoundedType()
	{
		Program program = TestPrograms.program("p",
				"{\"kind\":\"declaration\",\"name\":\"age\",\"type\":{\"kind\":\"bounded\",\"lower\":0,\"upper\":150}}");
		TypeRef type = ((VariableDecl) program.items().get(0)).type();
		TypeRef.Bounded bounded = assertInstanceOf(TypeRef.Bounded.class, type);
		assertEquals(new BigDecimal("0"), bounded.lower());
		assertEquals(new BigDecimal("150"), bounded.upper());
		assertInstanceOf(TypeRef.Primitive.class, bounded.base());
	}

	@Test
	void missingProgramNameFallsBack()
	{
		Program program = AstJson.parseProgram("{\"items\":[]}", "fallback");
		assertEquals("fallback", program.name());
		assertTrue(program.items().isEmpty());
	}

	@Test
	void unknownKindIsRejected()
	{
		JsonParseException e = assertThrows(JsonParseException.class,
				() -> TestPrograms.program("p", "{\"kind\":\"class\",\"name\":\"X\"}"));
		assertTrue(e.getMessage().contains("class"));
	}

	@Test
	void unknownOperatorIsRejected()
	{
		assertThrows(JsonParseException.class, () -> AstJson.parseExpr(
				"{\"kind\":\"unary\",\"op\":\"~\",\"operand\":{\"kind\":\"int\",\"value\":\"1\"}}"));
	}

	@Test
	void missingMemberIsRejected()
	{
		JsonParseException e = assertThrows(JsonParseException.class,
				() -> TestPrograms.program("p", "{\"kind\":\"enum\",\"name\":\"E\"}"));
		assertTrue(e.getMessage().contains("variants"));
	}
}
