package org.yuho.legal;

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
import org.yuho.ast.expr.Arm;
import org.yuho.ast.expr.Expr;
import org.yuho.ast.stmt.Stmt;
import org.yuho.semantic.ErrorKind;
import org.yuho.semantic.SemanticError;
import org.yuho.semantic.TypeEnvironment;
import org.yuho.semantic.symbol.FunctionSymbol;
import org.yuho.semantic.symbol.LegalTestSymbol;
import org.yuho.semantic.type.EnumType;
import org.yuho.semantic.type.Type;
import org.yuho.util.Debug;
import org.yuho.util.ErrorHandler;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Legal-logic checks over a type-checked program: legal test definitions, enum variants, match
 * exhaustiveness and mutual exclusivity. Runs after the type checker on the same environment.
 */
public class LegalChecker implements Item.Visitor<Void>
{
	private final TypeEnvironment environment;
	private final ErrorHandler errorHandler;
	private final MatchChecker matchChecker;
	private final MatchFinder matchFinder = new MatchFinder();

	public LegalChecker(TypeEnvironment environment, ErrorHandler errorHandler)
	{
		this.environment = environment;
		this.errorHandler = errorHandler;
		this.matchChecker = new MatchChecker(environment);
	}

	public void check(List<Item> items)
	{
		Debug.logDebug("Checking legal tests, matches and enum exclusivity...");
		for (Item item : items)
		{
			item.accept(this);
		}
	}

	private void report(List<SemanticError> errors)
	{
		for (SemanticError error : errors)
		{
			errorHandler.add(error);
		}
	}

	@Override
	public Void visitStruct(StructDecl decl)
	{
		return null;
	}

	@Override
	public Void visitEnum(EnumDecl decl)
	{
		Set<String> seen = new HashSet<>();
		for (String variant : decl.variants())
		{
			if (!seen.add(variant))
			{
				errorHandler.logError(ErrorKind.DUPLICATE_DEFINITION, decl.span(),
						"Variant '" + variant + "' is declared twice in enum '" + decl.name() + "'");
			}
		}
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
		for (Stmt stmt : decl.body())
		{
			stmt.accept(matchFinder);
		}

		Optional<FunctionSymbol> function = environment.getFunction(decl.name());
		if (function.isEmpty() || function.get().getDeclaration() != decl)
		{
			return null;
		}
		Type returnType = function.get().getReturnType();
		if (returnType != null && returnType.unwrap() instanceof EnumType enumType && enumType.getSymbol().isMutuallyExclusive())
		{
			report(MutualExclusivityAnalyzer.checkMutualExclusivity(decl, enumType.getSymbol()));
		}
		return null;
	}

	@Override
	public Void visitVariable(VariableDecl decl)
	{
		if (decl.value() != null)
		{
			decl.value().accept(matchFinder);
		}
		return null;
	}

	@Override
	public Void visitLegalTest(LegalTestDecl decl)
	{
		Optional<LegalTestSymbol> test = environment.getLegalTest(decl.name());
		if (test.isPresent() && test.get().getDeclaration() == decl)
		{
			report(LegalTestEngine.evaluateTestDefinition(test.get()));
		}
		return null;
	}

	@Override
	public Void visitPrinciple(PrincipleDecl decl)
	{
		decl.body().accept(matchFinder);
		return null;
	}

	@Override
	public Void visitScope(ScopeDecl decl)
	{
		check(decl.items());
		return null;
	}

	private void checkArms(List<? extends Arm> arms, Span span)
	{
		report(matchChecker.checkMatchExhaustiveness(arms, span));
	}

	/**
	 * Finds every match, statement or expression, nested anywhere in a body.
	 */
	private final class MatchFinder implements Stmt.Visitor<Void>, Expr.Visitor<Void>
	{
		private void visitAll(List<Stmt> block)
		{
			for (Stmt stmt : block)
			{
				stmt.accept(this);
			}
		}

		private void visitArm(Arm arm)
		{
			if (arm.guard() != null)
			{
				arm.guard().accept(this);
			}
		}

		@Override
		public Void visitDeclare(Stmt.Declare stmt)
		{
			Expr value = stmt.declaration().value();
			return value == null ? null : value.accept(this);
		}

		@Override
		public Void visitAssignment(Stmt.Assignment stmt)
		{
			return stmt.value().accept(this);
		}

		@Override
		public Void visitReturn(Stmt.Return stmt)
		{
			return stmt.value() == null ? null : stmt.value().accept(this);
		}

		@Override
		public Void visitMatch(Stmt.Match stmt)
		{
			stmt.scrutinee().accept(this);
			checkArms(stmt.cases(), stmt.span());
			for (Stmt.MatchCase matchCase : stmt.cases())
			{
				visitArm(matchCase);
				visitAll(matchCase.body());
			}
			return null;
		}

		@Override
		public Void visitIf(Stmt.If stmt)
		{
			stmt.condition().accept(this);
			visitAll(stmt.thenBranch());
			if (stmt.elseBranch() != null)
			{
				visitAll(stmt.elseBranch());
			}
			return null;
		}

		@Override
		public Void visitPass(Stmt.Pass stmt)
		{
			return null;
		}

		@Override
		public Void visitLiteral(Expr.Literal expr)
		{
			return null;
		}

		@Override
		public Void visitIdentifier(Expr.Identifier expr)
		{
			return null;
		}

		@Override
		public Void visitBinary(Expr.Binary expr)
		{
			expr.left().accept(this);
			return expr.right().accept(this);
		}

		@Override
		public Void visitUnary(Expr.Unary expr)
		{
			return expr.operand().accept(this);
		}

		@Override
		public Void visitCall(Expr.Call expr)
		{
			for (Expr arg : expr.arguments())
			{
				arg.accept(this);
			}
			return null;
		}

		@Override
		public Void visitFieldAccess(Expr.FieldAccess expr)
		{
			return expr.target().accept(this);
		}

		@Override
		public Void visitStructInit(Expr.StructInit expr)
		{
			for (Expr.FieldInit init : expr.fields())
			{
				init.value().accept(this);
			}
			return null;
		}

		@Override
		public Void visitMatch(Expr.Match expr)
		{
			expr.scrutinee().accept(this);
			checkArms(expr.arms(), expr.span());
			for (Expr.MatchArm arm : expr.arms())
			{
				visitArm(arm);
				arm.consequence().accept(this);
			}
			return null;
		}

		@Override
		public Void visitQuantified(Expr.Quantified expr)
		{
			return expr.body().accept(this);
		}
	}
}
