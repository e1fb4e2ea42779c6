package org.yuho.legal;

import org.yuho.ast.Span;
import org.yuho.ast.decl.FunctionDecl;
import org.yuho.ast.expr.Expr;
import org.yuho.ast.stmt.Stmt;
import org.yuho.semantic.ErrorKind;
import org.yuho.semantic.SemanticError;
import org.yuho.semantic.symbol.EnumSymbol;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single-function reachability walk for functions returning a mutually exclusive enum.
 * <p>
 * The body is split into regions. The entry is one region; each branch of an exclusive
 * discriminator (an {@code if}, or a match with a wildcard arm) opens a region of its own. An
 * {@code if} without {@code else} is treated as one with an empty {@code else}, so what follows it
 * stays in the enclosing region. Returns reached in the same region pool their variants, and a
 * region that can yield two different variants is ambiguous.
 */
public class MutualExclusivityAnalyzer
{
	private final FunctionDecl function;
	private final EnumSymbol enumSymbol;
	private final List<SemanticError> errors = new ArrayList<>();

	private MutualExclusivityAnalyzer(FunctionDecl function, EnumSymbol enumSymbol)
	{
		this.function = function;
		this.enumSymbol = enumSymbol;
	}

	public static List<SemanticError> checkMutualExclusivity(FunctionDecl function, EnumSymbol enumSymbol)
	{
		MutualExclusivityAnalyzer analyzer = new MutualExclusivityAnalyzer(function, enumSymbol);
		Region entry = new Region();
		analyzer.walkBlock(function.body(), entry);
		return analyzer.errors;
	}

	/**
	 * Variants returned in one region, with the first span each was returned at.
	 */
	private static final class Region
	{
		private final Map<String, Span> variants = new LinkedHashMap<>();
		private boolean reported;
	}

	/**
	 * @return true when every path through {@code block} ends in a return
	 */
	private boolean walkBlock(List<Stmt> block, Region region)
	{
		for (Stmt stmt : block)
		{
			if (walkStmt(stmt, region))
			{
				return true; // the rest of the block is unreachable
			}
		}
		return false;
	}

	private boolean walkStmt(Stmt stmt, Region region)
	{
		if (stmt instanceof Stmt.Return ret)
		{
			if (ret.value() != null)
			{
				collect(ret.value(), ret.span(), region);
			}
			return true;
		}
		if (stmt instanceof Stmt.If ifStmt)
		{
			boolean thenReturns = walkBlock(ifStmt.thenBranch(), new Region());
			boolean elseReturns = ifStmt.elseBranch() != null && walkBlock(ifStmt.elseBranch(), new Region());
			return thenReturns && elseReturns;
		}
		if (stmt instanceof Stmt.Match match)
		{
			if (!MatchChecker.isExhaustive(match.cases()))
			{
				for (Stmt.MatchCase matchCase : match.cases())
				{
					walkBlock(matchCase.body(), region);
				}
				return false;
			}
			boolean allReturn = true;
			for (Stmt.MatchCase matchCase : match.cases())
			{
				allReturn &= walkBlock(matchCase.body(), new Region());
			}
			return allReturn;
		}
		return false;
	}

	/**
	 * A returned match expression discriminates like a match statement.
	 */
	private void collect(Expr value, Span span, Region region)
	{
		if (value instanceof Expr.Match match)
		{
			boolean exclusive = MatchChecker.isExhaustive(match.arms());
			for (Expr.MatchArm arm : match.arms())
			{
				collect(arm.consequence(), arm.span(), exclusive ? new Region() : region);
			}
			return;
		}
		Optional<String> variant = variantOf(value);
		if (variant.isEmpty())
		{
			return;
		}
		region.variants.putIfAbsent(variant.get(), span);
		if (region.variants.size() > 1 && !region.reported)
		{
			region.reported = true;
			errors.add(new SemanticError(ErrorKind.AMBIGUOUS_VARIANT_PATH,
					"Function '" + function.name() + "' can return variants " + String.join(", ", region.variants.keySet())
							+ " of mutually exclusive enum '" + enumSymbol.getName()
							+ "' without an exclusive discriminator between them",
					span));
		}
	}

	private Optional<String> variantOf(Expr value)
	{
		if (value instanceof Expr.FieldAccess access && access.target() instanceof Expr.Identifier owner
				&& owner.name().equals(enumSymbol.getName()) && enumSymbol.hasVariant(access.field()))
		{
			return Optional.of(access.field());
		}
		if (value instanceof Expr.Identifier id && enumSymbol.hasVariant(id.name()))
		{
			return Optional.of(id.name());
		}
		return Optional.empty();
	}
}
