package org.yuho.semantic.symbol;

import org.yuho.ast.decl.LegalTestDecl;
import org.yuho.semantic.type.PrimitiveType;
import org.yuho.semantic.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A legal test with its requirements resolved, in declaration order.
 */
public class LegalTestSymbol implements Symbol
{
	private final LegalTestDecl declaration;
	private final List<FieldSymbol> requirements = new ArrayList<>();

	public LegalTestSymbol(LegalTestDecl declaration)
	{
		this.declaration = declaration;
	}

	public LegalTestDecl getDeclaration()
	{
		return declaration;
	}

	public void addRequirement(FieldSymbol requirement)
	{
		requirements.add(requirement);
	}

	public List<FieldSymbol> getRequirements()
	{
		return Collections.unmodifiableList(requirements);
	}

	@Override
	public String getName()
	{
		return declaration.name();
	}

	@Override
	public Type getType()
	{
		return PrimitiveType.BOOL;
	}
}
