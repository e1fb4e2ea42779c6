package org.yuho.semantic.symbol;

import org.yuho.ast.decl.EnumDecl;
import org.yuho.semantic.type.EnumType;
import org.yuho.semantic.type.Type;

import java.util.List;

public class EnumSymbol extends TypeSymbol
{
	private final EnumDecl declaration;
	private final EnumType type;

	public EnumSymbol(EnumDecl declaration)
	{
		super(declaration.name(), declaration.span());
		this.declaration = declaration;
		this.type = new EnumType(this);
	}

	public EnumDecl getDeclaration()
	{
		return declaration;
	}

	public List<String> getVariants()
	{
		return declaration.variants();
	}

	public boolean hasVariant(String variant)
	{
		return declaration.variants().contains(variant);
	}

	public boolean isMutuallyExclusive()
	{
		return declaration.mutuallyExclusive();
	}

	@Override
	public Type getType()
	{
		return type;
	}
}
