package org.yuho.semantic.symbol;

import org.yuho.ast.decl.FunctionDecl;
import org.yuho.semantic.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class FunctionSymbol implements Symbol
{
	private final FunctionDecl declaration;
	private final List<TypeParameterSymbol> typeParameters = new ArrayList<>();
	private final List<VariableSymbol> parameters = new ArrayList<>();
	private Type returnType;

	public FunctionSymbol(FunctionDecl declaration)
	{
		this.declaration = declaration;
		for (String param : declaration.typeParameters())
		{
			typeParameters.add(new TypeParameterSymbol(param));
		}
	}

	public FunctionDecl getDeclaration()
	{
		return declaration;
	}

	public List<TypeParameterSymbol> getTypeParameters()
	{
		return Collections.unmodifiableList(typeParameters);
	}

	public void addParameter(VariableSymbol parameter)
	{
		parameters.add(parameter);
	}

	public List<VariableSymbol> getParameters()
	{
		return Collections.unmodifiableList(parameters);
	}

	public void setReturnType(Type returnType)
	{
		this.returnType = returnType;
	}

	public Type getReturnType()
	{
		return returnType;
	}

	@Override
	public String getName()
	{
		return declaration.name();
	}

	@Override
	public Type getType()
	{
		return returnType;
	}
}
