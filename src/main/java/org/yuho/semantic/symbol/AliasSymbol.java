// File: src/main/java/org/yuho/semantic/symbol/AliasSymbol.java
package org.yuho.semantic.symbol;

import org.yuho.ast.decl.TypeAliasDecl;
import org.yuho.semantic.type.ErrorType;
import org.yuho.semantic.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@code type Name<T> = Target}. The target is resolved lazily, on first use.
 */
public class AliasSymbol extends TypeSymbol
{
	public enum State
	{
		UNRESOLVED, RESOLVING, RESOLVED
	}

	private final TypeAliasDecl declaration;
	private final List<TypeParameterSymbol> typeParameters = new ArrayList<>();
	private State state = State.UNRESOLVED;
	private Type target = ErrorType.INSTANCE;

	public AliasSymbol(TypeAliasDecl declaration)
	{
		super(declaration.name(), declaration.span());
		this.declaration = declaration;
		for (String param : declaration.typeParameters())
		{
			typeParameters.add(new TypeParameterSymbol(param));
		}
	}

	public TypeAliasDecl getDeclaration()
	{
		return declaration;
	}

	public List<TypeParameterSymbol> getTypeParameters()
	{
		return Collections.unmodifiableList(typeParameters);
	}

	public State getState()
	{
		return state;
	}

	public void markResolving()
	{
		state = State.RESOLVING;
	}

	public void resolveTo(Type target)
	{
		this.target = target;
		this.state = State.RESOLVED;
	}

	public Type getTargetType()
	{
		return target;
	}

	@Override
	public Type getType()
	{
		return target;
	}
}
