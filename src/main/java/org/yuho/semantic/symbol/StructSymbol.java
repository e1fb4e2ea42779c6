// File: src/main/java/org/yuho/semantic/symbol/StructSymbol.java
package org.yuho.semantic.symbol;

import org.yuho.ast.decl.StructDecl;
import org.yuho.semantic.type.StructType;
import org.yuho.semantic.type.Type;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A struct definition. The parent is an arena id so that cycles can be detected without
 * following object references.
 */
public class StructSymbol extends TypeSymbol
{
	private final StructDecl declaration;
	private final List<TypeParameterSymbol> typeParameters = new ArrayList<>();
	private final List<FieldSymbol> ownFields = new ArrayList<>();
	private List<FieldSymbol> effectiveFields = List.of();
	private int parentId = NO_ID;
	private StructType type;

	public StructSymbol(StructDecl declaration)
	{
		super(declaration.name(), declaration.span());
		this.declaration = declaration;
		for (String param : declaration.typeParameters())
		{
			typeParameters.add(new TypeParameterSymbol(param));
		}
	}

	public StructDecl getDeclaration()
	{
		return declaration;
	}

	public List<TypeParameterSymbol> getTypeParameters()
	{
		return Collections.unmodifiableList(typeParameters);
	}

	public boolean isGeneric()
	{
		return !typeParameters.isEmpty();
	}

	public Optional<String> getParentName()
	{
		return Optional.ofNullable(declaration.parent());
	}

	public int getParentId()
	{
		return parentId;
	}

	public boolean hasParent()
	{
		return parentId != NO_ID;
	}

	public void setParentId(int parentId)
	{
		this.parentId = parentId;
	}

	public void addOwnField(FieldSymbol field)
	{
		ownFields.add(field);
	}

	public List<FieldSymbol> getOwnFields()
	{
		return Collections.unmodifiableList(ownFields);
	}

	/**
	 * Parent fields first (root-to-leaf), then this struct's own fields.
	 */
	public List<FieldSymbol> getEffectiveFields()
	{
		return effectiveFields;
	}

	public void setEffectiveFields(List<FieldSymbol> effectiveFields)
	{
		this.effectiveFields = List.copyOf(effectiveFields);
	}

	public Optional<FieldSymbol> findField(String name)
	{
		for (FieldSymbol field : effectiveFields)
		{
			if (field.name().equals(name))
			{
				return Optional.of(field);
			}
		}
		return Optional.empty();
	}

	public void setType(StructType type)
	{
		this.type = type;
	}

	@Override
	public Type getType()
	{
		return type;
	}
}
