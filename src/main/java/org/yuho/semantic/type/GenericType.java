// File: src/main/java/org/yuho/semantic/type/GenericType.java
package org.yuho.semantic.type;

import org.yuho.semantic.symbol.FieldSymbol;
import org.yuho.semantic.symbol.StructSymbol;
import org.yuho.semantic.symbol.TypeParameterSymbol;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Represents an instantiated generic struct, such as 'Box<int>'.
 * Holds the base struct and the concrete type arguments; field types are substituted on demand.
 */
public class GenericType implements Type
{
	private final StructSymbol baseSymbol;
	private final List<Type> typeArguments;

	public GenericType(StructSymbol baseSymbol, List<Type> typeArguments)
	{
		if (baseSymbol.getTypeParameters().size() != typeArguments.size())
		{
			throw new IllegalArgumentException("Generic '" + baseSymbol.getName() + "' expects "
					+ baseSymbol.getTypeParameters().size() + " type arguments, got " + typeArguments.size());
		}
		this.baseSymbol = baseSymbol;
		this.typeArguments = List.copyOf(typeArguments);
	}

	public StructSymbol getBaseSymbol()
	{
		return baseSymbol;
	}

	public List<Type> getTypeArguments()
	{
		return typeArguments;
	}

	public Map<TypeParameterSymbol, Type> getBindings()
	{
		Map<TypeParameterSymbol, Type> bindings = new HashMap<>();
		List<TypeParameterSymbol> params = baseSymbol.getTypeParameters();
		for (int i = 0; i < params.size(); i++)
		{
			bindings.put(params.get(i), typeArguments.get(i));
		}
		return bindings;
	}

	/**
	 * The base struct's effective fields with every type parameter replaced by its argument.
	 */
	public List<FieldSymbol> getFields()
	{
		Map<TypeParameterSymbol, Type> bindings = getBindings();
		List<FieldSymbol> fields = new ArrayList<>();
		for (FieldSymbol field : baseSymbol.getEffectiveFields())
		{
			fields.add(field.withType(substitute(field.type(), bindings)));
		}
		return fields;
	}

	public static Type substitute(Type type, Map<TypeParameterSymbol, Type> bindings)
	{
		if (bindings.isEmpty())
		{
			return type;
		}
		if (type instanceof TypeParameterType param)
		{
			return bindings.getOrDefault(param.getSymbol(), type);
		}
		if (type instanceof ArrayType array)
		{
			return new ArrayType(substitute(array.getElementType(), bindings));
		}
		if (type instanceof UnionType union)
		{
			return new UnionType(substitute(union.getLeft(), bindings), substitute(union.getRight(), bindings));
		}
		if (type instanceof NonEmptyType nonEmpty)
		{
			return new NonEmptyType(substitute(nonEmpty.getInner(), bindings));
		}
		if (type instanceof RefinementType refinement)
		{
			return refinement.withBase(substitute(refinement.getBase(), bindings));
		}
		if (type instanceof TemporalType temporal)
		{
			return new TemporalType(substitute(temporal.getInner(), bindings), temporal.getValidFrom(), temporal.getValidUntil());
		}
		if (type instanceof GenericType generic)
		{
			List<Type> args = new ArrayList<>();
			for (Type arg : generic.typeArguments)
			{
				args.add(substitute(arg, bindings));
			}
			return new GenericType(generic.baseSymbol, args);
		}
		return type;
	}

	@Override
	public String getName()
	{
		// Generates a name like "Box<int>"
		String args = typeArguments.stream()
				.map(Type::getName)
				.collect(Collectors.joining(", "));
		return baseSymbol.getName() + "<" + args + ">";
	}

	@Override
	public boolean isAssignableTo(Type other)
	{
		if (this.equals(other))
		{
			return true;
		}
		if (other instanceof GenericType otherGeneric)
		{
			if (this.baseSymbol != otherGeneric.baseSymbol)
			{
				return false;
			}
			// Invariant: Box<int> is not a Box<float>.
			return this.typeArguments.equals(otherGeneric.typeArguments);
		}
		return false;
	}

	@Override
	public boolean equals(Object obj)
	{
		if (this == obj)
		{
			return true;
		}
		if (obj == null || getClass() != obj.getClass())
		{
			return false;
		}
		GenericType that = (GenericType) obj;
		return baseSymbol == that.baseSymbol && typeArguments.equals(that.typeArguments);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(baseSymbol.getName(), typeArguments);
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
