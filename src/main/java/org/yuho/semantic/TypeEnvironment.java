package org.yuho.semantic;

import org.yuho.semantic.symbol.AliasSymbol;
import org.yuho.semantic.symbol.EnumSymbol;
import org.yuho.semantic.symbol.FunctionSymbol;
import org.yuho.semantic.symbol.LegalTestSymbol;
import org.yuho.semantic.symbol.StructSymbol;
import org.yuho.semantic.symbol.TypeSymbol;
import org.yuho.semantic.symbol.VariableSymbol;
import org.yuho.semantic.type.StructType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * All named definitions of one compilation unit. Type definitions live in an arena and are
 * addressed by integer id; struct parents are stored as ids into the same arena.
 */
public class TypeEnvironment
{
	private final List<TypeSymbol> arena = new ArrayList<>();
	private final Map<String, Integer> typeIds = new HashMap<>();
	private final Map<String, LegalTestSymbol> legalTests = new LinkedHashMap<>();
	private final Map<String, FunctionSymbol> functions = new LinkedHashMap<>();
	private final Map<String, VariableSymbol> globals = new LinkedHashMap<>();

	/**
	 * Adds a type definition and returns its id. The caller is responsible for rejecting
	 * duplicate names first; a second registration under the same name does not replace the first.
	 */
	public int register(TypeSymbol symbol)
	{
		int id = arena.size();
		symbol.setId(id);
		arena.add(symbol);
		typeIds.putIfAbsent(symbol.getName(), id);
		if (symbol instanceof StructSymbol struct)
		{
			struct.setType(new StructType(struct, this));
		}
		return id;
	}

	public TypeSymbol getById(int id)
	{
		return arena.get(id);
	}

	public int size()
	{
		return arena.size();
	}

	public List<TypeSymbol> getDefinitions()
	{
		return Collections.unmodifiableList(arena);
	}

	public Optional<TypeSymbol> lookupType(String name)
	{
		Integer id = typeIds.get(name);
		return id == null ? Optional.empty() : Optional.of(arena.get(id));
	}

	public Optional<StructSymbol> getStruct(String name)
	{
		return lookupType(name).filter(StructSymbol.class::isInstance).map(StructSymbol.class::cast);
	}

	public Optional<EnumSymbol> getEnum(String name)
	{
		return lookupType(name).filter(EnumSymbol.class::isInstance).map(EnumSymbol.class::cast);
	}

	public Optional<AliasSymbol> getAlias(String name)
	{
		return lookupType(name).filter(AliasSymbol.class::isInstance).map(AliasSymbol.class::cast);
	}

	public List<StructSymbol> getStructs()
	{
		List<StructSymbol> structs = new ArrayList<>();
		for (TypeSymbol symbol : arena)
		{
			if (symbol instanceof StructSymbol struct)
			{
				structs.add(struct);
			}
		}
		return structs;
	}

	public List<EnumSymbol> getEnums()
	{
		List<EnumSymbol> enums = new ArrayList<>();
		for (TypeSymbol symbol : arena)
		{
			if (symbol instanceof EnumSymbol enumSymbol)
			{
				enums.add(enumSymbol);
			}
		}
		return enums;
	}

	/**
	 * Finds the enum declaring {@code variant}, for bare variant names. Empty when no enum or
	 * more than one enum declares it.
	 */
	public Optional<EnumSymbol> findEnumByVariant(String variant)
	{
		EnumSymbol found = null;
		for (EnumSymbol enumSymbol : getEnums())
		{
			if (enumSymbol.hasVariant(variant))
			{
				if (found != null)
				{
					return Optional.empty();
				}
				found = enumSymbol;
			}
		}
		return Optional.ofNullable(found);
	}

	public void defineLegalTest(LegalTestSymbol test)
	{
		legalTests.putIfAbsent(test.getName(), test);
	}

	public Optional<LegalTestSymbol> getLegalTest(String name)
	{
		return Optional.ofNullable(legalTests.get(name));
	}

	public Map<String, LegalTestSymbol> getLegalTests()
	{
		return Collections.unmodifiableMap(legalTests);
	}

	public void defineFunction(FunctionSymbol function)
	{
		functions.putIfAbsent(function.getName(), function);
	}

	public Optional<FunctionSymbol> getFunction(String name)
	{
		return Optional.ofNullable(functions.get(name));
	}

	public Map<String, FunctionSymbol> getFunctions()
	{
		return Collections.unmodifiableMap(functions);
	}

	/**
	 * Defines or replaces a global; discovery registers a placeholder that pass 2 replaces once
	 * the declared type is resolved.
	 */
	public void defineGlobal(VariableSymbol variable)
	{
		globals.put(variable.getName(), variable);
	}

	public Optional<VariableSymbol> getGlobal(String name)
	{
		return Optional.ofNullable(globals.get(name));
	}

	public Map<String, VariableSymbol> getGlobals()
	{
		return Collections.unmodifiableMap(globals);
	}

	/**
	 * True if {@code name} is taken by any kind of top-level definition.
	 */
	public boolean isDefined(String name)
	{
		return typeIds.containsKey(name) || legalTests.containsKey(name) || functions.containsKey(name) || globals.containsKey(name);
	}
}
