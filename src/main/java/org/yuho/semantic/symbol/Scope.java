// File: src/main/java/org/yuho/semantic/symbol/Scope.java
package org.yuho.semantic.symbol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One level of the lexical symbol table: a function body, a match arm or a quantifier body.
 */
public class Scope
{
	private final Scope enclosingScope;
	private final Map<String, Symbol> symbols = new LinkedHashMap<>();

	public Scope(Scope enclosingScope)
	{
		this.enclosingScope = enclosingScope;
	}

	public void define(Symbol sym)
	{
		symbols.put(sym.getName(), sym);
	}

	public Optional<Symbol> resolve(String name)
	{
		Optional<Symbol> local = resolveLocally(name);
		if (local.isPresent())
		{
			return local;
		}
		if (enclosingScope != null)
		{
			return enclosingScope.resolve(name);
		}
		return Optional.empty();
	}

	public Optional<Symbol> resolveLocally(String name)
	{
		return Optional.ofNullable(symbols.get(name));
	}

	public Map<String, Symbol> getSymbols()
	{
		return Collections.unmodifiableMap(symbols);
	}

	public Scope getEnclosingScope()
	{
		return enclosingScope;
	}
}
