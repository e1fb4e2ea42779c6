package org.yuho.ast;

import org.yuho.ast.decl.Item;

import java.util.List;

/**
 * One compilation unit as handed over by the parser: a file name and its top-level items.
 */
public record Program(String name, List<Item> items)
{
	public Program
	{
		items = List.copyOf(items);
	}
}
