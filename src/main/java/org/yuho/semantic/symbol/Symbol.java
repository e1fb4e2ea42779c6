// File: src/main/java/org/yuho/semantic/symbol/Symbol.java
package org.yuho.semantic.symbol;

import org.yuho.semantic.type.Type;

public interface Symbol
{
	String getName();

	Type getType();
}
