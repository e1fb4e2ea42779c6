// File: src/main/java/org/yuho/semantic/type/ErrorType.java
package org.yuho.semantic.type;

public class ErrorType implements Type
{
	public static final ErrorType INSTANCE = new ErrorType();

	private ErrorType()
	{
	}

	@Override
	public String getName()
	{
		return "<error>";
	}

	@Override
	public boolean isAssignableTo(Type other)
	{
		return true; // Avoid cascading errors
	}

	@Override
	public boolean isError()
	{
		return true;
	}
}
