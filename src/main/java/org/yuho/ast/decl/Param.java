package org.yuho.ast.decl;

import org.yuho.ast.Span;
import org.yuho.ast.type.TypeRef;

public record Param(String name, TypeRef type, Span span)
{
}
