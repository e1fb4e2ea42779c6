package org.yuho.ast.decl;

import org.yuho.ast.Span;
import org.yuho.ast.type.TypeRef;

public record Requirement(String name, TypeRef type, Span span)
{
}
