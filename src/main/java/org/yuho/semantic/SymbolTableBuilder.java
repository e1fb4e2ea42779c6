// File: src/main/java/org/yuho/semantic/SymbolTableBuilder.java
package org.yuho.semantic;

import org.yuho.ast.Span;
import org.yuho.ast.decl.EnumDecl;
import org.yuho.ast.decl.FieldDecl;
import org.yuho.ast.decl.FunctionDecl;
import org.yuho.ast.decl.Item;
import org.yuho.ast.decl.LegalTestDecl;
import org.yuho.ast.decl.Param;
import org.yuho.ast.decl.PrincipleDecl;
import org.yuho.ast.decl.Requirement;
import org.yuho.ast.decl.ScopeDecl;
import org.yuho.ast.decl.StructDecl;
import org.yuho.ast.decl.TypeAliasDecl;
import org.yuho.ast.decl.VariableDecl;
import org.yuho.semantic.symbol.AliasSymbol;
import org.yuho.semantic.symbol.EnumSymbol;
import org.yuho.semantic.symbol.FieldSymbol;
import org.yuho.semantic.symbol.FunctionSymbol;
import org.yuho.semantic.symbol.LegalTestSymbol;
import org.yuho.semantic.symbol.StructSymbol;
import org.yuho.semantic.symbol.TypeSymbol;
import org.yuho.semantic.symbol.VariableSymbol;
import org.yuho.semantic.type.PrimitiveType;
import org.yuho.semantic.type.Type;
import org.yuho.util.Debug;
import org.yuho.util.ErrorHandler;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Fills a {@link TypeEnvironment} in two passes: discovery registers every name, member
 * definition resolves fields, parents, signatures and requirements against the full set of names.
 */
public class SymbolTableBuilder implements Item.Visitor<Void>
{
	private final TypeEnvironment environment;
	private final ErrorHandler errorHandler;
	private final TypeResolver resolver;
	private final Set<String> principleNames = new HashSet<>();
	private final List<PrincipleDecl> principles = new ArrayList<>();
	private final List<VariableDecl> globalDecls = new ArrayList<>();

	public SymbolTableBuilder(TypeEnvironment environment, ErrorHandler errorHandler, TypeResolver resolver)
	{
		this.environment = environment;
		this.errorHandler = errorHandler;
		this.resolver = resolver;
	}

	/**
	 * PASS 1: registers every declared name. Items nested in scope blocks are registered under
	 * their simple names.
	 */
	public void discover(List<Item> items)
	{
		for (Item item : items)
		{
			item.accept(this);
		}
	}

	/**
	 * PASS 2: resolves everything that refers to other declarations.
	 */
	public void defineMembers()
	{
		Debug.logDebug("Linking struct parents...");
		linkParents();

		for (TypeSymbol symbol : environment.getDefinitions())
		{
			if (symbol instanceof AliasSymbol alias)
			{
				resolver.resolveAlias(alias);
			}
			else if (symbol instanceof StructSymbol struct)
			{
				defineFields(struct);
			}
		}

		Debug.logDebug("Computing effective field sets...");
		for (StructSymbol struct : environment.getStructs())
		{
			computeEffectiveFields(struct);
		}

		for (LegalTestSymbol test : environment.getLegalTests().values())
		{
			for (Requirement requirement : test.getDeclaration().requirements())
			{
				Type type = resolver.resolve(requirement.type());
				test.addRequirement(new FieldSymbol(requirement.name(), type, List.of(), test.getName(), requirement.span()));
			}
		}

		for (FunctionSymbol function : environment.getFunctions().values())
		{
			FunctionDecl decl = function.getDeclaration();
			for (Param param : decl.parameters())
			{
				Type type = resolver.resolve(param.type(), function.getTypeParameters());
				function.addParameter(new VariableSymbol(param.name(), type, VariableSymbol.Kind.PARAMETER, param.span()));
			}
			function.setReturnType(decl.returnType() == null
					? PrimitiveType.PASS
					: resolver.resolve(decl.returnType(), function.getTypeParameters()));
		}

		for (VariableDecl decl : globalDecls)
		{
			Type type = resolver.resolve(decl.type());
			environment.defineGlobal(new VariableSymbol(decl.name(), type, VariableSymbol.Kind.GLOBAL, decl.span()));
		}
	}

	public List<PrincipleDecl> getPrinciples()
	{
		return principles;
	}

	public List<VariableDecl> getGlobalDeclarations()
	{
		return globalDecls;
	}

	// --- Discovery ---

	private boolean claimName(String name, Span span, String what)
	{
		if (environment.isDefined(name))
		{
			errorHandler.logError(ErrorKind.DUPLICATE_DEFINITION, span, what + " '" + name + "' is already defined");
			return false;
		}
		return true;
	}

	@Override
	public Void visitStruct(StructDecl decl)
	{
		if (claimName(decl.name(), decl.span(), "Struct"))
		{
			environment.register(new StructSymbol(decl));
		}
		return null;
	}

	@Override
	public Void visitEnum(EnumDecl decl)
	{
		if (claimName(decl.name(), decl.span(), "Enum"))
		{
			environment.register(new EnumSymbol(decl));
		}
		return null;
	}

	@Override
	public Void visitTypeAlias(TypeAliasDecl decl)
	{
		if (claimName(decl.name(), decl.span(), "Type alias"))
		{
			environment.register(new AliasSymbol(decl));
		}
		return null;
	}

	@Override
	public Void visitFunction(FunctionDecl decl)
	{
		if (claimName(decl.name(), decl.span(), "Function"))
		{
			environment.defineFunction(new FunctionSymbol(decl));
		}
		return null;
	}

	@Override
	public Void visitVariable(VariableDecl decl)
	{
		if (claimName(decl.name(), decl.span(), "Variable"))
		{
			// Placeholder so later duplicates are caught; the real type is set in pass 2.
			environment.defineGlobal(new VariableSymbol(decl.name(), null, VariableSymbol.Kind.GLOBAL, decl.span()));
			globalDecls.add(decl);
		}
		return null;
	}

	@Override
	public Void visitLegalTest(LegalTestDecl decl)
	{
		if (claimName(decl.name(), decl.span(), "Legal test"))
		{
			environment.defineLegalTest(new LegalTestSymbol(decl));
		}
		return null;
	}

	@Override
	public Void visitPrinciple(PrincipleDecl decl)
	{
		if (!principleNames.add(decl.name()))
		{
			errorHandler.logError(ErrorKind.DUPLICATE_DEFINITION, decl.span(), "Principle '" + decl.name() + "' is already defined");
			return null;
		}
		principles.add(decl);
		return null;
	}

	@Override
	public Void visitScope(ScopeDecl decl)
	{
		discover(decl.items());
		return null;
	}

	// --- Member definition ---

	/**
	 * A parent must exist, be a non-generic struct, be declared before its child and not lead
	 * back to the child.
	 */
	private void linkParents()
	{
		for (StructSymbol struct : environment.getStructs())
		{
			Optional<String> parentName = struct.getParentName();
			if (parentName.isEmpty())
			{
				continue;
			}
			Optional<TypeSymbol> parentSymbol = environment.lookupType(parentName.get());
			if (parentSymbol.isEmpty())
			{
				errorHandler.logError(ErrorKind.UNDEFINED_SYMBOL, struct.getSpan(),
						"Parent struct '" + parentName.get() + "' of '" + struct.getName() + "' is not defined");
				continue;
			}
			if (!(parentSymbol.get() instanceof StructSymbol parent))
			{
				errorHandler.logError(ErrorKind.TYPE_MISMATCH, struct.getSpan(),
						"'" + parentName.get() + "' is not a struct and cannot be extended by '" + struct.getName() + "'");
				continue;
			}
			if (leadsBackTo(struct))
			{
				errorHandler.logError(ErrorKind.CIRCULAR_INHERITANCE, struct.getSpan(),
						"Circular inheritance detected: '" + struct.getName() + "' is its own ancestor");
				continue;
			}
			if (parent.getId() > struct.getId())
			{
				errorHandler.logError(ErrorKind.CIRCULAR_INHERITANCE, struct.getSpan(),
						"Parent '" + parent.getName() + "' must be declared before '" + struct.getName() + "'");
				continue;
			}
			if (parent.isGeneric())
			{
				errorHandler.logError(ErrorKind.ARITY_MISMATCH, struct.getSpan(),
						String.format("Type '%s' expects %d type argument(s) but got %d", parent.getName(), parent.getTypeParameters().size(), 0));
				continue;
			}
			struct.setParentId(parent.getId());
		}
	}

	/**
	 * Walks the declared parent names from {@code start}; true if the walk revisits {@code start}.
	 */
	private boolean leadsBackTo(StructSymbol start)
	{
		BitSet visited = new BitSet(environment.size());
		StructSymbol current = start;
		while (current != null)
		{
			if (visited.get(current.getId()))
			{
				return current == start;
			}
			visited.set(current.getId());
			current = current.getParentName().flatMap(environment::getStruct).orElse(null);
		}
		return false;
	}

	private void defineFields(StructSymbol struct)
	{
		for (FieldDecl field : struct.getDeclaration().fields())
		{
			Type type = resolver.resolve(field.type(), struct.getTypeParameters());
			struct.addOwnField(new FieldSymbol(field.name(), type, field.constraints(), struct.getName(), field.span()));
		}
	}

	/**
	 * Parents are always earlier in the arena, so their effective fields are final by now.
	 */
	private void computeEffectiveFields(StructSymbol struct)
	{
		List<FieldSymbol> fields = new ArrayList<>();
		if (struct.hasParent())
		{
			fields.addAll(((StructSymbol) environment.getById(struct.getParentId())).getEffectiveFields());
		}
		for (FieldSymbol own : struct.getOwnFields())
		{
			Optional<FieldSymbol> clash = fields.stream().filter(f -> f.name().equals(own.name())).findFirst();
			if (clash.isPresent())
			{
				String where = clash.get().owner().equals(struct.getName())
						? "twice in '" + struct.getName() + "'"
						: "in parent '" + clash.get().owner() + "'";
				errorHandler.logError(ErrorKind.DUPLICATE_FIELD, own.span(),
						"Duplicate field '" + own.name() + "' in struct '" + struct.getName() + "': already declared " + where);
				continue;
			}
			fields.add(own);
		}
		struct.setEffectiveFields(fields);
	}
}
