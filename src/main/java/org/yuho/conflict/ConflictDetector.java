package org.yuho.conflict;

import org.yuho.ast.Program;
import org.yuho.ast.Span;
import org.yuho.ast.decl.EnumDecl;
import org.yuho.ast.decl.FieldDecl;
import org.yuho.ast.decl.Item;
import org.yuho.ast.decl.LegalTestDecl;
import org.yuho.ast.decl.Requirement;
import org.yuho.ast.decl.ScopeDecl;
import org.yuho.ast.decl.StructDecl;
import org.yuho.ast.type.TypeRefPrinter;
import org.yuho.semantic.TypedProgram;
import org.yuho.util.Debug;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compares same-named structs, enums and legal tests across programs. Declarations are compared by
 * their ordered member lists: field and requirement names with their declared types, or variant
 * names. A name declared in only one program is never a conflict.
 */
public class ConflictDetector
{
	/**
	 * What one program declares, by simple name. The first declaration of a name wins.
	 */
	private static final class Declarations
	{
		private final Map<String, Declared> structs = new LinkedHashMap<>();
		private final Map<String, Declared> enums = new LinkedHashMap<>();
		private final Map<String, Declared> legalTests = new LinkedHashMap<>();
	}

	private record Declared(List<String> members, Span span)
	{
	}

	public Optional<ConflictReport> checkConflict(TypedProgram a, TypedProgram b)
	{
		return checkConflict(a.getProgram(), b.getProgram());
	}

	/**
	 * @return the conflicts between {@code a} and {@code b}, or empty when they agree on every
	 * shared name
	 */
	public Optional<ConflictReport> checkConflict(Program a, Program b)
	{
		Declarations declarationsA = extract(a.items(), new Declarations());
		Declarations declarationsB = extract(b.items(), new Declarations());

		List<Conflict> conflicts = new ArrayList<>();
		compare(ConflictKind.STRUCT_CONFLICT, "Struct '%s' has conflicting field definitions: %s vs %s",
				declarationsA.structs, declarationsB.structs, conflicts);
		compare(ConflictKind.ENUM_CONFLICT, "Enum '%s' has conflicting definitions: %s vs %s",
				declarationsA.enums, declarationsB.enums, conflicts);
		compare(ConflictKind.LEGAL_TEST_CONFLICT, "Legal test '%s' has conflicting requirements: %s vs %s",
				declarationsA.legalTests, declarationsB.legalTests, conflicts);

		if (conflicts.isEmpty())
		{
			Debug.logDebug("No conflicts detected between " + a.name() + " and " + b.name());
			return Optional.empty();
		}
		for (Conflict conflict : conflicts)
		{
			Debug.logWarning("[Conflict] " + a.name() + " / " + b.name() + " " + conflict.kind() + " - " + conflict.description());
		}
		return Optional.of(new ConflictReport(a.name(), b.name(), conflicts));
	}

	/**
	 * Checks every unordered pair once, in input order.
	 */
	public List<ConflictReport> checkAll(List<Program> programs)
	{
		List<ConflictReport> reports = new ArrayList<>();
		for (int i = 0; i < programs.size(); i++)
		{
			for (int j = i + 1; j < programs.size(); j++)
			{
				checkConflict(programs.get(i), programs.get(j)).ifPresent(reports::add);
			}
		}
		return reports;
	}

	private static void compare(ConflictKind kind, String format, Map<String, Declared> inA, Map<String, Declared> inB,
								List<Conflict> conflicts)
	{
		for (Map.Entry<String, Declared> entry : inA.entrySet())
		{
			Declared other = inB.get(entry.getKey());
			if (other == null || other.members().equals(entry.getValue().members()))
			{
				continue;
			}
			Declared mine = entry.getValue();
			String description = String.format(format, entry.getKey(), mine.members(), other.members());
			conflicts.add(new Conflict(kind, entry.getKey(), mine.span(), other.span(), mine.members(), other.members(), description));
		}
	}

	private static Declarations extract(List<Item> items, Declarations into)
	{
		for (Item item : items)
		{
			if (item instanceof StructDecl struct)
			{
				List<String> fields = new ArrayList<>();
				for (FieldDecl field : struct.fields())
				{
					fields.add(field.name() + ": " + TypeRefPrinter.print(field.type()));
				}
				into.structs.putIfAbsent(struct.name(), new Declared(fields, struct.span()));
			}
			else if (item instanceof EnumDecl enumDecl)
			{
				into.enums.putIfAbsent(enumDecl.name(), new Declared(enumDecl.variants(), enumDecl.span()));
			}
			else if (item instanceof LegalTestDecl test)
			{
				List<String> requirements = new ArrayList<>();
				for (Requirement requirement : test.requirements())
				{
					requirements.add(requirement.name() + ": " + TypeRefPrinter.print(requirement.type()));
				}
				into.legalTests.putIfAbsent(test.name(), new Declared(requirements, test.span()));
			}
			else if (item instanceof ScopeDecl scope)
			{
				extract(scope.items(), into);
			}
		}
		return into;
	}
}
