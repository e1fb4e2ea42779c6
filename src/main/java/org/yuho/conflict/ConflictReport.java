package org.yuho.conflict;

import java.util.List;
import java.util.Optional;

/**
 * The conflicts between two programs, in the order they were found.
 */
public record ConflictReport(String fileA, String fileB, List<Conflict> conflicts)
{
	public ConflictReport
	{
		conflicts = List.copyOf(conflicts);
	}

	public int getConflictCount()
	{
		return conflicts.size();
	}

	public Optional<Conflict> find(String name)
	{
		return conflicts.stream().filter(c -> c.name().equals(name)).findFirst();
	}
}
