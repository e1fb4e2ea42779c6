package org.yuho.semantic.type;

import java.util.Objects;

/**
 * A structured statute reference: section, subsection and act.
 */
public class CitationType implements Type
{
	private final String section;
	private final String subsection;
	private final String act;

	public CitationType(String section, String subsection, String act)
	{
		this.section = section;
		this.subsection = subsection;
		this.act = act;
	}

	public String getSection()
	{
		return section;
	}

	public String getSubsection()
	{
		return subsection;
	}

	public String getAct()
	{
		return act;
	}

	@Override
	public String getName()
	{
		return "Citation<" + section + ", " + subsection + ", " + act + ">";
	}

	@Override
	public boolean isAssignableTo(Type other)
	{
		return other instanceof CitationType;
	}

	@Override
	public boolean equals(Object obj)
	{
		if (!(obj instanceof CitationType that))
		{
			return false;
		}
		return section.equals(that.section) && subsection.equals(that.subsection) && act.equals(that.act);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(section, subsection, act);
	}
}
