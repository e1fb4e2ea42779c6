package org.yuho.semantic;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;

/**
 * Statute dates: {@code DD-MM-YYYY} (the house style), ISO {@code YYYY-MM-DD} and US {@code MM/DD/YYYY},
 * tried in that order.
 */
public final class DateParser
{
	private static final List<DateTimeFormatter> FORMATS = List.of(
			DateTimeFormatter.ofPattern("dd-MM-uuuu").withResolverStyle(ResolverStyle.STRICT),
			DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT),
			DateTimeFormatter.ofPattern("MM/dd/uuuu").withResolverStyle(ResolverStyle.STRICT));

	public static final String EXPECTED_FORMATS = "DD-MM-YYYY, YYYY-MM-DD or MM/DD/YYYY";

	private DateParser()
	{
	}

	public static Optional<LocalDate> parse(String text)
	{
		if (text == null)
		{
			return Optional.empty();
		}
		String trimmed = text.trim();
		for (DateTimeFormatter format : FORMATS)
		{
			try
			{
				return Optional.of(LocalDate.parse(trimmed, format));
			}
			catch (DateTimeParseException e)
			{
				// try the next format
			}
		}
		return Optional.empty();
	}
}
