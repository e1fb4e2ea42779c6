package org.yuho.semantic;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class DateParserTest
{
	@ParameterizedTest
	@CsvSource({
			"15-03-2021, 2021-03-15",
			"2021-03-15, 2021-03-15",
			"03/15/2021, 2021-03-15",
			"29-02-2024, 2024-02-29"
	})
	void acceptsSupportedFormats(String text, String expected)
	{
		assertEquals(LocalDate.parse(expected), DateParser.parse(text).orElseThrow());
	}

	@ParameterizedTest
	@ValueSource(strings = {"", "yesterday", "2021/03/15", "31-02-2021", "29-02-2023", "15.03.2021"})
	void rejectsEverythingElse(String text)
	{
		assertTrue(DateParser.parse(text).isEmpty());
	}
}
