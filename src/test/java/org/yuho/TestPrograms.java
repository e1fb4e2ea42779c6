package org.yuho;

import org.yuho.ast.Program;
import org.yuho.ast.json.AstJson;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads the JSON fixtures under {@code src/test/resources/programs}.
 */
public final class TestPrograms
{
	private TestPrograms()
	{
	}

	public static Program load(String name)
	{
		String resource = "/programs/" + name + ".json";
		try (InputStream in = TestPrograms.class.getResourceAsStream(resource))
		{
			if (in == null)
			{
				throw new IllegalStateException("Missing test fixture " + resource);
			}
			return AstJson.parseProgram(new String(in.readAllBytes(), StandardCharsets.UTF_8), name);
		}
		catch (IOException e)
		{
			throw new UncheckedIOException(e);
		}
	}

	/**
	 * Wraps item JSON objects into a program document.
	 */
	public static Program program(String name, String... items)
	{
		return AstJson.parseProgram("{\"name\":\"" + name + "\",\"items\":[" + String.join(",", items) + "]}");
	}
}
