package org.yuho.util;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

public class ProcessUtils
{
	/**
	 * Output of a finished (or killed) child process.
	 */
	public record ProcessOutput(int exitCode, String stdout, String stderr, boolean timedOut)
	{
	}

	/**
	 * Runs {@code command}, writes {@code input} to its stdin and waits at most {@code timeoutMs}.
	 * A process still running after the timeout is destroyed and reported with {@code timedOut = true}.
	 */
	public static ProcessOutput executeWithInput(List<String> command, String input, long timeoutMs) throws IOException, InterruptedException
	{
		Debug.logDebug("Executing: " + String.join(" ", command));
		ProcessBuilder pb = new ProcessBuilder(command);
		Process process = pb.start();

		StreamCollector out = new StreamCollector(process.getInputStream());
		StreamCollector err = new StreamCollector(process.getErrorStream());
		out.start();
		err.start();

		try (OutputStream stdin = process.getOutputStream())
		{
			stdin.write(input.getBytes(StandardCharsets.UTF_8));
			stdin.flush();
		}
		catch (IOException e)
		{
			// The solver may exit before reading everything; stderr tells why.
			Debug.logDebug("Could not write full input to process: " + e.getMessage());
		}

		boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
		if (!finished)
		{
			process.destroyForcibly();
			process.waitFor(1, TimeUnit.SECONDS);
		}
		out.join(1000);
		err.join(1000);

		String stderr = err.text();
		if (!stderr.isBlank())
		{
			Debug.logDebug(stderr);
		}
		return new ProcessOutput(finished ? process.exitValue() : -1, out.text(), stderr, !finished);
	}

	private static final class StreamCollector extends Thread
	{
		private final InputStream stream;
		private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

		StreamCollector(InputStream stream)
		{
			this.stream = stream;
			setDaemon(true);
		}

		@Override
		public void run()
		{
			try (InputStream in = stream)
			{
				in.transferTo(buffer);
			}
			catch (IOException e)
			{
				Debug.logDebug("Process stream closed: " + e.getMessage());
			}
		}

		String text()
		{
			synchronized (buffer)
			{
				return buffer.toString(StandardCharsets.UTF_8);
			}
		}
	}
}
