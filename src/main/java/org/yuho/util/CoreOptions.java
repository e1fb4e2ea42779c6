package org.yuho.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Parses and holds the options that tune the core: solver choice, timeouts and parallelism.
 */
public class CoreOptions
{
	public static final long DEFAULT_TIMEOUT_MS = 5000;
	public static final String DEFAULT_SOLVER_COMMAND = "z3 -in";

	public enum SolverKind
	{
		Z3, PROCESS
	}

	private long timeoutMs = DEFAULT_TIMEOUT_MS;
	private int jobs = Runtime.getRuntime().availableProcessors();
	private SolverKind solverKind = SolverKind.Z3;
	private List<String> solverCommand = splitCommand(DEFAULT_SOLVER_COMMAND);
	private boolean verboseFlag = false;
	private boolean helpFlag = false;
	private final List<String> inputFiles = new ArrayList<>();

	// Use parse() or defaults()
	private CoreOptions()
	{
	}

	public static CoreOptions defaults()
	{
		return new CoreOptions();
	}

	/**
	 * Parses {@code args}. A bad value is not turned into a help request:
	 * the caller gets an {@link IllegalArgumentException} naming the offending option.
	 */
	public static CoreOptions parse(String[] args)
	{
		CoreOptions parsed = new CoreOptions();

		for (int i = 0; i < args.length; i++)
		{
			String arg = args[i];

			// --- Flags with no argument ---
			if (arg.equals("-h") || arg.equals("--help"))
			{
				parsed.helpFlag = true;
				return parsed;
			}
			if (arg.equals("-v") || arg.equals("--verbose"))
			{
				parsed.verboseFlag = true;
				Debug.ENABLE_DEBUG = true;
				continue;
			}

			// --- Flags with one argument ---
			if (arg.equals("--timeout"))
			{
				parsed.timeoutMs = parsePositiveLong(getNextArg(args, ++i, arg), arg);
				continue;
			}
			if (arg.equals("-j") || arg.equals("--jobs"))
			{
				parsed.jobs = (int) parsePositiveLong(getNextArg(args, ++i, arg), arg);
				continue;
			}
			if (arg.equals("--solver"))
			{
				String value = getNextArg(args, ++i, arg);
				switch (value)
				{
					case "z3" -> parsed.solverKind = SolverKind.Z3;
					case "process" -> parsed.solverKind = SolverKind.PROCESS;
					default -> throw new IllegalArgumentException("Invalid value for --solver: " + value);
				}
				continue;
			}
			if (arg.equals("--solver-command"))
			{
				List<String> command = splitCommand(getNextArg(args, ++i, arg));
				if (command.isEmpty())
				{
					throw new IllegalArgumentException("Empty value for --solver-command");
				}
				parsed.solverCommand = command;
				continue;
			}

			if (arg.startsWith("-"))
			{
				throw new IllegalArgumentException("Unknown option: " + arg);
			}

			parsed.inputFiles.add(arg);
		}

		return parsed;
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	private static long parsePositiveLong(String value, String flag)
	{
		long parsed;
		try
		{
			parsed = Long.parseLong(value);
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("Invalid value for " + flag + ": " + value, e);
		}
		if (parsed <= 0 || parsed > Integer.MAX_VALUE)
		{
			throw new IllegalArgumentException("Value for " + flag + " must be between 1 and " + Integer.MAX_VALUE + ": " + value);
		}
		return parsed;
	}

	private static List<String> splitCommand(String command)
	{
		String trimmed = command.trim();
		if (trimmed.isEmpty())
		{
			return List.of();
		}
		return List.copyOf(Arrays.asList(trimmed.split("\\s+")));
	}

	public static void printUsage()
	{
		System.out.println("OVERVIEW: Semantic core for the Yuho statute language.");
		System.out.println("\nUSAGE: yuho-core [options] program.json...");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                 Show this help message and exit.");
		System.out.println("  -v, --verbose              Enable verbose debug logging.");
		System.out.println("  --timeout <ms>             Solver timeout per principle (default 5000).");
		System.out.println("  -j, --jobs <n>             Worker threads for batch analysis.");
		System.out.println("  --solver <z3|process>      In-process Z3 or an external SMT-LIB solver.");
		System.out.println("  --solver-command \"<cmd>\"   External solver command line (default 'z3 -in').");
	}

	// --- Getters ---

	public long getTimeoutMs()
	{
		return timeoutMs;
	}

	public int getJobs()
	{
		return jobs;
	}

	public SolverKind getSolverKind()
	{
		return solverKind;
	}

	public List<String> getSolverCommand()
	{
		return solverCommand;
	}

	public boolean isVerbose()
	{
		return verboseFlag;
	}

	public boolean isHelp()
	{
		return helpFlag;
	}

	public List<String> getInputFiles()
	{
		return Collections.unmodifiableList(inputFiles);
	}
}
