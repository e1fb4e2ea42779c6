package org.yuho;

import com.google.gson.JsonParseException;
import org.yuho.ast.Program;
import org.yuho.ast.json.AstJson;
import org.yuho.batch.BatchAnalyzer;
import org.yuho.conflict.Conflict;
import org.yuho.conflict.ConflictReport;
import org.yuho.semantic.CheckResult;
import org.yuho.semantic.SemanticError;
import org.yuho.semantic.TypedProgram;
import org.yuho.util.CoreOptions;
import org.yuho.util.Debug;
import org.yuho.verify.ProgramVerification;
import org.yuho.verify.VerificationResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Batch runner over parser output: checks every program, verifies the principles of the ones that
 * pass and reports conflicts between all of them. Exits with 1 when anything failed.
 */
public class Main
{
	public static void main(String[] args)
	{
		int status;
		try
		{
			status = run(CoreOptions.parse(args));
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError("Invalid arguments: " + e.getMessage());
			status = 2;
		}
		catch (IOException | JsonParseException e)
		{
			Debug.logError("Error reading program: " + e.getMessage());
			status = 2;
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			Debug.logError("Interrupted.");
			status = 2;
		}
		System.exit(status);
	}

	static int run(CoreOptions options) throws IOException, InterruptedException
	{
		if (options.isHelp())
		{
			CoreOptions.printUsage();
			return 0;
		}
		if (options.getInputFiles().isEmpty())
		{
			throw new IllegalArgumentException("No input files provided. Use -h for help.");
		}

		List<Program> programs = new ArrayList<>();
		for (String file : options.getInputFiles())
		{
			programs.add(AstJson.readProgram(Path.of(file)));
		}

		boolean failed = false;
		try (BatchAnalyzer batch = new BatchAnalyzer(options))
		{
			List<TypedProgram> valid = new ArrayList<>();
			for (CheckResult result : batch.analyzeAll(programs))
			{
				if (result.isSuccess())
				{
					valid.add(result.getCheckedProgram());
					continue;
				}
				failed = true;
				for (SemanticError error : result.getErrors())
				{
					System.out.println(result.getCheckedProgram().getName() + ":" + error);
				}
			}

			for (ProgramVerification verification : batch.verifyAll(valid))
			{
				for (VerificationResult result : verification.results())
				{
					System.out.println(verification.programName() + ": " + result);
				}
				verification.translationErrors().forEach((principle, error) ->
						System.out.println(verification.programName() + ": " + principle + ": " + error));
				failed |= !verification.allValid();
			}

			for (ConflictReport report : batch.checkConflicts(programs))
			{
				failed = true;
				System.out.println("Conflicts between " + report.fileA() + " and " + report.fileB() + ": " + report.getConflictCount());
				for (Conflict conflict : report.conflicts())
				{
					System.out.println("  " + conflict.kind() + " " + conflict.description()
							+ " (" + conflict.locationA() + " / " + conflict.locationB() + ")");
				}
			}
		}
		return failed ? 1 : 0;
	}
}
