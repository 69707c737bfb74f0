package org.pygcse;

import org.pygcse.util.ConverterArguments;
import org.pygcse.util.Debug;
import org.pygcse.util.Diagnostic;
import org.pygcse.util.FileUtils;
import org.pygcse.util.IRDTOConverter;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command-line entry point. Every input file is converted on its own; a
 * failing file does not stop the others.
 */
public class Main
{
	public static final String VERSION = "0.1.0";

	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	/**
	 * @return the process exit status
	 */
	static int run(String[] args)
	{
		try
		{
			ConverterArguments arguments = ConverterArguments.parse(args);

			if (arguments.isHelpFlag())
			{
				ConverterArguments.printUsage();
				return arguments.isInvalid() ? 2 : 0;
			}
			if (arguments.isVersionFlag())
			{
				standardOutput().println("pygcse (Python to IGCSE pseudocode) version " + VERSION);
				return 0;
			}
			if (arguments.getInputFiles().isEmpty())
			{
				throw new IllegalArgumentException("No input files provided. Use -h for help.");
			}

			PseudocodeConverter converter = new PseudocodeConverter(arguments.getOptions());
			boolean failed = false;
			for (Path file : arguments.getInputFiles())
			{
				if (!Files.exists(file))
				{
					Debug.logError("The specified file does not exist: " + file);
					failed = true;
					continue;
				}
				failed |= !convertFile(converter, file, arguments);
			}
			return failed ? 1 : 0;
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError("Invalid arguments: " + e.getMessage());
			return 2;
		}
		catch (IOException e)
		{
			Debug.logError("Error reading or writing file: " + e.getMessage());
			return 1;
		}
	}

	/**
	 * @return false if the file produced an error, or any diagnostic in strict mode
	 */
	private static boolean convertFile(PseudocodeConverter converter, Path file, ConverterArguments arguments) throws IOException
	{
		Debug.logDebug("Converting " + file);
		String input = FileUtils.load(file);
		String title = file.getFileName().toString();
		ConversionResult result = arguments.isJsonInput() ? converter.convertJson(input, title) : converter.convert(input, title);

		for (Diagnostic diagnostic : result.diagnostics())
		{
			if (diagnostic.isError())
			{
				Debug.logError(file + ": " + diagnostic);
			}
			else
			{
				Debug.logWarning(file + ": " + diagnostic);
			}
		}

		Path output = outputPathFor(file, arguments);
		if (output == null)
		{
			PrintStream stdout = standardOutput();
			stdout.println(result.code());
			stdout.flush();
		}
		else
		{
			FileUtils.write(output, result.code() + System.lineSeparator());
			Debug.logInfo("Wrote " + output);
		}

		if (arguments.isDumpIr() && result.ir() != null)
		{
			Path irPath = FileUtils.replaceExtension(output == null ? file : output, ".ir.json");
			FileUtils.write(irPath, IRDTOConverter.toJson(result.ir()));
			Debug.logInfo("Wrote " + irPath);
		}

		if (result.hasErrors())
		{
			return false;
		}
		return !arguments.isStrict() || result.diagnostics().isEmpty();
	}

	/**
	 * {@link System#out} encoding text as UTF-8 regardless of the platform charset.
	 * Never closed, closing it would close {@code System.out}.
	 */
	private static PrintStream standardOutput()
	{
		return new PrintStream(System.out, true, StandardCharsets.UTF_8);
	}

	/**
	 * {@code null} means standard output.
	 */
	private static Path outputPathFor(Path file, ConverterArguments arguments)
	{
		if (arguments.getOutputPath() != null)
		{
			return arguments.getOutputPath();
		}
		if (arguments.getInputFiles().size() == 1)
		{
			return null;
		}
		return FileUtils.replaceExtension(file, arguments.getOptions().markdown() ? ".md" : ".pseudo");
	}
}
