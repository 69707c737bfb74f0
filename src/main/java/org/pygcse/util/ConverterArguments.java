package org.pygcse.util;

import org.pygcse.ConversionOptions;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses and holds the command-line arguments of the converter.
 */
public class ConverterArguments
{
	private final List<Path> inputFiles = new ArrayList<>();
	private boolean helpFlag = false;
	private boolean invalid = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private Path outputPath = null;
	private boolean jsonInput = false;
	private boolean dumpIr = false;
	private boolean strict = false;
	private ConversionOptions options = ConversionOptions.defaults();

	// Private constructor, use parse()
	private ConverterArguments()
	{
	}

	public static ConverterArguments parse(String[] args)
	{
		ConverterArguments parsedArgs = new ConverterArguments();

		if (args.length < 1)
		{
			parsedArgs.helpFlag = true;
			return parsedArgs;
		}

		try
		{
			for (int i = 0; i < args.length; i++)
			{
				String arg = args[i];

				// --- Flags with no argument ---
				if (arg.equals("-h") || arg.equals("--help"))
				{
					parsedArgs.helpFlag = true;
					return parsedArgs;
				}
				if (arg.equals("--version"))
				{
					parsedArgs.versionFlag = true;
					return parsedArgs;
				}
				if (arg.equals("-v") || arg.equals("--verbose"))
				{
					parsedArgs.verboseFlag = true;
					Debug.ENABLE_DEBUG = true;
					continue;
				}
				if (arg.equals("--json"))
				{
					parsedArgs.jsonInput = true;
					continue;
				}
				if (arg.equals("--markdown"))
				{
					parsedArgs.options = parsedArgs.options.withMarkdown(true);
					continue;
				}
				if (arg.equals("--blank-lines"))
				{
					parsedArgs.options = parsedArgs.options.withBlankLines(true);
					continue;
				}
				if (arg.equals("--line-numbers"))
				{
					parsedArgs.options = parsedArgs.options.withLineNumbers(true);
					continue;
				}
				if (arg.equals("--dump-ir"))
				{
					parsedArgs.dumpIr = true;
					continue;
				}
				if (arg.equals("--strict"))
				{
					parsedArgs.strict = true;
					continue;
				}

				// --- Flags with one argument ---
				if (arg.equals("-o") || arg.equals("--output"))
				{
					parsedArgs.outputPath = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}
				if (arg.equals("--indent"))
				{
					parsedArgs.options = parsedArgs.options.withIndentSize(getIntArg(args, ++i, arg));
					continue;
				}
				if (arg.equals("--max-line"))
				{
					parsedArgs.options = parsedArgs.options.withMaxLineLength(getIntArg(args, ++i, arg));
					continue;
				}

				// --- Handle file inputs ---
				if (arg.startsWith("-"))
				{
					throw new IllegalArgumentException("Unknown option: " + arg);
				}
				parsedArgs.inputFiles.add(Paths.get(arg));
			}

			if (parsedArgs.outputPath != null && parsedArgs.inputFiles.size() > 1)
			{
				throw new IllegalArgumentException("-o/--output can only be used with a single input file");
			}
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError(e.getMessage());
			parsedArgs.helpFlag = true;
			parsedArgs.invalid = true;
		}

		return parsedArgs;
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	private static int getIntArg(String[] args, int i, String flag)
	{
		String value = getNextArg(args, i, flag);
		try
		{
			return Integer.parseInt(value);
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("Expected a number after " + flag + ", got '" + value + "'");
		}
	}

	public static void printUsage()
	{
		System.out.println("OVERVIEW: Translates a subset of Python into IGCSE pseudocode.");
		System.out.println("\nUSAGE: pygcse [options] file...");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                Show this help message and exit.");
		System.out.println("  --version                 Show version and exit.");
		System.out.println("  -v, --verbose             Enable verbose debug logging.");
		System.out.println("  -o, --output <file>       Write the result to <file> (single input only).");
		System.out.println("  --json                    Inputs are JSON dumps of Python's ast module.");
		System.out.println("  --indent <n>              Spaces per indentation level (default " + ConversionOptions.DEFAULT_INDENT + ").");
		System.out.println("  --max-line <n>            Warn about lines longer than <n> (default " + ConversionOptions.DEFAULT_MAX_LINE + ").");
		System.out.println("\nFLAGS:");
		System.out.println("  --markdown                Wrap the output in a Markdown document.");
		System.out.println("  --blank-lines             Separate procedures and functions with blank lines.");
		System.out.println("  --line-numbers            Number the output lines.");
		System.out.println("  --dump-ir                 Also write the IR as JSON next to the output.");
		System.out.println("  --strict                  Exit with status 1 on warnings as well as errors.");
		System.out.println("\nWith one input and no -o the result goes to standard output; with several,");
		System.out.println("each is written next to its input with a .pseudo (or .md) extension.");
	}

	// --- Getters ---

	public List<Path> getInputFiles()
	{
		return inputFiles;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	/**
	 * True if parsing failed; the usage text is shown and the run ends with status 2.
	 */
	public boolean isInvalid()
	{
		return invalid;
	}

	public boolean isVersionFlag()
	{
		return versionFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public Path getOutputPath()
	{
		return outputPath;
	}

	public boolean isJsonInput()
	{
		return jsonInput;
	}

	public boolean isDumpIr()
	{
		return dumpIr;
	}

	public boolean isStrict()
	{
		return strict;
	}

	public ConversionOptions getOptions()
	{
		return options;
	}
}
