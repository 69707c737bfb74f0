package org.pygcse.util;

/**
 * A single warning or error reported while converting one program.
 *
 * @param severity whether the problem blocked part of the output
 * @param kind     the category of problem
 * @param message  human readable description
 * @param line     source line, or 0 when unknown
 */
public record Diagnostic(Severity severity, Kind kind, String message, int line)
{
	public enum Severity
	{
		WARNING,
		ERROR
	}

	public enum Kind
	{
		UNSUPPORTED_NODE("Unsupported Node"),
		UNKNOWN_EXPRESSION("Unknown Expression"),
		APPROXIMATION("Approximation"),
		LONG_LINE("Long Line"),
		MALFORMED_INPUT("Malformed Input"),
		SYNTAX("Syntax Error");

		private final String label;

		Kind(String label)
		{
			this.label = label;
		}

		public String getLabel()
		{
			return label;
		}
	}

	public boolean isError()
	{
		return severity == Severity.ERROR;
	}

	@Override
	public String toString()
	{
		if (line > 0)
		{
			return String.format("[%s] line %d - %s", kind.getLabel(), line, message);
		}
		return String.format("[%s] %s", kind.getLabel(), message);
	}
}
