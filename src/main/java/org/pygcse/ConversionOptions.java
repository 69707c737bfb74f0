package org.pygcse;

/**
 * Settings for one converter. Immutable; the {@code with*} methods return a copy.
 *
 * @param indentSize         spaces per nesting level
 * @param maxLineLength      lines longer than this raise a warning
 * @param blankLines         surround procedures and functions with blank lines
 * @param lineNumbers        prefix every line with its number
 * @param lineEnding         separator placed between output lines
 * @param emptyArrayCapacity upper bound declared for arrays created from {@code []}
 * @param markdown           wrap the output in a Markdown document
 */
public record ConversionOptions(int indentSize, int maxLineLength, boolean blankLines, boolean lineNumbers,
								String lineEnding, int emptyArrayCapacity, boolean markdown)
{
	public static final int DEFAULT_INDENT = 2;
	public static final int DEFAULT_MAX_LINE = 80;
	public static final int DEFAULT_CAPACITY = 100;

	public ConversionOptions
	{
		if (indentSize < 0)
		{
			throw new IllegalArgumentException("Indent size must not be negative: " + indentSize);
		}
		if (maxLineLength < 1)
		{
			throw new IllegalArgumentException("Maximum line length must be positive: " + maxLineLength);
		}
		if (emptyArrayCapacity < 1)
		{
			throw new IllegalArgumentException("Array capacity must be positive: " + emptyArrayCapacity);
		}
		if (lineEnding == null)
		{
			lineEnding = "\n";
		}
	}

	public static ConversionOptions defaults()
	{
		return new ConversionOptions(DEFAULT_INDENT, DEFAULT_MAX_LINE, false, false, "\n", DEFAULT_CAPACITY, false);
	}

	public ConversionOptions withIndentSize(int indentSize)
	{
		return new ConversionOptions(indentSize, maxLineLength, blankLines, lineNumbers, lineEnding, emptyArrayCapacity, markdown);
	}

	public ConversionOptions withMaxLineLength(int maxLineLength)
	{
		return new ConversionOptions(indentSize, maxLineLength, blankLines, lineNumbers, lineEnding, emptyArrayCapacity, markdown);
	}

	public ConversionOptions withBlankLines(boolean blankLines)
	{
		return new ConversionOptions(indentSize, maxLineLength, blankLines, lineNumbers, lineEnding, emptyArrayCapacity, markdown);
	}

	public ConversionOptions withLineNumbers(boolean lineNumbers)
	{
		return new ConversionOptions(indentSize, maxLineLength, blankLines, lineNumbers, lineEnding, emptyArrayCapacity, markdown);
	}

	public ConversionOptions withLineEnding(String lineEnding)
	{
		return new ConversionOptions(indentSize, maxLineLength, blankLines, lineNumbers, lineEnding, emptyArrayCapacity, markdown);
	}

	public ConversionOptions withEmptyArrayCapacity(int emptyArrayCapacity)
	{
		return new ConversionOptions(indentSize, maxLineLength, blankLines, lineNumbers, lineEnding, emptyArrayCapacity, markdown);
	}

	public ConversionOptions withMarkdown(boolean markdown)
	{
		return new ConversionOptions(indentSize, maxLineLength, blankLines, lineNumbers, lineEnding, emptyArrayCapacity, markdown);
	}
}
