package org.pygcse.parser;

/**
 * Raised when the source text is not valid in the supported Python subset.
 */
public class SyntaxException extends RuntimeException
{
	private final int line;
	private final int column;

	public SyntaxException(String message, int line, int column)
	{
		super(message);
		this.line = line;
		this.column = column;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}
}
