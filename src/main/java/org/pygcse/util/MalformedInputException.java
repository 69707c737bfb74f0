package org.pygcse.util;

/**
 * Thrown when a syntax node lacks a field its construct cannot do without,
 * such as an {@code if} with no condition. Aborts the enclosing top-level
 * statement only.
 */
public class MalformedInputException extends RuntimeException
{
	private final int line;

	public MalformedInputException(String message, int line)
	{
		super(message);
		this.line = line;
	}

	public int getLine()
	{
		return line;
	}
}
