package org.pygcse.semantic.symbol;

import org.pygcse.semantic.type.PseudoType;

/**
 * A variable and the type inferred at its first assignment.
 */
public class VariableSymbol
{
	private final String name;
	private final PseudoType type;
	private final int line;

	public VariableSymbol(String name, PseudoType type, int line)
	{
		this.name = name;
		this.type = type;
		this.line = line;
	}

	public String getName()
	{
		return name;
	}

	public PseudoType getType()
	{
		return type;
	}

	public int getLine()
	{
		return line;
	}
}
