package org.pygcse.ast;

public enum BinaryOperator
{
	ADD("+", "Add"),
	SUB("-", "Sub"),
	MULT("*", "Mult"),
	DIV("/", "Div"),
	FLOOR_DIV("DIV", "FloorDiv"),
	MOD("MOD", "Mod"),
	POW("^", "Pow");

	private final String pseudocode;
	private final String pythonName;

	BinaryOperator(String pseudocode, String pythonName)
	{
		this.pseudocode = pseudocode;
		this.pythonName = pythonName;
	}

	public String getPseudocode()
	{
		return pseudocode;
	}

	public static BinaryOperator fromSymbol(String symbol)
	{
		return switch (symbol)
		{
			case "+" -> ADD;
			case "-" -> SUB;
			case "*" -> MULT;
			case "/" -> DIV;
			case "//" -> FLOOR_DIV;
			case "%" -> MOD;
			case "**" -> POW;
			default -> throw new IllegalArgumentException("Unknown binary operator: " + symbol);
		};
	}

	/**
	 * Resolves an operator by its Python {@code ast} class name, e.g. {@code FloorDiv}.
	 */
	public static BinaryOperator fromPythonName(String name)
	{
		for (BinaryOperator op : values())
		{
			if (op.pythonName.equals(name))
			{
				return op;
			}
		}
		return null;
	}
}
