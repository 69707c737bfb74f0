package org.pygcse.ast;

public enum UnaryOperator
{
	PLUS("+", "UAdd"),
	MINUS("-", "USub"),
	NOT("NOT", "Not"),
	INVERT("~", "Invert");

	private final String pseudocode;
	private final String pythonName;

	UnaryOperator(String pseudocode, String pythonName)
	{
		this.pseudocode = pseudocode;
		this.pythonName = pythonName;
	}

	public String getPseudocode()
	{
		return pseudocode;
	}

	public static UnaryOperator fromSymbol(String symbol)
	{
		return switch (symbol)
		{
			case "+" -> PLUS;
			case "-" -> MINUS;
			case "not" -> NOT;
			case "~" -> INVERT;
			default -> throw new IllegalArgumentException("Unknown unary operator: " + symbol);
		};
	}

	public static UnaryOperator fromPythonName(String name)
	{
		for (UnaryOperator op : values())
		{
			if (op.pythonName.equals(name))
			{
				return op;
			}
		}
		return null;
	}
}
