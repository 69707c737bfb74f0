package org.pygcse.ast;

public enum CompareOperator
{
	EQ("=", "==", "Eq"),
	NOT_EQ("≠", "!=", "NotEq"),
	LT("<", "<", "Lt"),
	LT_E("≤", "<=", "LtE"),
	GT(">", ">", "Gt"),
	GT_E("≥", ">=", "GtE"),
	IS("=", "is", "Is"),
	IS_NOT("≠", "is not", "IsNot"),
	IN("IN", "in", "In"),
	NOT_IN("NOT IN", "not in", "NotIn");

	private final String pseudocode;
	private final String symbol;
	private final String pythonName;

	CompareOperator(String pseudocode, String symbol, String pythonName)
	{
		this.pseudocode = pseudocode;
		this.symbol = symbol;
		this.pythonName = pythonName;
	}

	public String getPseudocode()
	{
		return pseudocode;
	}

	public static CompareOperator fromSymbol(String symbol)
	{
		String normalized = symbol.trim().replaceAll("\\s+", " ");
		for (CompareOperator op : values())
		{
			if (op.symbol.equals(normalized))
			{
				return op;
			}
		}
		throw new IllegalArgumentException("Unknown comparison operator: " + symbol);
	}

	public static CompareOperator fromPythonName(String name)
	{
		for (CompareOperator op : values())
		{
			if (op.pythonName.equals(name))
			{
				return op;
			}
		}
		return null;
	}
}
