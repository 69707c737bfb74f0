package org.pygcse.semantic.type;

/**
 * The data types of the pseudocode notation.
 */
public enum PseudoType
{
	INTEGER,
	REAL,
	STRING,
	CHAR,
	BOOLEAN,
	ARRAY,
	RECORD;

	/**
	 * Maps a Python annotation or builtin type name. Unknown names fall back to STRING.
	 */
	public static PseudoType fromPythonName(String name)
	{
		if (name == null)
		{
			return STRING;
		}
		return switch (name)
		{
			case "int" -> INTEGER;
			case "float" -> REAL;
			case "bool" -> BOOLEAN;
			case "list", "List", "tuple", "Tuple" -> ARRAY;
			case "dict", "Dict" -> RECORD;
			default -> STRING;
		};
	}

	public boolean isNumeric()
	{
		return this == INTEGER || this == REAL;
	}
}
