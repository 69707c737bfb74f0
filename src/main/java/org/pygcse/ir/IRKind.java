package org.pygcse.ir;

public enum IRKind
{
	ASSIGNMENT,
	OUTPUT,
	INPUT,
	CONDITIONAL,
	CONDITIONAL_BRANCH,
	LOOP_FOR,
	LOOP_WHILE,
	LOOP_REPEAT,
	PROCEDURE,
	FUNCTION,
	RETURN,
	ARRAY_DECLARATION,
	RECORD_TYPE,
	CLASS,
	CASE,
	CASE_BRANCH,
	STATEMENT,
	COMMENT,
	BLOCK,
	// Closing line of a block construct (NEXT i, ENDWHILE, UNTIL ...), rendered at its parent's level.
	TERMINATOR;

	public boolean isRoutine()
	{
		return this == PROCEDURE || this == FUNCTION;
	}

	public boolean isLoop()
	{
		return this == LOOP_FOR || this == LOOP_WHILE || this == LOOP_REPEAT;
	}
}
