package org.pygcse.ast;

public enum BooleanOperator
{
	AND,
	OR
}
