package org.pygcse.semantic.symbol;

import org.pygcse.ir.IRNode;

/**
 * What is known about an array: its declared size, element type, the next
 * free 0-based slot, and the declaration node so appends can widen it.
 * {@code nextIndex} doubles as the element count while {@code lengthKnown} holds.
 */
public class ArraySymbol
{
	private final String name;
	private String elementType;
	private int size;
	private int nextIndex;
	private final IRNode declaration;
	// false once the element count depends on run-time behaviour
	private boolean lengthKnown = true;
	// declared with the default capacity rather than a literal's size
	private boolean capacityDeclared = false;
	// variable holding the element count once appends happen inside a loop
	private String counter;

	public ArraySymbol(String name, String elementType, int size, int nextIndex, IRNode declaration)
	{
		this.name = name;
		this.elementType = elementType;
		this.size = size;
		this.nextIndex = nextIndex;
		this.declaration = declaration;
	}

	public String getName()
	{
		return name;
	}

	public String getElementType()
	{
		return elementType;
	}

	public void setElementType(String elementType)
	{
		this.elementType = elementType;
	}

	public int getSize()
	{
		return size;
	}

	public void setSize(int size)
	{
		this.size = size;
	}

	public int getNextIndex()
	{
		return nextIndex;
	}

	public void setNextIndex(int nextIndex)
	{
		this.nextIndex = nextIndex;
	}

	public IRNode getDeclaration()
	{
		return declaration;
	}

	public boolean isLengthKnown()
	{
		return lengthKnown;
	}

	public void setLengthKnown(boolean lengthKnown)
	{
		this.lengthKnown = lengthKnown;
	}

	public boolean isCapacityDeclared()
	{
		return capacityDeclared;
	}

	public void setCapacityDeclared(boolean capacityDeclared)
	{
		this.capacityDeclared = capacityDeclared;
	}

	public String getCounter()
	{
		return counter;
	}

	public void setCounter(String counter)
	{
		this.counter = counter;
	}
}
