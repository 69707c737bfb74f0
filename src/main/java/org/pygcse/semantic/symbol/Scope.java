package org.pygcse.semantic.symbol;

/**
 * One level of block nesting. Only used to know how deep the visitor is,
 * not for name resolution.
 */
public class Scope
{
	private final String name;
	private final Scope enclosingScope;
	private final int depth;

	public Scope(String name, Scope enclosingScope)
	{
		this.name = name;
		this.enclosingScope = enclosingScope;
		this.depth = enclosingScope == null ? 0 : enclosingScope.depth + 1;
	}

	public String getName()
	{
		return name;
	}

	public Scope getEnclosingScope()
	{
		return enclosingScope;
	}

	public int getDepth()
	{
		return depth;
	}

	public boolean isInside(String scopeName)
	{
		for (Scope s = this; s != null; s = s.enclosingScope)
		{
			if (s.name.equals(scopeName))
			{
				return true;
			}
		}
		return false;
	}
}
