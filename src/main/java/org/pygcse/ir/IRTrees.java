package org.pygcse.ir;

import java.util.function.Predicate;

/**
 * Read-only queries over an IR tree.
 */
public final class IRTrees
{
	private IRTrees()
	{
	}

	/**
	 * The first matching descendant in source order, or {@code null}. Nodes for
	 * which {@code descend} is false are tested but not entered.
	 */
	public static IRNode firstBelow(IRNode root, Predicate<IRNode> match, Predicate<IRNode> descend)
	{
		for (IRNode child : root.getChildren())
		{
			if (match.test(child))
			{
				return child;
			}
			if (descend.test(child))
			{
				IRNode found = firstBelow(child, match, descend);
				if (found != null)
				{
					return found;
				}
			}
		}
		return null;
	}
}
