package org.pygcse.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One pseudocode construct. {@code children} are the nested block content;
 * every node has at most one parent, so the tree is acyclic.
 */
public class IRNode
{
	private final IRKind kind;
	private String text;
	private IRMeta meta;
	private final List<IRNode> children = new ArrayList<>();
	private IRNode parent;

	public IRNode(IRKind kind, String text)
	{
		this(kind, text, null);
	}

	public IRNode(IRKind kind, String text, IRMeta meta)
	{
		this.kind = kind;
		this.text = text == null ? "" : text;
		this.meta = meta;
	}

	public static IRNode block()
	{
		return new IRNode(IRKind.BLOCK, "");
	}

	public static IRNode terminator(String text)
	{
		return new IRNode(IRKind.TERMINATOR, text);
	}

	public static IRNode comment(String text)
	{
		return new IRNode(IRKind.COMMENT, "// " + text);
	}

	public IRNode addChild(IRNode child)
	{
		if (child == this)
		{
			throw new IllegalArgumentException("An IR node cannot contain itself");
		}
		if (child.parent != null)
		{
			throw new IllegalStateException("IR node " + child.kind + " '" + child.text + "' already has a parent");
		}
		child.parent = this;
		children.add(child);
		return this;
	}

	public IRNode addChildren(List<IRNode> nodes)
	{
		for (IRNode node : nodes)
		{
			addChild(node);
		}
		return this;
	}

	public IRKind getKind()
	{
		return kind;
	}

	public String getText()
	{
		return text;
	}

	public void setText(String text)
	{
		this.text = text;
	}

	public IRMeta getMeta()
	{
		return meta;
	}

	public void setMeta(IRMeta meta)
	{
		this.meta = meta;
	}

	public List<IRNode> getChildren()
	{
		return Collections.unmodifiableList(children);
	}

	public IRNode getParent()
	{
		return parent;
	}

	public IRNode lastChild()
	{
		return children.isEmpty() ? null : children.get(children.size() - 1);
	}

	@Override
	public String toString()
	{
		return kind + "(" + text + ")";
	}
}
