package org.pygcse.ir;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IRNodeTest
{
	@Test
	void childKnowsItsParent()
	{
		IRNode parent = IRNode.block();
		IRNode child = new IRNode(IRKind.OUTPUT, "OUTPUT 1");
		parent.addChild(child);
		assertSame(parent, child.getParent());
		assertSame(child, parent.lastChild());
	}

	@Test
	void nodeCannotHaveTwoParents()
	{
		IRNode child = new IRNode(IRKind.OUTPUT, "OUTPUT 1");
		IRNode.block().addChild(child);
		assertThrows(IllegalStateException.class, () -> IRNode.block().addChild(child));
	}

	@Test
	void nodeCannotContainItself()
	{
		IRNode node = IRNode.block();
		assertThrows(IllegalArgumentException.class, () -> node.addChild(node));
	}

	@Test
	void childrenAreReadOnly()
	{
		IRNode node = IRNode.block();
		assertThrows(UnsupportedOperationException.class, () -> node.getChildren().add(IRNode.block()));
	}

	@Test
	void commentAndNullText()
	{
		assertEquals("// note", IRNode.comment("note").getText());
		assertEquals("", new IRNode(IRKind.STATEMENT, null).getText());
	}

	@Test
	void firstBelowStopsAtExcludedNodes()
	{
		IRNode inner = new IRNode(IRKind.LOOP_WHILE, "WHILE TRUE DO");
		IRNode output = new IRNode(IRKind.OUTPUT, "OUTPUT 1");
		inner.addChild(output);
		IRNode routine = new IRNode(IRKind.PROCEDURE, "PROCEDURE p()");
		routine.addChild(inner);
		IRNode root = IRNode.block().addChild(routine);

		assertSame(output, IRTrees.firstBelow(root, n -> n.getKind() == IRKind.OUTPUT, n -> true));
		assertNull(IRTrees.firstBelow(root, n -> n.getKind() == IRKind.OUTPUT, n -> !n.getKind().isRoutine()));
	}
}
