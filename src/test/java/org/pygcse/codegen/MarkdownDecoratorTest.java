package org.pygcse.codegen;

import org.junit.jupiter.api.Test;
import org.pygcse.ir.IRKind;
import org.pygcse.ir.IRMeta;
import org.pygcse.ir.IRNode;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownDecoratorTest
{
	@Test
	void documentLayout()
	{
		String doc = new MarkdownDecorator().decorate("x ← 1", null, null);
		String expected = String.join("\n",
				"## IGCSE Pseudocode",
				"",
				"### Pseudocode",
				"",
				"```pseudocode",
				"x ← 1",
				"```",
				"",
				"---",
				"*Generated by pygcse*");
		assertEquals(expected, doc);
	}

	@Test
	void contentsListRoutinesButNotConstructors()
	{
		IRNode root = IRNode.block();
		IRNode classNode = new IRNode(IRKind.CLASS, "CLASS Dog", new IRMeta.ClassMeta("Dog", null));
		classNode.addChild(new IRNode(IRKind.PROCEDURE, "PUBLIC PROCEDURE NEW()", new IRMeta.RoutineMeta("NEW", List.of(), false, null)));
		root.addChild(classNode);
		root.addChild(new IRNode(IRKind.FUNCTION, "FUNCTION f() RETURNS INTEGER", new IRMeta.RoutineMeta("f", List.of(), true, "INTEGER")));

		assertEquals(List.of("Dog", "f"), MarkdownDecorator.routineNames(root));
		String doc = new MarkdownDecorator(1, "\n").decorate("", "prog.py", root);
		assertTrue(doc.startsWith("# prog.py\n\n## Contents\n\n- `Dog`\n- `f`\n"));
	}

	@Test
	void headingLevelIsChecked()
	{
		assertThrows(IllegalArgumentException.class, () -> new MarkdownDecorator(6, "\n"));
	}
}
