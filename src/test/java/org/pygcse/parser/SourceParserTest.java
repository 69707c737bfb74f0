package org.pygcse.parser;

import org.junit.jupiter.api.Test;
import org.pygcse.ast.CompareOperator;
import org.pygcse.ast.Expr;
import org.pygcse.ast.Module;
import org.pygcse.ast.Stmt;

import static org.junit.jupiter.api.Assertions.*;

class SourceParserTest
{
	private static Module parse(String source)
	{
		return new SourceParser().parse(source);
	}

	@Test
	void assignmentWithLineNumber()
	{
		Module module = parse("\nx = 10");
		assertEquals(1, module.body().size());
		Stmt.Assign assign = assertInstanceOf(Stmt.Assign.class, module.body().get(0));
		assertEquals(2, assign.line());
		assertEquals(new Expr.Name("x"), assign.targets().get(0));
		assertEquals(new Expr.Num("10"), assign.value());
	}

	@Test
	void severalBlocksCloseOnOneDedent()
	{
		Module module = parse("""
				for i in x:
				    while a:
				        if b:
				            pass
				y = 1
				""");
		assertEquals(2, module.body().size());
		Stmt.For loop = assertInstanceOf(Stmt.For.class, module.body().get(0));
		Stmt.While inner = assertInstanceOf(Stmt.While.class, loop.body().get(0));
		assertInstanceOf(Stmt.If.class, inner.body().get(0));
		assertInstanceOf(Stmt.Assign.class, module.body().get(1));
	}

	@Test
	void elifNestsInOrelse()
	{
		Module module = parse("""
				if a:
				    pass
				elif b:
				    pass
				""");
		Stmt.If outer = assertInstanceOf(Stmt.If.class, module.body().get(0));
		assertEquals(1, outer.orelse().size());
		assertInstanceOf(Stmt.If.class, outer.orelse().get(0));
	}

	@Test
	void commentsAreKept()
	{
		Module module = parse("# start\nx = 1  # trailing\n");
		Stmt.Comment comment = assertInstanceOf(Stmt.Comment.class, module.body().get(0));
		assertEquals("start", comment.text());
		assertTrue(module.body().stream().anyMatch(s -> s instanceof Stmt.Comment c && c.text().equals("trailing")));
	}

	@Test
	void functionParametersAndDefaults()
	{
		Module module = parse("""
				def greet(name: str, times=2) -> None:
				    print(name)
				""");
		Stmt.FunctionDef def = assertInstanceOf(Stmt.FunctionDef.class, module.body().get(0));
		assertEquals("greet", def.name());
		assertEquals(2, def.params().size());
		assertEquals(new Expr.Name("str"), def.params().get(0).annotation());
		assertEquals(new Expr.Num("2"), def.params().get(1).defaultValue());
	}

	@Test
	void chainedComparisonKeepsAllOperators()
	{
		Expr.Compare compare = assertInstanceOf(Expr.Compare.class, new SourceParser().parseExpression("1 < x <= 10"));
		assertEquals(2, compare.ops().size());
		assertEquals(CompareOperator.LT_E, compare.ops().get(1));
	}

	@Test
	void negativeLiteralIsUnaryMinus()
	{
		assertInstanceOf(Expr.UnaryOp.class, new SourceParser().parseExpression("-2"));
	}

	@Test
	void formattedStringIsSplitIntoParts()
	{
		Expr.JoinedStr joined = assertInstanceOf(Expr.JoinedStr.class, new SourceParser().parseExpression("f\"a{b}c\""));
		assertEquals(3, joined.values().size());
	}

	@Test
	void syntaxErrorCarriesPosition()
	{
		SyntaxException e = assertThrows(SyntaxException.class, () -> parse("x = \ny = 2\n"));
		assertEquals(1, e.getLine());
	}
}
