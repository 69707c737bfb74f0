package org.pygcse.parser;

import org.junit.jupiter.api.Test;
import org.pygcse.ast.BinaryOperator;
import org.pygcse.ast.Expr;
import org.pygcse.ast.Module;
import org.pygcse.ast.Stmt;

import static org.junit.jupiter.api.Assertions.*;

class JsonTreeReaderTest
{
	private static Module read(String json)
	{
		return new JsonTreeReader().read(json);
	}

	@Test
	void readsPythonAstDump()
	{
		Module module = read("""
				{"type": "Module", "body": [
				  {"type": "Assign", "lineno": 3,
				   "targets": [{"type": "Name", "id": "total"}],
				   "value": {"type": "BinOp",
				             "left": {"type": "Name", "id": "a"},
				             "op": {"type": "Add"},
				             "right": {"type": "Constant", "value": 1.5}}}
				]}
				""");
		Stmt.Assign assign = assertInstanceOf(Stmt.Assign.class, module.body().get(0));
		assertEquals(3, assign.line());
		Expr.BinOp value = assertInstanceOf(Expr.BinOp.class, assign.value());
		assertEquals(BinaryOperator.ADD, value.op());
		assertEquals(new Expr.Num("1.5"), value.right());
	}

	@Test
	void constantsMapToLiterals()
	{
		Module module = read("""
				{"type": "Module", "body": [
				  {"type": "Expr", "value": {"type": "Constant", "value": true}},
				  {"type": "Expr", "value": {"type": "Constant", "value": null}},
				  {"type": "Expr", "value": {"type": "Constant", "value": "say \\"hi\\""}}
				]}
				""");
		assertEquals(new Expr.Bool(true), ((Stmt.ExprStmt) module.body().get(0)).value());
		assertEquals(new Expr.NoneLit(), ((Stmt.ExprStmt) module.body().get(1)).value());
		assertEquals(new Expr.Str("say \"hi\"", '\''), ((Stmt.ExprStmt) module.body().get(2)).value());
	}

	@Test
	void missingFieldBecomesNull()
	{
		Module module = read("""
				{"type": "Module", "body": [{"type": "If", "lineno": 1, "body": [], "orelse": []}]}
				""");
		assertNull(((Stmt.If) module.body().get(0)).test());
	}

	@Test
	void unknownStatementIsKept()
	{
		Module module = read("""
				{"type": "Module", "body": [{"type": "AsyncFor", "lineno": 4}]}
				""");
		Stmt.Unknown unknown = assertInstanceOf(Stmt.Unknown.class, module.body().get(0));
		assertEquals("AsyncFor", unknown.type());
	}

	@Test
	void invalidJsonIsSyntaxError()
	{
		assertThrows(SyntaxException.class, () -> read("{not json"));
		assertThrows(SyntaxException.class, () -> read("[1, 2]"));
	}

	@Test
	void errorObjectIsReported()
	{
		SyntaxException e = assertThrows(SyntaxException.class,
				() -> read("{\"error\": {\"msg\": \"invalid syntax\", \"lineno\": 7}}"));
		assertEquals(7, e.getLine());
	}
}
