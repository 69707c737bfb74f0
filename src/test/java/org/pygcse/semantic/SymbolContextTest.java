package org.pygcse.semantic;

import org.junit.jupiter.api.Test;
import org.pygcse.semantic.type.PseudoType;

import static org.junit.jupiter.api.Assertions.*;

class SymbolContextTest
{
	@Test
	void firstDeclaredTypeWins()
	{
		SymbolContext context = new SymbolContext();
		context.declareVariable("x", PseudoType.INTEGER, 1);
		context.declareVariable("x", PseudoType.STRING, 2);
		assertEquals(PseudoType.INTEGER, context.getType("x"));
		assertTrue(context.isDeclared("x"));
		assertFalse(context.isDeclared("y"));
	}

	@Test
	void freshIndexAvoidsProgramNames()
	{
		SymbolContext context = new SymbolContext();
		context.noteIdentifier("i");
		context.noteIdentifier("j");
		assertEquals("k", context.freshIndexName());
		assertEquals("m", context.freshIndexName());
	}

	@Test
	void freshTempNamesAreDistinct()
	{
		SymbolContext context = new SymbolContext();
		context.noteIdentifier("temp");
		String first = context.freshTempName();
		String second = context.freshTempName();
		assertNotEquals("temp", first);
		assertNotEquals(first, second);
	}

	@Test
	void loopScopeIsVisibleFromNestedBranch()
	{
		SymbolContext context = new SymbolContext();
		assertFalse(context.isInLoop());
		context.pushScope(SymbolContext.LOOP_SCOPE);
		context.pushScope(SymbolContext.BRANCH_SCOPE);
		assertTrue(context.isInLoop());
		assertEquals(2, context.getDepth());
		context.popScope();
		context.popScope();
		assertFalse(context.isInLoop());
	}

	@Test
	void globalScopeCannotBePopped()
	{
		assertThrows(IllegalStateException.class, () -> new SymbolContext().popScope());
	}

	@Test
	void routinesAreTracked()
	{
		SymbolContext context = new SymbolContext();
		context.registerFunction("area", PseudoType.REAL);
		context.registerProcedure("show");
		assertEquals(PseudoType.REAL, context.getReturnType("area"));
		assertTrue(context.isProcedure("show"));
		assertFalse(context.isProcedure("area"));
	}
}
