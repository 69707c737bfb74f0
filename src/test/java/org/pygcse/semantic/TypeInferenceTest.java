package org.pygcse.semantic;

import org.junit.jupiter.api.Test;
import org.pygcse.parser.SourceParser;
import org.pygcse.semantic.type.PseudoType;

import static org.junit.jupiter.api.Assertions.*;

class TypeInferenceTest
{
	private final SymbolContext context = new SymbolContext();
	private final TypeInference types = new TypeInference(context);

	private PseudoType infer(String source)
	{
		return types.infer(new SourceParser().parseExpression(source));
	}

	@Test
	void literals()
	{
		assertEquals(PseudoType.INTEGER, infer("42"));
		assertEquals(PseudoType.REAL, infer("4.2"));
		assertEquals(PseudoType.STRING, infer("\"hi\""));
		assertEquals(PseudoType.BOOLEAN, infer("True"));
		assertEquals(PseudoType.ARRAY, infer("[1, 2]"));
	}

	@Test
	void arithmetic()
	{
		assertEquals(PseudoType.REAL, infer("7 / 2"));
		assertEquals(PseudoType.INTEGER, infer("7 // 2"));
		assertEquals(PseudoType.INTEGER, infer("a + b"));
		assertEquals(PseudoType.REAL, infer("a * 1.5"));
	}

	@Test
	void stringOperandMakesString()
	{
		context.declareVariable("name", PseudoType.STRING, 1);
		assertEquals(PseudoType.STRING, infer("name + 1"));
		assertEquals(PseudoType.STRING, infer("name[0]"));
	}

	@Test
	void builtinCalls()
	{
		assertEquals(PseudoType.INTEGER, infer("len(a)"));
		assertEquals(PseudoType.STRING, infer("input()"));
		assertEquals(PseudoType.REAL, infer("round(x, 2)"));
		context.registerFunction("area", PseudoType.REAL);
		assertEquals(PseudoType.REAL, infer("area(3)"));
	}

	@Test
	void unknownFallsBackToString()
	{
		assertNull(infer("foo"));
		assertEquals(PseudoType.STRING, types.inferOrDefault(new SourceParser().parseExpression("foo")));
	}
}
