package org.pygcse.codegen;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TextFormatterTest
{
	private final TextFormatter formatter = new TextFormatter();

	@Test
	void operatorsGetSingleSpaces()
	{
		assertEquals("x ← 1", formatter.format("x←1"));
		assertEquals("a - b * c", formatter.format("a-b  *c"));
	}

	@Test
	void punctuationIsTight()
	{
		assertEquals("a[i]", formatter.format("a[ i ]"));
		assertEquals("f(a, b)", formatter.format("f( a ,b )"));
		assertEquals("p.x ← 1", formatter.format("p . x ← 1"));
	}

	@Test
	void unarySignStaysWithOperand()
	{
		assertEquals("x ← -1", formatter.format("x ← - 1"));
		assertEquals("FOR i ← 10 TO 2 STEP -2", formatter.format("FOR i ← 10 TO 2 STEP - 2"));
		assertEquals("f(-x, y)", formatter.format("f(- x, y)"));
	}

	@Test
	void stringsAreUntouched()
	{
		assertEquals("OUTPUT \"a  +b\"", formatter.format("OUTPUT   \"a  +b\""));
		assertEquals("OUTPUT 'if x'", formatter.format("OUTPUT 'if x'"));
	}

	@Test
	void commentsAreUntouched()
	{
		assertEquals("x ← 1 // keep  this", formatter.format("x←1 // keep  this"));
	}

	@Test
	void lowercaseKeywordsAreUppercased()
	{
		assertEquals("IF x > 0 THEN", formatter.format("if x > 0 then"));
	}

	@Test
	void keywordUsedAsIdentifierKeepsItsCase()
	{
		assertEquals("step ← 2", formatter.format("step ← 2"));
		assertEquals("OUTPUT NEXT", formatter.format("OUTPUT next"));
		assertEquals("OUTPUT next", new TextFormatter(Set.of("next")).format("OUTPUT next"));
	}

	@Test
	void formattingIsIdempotent()
	{
		String[] lines = {
				"IF score ≥ 50 AND NOT done THEN",
				"x ← -(a + b) * 2",
				"OUTPUT \"Total: \" & STRING(total)",
				"DECLARE data : ARRAY[1:3] OF INTEGER",
				"ROUND(RANDOM() * (6 - 1) + 1, 0)"
		};
		for (String line : lines)
		{
			String once = formatter.format(line);
			assertEquals(once, formatter.format(once));
			assertEquals(line, once);
		}
	}

	@Test
	void blankLineStaysEmpty()
	{
		assertEquals("", formatter.format("   "));
	}
}
