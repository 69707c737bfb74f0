package org.pygcse.translate;

import org.junit.jupiter.api.Test;
import org.pygcse.ast.Expr;
import org.pygcse.parser.SourceParser;
import org.pygcse.semantic.SymbolContext;
import org.pygcse.semantic.TypeInference;
import org.pygcse.util.ErrorHandler;
import org.pygcse.util.MalformedInputException;

import static org.junit.jupiter.api.Assertions.*;

class RangeBoundsTest
{
	private static RangeBounds resolve(String call)
	{
		SymbolContext context = new SymbolContext();
		ExpressionTranslator expressions = new ExpressionTranslator(context, new TypeInference(context), new ErrorHandler());
		Expr.Call range = (Expr.Call) new SourceParser().parseExpression(call);
		return RangeBounds.resolve(range.args(), expressions);
	}

	@Test
	void singleArgumentCountsFromZero()
	{
		RangeBounds bounds = resolve("range(5)");
		assertEquals("0", bounds.start());
		assertEquals("4", bounds.end());
		assertNull(bounds.step());
	}

	@Test
	void oversizedLiteralIsNotFolded()
	{
		assertEquals("99999999999999999999 - 1", resolve("range(99999999999999999999)").end());
		assertTrue(resolve("range(0, 10, 99999999999999999999)").approximate());
	}

	@Test
	void symbolicEndIsOffset()
	{
		assertEquals("n - 1", resolve("range(n)").end());
		assertEquals("n", resolve("range(1, n + 1)").end());
		assertEquals("LENGTH(a) - 1", resolve("range(len(a))").end());
	}

	@Test
	void literalStepUsesLastValueReached()
	{
		RangeBounds bounds = resolve("range(0, 10, 3)");
		assertEquals("9", bounds.end());
		assertEquals("3", bounds.step());
		assertFalse(bounds.approximate());
	}

	@Test
	void negativeStepCountsDown()
	{
		RangeBounds bounds = resolve("range(10, 0, -2)");
		assertEquals("10", bounds.start());
		assertEquals("2", bounds.end());
		assertEquals("-2", bounds.step());
	}

	@Test
	void symbolicStepIsApproximate()
	{
		RangeBounds bounds = resolve("range(0, n, k)");
		assertTrue(bounds.approximate());
		assertEquals("k", bounds.step());
	}

	@Test
	void lastValueOfEmptyRangeIsNeverReached()
	{
		assertEquals(4, RangeBounds.lastValue(5, 1, 1));
		assertEquals(2, RangeBounds.lastValue(1, 5, -1));
	}

	@Test
	void zeroStepIsRejected()
	{
		assertThrows(MalformedInputException.class, () -> resolve("range(0, 5, 0)"));
	}

	@Test
	void tooManyArgumentsAreRejected()
	{
		assertThrows(MalformedInputException.class, () -> resolve("range(1, 2, 3, 4)"));
	}
}
