package org.pygcse.translate;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.pygcse.ir.IRKind;
import org.pygcse.ir.IRNode;
import org.pygcse.parser.SourceParser;
import org.pygcse.semantic.SymbolContext;
import org.pygcse.semantic.TypeInference;
import org.pygcse.semantic.symbol.ArraySymbol;
import org.pygcse.semantic.type.PseudoType;
import org.pygcse.util.Diagnostic;
import org.pygcse.util.ErrorHandler;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionTranslatorTest
{
	private SymbolContext context;
	private ErrorHandler errors;
	private ExpressionTranslator translator;

	@BeforeEach
	void setUp()
	{
		context = new SymbolContext();
		errors = new ErrorHandler();
		translator = new ExpressionTranslator(context, new TypeInference(context), errors);
	}

	private String translate(String source)
	{
		return translator.translate(new SourceParser().parseExpression(source));
	}

	// --- Operators ---

	@ParameterizedTest
	@CsvSource(delimiter = '|', value = {
			"a != b     | a ≠ b",
			"a <= b     | a ≤ b",
			"a >= b     | a ≥ b",
			"a == b     | a = b",
			"a is None  | a = NULL",
			"x in items | x IN items",
			"a ** 2     | a ^ 2",
			"-x         | -x"
	})
	void operatorSymbols(String python, String pseudocode)
	{
		assertEquals(pseudocode, translate(python));
	}

	@Test
	void chainedComparisonSplitsIntoConjunction()
	{
		assertEquals("1 < x AND x < 10", translate("1 < x < 10"));
	}

	@Test
	void parenthesesOnlyWhereNeeded()
	{
		assertEquals("a + b * c", translate("a + b * c"));
		assertEquals("(a + b) * c", translate("(a + b) * c"));
		assertEquals("a - (b - c)", translate("a - (b - c)"));
	}

	@Test
	void integerDivisionAndModulo()
	{
		assertEquals("a DIV b", translate("a // b"));
		assertEquals("a MOD 2", translate("a % 2"));
	}

	@Test
	void booleanOperators()
	{
		assertEquals("x = 1 AND NOT y", translate("x == 1 and not y"));
		assertEquals("TRUE OR FALSE", translate("True or False"));
	}

	@Test
	void stringConcatenationUsesAmpersand()
	{
		assertEquals("\"Hi \" & name", translate("\"Hi \" + name"));
	}

	@Test
	void formattedStringBecomesConcatenation()
	{
		assertEquals("\"Hi \" & name", translate("f\"Hi {name}\""));
	}

	// --- Calls ---

	@Test
	void builtinsMapToPseudocodeFunctions()
	{
		assertEquals("LENGTH(a)", translate("len(a)"));
		assertEquals("STRING(n)", translate("str(n)"));
		assertEquals("UCASE(s)", translate("s.upper()"));
	}

	@Test
	void randomIntegerInRange()
	{
		assertEquals("ROUND(RANDOM() * (6 - 1) + 1, 0)", translate("random.randint(1, 6)"));
	}

	// --- Indexing ---

	@Test
	void literalIndexShiftsToOneBased()
	{
		assertEquals("a[1]", translate("a[0]"));
		assertEquals("a[i + 1]", translate("a[i]"));
	}

	@Test
	void indexOffsetIsFolded()
	{
		assertEquals("a[i]", translate("a[i - 1]"));
		assertEquals("a[i + 2]", translate("a[i + 1]"));
	}

	@Test
	void oneBasedCounterIsNotShifted()
	{
		context.markOneBased("i");
		assertEquals("a[i]", translate("a[i]"));
	}

	@Test
	void negativeIndexWithUnknownSize()
	{
		assertEquals("a[LENGTH(a)]", translate("a[-1]"));
		assertEquals("a[LENGTH(a) - 1]", translate("a[-2]"));
	}

	@Test
	void negativeIndexWithKnownSize()
	{
		context.registerArray(new ArraySymbol("a", "INTEGER", 5, 5, new IRNode(IRKind.ARRAY_DECLARATION, "")));
		assertEquals("a[5]", translate("a[-1]"));
	}

	@Test
	void negativeIndexCountsFilledSlotsNotCapacity()
	{
		context.registerArray(new ArraySymbol("a", "INTEGER", 100, 2, new IRNode(IRKind.ARRAY_DECLARATION, "")));
		assertEquals("a[2]", translate("a[-1]"));
		assertEquals("a[1]", translate("a[-2]"));
	}

	@Test
	void negativeIndexUsesAppendCounter()
	{
		ArraySymbol array = new ArraySymbol("a", "INTEGER", 100, 0, new IRNode(IRKind.ARRAY_DECLARATION, ""));
		array.setLengthKnown(false);
		array.setCounter("aCount");
		context.registerArray(array);
		assertEquals("a[aCount]", translate("a[-1]"));
		assertEquals("a[aCount - 1]", translate("a[-2]"));
	}

	@Test
	void oversizedIndexIsNotFolded()
	{
		assertEquals("a[99999999999999999999 + 1]", translate("a[99999999999999999999]"));
		assertEquals("a[-99999999999999999999 + 1]", translate("a[-99999999999999999999]"));
		assertEquals("a[i + 99999999999999999999 + 1]", translate("a[i + 99999999999999999999]"));
	}

	@Test
	void stringKeyIsNotShifted()
	{
		assertEquals("d[\"k\"]", translate("d[\"k\"]"));
	}

	@Test
	void sliceBecomesSubstring()
	{
		assertEquals("SUBSTRING(s, 2, 2)", translate("s[1:3]"));
		assertEquals("SUBSTRING(s, 1, 3)", translate("s[:3]"));
	}

	@Test
	void indexIntoStringVariable()
	{
		context.declareVariable("s", PseudoType.STRING, 1);
		assertEquals("SUBSTRING(s, 1, 1)", translate("s[0]"));
	}

	// --- Diagnostics ---

	@Test
	void unsupportedExpressionIsMarked()
	{
		assertEquals("Unknown(Lambda)", translate("lambda x: x"));
		assertEquals(1, errors.getDiagnostics().size());
		assertEquals(Diagnostic.Kind.UNKNOWN_EXPRESSION, errors.getDiagnostics().get(0).kind());
	}

	@Test
	void conditionalExpressionIsApproximated()
	{
		assertEquals("IF c THEN a ELSE b", translate("a if c else b"));
		assertEquals(Diagnostic.Kind.APPROXIMATION, errors.getDiagnostics().get(0).kind());
	}
}
