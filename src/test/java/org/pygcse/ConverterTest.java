package org.pygcse;

import org.junit.jupiter.api.Test;
import org.pygcse.util.Diagnostic;

import static org.junit.jupiter.api.Assertions.*;

class ConverterTest
{
	private static String convert(String source)
	{
		ConversionResult result = new PseudocodeConverter().convert(source);
		assertFalse(result.hasErrors(), () -> "Unexpected errors: " + result.errors());
		return result.code();
	}

	// --- Statements ---

	@Test
	void simpleAssignment()
	{
		assertEquals("x ← 10", convert("x = 10"));
	}

	@Test
	void ifElse()
	{
		String source = """
				if score >= 50:
				    print("Pass")
				else:
				    print("Fail")
				""";
		assertEquals("IF score ≥ 50 THEN\n  OUTPUT \"Pass\"\nELSE\n  OUTPUT \"Fail\"\nENDIF", convert(source));
	}

	@Test
	void elifChainClosesOnce()
	{
		String source = """
				if x > 0:
				    print("pos")
				elif x < 0:
				    print("neg")
				else:
				    print("zero")
				""";
		assertEquals("IF x > 0 THEN\n  OUTPUT \"pos\"\nELSE IF x < 0 THEN\n  OUTPUT \"neg\"\nELSE\n  OUTPUT \"zero\"\nENDIF",
				convert(source));
	}

	@Test
	void forRangeIsInclusive()
	{
		String source = """
				for i in range(1, 11):
				    print(i)
				""";
		assertEquals("FOR i ← 1 TO 10\n  OUTPUT i\nNEXT i", convert(source));
	}

	@Test
	void forRangeWithNegativeStep()
	{
		String source = """
				for i in range(10, 0, -2):
				    print(i)
				""";
		assertEquals("FOR i ← 10 TO 2 STEP -2\n  OUTPUT i\nNEXT i", convert(source));
	}

	@Test
	void emptyRangeNeverRuns()
	{
		String source = """
				for i in range(5, 1):
				    print(i)
				""";
		assertTrue(convert(source).startsWith("FOR i ← 5 TO 0"));
	}

	@Test
	void iterationOverArrayUsesIndex()
	{
		String source = """
				names = ["a", "b"]
				for n in names:
				    print(n)
				""";
		String expected = String.join("\n",
				"DECLARE names : ARRAY[1:2] OF STRING",
				"names[1] ← \"a\"",
				"names[2] ← \"b\"",
				"FOR i ← 1 TO 2",
				"  OUTPUT names[i]",
				"NEXT i");
		assertEquals(expected, convert(source));
	}

	@Test
	void whileTrueWithTrailingBreakBecomesRepeat()
	{
		String source = """
				while True:
				    x = int(input("Enter: "))
				    if x > 0:
				        break
				""";
		assertEquals("REPEAT\n  OUTPUT \"Enter: \"\n  INPUT x\nUNTIL x > 0", convert(source));
	}

	@Test
	void nestedBlocksIndent()
	{
		String source = """
				for i in range(3):
				    if i > 0:
				        print(i)
				""";
		assertEquals("FOR i ← 0 TO 2\n  IF i > 0 THEN\n    OUTPUT i\n  ENDIF\nNEXT i", convert(source));
	}

	@Test
	void inputWithPrompt()
	{
		assertEquals("OUTPUT \"Name: \"\nINPUT name", convert("name = input(\"Name: \")"));
	}

	@Test
	void inputWithoutPrompt()
	{
		assertEquals("INPUT name", convert("name = input()"));
	}

	@Test
	void arrayWithRepeatedElement()
	{
		String source = """
				data = [0] * 3
				data[1] = 100
				""";
		String expected = String.join("\n",
				"DECLARE data : ARRAY[1:3] OF INTEGER",
				"data[1] ← 0",
				"data[2] ← 0",
				"data[3] ← 0",
				"data[2] ← 100");
		assertEquals(expected, convert(source));
	}

	@Test
	void appendBeyondCapacityGrowsDeclaration()
	{
		String source = """
				items = []
				items.append(1)
				items.append(2)
				items.append(3)
				""";
		ConversionResult result = new PseudocodeConverter(ConversionOptions.defaults().withEmptyArrayCapacity(2)).convert(source);
		String expected = String.join("\n",
				"DECLARE items : ARRAY[1:3] OF INTEGER",
				"items[1] ← 1",
				"items[2] ← 2",
				"items[3] ← 3");
		assertEquals(expected, result.code());
		assertEquals(1, result.warnings().size());
		assertEquals(Diagnostic.Kind.APPROXIMATION, result.warnings().get(0).kind());
	}

	@Test
	void repeatedElementListIsSpelledOut()
	{
		assertEquals("DECLARE flags : ARRAY[1:2] OF BOOLEAN\nflags[1] ← FALSE\nflags[2] ← FALSE", convert("flags = [False] * 2"));
	}

	@Test
	void negativeIndexCountsFilledElements()
	{
		String source = """
				a = []
				a.append(5)
				a.append(7)
				print(a[-1])
				""";
		String expected = String.join("\n",
				"DECLARE a : ARRAY[1:100] OF INTEGER",
				"a[1] ← 5",
				"a[2] ← 7",
				"OUTPUT a[2]");
		assertEquals(expected, convert(source));
	}

	@Test
	void appendInsideLoopUsesCounter()
	{
		String source = """
				squares = []
				for n in range(3):
				    squares.append(n * n)
				print(squares[-1])
				""";
		String expected = String.join("\n",
				"DECLARE squares : ARRAY[1:100] OF INTEGER",
				"squaresCount ← 0",
				"FOR n ← 0 TO 2",
				"  squaresCount ← squaresCount + 1",
				"  squares[squaresCount] ← n * n",
				"NEXT n",
				"OUTPUT squares[squaresCount]");
		assertEquals(expected, convert(source));
	}

	@Test
	void counterStartsAfterLiteralElements()
	{
		String source = """
				names = ["Ann"]
				while True:
				    name = input()
				    if name == "":
				        break
				    names.append(name)
				for n in names:
				    print(n)
				""";
		String code = convert(source);
		assertTrue(code.startsWith("DECLARE names : ARRAY[1:100] OF STRING\nnames[1] ← \"Ann\"\nnamesCount ← 1\n"), code);
		assertTrue(code.contains("  namesCount ← namesCount + 1\n  names[namesCount] ← name"), code);
		assertTrue(code.contains("FOR i ← 1 TO namesCount"), code);
	}

	@Test
	void compoundAssignmentToLoopElementLeavesArrayAlone()
	{
		String source = """
				scores = [1, 2]
				for s in scores:
				    s += 10
				    print(s)
				""";
		String expected = String.join("\n",
				"DECLARE scores : ARRAY[1:2] OF INTEGER",
				"scores[1] ← 1",
				"scores[2] ← 2",
				"FOR i ← 1 TO 2",
				"  s ← scores[i] + 10",
				"  OUTPUT s",
				"NEXT i");
		assertEquals(expected, convert(source));
	}

	// --- Routines ---

	@Test
	void functionWithValuedReturn()
	{
		String source = """
				def add(x, y):
				    return x + y
				""";
		assertEquals("FUNCTION add(x, y) RETURNS INTEGER\n  RETURN x + y\nENDFUNCTION", convert(source));
	}

	@Test
	void procedureWithoutReturn()
	{
		String source = """
				def show(msg):
				    print(msg)
				""";
		assertEquals("PROCEDURE show(msg)\n  OUTPUT msg\nENDPROCEDURE", convert(source));
	}

	// --- Classes ---

	@Test
	void instantiatedDataClassBecomesRecord()
	{
		String source = """
				class Point:
				    def __init__(self, x, y):
				        self.x = x
				        self.y = y
				p = Point(1, 2)
				""";
		String expected = String.join("\n",
				"TYPE PointRecord",
				"  DECLARE x : INTEGER",
				"  DECLARE y : INTEGER",
				"ENDTYPE",
				"DECLARE p : PointRecord",
				"p.x ← 1",
				"p.y ← 2");
		assertEquals(expected, convert(source));
	}

	@Test
	void arrayOfRecords()
	{
		String source = """
				class Point:
				    def __init__(self, x, y):
				        self.x = x
				        self.y = y
				pts = [Point(1, 2), Point(3, 4)]
				""";
		String expected = String.join("\n",
				"TYPE PointRecord",
				"  DECLARE x : INTEGER",
				"  DECLARE y : INTEGER",
				"ENDTYPE",
				"DECLARE pts : ARRAY[1:2] OF PointRecord",
				"pts[1].x ← 1",
				"pts[1].y ← 2",
				"pts[2].x ← 3",
				"pts[2].y ← 4");
		assertEquals(expected, convert(source));
	}

	@Test
	void recordReturnedFromFunctionKeepsItsType()
	{
		String source = """
				class Point:
				    def __init__(self, x):
				        self.x = x
				def origin():
				    return Point(0)
				""";
		String expected = String.join("\n",
				"TYPE PointRecord",
				"  DECLARE x : INTEGER",
				"ENDTYPE",
				"FUNCTION origin() RETURNS PointRecord",
				"  RETURN NEW Point(0)",
				"ENDFUNCTION");
		assertEquals(expected, convert(source));
	}

	@Test
	void recordUsedInsideExpressionKeepsItsType()
	{
		String source = """
				class Point:
				    def __init__(self, x):
				        self.x = x
				print(Point(3).x)
				""";
		assertTrue(convert(source).startsWith("TYPE PointRecord\n  DECLARE x : INTEGER\nENDTYPE\n"));
	}

	@Test
	void classWithMethods()
	{
		String source = """
				class Dog:
				    def __init__(self, name):
				        self.name = name
				    def speak(self):
				        print(self.name)
				d = Dog("Rex")
				""";
		String expected = String.join("\n",
				"CLASS Dog",
				"  PRIVATE name : STRING",
				"  PUBLIC PROCEDURE NEW(name)",
				"    name ← name",
				"  ENDPROCEDURE",
				"  PUBLIC PROCEDURE speak()",
				"    OUTPUT name",
				"  ENDPROCEDURE",
				"ENDCLASS",
				"d ← NEW Dog(\"Rex\")");
		assertEquals(expected, convert(source));
	}

	// --- Options ---

	@Test
	void lineNumbersArePrefixed()
	{
		ConversionOptions options = ConversionOptions.defaults().withLineNumbers(true);
		String code = new PseudocodeConverter(options).convert("x = 1\ny = 2").code();
		assertEquals("  1: x ← 1\n  2: y ← 2", code);
	}

	@Test
	void markdownWrapsCodeInFence()
	{
		ConversionOptions options = ConversionOptions.defaults().withMarkdown(true);
		String code = new PseudocodeConverter(options).convert("x = 1", "demo.py").code();
		assertTrue(code.startsWith("## demo.py"));
		assertTrue(code.contains("```pseudocode\nx ← 1\n```"));
	}

	// --- Failures ---

	@Test
	void syntaxErrorProducesNoCode()
	{
		ConversionResult result = new PseudocodeConverter().convert("if x >\n    pass\n");
		assertTrue(result.hasErrors());
		assertEquals("", result.code());
		assertNull(result.ir());
		assertEquals(Diagnostic.Kind.SYNTAX, result.errors().get(0).kind());
	}

	@Test
	void malformedJsonStatementDoesNotStopConversion()
	{
		String json = """
				{"type": "Module", "body": [
				  {"type": "If", "lineno": 1, "body": [], "orelse": []},
				  {"type": "Assign", "lineno": 2,
				   "targets": [{"type": "Name", "id": "y"}],
				   "value": {"type": "Constant", "value": 2}}
				]}
				""";
		ConversionResult result = new PseudocodeConverter().convertJson(json);
		assertTrue(result.hasErrors());
		assertEquals(Diagnostic.Kind.MALFORMED_INPUT, result.errors().get(0).kind());
		assertTrue(result.code().endsWith("y ← 2"));
	}

	@Test
	void jsonInputMatchesSourceInput()
	{
		String json = """
				{"type": "Module", "body": [
				  {"type": "Assign", "lineno": 1,
				   "targets": [{"type": "Name", "id": "x"}],
				   "value": {"type": "Constant", "value": 10}}
				]}
				""";
		assertEquals(convert("x = 10"), new PseudocodeConverter().convertJson(json).code());
	}
}
