package org.pygcse.codegen;

import org.junit.jupiter.api.Test;
import org.pygcse.ConversionOptions;
import org.pygcse.ir.IRKind;
import org.pygcse.ir.IRMeta;
import org.pygcse.ir.IRNode;
import org.pygcse.util.Diagnostic;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PseudocodeEmitterTest
{
	private static EmitResult emit(IRNode root)
	{
		return new PseudocodeEmitter(ConversionOptions.defaults()).emit(root);
	}

	private static IRNode output(String value)
	{
		return new IRNode(IRKind.OUTPUT, "OUTPUT " + value);
	}

	private static IRNode procedure(String name, IRNode body)
	{
		IRNode node = new IRNode(IRKind.PROCEDURE, "PROCEDURE " + name + "()", new IRMeta.RoutineMeta(name, List.of(), false, null));
		return node.addChild(body);
	}

	@Test
	void missingCloserIsSupplied()
	{
		IRNode loop = new IRNode(IRKind.LOOP_FOR, "FOR i ← 1 TO 3", new IRMeta.ForMeta("i", "1", "3", null));
		loop.addChild(output("i"));
		EmitResult result = emit(IRNode.block().addChild(loop));
		assertEquals("FOR i ← 1 TO 3\n  OUTPUT i\nNEXT i", result.code());
		assertEquals(3, result.lineCount());
	}

	@Test
	void terminatorChildRendersAtParentLevel()
	{
		IRNode loop = new IRNode(IRKind.LOOP_WHILE, "WHILE x < 3 DO", new IRMeta.WhileMeta("x < 3"));
		loop.addChild(new IRNode(IRKind.ASSIGNMENT, "x ← x + 1"));
		loop.addChild(IRNode.terminator("ENDWHILE"));
		assertEquals("WHILE x < 3 DO\n  x ← x + 1\nENDWHILE", emit(IRNode.block().addChild(loop)).code());
	}

	@Test
	void conditionalGetsSingleEndif()
	{
		IRNode then = output("1");
		IRNode otherwise = new IRNode(IRKind.CONDITIONAL_BRANCH, "ELSE", new IRMeta.BranchMeta(null));
		otherwise.addChild(output("2"));
		IRNode conditional = new IRNode(IRKind.CONDITIONAL, "IF x > 0 THEN",
				new IRMeta.ConditionalMeta("x > 0", List.of(then), List.of(otherwise), false));
		conditional.addChild(then);
		conditional.addChild(otherwise);

		assertEquals("IF x > 0 THEN\n  OUTPUT 1\nELSE\n  OUTPUT 2\nENDIF", emit(IRNode.block().addChild(conditional)).code());
	}

	@Test
	void conditionalWithoutBranchInformationIsReported()
	{
		IRNode conditional = new IRNode(IRKind.CONDITIONAL, "IF x THEN");
		EmitResult result = emit(IRNode.block().addChild(conditional));
		assertEquals("IF x THEN", result.code());
		assertEquals(Diagnostic.Kind.UNSUPPORTED_NODE, result.diagnostics().get(0).kind());
	}

	@Test
	void strayTerminatorIsReported()
	{
		EmitResult result = emit(IRNode.block().addChild(IRNode.terminator("ENDWHILE")));
		assertEquals(1, result.diagnostics().size());
	}

	@Test
	void caseBranches()
	{
		IRNode caseNode = new IRNode(IRKind.CASE, "CASE OF x", new IRMeta.CaseMeta("x"));
		IRNode one = new IRNode(IRKind.CASE_BRANCH, "1");
		one.addChild(output("\"one\""));
		IRNode otherwise = new IRNode(IRKind.CASE_BRANCH, "OTHERWISE");
		otherwise.addChild(new IRNode(IRKind.LOOP_WHILE, "WHILE TRUE DO", new IRMeta.WhileMeta("TRUE")));
		caseNode.addChild(one);
		caseNode.addChild(otherwise);

		String expected = String.join("\n",
				"CASE OF x",
				"  1 : OUTPUT \"one\"",
				"  OTHERWISE :",
				"    WHILE TRUE DO",
				"    ENDWHILE",
				"ENDCASE");
		assertEquals(expected, emit(IRNode.block().addChild(caseNode)).code());
	}

	@Test
	void blankLinesSeparateRoutines()
	{
		IRNode root = IRNode.block()
				.addChild(procedure("a", output("1")))
				.addChild(procedure("b", output("2")))
				.addChild(new IRNode(IRKind.STATEMENT, "CALL a()"));
		ConversionOptions options = ConversionOptions.defaults().withBlankLines(true);

		String expected = String.join("\n",
				"PROCEDURE a()",
				"  OUTPUT 1",
				"ENDPROCEDURE",
				"",
				"PROCEDURE b()",
				"  OUTPUT 2",
				"ENDPROCEDURE",
				"",
				"CALL a()");
		assertEquals(expected, new PseudocodeEmitter(options).emit(root).code());
	}

	@Test
	void lineNumbersIndentAndLineEnding()
	{
		IRNode loop = new IRNode(IRKind.LOOP_WHILE, "WHILE TRUE DO", new IRMeta.WhileMeta("TRUE"));
		loop.addChild(output("1"));
		ConversionOptions options = ConversionOptions.defaults()
				.withLineNumbers(true)
				.withIndentSize(4)
				.withLineEnding("\r\n");

		String code = new PseudocodeEmitter(options).emit(IRNode.block().addChild(loop)).code();
		assertEquals("  1: WHILE TRUE DO\r\n  2:     OUTPUT 1\r\n  3: ENDWHILE", code);
	}

	@Test
	void longLineRaisesWarning()
	{
		ConversionOptions options = ConversionOptions.defaults().withMaxLineLength(10);
		EmitResult result = new PseudocodeEmitter(options).emit(IRNode.block()
				.addChild(output("1"))
				.addChild(output("\"far too long\"")));

		assertEquals(1, result.diagnostics().size());
		Diagnostic warning = result.diagnostics().get(0);
		assertEquals(Diagnostic.Kind.LONG_LINE, warning.kind());
		assertEquals(2, warning.line());
		assertFalse(warning.isError());
	}

	@Test
	void diagnosticsDoNotCarryOverBetweenRuns()
	{
		PseudocodeEmitter emitter = new PseudocodeEmitter(ConversionOptions.defaults());
		emitter.emit(IRNode.block().addChild(IRNode.terminator("ENDIF")));
		assertTrue(emitter.emit(IRNode.block().addChild(output("1"))).diagnostics().isEmpty());
	}
}
