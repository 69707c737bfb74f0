package org.pygcse.codegen;

import org.pygcse.ConversionOptions;
import org.pygcse.ir.IRKind;
import org.pygcse.ir.IRMeta;
import org.pygcse.ir.IRNode;
import org.pygcse.util.Debug;
import org.pygcse.util.Diagnostic;
import org.pygcse.util.ErrorHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Renders an IR tree as indented pseudocode. Block closers come from the
 * TERMINATOR children placed by the visitor; ENDIF and any missing closer
 * are supplied here, so every opened block is closed exactly once.
 */
public class PseudocodeEmitter
{
	private final ConversionOptions options;
	private ErrorHandler errorHandler = new ErrorHandler();
	private final List<String> lines = new ArrayList<>();
	private TextFormatter formatter = new TextFormatter();
	private boolean blankPending = false;

	public PseudocodeEmitter(ConversionOptions options)
	{
		this.options = options;
	}

	public EmitResult emit(IRNode root)
	{
		lines.clear();
		blankPending = false;
		errorHandler = new ErrorHandler();
		Set<String> identifiers = root.getMeta() instanceof IRMeta.ProgramMeta program ? program.identifiers() : Set.of();
		formatter = new TextFormatter(identifiers);

		emitNode(root, 0);

		List<String> output = new ArrayList<>();
		for (int i = 0; i < lines.size(); i++)
		{
			String line = lines.get(i);
			if (line.length() > options.maxLineLength())
			{
				errorHandler.logWarning(Diagnostic.Kind.LONG_LINE, i + 1,
						"Line is " + line.length() + " characters long (maximum " + options.maxLineLength() + ")");
			}
			output.add(options.lineNumbers() ? String.format("%3d: %s", i + 1, line) : line);
		}
		Debug.logDebug("Emitted " + output.size() + " line(s)");
		return new EmitResult(String.join(options.lineEnding(), output), errorHandler.getDiagnostics(), output.size());
	}

	// --- Dispatch ---

	private void emitNode(IRNode node, int level)
	{
		switch (node.getKind())
		{
			case BLOCK ->
			{
				for (IRNode child : node.getChildren())
				{
					emitNode(child, level);
				}
			}
			case CONDITIONAL -> emitConditional(node, level);
			case LOOP_FOR, LOOP_WHILE, LOOP_REPEAT, RECORD_TYPE, CLASS, CASE -> emitBlock(node, level);
			case PROCEDURE, FUNCTION -> emitRoutine(node, level);
			case COMMENT -> emitLeaf(node, level, false);
			case TERMINATOR, CONDITIONAL_BRANCH, CASE_BRANCH ->
			{
				errorHandler.logWarning(Diagnostic.Kind.UNSUPPORTED_NODE, 0, node.getKind() + " '" + node.getText() + "' outside its block");
				emitLeaf(node, level, true);
			}
			default -> emitLeaf(node, level, true);
		}
	}

	private void emitLeaf(IRNode node, int level, boolean format)
	{
		line(level, node.getText(), format);
		for (IRNode child : node.getChildren())
		{
			emitNode(child, level + 1);
		}
	}

	// --- IF ---

	private void emitConditional(IRNode node, int level)
	{
		if (!(node.getMeta() instanceof IRMeta.ConditionalMeta meta))
		{
			errorHandler.logWarning(Diagnostic.Kind.UNSUPPORTED_NODE, 0, "Conditional '" + node.getText() + "' has no branch information");
			emitLeaf(node, level, true);
			return;
		}

		line(level, node.getText(), true);
		for (IRNode child : meta.thenBranch())
		{
			emitNode(child, level + 1);
		}
		for (IRNode branch : meta.elseBranches())
		{
			closer(level, branch.getText());
			for (IRNode child : branch.getChildren())
			{
				emitNode(child, level + 1);
			}
		}
		if (!meta.continuation())
		{
			closer(level, "ENDIF");
		}
	}

	// --- Blocks with closers ---

	private void emitRoutine(IRNode node, int level)
	{
		if (options.blankLines() && !lines.isEmpty() && !opensEnclosingBlock(node))
		{
			blankPending = true;
		}
		emitBlock(node, level);
		if (options.blankLines())
		{
			blankPending = true;
		}
	}

	/**
	 * True if the routine is the first routine of a CLASS, which follows the header or fields directly.
	 */
	private static boolean opensEnclosingBlock(IRNode routine)
	{
		IRNode parent = routine.getParent();
		if (parent == null || parent.getKind() != IRKind.CLASS)
		{
			return false;
		}
		for (IRNode sibling : parent.getChildren())
		{
			if (sibling.getKind().isRoutine())
			{
				return sibling == routine;
			}
		}
		return false;
	}

	private void emitBlock(IRNode node, int level)
	{
		line(level, node.getText(), true);
		boolean closed = false;
		List<IRNode> children = node.getChildren();
		for (int i = 0; i < children.size(); i++)
		{
			IRNode child = children.get(i);
			if (child.getKind() == IRKind.TERMINATOR)
			{
				if (i != children.size() - 1)
				{
					errorHandler.logWarning(Diagnostic.Kind.UNSUPPORTED_NODE, 0, "'" + child.getText() + "' is not the last line of its block");
				}
				closer(level, child.getText());
				closed = true;
			}
			else if (child.getKind() == IRKind.CASE_BRANCH && node.getKind() == IRKind.CASE)
			{
				emitCaseBranch(child, level + 1);
			}
			else
			{
				emitNode(child, level + 1);
			}
		}
		if (!closed)
		{
			closer(level, implicitCloser(node));
		}
	}

	private static String implicitCloser(IRNode node)
	{
		IRMeta meta = node.getMeta();
		return switch (node.getKind())
		{
			case LOOP_FOR -> meta instanceof IRMeta.ForMeta forMeta ? "NEXT " + forMeta.variable() : "NEXT";
			case LOOP_WHILE -> "ENDWHILE";
			case LOOP_REPEAT -> meta instanceof IRMeta.RepeatMeta repeat ? "UNTIL " + repeat.condition() : "UNTIL FALSE";
			case PROCEDURE -> "ENDPROCEDURE";
			case FUNCTION -> "ENDFUNCTION";
			case RECORD_TYPE -> "ENDTYPE";
			case CLASS -> "ENDCLASS";
			case CASE -> "ENDCASE";
			default -> throw new IllegalArgumentException("No closing keyword for " + node.getKind());
		};
	}

	// --- CASE ---

	/**
	 * {@code value : statement} when the branch is a single simple statement;
	 * otherwise the label stands alone and the statements are indented below it.
	 */
	private void emitCaseBranch(IRNode branch, int level)
	{
		List<IRNode> children = branch.getChildren();
		if (!children.isEmpty() && isSimple(children.get(0)))
		{
			line(level, branch.getText() + " : " + children.get(0).getText(), true);
			for (int i = 1; i < children.size(); i++)
			{
				emitNode(children.get(i), level + 1);
			}
			return;
		}
		line(level, branch.getText() + " :", true);
		for (IRNode child : children)
		{
			emitNode(child, level + 1);
		}
	}

	private static boolean isSimple(IRNode node)
	{
		return node.getChildren().isEmpty() && switch (node.getKind())
		{
			case ASSIGNMENT, OUTPUT, INPUT, RETURN, STATEMENT, COMMENT -> true;
			default -> false;
		};
	}

	// --- Output ---

	/**
	 * A line that ends or divides a block; a pending blank line is dropped before it.
	 */
	private void closer(int level, String text)
	{
		blankPending = false;
		line(level, text, true);
	}

	private void line(int level, String text, boolean format)
	{
		if (blankPending)
		{
			lines.add("");
			blankPending = false;
		}
		String body = format ? formatter.format(text) : text;
		lines.add(" ".repeat(options.indentSize() * level) + body);
	}
}
