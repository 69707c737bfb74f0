package org.pygcse.translate;

import org.pygcse.ast.Expr;
import org.pygcse.ast.Stmt;
import org.pygcse.ir.IRKind;
import org.pygcse.ir.IRMeta;
import org.pygcse.ir.IRNode;
import org.pygcse.semantic.SymbolContext;
import org.pygcse.semantic.TypeInference;
import org.pygcse.semantic.symbol.ArraySymbol;
import org.pygcse.semantic.type.PseudoType;
import org.pygcse.util.Diagnostic;
import org.pygcse.util.ErrorHandler;
import org.pygcse.util.MalformedInputException;

import java.util.ArrayList;
import java.util.List;

/**
 * IF chains, counting and iterating FOR loops, WHILE and REPEAT loops, and CASE.
 */
public class ControlFlowTranslator
{
	private final StatementVisitor visitor;
	private final SymbolContext context;
	private final TypeInference types;
	private final ExpressionTranslator expressions;
	private final ErrorHandler errorHandler;

	public ControlFlowTranslator(StatementVisitor visitor, SymbolContext context, TypeInference types, ExpressionTranslator expressions, ErrorHandler errorHandler)
	{
		this.visitor = visitor;
		this.context = context;
		this.types = types;
		this.expressions = expressions;
		this.errorHandler = errorHandler;
	}

	// --- IF ---

	/**
	 * An {@code else} whose only statement is another {@code if} continues the
	 * chain as {@code ELSE IF}; the chain is flattened so ENDIF is emitted once.
	 */
	public IRNode ifStatement(Stmt.If stmt)
	{
		String condition = condition(stmt.test(), stmt.line(), "if");
		List<IRNode> thenBranch = visitor.visitScoped(SymbolContext.BRANCH_SCOPE, stmt.body());

		List<IRNode> elseBranches = new ArrayList<>();
		List<Stmt> orelse = stmt.orelse();
		while (!orelse.isEmpty())
		{
			if (orelse.size() == 1 && orelse.get(0) instanceof Stmt.If elif)
			{
				expressions.setLine(elif.line());
				String elifCondition = condition(elif.test(), elif.line(), "elif");
				IRNode branch = new IRNode(IRKind.CONDITIONAL_BRANCH, "ELSE IF " + elifCondition + " THEN", new IRMeta.BranchMeta(elifCondition));
				branch.addChildren(visitor.visitScoped(SymbolContext.BRANCH_SCOPE, elif.body()));
				elseBranches.add(branch);
				orelse = elif.orelse();
			}
			else
			{
				IRNode branch = new IRNode(IRKind.CONDITIONAL_BRANCH, "ELSE", new IRMeta.BranchMeta(null));
				branch.addChildren(visitor.visitScoped(SymbolContext.BRANCH_SCOPE, orelse));
				elseBranches.add(branch);
				break;
			}
		}

		IRNode node = new IRNode(IRKind.CONDITIONAL, "IF " + condition + " THEN",
				new IRMeta.ConditionalMeta(condition, thenBranch, elseBranches, false));
		node.addChildren(thenBranch);
		node.addChildren(elseBranches);
		return node;
	}

	// --- FOR ---

	public IRNode forStatement(Stmt.For stmt)
	{
		if (stmt.target() == null || stmt.iter() == null)
		{
			throw new MalformedInputException("for loop without target or iterable", stmt.line());
		}
		if (!stmt.orelse().isEmpty())
		{
			errorHandler.logWarning(Diagnostic.Kind.APPROXIMATION, stmt.line(), "Loop else clause dropped");
		}

		if (stmt.target() instanceof Expr.Name variable)
		{
			if (stmt.iter() instanceof Expr.Call call && "range".equals(call.simpleName()))
			{
				return rangeLoop(variable.id(), call, stmt.body());
			}
			if (stmt.iter() instanceof Expr.Name || stmt.iter() instanceof Expr.Attribute)
			{
				return iterationLoop(variable.id(), stmt.iter(), stmt.body());
			}
		}

		errorHandler.logWarning(Diagnostic.Kind.APPROXIMATION, stmt.line(), "Iteration over this expression has no counting-loop form");
		String target = expressions.translate(stmt.target());
		IRNode node = new IRNode(IRKind.LOOP_FOR, "FOR " + target + " IN " + expressions.translate(stmt.iter()));
		node.addChildren(visitor.visitScoped(SymbolContext.LOOP_SCOPE, stmt.body()));
		node.addChild(IRNode.terminator("NEXT " + target));
		return node;
	}

	private IRNode rangeLoop(String variable, Expr.Call range, List<Stmt> body)
	{
		RangeBounds bounds = RangeBounds.resolve(range.args(), expressions);
		if (bounds.approximate())
		{
			errorHandler.logWarning(Diagnostic.Kind.APPROXIMATION, expressions.getLine(), "range() step is not a literal; bound assumes counting up");
		}
		context.declareVariable(variable, PseudoType.INTEGER, expressions.getLine());

		String header = "FOR " + variable + " ← " + bounds.start() + " TO " + bounds.end();
		if (bounds.step() != null)
		{
			header += " STEP " + bounds.step();
		}
		IRNode node = new IRNode(IRKind.LOOP_FOR, header, new IRMeta.ForMeta(variable, bounds.start(), bounds.end(), bounds.step()));
		node.addChildren(visitor.visitScoped(SymbolContext.LOOP_SCOPE, body));
		node.addChild(IRNode.terminator("NEXT " + variable));
		return node;
	}

	/**
	 * {@code for x in items} counts a fresh index over the array, and every read
	 * of {@code x} in the body becomes {@code items[i]}. Strings are walked a
	 * character at a time.
	 */
	private IRNode iterationLoop(String element, Expr iterable, List<Stmt> body)
	{
		String collection = expressions.translate(iterable);
		String index = context.freshIndexName();
		ArraySymbol array = iterable instanceof Expr.Name name ? context.getArray(name.id()) : null;
		boolean text = array == null && types.infer(iterable) == PseudoType.STRING;

		String end;
		if (array != null && array.isLengthKnown())
		{
			end = String.valueOf(array.getNextIndex());
		}
		else if (array != null && array.getCounter() != null)
		{
			end = array.getCounter();
		}
		else
		{
			end = "LENGTH(" + collection + ")";
		}

		if (text)
		{
			context.aliasElement(element, "SUBSTRING(" + collection + ", " + index + ", 1)");
			context.declareVariable(element, PseudoType.STRING, expressions.getLine());
		}
		else
		{
			context.aliasElement(element, collection + "[" + index + "]");
			if (array != null && array.getElementType() != null)
			{
				context.declareVariable(element, types.infer(new Expr.Subscript(iterable, new Expr.Num("0"))), expressions.getLine());
			}
		}
		context.markOneBased(index);
		context.declareVariable(index, PseudoType.INTEGER, expressions.getLine());

		IRNode node = new IRNode(IRKind.LOOP_FOR, "FOR " + index + " ← 1 TO " + end, new IRMeta.ForMeta(index, "1", end, null));
		try
		{
			node.addChildren(visitor.visitScoped(SymbolContext.LOOP_SCOPE, body));
		}
		finally
		{
			context.removeAlias(element);
			context.unmarkOneBased(index);
		}
		node.addChild(IRNode.terminator("NEXT " + index));
		return node;
	}

	// --- WHILE / REPEAT ---

	/**
	 * {@code while True:} ending in {@code if cond: break} is a post-test loop
	 * and becomes {@code REPEAT ... UNTIL cond}.
	 */
	public IRNode whileStatement(Stmt.While stmt)
	{
		if (stmt.test() == null)
		{
			throw new MalformedInputException("while loop without condition", stmt.line());
		}
		if (!stmt.orelse().isEmpty())
		{
			errorHandler.logWarning(Diagnostic.Kind.APPROXIMATION, stmt.line(), "Loop else clause dropped");
		}

		Stmt.If exit = repeatExit(stmt);
		if (exit != null)
		{
			List<Stmt> body = stmt.body().subList(0, stmt.body().size() - 1);
			IRNode node = new IRNode(IRKind.LOOP_REPEAT, "REPEAT");
			node.addChildren(visitor.visitScoped(SymbolContext.LOOP_SCOPE, body));

			expressions.setLine(exit.line());
			String condition = expressions.translate(exit.test());
			node.setMeta(new IRMeta.RepeatMeta(condition));
			node.addChild(IRNode.terminator("UNTIL " + condition));
			return node;
		}

		String condition = expressions.translate(stmt.test());
		IRNode node = new IRNode(IRKind.LOOP_WHILE, "WHILE " + condition + " DO", new IRMeta.WhileMeta(condition));
		node.addChildren(visitor.visitScoped(SymbolContext.LOOP_SCOPE, stmt.body()));
		node.addChild(IRNode.terminator("ENDWHILE"));
		return node;
	}

	private static Stmt.If repeatExit(Stmt.While stmt)
	{
		if (!(stmt.test() instanceof Expr.Bool bool) || !bool.value() || stmt.body().isEmpty() || !stmt.orelse().isEmpty())
		{
			return null;
		}
		Stmt last = stmt.body().get(stmt.body().size() - 1);
		if (!(last instanceof Stmt.If exit) || exit.test() == null || !exit.orelse().isEmpty()
				|| exit.body().size() != 1 || !(exit.body().get(0) instanceof Stmt.Break))
		{
			return null;
		}
		// any other break would leave the loop somewhere UNTIL cannot express
		return countBreaks(stmt.body()) == 1 ? exit : null;
	}

	/**
	 * Counts the breaks that leave this loop, ignoring those of nested loops.
	 */
	private static int countBreaks(List<Stmt> body)
	{
		int count = 0;
		for (Stmt stmt : body)
		{
			if (stmt instanceof Stmt.Break)
			{
				count++;
			}
			else if (stmt instanceof Stmt.If ifStmt)
			{
				count += countBreaks(ifStmt.body()) + countBreaks(ifStmt.orelse());
			}
			else if (stmt instanceof Stmt.Try tryStmt)
			{
				count += countBreaks(tryStmt.body());
			}
			else if (stmt instanceof Stmt.With withStmt)
			{
				count += countBreaks(withStmt.body());
			}
			else if (stmt instanceof Stmt.Match match)
			{
				for (Stmt.MatchCase c : match.cases())
				{
					count += countBreaks(c.body());
				}
			}
		}
		return count;
	}

	// --- CASE ---

	public IRNode matchStatement(Stmt.Match stmt)
	{
		if (stmt.subject() == null)
		{
			throw new MalformedInputException("match without subject", stmt.line());
		}
		String subject = expressions.translate(stmt.subject());
		IRNode node = new IRNode(IRKind.CASE, "CASE OF " + subject, new IRMeta.CaseMeta(subject));

		for (Stmt.MatchCase c : stmt.cases())
		{
			if (c.guard() != null)
			{
				errorHandler.logWarning(Diagnostic.Kind.APPROXIMATION, stmt.line(), "Case guard ignored");
			}
			String label = caseLabel(c.patterns(), stmt.line());
			IRNode branch = new IRNode(IRKind.CASE_BRANCH, label, new IRMeta.BranchMeta(label.equals("OTHERWISE") ? null : label));
			branch.addChildren(visitor.visitScoped(SymbolContext.BRANCH_SCOPE, c.body()));
			node.addChild(branch);
		}
		node.addChild(IRNode.terminator("ENDCASE"));
		return node;
	}

	private String caseLabel(List<Expr> patterns, int line)
	{
		List<String> values = new ArrayList<>();
		for (Expr pattern : patterns)
		{
			if (pattern instanceof Expr.Name name)
			{
				if (!name.id().equals("_"))
				{
					errorHandler.logWarning(Diagnostic.Kind.APPROXIMATION, line, "Capture pattern '" + name.id() + "' treated as OTHERWISE");
				}
				return "OTHERWISE";
			}
			values.add(expressions.translate(pattern));
		}
		return String.join(", ", values);
	}

	private String condition(Expr test, int line, String construct)
	{
		if (test == null)
		{
			throw new MalformedInputException(construct + " statement without condition", line);
		}
		return expressions.translate(test);
	}
}
