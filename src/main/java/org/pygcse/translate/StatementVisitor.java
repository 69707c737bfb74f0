package org.pygcse.translate;

import org.pygcse.ast.Expr;
import org.pygcse.ast.Module;
import org.pygcse.ast.Stmt;
import org.pygcse.ir.IRKind;
import org.pygcse.ir.IRMeta;
import org.pygcse.ir.IRNode;
import org.pygcse.semantic.SymbolContext;
import org.pygcse.semantic.TypeInference;
import org.pygcse.util.Debug;
import org.pygcse.util.Diagnostic;
import org.pygcse.util.ErrorHandler;
import org.pygcse.util.MalformedInputException;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a syntax tree into the pseudocode IR. Dispatches each statement to
 * the assignment, control-flow or definition translator; the few remaining
 * kinds are handled here.
 */
public class StatementVisitor
{
	private final SymbolContext context;
	private final ExpressionTranslator expressions;
	private final ErrorHandler errorHandler;
	private final AssignmentTranslator assignments;
	private final ControlFlowTranslator controlFlow;
	private final DefinitionTranslator definitions;

	/**
	 * @param emptyArrayCapacity upper bound declared for arrays created from an empty list
	 */
	public StatementVisitor(ErrorHandler errorHandler, int emptyArrayCapacity)
	{
		this.errorHandler = errorHandler;
		this.context = new SymbolContext();
		TypeInference types = new TypeInference(context);
		this.expressions = new ExpressionTranslator(context, types, errorHandler);
		this.definitions = new DefinitionTranslator(this, context, types, expressions, errorHandler);
		this.assignments = new AssignmentTranslator(context, types, expressions, definitions, errorHandler, emptyArrayCapacity);
		this.controlFlow = new ControlFlowTranslator(this, context, types, expressions, errorHandler);
	}

	public SymbolContext getContext()
	{
		return context;
	}

	/**
	 * Translates a whole program. A malformed top-level statement is replaced by
	 * a marker comment and recorded as an error; the statements after it are
	 * still translated.
	 */
	public IRNode visitModule(Module module)
	{
		new InstantiationScanner(context).scan(module);

		IRNode root = IRNode.block();
		for (Stmt stmt : module.body())
		{
			try
			{
				root.addChildren(visit(stmt));
			}
			catch (MalformedInputException e)
			{
				errorHandler.logError(Diagnostic.Kind.MALFORMED_INPUT, e.getLine(), e.getMessage());
				// a loop abandoned halfway leaves its counters behind
				context.takeLoopPrelude();
				root.addChild(IRNode.comment("Malformed input"));
			}
		}
		root.setMeta(new IRMeta.ProgramMeta(context.getIdentifiers()));
		Debug.logDebug("Translated " + module.body().size() + " top-level statement(s)");
		return root;
	}

	public List<IRNode> visitBody(List<Stmt> body)
	{
		List<IRNode> nodes = new ArrayList<>();
		for (Stmt stmt : body)
		{
			nodes.addAll(visit(stmt));
		}
		return nodes;
	}

	/**
	 * Visits {@code body} inside a nested scope of the given name.
	 */
	public List<IRNode> visitScoped(String scopeName, List<Stmt> body)
	{
		context.pushScope(scopeName);
		try
		{
			return visitBody(body);
		}
		finally
		{
			context.popScope();
		}
	}

	/**
	 * Places the statements collected while translating a loop, such as
	 * append counters, in front of the outermost loop.
	 */
	private List<IRNode> withLoopPrelude(IRNode loop, boolean outermost)
	{
		if (!outermost)
		{
			return List.of(loop);
		}
		List<IRNode> nodes = new ArrayList<>(context.takeLoopPrelude());
		nodes.add(loop);
		return nodes;
	}

	public List<IRNode> visit(Stmt stmt)
	{
		if (stmt == null)
		{
			throw new MalformedInputException("Missing statement", expressions.getLine());
		}
		expressions.setLine(stmt.line());

		// --- Assignments ---
		if (stmt instanceof Stmt.Assign assign)
		{
			return assignments.assign(assign);
		}
		if (stmt instanceof Stmt.AugAssign augAssign)
		{
			return assignments.augmentedAssign(augAssign);
		}
		if (stmt instanceof Stmt.AnnAssign annAssign)
		{
			return assignments.annotatedAssign(annAssign);
		}

		// --- Control flow ---
		if (stmt instanceof Stmt.If ifStmt)
		{
			return List.of(controlFlow.ifStatement(ifStmt));
		}
		if (stmt instanceof Stmt.For forStmt)
		{
			boolean outermost = !context.isInLoop();
			return withLoopPrelude(controlFlow.forStatement(forStmt), outermost);
		}
		if (stmt instanceof Stmt.While whileStmt)
		{
			boolean outermost = !context.isInLoop();
			return withLoopPrelude(controlFlow.whileStatement(whileStmt), outermost);
		}
		if (stmt instanceof Stmt.Match match)
		{
			return List.of(controlFlow.matchStatement(match));
		}
		if (stmt instanceof Stmt.Break)
		{
			return List.of(new IRNode(IRKind.STATEMENT, "BREAK"));
		}
		if (stmt instanceof Stmt.Continue)
		{
			return List.of(new IRNode(IRKind.STATEMENT, "CONTINUE"));
		}

		// --- Definitions ---
		if (stmt instanceof Stmt.FunctionDef functionDef)
		{
			return List.of(definitions.functionDef(functionDef));
		}
		if (stmt instanceof Stmt.ClassDef classDef)
		{
			return definitions.classDef(classDef);
		}
		if (stmt instanceof Stmt.Return ret)
		{
			return List.of(definitions.returnStatement(ret));
		}

		// --- Everything else ---
		if (stmt instanceof Stmt.ExprStmt exprStmt)
		{
			return expressionStatement(exprStmt);
		}
		if (stmt instanceof Stmt.Comment comment)
		{
			return List.of(IRNode.comment(comment.text()));
		}
		if (stmt instanceof Stmt.Pass)
		{
			return List.of(IRNode.comment("pass"));
		}
		if (stmt instanceof Stmt.Try tryStmt)
		{
			return withMarker("try-except statement", tryStmt.body());
		}
		if (stmt instanceof Stmt.With withStmt)
		{
			return withMarker("with statement", withStmt.body());
		}
		if (stmt instanceof Stmt.Import)
		{
			return List.of(IRNode.comment("import statement"));
		}
		if (stmt instanceof Stmt.Assert)
		{
			return List.of(IRNode.comment("assert statement"));
		}
		if (stmt instanceof Stmt.Raise)
		{
			return List.of(IRNode.comment("raise statement"));
		}
		if (stmt instanceof Stmt.Global)
		{
			return List.of(IRNode.comment("global statement"));
		}
		if (stmt instanceof Stmt.Delete)
		{
			return List.of(IRNode.comment("delete statement"));
		}

		String type = ((Stmt.Unknown) stmt).type();
		errorHandler.logWarning(Diagnostic.Kind.UNSUPPORTED_NODE, stmt.line(), "Unprocessed node: " + type);
		return List.of(IRNode.comment("Unprocessed node: " + type));
	}

	private List<IRNode> withMarker(String marker, List<Stmt> body)
	{
		List<IRNode> nodes = new ArrayList<>();
		nodes.add(IRNode.comment(marker));
		nodes.addAll(visitBody(body));
		return nodes;
	}

	private List<IRNode> expressionStatement(Stmt.ExprStmt stmt)
	{
		Expr value = stmt.value();
		if (value == null)
		{
			throw new MalformedInputException("Expression statement without value", stmt.line());
		}

		// docstrings and other bare strings
		if (value instanceof Expr.Str str)
		{
			return docComment(str.value());
		}
		if (value instanceof Expr.Call call)
		{
			if ("print".equals(call.simpleName()))
			{
				return List.of(output(call));
			}
			if (call.func() instanceof Expr.Attribute attribute && attribute.value() instanceof Expr.Name target)
			{
				if (attribute.attr().equals("append") && call.args().size() == 1)
				{
					return assignments.append(target.id(), call.args().get(0), stmt.line());
				}
				if (attribute.attr().equals("pop") && call.args().isEmpty())
				{
					return assignments.pop(target.id());
				}
			}
			return List.of(new IRNode(IRKind.STATEMENT, "CALL " + expressions.translate(call)));
		}
		return List.of(new IRNode(IRKind.STATEMENT, expressions.translate(value)));
	}

	private IRNode output(Expr.Call print)
	{
		for (Expr.Keyword keyword : print.keywords())
		{
			if ("sep".equals(keyword.name()) || "end".equals(keyword.name()))
			{
				errorHandler.logWarning(Diagnostic.Kind.APPROXIMATION, expressions.getLine(), "print() argument '" + keyword.name() + "' ignored");
			}
		}
		if (print.args().isEmpty())
		{
			return new IRNode(IRKind.OUTPUT, "OUTPUT \"\"");
		}
		List<String> parts = new ArrayList<>();
		for (Expr arg : print.args())
		{
			parts.add(expressions.translate(arg));
		}
		return new IRNode(IRKind.OUTPUT, "OUTPUT " + String.join(", ", parts));
	}

	private List<IRNode> docComment(String text)
	{
		List<IRNode> comments = new ArrayList<>();
		for (String line : text.replace("\\n", "\n").split("\n"))
		{
			if (!line.isBlank())
			{
				comments.add(IRNode.comment(line.strip()));
			}
		}
		return comments;
	}
}
