package org.pygcse.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenStream;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.pygcse.ast.*;
import org.pygcse.ast.Module;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

/**
 * Walks the ANTLR parse tree and produces the generic syntax tree. Expression
 * rules go through the generated visitor; statements are built by hand since
 * one source line may yield several statements.
 */
public class TreeBuilder extends PythonBaseVisitor<Expr>
{
	private final TokenStream tokens;
	private final Deque<Token> pendingComments;
	private final Function<String, Expr> expressionParser;

	public TreeBuilder(TokenStream tokens, List<Token> comments, Function<String, Expr> expressionParser)
	{
		this.tokens = tokens;
		this.pendingComments = new ArrayDeque<>(comments);
		this.expressionParser = expressionParser;
	}

	public Module build(PythonParser.File_inputContext ctx)
	{
		List<Stmt> body = new ArrayList<>();
		for (PythonParser.StmtContext stmt : ctx.stmt())
		{
			flushComments(body, stmt.getStart().getLine(), 0);
			body.addAll(buildStmt(stmt));
		}
		flushComments(body, Integer.MAX_VALUE, 0);
		return new Module(body);
	}

	// --- Comments ---

	private void flushComments(List<Stmt> out, int beforeLine, int minColumn)
	{
		while (!pendingComments.isEmpty())
		{
			Token comment = pendingComments.peek();
			if (comment.getLine() >= beforeLine || comment.getCharPositionInLine() < minColumn)
			{
				return;
			}
			pendingComments.poll();
			out.add(new Stmt.Comment(comment.getLine(), comment.getText().substring(1).strip()));
		}
	}

	private void dropComments(int beforeLine)
	{
		while (!pendingComments.isEmpty() && pendingComments.peek().getLine() < beforeLine)
		{
			pendingComments.poll();
		}
	}

	/**
	 * Line of the first real token after an indented block, i.e. where the
	 * enclosing block resumes.
	 */
	private int lineAfter(ParserRuleContext block)
	{
		for (int i = block.getStop().getTokenIndex() + 1; i < tokens.size(); i++)
		{
			Token t = tokens.get(i);
			if (t.getType() == Token.EOF)
			{
				return Integer.MAX_VALUE;
			}
			if (t.getChannel() == Token.DEFAULT_CHANNEL && t.getType() != PythonParser.DEDENT
					&& t.getType() != PythonParser.INDENT && t.getType() != PythonParser.NEWLINE)
			{
				return t.getLine();
			}
		}
		return Integer.MAX_VALUE;
	}

	// --- Statements ---

	private List<Stmt> block(PythonParser.BlockContext ctx)
	{
		if (ctx == null)
		{
			return new ArrayList<>();
		}
		if (ctx.simple_stmts() != null)
		{
			return simpleStatements(ctx.simple_stmts());
		}

		List<Stmt> body = new ArrayList<>();
		int column = ctx.stmt(0).getStart().getCharPositionInLine();
		for (PythonParser.StmtContext stmt : ctx.stmt())
		{
			flushComments(body, stmt.getStart().getLine(), 0);
			body.addAll(buildStmt(stmt));
		}
		// Trailing comments indented like the block belong to it.
		flushComments(body, lineAfter(ctx), column);
		return body;
	}

	private List<Stmt> buildStmt(PythonParser.StmtContext ctx)
	{
		if (ctx.simple_stmts() != null)
		{
			return simpleStatements(ctx.simple_stmts());
		}
		return List.of(compound(ctx.compound_stmt()));
	}

	private List<Stmt> simpleStatements(PythonParser.Simple_stmtsContext ctx)
	{
		List<Stmt> out = new ArrayList<>();
		for (PythonParser.Simple_stmtContext simple : ctx.simple_stmt())
		{
			out.add(simple(simple));
		}
		return out;
	}

	private Stmt simple(PythonParser.Simple_stmtContext ctx)
	{
		int line = ctx.getStart().getLine();

		if (ctx.expr_stmt() != null)
		{
			return expressionStatement(ctx.expr_stmt());
		}
		if (ctx.pass_stmt() != null)
		{
			return new Stmt.Pass(line);
		}
		if (ctx.break_stmt() != null)
		{
			return new Stmt.Break(line);
		}
		if (ctx.continue_stmt() != null)
		{
			return new Stmt.Continue(line);
		}
		if (ctx.return_stmt() != null)
		{
			PythonParser.TestlistContext value = ctx.return_stmt().testlist();
			return new Stmt.Return(line, value == null ? null : testlist(value));
		}
		if (ctx.del_stmt() != null)
		{
			return new Stmt.Delete(line);
		}
		if (ctx.raise_stmt() != null)
		{
			return new Stmt.Raise(line);
		}
		if (ctx.global_stmt() != null)
		{
			return new Stmt.Global(line);
		}
		if (ctx.import_stmt() != null)
		{
			return new Stmt.Import(line);
		}
		return new Stmt.Assert(line);
	}

	private Stmt expressionStatement(PythonParser.Expr_stmtContext ctx)
	{
		int line = ctx.getStart().getLine();

		if (ctx instanceof PythonParser.AnnotatedAssignContext annotated)
		{
			PythonParser.AnnassignContext ann = annotated.annassign();
			Expr value = ann.value == null ? null : testlist(ann.value);
			return new Stmt.AnnAssign(line, testlist(annotated.target), visit(ann.annotation), value);
		}
		if (ctx instanceof PythonParser.AugmentedAssignContext augmented)
		{
			String symbol = augmented.augassign().op.getText();
			BinaryOperator op = BinaryOperator.fromSymbol(symbol.substring(0, symbol.length() - 1));
			return new Stmt.AugAssign(line, testlist(augmented.target), op, testlist(augmented.value));
		}

		PythonParser.PlainAssignContext plain = (PythonParser.PlainAssignContext) ctx;
		List<PythonParser.TestlistContext> parts = plain.parts;
		if (parts.size() == 1)
		{
			return new Stmt.ExprStmt(line, testlist(parts.get(0)));
		}
		List<Expr> targets = new ArrayList<>();
		for (int i = 0; i < parts.size() - 1; i++)
		{
			targets.add(testlist(parts.get(i)));
		}
		return new Stmt.Assign(line, targets, testlist(parts.get(parts.size() - 1)));
	}

	private Stmt compound(PythonParser.Compound_stmtContext ctx)
	{
		if (ctx.if_stmt() != null)
		{
			return ifStatement(ctx.if_stmt());
		}
		if (ctx.while_stmt() != null)
		{
			PythonParser.While_stmtContext w = ctx.while_stmt();
			return new Stmt.While(w.getStart().getLine(), visit(w.cond), block(w.body), block(w.elseBlock));
		}
		if (ctx.for_stmt() != null)
		{
			PythonParser.For_stmtContext f = ctx.for_stmt();
			return new Stmt.For(f.getStart().getLine(), exprlist(f.target), testlist(f.iter), block(f.body), block(f.elseBlock));
		}
		if (ctx.try_stmt() != null)
		{
			PythonParser.Try_stmtContext t = ctx.try_stmt();
			List<Stmt> body = block(t.body);
			// handler blocks are not translated, neither are their comments
			dropComments(lineAfter(t));
			return new Stmt.Try(t.getStart().getLine(), body);
		}
		if (ctx.with_stmt() != null)
		{
			PythonParser.With_stmtContext w = ctx.with_stmt();
			return new Stmt.With(w.getStart().getLine(), block(w.body));
		}
		if (ctx.funcdef() != null)
		{
			return functionDef(ctx.funcdef());
		}
		if (ctx.classdef() != null)
		{
			return classDef(ctx.classdef());
		}
		if (ctx.decorated() != null)
		{
			PythonParser.DecoratedContext d = ctx.decorated();
			return d.funcdef() != null ? functionDef(d.funcdef()) : classDef(d.classdef());
		}
		return matchStatement(ctx.match_stmt());
	}

	private Stmt ifStatement(PythonParser.If_stmtContext ctx)
	{
		// Blocks are built in source order so comments land in the right branch.
		List<Expr> tests = new ArrayList<>();
		List<List<Stmt>> bodies = new ArrayList<>();
		for (int i = 0; i < ctx.conds.size(); i++)
		{
			tests.add(visit(ctx.conds.get(i)));
			bodies.add(block(ctx.blocks.get(i)));
		}

		// elif chains become nested If nodes in the else branch, as Python's own ast does.
		List<Stmt> orelse = block(ctx.elseBlock);
		for (int i = ctx.conds.size() - 1; i > 0; i--)
		{
			int line = ctx.conds.get(i).getStart().getLine();
			List<Stmt> nested = new ArrayList<>();
			nested.add(new Stmt.If(line, tests.get(i), bodies.get(i), orelse));
			orelse = nested;
		}
		return new Stmt.If(ctx.getStart().getLine(), tests.get(0), bodies.get(0), orelse);
	}

	private Stmt functionDef(PythonParser.FuncdefContext ctx)
	{
		List<Stmt.Param> params = new ArrayList<>();
		if (ctx.params != null)
		{
			for (PythonParser.TfpdefContext p : ctx.params.tfpdef())
			{
				if (p.NAME() == null)
				{
					// bare '*' or '/' separators
					continue;
				}
				Expr annotation = p.annotation == null ? null : visit(p.annotation);
				Expr defaultValue = p.defaultValue == null ? null : visit(p.defaultValue);
				params.add(new Stmt.Param(p.NAME().getText(), annotation, defaultValue));
			}
		}
		Expr returns = ctx.returnType == null ? null : visit(ctx.returnType);
		return new Stmt.FunctionDef(ctx.getStart().getLine(), ctx.name.getText(), params, returns, block(ctx.body));
	}

	private Stmt classDef(PythonParser.ClassdefContext ctx)
	{
		List<Expr> bases = new ArrayList<>();
		if (ctx.bases != null)
		{
			for (PythonParser.ArgumentContext arg : ctx.bases.argument())
			{
				if (arg.keyword == null)
				{
					bases.add(visit(arg.value));
				}
			}
		}
		return new Stmt.ClassDef(ctx.getStart().getLine(), ctx.name.getText(), bases, block(ctx.body));
	}

	private Stmt matchStatement(PythonParser.Match_stmtContext ctx)
	{
		List<Stmt.MatchCase> cases = new ArrayList<>();
		for (PythonParser.Case_blockContext c : ctx.case_block())
		{
			List<Expr> patterns = new ArrayList<>();
			for (PythonParser.PatternContext p : c.patterns)
			{
				patterns.add(pattern(p));
			}
			Expr guard = c.guard == null ? null : visit(c.guard);
			cases.add(new Stmt.MatchCase(patterns, guard, block(c.body)));
		}
		return new Stmt.Match(ctx.getStart().getLine(), testlist(ctx.subject), cases);
	}

	private Expr pattern(PythonParser.PatternContext ctx)
	{
		if (ctx.NUMBER() != null)
		{
			Expr number = new Expr.Num(ctx.NUMBER().getText().replace("_", ""));
			return ctx.getChildCount() > 1 ? new Expr.UnaryOp(UnaryOperator.MINUS, number) : number;
		}
		if (!ctx.STRING().isEmpty())
		{
			return strings(ctx.STRING());
		}
		String text = ctx.getText();
		switch (text)
		{
			case "None":
				return new Expr.NoneLit();
			case "True":
				return new Expr.Bool(true);
			case "False":
				return new Expr.Bool(false);
			default:
				break;
		}
		List<TerminalNode> names = ctx.NAME();
		Expr result = new Expr.Name(names.get(0).getText());
		for (int i = 1; i < names.size(); i++)
		{
			result = new Expr.Attribute(result, names.get(i).getText());
		}
		return result;
	}

	// --- Expression lists ---

	private Expr testlist(PythonParser.TestlistContext ctx)
	{
		List<PythonParser.TestContext> tests = ctx.test();
		if (tests.size() == 1 && ctx.getChildCount() == 1)
		{
			return visit(tests.get(0));
		}
		return new Expr.TupleLit(tests.stream().map(this::visit).toList());
	}

	private Expr exprlist(PythonParser.ExprlistContext ctx)
	{
		List<PythonParser.ExprContext> exprs = ctx.expr();
		if (exprs.size() == 1 && ctx.getChildCount() == 1)
		{
			return visit(exprs.get(0));
		}
		return new Expr.TupleLit(exprs.stream().map(this::visit).toList());
	}

	// --- Expressions ---

	@Override
	public Expr visitTest(PythonParser.TestContext ctx)
	{
		if (ctx.lambdef() != null)
		{
			return new Expr.Unsupported("Lambda", ctx.getText());
		}
		if (ctx.cond != null)
		{
			return new Expr.IfExp(visit(ctx.cond), visit(ctx.body), visit(ctx.orelse));
		}
		return visit(ctx.body);
	}

	@Override
	public Expr visitOr_test(PythonParser.Or_testContext ctx)
	{
		if (ctx.and_test().size() == 1)
		{
			return visit(ctx.and_test(0));
		}
		return new Expr.BoolOp(BooleanOperator.OR, ctx.and_test().stream().map(this::visit).toList());
	}

	@Override
	public Expr visitAnd_test(PythonParser.And_testContext ctx)
	{
		if (ctx.not_test().size() == 1)
		{
			return visit(ctx.not_test(0));
		}
		return new Expr.BoolOp(BooleanOperator.AND, ctx.not_test().stream().map(this::visit).toList());
	}

	@Override
	public Expr visitNot_test(PythonParser.Not_testContext ctx)
	{
		if (ctx.not_test() != null)
		{
			return new Expr.UnaryOp(UnaryOperator.NOT, visit(ctx.not_test()));
		}
		return visit(ctx.comparison());
	}

	@Override
	public Expr visitComparison(PythonParser.ComparisonContext ctx)
	{
		if (ctx.expr().size() == 1)
		{
			return visit(ctx.expr(0));
		}
		List<CompareOperator> ops = new ArrayList<>();
		for (PythonParser.Comp_opContext op : ctx.comp_op())
		{
			// getText() would glue "not in" into "notin"
			StringBuilder symbol = new StringBuilder();
			for (int i = 0; i < op.getChildCount(); i++)
			{
				if (i > 0)
				{
					symbol.append(' ');
				}
				symbol.append(op.getChild(i).getText());
			}
			ops.add(CompareOperator.fromSymbol(symbol.toString()));
		}
		List<Expr> comparators = new ArrayList<>();
		for (int i = 1; i < ctx.expr().size(); i++)
		{
			comparators.add(visit(ctx.expr(i)));
		}
		return new Expr.Compare(visit(ctx.expr(0)), ops, comparators);
	}

	@Override
	public Expr visitFactorExpr(PythonParser.FactorExprContext ctx)
	{
		return visit(ctx.factor());
	}

	@Override
	public Expr visitMulExpr(PythonParser.MulExprContext ctx)
	{
		return new Expr.BinOp(visit(ctx.expr(0)), BinaryOperator.fromSymbol(ctx.op.getText()), visit(ctx.expr(1)));
	}

	@Override
	public Expr visitAddExpr(PythonParser.AddExprContext ctx)
	{
		return new Expr.BinOp(visit(ctx.expr(0)), BinaryOperator.fromSymbol(ctx.op.getText()), visit(ctx.expr(1)));
	}

	@Override
	public Expr visitFactor(PythonParser.FactorContext ctx)
	{
		if (ctx.op != null)
		{
			return new Expr.UnaryOp(UnaryOperator.fromSymbol(ctx.op.getText()), visit(ctx.factor()));
		}
		return visit(ctx.power());
	}

	@Override
	public Expr visitPower(PythonParser.PowerContext ctx)
	{
		Expr base = visit(ctx.atom_expr());
		if (ctx.exponent != null)
		{
			return new Expr.BinOp(base, BinaryOperator.POW, visit(ctx.exponent));
		}
		return base;
	}

	@Override
	public Expr visitAtom_expr(PythonParser.Atom_exprContext ctx)
	{
		Expr result = visit(ctx.atom());
		for (PythonParser.TrailerContext trailer : ctx.trailer())
		{
			if (trailer instanceof PythonParser.CallTrailerContext call)
			{
				result = call(result, call.arglist());
			}
			else if (trailer instanceof PythonParser.IndexTrailerContext index)
			{
				result = new Expr.Subscript(result, subscript(index.subscript_item()));
			}
			else
			{
				PythonParser.AttributeTrailerContext attribute = (PythonParser.AttributeTrailerContext) trailer;
				result = new Expr.Attribute(result, attribute.NAME().getText());
			}
		}
		return result;
	}

	private Expr call(Expr func, PythonParser.ArglistContext arglist)
	{
		List<Expr> args = new ArrayList<>();
		List<Expr.Keyword> keywords = new ArrayList<>();
		if (arglist != null)
		{
			for (PythonParser.ArgumentContext arg : arglist.argument())
			{
				if (arg.keyword != null)
				{
					keywords.add(new Expr.Keyword(arg.keyword.getText(), visit(arg.value)));
				}
				else if (arg.comp_for() != null)
				{
					args.add(comprehension(visit(arg.value), arg.comp_for()));
				}
				else
				{
					args.add(visit(arg.value));
				}
			}
		}
		return new Expr.Call(func, args, keywords);
	}

	private Expr subscript(PythonParser.Subscript_itemContext ctx)
	{
		if (ctx.index != null)
		{
			return visit(ctx.index);
		}
		return new Expr.Slice(
				ctx.lower == null ? null : visit(ctx.lower),
				ctx.upper == null ? null : visit(ctx.upper),
				ctx.step == null ? null : visit(ctx.step));
	}

	private Expr comprehension(Expr element, PythonParser.Comp_forContext ctx)
	{
		List<Expr> conditions = ctx.conds.stream().map(this::visit).toList();
		return new Expr.ListComp(element, exprlist(ctx.exprlist()), visit(ctx.iter), conditions);
	}

	@Override
	public Expr visitParenAtom(PythonParser.ParenAtomContext ctx)
	{
		PythonParser.Testlist_compContext inner = ctx.testlist_comp();
		if (inner == null)
		{
			return new Expr.TupleLit(List.of());
		}
		if (inner.comp_for() != null)
		{
			return comprehension(visit(inner.test(0)), inner.comp_for());
		}
		if (inner.test().size() == 1 && inner.getChildCount() == 1)
		{
			return visit(inner.test(0));
		}
		return new Expr.TupleLit(inner.test().stream().map(this::visit).toList());
	}

	@Override
	public Expr visitListAtom(PythonParser.ListAtomContext ctx)
	{
		PythonParser.Testlist_compContext inner = ctx.testlist_comp();
		if (inner == null)
		{
			return new Expr.ListLit(List.of());
		}
		if (inner.comp_for() != null)
		{
			return comprehension(visit(inner.test(0)), inner.comp_for());
		}
		return new Expr.ListLit(inner.test().stream().map(this::visit).toList());
	}

	@Override
	public Expr visitDictAtom(PythonParser.DictAtomContext ctx)
	{
		PythonParser.DictorsetmakerContext inner = ctx.dictorsetmaker();
		if (inner == null)
		{
			return new Expr.DictLit(List.of(), List.of());
		}
		if (inner.keys.isEmpty())
		{
			return new Expr.Unsupported("Set", ctx.getText());
		}
		return new Expr.DictLit(inner.keys.stream().map(this::visit).toList(), inner.values.stream().map(this::visit).toList());
	}

	@Override
	public Expr visitNameAtom(PythonParser.NameAtomContext ctx)
	{
		return new Expr.Name(ctx.NAME().getText());
	}

	@Override
	public Expr visitNumberAtom(PythonParser.NumberAtomContext ctx)
	{
		return new Expr.Num(ctx.NUMBER().getText().replace("_", ""));
	}

	@Override
	public Expr visitStringAtom(PythonParser.StringAtomContext ctx)
	{
		return strings(ctx.STRING());
	}

	@Override
	public Expr visitEllipsisAtom(PythonParser.EllipsisAtomContext ctx)
	{
		return new Expr.Unsupported("Ellipsis", "...");
	}

	@Override
	public Expr visitNoneAtom(PythonParser.NoneAtomContext ctx)
	{
		return new Expr.NoneLit();
	}

	@Override
	public Expr visitTrueAtom(PythonParser.TrueAtomContext ctx)
	{
		return new Expr.Bool(true);
	}

	@Override
	public Expr visitFalseAtom(PythonParser.FalseAtomContext ctx)
	{
		return new Expr.Bool(false);
	}

	// --- String literals ---

	/**
	 * Joins adjacent literals the way Python does. Any f-string among them turns
	 * the whole run into a {@link Expr.JoinedStr}.
	 */
	private Expr strings(List<TerminalNode> literals)
	{
		List<Expr> parts = new ArrayList<>();
		boolean formatted = false;
		for (TerminalNode literal : literals)
		{
			StringLiteral parsed = StringLiteral.of(literal.getText());
			if (parsed.formatted())
			{
				formatted = true;
				parts.addAll(formattedParts(parsed));
			}
			else
			{
				parts.add(new Expr.Str(parsed.body(), parsed.quote()));
			}
		}

		if (formatted)
		{
			return new Expr.JoinedStr(parts);
		}
		if (parts.size() == 1)
		{
			return parts.get(0);
		}
		StringBuilder joined = new StringBuilder();
		for (Expr part : parts)
		{
			joined.append(((Expr.Str) part).value());
		}
		return new Expr.Str(joined.toString(), ((Expr.Str) parts.get(0)).quote());
	}

	private List<Expr> formattedParts(StringLiteral literal)
	{
		List<Expr> parts = new ArrayList<>();
		String body = literal.body();
		StringBuilder text = new StringBuilder();
		int i = 0;
		while (i < body.length())
		{
			char c = body.charAt(i);
			if ((c == '{' || c == '}') && i + 1 < body.length() && body.charAt(i + 1) == c)
			{
				text.append(c);
				i += 2;
				continue;
			}
			if (c != '{')
			{
				text.append(c);
				i++;
				continue;
			}

			int close = matchingBrace(body, i);
			if (text.length() > 0)
			{
				parts.add(new Expr.Str(text.toString(), literal.quote()));
				text.setLength(0);
			}
			parts.add(replacementField(body.substring(i + 1, close)));
			i = close + 1;
		}
		if (text.length() > 0)
		{
			parts.add(new Expr.Str(text.toString(), literal.quote()));
		}
		return parts;
	}

	private static int matchingBrace(String body, int open)
	{
		int depth = 0;
		char inString = 0;
		for (int i = open; i < body.length(); i++)
		{
			char c = body.charAt(i);
			if (inString != 0)
			{
				if (c == inString)
				{
					inString = 0;
				}
				continue;
			}
			if (c == '\'' || c == '"')
			{
				inString = c;
			}
			else if (c == '{' || c == '[' || c == '(')
			{
				depth++;
			}
			else if (c == '}' || c == ']' || c == ')')
			{
				depth--;
				if (depth == 0 && c == '}')
				{
					return i;
				}
			}
		}
		throw new SyntaxException("[Syntax Error] unterminated '{' in f-string", 0, 0);
	}

	private Expr replacementField(String field)
	{
		// Split off "!r" conversions and ":spec" at bracket depth 0.
		int depth = 0;
		String expression = field;
		String spec = null;
		for (int i = 0; i < field.length(); i++)
		{
			char c = field.charAt(i);
			if (c == '[' || c == '(' || c == '{')
			{
				depth++;
			}
			else if (c == ']' || c == ')' || c == '}')
			{
				depth--;
			}
			else if (depth == 0 && (c == ':' || (c == '!' && i + 1 < field.length() && field.charAt(i + 1) != '=')))
			{
				expression = field.substring(0, i);
				int colon = field.indexOf(':', i);
				spec = colon >= 0 ? field.substring(colon + 1) : null;
				break;
			}
		}
		if (expression.endsWith("="))
		{
			expression = expression.substring(0, expression.length() - 1);
		}
		return new Expr.FormattedValue(expressionParser.apply(expression), spec);
	}

	/**
	 * Prefix, quote and body of one STRING token.
	 */
	private record StringLiteral(String prefix, char quote, String body)
	{
		static StringLiteral of(String token)
		{
			int start = 0;
			while (token.charAt(start) != '\'' && token.charAt(start) != '"')
			{
				start++;
			}
			String prefix = token.substring(0, start);
			char quote = token.charAt(start);
			boolean triple = token.startsWith(String.valueOf(quote).repeat(3), start) && token.length() - start >= 6;
			int width = triple ? 3 : 1;
			return new StringLiteral(prefix, quote, token.substring(start + width, token.length() - width));
		}

		boolean formatted()
		{
			return prefix.indexOf('f') >= 0 || prefix.indexOf('F') >= 0;
		}
	}

	@Override
	public Expr visit(ParseTree tree)
	{
		return tree == null ? null : super.visit(tree);
	}
}
