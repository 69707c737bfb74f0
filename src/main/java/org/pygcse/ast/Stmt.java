package org.pygcse.ast;

import java.util.List;

/**
 * Statement nodes of the supported Python subset. Every statement carries the
 * source line it starts on (0 when the supplier does not know it).
 */
public sealed interface Stmt
{
	int line();

	/**
	 * {@code a = b = value} has two targets; {@code a, b = 1, 2} has one tuple target.
	 */
	record Assign(int line, List<Expr> targets, Expr value) implements Stmt
	{
	}

	record AugAssign(int line, Expr target, BinaryOperator op, Expr value) implements Stmt
	{
	}

	record AnnAssign(int line, Expr target, Expr annotation, Expr value) implements Stmt
	{
	}

	record If(int line, Expr test, List<Stmt> body, List<Stmt> orelse) implements Stmt
	{
	}

	record For(int line, Expr target, Expr iter, List<Stmt> body, List<Stmt> orelse) implements Stmt
	{
	}

	record While(int line, Expr test, List<Stmt> body, List<Stmt> orelse) implements Stmt
	{
	}

	record Param(String name, Expr annotation, Expr defaultValue)
	{
	}

	record FunctionDef(int line, String name, List<Param> params, Expr returns, List<Stmt> body) implements Stmt
	{
	}

	record ClassDef(int line, String name, List<Expr> bases, List<Stmt> body) implements Stmt
	{
	}

	record Return(int line, Expr value) implements Stmt
	{
	}

	record ExprStmt(int line, Expr value) implements Stmt
	{
	}

	record Pass(int line) implements Stmt
	{
	}

	record Break(int line) implements Stmt
	{
	}

	record Continue(int line) implements Stmt
	{
	}

	/**
	 * A source comment; {@code text} excludes the leading {@code #}.
	 */
	record Comment(int line, String text) implements Stmt
	{
	}

	record MatchCase(List<Expr> patterns, Expr guard, List<Stmt> body)
	{
	}

	record Match(int line, Expr subject, List<MatchCase> cases) implements Stmt
	{
	}

	/**
	 * Only the protected body is kept; handlers and clean-up blocks are dropped.
	 */
	record Try(int line, List<Stmt> body) implements Stmt
	{
	}

	record With(int line, List<Stmt> body) implements Stmt
	{
	}

	// Constructs rendered as a comment marker only.

	record Import(int line) implements Stmt
	{
	}

	record Assert(int line) implements Stmt
	{
	}

	record Raise(int line) implements Stmt
	{
	}

	record Global(int line) implements Stmt
	{
	}

	record Delete(int line) implements Stmt
	{
	}

	/**
	 * A statement type the supplier could not map, e.g. {@code AsyncFor} from a JSON dump.
	 */
	record Unknown(int line, String type) implements Stmt
	{
	}
}
