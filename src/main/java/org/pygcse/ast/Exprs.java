package org.pygcse.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Structural walks over expression trees.
 */
public final class Exprs
{
	private Exprs()
	{
	}

	/**
	 * Direct sub-expressions in source order; absent optional children are skipped.
	 */
	public static List<Expr> children(Expr expr)
	{
		List<Expr> out = new ArrayList<>();
		if (expr instanceof Expr.BinOp binOp)
		{
			add(out, binOp.left(), binOp.right());
		}
		else if (expr instanceof Expr.UnaryOp unary)
		{
			add(out, unary.operand());
		}
		else if (expr instanceof Expr.BoolOp boolOp)
		{
			addAll(out, boolOp.values());
		}
		else if (expr instanceof Expr.Compare compare)
		{
			add(out, compare.left());
			addAll(out, compare.comparators());
		}
		else if (expr instanceof Expr.Call call)
		{
			add(out, call.func());
			addAll(out, call.args());
			for (Expr.Keyword keyword : call.keywords())
			{
				add(out, keyword.value());
			}
		}
		else if (expr instanceof Expr.Attribute attribute)
		{
			add(out, attribute.value());
		}
		else if (expr instanceof Expr.Subscript subscript)
		{
			add(out, subscript.value(), subscript.index());
		}
		else if (expr instanceof Expr.Slice slice)
		{
			add(out, slice.lower(), slice.upper(), slice.step());
		}
		else if (expr instanceof Expr.ListLit list)
		{
			addAll(out, list.elements());
		}
		else if (expr instanceof Expr.TupleLit tuple)
		{
			addAll(out, tuple.elements());
		}
		else if (expr instanceof Expr.DictLit dict)
		{
			addAll(out, dict.keys());
			addAll(out, dict.values());
		}
		else if (expr instanceof Expr.IfExp ifExp)
		{
			add(out, ifExp.test(), ifExp.body(), ifExp.orelse());
		}
		else if (expr instanceof Expr.JoinedStr joined)
		{
			addAll(out, joined.values());
		}
		else if (expr instanceof Expr.FormattedValue formatted)
		{
			add(out, formatted.value());
		}
		else if (expr instanceof Expr.ListComp comp)
		{
			add(out, comp.element(), comp.target(), comp.iter());
			addAll(out, comp.conditions());
		}
		return out;
	}

	/**
	 * Pre-order visit of {@code expr} and everything below it. A {@code null} root is ignored.
	 */
	public static void forEach(Expr expr, Consumer<Expr> action)
	{
		if (expr == null)
		{
			return;
		}
		action.accept(expr);
		for (Expr child : children(expr))
		{
			forEach(child, action);
		}
	}

	public static boolean anyMatch(Expr expr, Predicate<Expr> predicate)
	{
		if (expr == null)
		{
			return false;
		}
		if (predicate.test(expr))
		{
			return true;
		}
		for (Expr child : children(expr))
		{
			if (anyMatch(child, predicate))
			{
				return true;
			}
		}
		return false;
	}

	/**
	 * True if {@code expr} reads the plain variable {@code name}.
	 */
	public static boolean readsName(Expr expr, String name)
	{
		return anyMatch(expr, e -> e instanceof Expr.Name n && name.equals(n.id()));
	}

	public static boolean isCallTo(Expr expr, String function)
	{
		return expr instanceof Expr.Call call && function.equals(call.simpleName());
	}

	private static void add(List<Expr> out, Expr... exprs)
	{
		for (Expr e : exprs)
		{
			if (e != null)
			{
				out.add(e);
			}
		}
	}

	private static void addAll(List<Expr> out, List<Expr> exprs)
	{
		for (Expr e : exprs)
		{
			if (e != null)
			{
				out.add(e);
			}
		}
	}
}
