package org.pygcse.ast;

import java.util.List;

/**
 * Expression nodes of the supported Python subset. Optional children are
 * {@code null} when absent; lists are never {@code null}.
 */
public sealed interface Expr
{
	record Name(String id) implements Expr
	{
	}

	/**
	 * A numeric literal kept as written, so {@code 3.50} is not re-rendered as {@code 3.5}.
	 */
	record Num(String literal) implements Expr
	{
		public boolean isInteger()
		{
			return literal.matches("\\d+");
		}

		/**
		 * An integer literal small enough for {@link #intValue()}.
		 */
		public boolean fitsLong()
		{
			return isInteger() && literal.length() <= 18;
		}

		public long intValue()
		{
			return Long.parseLong(literal);
		}
	}

	/**
	 * A string literal. {@code value} is the source text between the quotes, escapes untouched.
	 */
	record Str(String value, char quote) implements Expr
	{
		public String quoted()
		{
			return quote + value + quote;
		}
	}

	record Bool(boolean value) implements Expr
	{
	}

	record NoneLit() implements Expr
	{
	}

	record BinOp(Expr left, BinaryOperator op, Expr right) implements Expr
	{
	}

	record UnaryOp(UnaryOperator op, Expr operand) implements Expr
	{
	}

	record BoolOp(BooleanOperator op, List<Expr> values) implements Expr
	{
	}

	record Compare(Expr left, List<CompareOperator> ops, List<Expr> comparators) implements Expr
	{
	}

	record Keyword(String name, Expr value)
	{
	}

	record Call(Expr func, List<Expr> args, List<Keyword> keywords) implements Expr
	{
		/**
		 * The called name for plain calls like {@code f(x)}, otherwise {@code null}.
		 */
		public String simpleName()
		{
			return func instanceof Name name ? name.id() : null;
		}
	}

	record Attribute(Expr value, String attr) implements Expr
	{
	}

	record Subscript(Expr value, Expr index) implements Expr
	{
	}

	record Slice(Expr lower, Expr upper, Expr step) implements Expr
	{
	}

	record ListLit(List<Expr> elements) implements Expr
	{
	}

	record TupleLit(List<Expr> elements) implements Expr
	{
	}

	record DictLit(List<Expr> keys, List<Expr> values) implements Expr
	{
	}

	record IfExp(Expr test, Expr body, Expr orelse) implements Expr
	{
	}

	/**
	 * An f-string; {@code values} holds {@link Str} and {@link FormattedValue} parts in order.
	 */
	record JoinedStr(List<Expr> values) implements Expr
	{
	}

	record FormattedValue(Expr value, String formatSpec) implements Expr
	{
	}

	record ListComp(Expr element, Expr target, Expr iter, List<Expr> conditions) implements Expr
	{
	}

	/**
	 * Anything the suppliers recognise but the translator has no rule for.
	 */
	record Unsupported(String kind, String text) implements Expr
	{
	}
}
