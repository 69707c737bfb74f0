package org.pygcse.translate;

import org.pygcse.ast.BinaryOperator;
import org.pygcse.ast.Expr;
import org.pygcse.ast.UnaryOperator;
import org.pygcse.util.MalformedInputException;

import java.util.List;

/**
 * Converts the arguments of {@code range(...)} into the inclusive bounds of a
 * counting loop.
 *
 * @param start       first value
 * @param end         last value reached, inclusive
 * @param step        {@code null} when counting up by one
 * @param approximate true when the bound could not be made exact
 */
public record RangeBounds(String start, String end, String step, boolean approximate)
{
	public static RangeBounds resolve(List<Expr> args, ExpressionTranslator expressions)
	{
		if (args.isEmpty() || args.size() > 3)
		{
			throw new MalformedInputException("range() takes 1 to 3 arguments, got " + args.size(), expressions.getLine());
		}

		Expr startExpr = args.size() == 1 ? new Expr.Num("0") : args.get(0);
		Expr endExpr = args.size() == 1 ? args.get(0) : args.get(1);
		Expr stepExpr = args.size() == 3 ? args.get(2) : null;
		String start = expressions.translate(startExpr);

		Long step = stepExpr == null ? Long.valueOf(1) : literal(stepExpr);
		if (step == null)
		{
			// symbolic step: direction unknown, assume counting up
			return new RangeBounds(start, offset(endExpr, -1, expressions), expressions.translate(stepExpr), true);
		}
		if (step == 0)
		{
			throw new MalformedInputException("range() step must not be zero", expressions.getLine());
		}
		if (step == 1)
		{
			return new RangeBounds(start, offset(endExpr, -1, expressions), null, false);
		}

		Long first = literal(startExpr);
		Long limit = literal(endExpr);
		String stepText = String.valueOf(step);
		if (first != null && limit != null)
		{
			return new RangeBounds(start, String.valueOf(lastValue(first, limit, step)), stepText, false);
		}
		return new RangeBounds(start, offset(endExpr, step > 0 ? -1 : 1, expressions), stepText, false);
	}

	/**
	 * The last value {@code range(first, limit, step)} produces. For an empty
	 * range this is a bound the loop never reaches, so it runs zero times.
	 */
	static long lastValue(long first, long limit, long step)
	{
		if (step > 0)
		{
			if (first >= limit)
			{
				return first - 1;
			}
			return first + ((limit - first - 1) / step) * step;
		}
		if (first <= limit)
		{
			return first + 1;
		}
		return first - ((first - limit - 1) / -step) * -step;
	}

	/**
	 * Renders {@code expr + delta}, folding literals and a trailing {@code + c}.
	 */
	static String offset(Expr expr, long delta, ExpressionTranslator expressions)
	{
		Long value = literal(expr);
		if (value != null)
		{
			return String.valueOf(value + delta);
		}
		if (expr instanceof Expr.BinOp binOp && binOp.right() instanceof Expr.Num num && num.fitsLong()
				&& (binOp.op() == BinaryOperator.ADD || binOp.op() == BinaryOperator.SUB)
				&& !expressions.isConcatenation(binOp.left(), binOp.right()))
		{
			long constant = binOp.op() == BinaryOperator.ADD ? num.intValue() : -num.intValue();
			return ExpressionTranslator.withOffset(expressions.translate(binOp.left(), ExpressionTranslator.PREC_ADD), constant + delta);
		}
		return ExpressionTranslator.withOffset(expressions.translate(expr, ExpressionTranslator.PREC_ADD), delta);
	}

	/**
	 * The value of an integer literal, possibly negated, otherwise {@code null}.
	 */
	static Long literal(Expr expr)
	{
		if (expr instanceof Expr.Num num && num.fitsLong())
		{
			return num.intValue();
		}
		if (expr instanceof Expr.UnaryOp unary && unary.op() == UnaryOperator.MINUS
				&& unary.operand() instanceof Expr.Num num && num.fitsLong())
		{
			return -num.intValue();
		}
		return null;
	}
}
