package org.pygcse.translate;

import org.pygcse.ast.BinaryOperator;
import org.pygcse.ast.BooleanOperator;
import org.pygcse.ast.CompareOperator;
import org.pygcse.ast.Expr;
import org.pygcse.ast.UnaryOperator;
import org.pygcse.semantic.SymbolContext;
import org.pygcse.semantic.TypeInference;
import org.pygcse.semantic.symbol.ArraySymbol;
import org.pygcse.semantic.symbol.ClassSymbol;
import org.pygcse.semantic.type.PseudoType;
import org.pygcse.util.Diagnostic;
import org.pygcse.util.ErrorHandler;
import org.pygcse.util.MalformedInputException;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders expression nodes as pseudocode text. The syntax tree keeps no
 * parentheses, so they are re-derived from operator precedence.
 */
public class ExpressionTranslator
{
	// Binding strength, loosest first.
	static final int PREC_NONE = 0;
	static final int PREC_OR = 1;
	static final int PREC_AND = 2;
	static final int PREC_NOT = 3;
	static final int PREC_COMPARE = 4;
	static final int PREC_ADD = 5;
	static final int PREC_MULT = 6;
	static final int PREC_UNARY = 7;
	static final int PREC_POW = 8;
	static final int PREC_ATOM = 10;

	private final SymbolContext context;
	private final TypeInference types;
	private final ErrorHandler errorHandler;
	private int line;

	public ExpressionTranslator(SymbolContext context, TypeInference types, ErrorHandler errorHandler)
	{
		this.context = context;
		this.types = types;
		this.errorHandler = errorHandler;
	}

	/**
	 * Sets the source line reported by diagnostics raised while translating.
	 */
	public void setLine(int line)
	{
		this.line = line;
	}

	public int getLine()
	{
		return line;
	}

	public String translate(Expr expr)
	{
		return translate(expr, PREC_NONE);
	}

	/**
	 * Translates {@code expr}, parenthesising it when it binds looser than {@code minPrecedence}.
	 */
	public String translate(Expr expr, int minPrecedence)
	{
		if (expr == null)
		{
			throw new MalformedInputException("Missing expression", line);
		}
		String text = render(expr);
		return precedence(expr) < minPrecedence ? "(" + text + ")" : text;
	}

	public String translateArguments(List<Expr> args, List<Expr.Keyword> keywords)
	{
		List<String> parts = new ArrayList<>();
		for (Expr arg : args)
		{
			parts.add(translate(arg));
		}
		for (Expr.Keyword keyword : keywords)
		{
			parts.add(translate(keyword.value()));
		}
		return String.join(", ", parts);
	}

	/**
	 * True when {@code +} between these operands is a string concatenation.
	 */
	public boolean isConcatenation(Expr left, Expr right)
	{
		return isStringLike(left) || isStringLike(right);
	}

	// --- Dispatch ---

	private String render(Expr expr)
	{
		if (expr instanceof Expr.Name name)
		{
			return renderName(name);
		}
		if (expr instanceof Expr.Num num)
		{
			return num.literal();
		}
		if (expr instanceof Expr.Str str)
		{
			return str.quoted();
		}
		if (expr instanceof Expr.Bool bool)
		{
			return bool.value() ? "TRUE" : "FALSE";
		}
		if (expr instanceof Expr.NoneLit)
		{
			return "NULL";
		}
		if (expr instanceof Expr.BinOp binOp)
		{
			return renderBinary(binOp);
		}
		if (expr instanceof Expr.UnaryOp unary)
		{
			return renderUnary(unary);
		}
		if (expr instanceof Expr.BoolOp boolOp)
		{
			return renderBoolean(boolOp);
		}
		if (expr instanceof Expr.Compare compare)
		{
			return renderCompare(compare);
		}
		if (expr instanceof Expr.Call call)
		{
			return renderCall(call);
		}
		if (expr instanceof Expr.Attribute attribute)
		{
			return renderAttribute(attribute);
		}
		if (expr instanceof Expr.Subscript subscript)
		{
			return renderSubscript(subscript);
		}
		if (expr instanceof Expr.ListLit list)
		{
			return "[" + joinElements(list.elements()) + "]";
		}
		if (expr instanceof Expr.TupleLit tuple)
		{
			return "(" + joinElements(tuple.elements()) + ")";
		}
		if (expr instanceof Expr.DictLit dict)
		{
			return renderDict(dict);
		}
		if (expr instanceof Expr.IfExp ifExp)
		{
			approximation("Conditional expression rendered inline");
			return "IF " + translate(ifExp.test()) + " THEN " + translate(ifExp.body()) + " ELSE " + translate(ifExp.orelse());
		}
		if (expr instanceof Expr.JoinedStr joined)
		{
			return renderFormattedString(joined);
		}
		if (expr instanceof Expr.FormattedValue formatted)
		{
			return translate(formatted.value());
		}
		if (expr instanceof Expr.ListComp comp)
		{
			approximation("List comprehension has no pseudocode equivalent");
			return "[" + translate(comp.element()) + " FOR " + translate(comp.target()) + " IN " + translate(comp.iter()) + "]";
		}
		if (expr instanceof Expr.Slice slice)
		{
			return optional(slice.lower()) + ":" + optional(slice.upper());
		}
		return renderUnknown(((Expr.Unsupported) expr).kind());
	}

	private int precedence(Expr expr)
	{
		if (expr instanceof Expr.BinOp binOp)
		{
			return binaryPrecedence(binOp.op());
		}
		if (expr instanceof Expr.UnaryOp unary)
		{
			return unary.op() == UnaryOperator.NOT ? PREC_NOT : PREC_UNARY;
		}
		if (expr instanceof Expr.BoolOp boolOp)
		{
			return boolOp.op() == BooleanOperator.AND ? PREC_AND : PREC_OR;
		}
		if (expr instanceof Expr.Compare compare)
		{
			// a chain renders as "x AND y"
			return compare.ops().size() > 1 ? PREC_AND : PREC_COMPARE;
		}
		if (expr instanceof Expr.JoinedStr joined)
		{
			return joined.values().size() > 1 ? PREC_ADD : PREC_ATOM;
		}
		if (expr instanceof Expr.IfExp)
		{
			return PREC_NONE;
		}
		if (expr instanceof Expr.Num num && num.literal().startsWith("-"))
		{
			return PREC_UNARY;
		}
		return PREC_ATOM;
	}

	private static int binaryPrecedence(BinaryOperator op)
	{
		return switch (op)
		{
			case ADD, SUB -> PREC_ADD;
			case MULT, DIV, FLOOR_DIV, MOD -> PREC_MULT;
			case POW -> PREC_POW;
		};
	}

	// --- Names and operators ---

	private String renderName(Expr.Name name)
	{
		if (name.id() == null)
		{
			throw new MalformedInputException("Name without identifier", line);
		}
		String alias = context.getAlias(name.id());
		return alias != null ? alias : name.id();
	}

	private String renderBinary(Expr.BinOp binOp)
	{
		if (binOp.op() == null)
		{
			return renderUnknown("BinOp");
		}
		int prec = binaryPrecedence(binOp.op());
		String symbol = binOp.op().getPseudocode();
		if (binOp.op() == BinaryOperator.ADD && isConcatenation(binOp.left(), binOp.right()))
		{
			symbol = "&";
		}

		// ** is right associative, the others left associative
		boolean rightAssociative = binOp.op() == BinaryOperator.POW;
		String left = translate(binOp.left(), rightAssociative ? prec + 1 : prec);
		String right = translate(binOp.right(), rightAssociative ? prec : prec + 1);
		return left + " " + symbol + " " + right;
	}

	private String renderUnary(Expr.UnaryOp unary)
	{
		if (unary.op() == null || unary.op() == UnaryOperator.INVERT)
		{
			return renderUnknown(unary.op() == null ? "UnaryOp" : "Invert");
		}
		if (unary.op() == UnaryOperator.NOT)
		{
			return "NOT " + translate(unary.operand(), PREC_NOT);
		}
		return unary.op().getPseudocode() + translate(unary.operand(), PREC_UNARY);
	}

	private String renderBoolean(Expr.BoolOp boolOp)
	{
		int prec = boolOp.op() == BooleanOperator.AND ? PREC_AND : PREC_OR;
		List<String> parts = new ArrayList<>();
		for (Expr value : boolOp.values())
		{
			parts.add(translate(value, prec + 1));
		}
		return String.join(" " + boolOp.op().name() + " ", parts);
	}

	/**
	 * {@code a < b < c} becomes {@code a < b AND b < c}.
	 */
	private String renderCompare(Expr.Compare compare)
	{
		if (compare.ops().size() != compare.comparators().size() || compare.ops().isEmpty())
		{
			throw new MalformedInputException("Comparison operators and operands do not match", line);
		}
		List<String> parts = new ArrayList<>();
		Expr left = compare.left();
		for (int i = 0; i < compare.ops().size(); i++)
		{
			CompareOperator op = compare.ops().get(i);
			if (op == null)
			{
				return renderUnknown("Compare");
			}
			Expr right = compare.comparators().get(i);
			parts.add(translate(left, PREC_ADD) + " " + op.getPseudocode() + " " + translate(right, PREC_ADD));
			left = right;
		}
		return String.join(" AND ", parts);
	}

	// --- Calls ---

	private String renderCall(Expr.Call call)
	{
		String name = call.simpleName();
		List<Expr> args = call.args();
		if (name != null)
		{
			String builtin = renderBuiltin(name, call);
			if (builtin != null)
			{
				return builtin;
			}
			ClassSymbol classSymbol = context.getClassSymbol(name);
			if (classSymbol != null)
			{
				return "NEW " + name + "(" + translateArguments(args, call.keywords()) + ")";
			}
			return name + "(" + translateArguments(args, call.keywords()) + ")";
		}

		if (call.func() instanceof Expr.Attribute attribute)
		{
			String method = renderMethod(attribute, args);
			if (method != null)
			{
				return method;
			}
		}
		return translate(call.func(), PREC_ATOM) + "(" + translateArguments(args, call.keywords()) + ")";
	}

	private String renderBuiltin(String name, Expr.Call call)
	{
		List<Expr> args = call.args();
		switch (name)
		{
			case "len":
				return "LENGTH(" + translateArguments(args, call.keywords()) + ")";
			case "str":
				return "STRING(" + translateArguments(args, call.keywords()) + ")";
			case "int":
				return "INTEGER(" + translateArguments(args, call.keywords()) + ")";
			case "float":
				return "REAL(" + translateArguments(args, call.keywords()) + ")";
			case "abs":
				return "ABS(" + translateArguments(args, call.keywords()) + ")";
			case "max":
				return "MAX(" + translateArguments(args, call.keywords()) + ")";
			case "min":
				return "MIN(" + translateArguments(args, call.keywords()) + ")";
			case "round":
				return "ROUND(" + translateArguments(args, call.keywords()) + ")";
			case "input":
				approximation("input() used inside an expression");
				return "INPUT";
			default:
				return null;
		}
	}

	private String renderMethod(Expr.Attribute attribute, List<Expr> args)
	{
		Expr target = attribute.value();
		if (target instanceof Expr.Name module && module.id().equals("random"))
		{
			if (attribute.attr().equals("random") && args.isEmpty())
			{
				return "RANDOM()";
			}
			if (attribute.attr().equals("randint") && args.size() == 2)
			{
				String low = translate(args.get(0), PREC_ADD + 1);
				String high = translate(args.get(1), PREC_ADD);
				return "ROUND(RANDOM() * (" + high + " - " + low + ") + " + low + ", 0)";
			}
		}

		String self = translate(target, PREC_ATOM);
		switch (attribute.attr())
		{
			case "upper":
				return args.isEmpty() ? "UCASE(" + self + ")" : null;
			case "lower":
				return args.isEmpty() ? "LCASE(" + self + ")" : null;
			case "strip":
				return args.isEmpty() ? "TRIM(" + self + ")" : null;
			case "split":
				return "SPLIT(" + self + ", " + (args.isEmpty() ? "\" \"" : translate(args.get(0))) + ")";
			case "replace":
				return args.size() == 2 ? "REPLACE(" + self + ", " + translate(args.get(0)) + ", " + translate(args.get(1)) + ")" : null;
			case "find":
				return args.size() == 1 ? "FIND(" + self + ", " + translate(args.get(0)) + ")" : null;
			case "startswith":
				return args.size() == 1 ? "STARTSWITH(" + self + ", " + translate(args.get(0)) + ")" : null;
			case "endswith":
				return args.size() == 1 ? "ENDSWITH(" + self + ", " + translate(args.get(0)) + ")" : null;
			default:
				return null;
		}
	}

	// --- Attributes and subscripts ---

	private String renderAttribute(Expr.Attribute attribute)
	{
		if (attribute.attr() == null)
		{
			throw new MalformedInputException("Attribute without name", line);
		}
		if (context.getCurrentClass() != null && attribute.value() instanceof Expr.Name name && name.id().equals("self"))
		{
			return attribute.attr();
		}
		return translate(attribute.value(), PREC_ATOM) + "." + attribute.attr();
	}

	private String renderSubscript(Expr.Subscript subscript)
	{
		Expr index = subscript.index();
		if (index == null)
		{
			throw new MalformedInputException("Subscript without index", line);
		}
		if (index instanceof Expr.Slice slice)
		{
			return renderSlice(subscript.value(), slice);
		}

		String target = translate(subscript.value(), PREC_ATOM);
		if (index instanceof Expr.Str key)
		{
			// dictionary lookup, no shift
			return target + "[" + key.quoted() + "]";
		}
		String arrayName = subscript.value() instanceof Expr.Name name ? name.id() : null;
		if (arrayName != null && !context.isArray(arrayName) && context.getType(arrayName) == PseudoType.STRING)
		{
			return "SUBSTRING(" + target + ", " + renderIndex(index, target, arrayName) + ", 1)";
		}
		return target + "[" + renderIndex(index, target, arrayName) + "]";
	}

	/**
	 * Shifts a 0-based index to the 1-based form. {@code target} is the rendered
	 * collection, used for {@code LENGTH} when a negative index meets an unknown size.
	 */
	public String renderIndex(Expr index, String target, String arrayName)
	{
		if (index instanceof Expr.Num num && num.fitsLong())
		{
			return String.valueOf(num.intValue() + 1);
		}
		if (index instanceof Expr.UnaryOp unary && unary.op() == UnaryOperator.MINUS
				&& unary.operand() instanceof Expr.Num num && num.fitsLong())
		{
			long fromEnd = num.intValue();
			ArraySymbol array = arrayName == null ? null : context.getArray(arrayName);
			// counted from the filled elements, not the declared capacity
			if (array != null && array.isLengthKnown() && fromEnd <= array.getNextIndex())
			{
				return String.valueOf(array.getNextIndex() - fromEnd + 1);
			}
			if (array != null && array.getCounter() != null)
			{
				return withOffset(array.getCounter(), 1 - fromEnd);
			}
			return fromEnd == 1 ? "LENGTH(" + target + ")" : "LENGTH(" + target + ") - " + (fromEnd - 1);
		}
		if (index instanceof Expr.Name name && context.isOneBased(name.id()))
		{
			return name.id();
		}
		if (index instanceof Expr.BinOp binOp && (binOp.op() == BinaryOperator.ADD || binOp.op() == BinaryOperator.SUB))
		{
			String folded = foldOffset(binOp);
			if (folded != null)
			{
				return folded;
			}
		}
		return translate(index, PREC_ADD) + " + 1";
	}

	/**
	 * {@code i - 1} becomes {@code i}, {@code i + 2} becomes {@code i + 3}.
	 */
	private String foldOffset(Expr.BinOp binOp)
	{
		Expr base;
		long offset;
		if (binOp.right() instanceof Expr.Num num && num.fitsLong())
		{
			base = binOp.left();
			offset = binOp.op() == BinaryOperator.ADD ? num.intValue() : -num.intValue();
		}
		else if (binOp.op() == BinaryOperator.ADD && binOp.left() instanceof Expr.Num num && num.fitsLong())
		{
			base = binOp.right();
			offset = num.intValue();
		}
		else
		{
			return null;
		}

		boolean oneBased = base instanceof Expr.Name name && context.isOneBased(name.id());
		if (!oneBased)
		{
			offset += 1;
		}
		return withOffset(translate(base, PREC_ADD), offset);
	}

	static String withOffset(String base, long offset)
	{
		if (offset == 0)
		{
			return base;
		}
		return offset > 0 ? base + " + " + offset : base + " - " + (-offset);
	}

	/**
	 * {@code s[a:b]} becomes {@code SUBSTRING(s, a + 1, b - a)}.
	 */
	private String renderSlice(Expr value, Expr.Slice slice)
	{
		String target = translate(value, PREC_ATOM);
		if (slice.step() != null)
		{
			approximation("Slice step ignored");
		}

		Expr lower = slice.lower();
		Expr upper = slice.upper();
		boolean lowerZero = lower == null || (lower instanceof Expr.Num num && num.fitsLong() && num.intValue() == 0);
		String start = lowerZero ? "1" : renderIndex(lower, target, null);

		String length;
		if (upper == null)
		{
			length = lowerZero ? "LENGTH(" + target + ")" : "LENGTH(" + target + ") - " + translate(lower, PREC_ADD + 1);
		}
		else if (lowerZero)
		{
			length = translate(upper);
		}
		else if (upper instanceof Expr.Num high && high.fitsLong() && lower instanceof Expr.Num low && low.fitsLong())
		{
			length = String.valueOf(high.intValue() - low.intValue());
		}
		else
		{
			length = translate(upper, PREC_ADD) + " - " + translate(lower, PREC_ADD + 1);
		}
		return "SUBSTRING(" + target + ", " + start + ", " + length + ")";
	}

	// --- Literals ---

	private String renderDict(Expr.DictLit dict)
	{
		approximation("Dictionary literal has no pseudocode equivalent");
		List<String> pairs = new ArrayList<>();
		for (int i = 0; i < dict.keys().size() && i < dict.values().size(); i++)
		{
			Expr key = dict.keys().get(i);
			pairs.add(key == null ? "**" + translate(dict.values().get(i)) : translate(key) + ": " + translate(dict.values().get(i)));
		}
		return "{" + String.join(", ", pairs) + "}";
	}

	/**
	 * f-strings become a concatenation of their literal and formatted parts.
	 */
	private String renderFormattedString(Expr.JoinedStr joined)
	{
		if (joined.values().isEmpty())
		{
			return "\"\"";
		}
		List<String> parts = new ArrayList<>();
		for (Expr part : joined.values())
		{
			if (part instanceof Expr.FormattedValue formatted && formatted.formatSpec() != null && !formatted.formatSpec().isEmpty())
			{
				approximation("Format specification '" + formatted.formatSpec() + "' ignored");
			}
			parts.add(translate(part, PREC_ADD + 1));
		}
		return String.join(" & ", parts);
	}

	private String joinElements(List<Expr> elements)
	{
		List<String> parts = new ArrayList<>();
		for (Expr element : elements)
		{
			parts.add(translate(element));
		}
		return String.join(", ", parts);
	}

	private String optional(Expr expr)
	{
		return expr == null ? "" : translate(expr);
	}

	private boolean isStringLike(Expr expr)
	{
		if (expr instanceof Expr.Str || expr instanceof Expr.JoinedStr)
		{
			return true;
		}
		if (expr instanceof Expr.BinOp binOp && binOp.op() == BinaryOperator.ADD)
		{
			return isConcatenation(binOp.left(), binOp.right());
		}
		if (expr instanceof Expr.Name name)
		{
			return context.getType(name.id()) == PseudoType.STRING;
		}
		return types.isString(expr);
	}

	// --- Diagnostics ---

	private String renderUnknown(String kind)
	{
		errorHandler.logWarning(Diagnostic.Kind.UNKNOWN_EXPRESSION, line, "No translation for expression '" + kind + "'");
		return "Unknown(" + kind + ")";
	}

	private void approximation(String message)
	{
		errorHandler.logWarning(Diagnostic.Kind.APPROXIMATION, line, message);
	}
}
