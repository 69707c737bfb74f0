package org.pygcse.semantic;

import org.pygcse.ast.Expr;
import org.pygcse.ast.UnaryOperator;
import org.pygcse.semantic.symbol.ArraySymbol;
import org.pygcse.semantic.type.PseudoType;

/**
 * Best-effort static typing of expressions, good enough to pick a DECLARE
 * type or decide between {@code +} and {@code &}. Returns {@code null} when
 * nothing can be said.
 */
public class TypeInference
{
	private final SymbolContext context;

	public TypeInference(SymbolContext context)
	{
		this.context = context;
	}

	public PseudoType infer(Expr expr)
	{
		if (expr == null)
		{
			return null;
		}

		if (expr instanceof Expr.Num num)
		{
			return num.isInteger() ? PseudoType.INTEGER : numericLiteralType(num.literal());
		}
		if (expr instanceof Expr.Str || expr instanceof Expr.JoinedStr)
		{
			return PseudoType.STRING;
		}
		if (expr instanceof Expr.Bool || expr instanceof Expr.Compare || expr instanceof Expr.BoolOp)
		{
			return PseudoType.BOOLEAN;
		}
		if (expr instanceof Expr.ListLit || expr instanceof Expr.TupleLit || expr instanceof Expr.ListComp)
		{
			return PseudoType.ARRAY;
		}
		if (expr instanceof Expr.DictLit)
		{
			return PseudoType.RECORD;
		}
		if (expr instanceof Expr.Name name)
		{
			return context.getType(name.id());
		}
		if (expr instanceof Expr.UnaryOp unary)
		{
			return unary.op() == UnaryOperator.NOT ? PseudoType.BOOLEAN : infer(unary.operand());
		}
		if (expr instanceof Expr.BinOp binOp)
		{
			return inferBinary(binOp);
		}
		if (expr instanceof Expr.IfExp ifExp)
		{
			PseudoType body = infer(ifExp.body());
			return body != null ? body : infer(ifExp.orelse());
		}
		if (expr instanceof Expr.Subscript subscript)
		{
			return inferSubscript(subscript);
		}
		if (expr instanceof Expr.Call call)
		{
			return inferCall(call);
		}
		return null;
	}

	/**
	 * Like {@link #infer} but never {@code null}; unknown expressions are treated as text.
	 */
	public PseudoType inferOrDefault(Expr expr)
	{
		PseudoType type = infer(expr);
		return type == null ? PseudoType.STRING : type;
	}

	public boolean isString(Expr expr)
	{
		return infer(expr) == PseudoType.STRING;
	}

	/**
	 * Maps an annotation expression such as {@code int} or {@code list[str]}.
	 */
	public static PseudoType fromAnnotation(Expr annotation)
	{
		if (annotation instanceof Expr.Name name)
		{
			return PseudoType.fromPythonName(name.id());
		}
		if (annotation instanceof Expr.Subscript subscript)
		{
			return fromAnnotation(subscript.value());
		}
		if (annotation instanceof Expr.Str str)
		{
			return PseudoType.fromPythonName(str.value());
		}
		return PseudoType.STRING;
	}

	/**
	 * The element type of a {@code list[T]} annotation, or {@code null} for a bare {@code list}.
	 */
	public static PseudoType elementTypeOf(Expr annotation)
	{
		if (annotation instanceof Expr.Subscript subscript)
		{
			return fromAnnotation(subscript.index());
		}
		return null;
	}

	private PseudoType inferBinary(Expr.BinOp binOp)
	{
		PseudoType left = infer(binOp.left());
		PseudoType right = infer(binOp.right());
		if (left == PseudoType.STRING || right == PseudoType.STRING)
		{
			return PseudoType.STRING;
		}
		if (binOp.op() == null)
		{
			return null;
		}

		switch (binOp.op())
		{
			case DIV:
				return PseudoType.REAL;
			case FLOOR_DIV:
			case MOD:
				return PseudoType.INTEGER;
			default:
				// untyped operands, e.g. parameters, count as whole numbers
				return left == PseudoType.REAL || right == PseudoType.REAL ? PseudoType.REAL : PseudoType.INTEGER;
		}
	}

	private PseudoType inferSubscript(Expr.Subscript subscript)
	{
		if (subscript.index() instanceof Expr.Slice)
		{
			return infer(subscript.value());
		}
		if (subscript.value() instanceof Expr.Name name)
		{
			ArraySymbol array = context.getArray(name.id());
			if (array != null && array.getElementType() != null)
			{
				return parseTypeName(array.getElementType());
			}
			if (context.getType(name.id()) == PseudoType.STRING)
			{
				return PseudoType.STRING;
			}
		}
		return null;
	}

	private PseudoType inferCall(Expr.Call call)
	{
		String name = call.simpleName();
		if (name != null)
		{
			switch (name)
			{
				case "int":
				case "len":
					return PseudoType.INTEGER;
				case "float":
					return PseudoType.REAL;
				case "str":
				case "input":
				case "chr":
					return PseudoType.STRING;
				case "bool":
					return PseudoType.BOOLEAN;
				case "round":
					return call.args().size() > 1 ? PseudoType.REAL : PseudoType.INTEGER;
				case "abs":
				case "max":
				case "min":
					return call.args().isEmpty() ? null : infer(call.args().get(0));
				default:
					return context.getReturnType(name);
			}
		}

		if (call.func() instanceof Expr.Attribute attribute)
		{
			switch (attribute.attr())
			{
				case "upper":
				case "lower":
				case "strip":
				case "replace":
				case "join":
				case "format":
					return PseudoType.STRING;
				case "find":
				case "index":
				case "count":
				case "randint":
					return PseudoType.INTEGER;
				case "random":
				case "sqrt":
					return PseudoType.REAL;
				case "startswith":
				case "endswith":
				case "isdigit":
				case "isalpha":
					return PseudoType.BOOLEAN;
				case "split":
					return PseudoType.ARRAY;
				default:
					return null;
			}
		}
		return null;
	}

	private static PseudoType numericLiteralType(String literal)
	{
		return literal.matches("[0-9_]*\\.?[0-9_]*([eE][+-]?\\d+)?") ? PseudoType.REAL : PseudoType.INTEGER;
	}

	private static PseudoType parseTypeName(String typeName)
	{
		try
		{
			return PseudoType.valueOf(typeName);
		}
		catch (IllegalArgumentException e)
		{
			// a record type name such as "StudentRecord"
			return PseudoType.RECORD;
		}
	}
}
