package org.pygcse.parser;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.pygcse.ast.*;
import org.pygcse.ast.Module;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the JSON dump of Python's {@code ast} module ({@code "type"} tag, Python
 * field names, {@code lineno}) into the generic syntax tree.
 * <p>
 * The reader is lenient: a missing required field becomes {@code null} and is
 * reported by the translator, so one malformed statement does not cost the
 * rest of the program.
 */
public class JsonTreeReader
{
	public Module read(String json)
	{
		JsonElement root;
		try
		{
			root = JsonParser.parseString(json);
		}
		catch (JsonParseException e)
		{
			throw new SyntaxException("[Syntax Error] invalid AST JSON - " + e.getMessage(), 0, 0);
		}

		if (!root.isJsonObject())
		{
			throw new SyntaxException("[Syntax Error] AST JSON must be an object", 0, 0);
		}
		JsonObject module = root.getAsJsonObject();
		if (module.has("error"))
		{
			JsonElement error = module.get("error");
			int line = error.isJsonObject() ? intField(error.getAsJsonObject(), "lineno") : 0;
			throw new SyntaxException("[Syntax Error] " + error, line, 0);
		}
		return new Module(statements(module, "body"));
	}

	// --- Statements ---

	private List<Stmt> statements(JsonObject node, String field)
	{
		List<Stmt> out = new ArrayList<>();
		for (JsonObject child : objects(node, field))
		{
			out.add(statement(child));
		}
		return out;
	}

	private Stmt statement(JsonObject node)
	{
		int line = intField(node, "lineno");
		String type = type(node);

		switch (type)
		{
			case "Assign":
				return new Stmt.Assign(line, expressions(node, "targets"), expression(node, "value"));
			case "AugAssign":
				return new Stmt.AugAssign(line, expression(node, "target"), binaryOperator(node), expression(node, "value"));
			case "AnnAssign":
				return new Stmt.AnnAssign(line, expression(node, "target"), expression(node, "annotation"), expression(node, "value"));
			case "If":
				return new Stmt.If(line, expression(node, "test"), statements(node, "body"), statements(node, "orelse"));
			case "For":
				return new Stmt.For(line, expression(node, "target"), expression(node, "iter"), statements(node, "body"), statements(node, "orelse"));
			case "While":
				return new Stmt.While(line, expression(node, "test"), statements(node, "body"), statements(node, "orelse"));
			case "FunctionDef":
				return new Stmt.FunctionDef(line, stringField(node, "name"), parameters(node), expression(node, "returns"), statements(node, "body"));
			case "ClassDef":
				return new Stmt.ClassDef(line, stringField(node, "name"), expressions(node, "bases"), statements(node, "body"));
			case "Return":
				return new Stmt.Return(line, expression(node, "value"));
			case "Expr":
				return new Stmt.ExprStmt(line, expression(node, "value"));
			case "Pass":
				return new Stmt.Pass(line);
			case "Break":
				return new Stmt.Break(line);
			case "Continue":
				return new Stmt.Continue(line);
			case "Comment":
				return new Stmt.Comment(line, stringField(node, "value"));
			case "Match":
				return new Stmt.Match(line, expression(node, "subject"), matchCases(node));
			case "Try":
			case "TryStar":
				return new Stmt.Try(line, statements(node, "body"));
			case "With":
				return new Stmt.With(line, statements(node, "body"));
			case "Import":
			case "ImportFrom":
				return new Stmt.Import(line);
			case "Assert":
				return new Stmt.Assert(line);
			case "Raise":
				return new Stmt.Raise(line);
			case "Global":
			case "Nonlocal":
				return new Stmt.Global(line);
			case "Delete":
				return new Stmt.Delete(line);
			default:
				return new Stmt.Unknown(line, type);
		}
	}

	private List<Stmt.Param> parameters(JsonObject functionDef)
	{
		List<Stmt.Param> params = new ArrayList<>();
		JsonObject arguments = object(functionDef, "args");
		if (arguments == null)
		{
			return params;
		}

		List<JsonObject> positional = new ArrayList<>(objects(arguments, "posonlyargs"));
		positional.addAll(objects(arguments, "args"));
		List<Expr> defaults = expressions(arguments, "defaults");

		// defaults line up with the last positional parameters
		int firstDefault = positional.size() - defaults.size();
		for (int i = 0; i < positional.size(); i++)
		{
			JsonObject arg = positional.get(i);
			Expr defaultValue = i >= firstDefault ? defaults.get(i - firstDefault) : null;
			params.add(new Stmt.Param(stringField(arg, "arg"), expression(arg, "annotation"), defaultValue));
		}
		return params;
	}

	private List<Stmt.MatchCase> matchCases(JsonObject match)
	{
		List<Stmt.MatchCase> cases = new ArrayList<>();
		for (JsonObject c : objects(match, "cases"))
		{
			List<Expr> patterns = new ArrayList<>();
			collectPatterns(object(c, "pattern"), patterns);
			cases.add(new Stmt.MatchCase(patterns, expression(c, "guard"), statements(c, "body")));
		}
		return cases;
	}

	private void collectPatterns(JsonObject pattern, List<Expr> out)
	{
		if (pattern == null)
		{
			return;
		}
		switch (type(pattern))
		{
			case "MatchValue":
				out.add(expression(pattern, "value"));
				break;
			case "MatchSingleton":
				out.add(constant(pattern.get("value")));
				break;
			case "MatchOr":
				for (JsonObject alternative : objects(pattern, "patterns"))
				{
					collectPatterns(alternative, out);
				}
				break;
			case "MatchAs":
				String name = stringField(pattern, "name");
				out.add(new Expr.Name(name == null ? "_" : name));
				break;
			default:
				out.add(new Expr.Unsupported(type(pattern), ""));
				break;
		}
	}

	// --- Expressions ---

	private List<Expr> expressions(JsonObject node, String field)
	{
		List<Expr> out = new ArrayList<>();
		JsonArray array = array(node, field);
		if (array == null)
		{
			return out;
		}
		for (JsonElement element : array)
		{
			// Dict keys are null for "**spread" entries
			out.add(element.isJsonObject() ? expression(element.getAsJsonObject()) : null);
		}
		return out;
	}

	private Expr expression(JsonObject node, String field)
	{
		JsonObject child = object(node, field);
		return child == null ? null : expression(child);
	}

	private Expr expression(JsonObject node)
	{
		String type = type(node);
		switch (type)
		{
			case "Name":
				return new Expr.Name(stringField(node, "id"));
			case "Constant":
			case "NameConstant":
				return constant(node.get("value"));
			case "Num":
				return constant(node.get("n"));
			case "Str":
				return constant(node.get("s"));
			case "BinOp":
			{
				BinaryOperator op = binaryOperator(node);
				if (op == null)
				{
					return new Expr.Unsupported(operatorName(node, "op"), "");
				}
				return new Expr.BinOp(expression(node, "left"), op, expression(node, "right"));
			}
			case "UnaryOp":
				return new Expr.UnaryOp(UnaryOperator.fromPythonName(operatorName(node, "op")), expression(node, "operand"));
			case "BoolOp":
			{
				BooleanOperator op = "And".equals(operatorName(node, "op")) ? BooleanOperator.AND : BooleanOperator.OR;
				return new Expr.BoolOp(op, expressions(node, "values"));
			}
			case "Compare":
			{
				List<CompareOperator> ops = new ArrayList<>();
				for (JsonObject op : objects(node, "ops"))
				{
					ops.add(CompareOperator.fromPythonName(type(op)));
				}
				return new Expr.Compare(expression(node, "left"), ops, expressions(node, "comparators"));
			}
			case "Call":
			{
				List<Expr.Keyword> keywords = new ArrayList<>();
				for (JsonObject keyword : objects(node, "keywords"))
				{
					keywords.add(new Expr.Keyword(stringField(keyword, "arg"), expression(keyword, "value")));
				}
				return new Expr.Call(expression(node, "func"), expressions(node, "args"), keywords);
			}
			case "Attribute":
				return new Expr.Attribute(expression(node, "value"), stringField(node, "attr"));
			case "Subscript":
				return new Expr.Subscript(expression(node, "value"), expression(node, "slice"));
			case "Index":
				return expression(node, "value");
			case "Slice":
				return new Expr.Slice(expression(node, "lower"), expression(node, "upper"), expression(node, "step"));
			case "List":
				return new Expr.ListLit(expressions(node, "elts"));
			case "Tuple":
				return new Expr.TupleLit(expressions(node, "elts"));
			case "Dict":
				return new Expr.DictLit(expressions(node, "keys"), expressions(node, "values"));
			case "IfExp":
				return new Expr.IfExp(expression(node, "test"), expression(node, "body"), expression(node, "orelse"));
			case "JoinedStr":
				return new Expr.JoinedStr(expressions(node, "values"));
			case "FormattedValue":
				return new Expr.FormattedValue(expression(node, "value"), null);
			case "ListComp":
			case "GeneratorExp":
			{
				List<JsonObject> generators = objects(node, "generators");
				if (generators.isEmpty())
				{
					return new Expr.Unsupported(type, "");
				}
				JsonObject first = generators.get(0);
				return new Expr.ListComp(expression(node, "elt"), expression(first, "target"), expression(first, "iter"), expressions(first, "ifs"));
			}
			default:
				return new Expr.Unsupported(type, "");
		}
	}

	private Expr constant(JsonElement value)
	{
		if (value == null || value.isJsonNull())
		{
			return new Expr.NoneLit();
		}
		if (!value.isJsonPrimitive())
		{
			return new Expr.Unsupported("Constant", value.toString());
		}

		JsonPrimitive primitive = value.getAsJsonPrimitive();
		if (primitive.isBoolean())
		{
			return new Expr.Bool(primitive.getAsBoolean());
		}
		if (primitive.isNumber())
		{
			return new Expr.Num(primitive.getAsString());
		}

		String text = primitive.getAsString()
				.replace("\\", "\\\\")
				.replace("\n", "\\n")
				.replace("\t", "\\t");
		if (text.contains("\"") && !text.contains("'"))
		{
			return new Expr.Str(text, '\'');
		}
		return new Expr.Str(text.replace("\"", "\\\""), '"');
	}

	private BinaryOperator binaryOperator(JsonObject node)
	{
		return BinaryOperator.fromPythonName(operatorName(node, "op"));
	}

	private String operatorName(JsonObject node, String field)
	{
		JsonObject op = object(node, field);
		return op == null ? null : type(op);
	}

	// --- JSON helpers ---

	private static String type(JsonObject node)
	{
		String type = stringField(node, "type");
		if (type == null)
		{
			type = stringField(node, "_type");
		}
		return type == null ? "Unknown" : type;
	}

	private static String stringField(JsonObject node, String field)
	{
		JsonElement value = node.get(field);
		return value == null || value.isJsonNull() ? null : value.getAsString();
	}

	private static int intField(JsonObject node, String field)
	{
		JsonElement value = node.get(field);
		return value == null || value.isJsonNull() || !value.isJsonPrimitive() ? 0 : value.getAsInt();
	}

	private static JsonObject object(JsonObject node, String field)
	{
		JsonElement value = node.get(field);
		return value != null && value.isJsonObject() ? value.getAsJsonObject() : null;
	}

	private static JsonArray array(JsonObject node, String field)
	{
		JsonElement value = node.get(field);
		return value != null && value.isJsonArray() ? value.getAsJsonArray() : null;
	}

	private static List<JsonObject> objects(JsonObject node, String field)
	{
		List<JsonObject> out = new ArrayList<>();
		JsonArray array = array(node, field);
		if (array != null)
		{
			for (JsonElement element : array)
			{
				if (element.isJsonObject())
				{
					out.add(element.getAsJsonObject());
				}
			}
		}
		return out;
	}
}
