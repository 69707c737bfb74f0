package org.pygcse.translate;

import org.pygcse.ast.Expr;
import org.pygcse.ast.Stmt;
import org.pygcse.ir.IRKind;
import org.pygcse.ir.IRMeta;
import org.pygcse.ir.IRNode;
import org.pygcse.ir.IRTrees;
import org.pygcse.semantic.SymbolContext;
import org.pygcse.semantic.TypeInference;
import org.pygcse.semantic.symbol.ArraySymbol;
import org.pygcse.semantic.symbol.ClassSymbol;
import org.pygcse.semantic.type.PseudoType;
import org.pygcse.util.Debug;
import org.pygcse.util.Diagnostic;
import org.pygcse.util.ErrorHandler;
import org.pygcse.util.MalformedInputException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Functions, procedures, classes and record types.
 */
public class DefinitionTranslator
{
	private static final String CONSTRUCTOR = "__init__";

	private final StatementVisitor visitor;
	private final SymbolContext context;
	private final TypeInference types;
	private final ExpressionTranslator expressions;
	private final ErrorHandler errorHandler;

	public DefinitionTranslator(StatementVisitor visitor, SymbolContext context, TypeInference types, ExpressionTranslator expressions, ErrorHandler errorHandler)
	{
		this.visitor = visitor;
		this.context = context;
		this.types = types;
		this.expressions = expressions;
		this.errorHandler = errorHandler;
	}

	// --- Routines ---

	public IRNode functionDef(Stmt.FunctionDef def)
	{
		return routine(def, def.name(), "", List.of());
	}

	/**
	 * Builds a PROCEDURE or FUNCTION. The choice is made on the translated body:
	 * a valued RETURN anywhere in it, outside nested routines, makes a FUNCTION.
	 *
	 * @param displayName name in the header, {@code NEW} for constructors
	 * @param prefix      {@code "PUBLIC "} inside a class, otherwise empty
	 * @param prelude     statements placed before the body
	 */
	private IRNode routine(Stmt.FunctionDef def, String displayName, String prefix, List<IRNode> prelude)
	{
		if (def.name() == null)
		{
			throw new MalformedInputException("Function definition without name", def.line());
		}

		boolean method = context.getCurrentClass() != null;
		List<String> params = new ArrayList<>();
		for (Stmt.Param param : def.params())
		{
			if (method && "self".equals(param.name()))
			{
				continue;
			}
			params.add(parameter(param, def.line()));
		}

		// Registered before the body is visited so recursive calls are known.
		PseudoType annotated = def.returns() == null || def.returns() instanceof Expr.NoneLit ? null : TypeInference.fromAnnotation(def.returns());
		if (annotated != null)
		{
			context.registerFunction(def.name(), annotated);
		}

		List<IRNode> body = new ArrayList<>(prelude);
		body.addAll(visitor.visitScoped(SymbolContext.ROUTINE_SCOPE, def.body()));

		IRNode valuedReturn = displayName.equals("NEW") ? null : firstValuedReturn(body);
		String signature = displayName + "(" + String.join(", ", params) + ")";

		IRNode result;
		if (valuedReturn != null)
		{
			String returnType = annotated != null ? annotated.name() : ((IRMeta.ReturnMeta) valuedReturn.getMeta()).type();
			result = new IRNode(IRKind.FUNCTION, prefix + "FUNCTION " + signature + " RETURNS " + returnType,
					new IRMeta.RoutineMeta(displayName, params, true, returnType));
			result.addChildren(body);
			result.addChild(IRNode.terminator("ENDFUNCTION"));
			context.registerFunction(def.name(), registeredType(returnType));
		}
		else
		{
			result = new IRNode(IRKind.PROCEDURE, prefix + "PROCEDURE " + signature,
					new IRMeta.RoutineMeta(displayName, params, false, null));
			result.addChildren(body);
			result.addChild(IRNode.terminator("ENDPROCEDURE"));
			context.registerProcedure(def.name());
		}
		Debug.logDebug((valuedReturn != null ? "Function '" : "Procedure '") + def.name() + "' with " + params.size() + " parameter(s)");
		return result;
	}

	/**
	 * The first RETURN with a value in {@code body}, not counting nested routines.
	 */
	private static IRNode firstValuedReturn(List<IRNode> body)
	{
		Predicate<IRNode> valued = n -> n.getKind() == IRKind.RETURN && n.getMeta() instanceof IRMeta.ReturnMeta r && r.hasValue();
		for (IRNode node : body)
		{
			if (valued.test(node))
			{
				return node;
			}
			if (!node.getKind().isRoutine())
			{
				IRNode found = IRTrees.firstBelow(node, valued, n -> !n.getKind().isRoutine());
				if (found != null)
				{
					return found;
				}
			}
		}
		return null;
	}

	/**
	 * A record type name such as {@code PointRecord} is registered as RECORD.
	 */
	private static PseudoType registeredType(String returnType)
	{
		for (PseudoType type : PseudoType.values())
		{
			if (type.name().equals(returnType))
			{
				return type;
			}
		}
		return PseudoType.RECORD;
	}

	private String parameter(Stmt.Param param, int line)
	{
		if (param.name() == null)
		{
			throw new MalformedInputException("Parameter without name", line);
		}
		context.noteIdentifier(param.name());
		if (param.annotation() == null)
		{
			return param.name();
		}

		PseudoType type = TypeInference.fromAnnotation(param.annotation());
		context.declareVariable(param.name(), type, line);
		if (type == PseudoType.ARRAY)
		{
			PseudoType element = TypeInference.elementTypeOf(param.annotation());
			ArraySymbol array = new ArraySymbol(param.name(), element == null ? null : element.name(), 0, 0, new IRNode(IRKind.ARRAY_DECLARATION, ""));
			array.setLengthKnown(false);
			context.registerArray(array);
			return param.name() + " : " + (element == null ? "ARRAY" : "ARRAY OF " + element.name());
		}
		return param.name() + " : " + type.name();
	}

	public IRNode returnStatement(Stmt.Return stmt)
	{
		if (stmt.value() == null)
		{
			return new IRNode(IRKind.RETURN, "RETURN", new IRMeta.ReturnMeta(false, null));
		}
		String value = expressions.translate(stmt.value());
		ClassSymbol record = stmt.value() instanceof Expr.Call call ? context.getClassSymbol(call.simpleName()) : null;
		PseudoType type = types.infer(stmt.value());
		String typeName;
		if (record != null && record.isRecord())
		{
			typeName = record.getRecordTypeName();
		}
		else
		{
			typeName = type == null || type == PseudoType.ARRAY || type == PseudoType.RECORD ? PseudoType.STRING.name() : type.name();
		}
		return new IRNode(IRKind.RETURN, "RETURN " + value, new IRMeta.ReturnMeta(true, typeName));
	}

	// --- Classes ---

	/**
	 * A class whose only method is its constructor is a record. Its TYPE goes
	 * with the first instantiation when that one declares a variable, otherwise
	 * it is emitted here. Any other class becomes a CLASS block.
	 */
	public List<IRNode> classDef(Stmt.ClassDef def)
	{
		if (def.name() == null)
		{
			throw new MalformedInputException("Class definition without name", def.line());
		}

		List<Stmt.FunctionDef> methods = new ArrayList<>();
		for (Stmt stmt : def.body())
		{
			if (stmt instanceof Stmt.FunctionDef f)
			{
				methods.add(f);
			}
		}
		Stmt.FunctionDef constructor = methods.stream().filter(m -> CONSTRUCTOR.equals(m.name())).findFirst().orElse(null);
		boolean record = def.bases().isEmpty() && methods.size() == 1 && constructor != null;
		String base = def.bases().isEmpty() ? null : expressions.translate(def.bases().get(0));
		if (def.bases().size() > 1)
		{
			errorHandler.logWarning(Diagnostic.Kind.APPROXIMATION, def.line(), "Class '" + def.name() + "' inherits only from " + base);
		}

		ClassSymbol symbol = new ClassSymbol(def.name(), base, record);
		if (constructor != null)
		{
			collectConstructor(symbol, constructor);
		}
		context.registerClass(symbol);
		Debug.logDebug("Class '" + def.name() + "'" + (record ? " (record)" : "") + " with attributes " + symbol.getAttributes());

		if (record)
		{
			return context.isDeclaredOnFirstCall(def.name()) ? List.of() : ensureRecordType(symbol, context.getFirstCall(def.name()));
		}
		return List.of(fullClass(def, symbol, constructor));
	}

	private void collectConstructor(ClassSymbol symbol, Stmt.FunctionDef constructor)
	{
		for (Stmt.Param param : constructor.params())
		{
			if (param.name() == null || param.name().equals("self"))
			{
				continue;
			}
			String type = param.annotation() == null ? null : TypeInference.fromAnnotation(param.annotation()).name();
			symbol.addConstructorParam(param.name(), type);
			if (param.defaultValue() != null)
			{
				symbol.setParamDefault(param.name(), param.defaultValue());
			}
		}

		for (Stmt stmt : constructor.body())
		{
			Expr target = null;
			Expr value = null;
			if (stmt instanceof Stmt.Assign assign && assign.targets().size() == 1)
			{
				target = assign.targets().get(0);
				value = assign.value();
			}
			else if (stmt instanceof Stmt.AnnAssign annAssign)
			{
				target = annAssign.target();
				value = annAssign.value();
				if (isSelfAttribute(target) && annAssign.annotation() != null)
				{
					symbol.setFieldType(((Expr.Attribute) target).attr(), TypeInference.fromAnnotation(annAssign.annotation()).name());
				}
			}
			if (!isSelfAttribute(target))
			{
				continue;
			}

			String attribute = ((Expr.Attribute) target).attr();
			String boundParam = value instanceof Expr.Name name && symbol.getConstructorParams().contains(name.id()) ? name.id() : null;
			symbol.addAttribute(attribute, boundParam, value);
		}
	}

	private static boolean isSelfAttribute(Expr target)
	{
		return target instanceof Expr.Attribute attribute && attribute.value() instanceof Expr.Name owner && owner.id().equals("self");
	}

	private IRNode fullClass(Stmt.ClassDef def, ClassSymbol symbol, Stmt.FunctionDef constructor)
	{
		String header = "CLASS " + def.name() + (symbol.getBase() == null ? "" : " INHERITS " + symbol.getBase());
		IRNode node = new IRNode(IRKind.CLASS, header, new IRMeta.ClassMeta(def.name(), symbol.getBase()));

		ClassSymbol enclosing = context.getCurrentClass();
		context.setCurrentClass(symbol);
		context.pushScope("class");
		try
		{
			// class-level assignments are fields initialised by the constructor
			List<IRNode> initialisers = new ArrayList<>();
			for (Stmt stmt : def.body())
			{
				if (stmt instanceof Stmt.Assign assign && assign.targets().size() == 1 && assign.targets().get(0) instanceof Expr.Name field)
				{
					symbol.addAttribute(field.id(), null, assign.value());
					initialisers.add(AssignmentTranslator.assignment(field.id(), expressions.translate(assign.value())));
				}
			}

			for (String attribute : symbol.getAttributes())
			{
				node.addChild(new IRNode(IRKind.STATEMENT, "PRIVATE " + attribute + " : " + fieldType(symbol, attribute, null)));
			}

			if (constructor == null && !initialisers.isEmpty())
			{
				IRNode synthesized = new IRNode(IRKind.PROCEDURE, "PUBLIC PROCEDURE NEW()", new IRMeta.RoutineMeta("NEW", List.of(), false, null));
				synthesized.addChildren(initialisers);
				synthesized.addChild(IRNode.terminator("ENDPROCEDURE"));
				node.addChild(synthesized);
			}

			for (Stmt stmt : def.body())
			{
				expressions.setLine(stmt.line());
				if (stmt instanceof Stmt.FunctionDef f)
				{
					boolean isConstructor = f == constructor;
					node.addChild(routine(f, isConstructor ? "NEW" : f.name(), "PUBLIC ", isConstructor ? initialisers : List.of()));
				}
				else if (stmt instanceof Stmt.Comment || stmt instanceof Stmt.ClassDef
						|| (stmt instanceof Stmt.ExprStmt e && e.value() instanceof Expr.Str))
				{
					node.addChildren(visitor.visit(stmt));
				}
			}
		}
		finally
		{
			context.popScope();
			context.setCurrentClass(enclosing);
		}

		node.addChild(IRNode.terminator("ENDCLASS"));
		return node;
	}

	// --- Records ---

	/**
	 * {@code p = Point(1, 2)}: records become a DECLARE plus one assignment per
	 * field; other classes become {@code p ← NEW Point(1, 2)}.
	 */
	public List<IRNode> instantiate(Expr target, Expr.Call call)
	{
		ClassSymbol symbol = context.getClassSymbol(call.simpleName());
		String variable = expressions.translate(target);
		if (target instanceof Expr.Name name)
		{
			context.declareVariable(name.id(), PseudoType.RECORD, expressions.getLine());
		}

		if (!symbol.isRecord())
		{
			return List.of(AssignmentTranslator.assignment(variable, "NEW " + symbol.getName() + "(" + expressions.translateArguments(call.args(), call.keywords()) + ")"));
		}

		List<IRNode> nodes = new ArrayList<>(ensureRecordType(symbol, call));
		if (target instanceof Expr.Name)
		{
			nodes.add(new IRNode(IRKind.STATEMENT, "DECLARE " + variable + " : " + symbol.getRecordTypeName()));
		}
		for (Map.Entry<String, Expr> field : fieldValues(symbol, call).entrySet())
		{
			if (field.getValue() != null)
			{
				nodes.add(AssignmentTranslator.assignment(variable + "." + field.getKey(), expressions.translate(field.getValue())));
			}
		}
		return nodes;
	}

	/**
	 * The TYPE block for a record class, or nothing if it was already emitted.
	 *
	 * @param firstCall the instantiation that triggered it, used for field types; may be {@code null}
	 */
	public List<IRNode> ensureRecordType(ClassSymbol symbol, Expr.Call firstCall)
	{
		if (symbol.isTypeEmitted())
		{
			return List.of();
		}
		symbol.markTypeEmitted();

		Map<String, Expr> values = firstCall == null ? Map.of() : fieldValues(symbol, firstCall);
		List<String> fields = new ArrayList<>();
		IRNode node = new IRNode(IRKind.RECORD_TYPE, "TYPE " + symbol.getRecordTypeName());
		for (String attribute : symbol.getAttributes())
		{
			String type = fieldType(symbol, attribute, values.get(attribute));
			symbol.setFieldType(attribute, type);
			fields.add(attribute + " : " + type);
			node.addChild(new IRNode(IRKind.STATEMENT, "DECLARE " + attribute + " : " + type));
		}
		node.setMeta(new IRMeta.RecordMeta(symbol.getRecordTypeName(), fields));
		node.addChild(IRNode.terminator("ENDTYPE"));
		return List.of(node);
	}

	/**
	 * Field values of one instantiation, in attribute order. Arguments are bound
	 * to constructor parameters by position and keyword, then each attribute
	 * takes the parameter it was assigned from. Attributes with no such binding
	 * take the argument at their own position.
	 */
	public Map<String, Expr> fieldValues(ClassSymbol symbol, Expr.Call call)
	{
		List<String> params = symbol.getConstructorParams();
		Map<String, Expr> arguments = new LinkedHashMap<>();
		for (int i = 0; i < call.args().size() && i < params.size(); i++)
		{
			arguments.put(params.get(i), call.args().get(i));
		}
		for (Expr.Keyword keyword : call.keywords())
		{
			if (keyword.name() != null)
			{
				arguments.put(keyword.name(), keyword.value());
			}
		}

		Map<String, Expr> values = new LinkedHashMap<>();
		List<String> attributes = symbol.getAttributes();
		for (int i = 0; i < attributes.size(); i++)
		{
			String attribute = attributes.get(i);
			String param = symbol.getBinding(attribute);
			Expr value;
			if (param != null)
			{
				value = arguments.containsKey(param) ? arguments.get(param) : symbol.getParamDefault(param);
			}
			else if (symbol.getInitialValue(attribute) != null)
			{
				value = symbol.getInitialValue(attribute);
			}
			else
			{
				value = i < call.args().size() ? call.args().get(i) : null;
			}
			values.put(attribute, value);
		}
		return values;
	}

	/**
	 * Annotation first, then the bound parameter's annotation, then the value's type, else STRING.
	 */
	private String fieldType(ClassSymbol symbol, String attribute, Expr value)
	{
		if (symbol.getFieldType(attribute) != null)
		{
			return symbol.getFieldType(attribute);
		}
		String param = symbol.getBinding(attribute);
		if (param != null && symbol.getParamType(param) != null)
		{
			return symbol.getParamType(param);
		}
		PseudoType inferred = types.infer(value != null ? value : symbol.getInitialValue(attribute));
		return inferred == null || inferred == PseudoType.ARRAY ? PseudoType.STRING.name() : inferred.name();
	}
}
