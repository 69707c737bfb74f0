package org.pygcse.translate;

import org.pygcse.ast.BinaryOperator;
import org.pygcse.ast.Expr;
import org.pygcse.ast.Exprs;
import org.pygcse.ast.Stmt;
import org.pygcse.ir.IRKind;
import org.pygcse.ir.IRMeta;
import org.pygcse.ir.IRNode;
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
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Plain, compound and annotated assignments, including the array forms
 * (literal initialisation, append, pop) and {@code input()}.
 */
public class AssignmentTranslator
{
	private final SymbolContext context;
	private final TypeInference types;
	private final ExpressionTranslator expressions;
	private final DefinitionTranslator definitions;
	private final ErrorHandler errorHandler;
	private final int emptyArrayCapacity;

	private static final int MAX_REPEATED_ELEMENTS = 1000;

	public AssignmentTranslator(SymbolContext context, TypeInference types, ExpressionTranslator expressions,
	                            DefinitionTranslator definitions, ErrorHandler errorHandler, int emptyArrayCapacity)
	{
		this.context = context;
		this.types = types;
		this.expressions = expressions;
		this.definitions = definitions;
		this.errorHandler = errorHandler;
		this.emptyArrayCapacity = emptyArrayCapacity;
	}

	public List<IRNode> assign(Stmt.Assign stmt)
	{
		if (stmt.value() == null || stmt.targets().isEmpty())
		{
			throw new MalformedInputException("Assignment without target or value", stmt.line());
		}

		List<IRNode> nodes = new ArrayList<>();
		// a = b = 0 assigns each target in turn
		for (Expr target : stmt.targets())
		{
			if (target instanceof Expr.TupleLit tuple)
			{
				nodes.addAll(unpack(tuple.elements(), stmt.value()));
			}
			else if (target instanceof Expr.ListLit list)
			{
				nodes.addAll(unpack(list.elements(), stmt.value()));
			}
			else
			{
				nodes.addAll(route(target, stmt.value()));
			}
		}
		return nodes;
	}

	public List<IRNode> augmentedAssign(Stmt.AugAssign stmt)
	{
		if (stmt.target() == null || stmt.value() == null)
		{
			throw new MalformedInputException("Augmented assignment without target or value", stmt.line());
		}

		// items += [a, b] extends the array
		if (stmt.op() == BinaryOperator.ADD && stmt.target() instanceof Expr.Name name
				&& context.isArray(name.id()) && stmt.value() instanceof Expr.ListLit list)
		{
			List<IRNode> nodes = new ArrayList<>();
			for (Expr element : list.elements())
			{
				nodes.addAll(append(name.id(), element, stmt.line()));
			}
			return nodes;
		}

		String value = expressions.translate(new Expr.BinOp(stmt.target(), stmt.op(), stmt.value()));
		if (stmt.target() instanceof Expr.Name name && context.getAlias(name.id()) != null)
		{
			// rebinding the element variable leaves the array untouched
			context.removeAlias(name.id());
			context.declareVariable(name.id(), types.infer(new Expr.BinOp(stmt.target(), stmt.op(), stmt.value())), stmt.line());
			return List.of(assignment(name.id(), value));
		}
		String target = expressions.translate(stmt.target());
		return List.of(assignment(target, value));
	}

	public List<IRNode> annotatedAssign(Stmt.AnnAssign stmt)
	{
		if (stmt.target() == null || stmt.annotation() == null)
		{
			throw new MalformedInputException("Annotated assignment without target or annotation", stmt.line());
		}
		if (!(stmt.target() instanceof Expr.Name name))
		{
			// self.x: int = 0 and similar
			return stmt.value() == null ? List.of() : route(stmt.target(), stmt.value());
		}

		Expr annotation = stmt.annotation();
		if (annotation instanceof Expr.Name annotated && context.isClass(annotated.id()) && stmt.value() != null)
		{
			return route(stmt.target(), stmt.value());
		}

		PseudoType type = TypeInference.fromAnnotation(annotation);
		if (type == PseudoType.ARRAY)
		{
			PseudoType elementType = TypeInference.elementTypeOf(annotation);
			if (stmt.value() instanceof Expr.ListLit list)
			{
				return initializeArray(name.id(), list.elements(), elementType);
			}
			if (stmt.value() instanceof Expr.TupleLit tuple)
			{
				return initializeArray(name.id(), tuple.elements(), elementType);
			}
			List<IRNode> nodes = new ArrayList<>();
			nodes.add(declareArray(name.id(), elementType == null ? PseudoType.STRING.name() : elementType.name(), emptyArrayCapacity, 0, true));
			context.getArray(name.id()).setLengthKnown(stmt.value() == null);
			if (stmt.value() != null)
			{
				nodes.add(assignment(name.id(), expressions.translate(stmt.value())));
			}
			return nodes;
		}

		context.declareVariable(name.id(), type, stmt.line());
		List<IRNode> nodes = new ArrayList<>();
		nodes.add(new IRNode(IRKind.STATEMENT, "DECLARE " + name.id() + " : " + type.name()));
		if (stmt.value() != null)
		{
			nodes.addAll(route(stmt.target(), stmt.value()));
		}
		return nodes;
	}

	// --- Routing ---

	/**
	 * Picks the translation for {@code target = value}: array literal, input,
	 * instantiation, then the generic element, attribute and variable forms.
	 */
	List<IRNode> route(Expr target, Expr value)
	{
		if (target instanceof Expr.Name name)
		{
			if (value instanceof Expr.ListLit list)
			{
				return initializeArray(name.id(), list.elements(), null);
			}
			if (value instanceof Expr.TupleLit tuple)
			{
				return initializeArray(name.id(), tuple.elements(), null);
			}
			List<Expr> repeated = repeatedElements(value);
			if (repeated != null)
			{
				return initializeArray(name.id(), repeated, null);
			}
		}
		if (Exprs.anyMatch(value, e -> Exprs.isCallTo(e, "input")))
		{
			return input(target, value);
		}
		if (value instanceof Expr.Call call && context.isClass(call.simpleName()))
		{
			return definitions.instantiate(target, call);
		}
		if (value instanceof Expr.Call call && isPop(call))
		{
			return popInto(target, call);
		}

		if (target instanceof Expr.Name name)
		{
			String rendered = expressions.translate(value);
			if (context.getAlias(name.id()) != null)
			{
				// the element variable now holds its own value
				context.removeAlias(name.id());
			}
			context.declareVariable(name.id(), types.infer(value), expressions.getLine());
			return List.of(assignment(name.id(), rendered));
		}
		if (target instanceof Expr.Subscript || target instanceof Expr.Attribute)
		{
			return List.of(assignment(expressions.translate(target), expressions.translate(value)));
		}
		throw new MalformedInputException("Cannot assign to this target", expressions.getLine());
	}

	/**
	 * {@code a, b = x, y}. When a value reads one of the targets (a swap) it is
	 * copied to a temporary first.
	 */
	private List<IRNode> unpack(List<Expr> targets, Expr value)
	{
		List<Expr> values = value instanceof Expr.TupleLit tuple ? tuple.elements()
				: value instanceof Expr.ListLit list ? list.elements() : null;
		if (values == null || values.size() != targets.size())
		{
			errorHandler.logWarning(Diagnostic.Kind.APPROXIMATION, expressions.getLine(), "Unpacking assignment rendered as a single line");
			List<String> rendered = new ArrayList<>();
			for (Expr target : targets)
			{
				rendered.add(expressions.translate(target));
			}
			return List.of(assignment(String.join(", ", rendered), expressions.translate(value)));
		}

		Set<String> targetNames = new HashSet<>();
		for (Expr target : targets)
		{
			if (target instanceof Expr.Name name)
			{
				targetNames.add(name.id());
			}
		}

		List<IRNode> nodes = new ArrayList<>();
		List<Expr> sources = new ArrayList<>();
		for (Expr v : values)
		{
			boolean readsTarget = targetNames.stream().anyMatch(n -> Exprs.readsName(v, n));
			if (readsTarget)
			{
				String temp = context.freshTempName();
				context.declareVariable(temp, types.infer(v), expressions.getLine());
				nodes.add(assignment(temp, expressions.translate(v)));
				sources.add(new Expr.Name(temp));
			}
			else
			{
				sources.add(v);
			}
		}
		for (int i = 0; i < targets.size(); i++)
		{
			nodes.addAll(route(targets.get(i), sources.get(i)));
		}
		return nodes;
	}

	// --- Input ---

	/**
	 * {@code x = int(input("Age: "))} becomes {@code OUTPUT "Age: "} then {@code INPUT x}.
	 */
	private List<IRNode> input(Expr target, Expr value)
	{
		PseudoType type = PseudoType.STRING;
		Expr.Call inputCall;
		if (Exprs.isCallTo(value, "input"))
		{
			inputCall = (Expr.Call) value;
		}
		else if (value instanceof Expr.Call conversion && conversion.args().size() == 1 && Exprs.isCallTo(conversion.args().get(0), "input")
				&& ("int".equals(conversion.simpleName()) || "float".equals(conversion.simpleName()) || "str".equals(conversion.simpleName())))
		{
			type = PseudoType.fromPythonName(conversion.simpleName());
			inputCall = (Expr.Call) conversion.args().get(0);
		}
		else
		{
			errorHandler.logWarning(Diagnostic.Kind.APPROXIMATION, expressions.getLine(), "input() inside a larger expression; only the input is kept");
			inputCall = findInput(value);
		}

		String variable = expressions.translate(target);
		if (target instanceof Expr.Name name)
		{
			context.declareVariable(name.id(), type, expressions.getLine());
		}

		List<IRNode> nodes = new ArrayList<>();
		if (!inputCall.args().isEmpty())
		{
			nodes.add(new IRNode(IRKind.OUTPUT, "OUTPUT " + expressions.translate(inputCall.args().get(0))));
		}
		nodes.add(new IRNode(IRKind.INPUT, "INPUT " + variable, new IRMeta.InputMeta(variable, type.name())));
		return nodes;
	}

	private static Expr.Call findInput(Expr value)
	{
		List<Expr.Call> found = new ArrayList<>();
		Exprs.forEach(value, e ->
		{
			if (found.isEmpty() && Exprs.isCallTo(e, "input"))
			{
				found.add((Expr.Call) e);
			}
		});
		return found.get(0);
	}

	// --- Arrays ---

	/**
	 * {@code DECLARE a : ARRAY[1:N] OF T} followed by one assignment per element.
	 */
	List<IRNode> initializeArray(String name, List<Expr> elements, PseudoType annotatedType)
	{
		ClassSymbol recordClass = recordClassOf(elements);
		if (recordClass != null)
		{
			return initializeRecordArray(name, elements, recordClass);
		}

		String elementType;
		if (annotatedType != null)
		{
			elementType = annotatedType.name();
		}
		else if (!elements.isEmpty())
		{
			elementType = types.inferOrDefault(elements.get(0)).name();
		}
		else
		{
			elementType = null;
		}

		boolean empty = elements.isEmpty();
		List<IRNode> nodes = new ArrayList<>();
		nodes.add(declareArray(name, elementType, empty ? emptyArrayCapacity : elements.size(), elements.size(), empty));
		for (int i = 0; i < elements.size(); i++)
		{
			nodes.add(assignment(name + "[" + (i + 1) + "]", expressions.translate(elements.get(i))));
		}
		return nodes;
	}

	private List<IRNode> initializeRecordArray(String name, List<Expr> elements, ClassSymbol recordClass)
	{
		List<IRNode> nodes = new ArrayList<>(definitions.ensureRecordType(recordClass, (Expr.Call) elements.get(0)));
		nodes.add(declareArray(name, recordClass.getRecordTypeName(), elements.size(), elements.size(), false));
		for (int i = 0; i < elements.size(); i++)
		{
			nodes.addAll(fieldAssignments(name + "[" + (i + 1) + "]", recordClass, (Expr.Call) elements.get(i)));
		}
		return nodes;
	}

	/**
	 * {@code [v] * n} with a literal {@code n}, spelled out element by element,
	 * otherwise {@code null}.
	 */
	private List<Expr> repeatedElements(Expr value)
	{
		if (!(value instanceof Expr.BinOp binOp) || binOp.op() != BinaryOperator.MULT)
		{
			return null;
		}
		Expr list = binOp.left() instanceof Expr.ListLit ? binOp.left() : binOp.right();
		Expr count = list == binOp.left() ? binOp.right() : binOp.left();
		if (!(list instanceof Expr.ListLit literal) || literal.elements().size() != 1
				|| !(count instanceof Expr.Num num) || !num.fitsLong())
		{
			return null;
		}
		if (num.intValue() < 1 || num.intValue() > MAX_REPEATED_ELEMENTS)
		{
			errorHandler.logWarning(Diagnostic.Kind.APPROXIMATION, expressions.getLine(), "Repeated list of " + num.literal() + " elements kept as an expression");
			return null;
		}
		return new ArrayList<>(Collections.nCopies((int) num.intValue(), literal.elements().get(0)));
	}

	/**
	 * The record class every element instantiates, or {@code null} if the elements are not all one record class.
	 */
	private ClassSymbol recordClassOf(List<Expr> elements)
	{
		ClassSymbol found = null;
		for (Expr element : elements)
		{
			if (!(element instanceof Expr.Call call))
			{
				return null;
			}
			ClassSymbol symbol = context.getClassSymbol(call.simpleName());
			if (symbol == null || !symbol.isRecord() || (found != null && found != symbol))
			{
				return null;
			}
			found = symbol;
		}
		return found;
	}

	private List<IRNode> fieldAssignments(String prefix, ClassSymbol recordClass, Expr.Call call)
	{
		List<IRNode> nodes = new ArrayList<>();
		for (Map.Entry<String, Expr> field : definitions.fieldValues(recordClass, call).entrySet())
		{
			if (field.getValue() != null)
			{
				nodes.add(assignment(prefix + "." + field.getKey(), expressions.translate(field.getValue())));
			}
		}
		return nodes;
	}

	private IRNode declareArray(String name, String elementType, int size, int count, boolean capacity)
	{
		IRNode declaration = new IRNode(IRKind.ARRAY_DECLARATION, "");
		ArraySymbol array = new ArraySymbol(name, elementType, size, count, declaration);
		array.setCapacityDeclared(capacity);
		context.registerArray(array);
		refreshDeclaration(array);
		Debug.logDebug("Array '" + name + "' [1:" + size + "] of " + elementType);
		return declaration;
	}

	private static void refreshDeclaration(ArraySymbol array)
	{
		String elementType = array.getElementType() == null ? PseudoType.STRING.name() : array.getElementType();
		String size = String.valueOf(array.getSize());
		array.getDeclaration().setText("DECLARE " + array.getName() + " : ARRAY[1:" + size + "] OF " + elementType);
		array.getDeclaration().setMeta(new IRMeta.ArrayMeta(array.getName(), size, elementType));
	}

	/**
	 * {@code a.append(v)} writes the next free slot: a fixed index while the
	 * element count is known, otherwise through the array's counter variable.
	 */
	List<IRNode> append(String name, Expr value, int line)
	{
		ArraySymbol array = context.getArray(name);
		if (array == null)
		{
			errorHandler.logWarning(Diagnostic.Kind.APPROXIMATION, line, "Append to '" + name + "' whose size is unknown");
			ClassSymbol unknownRecord = value instanceof Expr.Call call ? context.getClassSymbol(call.simpleName()) : null;
			List<IRNode> nodes = new ArrayList<>();
			if (unknownRecord != null && unknownRecord.isRecord())
			{
				nodes.addAll(definitions.ensureRecordType(unknownRecord, (Expr.Call) value));
			}
			nodes.add(assignment(name + "[LENGTH(" + name + ") + 1]", expressions.translate(value)));
			return nodes;
		}
		boolean changed = false;
		if (array.getCounter() == null && context.isInLoop())
		{
			changed = startCounter(array, line);
		}

		ClassSymbol recordClass = value instanceof Expr.Call call ? context.getClassSymbol(call.simpleName()) : null;
		List<IRNode> nodes = new ArrayList<>();
		if (recordClass != null && recordClass.isRecord())
		{
			nodes.addAll(definitions.ensureRecordType(recordClass, (Expr.Call) value));
		}
		if (array.getElementType() == null)
		{
			array.setElementType(recordClass != null && recordClass.isRecord()
					? recordClass.getRecordTypeName() : types.inferOrDefault(value).name());
			changed = true;
		}

		String element;
		if (array.getCounter() != null)
		{
			String counter = array.getCounter();
			nodes.add(assignment(counter, counter + " + 1"));
			element = name + "[" + counter + "]";
		}
		else
		{
			int slot = array.getNextIndex() + 1;
			array.setNextIndex(slot);
			if (slot > array.getSize())
			{
				if (array.isCapacityDeclared())
				{
					errorHandler.logWarning(Diagnostic.Kind.APPROXIMATION, line,
							"Append to '" + name + "' exceeds its declared capacity of " + array.getSize());
				}
				array.setSize(slot);
				changed = true;
			}
			element = name + "[" + slot + "]";
		}
		if (changed)
		{
			refreshDeclaration(array);
		}

		if (recordClass != null && recordClass.isRecord())
		{
			nodes.addAll(fieldAssignments(element, recordClass, (Expr.Call) value));
		}
		else
		{
			nodes.add(assignment(element, expressions.translate(value)));
		}
		return nodes;
	}

	/**
	 * The first append inside a loop switches the array to a counter variable,
	 * set before the outermost loop to the elements filled so far. The array
	 * keeps at least the default capacity since the pass count is unknown.
	 *
	 * @return whether the declaration changed
	 */
	private boolean startCounter(ArraySymbol array, int line)
	{
		String counter = context.freshCounterName(array.getName());
		array.setCounter(counter);
		array.setLengthKnown(false);
		context.declareVariable(counter, PseudoType.INTEGER, line);
		context.addLoopPrelude(assignment(counter, String.valueOf(array.getNextIndex())));
		Debug.logDebug("Array '" + array.getName() + "' counted by '" + counter + "'");

		if (array.getSize() >= emptyArrayCapacity)
		{
			return false;
		}
		errorHandler.logWarning(Diagnostic.Kind.APPROXIMATION, line,
				"Append to '" + array.getName() + "' inside a loop; capacity assumed to be " + emptyArrayCapacity);
		array.setSize(emptyArrayCapacity);
		array.setCapacityDeclared(true);
		return true;
	}

	List<IRNode> pop(String name)
	{
		ArraySymbol array = context.getArray(name);
		if (array != null && array.getCounter() != null)
		{
			return List.of(assignment(array.getCounter(), array.getCounter() + " - 1"));
		}
		if (array != null && array.getNextIndex() > 0)
		{
			array.setNextIndex(array.getNextIndex() - 1);
		}
		return List.of(IRNode.comment(name + ".pop()"));
	}

	private boolean isPop(Expr.Call call)
	{
		return call.args().isEmpty() && call.func() instanceof Expr.Attribute attribute && attribute.attr().equals("pop")
				&& attribute.value() instanceof Expr.Name name && context.isArray(name.id());
	}

	/**
	 * {@code x = a.pop()} reads the last element, then drops it.
	 */
	private List<IRNode> popInto(Expr target, Expr.Call call)
	{
		String name = ((Expr.Name) ((Expr.Attribute) call.func()).value()).id();
		ArraySymbol array = context.getArray(name);
		String last;
		if (array.getCounter() != null)
		{
			last = name + "[" + array.getCounter() + "]";
		}
		else
		{
			last = array.isLengthKnown() && array.getNextIndex() > 0
					? name + "[" + array.getNextIndex() + "]"
					: name + "[LENGTH(" + name + ")]";
		}
		if (target instanceof Expr.Name variable && array.getElementType() != null)
		{
			context.declareVariable(variable.id(), types.infer(new Expr.Subscript(new Expr.Name(name), new Expr.Num("0"))), expressions.getLine());
		}

		List<IRNode> nodes = new ArrayList<>();
		nodes.add(assignment(expressions.translate(target), last));
		nodes.addAll(pop(name));
		return nodes;
	}

	static IRNode assignment(String target, String value)
	{
		return new IRNode(IRKind.ASSIGNMENT, target + " ← " + value);
	}
}
