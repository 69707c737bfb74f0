package org.pygcse.semantic;

import org.pygcse.ast.Expr;
import org.pygcse.ir.IRNode;
import org.pygcse.semantic.symbol.ArraySymbol;
import org.pygcse.semantic.symbol.ClassSymbol;
import org.pygcse.semantic.symbol.Scope;
import org.pygcse.semantic.symbol.VariableSymbol;
import org.pygcse.semantic.type.PseudoType;
import org.pygcse.util.Debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable bookkeeping for one conversion. Created fresh per program and
 * dropped when the conversion returns.
 */
public class SymbolContext
{
	public static final String LOOP_SCOPE = "loop";
	public static final String ROUTINE_SCOPE = "routine";
	public static final String BRANCH_SCOPE = "branch";

	private static final String[] INDEX_NAMES = {"i", "j", "k", "m", "n"};

	private final Map<String, VariableSymbol> variables = new LinkedHashMap<>();
	private final Map<String, ArraySymbol> arrays = new HashMap<>();
	private final Map<String, ClassSymbol> classes = new LinkedHashMap<>();
	private final Map<String, PseudoType> functions = new HashMap<>();
	private final Set<String> procedures = new HashSet<>();

	// element variable of a rewritten "for x in array" loop -> indexed reference
	private final Map<String, String> elementAliases = new HashMap<>();
	private final Set<String> oneBasedCounters = new HashSet<>();
	private final Set<String> identifiers = new LinkedHashSet<>();
	// class name -> first call in source order, and whether that call declares a variable
	private final Map<String, Expr.Call> firstCalls = new HashMap<>();
	private final Set<String> declaredOnFirstCall = new HashSet<>();

	// statements to place before the outermost enclosing loop
	private final List<IRNode> loopPrelude = new ArrayList<>();

	private Scope currentScope = new Scope("global", null);
	private ClassSymbol currentClass;
	private int tempCounter = 0;

	// --- Variables ---

	/**
	 * Records the type of a variable at its first assignment; later calls keep the first type.
	 */
	public void declareVariable(String name, PseudoType type, int line)
	{
		noteIdentifier(name);
		if (type == null || variables.containsKey(name))
		{
			return;
		}
		variables.put(name, new VariableSymbol(name, type, line));
		Debug.logDebug("Variable '" + name + "' : " + type);
	}

	public PseudoType getType(String name)
	{
		VariableSymbol symbol = variables.get(name);
		return symbol == null ? null : symbol.getType();
	}

	public boolean isDeclared(String name)
	{
		return variables.containsKey(name);
	}

	// --- Arrays ---

	public void registerArray(ArraySymbol array)
	{
		arrays.put(array.getName(), array);
		declareVariable(array.getName(), PseudoType.ARRAY, 0);
	}

	public ArraySymbol getArray(String name)
	{
		return arrays.get(name);
	}

	public boolean isArray(String name)
	{
		return arrays.containsKey(name);
	}

	// --- Classes and routines ---

	public void registerClass(ClassSymbol symbol)
	{
		classes.put(symbol.getName(), symbol);
		noteIdentifier(symbol.getName());
	}

	public ClassSymbol getClassSymbol(String name)
	{
		return name == null ? null : classes.get(name);
	}

	public boolean isClass(String name)
	{
		return name != null && classes.containsKey(name);
	}

	/**
	 * Records a call to {@code className}. Only the first call per name is kept.
	 *
	 * @param declaring the call is the value of an assignment, an array literal element or an append argument
	 */
	public void markInstantiated(String className, Expr.Call call, boolean declaring)
	{
		if (firstCalls.putIfAbsent(className, call) == null && declaring)
		{
			declaredOnFirstCall.add(className);
		}
	}

	public Expr.Call getFirstCall(String className)
	{
		return firstCalls.get(className);
	}

	/**
	 * True when the first call to the class declares a variable, which then carries the record TYPE.
	 */
	public boolean isDeclaredOnFirstCall(String className)
	{
		return declaredOnFirstCall.contains(className);
	}

	public void registerFunction(String name, PseudoType returnType)
	{
		functions.put(name, returnType);
		noteIdentifier(name);
	}

	public void registerProcedure(String name)
	{
		procedures.add(name);
		noteIdentifier(name);
	}

	public PseudoType getReturnType(String function)
	{
		return functions.get(function);
	}

	public boolean isProcedure(String name)
	{
		return procedures.contains(name);
	}

	public ClassSymbol getCurrentClass()
	{
		return currentClass;
	}

	public void setCurrentClass(ClassSymbol currentClass)
	{
		this.currentClass = currentClass;
	}

	// --- Scopes ---

	public void pushScope(String name)
	{
		currentScope = new Scope(name, currentScope);
	}

	public void popScope()
	{
		if (currentScope.getEnclosingScope() == null)
		{
			throw new IllegalStateException("Cannot pop the global scope");
		}
		currentScope = currentScope.getEnclosingScope();
	}

	public Scope getCurrentScope()
	{
		return currentScope;
	}

	public int getDepth()
	{
		return currentScope.getDepth();
	}

	public boolean isInLoop()
	{
		return currentScope.isInside(LOOP_SCOPE);
	}

	// --- Rewritten loop elements ---

	public void aliasElement(String element, String replacement)
	{
		elementAliases.put(element, replacement);
	}

	public void removeAlias(String element)
	{
		elementAliases.remove(element);
	}

	public String getAlias(String name)
	{
		return elementAliases.get(name);
	}

	public void markOneBased(String counter)
	{
		oneBasedCounters.add(counter);
	}

	public void unmarkOneBased(String counter)
	{
		oneBasedCounters.remove(counter);
	}

	public boolean isOneBased(String name)
	{
		return oneBasedCounters.contains(name);
	}

	// --- Names ---

	public void noteIdentifier(String name)
	{
		if (name != null && !name.isEmpty())
		{
			identifiers.add(name);
		}
	}

	public Set<String> getIdentifiers()
	{
		return Collections.unmodifiableSet(identifiers);
	}

	/**
	 * A loop counter name not used anywhere in the program so far.
	 */
	public String freshIndexName()
	{
		for (String candidate : INDEX_NAMES)
		{
			if (!identifiers.contains(candidate) && !oneBasedCounters.contains(candidate))
			{
				noteIdentifier(candidate);
				return candidate;
			}
		}
		int n = 1;
		while (identifiers.contains("idx" + n))
		{
			n++;
		}
		noteIdentifier("idx" + n);
		return "idx" + n;
	}

	/**
	 * {@code itemsCount} for {@code items}, numbered when that name is taken.
	 */
	public String freshCounterName(String arrayName)
	{
		String base = arrayName + "Count";
		String name = base;
		int n = 1;
		while (identifiers.contains(name))
		{
			n++;
			name = base + n;
		}
		noteIdentifier(name);
		return name;
	}

	public void addLoopPrelude(IRNode node)
	{
		loopPrelude.add(node);
	}

	/**
	 * Returns and clears the statements collected for the loop being closed.
	 */
	public List<IRNode> takeLoopPrelude()
	{
		List<IRNode> taken = new ArrayList<>(loopPrelude);
		loopPrelude.clear();
		return taken;
	}

	public String freshTempName()
	{
		String name;
		do
		{
			tempCounter++;
			name = tempCounter == 1 ? "temp" : "temp" + tempCounter;
		}
		while (identifiers.contains(name));
		noteIdentifier(name);
		return name;
	}
}
