package org.pygcse.translate;

import org.pygcse.ast.Expr;
import org.pygcse.ast.Exprs;
import org.pygcse.ast.Module;
import org.pygcse.ast.Stmt;
import org.pygcse.semantic.SymbolContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Pre-pass over the whole program. Records the first call to each name, so a
 * record class knows whether its TYPE block goes with a declaration or with
 * the class itself, and every identifier in use, so generated loop counters
 * never collide with one.
 */
public class InstantiationScanner
{
	private final SymbolContext context;

	public InstantiationScanner(SymbolContext context)
	{
		this.context = context;
	}

	public void scan(Module module)
	{
		for (Stmt stmt : module.body())
		{
			scan(stmt);
		}
	}

	private void scan(Stmt stmt)
	{
		if (stmt == null)
		{
			return;
		}
		Set<Expr> declaring = declaringCalls(stmt);
		for (Expr expr : expressionsOf(stmt))
		{
			Exprs.forEach(expr, e -> note(e, declaring));
		}
		for (List<Stmt> body : bodiesOf(stmt))
		{
			for (Stmt inner : body)
			{
				scan(inner);
			}
		}
	}

	private void note(Expr expr, Set<Expr> declaring)
	{
		if (expr instanceof Expr.Name name)
		{
			context.noteIdentifier(name.id());
		}
		else if (expr instanceof Expr.Attribute attribute)
		{
			// fields turn into bare names inside TYPE and CLASS blocks
			context.noteIdentifier(attribute.attr());
		}
		else if (expr instanceof Expr.Call call)
		{
			if (call.simpleName() != null)
			{
				context.markInstantiated(call.simpleName(), call, declaring.contains(call));
			}
			for (Expr.Keyword keyword : call.keywords())
			{
				context.noteIdentifier(keyword.name());
			}
		}
	}

	/**
	 * Calls that sit where a record instantiation declares its own variable:
	 * an assignment value, an element of an assigned list, or an append argument.
	 */
	private static Set<Expr> declaringCalls(Stmt stmt)
	{
		Set<Expr> calls = Collections.newSetFromMap(new IdentityHashMap<>());
		Expr value = null;
		if (stmt instanceof Stmt.Assign assign)
		{
			value = assign.value();
		}
		else if (stmt instanceof Stmt.AnnAssign annAssign)
		{
			value = annAssign.value();
		}
		else if (stmt instanceof Stmt.AugAssign augAssign && augAssign.value() instanceof Expr.ListLit)
		{
			value = augAssign.value();
		}
		else if (stmt instanceof Stmt.ExprStmt exprStmt && exprStmt.value() instanceof Expr.Call call
				&& call.func() instanceof Expr.Attribute attribute && "append".equals(attribute.attr()) && call.args().size() == 1)
		{
			value = call.args().get(0);
		}
		if (value == null || Exprs.anyMatch(value, e -> Exprs.isCallTo(e, "input")))
		{
			return calls;
		}

		if (value instanceof Expr.Call)
		{
			calls.add(value);
		}
		List<Expr> elements = value instanceof Expr.ListLit list ? list.elements()
				: value instanceof Expr.TupleLit tuple ? tuple.elements() : List.of();
		for (Expr element : elements)
		{
			if (element instanceof Expr.Call)
			{
				calls.add(element);
			}
		}
		return calls;
	}

	private List<Expr> expressionsOf(Stmt stmt)
	{
		List<Expr> exprs = new ArrayList<>();
		if (stmt instanceof Stmt.Assign assign)
		{
			exprs.addAll(assign.targets());
			exprs.add(assign.value());
		}
		else if (stmt instanceof Stmt.AugAssign augAssign)
		{
			exprs.add(augAssign.target());
			exprs.add(augAssign.value());
		}
		else if (stmt instanceof Stmt.AnnAssign annAssign)
		{
			exprs.add(annAssign.target());
			exprs.add(annAssign.value());
		}
		else if (stmt instanceof Stmt.If ifStmt)
		{
			exprs.add(ifStmt.test());
		}
		else if (stmt instanceof Stmt.For forStmt)
		{
			exprs.add(forStmt.target());
			exprs.add(forStmt.iter());
		}
		else if (stmt instanceof Stmt.While whileStmt)
		{
			exprs.add(whileStmt.test());
		}
		else if (stmt instanceof Stmt.Return ret)
		{
			exprs.add(ret.value());
		}
		else if (stmt instanceof Stmt.ExprStmt exprStmt)
		{
			exprs.add(exprStmt.value());
		}
		else if (stmt instanceof Stmt.Match match)
		{
			exprs.add(match.subject());
			for (Stmt.MatchCase c : match.cases())
			{
				exprs.add(c.guard());
			}
		}
		else if (stmt instanceof Stmt.FunctionDef def)
		{
			if (def.name() != null)
			{
				context.noteIdentifier(def.name());
			}
			for (Stmt.Param param : def.params())
			{
				if (param.name() != null)
				{
					context.noteIdentifier(param.name());
				}
				exprs.add(param.defaultValue());
			}
		}
		else if (stmt instanceof Stmt.ClassDef def && def.name() != null)
		{
			context.noteIdentifier(def.name());
		}
		return exprs;
	}

	private static List<List<Stmt>> bodiesOf(Stmt stmt)
	{
		if (stmt instanceof Stmt.If ifStmt)
		{
			return List.of(ifStmt.body(), ifStmt.orelse());
		}
		if (stmt instanceof Stmt.For forStmt)
		{
			return List.of(forStmt.body(), forStmt.orelse());
		}
		if (stmt instanceof Stmt.While whileStmt)
		{
			return List.of(whileStmt.body(), whileStmt.orelse());
		}
		if (stmt instanceof Stmt.FunctionDef def)
		{
			return List.of(def.body());
		}
		if (stmt instanceof Stmt.ClassDef def)
		{
			return List.of(def.body());
		}
		if (stmt instanceof Stmt.Try tryStmt)
		{
			return List.of(tryStmt.body());
		}
		if (stmt instanceof Stmt.With withStmt)
		{
			return List.of(withStmt.body());
		}
		if (stmt instanceof Stmt.Match match)
		{
			List<List<Stmt>> bodies = new ArrayList<>();
			for (Stmt.MatchCase c : match.cases())
			{
				bodies.add(c.body());
			}
			return bodies;
		}
		return List.of();
	}
}
