package org.pygcse.ir;

import java.util.List;
import java.util.Set;

/**
 * Kind-specific data attached to an {@link IRNode}. The emitter reads only
 * this and the node text, never the symbol context.
 */
public sealed interface IRMeta
{
	/**
	 * {@code thenBranch} and {@code elseBranches} reference nodes that are also
	 * children of the conditional; the split tells the emitter where ENDIF goes.
	 * A {@code continuation} is an ELSE IF rendered by an outer chain, so it
	 * never closes itself.
	 */
	record ConditionalMeta(String condition, List<IRNode> thenBranch, List<IRNode> elseBranches, boolean continuation) implements IRMeta
	{
	}

	/**
	 * {@code condition} is {@code null} for a plain ELSE.
	 */
	record BranchMeta(String condition) implements IRMeta
	{
	}

	/**
	 * {@code step} is {@code null} when the loop counts up by one.
	 */
	record ForMeta(String variable, String start, String end, String step) implements IRMeta
	{
	}

	record WhileMeta(String condition) implements IRMeta
	{
	}

	record RepeatMeta(String condition) implements IRMeta
	{
	}

	record RoutineMeta(String name, List<String> params, boolean returnsValue, String returnType) implements IRMeta
	{
	}

	record ReturnMeta(boolean hasValue, String type) implements IRMeta
	{
	}

	record ArrayMeta(String name, String size, String elementType) implements IRMeta
	{
	}

	record RecordMeta(String typeName, List<String> fields) implements IRMeta
	{
	}

	record ClassMeta(String name, String base) implements IRMeta
	{
	}

	record CaseMeta(String subject) implements IRMeta
	{
	}

	record InputMeta(String variable, String type) implements IRMeta
	{
	}

	/**
	 * Attached to the root; lists every identifier of the source program so the
	 * formatter can tell a variable called {@code step} from the keyword.
	 */
	record ProgramMeta(Set<String> identifiers) implements IRMeta
	{
	}
}
