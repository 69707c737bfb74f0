package org.pygcse.codegen;

import org.pygcse.ir.IRKind;
import org.pygcse.ir.IRMeta;
import org.pygcse.ir.IRNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Wraps emitted pseudocode in a Markdown document. The code lines are placed
 * in a fenced block exactly as emitted.
 */
public class MarkdownDecorator
{
	private static final String FENCE = "```";

	private final int headingLevel;
	private final String lineEnding;

	public MarkdownDecorator(int headingLevel, String lineEnding)
	{
		if (headingLevel < 1 || headingLevel > 5)
		{
			throw new IllegalArgumentException("Heading level must be between 1 and 5: " + headingLevel);
		}
		this.headingLevel = headingLevel;
		this.lineEnding = lineEnding;
	}

	public MarkdownDecorator()
	{
		this(2, "\n");
	}

	/**
	 * @param code  emitted pseudocode
	 * @param title heading text, usually the source file name; {@code null} for a generic heading
	 * @param root  IR the code came from, used for the list of routines; may be {@code null}
	 */
	public String decorate(String code, String title, IRNode root)
	{
		String heading = "#".repeat(headingLevel);
		String subheading = "#".repeat(headingLevel + 1);
		List<String> out = new ArrayList<>();

		out.add(heading + " " + (title == null ? "IGCSE Pseudocode" : title));
		out.add("");

		List<String> routines = root == null ? List.of() : routineNames(root);
		if (!routines.isEmpty())
		{
			out.add(subheading + " Contents");
			out.add("");
			for (String name : routines)
			{
				out.add("- `" + name + "`");
			}
			out.add("");
		}

		out.add(subheading + " Pseudocode");
		out.add("");
		out.add(FENCE + "pseudocode");
		out.add(code);
		out.add(FENCE);
		out.add("");
		out.add("---");
		out.add("*Generated by pygcse*");
		return String.join(lineEnding, out);
	}

	static List<String> routineNames(IRNode root)
	{
		List<String> names = new ArrayList<>();
		collect(root, names);
		return names;
	}

	private static void collect(IRNode node, List<String> names)
	{
		if (node.getKind().isRoutine() && node.getMeta() instanceof IRMeta.RoutineMeta routine && !routine.name().equals("NEW"))
		{
			names.add(routine.name());
		}
		if (node.getKind() == IRKind.CLASS && node.getMeta() instanceof IRMeta.ClassMeta classMeta)
		{
			names.add(classMeta.name());
		}
		for (IRNode child : node.getChildren())
		{
			collect(child, names);
		}
	}
}
