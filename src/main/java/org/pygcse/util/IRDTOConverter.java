package org.pygcse.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.pygcse.dto.IRNodeDTO;
import org.pygcse.ir.IRMeta;
import org.pygcse.ir.IRNode;

import java.util.ArrayList;
import java.util.Map;

/**
 * Turns an IR tree into plain DTOs for the {@code --dump-ir} JSON output.
 */
public class IRDTOConverter
{
	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

	public static String toJson(IRNode root)
	{
		return GSON.toJson(toDTO(root));
	}

	public static IRNodeDTO toDTO(IRNode node)
	{
		IRNodeDTO dto = new IRNodeDTO();
		dto.kind = node.getKind().name();
		dto.text = node.getText();
		if (node.getMeta() != null)
		{
			metaToMap(node.getMeta(), dto.meta);
		}
		for (IRNode child : node.getChildren())
		{
			dto.children.add(toDTO(child));
		}
		return dto;
	}

	private static void metaToMap(IRMeta meta, Map<String, Object> out)
	{
		if (meta instanceof IRMeta.ConditionalMeta c)
		{
			out.put("condition", c.condition());
			// the branches themselves are already among the children
			out.put("thenCount", c.thenBranch().size());
			out.put("elseCount", c.elseBranches().size());
			out.put("continuation", c.continuation());
		}
		else if (meta instanceof IRMeta.BranchMeta b)
		{
			out.put("condition", b.condition());
		}
		else if (meta instanceof IRMeta.ForMeta f)
		{
			out.put("variable", f.variable());
			out.put("start", f.start());
			out.put("end", f.end());
			out.put("step", f.step());
		}
		else if (meta instanceof IRMeta.WhileMeta w)
		{
			out.put("condition", w.condition());
		}
		else if (meta instanceof IRMeta.RepeatMeta r)
		{
			out.put("condition", r.condition());
		}
		else if (meta instanceof IRMeta.RoutineMeta r)
		{
			out.put("name", r.name());
			out.put("params", new ArrayList<>(r.params()));
			out.put("returnsValue", r.returnsValue());
			out.put("returnType", r.returnType());
		}
		else if (meta instanceof IRMeta.ReturnMeta r)
		{
			out.put("hasValue", r.hasValue());
			out.put("type", r.type());
		}
		else if (meta instanceof IRMeta.ArrayMeta a)
		{
			out.put("name", a.name());
			out.put("size", a.size());
			out.put("elementType", a.elementType());
		}
		else if (meta instanceof IRMeta.RecordMeta r)
		{
			out.put("typeName", r.typeName());
			out.put("fields", new ArrayList<>(r.fields()));
		}
		else if (meta instanceof IRMeta.ClassMeta c)
		{
			out.put("name", c.name());
			out.put("base", c.base());
		}
		else if (meta instanceof IRMeta.CaseMeta c)
		{
			out.put("subject", c.subject());
		}
		else if (meta instanceof IRMeta.InputMeta i)
		{
			out.put("variable", i.variable());
			out.put("type", i.type());
		}
		else if (meta instanceof IRMeta.ProgramMeta p)
		{
			out.put("identifiers", new ArrayList<>(p.identifiers()));
		}
	}
}
