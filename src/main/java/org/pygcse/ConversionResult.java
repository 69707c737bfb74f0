package org.pygcse;

import org.pygcse.ir.IRNode;
import org.pygcse.util.Diagnostic;

import java.util.List;

/**
 * Output of one conversion: best-effort pseudocode, the IR it was emitted
 * from ({@code null} when the source did not parse), and every diagnostic.
 */
public record ConversionResult(String code, IRNode ir, List<Diagnostic> diagnostics)
{
	public boolean hasErrors()
	{
		return diagnostics.stream().anyMatch(Diagnostic::isError);
	}

	public List<Diagnostic> warnings()
	{
		return diagnostics.stream().filter(d -> !d.isError()).toList();
	}

	public List<Diagnostic> errors()
	{
		return diagnostics.stream().filter(Diagnostic::isError).toList();
	}
}
