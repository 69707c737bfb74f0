package org.pygcse.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the diagnostics of one conversion. Nothing recorded here stops
 * the caller; it decides what to do with the list once the pass is over.
 */
public class ErrorHandler
{
	private final List<Diagnostic> diagnostics = new ArrayList<>();
	private boolean hasErrors = false;

	public void logWarning(Diagnostic.Kind kind, int line, String msg)
	{
		Diagnostic warning = new Diagnostic(Diagnostic.Severity.WARNING, kind, msg, line);
		Debug.logDebug(warning.toString());
		diagnostics.add(warning);
	}

	public void logError(Diagnostic.Kind kind, int line, String msg)
	{
		Diagnostic error = new Diagnostic(Diagnostic.Severity.ERROR, kind, msg, line);
		Debug.logDebug(error.toString());
		diagnostics.add(error);
		hasErrors = true;
	}

	public void addAll(List<Diagnostic> others)
	{
		for (Diagnostic d : others)
		{
			diagnostics.add(d);
			if (d.isError())
			{
				hasErrors = true;
			}
		}
	}

	public List<Diagnostic> getDiagnostics()
	{
		return Collections.unmodifiableList(diagnostics);
	}

	public boolean hasErrors()
	{
		return hasErrors;
	}
}
