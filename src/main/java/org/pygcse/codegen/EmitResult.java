package org.pygcse.codegen;

import org.pygcse.util.Diagnostic;

import java.util.List;

/**
 * Text produced by one emitter pass and the warnings raised while producing it.
 */
public record EmitResult(String code, List<Diagnostic> diagnostics, int lineCount)
{
}
