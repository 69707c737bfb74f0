package org.pygcse;

import org.pygcse.ast.Module;
import org.pygcse.codegen.EmitResult;
import org.pygcse.codegen.MarkdownDecorator;
import org.pygcse.codegen.PseudocodeEmitter;
import org.pygcse.ir.IRNode;
import org.pygcse.parser.JsonTreeReader;
import org.pygcse.parser.SourceParser;
import org.pygcse.parser.SyntaxException;
import org.pygcse.translate.StatementVisitor;
import org.pygcse.util.Debug;
import org.pygcse.util.Diagnostic;
import org.pygcse.util.ErrorHandler;

import java.util.function.Supplier;

/**
 * Runs the whole pipeline: syntax tree supplier, statement visitor, emitter.
 * Holds only its options, so one instance can serve any number of conversions.
 */
public class PseudocodeConverter
{
	private final ConversionOptions options;

	public PseudocodeConverter(ConversionOptions options)
	{
		this.options = options;
	}

	public PseudocodeConverter()
	{
		this(ConversionOptions.defaults());
	}

	public ConversionOptions getOptions()
	{
		return options;
	}

	/**
	 * Converts Python source text.
	 */
	public ConversionResult convert(String source)
	{
		return convert(() -> new SourceParser().parse(source), null);
	}

	/**
	 * Converts the JSON dump of a Python {@code ast} tree.
	 */
	public ConversionResult convertJson(String json)
	{
		return convert(() -> new JsonTreeReader().read(json), null);
	}

	public ConversionResult convert(String source, String title)
	{
		return convert(() -> new SourceParser().parse(source), title);
	}

	public ConversionResult convertJson(String json, String title)
	{
		return convert(() -> new JsonTreeReader().read(json), title);
	}

	public ConversionResult convertModule(Module module)
	{
		return convert(() -> module, null);
	}

	private ConversionResult convert(Supplier<Module> supplier, String title)
	{
		ErrorHandler errorHandler = new ErrorHandler();
		Module module;
		try
		{
			module = supplier.get();
		}
		catch (SyntaxException e)
		{
			errorHandler.logError(Diagnostic.Kind.SYNTAX, e.getLine(), e.getMessage());
			return new ConversionResult("", null, errorHandler.getDiagnostics());
		}

		IRNode ir = new StatementVisitor(errorHandler, options.emptyArrayCapacity()).visitModule(module);
		EmitResult emitted = new PseudocodeEmitter(options).emit(ir);
		errorHandler.addAll(emitted.diagnostics());

		String code = emitted.code();
		if (options.markdown())
		{
			code = new MarkdownDecorator(2, options.lineEnding()).decorate(code, title, ir);
		}
		Debug.logDebug("Conversion finished: " + emitted.lineCount() + " line(s), " + errorHandler.getDiagnostics().size() + " diagnostic(s)");
		return new ConversionResult(code, ir, errorHandler.getDiagnostics());
	}
}
