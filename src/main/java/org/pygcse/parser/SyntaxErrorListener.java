package org.pygcse.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.pygcse.util.Debug;

import java.util.ArrayList;
import java.util.List;

/**
 * A custom error listener for the ANTLR lexer and parser. Routes syntax errors
 * through Debug and remembers them so the caller can fail the parse.
 */
public class SyntaxErrorListener extends BaseErrorListener
{
	private final List<SyntaxException> errors = new ArrayList<>();

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e)
	{
		String err = String.format("[Syntax Error] line %d:%d - %s", line, charPositionInLine + 1, msg);
		Debug.logDebug(err);
		errors.add(new SyntaxException(err, line, charPositionInLine + 1));
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}

	public List<SyntaxException> getErrors()
	{
		return errors;
	}
}
