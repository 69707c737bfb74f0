package org.pygcse.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.pygcse.ast.Expr;
import org.pygcse.ast.Module;
import org.pygcse.util.Debug;

import java.util.List;

/**
 * Parses Python source text into the generic syntax tree using the ANTLR
 * grammar, keeping comments so they can be carried into the pseudocode.
 */
public class SourceParser
{
	public Module parse(String source)
	{
		// The grammar needs a NEWLINE to close the last statement.
		String text = source.endsWith("\n") ? source : source + "\n";

		SyntaxErrorListener listener = new SyntaxErrorListener();
		PythonLexer lexer = new PythonLexer(CharStreams.fromString(text));
		lexer.removeErrorListeners();
		lexer.addErrorListener(listener);

		CommonTokenStream tokens = new CommonTokenStream(lexer);
		PythonParser parser = new PythonParser(tokens);

		// Remove default error listeners to use our own
		parser.removeErrorListeners();
		parser.addErrorListener(listener);

		PythonParser.File_inputContext tree = parser.file_input();
		if (listener.hasErrors())
		{
			throw listener.getErrors().get(0);
		}

		List<Token> comments = tokens.getTokens().stream()
				.filter(t -> t.getType() == PythonLexer.COMMENT)
				.toList();
		Debug.logDebug("Parsed " + tokens.size() + " tokens, " + comments.size() + " comments");

		return new TreeBuilder(tokens, comments, this::parseExpression).build(tree);
	}

	/**
	 * Parses a single expression, as found inside the braces of an f-string.
	 */
	public Expr parseExpression(String source)
	{
		SyntaxErrorListener listener = new SyntaxErrorListener();
		PythonLexer lexer = new PythonLexer(CharStreams.fromString(source.strip()));
		lexer.removeErrorListeners();
		lexer.addErrorListener(listener);

		CommonTokenStream tokens = new CommonTokenStream(lexer);
		PythonParser parser = new PythonParser(tokens);
		parser.removeErrorListeners();
		parser.addErrorListener(listener);

		PythonParser.TestContext tree = parser.test();
		if (listener.hasErrors())
		{
			throw listener.getErrors().get(0);
		}
		return new TreeBuilder(tokens, List.of(), this::parseExpression).visit(tree);
	}
}
