package org.pygcse.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Normalizes one line of pseudocode: keyword casing and operator spacing.
 * String literals and {@code //} comments pass through untouched. Spacing the
 * rules do not cover is collapsed to a single space or kept absent, so
 * formatting an already formatted line changes nothing.
 */
public class TextFormatter
{
	static final Set<String> KEYWORDS = Set.of(
			"IF", "THEN", "ELSE", "ENDIF",
			"FOR", "TO", "STEP", "NEXT",
			"WHILE", "DO", "ENDWHILE", "REPEAT", "UNTIL",
			"PROCEDURE", "ENDPROCEDURE", "FUNCTION", "RETURNS", "RETURN", "ENDFUNCTION", "CALL",
			"DECLARE", "CONSTANT", "ARRAY", "OF", "TYPE", "ENDTYPE",
			"CLASS", "ENDCLASS", "INHERITS", "PUBLIC", "PRIVATE", "NEW",
			"INPUT", "OUTPUT", "CASE", "OTHERWISE", "ENDCASE",
			"AND", "OR", "NOT", "DIV", "MOD", "IN",
			"TRUE", "FALSE", "NULL", "BREAK", "CONTINUE",
			"INTEGER", "REAL", "STRING", "CHAR", "BOOLEAN");

	// Keywords that stand for a value; a sign after them is binary.
	private static final Set<String> VALUE_KEYWORDS = Set.of("TRUE", "FALSE", "NULL");

	private static final Set<String> OPERATORS = Set.of("←", "=", "≠", "≤", "≥", "<", ">", "<=", ">=", "<>", "+", "-", "*", "/", "^", "&");

	private final Set<String> identifiers;

	/**
	 * @param identifiers names used by the source program; a lowercase keyword
	 *                    that is one of them is left alone
	 */
	public TextFormatter(Set<String> identifiers)
	{
		this.identifiers = identifiers;
	}

	public TextFormatter()
	{
		this(Set.of());
	}

	// --- Tokens ---

	enum TokenType
	{
		WORD,
		NUMBER,
		STRING,
		COMMENT,
		OPERATOR,
		PUNCTUATION
	}

	record Token(TokenType type, String text, boolean spaceBefore)
	{
	}

	static List<Token> tokenize(String line)
	{
		List<Token> tokens = new ArrayList<>();
		int i = 0;
		boolean space = false;
		while (i < line.length())
		{
			char c = line.charAt(i);
			if (Character.isWhitespace(c))
			{
				space = true;
				i++;
				continue;
			}

			int start = i;
			TokenType type;
			if (c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '/')
			{
				type = TokenType.COMMENT;
				i = line.length();
			}
			else if (c == '"' || c == '\'')
			{
				type = TokenType.STRING;
				i = endOfString(line, i);
			}
			else if (Character.isDigit(c))
			{
				type = TokenType.NUMBER;
				i++;
				while (i < line.length() && (Character.isLetterOrDigit(line.charAt(i)) || line.charAt(i) == '_'
						|| (line.charAt(i) == '.' && i + 1 < line.length() && Character.isDigit(line.charAt(i + 1)))))
				{
					i++;
				}
			}
			else if (Character.isLetter(c) || c == '_')
			{
				type = TokenType.WORD;
				while (i < line.length() && (Character.isLetterOrDigit(line.charAt(i)) || line.charAt(i) == '_'))
				{
					i++;
				}
			}
			else if ((c == '<' || c == '>') && i + 1 < line.length() && (line.charAt(i + 1) == '=' || line.substring(i, i + 2).equals("<>")))
			{
				type = TokenType.OPERATOR;
				i += 2;
			}
			else
			{
				type = OPERATORS.contains(String.valueOf(c)) ? TokenType.OPERATOR : TokenType.PUNCTUATION;
				i++;
			}
			tokens.add(new Token(type, line.substring(start, i), space));
			space = false;
		}
		return tokens;
	}

	private static int endOfString(String line, int start)
	{
		char quote = line.charAt(start);
		int i = start + 1;
		while (i < line.length())
		{
			char c = line.charAt(i);
			if (c == '\\')
			{
				i += 2;
				continue;
			}
			if (c == quote)
			{
				return i + 1;
			}
			i++;
		}
		// unterminated: the rest of the line belongs to the literal
		return line.length();
	}

	// --- Formatting ---

	public String format(String line)
	{
		if (line == null || line.isBlank())
		{
			return "";
		}

		List<Token> tokens = tokenize(line);
		StringBuilder out = new StringBuilder();
		Token previous = null;
		boolean previousUnary = false;
		for (int i = 0; i < tokens.size(); i++)
		{
			Token token = tokens.get(i);
			Token next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
			boolean unary = token.type() == TokenType.OPERATOR && isSign(token.text()) && startsOperand(previous);

			if (previous != null && spaceBetween(previous, previousUnary, token, unary))
			{
				out.append(' ');
			}
			out.append(token.type() == TokenType.WORD ? casing(token.text(), previous, next) : token.text());

			previous = token;
			previousUnary = unary;
		}
		return out.toString();
	}

	private static boolean spaceBetween(Token left, boolean leftUnary, Token right, boolean rightUnary)
	{
		if (leftUnary)
		{
			return false;
		}
		if (right.type() == TokenType.COMMENT)
		{
			return true;
		}
		if (isBinary(left) || (right.type() == TokenType.OPERATOR && !rightUnary))
		{
			return true;
		}
		if (right.text().equals(",") || right.text().equals(")") || right.text().equals("]") || right.text().equals("."))
		{
			return false;
		}
		if (left.text().equals(",") && left.type() == TokenType.PUNCTUATION)
		{
			return true;
		}
		if (left.text().equals("(") || left.text().equals("[") || left.text().equals("."))
		{
			return false;
		}
		return right.spaceBefore();
	}

	private static boolean isBinary(Token token)
	{
		return token.type() == TokenType.OPERATOR;
	}

	private static boolean isSign(String text)
	{
		return text.equals("-") || text.equals("+");
	}

	/**
	 * True if a sign after {@code previous} belongs to the following operand.
	 */
	private static boolean startsOperand(Token previous)
	{
		if (previous == null)
		{
			return true;
		}
		return switch (previous.type())
		{
			case OPERATOR -> true;
			case PUNCTUATION -> previous.text().equals("(") || previous.text().equals("[")
					|| previous.text().equals(",") || previous.text().equals(":");
			case WORD -> KEYWORDS.contains(previous.text().toUpperCase()) && !VALUE_KEYWORDS.contains(previous.text().toUpperCase())
					&& previous.text().equals(previous.text().toUpperCase());
			default -> false;
		};
	}

	private String casing(String word, Token previous, Token next)
	{
		String upper = word.toUpperCase();
		if (word.equals(upper) || !KEYWORDS.contains(upper) || identifiers.contains(word))
		{
			return word;
		}
		if (previous != null && previous.text().equals("."))
		{
			return word;
		}
		if (next != null && (next.text().equals("(") || next.text().equals("[") || next.text().equals(".") || next.text().equals("←")))
		{
			return word;
		}
		return upper;
	}
}
