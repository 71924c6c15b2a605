// File: src/main/java/org/lokray/quby/lexer/Token.java

package org.lokray.quby.lexer;

import java.util.Objects;

/**
 * A positioned piece of source text. The parser attaches one to every AST node so
 * diagnostics can name the source file and line they refer to.
 */
public class Token
{
	private final String lexeme;     // The actual text of the token (e.g. "foo", "@bar", "123")
	private final int line;          // 1-based line, or -1 when unknown
	private final int column;        // 1-based column, or -1 when unknown
	private final String sourceName; // The file the token came from, may be null

	/**
	 * Constructs a new Token instance.
	 *
	 * @param lexeme     The raw string value of the token from the source code.
	 * @param line       The line number where this token begins.
	 * @param column     The column number where this token begins.
	 * @param sourceName The name of the source the token was read from.
	 */
	public Token(String lexeme, int line, int column, String sourceName)
	{
		this.lexeme = lexeme;
		this.line = line;
		this.column = column;
		this.sourceName = sourceName;
	}

	public String getLexeme()
	{
		return lexeme;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	public String getSourceName()
	{
		return sourceName;
	}

	/**
	 * Creates a token at the same position holding different text. Used for nodes
	 * synthesized by the compiler, such as default constructors.
	 */
	public Token withLexeme(String newLexeme)
	{
		return new Token(newLexeme, line, column, sourceName);
	}

	@Override
	public String toString()
	{
		return "'" + lexeme + "' (" + sourceName + " Line:" + line + ", Col:" + column + ")";
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		Token token = (Token) o;
		return line == token.line &&
				column == token.column &&
				lexeme.equals(token.lexeme) &&
				Objects.equals(sourceName, token.sourceName);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(lexeme, line, column, sourceName);
	}
}
