// File: src/main/java/org/lokray/quby/util/ParseError.java

package org.lokray.quby.util;

/**
 * A failure reported by the parser. The compiler core never inspects the input that
 * produced it, it only turns it into a {@link Diagnostic}.
 */
public class ParseError
{
	private final String sourceName;
	private final int line;
	private final String match;
	private final String terminalName; // null when a whole grammar rule failed
	private final boolean literalTerminal;

	private ParseError(String sourceName, int line, String match, String terminalName, boolean literalTerminal)
	{
		this.sourceName = sourceName;
		this.line = line;
		this.match = match == null ? "" : match;
		this.terminalName = terminalName;
		this.literalTerminal = literalTerminal;
	}

	/**
	 * A grammar rule could not be matched against {@code match}.
	 */
	public static ParseError symbol(String sourceName, int line, String match)
	{
		return new ParseError(sourceName, line, match, null, false);
	}

	/**
	 * A terminal was expected near {@code match}.
	 *
	 * @param literalTerminal true when the terminal is literal text, such as a keyword,
	 *                        rather than a named token class.
	 */
	public static ParseError terminal(String sourceName, int line, String match, String terminalName, boolean literalTerminal)
	{
		return new ParseError(sourceName, line, match, terminalName, literalTerminal);
	}

	public String getSourceName()
	{
		return sourceName;
	}

	public int getLine()
	{
		return line;
	}

	public String getMatch()
	{
		return match;
	}

	public boolean isTerminalError()
	{
		return terminalName != null;
	}

	/**
	 * @return the user facing message, without any line prefix.
	 */
	public String format()
	{
		if (terminalName == null)
		{
			return "error parsing '" + match + "'";
		}
		else if (literalTerminal || match.isBlank())
		{
			return "syntax error near '" + terminalName + "'";
		}
		else
		{
			return "syntax error near " + terminalName + " '" + match + "'";
		}
	}

	@Override
	public String toString()
	{
		return "ParseError(" + sourceName + ":" + line + ") " + format();
	}
}
