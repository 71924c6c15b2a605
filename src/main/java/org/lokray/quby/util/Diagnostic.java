// File: src/main/java/org/lokray/quby/util/Diagnostic.java

package org.lokray.quby.util;

import java.util.Objects;

/**
 * One reported problem. The formatted message carries the line prefix when the line
 * is known, the raw message never does.
 */
public class Diagnostic
{
	public static final int UNKNOWN_LINE = -1;

	private final String sourceName;
	private final int line;
	private final String rawMessage;
	private final String message;

	public Diagnostic(String sourceName, int line, String rawMessage)
	{
		this.sourceName = sourceName;
		this.rawMessage = rawMessage;

		if (line > 0)
		{
			this.line = line;
			this.message = "line " + line + ", " + rawMessage;
		}
		else
		{
			this.line = UNKNOWN_LINE;
			this.message = rawMessage;
		}
	}

	public String getSourceName()
	{
		return sourceName;
	}

	public int getLine()
	{
		return line;
	}

	public String getRawMessage()
	{
		return rawMessage;
	}

	public String getMessage()
	{
		return message;
	}

	@Override
	public String toString()
	{
		return (sourceName == null ? "" : sourceName + ": ") + message;
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
		Diagnostic that = (Diagnostic) o;
		return line == that.line &&
				Objects.equals(sourceName, that.sourceName) &&
				rawMessage.equals(that.rawMessage);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(sourceName, line, rawMessage);
	}
}
