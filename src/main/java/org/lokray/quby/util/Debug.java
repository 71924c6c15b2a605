// File: src/main/java/org/lokray/quby/util/Debug.java

package org.lokray.quby.util;

import org.apache.log4j.Logger;

/**
 * Indented trace logging for the compiler passes. Output goes through log4j at DEBUG
 * level, so it is silent unless the {@code org.lokray.quby.util.Debug} logger is
 * raised in {@code log4j.properties}.
 */
public class Debug
{
	private static final Logger LOG = Logger.getLogger(Debug.class);

	private static int indentLevel = 0;

	/**
	 * Logs a formatted message if debugging is enabled.
	 *
	 * @param format The message format string (e.g., "Found var: %s").
	 * @param args   The arguments to format into the message.
	 */
	public static void log(String format, Object... args)
	{
		if (isEnabled())
		{
			String indent = "  ".repeat(indentLevel);
			LOG.debug(indent + String.format(format, args));
		}
	}

	/**
	 * Increases the indentation level for subsequent log messages.
	 */
	public static void indent()
	{
		if (isEnabled())
		{
			indentLevel++;
		}
	}

	/**
	 * Decreases the indentation level for subsequent log messages.
	 */
	public static void dedent()
	{
		if (isEnabled())
		{
			indentLevel = Math.max(0, indentLevel - 1);
		}
	}

	public static boolean isEnabled()
	{
		return LOG.isDebugEnabled();
	}
}
