// File: src/main/java/org/lokray/quby/util/ErrorReporter.java

package org.lokray.quby.util;

import org.apache.log4j.Logger;
import org.lokray.quby.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Collects diagnostics for a whole compilation. Nothing is thrown across passes:
 * every pass reports here and keeps going.
 */
public class ErrorReporter
{
	private static final Logger LOG = Logger.getLogger(ErrorReporter.class);

	private static final Comparator<Diagnostic> ORDER = Comparator
			.comparing(Diagnostic::getSourceName, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
			.thenComparingInt(Diagnostic::getLine);

	private final List<Diagnostic> diagnostics = new ArrayList<>();

	// the source name of the most recent diagnostic that had one
	private String lastSourceName = null;

	/**
	 * Reports an error at the position of a token.
	 *
	 * @param offset  The token where the error occurred, may be null.
	 * @param message The error message.
	 */
	public void report(Token offset, String message)
	{
		if (offset == null)
		{
			report(null, Diagnostic.UNKNOWN_LINE, message);
		}
		else
		{
			report(offset.getSourceName(), offset.getLine(), message);
		}
	}

	/**
	 * Reports an error. A diagnostic without a source name takes the name of the last
	 * one that had a name.
	 *
	 * @param sourceName The file the error is in, may be null.
	 * @param line       The line number where the error occurred, or a value below 1.
	 * @param message    The error message.
	 */
	public void report(String sourceName, int line, String message)
	{
		String name = sourceName;
		if (name == null)
		{
			name = lastSourceName;
		}
		else
		{
			lastSourceName = name;
		}

		Diagnostic diagnostic = new Diagnostic(name, line, message);
		diagnostics.add(diagnostic);
		LOG.debug("Reported " + diagnostic);
	}

	/**
	 * Checks if any errors have been reported.
	 *
	 * @return True if errors exist, false otherwise.
	 */
	public boolean hasErrors()
	{
		return !diagnostics.isEmpty();
	}

	/**
	 * @return every diagnostic, ordered by source name and then by line. Diagnostics that
	 * compare equal keep the order they were reported in.
	 */
	public List<Diagnostic> getDiagnostics()
	{
		List<Diagnostic> sorted = new ArrayList<>(diagnostics);
		sorted.sort(ORDER);
		return Collections.unmodifiableList(sorted);
	}

	/**
	 * Forgets the last source name, so the next unnamed diagnostic stays unnamed.
	 * Called at the start of each source file.
	 */
	public void resetSourceName()
	{
		lastSourceName = null;
	}

	/**
	 * Discards all diagnostics.
	 */
	public void reset()
	{
		diagnostics.clear();
		lastSourceName = null;
	}
}
