// File: src/main/java/org/lokray/quby/codegen/PrinterStatement.java

package org.lokray.quby.codegen;

import java.util.ArrayList;
import java.util.List;

/**
 * The statement being printed, in three parts: code that must run before it (temporary
 * declarations, block checks), the statement itself, and code that must run after it.
 */
class PrinterStatement
{
	private final List<String> pre = new ArrayList<>();
	private final List<String> now = new ArrayList<>();
	private final List<String> post = new ArrayList<>();

	void appendPre(String text)
	{
		pre.add(text);
	}

	void appendNow(String text)
	{
		now.add(text);
	}

	void appendPost(String text)
	{
		post.add(text);
	}

	boolean isEmpty()
	{
		return pre.isEmpty() && now.isEmpty() && post.isEmpty();
	}

	void copyTo(List<String> destination)
	{
		destination.addAll(pre);
		destination.addAll(now);
		destination.addAll(post);
	}

	/**
	 * Moves everything into {@code destination} in pre, now, post order and clears this
	 * statement.
	 */
	void flush(List<String> destination)
	{
		copyTo(destination);

		pre.clear();
		now.clear();
		post.clear();
	}
}
