// File: src/main/java/org/lokray/quby/codegen/Printer.java

package org.lokray.quby.codegen;

import org.lokray.quby.ast.ASTNode;
import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.runtime.QubyRuntime;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates the generated JavaScript.
 * <p>
 * Output goes to one of two regions. Pre-code holds function, class and table
 * definitions and always comes first; code holds the top level statements of the
 * programs. Each region has a {@link PrinterStatement} being built, so an expression
 * can ask for code to run before or after the statement it is part of.
 */
public class Printer
{
	private static final String STATEMENT_END = ";\n";

	private final List<String> pre = new ArrayList<>();
	private final List<String> stmts = new ArrayList<>();

	private final PrinterStatement currentPre = new PrinterStatement();
	private final PrinterStatement currentStmt = new PrinterStatement();

	private boolean isCode = true;
	private int tempVarCounter = 0;

	/**
	 * @param isCode true to print into the code region, false for the pre-code region.
	 */
	public void setCodeMode(boolean isCode)
	{
		this.isCode = isCode;
	}

	public boolean isCodeMode()
	{
		return isCode;
	}

	private PrinterStatement current()
	{
		return isCode ? currentStmt : currentPre;
	}

	private List<String> currentRegion()
	{
		return isCode ? stmts : pre;
	}

	/**
	 * @return a fresh temporary variable name, unique for this printer.
	 */
	public String getTempVariable()
	{
		return QubyRuntime.TEMP_VARIABLE + (tempVarCounter++);
	}

	public Printer append(String... texts)
	{
		PrinterStatement statement = current();
		for (String text : texts)
		{
			statement.appendNow(text);
		}
		return this;
	}

	/**
	 * Appends code that runs before the current statement.
	 */
	public Printer appendPre(String... texts)
	{
		PrinterStatement statement = current();
		for (String text : texts)
		{
			statement.appendPre(text);
		}
		return this;
	}

	/**
	 * Appends code that runs after the current statement.
	 */
	public Printer appendPost(String... texts)
	{
		PrinterStatement statement = current();
		for (String text : texts)
		{
			statement.appendPost(text);
		}
		return this;
	}

	public Printer flush()
	{
		current().flush(currentRegion());
		return this;
	}

	/**
	 * Terminates the current statement. Does nothing when nothing was printed since the
	 * last statement ended.
	 */
	public Printer endStatement()
	{
		if (current().isEmpty())
		{
			return this;
		}
		append(STATEMENT_END);
		return flush();
	}

	/**
	 * Prints each node as a statement of its own.
	 */
	public void printArray(List<? extends ASTNode> nodes, ASTVisitor<?> generator)
	{
		for (ASTNode node : nodes)
		{
			node.accept(generator);
			endStatement();
		}
	}

	/**
	 * @return the pre-code followed by the code, including anything not yet flushed.
	 */
	@Override
	public String toString()
	{
		List<String> all = new ArrayList<>(pre);
		currentPre.copyTo(all);
		all.addAll(stmts);
		currentStmt.copyTo(all);

		return String.join("", all);
	}
}
