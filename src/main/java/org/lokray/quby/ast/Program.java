// File: src/main/java/org/lokray/quby/ast/Program.java

package org.lokray.quby.ast;

import org.lokray.quby.ast.statements.Statement;
import org.lokray.quby.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The root AST node representing one Quby source file.
 * Contains the file's top level statements in source order.
 */
public class Program implements ASTNode
{
	private final String sourceName;
	private final List<Statement> statements;

	public Program(String sourceName)
	{
		this(sourceName, new ArrayList<>());
	}

	public Program(String sourceName, List<Statement> statements)
	{
		this.sourceName = sourceName;
		this.statements = new ArrayList<>(statements);
	}

	public String getSourceName()
	{
		return sourceName;
	}

	public List<Statement> getStatements()
	{
		return Collections.unmodifiableList(statements);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitProgram(this);
	}

	@Override
	public Token getFirstToken()
	{
		return statements.isEmpty() ? null : statements.get(0).getFirstToken();
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		for (Statement statement : statements)
		{
			sb.append(statement).append("\n");
		}
		return sb.toString();
	}
}
