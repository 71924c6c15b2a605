// File: src/main/java/org/lokray/quby/ast/statements/BlockStatement.java

package org.lokray.quby.ast.statements;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST node representing a sequence of statements.
 * This is used for function bodies, class bodies, if/else branches and loop bodies.
 */
public class BlockStatement implements Statement
{
	private final List<Statement> statements;

	public BlockStatement()
	{
		this.statements = new ArrayList<>();
	}

	/**
	 * Constructor to create a BlockStatement from a pre-existing list of statements.
	 *
	 * @param statements The list of statements to include in this block.
	 */
	public BlockStatement(List<Statement> statements)
	{
		this.statements = new ArrayList<>(statements);
	}

	public List<Statement> getStatements()
	{
		return Collections.unmodifiableList(statements);
	}

	public boolean isEmpty()
	{
		return statements.isEmpty();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBlockStatement(this);
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
