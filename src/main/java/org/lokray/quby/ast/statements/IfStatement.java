// File: src/main/java/org/lokray/quby/ast/statements/IfStatement.java
package org.lokray.quby.ast.statements;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.ast.expressions.Expression;
import org.lokray.quby.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST node representing an 'if ... elsif ... else ... end' statement.
 * The first branch is the 'if', any further branches are 'elsif's,
 * and the optional else block runs when no condition held.
 */
public class IfStatement implements Statement
{
	private final Token ifKeyword;
	private final List<Branch> branches;
	private final BlockStatement elseBranch;

	/**
	 * Constructs an IfStatement.
	 *
	 * @param ifKeyword  The 'if' keyword token.
	 * @param branches   The 'if' branch followed by any 'elsif' branches, never empty.
	 * @param elseBranch The optional block to execute if no condition is true.
	 */
	public IfStatement(Token ifKeyword, List<Branch> branches, BlockStatement elseBranch)
	{
		if (branches.isEmpty())
		{
			throw new IllegalArgumentException("An if statement needs at least one branch");
		}
		this.ifKeyword = ifKeyword;
		this.branches = new ArrayList<>(branches);
		this.elseBranch = elseBranch;
	}

	public List<Branch> getBranches()
	{
		return Collections.unmodifiableList(branches);
	}

	public BlockStatement getElseBranch()
	{
		return elseBranch;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIfStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return ifKeyword;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < branches.size(); i++)
		{
			Branch branch = branches.get(i);
			sb.append(i == 0 ? "If (" : " Elsif (").append(branch.getCondition()).append(") {\n");
			sb.append(branch.getBody()).append("}");
		}
		if (elseBranch != null)
		{
			sb.append(" Else {\n").append(elseBranch).append("}");
		}
		return sb.toString();
	}

	/**
	 * A condition and the block it guards.
	 */
	public static class Branch
	{
		private Expression condition;
		private final BlockStatement body;

		public Branch(Expression condition, BlockStatement body)
		{
			this.condition = condition;
			this.body = body;
		}

		public Expression getCondition()
		{
			return condition;
		}

		public void setCondition(Expression condition)
		{
			this.condition = condition;
		}

		public BlockStatement getBody()
		{
			return body;
		}
	}
}
