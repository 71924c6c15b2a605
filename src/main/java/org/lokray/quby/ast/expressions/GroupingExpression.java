// File: src/main/java/org/lokray/quby/ast/expressions/GroupingExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.lexer.Token;

/**
 * AST node representing an expression enclosed in parentheses.
 * Rebalancing never looks through it, so the parentheses always win.
 */
public class GroupingExpression implements Expression
{
	private final Token openParen;
	private Expression expression;

	public GroupingExpression(Token openParen, Expression expression)
	{
		this.openParen = openParen;
		this.expression = expression;
	}

	public Expression getExpression()
	{
		return expression;
	}

	public void setExpression(Expression expression)
	{
		this.expression = expression;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitGroupingExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return openParen;
	}

	@Override
	public String toString()
	{
		return "(" + expression + ")";
	}
}
