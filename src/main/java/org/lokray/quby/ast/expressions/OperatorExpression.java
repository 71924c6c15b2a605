// File: src/main/java/org/lokray/quby/ast/expressions/OperatorExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.lexer.Token;

/**
 * A two sided operator. Both sides can be replaced, which is how rebalancing rotates
 * a subtree.
 */
public abstract class OperatorExpression extends BalancingExpression
{
	private Expression left;
	private Expression right;

	protected OperatorExpression(Expression left, Token operatorToken, Operator operator, Expression right)
	{
		super(operatorToken, operator);
		this.left = left;
		this.right = right;
	}

	public Expression getLeft()
	{
		return left;
	}

	public void setLeft(Expression left)
	{
		this.left = left;
	}

	public Expression getRight()
	{
		return right;
	}

	public void setRight(Expression right)
	{
		this.right = right;
	}

	@Override
	public Token getFirstToken()
	{
		Token token = left == null ? null : left.getFirstToken();
		return token != null ? token : getOperatorToken();
	}

	@Override
	public String toString()
	{
		return "(" + left + " " + getOperator().getSymbol() + " " + right + ")";
	}
}
