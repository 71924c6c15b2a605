// File: src/main/java/org/lokray/quby/ast/expressions/BalancingExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.lexer.Token;

/**
 * An operator node taking part in precedence rebalancing. The parser builds operator
 * chains right-leaning without regard to precedence; each node is rebalanced once,
 * the first time the validator reaches it.
 */
public abstract class BalancingExpression implements Expression
{
	private final Token operatorToken;
	private final Operator operator;
	private boolean balanceDone = false;

	protected BalancingExpression(Token operatorToken, Operator operator)
	{
		this.operatorToken = operatorToken;
		this.operator = operator;
	}

	public Token getOperatorToken()
	{
		return operatorToken;
	}

	public Operator getOperator()
	{
		return operator;
	}

	public int getPrecedence()
	{
		return operator.getPrecedence();
	}

	public boolean isResultBool()
	{
		return operator.isResultBool();
	}

	public boolean isBalanceDone()
	{
		return balanceDone;
	}

	public void setBalanceDone()
	{
		this.balanceDone = true;
	}
}
