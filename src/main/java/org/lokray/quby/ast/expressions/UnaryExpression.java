// File: src/main/java/org/lokray/quby/ast/expressions/UnaryExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.lexer.Token;

/**
 * AST node representing a prefix unary operation ('-x' or '!x').
 */
public class UnaryExpression extends BalancingExpression
{
	private Expression operand;

	public UnaryExpression(Token operatorToken, Operator operator, Expression operand)
	{
		super(operatorToken, operator);
		this.operand = operand;
	}

	public Expression getOperand()
	{
		return operand;
	}

	public void setOperand(Expression operand)
	{
		this.operand = operand;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitUnaryExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return getOperatorToken();
	}

	@Override
	public String toString()
	{
		return "(" + getOperator().getSymbol() + operand + ")";
	}
}
