// File: src/main/java/org/lokray/quby/ast/expressions/BinaryExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.lexer.Token;

/**
 * AST node representing a binary operation (e.g., a + b, x == y, c && d).
 * It has a left operand, an operator, and a right operand.
 */
public class BinaryExpression extends OperatorExpression
{

	public BinaryExpression(Expression left, Token operatorToken, Operator operator, Expression right)
	{
		super(left, operatorToken, operator, right);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBinaryExpression(this);
	}
}
