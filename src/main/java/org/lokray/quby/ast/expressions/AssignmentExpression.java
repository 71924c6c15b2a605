// File: src/main/java/org/lokray/quby/ast/expressions/AssignmentExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.lexer.Token;

/**
 * AST node for 'target = value'. It is a balancing operator like any other, so
 * {@code a + b = c} is rotated into an assignment whose target is {@code a + b}
 * and then rejected.
 */
public class AssignmentExpression extends OperatorExpression
{
	// set when the target is an array access
	private boolean collectionMode = false;

	public AssignmentExpression(Expression target, Token operatorToken, Expression value)
	{
		super(target, operatorToken, Operator.ASSIGN, value);
	}

	public boolean isCollectionMode()
	{
		return collectionMode;
	}

	public void setCollectionMode()
	{
		this.collectionMode = true;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAssignmentExpression(this);
	}
}
