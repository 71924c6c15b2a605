// File: src/main/java/org/lokray/quby/ast/statements/ExpressionStatement.java

package org.lokray.quby.ast.statements;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.ast.expressions.Expression;
import org.lokray.quby.lexer.Token;

/**
 * AST node for an expression used as a statement, e.g. {@code foo(1)} or {@code x = 2}.
 */
public class ExpressionStatement implements Statement
{
	private Expression expression;

	public ExpressionStatement(Expression expression)
	{
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
		return visitor.visitExpressionStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return expression.getFirstToken();
	}

	@Override
	public String toString()
	{
		return String.valueOf(expression);
	}
}
