// File: src/main/java/org/lokray/quby/ast/expressions/MethodCallExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.lexer.Token;

import java.util.List;

/**
 * AST node for a call on an explicit receiver, {@code receiver.name(args)}.
 */
public class MethodCallExpression extends FunctionCallExpression
{
	private Expression receiver;

	public MethodCallExpression(Expression receiver, Token name, List<Expression> arguments, FunctionBlockExpression block)
	{
		super(name, arguments, block);
		this.receiver = receiver;
		setIsMethod();
	}

	public Expression getReceiver()
	{
		return receiver;
	}

	public void setReceiver(Expression receiver)
	{
		this.receiver = receiver;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitMethodCallExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		Token token = receiver.getFirstToken();
		return token != null ? token : super.getFirstToken();
	}

	@Override
	public String toString()
	{
		return receiver + "." + super.toString();
	}
}
