// File: src/main/java/org/lokray/quby/ast/expressions/NewJsInstanceExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST node for {@code new #JsType(args)}, creating a JavaScript object directly.
 */
public class NewJsInstanceExpression implements Expression
{
	private final Token keyword;
	private Expression target;
	private final List<Expression> arguments;
	private final FunctionBlockExpression block;

	public NewJsInstanceExpression(Token keyword, Expression target, List<Expression> arguments, FunctionBlockExpression block)
	{
		this.keyword = keyword;
		this.target = target;
		this.arguments = arguments == null ? new ArrayList<>() : new ArrayList<>(arguments);
		this.block = block;
	}

	public Expression getTarget()
	{
		return target;
	}

	public void setTarget(Expression target)
	{
		this.target = target;
	}

	public List<Expression> getArguments()
	{
		return Collections.unmodifiableList(arguments);
	}

	public void setArgument(int index, Expression argument)
	{
		arguments.set(index, argument);
	}

	public FunctionBlockExpression getBlock()
	{
		return block;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitNewJsInstanceExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}

	@Override
	public String toString()
	{
		return "new " + target + arguments;
	}
}
