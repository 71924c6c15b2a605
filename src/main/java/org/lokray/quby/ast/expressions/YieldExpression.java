// File: src/main/java/org/lokray/quby/ast/expressions/YieldExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST node for 'yield', calling the block passed to the current function.
 */
public class YieldExpression implements Expression
{
	private final Token keyword;
	private final List<Expression> arguments;

	public YieldExpression(Token keyword, List<Expression> arguments)
	{
		this.keyword = keyword;
		this.arguments = arguments == null ? new ArrayList<>() : new ArrayList<>(arguments);
	}

	public List<Expression> getArguments()
	{
		return Collections.unmodifiableList(arguments);
	}

	public void setArgument(int index, Expression argument)
	{
		arguments.set(index, argument);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitYieldExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}

	@Override
	public String toString()
	{
		return "yield " + arguments;
	}
}
