// File: src/main/java/org/lokray/quby/ast/expressions/ArrayAccessExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.lexer.Token;

/**
 * AST node representing array or hash element access (e.g., arr[index]).
 */
public class ArrayAccessExpression implements Assignable
{
	private Expression array;
	private Expression index;
	private boolean assignment = false;

	public ArrayAccessExpression(Expression array, Expression index)
	{
		this.array = array;
		this.index = index;
	}

	public Expression getArray()
	{
		return array;
	}

	public void setArray(Expression array)
	{
		this.array = array;
	}

	public Expression getIndex()
	{
		return index;
	}

	public void setIndex(Expression index)
	{
		this.index = index;
	}

	@Override
	public void markAssignment()
	{
		this.assignment = true;
	}

	@Override
	public boolean isAssignment()
	{
		return assignment;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitArrayAccessExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return array.getFirstToken();
	}

	@Override
	public String toString()
	{
		return array + "[" + index + "]";
	}
}
