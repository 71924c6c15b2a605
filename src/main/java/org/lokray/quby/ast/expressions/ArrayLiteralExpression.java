// File: src/main/java/org/lokray/quby/ast/expressions/ArrayLiteralExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST node for an array literal, {@code [a, b, c]}.
 */
public class ArrayLiteralExpression implements Expression
{
	private final Token openBracket;
	private final List<Expression> elements;

	public ArrayLiteralExpression(Token openBracket, List<Expression> elements)
	{
		this.openBracket = openBracket;
		this.elements = elements == null ? new ArrayList<>() : new ArrayList<>(elements);
	}

	public List<Expression> getElements()
	{
		return Collections.unmodifiableList(elements);
	}

	public void setElement(int index, Expression element)
	{
		elements.set(index, element);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitArrayLiteralExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return openBracket;
	}

	@Override
	public String toString()
	{
		return elements.toString();
	}
}
