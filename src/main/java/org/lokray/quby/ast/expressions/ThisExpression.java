// File: src/main/java/org/lokray/quby/ast/expressions/ThisExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.lexer.Token;

/**
 * AST node for 'this'.
 */
public class ThisExpression implements Expression
{
	private final Token keyword;
	private boolean insideExtensionClass = false;

	public ThisExpression(Token keyword)
	{
		this.keyword = keyword;
	}

	public boolean isInsideExtensionClass()
	{
		return insideExtensionClass;
	}

	public void setInsideExtensionClass(boolean insideExtensionClass)
	{
		this.insideExtensionClass = insideExtensionClass;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitThisExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}

	@Override
	public String toString()
	{
		return "this";
	}
}
