// File: src/main/java/org/lokray/quby/ast/expressions/SuperCallExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.lexer.Token;

import java.util.List;

/**
 * AST node for {@code super(args)} inside a constructor. It calls the super class
 * constructor with the same arity, which is looked up once every class is known.
 */
public class SuperCallExpression extends FunctionCallExpression
{
	private String superClassName = null;

	public SuperCallExpression(Token keyword, List<Expression> arguments, FunctionBlockExpression block)
	{
		super(keyword, arguments, block);
	}

	/**
	 * @return the resolved super class, or null while unresolved.
	 */
	public String getSuperClassName()
	{
		return superClassName;
	}

	public void setSuperClassName(String superClassName)
	{
		this.superClassName = superClassName;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitSuperCallExpression(this);
	}
}
