// File: src/main/java/org/lokray/quby/ast/expressions/JsVariableExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.lexer.Token;

/**
 * A JavaScript variable referenced as {@code #name}. It keeps its raw name in the
 * output and is only allowed in admin mode.
 */
public class JsVariableExpression extends VariableExpression
{
	public JsVariableExpression(Token name)
	{
		super(name, rawName(name.getLexeme()), false);
	}

	private static String rawName(String text)
	{
		return text.startsWith("#") ? text.substring(1) : text;
	}

	@Override
	public String getName()
	{
		return getCallName();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitJsVariableExpression(this);
	}
}
