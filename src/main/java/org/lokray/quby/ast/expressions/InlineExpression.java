// File: src/main/java/org/lokray/quby/ast/expressions/InlineExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.lexer.Token;

/**
 * Raw JavaScript written as {@code #<# ... #>#}, printed where it stands.
 */
public class InlineExpression implements Expression
{
	private static final String OPEN = "#<#";
	private static final String CLOSE = "#>#";

	private final Token token;

	public InlineExpression(Token token)
	{
		this.token = token;
	}

	/**
	 * @return the JavaScript between the delimiters.
	 */
	public String getCode()
	{
		String text = token.getLexeme();
		if (text.startsWith(OPEN) && text.endsWith(CLOSE) && text.length() >= OPEN.length() + CLOSE.length())
		{
			return text.substring(OPEN.length(), text.length() - CLOSE.length());
		}
		return text;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitInlineExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return token;
	}

	@Override
	public String toString()
	{
		return token.getLexeme();
	}
}
