// File: src/main/java/org/lokray/quby/ast/statements/PreInlineStatement.java

package org.lokray.quby.ast.statements;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.lexer.Token;

/**
 * Raw JavaScript written as {@code #<pre# ... #>#}. It is hoisted into the pre-code
 * region and printed once, ahead of every program.
 */
public class PreInlineStatement implements Statement
{
	private static final String OPEN = "#<pre#";
	private static final String CLOSE = "#>#";

	private final Token token;
	private boolean printed = false;

	public PreInlineStatement(Token token)
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

	public boolean isPrinted()
	{
		return printed;
	}

	public void setPrinted()
	{
		this.printed = true;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitPreInlineStatement(this);
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
