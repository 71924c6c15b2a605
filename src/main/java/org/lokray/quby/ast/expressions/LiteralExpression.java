// File: src/main/java/org/lokray/quby/ast/expressions/LiteralExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.lexer.Token;

/**
 * AST node representing a literal value: a number, a string, true, false or null.
 */
public class LiteralExpression implements Expression
{
	public enum LiteralKind
	{
		NUMBER,
		STRING,
		TRUE,
		FALSE,
		NULL
	}

	private final Token token;
	private final LiteralKind kind;

	public LiteralExpression(Token token, LiteralKind kind)
	{
		this.token = token;
		this.kind = kind;
	}

	public LiteralKind getKind()
	{
		return kind;
	}

	public String getText()
	{
		return token.getLexeme();
	}

	/**
	 * @return whether the value is truthy in Quby, where only false and null are not.
	 */
	public boolean isTrue()
	{
		return kind != LiteralKind.FALSE && kind != LiteralKind.NULL;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLiteralExpression(this);
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
