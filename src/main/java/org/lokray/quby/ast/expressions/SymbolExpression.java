// File: src/main/java/org/lokray/quby/ast/expressions/SymbolExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.lexer.Token;
import org.lokray.quby.runtime.QubyRuntime;

/**
 * AST node for a symbol such as {@code :name}. Every symbol becomes one shared string
 * constant in the pre-code.
 */
public class SymbolExpression implements Expression
{
	private final Token token;
	private final String name;
	private final String callName;

	public SymbolExpression(Token token)
	{
		this.token = token;
		String text = token.getLexeme();
		this.name = text.startsWith(":") ? text.substring(1) : text;
		this.callName = QubyRuntime.formatSymbol(name);
	}

	public String getName()
	{
		return name;
	}

	public String getCallName()
	{
		return callName;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitSymbolExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return token;
	}

	@Override
	public String toString()
	{
		return ":" + name;
	}
}
