// File: src/main/java/org/lokray/quby/ast/expressions/GlobalVariableExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.lexer.Token;
import org.lokray.quby.runtime.QubyRuntime;

/**
 * AST node for a global variable, written {@code $name}.
 */
public class GlobalVariableExpression implements Assignable
{
	private final Token token;
	private final String name;
	private final String callName;
	private boolean assignment = false;

	public GlobalVariableExpression(Token token)
	{
		this.token = token;
		String text = token.getLexeme();
		this.name = text.startsWith("$") ? text.substring(1) : text;
		this.callName = QubyRuntime.formatGlobal(name);
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
		return visitor.visitGlobalVariableExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return token;
	}

	@Override
	public String toString()
	{
		return "$" + name;
	}
}
