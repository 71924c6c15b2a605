// File: src/main/java/org/lokray/quby/ast/expressions/VariableExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.lexer.Token;
import org.lokray.quby.runtime.QubyRuntime;

/**
 * AST node for a local variable. The same node type is used for function and block
 * parameters; a block parameter is the {@code &block} form.
 */
public class VariableExpression implements Assignable
{
	private final Token name;
	private final String callName;
	private final boolean blockParameter;
	private boolean assignment = false;
	private boolean useVar = false; // print 'var' when declaring

	public VariableExpression(Token name)
	{
		this(name, false);
	}

	public VariableExpression(Token name, boolean blockParameter)
	{
		this(name, QubyRuntime.formatVar(stripSigil(name.getLexeme())), blockParameter);
	}

	protected VariableExpression(Token name, String callName, boolean blockParameter)
	{
		this.name = name;
		this.callName = callName;
		this.blockParameter = blockParameter;
	}

	private static String stripSigil(String text)
	{
		return text.startsWith("&") ? text.substring(1) : text;
	}

	public String getName()
	{
		return stripSigil(name.getLexeme());
	}

	public String getCallName()
	{
		return callName;
	}

	public boolean isBlockParameter()
	{
		return blockParameter;
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

	public boolean isUseVar()
	{
		return useVar;
	}

	public void setUseVar(boolean useVar)
	{
		this.useVar = useVar;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitVariableExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return name;
	}

	@Override
	public String toString()
	{
		return name.getLexeme();
	}
}
