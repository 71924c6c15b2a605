// File: src/main/java/org/lokray/quby/ast/expressions/FunctionBlockExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.ast.declarations.Parameters;
import org.lokray.quby.ast.statements.BlockStatement;
import org.lokray.quby.lexer.Token;

/**
 * AST node for a block passed to a call, {@code do |x| ... end} or {@code { |x| ... }}.
 */
public class FunctionBlockExpression implements Expression
{
	private final Token open;
	private final Parameters parameters;
	private final BlockStatement body;
	// opened with 'do' and closed with '}', or the other way round
	private final boolean mismatchedBraces;

	public FunctionBlockExpression(Token open, Parameters parameters, BlockStatement body, boolean mismatchedBraces)
	{
		this.open = open;
		this.parameters = parameters == null ? new Parameters() : parameters;
		this.body = body == null ? new BlockStatement() : body;
		this.mismatchedBraces = mismatchedBraces;
	}

	public Parameters getParameters()
	{
		return parameters;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	public boolean isMismatchedBraces()
	{
		return mismatchedBraces;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFunctionBlockExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return open;
	}

	@Override
	public String toString()
	{
		return "do |" + parameters + "|\n" + body + "end";
	}
}
