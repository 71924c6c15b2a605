// File: src/main/java/org/lokray/quby/ast/statements/ReturnStatement.java

package org.lokray.quby.ast.statements;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.ast.expressions.Expression;
import org.lokray.quby.lexer.Token;

/**
 * AST node representing a 'return' statement, with an optional value.
 */
public class ReturnStatement implements Statement
{
	private final Token keyword;
	private Expression value;

	public ReturnStatement(Token keyword, Expression value)
	{
		this.keyword = keyword;
		this.value = value;
	}

	public Expression getValue()
	{
		return value;
	}

	public void setValue(Expression value)
	{
		this.value = value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitReturnStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}

	@Override
	public String toString()
	{
		return "Return " + (value != null ? value : "");
	}
}
