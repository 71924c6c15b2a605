// File: src/main/java/org/lokray/quby/ast/statements/WhileStatement.java

package org.lokray.quby.ast.statements;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.ast.expressions.Expression;
import org.lokray.quby.lexer.Token;

/**
 * AST node for the four loop forms: 'while' and 'until' test before the body,
 * 'do ... while' and 'do ... until' test after it.
 */
public class WhileStatement implements Statement
{
	public enum LoopKind
	{
		WHILE,
		UNTIL,
		DO_WHILE,
		DO_UNTIL;

		public boolean isPostCondition()
		{
			return this == DO_WHILE || this == DO_UNTIL;
		}

		public boolean isNegated()
		{
			return this == UNTIL || this == DO_UNTIL;
		}
	}

	private final Token keyword;
	private final LoopKind kind;
	private Expression condition;
	private final BlockStatement body;

	public WhileStatement(Token keyword, LoopKind kind, Expression condition, BlockStatement body)
	{
		this.keyword = keyword;
		this.kind = kind;
		this.condition = condition;
		this.body = body;
	}

	public LoopKind getKind()
	{
		return kind;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public void setCondition(Expression condition)
	{
		this.condition = condition;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitWhileStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}

	@Override
	public String toString()
	{
		return kind + " (" + condition + ") {\n" + body + "}";
	}
}
