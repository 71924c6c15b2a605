// File: src/main/java/org/lokray/quby/ast/expressions/HashLiteralExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST node for a hash literal, {@code {key => value, ...}}. Each entry is a
 * {@link Operator#MAPPING} binary expression.
 */
public class HashLiteralExpression implements Expression
{
	private final Token openBrace;
	private final List<Expression> mappings;

	public HashLiteralExpression(Token openBrace, List<Expression> mappings)
	{
		this.openBrace = openBrace;
		this.mappings = mappings == null ? new ArrayList<>() : new ArrayList<>(mappings);
	}

	public List<Expression> getMappings()
	{
		return Collections.unmodifiableList(mappings);
	}

	public void setMapping(int index, Expression mapping)
	{
		mappings.set(index, mapping);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitHashLiteralExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return openBrace;
	}

	@Override
	public String toString()
	{
		return "{" + mappings + "}";
	}
}
