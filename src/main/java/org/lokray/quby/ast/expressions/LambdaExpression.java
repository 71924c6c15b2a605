// File: src/main/java/org/lokray/quby/ast/expressions/LambdaExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.ast.declarations.Parameters;
import org.lokray.quby.ast.statements.BlockStatement;
import org.lokray.quby.lexer.Token;

/**
 * A block used as a value, {@code def(x) ... end}.
 */
public class LambdaExpression extends FunctionBlockExpression
{
	public LambdaExpression(Token keyword, Parameters parameters, BlockStatement body)
	{
		super(keyword, parameters, body, false);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLambdaExpression(this);
	}
}
