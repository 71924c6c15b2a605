// File: src/main/java/org/lokray/quby/ast/expressions/NewExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.lexer.Token;
import org.lokray.quby.runtime.QubyRuntime;

import java.util.List;

/**
 * AST node for {@code new ClassName(args)}. The call name is the constructor's.
 */
public class NewExpression extends FunctionCallExpression
{
	private final String classCallName;
	private boolean extensionClass = false;

	public NewExpression(Token className, List<Expression> arguments, FunctionBlockExpression block)
	{
		super(className, arguments, block,
				QubyRuntime.formatNew(className.getLexeme(), arguments == null ? 0 : arguments.size()));
		this.classCallName = QubyRuntime.formatClass(className.getLexeme());
	}

	public String getClassCallName()
	{
		return classCallName;
	}

	public boolean isExtensionClass()
	{
		return extensionClass;
	}

	public void setExtensionClass(boolean extensionClass)
	{
		this.extensionClass = extensionClass;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitNewExpression(this);
	}

	@Override
	public String toString()
	{
		return "new " + super.toString();
	}
}
