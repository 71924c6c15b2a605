// File: src/main/java/org/lokray/quby/ast/declarations/ConstructorDeclaration.java

package org.lokray.quby.ast.declarations;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.ast.statements.BlockStatement;
import org.lokray.quby.lexer.Token;
import org.lokray.quby.runtime.QubyRuntime;

/**
 * AST node representing a 'def new(params) ... end' constructor. Its call name depends
 * on the class it belongs to, so it is only set once the class is known.
 */
public class ConstructorDeclaration extends FunctionDeclaration
{
	private String className = null;
	private boolean extensionClass = false;

	public ConstructorDeclaration(Token keyword, Parameters parameters, BlockStatement body)
	{
		super(keyword, parameters, body, FunctionKind.CONSTRUCTOR);
	}

	/**
	 * Binds this constructor to its class.
	 */
	public void setClass(ClassDeclaration klass)
	{
		this.className = klass.getName();
		this.extensionClass = klass.isExtensionClass();
		setCallName(QubyRuntime.formatNew(className, getNumParameters()));
	}

	public String getClassName()
	{
		return className;
	}

	public boolean isExtensionClass()
	{
		return extensionClass;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitConstructorDeclaration(this);
	}
}
