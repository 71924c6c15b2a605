// File: src/main/java/org/lokray/quby/ast/declarations/AdminMethodDeclaration.java

package org.lokray.quby.ast.declarations;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.ast.statements.BlockStatement;
import org.lokray.quby.lexer.Token;

/**
 * A method that keeps its raw name in the output, so JavaScript can call it directly.
 * Only allowed in admin mode.
 */
public class AdminMethodDeclaration extends FunctionDeclaration
{
	public AdminMethodDeclaration(Token name, Parameters parameters, BlockStatement body)
	{
		super(name, parameters, body, FunctionKind.METHOD);
		setCallName(name.getLexeme());
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAdminMethodDeclaration(this);
	}
}
