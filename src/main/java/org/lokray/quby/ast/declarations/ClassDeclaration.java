// File: src/main/java/org/lokray/quby/ast/declarations/ClassDeclaration.java

package org.lokray.quby.ast.declarations;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.ast.statements.BlockStatement;
import org.lokray.quby.ast.statements.Statement;
import org.lokray.quby.lexer.Token;
import org.lokray.quby.runtime.QubyRuntime;

/**
 * AST node representing a class declaration. Declaring one of the core classes
 * ({@code Object}, {@code Array}, ...) makes it an extension class: its methods are
 * added to the JavaScript prototype instead of defining a new class.
 */
public class ClassDeclaration implements Statement
{
	private final ClassHeader header;
	private final BlockStatement body;
	private final boolean extensionClass;

	public ClassDeclaration(ClassHeader header, BlockStatement body)
	{
		this.header = header;
		this.body = body == null ? new BlockStatement() : body;
		this.extensionClass = QubyRuntime.isCoreClass(header.getName());
	}

	public ClassHeader getHeader()
	{
		return header;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	public String getName()
	{
		return header.getName();
	}

	public String getCallName()
	{
		return header.getCallName();
	}

	public boolean isExtensionClass()
	{
		return extensionClass;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitClassDeclaration(this);
	}

	@Override
	public Token getFirstToken()
	{
		return header.getNameToken();
	}

	@Override
	public String toString()
	{
		return "Class " + header + " {\n" + body + "}";
	}
}
