// File: src/main/java/org/lokray/quby/ast/expressions/FieldExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.lexer.Token;
import org.lokray.quby.runtime.QubyRuntime;

/**
 * AST node for an object field, written {@code @name}. Fields are private to the class
 * that uses them, so the call name is only known once the enclosing class is.
 */
public class FieldExpression implements Assignable
{
	private final Token token;
	private final String name;
	private String className = null;
	private String callName = null;
	private boolean assignment = false;
	private boolean insideExtensionClass = false;
	// read accessors look at a field without counting as a use of it
	private boolean recordUsage = true;

	public FieldExpression(Token token)
	{
		this.token = token;
		String text = token.getLexeme();
		this.name = text.startsWith("@") ? text.substring(1) : text;
	}

	public String getName()
	{
		return name;
	}

	public String getClassName()
	{
		return className;
	}

	/**
	 * Binds the field to the class it is used in, which fixes its call name.
	 */
	public void setClassName(String className)
	{
		this.className = className;
		this.callName = QubyRuntime.formatField(className, name);
	}

	public String getCallName()
	{
		return callName;
	}

	/**
	 * @return the name handed to the runtime for error messages, e.g. {@code x@Point}.
	 */
	public String getDisplayName()
	{
		return name + QubyRuntime.FIELD_NAME_SEPARATOR + className;
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

	public boolean isInsideExtensionClass()
	{
		return insideExtensionClass;
	}

	public void setInsideExtensionClass(boolean insideExtensionClass)
	{
		this.insideExtensionClass = insideExtensionClass;
	}

	public boolean isRecordUsage()
	{
		return recordUsage;
	}

	public void setRecordUsage(boolean recordUsage)
	{
		this.recordUsage = recordUsage;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFieldExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return token;
	}

	@Override
	public String toString()
	{
		return "@" + name;
	}
}
