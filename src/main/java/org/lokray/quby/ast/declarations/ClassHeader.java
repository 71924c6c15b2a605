// File: src/main/java/org/lokray/quby/ast/declarations/ClassHeader.java

package org.lokray.quby.ast.declarations;

import org.lokray.quby.lexer.Token;
import org.lokray.quby.runtime.QubyRuntime;

/**
 * The {@code class Name < Super} line of a class declaration.
 */
public class ClassHeader
{
	private final Token name;
	private final Token superName;

	/**
	 * @param name      the class name.
	 * @param superName the declared super class, or null when none is given.
	 */
	public ClassHeader(Token name, Token superName)
	{
		this.name = name;
		this.superName = superName;
	}

	public Token getNameToken()
	{
		return name;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public String getCallName()
	{
		return QubyRuntime.formatClass(name.getLexeme());
	}

	public boolean hasSuper()
	{
		return superName != null;
	}

	/**
	 * @return the declared super class, or the root class when none is declared.
	 */
	public String getSuperName()
	{
		return superName != null ? superName.getLexeme() : QubyRuntime.ROOT_CLASS_NAME;
	}

	public String getSuperCallName()
	{
		return QubyRuntime.formatClass(getSuperName());
	}

	@Override
	public String toString()
	{
		return name.getLexeme() + (superName != null ? " < " + superName.getLexeme() : "");
	}
}
