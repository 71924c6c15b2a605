// File: src/main/java/org/lokray/quby/semantics/RootClassProxy.java

package org.lokray.quby.semantics;

import org.lokray.quby.ast.declarations.ClassDeclaration;
import org.lokray.quby.ast.statements.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Refers to the root class, {@code Object}, if the programs declare it. Methods added to
 * the root class are copied onto every core class when printing.
 */
public class RootClassProxy
{
	private ClassValidator rootClass = null;
	private final List<ClassDeclaration> declarations = new ArrayList<>();

	/**
	 * Records a declaration of the root class. The first one fixes the class validator.
	 */
	public void setClass(ClassValidator klass, ClassDeclaration declaration)
	{
		if (rootClass == null)
		{
			rootClass = klass;
		}
		declarations.add(declaration);
	}

	/**
	 * @return the root class, or null when it was never declared.
	 */
	public ClassValidator getClassValidator()
	{
		return rootClass;
	}

	/**
	 * @return the statements of every root class declaration, in source order. Should only
	 * be called once validation is over.
	 */
	public List<Statement> getPrintStatements()
	{
		if (declarations.isEmpty())
		{
			return Collections.emptyList();
		}

		List<Statement> statements = new ArrayList<>();
		for (ClassDeclaration declaration : declarations)
		{
			statements.addAll(declaration.getBody().getStatements());
		}
		return statements;
	}
}
