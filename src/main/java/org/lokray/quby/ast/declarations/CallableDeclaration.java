// File: src/main/java/org/lokray/quby/ast/declarations/CallableDeclaration.java

package org.lokray.quby.ast.declarations;

import org.lokray.quby.ast.expressions.VariableExpression;
import org.lokray.quby.ast.statements.Statement;

/**
 * Anything that can be called by name: functions, methods, constructors and the
 * accessor methods generated by class modifiers.
 */
public interface CallableDeclaration extends Statement
{
	/**
	 * @return the name as written in the source.
	 */
	String getName();

	String getCallName();

	/**
	 * @return the arity, not counting a block parameter.
	 */
	int getNumParameters();

	boolean isFunction();

	/**
	 * @return true for anything declared inside a class, constructors included.
	 */
	boolean isMethod();

	boolean isConstructor();

	boolean isAccessor();

	/**
	 * Records a variable first assigned in a nested block, so it can be declared at the
	 * top of the function body.
	 */
	void addPreVariable(VariableExpression variable);
}
