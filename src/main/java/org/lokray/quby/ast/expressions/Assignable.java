// File: src/main/java/org/lokray/quby/ast/expressions/Assignable.java

package org.lokray.quby.ast.expressions;

/**
 * An expression that may appear on the left of '='.
 */
public interface Assignable extends Expression
{
	/**
	 * Marks this expression as the target of an assignment, so it declares or writes
	 * instead of reads.
	 */
	void markAssignment();

	boolean isAssignment();
}
