// File: src/main/java/org/lokray/quby/ast/expressions/Expression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTNode;

/**
 * Base interface for all expression nodes in the Abstract Syntax Tree (AST).
 * Expressions are parts of the program that produce a value.
 * <p>
 * Every node that holds a child expression exposes a setter for it, because operator
 * precedence is fixed up after parsing and may hand back a different subtree root.
 */
public interface Expression extends ASTNode
{
}
