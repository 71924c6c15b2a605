// File: src/main/java/org/lokray/quby/ast/statements/Statement.java

package org.lokray.quby.ast.statements;

import org.lokray.quby.ast.ASTNode;

/**
 * Base interface for all statement nodes. Declarations are statements as well, since
 * classes and functions may appear anywhere a statement can.
 */
public interface Statement extends ASTNode
{
}
