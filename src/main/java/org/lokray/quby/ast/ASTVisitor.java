// File: src/main/java/org/lokray/quby/ast/ASTVisitor.java

package org.lokray.quby.ast;

import org.lokray.quby.ast.declarations.*;
import org.lokray.quby.ast.expressions.*;
import org.lokray.quby.ast.statements.*;

/**
 * Interface for the Visitor pattern that allows AST traversal.
 * Each `visit` method corresponds to a specific AST node type.
 * The compiler has two visitors: the validating pass returns {@code Void} and
 * records its findings on the Validator, the code generator returns {@code Void}
 * and writes into a Printer.
 */
public interface ASTVisitor<R>
{
	R visitProgram(Program program);

	// --- Declarations ---
	R visitClassDeclaration(ClassDeclaration declaration);

	R visitFunctionDeclaration(FunctionDeclaration declaration);

	R visitConstructorDeclaration(ConstructorDeclaration declaration);

	R visitAdminMethodDeclaration(AdminMethodDeclaration declaration);

	R visitAccessorDeclaration(AccessorDeclaration declaration);

	// --- Statements ---
	R visitBlockStatement(BlockStatement statement);

	R visitExpressionStatement(ExpressionStatement statement);

	R visitIfStatement(IfStatement statement);

	R visitWhileStatement(WhileStatement statement);

	R visitReturnStatement(ReturnStatement statement);

	R visitPreInlineStatement(PreInlineStatement statement);

	// --- Operators ---
	R visitBinaryExpression(BinaryExpression expression);

	R visitAssignmentExpression(AssignmentExpression expression);

	R visitUnaryExpression(UnaryExpression expression);

	R visitGroupingExpression(GroupingExpression expression);

	// --- Values and names ---
	R visitLiteralExpression(LiteralExpression expression);

	R visitSymbolExpression(SymbolExpression expression);

	R visitVariableExpression(VariableExpression expression);

	R visitJsVariableExpression(JsVariableExpression expression);

	R visitGlobalVariableExpression(GlobalVariableExpression expression);

	R visitFieldExpression(FieldExpression expression);

	R visitThisExpression(ThisExpression expression);

	// --- Calls ---
	R visitFunctionCallExpression(FunctionCallExpression expression);

	R visitMethodCallExpression(MethodCallExpression expression);

	R visitSuperCallExpression(SuperCallExpression expression);

	R visitNewExpression(NewExpression expression);

	R visitNewJsInstanceExpression(NewJsInstanceExpression expression);

	R visitYieldExpression(YieldExpression expression);

	// --- Collections ---
	R visitArrayAccessExpression(ArrayAccessExpression expression);

	R visitArrayLiteralExpression(ArrayLiteralExpression expression);

	R visitHashLiteralExpression(HashLiteralExpression expression);

	// --- Blocks and inlining ---
	R visitFunctionBlockExpression(FunctionBlockExpression expression);

	R visitLambdaExpression(LambdaExpression expression);

	R visitInlineExpression(InlineExpression expression);
}
