// File: src/main/java/org/lokray/quby/semantics/PrecedenceRebalancer.java

package org.lokray.quby.semantics;

import org.lokray.quby.ast.expressions.BalancingExpression;
import org.lokray.quby.ast.expressions.Expression;
import org.lokray.quby.ast.expressions.OperatorExpression;
import org.lokray.quby.ast.expressions.UnaryExpression;
import org.lokray.quby.util.Debug;

/**
 * Rewrites operator trees so they follow operator precedence.
 * <p>
 * The parser builds operator chains leaning right, so {@code a * b + c} arrives as
 * {@code a * (b + c)}. When a node's right child binds looser than the node itself,
 * the child becomes the root of the subtree and the node moves down into the child's
 * left spine, taking the operand it finds there as its new right side. Every node is
 * rebalanced at most once. Parentheses are never looked through.
 * <p>
 * The caller must store the returned expression in the slot the old one came from.
 */
public class PrecedenceRebalancer
{
	/**
	 * Rebalances the subtree rooted at the given expression.
	 *
	 * @return the expression now at the root of the subtree, which may be a different node.
	 */
	public Expression rebalance(Expression expression)
	{
		if (!(expression instanceof BalancingExpression))
		{
			return expression;
		}

		BalancingExpression node = (BalancingExpression) expression;
		if (node.isBalanceDone())
		{
			return node;
		}
		node.setBalanceDone();

		Expression child;
		if (node instanceof UnaryExpression)
		{
			UnaryExpression unary = (UnaryExpression) node;
			child = rebalance(unary.getOperand());
			unary.setOperand(child);
		}
		else
		{
			OperatorExpression operator = (OperatorExpression) node;
			child = rebalance(operator.getRight());
			operator.setRight(child);
		}

		if (child instanceof OperatorExpression && ((OperatorExpression) child).getPrecedence() > node.getPrecedence())
		{
			OperatorExpression newRoot = (OperatorExpression) child;
			Expression displaced = performBalanceSwap(newRoot, node, node.getPrecedence());

			if (node instanceof UnaryExpression)
			{
				((UnaryExpression) node).setOperand(displaced);
			}
			else
			{
				((OperatorExpression) node).setRight(displaced);
			}

			Debug.log("rebalanced '%s' below '%s'", node.getOperator().getSymbol(), newRoot.getOperator().getSymbol());
			return newRoot;
		}

		return node;
	}

	/**
	 * Inserts {@code newLeft} at the bottom of the left spine of {@code target}, stopping
	 * at the first operand that binds at least as tight as {@code precedence}.
	 *
	 * @return the operand that was displaced by {@code newLeft}.
	 */
	private Expression performBalanceSwap(OperatorExpression target, BalancingExpression newLeft, int precedence)
	{
		Expression left = target.getLeft();

		if (left instanceof OperatorExpression && ((OperatorExpression) left).getPrecedence() > precedence)
		{
			return performBalanceSwap((OperatorExpression) left, newLeft, precedence);
		}

		target.setLeft(newLeft);
		return left;
	}
}
