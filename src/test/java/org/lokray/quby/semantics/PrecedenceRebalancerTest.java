// File: src/test/java/org/lokray/quby/semantics/PrecedenceRebalancerTest.java

package org.lokray.quby.semantics;

import org.junit.jupiter.api.Test;
import org.lokray.quby.TestAst;
import org.lokray.quby.ast.expressions.BinaryExpression;
import org.lokray.quby.ast.expressions.Expression;
import org.lokray.quby.ast.expressions.GroupingExpression;
import org.lokray.quby.ast.expressions.Operator;
import org.lokray.quby.ast.expressions.UnaryExpression;
import org.lokray.quby.ast.expressions.VariableExpression;

import static org.junit.jupiter.api.Assertions.*;

class PrecedenceRebalancerTest
{
	private final TestAst ast = new TestAst("ops.q");
	private final PrecedenceRebalancer rebalancer = new PrecedenceRebalancer();

	@Test
	void looserRightChildBecomesTheRoot()
	{
		// a * b + c, as the parser builds it: a * (b + c)
		BinaryExpression multiply = ast.binary(ast.var("a"), Operator.MULTIPLY, ast.binary(ast.var("b"), Operator.ADD, ast.var("c")));

		Expression root = rebalancer.rebalance(multiply);

		BinaryExpression add = (BinaryExpression) root;
		assertEquals(Operator.ADD, add.getOperator());
		assertSame(multiply, add.getLeft());
		assertEquals("c", ((VariableExpression) add.getRight()).getName());
		assertEquals("b", ((VariableExpression) multiply.getRight()).getName());
	}

	@Test
	void tighterRightChildStays()
	{
		BinaryExpression add = ast.binary(ast.var("a"), Operator.ADD, ast.binary(ast.var("b"), Operator.MULTIPLY, ast.var("c")));

		assertSame(add, rebalancer.rebalance(add));
		assertEquals(Operator.MULTIPLY, ((BinaryExpression) add.getRight()).getOperator());
	}

	@Test
	void longChainIsRotatedAllTheWay()
	{
		// a * b + c == d, built as a * (b + (c == d))
		BinaryExpression multiply = ast.binary(ast.var("a"), Operator.MULTIPLY,
				ast.binary(ast.var("b"), Operator.ADD,
						ast.binary(ast.var("c"), Operator.EQUAL, ast.var("d"))));

		BinaryExpression equal = (BinaryExpression) rebalancer.rebalance(multiply);

		assertEquals(Operator.EQUAL, equal.getOperator());
		BinaryExpression add = (BinaryExpression) equal.getLeft();
		assertEquals(Operator.ADD, add.getOperator());
		assertSame(multiply, add.getLeft());
		assertEquals("d", ((VariableExpression) equal.getRight()).getName());
	}

	@Test
	void equalPrecedenceIsLeftAlone()
	{
		BinaryExpression subtract = ast.binary(ast.var("a"), Operator.SUBTRACT, ast.binary(ast.var("b"), Operator.ADD, ast.var("c")));

		assertSame(subtract, rebalancer.rebalance(subtract));
	}

	@Test
	void groupingIsNotLookedThrough()
	{
		GroupingExpression group = ast.group(ast.binary(ast.var("b"), Operator.ADD, ast.var("c")));
		BinaryExpression multiply = ast.binary(ast.var("a"), Operator.MULTIPLY, group);

		assertSame(multiply, rebalancer.rebalance(multiply));
		assertSame(group, multiply.getRight());
	}

	@Test
	void unaryOperatorMovesBelowLooserOperand()
	{
		// -a + b, built as -(a + b)
		UnaryExpression negate = ast.unary(Operator.NEGATE, ast.binary(ast.var("a"), Operator.ADD, ast.var("b")));

		BinaryExpression add = (BinaryExpression) rebalancer.rebalance(negate);

		assertEquals(Operator.ADD, add.getOperator());
		assertSame(negate, add.getLeft());
		assertEquals("a", ((VariableExpression) negate.getOperand()).getName());
	}

	@Test
	void nodesAreOnlyRebalancedOnce()
	{
		BinaryExpression multiply = ast.binary(ast.var("a"), Operator.MULTIPLY, ast.binary(ast.var("b"), Operator.ADD, ast.var("c")));

		Expression root = rebalancer.rebalance(multiply);

		assertTrue(multiply.isBalanceDone());
		assertSame(root, rebalancer.rebalance(root));
		assertSame(multiply, rebalancer.rebalance(multiply));
	}

	@Test
	void nonOperatorsAreReturnedUnchanged()
	{
		VariableExpression variable = ast.var("a");
		assertSame(variable, rebalancer.rebalance(variable));
	}
}
