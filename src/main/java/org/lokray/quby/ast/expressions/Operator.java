// File: src/main/java/org/lokray/quby/ast/expressions/Operator.java

package org.lokray.quby.ast.expressions;

/**
 * The operators of the language with their precedence. A lower number binds tighter.
 */
public enum Operator
{
	// unary
	NEGATE("-", 1, false),
	NOT("!", 1, true),

	POWER("**", 2, false),

	MULTIPLY("*", 3, false),
	DIVIDE("/", 3, false),
	MODULUS("%", 3, false),

	ADD("+", 4, false),
	SUBTRACT("-", 4, false),

	SHIFT_LEFT("<<", 5, false),
	SHIFT_RIGHT(">>", 5, false),

	LESS_THAN("<", 6, true),
	LESS_THAN_EQUAL("<=", 6, true),
	GREATER_THAN(">", 6, true),
	GREATER_THAN_EQUAL(">=", 6, true),

	INSTANCE_OF("instanceof", 7, true),

	EQUAL("==", 8, true),
	NOT_EQUAL("!=", 8, true),

	BIT_AND("&", 9, false),
	BIT_OR("|", 9, false),

	BOOL_AND("&&", 11, false),
	BOOL_OR("||", 12, false),

	ASSIGN("=", 14, false),

	// key => value inside a hash literal
	MAPPING("=>", 100, false);

	private final String symbol;
	private final int precedence;
	private final boolean resultBool;

	Operator(String symbol, int precedence, boolean resultBool)
	{
		this.symbol = symbol;
		this.precedence = precedence;
		this.resultBool = resultBool;
	}

	public String getSymbol()
	{
		return symbol;
	}

	public int getPrecedence()
	{
		return precedence;
	}

	/**
	 * @return true when the JavaScript result is always a boolean, so it can be used as
	 * a condition without the truthiness wrapper.
	 */
	public boolean isResultBool()
	{
		return resultBool;
	}
}
