// File: src/main/java/org/lokray/quby/ast/declarations/AccessorDeclaration.java

package org.lokray.quby.ast.declarations;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.ast.expressions.FieldExpression;
import org.lokray.quby.ast.expressions.FunctionCallExpression;
import org.lokray.quby.ast.expressions.VariableExpression;
import org.lokray.quby.lexer.Token;
import org.lokray.quby.runtime.QubyRuntime;

/**
 * A getter or setter method generated by a class modifier, e.g. {@code getset :x}
 * generates {@code getX()} and {@code setX(x)} while {@code attr :x} generates
 * {@code x()} and {@code x(x)}.
 */
public class AccessorDeclaration implements CallableDeclaration
{
	public enum AccessorKind
	{
		READ(0),
		WRITE(1);

		private final int numParameters;

		AccessorKind(int numParameters)
		{
			this.numParameters = numParameters;
		}

		public int getNumParameters()
		{
			return numParameters;
		}
	}

	private final FunctionCallExpression modifier;
	private final AccessorKind kind;
	private final String fieldName;
	private final FieldExpression field;
	private final String methodName;
	private final String callName;

	/**
	 * @param modifier   the class modifier call this accessor comes from.
	 * @param kind       whether the accessor reads or writes the field.
	 * @param prefix     put before the capitalized field name to form the method name,
	 *                   when empty the method is named after the field.
	 * @param fieldToken the token naming the field.
	 * @param fieldName  the field name without any sigil.
	 */
	public AccessorDeclaration(FunctionCallExpression modifier, AccessorKind kind, String prefix, Token fieldToken, String fieldName)
	{
		this.modifier = modifier;
		this.kind = kind;
		this.fieldName = fieldName;
		this.methodName = prefix.isEmpty() ? fieldName : prefix + capitalize(fieldName);
		this.callName = QubyRuntime.formatFun(methodName, kind.getNumParameters());

		this.field = new FieldExpression(fieldToken.withLexeme("@" + fieldName));
		if (kind == AccessorKind.READ)
		{
			field.setRecordUsage(false);
		}
		else
		{
			field.markAssignment();
		}
	}

	private static String capitalize(String name)
	{
		if (name.isEmpty())
		{
			return name;
		}
		return Character.toUpperCase(name.charAt(0)) + name.substring(1);
	}

	public String getModifierName()
	{
		return modifier.getName();
	}

	public AccessorKind getKind()
	{
		return kind;
	}

	public FieldExpression getField()
	{
		return field;
	}

	@Override
	public String getName()
	{
		return methodName;
	}

	@Override
	public String getCallName()
	{
		return callName;
	}

	@Override
	public int getNumParameters()
	{
		return kind.getNumParameters();
	}

	@Override
	public boolean isFunction()
	{
		return false;
	}

	@Override
	public boolean isMethod()
	{
		return true;
	}

	@Override
	public boolean isConstructor()
	{
		return false;
	}

	@Override
	public boolean isAccessor()
	{
		return true;
	}

	@Override
	public void addPreVariable(VariableExpression variable)
	{
		// accessors have no body, nothing is ever hoisted into them
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAccessorDeclaration(this);
	}

	@Override
	public Token getFirstToken()
	{
		return modifier.getFirstToken();
	}

	@Override
	public String toString()
	{
		return getModifierName() + " " + methodName;
	}
}
