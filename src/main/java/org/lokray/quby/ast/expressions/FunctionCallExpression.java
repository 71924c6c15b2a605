// File: src/main/java/org/lokray/quby/ast/expressions/FunctionCallExpression.java

package org.lokray.quby.ast.expressions;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.ast.declarations.AccessorDeclaration;
import org.lokray.quby.lexer.Token;
import org.lokray.quby.runtime.QubyRuntime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST node for a call without a receiver, such as {@code foo(1, 2)}.
 * <p>
 * Whether it calls a free function or a method of the enclosing class is not known
 * when it is parsed. The validator decides, and {@link #setIsMethod()} records the
 * outcome. Inside a class body, outside any method, the same syntax is a class
 * modifier ({@code attr :x}) and produces accessor methods instead.
 */
public class FunctionCallExpression implements Expression
{
	private final Token name;
	private final List<Expression> arguments;
	private final FunctionBlockExpression block;
	private final String callName;
	private boolean method = false;
	private boolean insideExtensionClass = false;
	private List<AccessorDeclaration> accessors = null;

	public FunctionCallExpression(Token name, List<Expression> arguments, FunctionBlockExpression block)
	{
		this(name, arguments, block, null);
	}

	/**
	 * @param callName the call name to use, or null to derive it from the name and arity.
	 */
	protected FunctionCallExpression(Token name, List<Expression> arguments, FunctionBlockExpression block, String callName)
	{
		this.name = name;
		this.arguments = arguments == null ? new ArrayList<>() : new ArrayList<>(arguments);
		this.block = block;
		this.callName = callName != null ? callName : QubyRuntime.formatFun(name.getLexeme(), this.arguments.size());
	}

	public Token getNameToken()
	{
		return name;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public String getCallName()
	{
		return callName;
	}

	public List<Expression> getArguments()
	{
		return Collections.unmodifiableList(arguments);
	}

	public void setArgument(int index, Expression argument)
	{
		arguments.set(index, argument);
	}

	public int getNumParameters()
	{
		return arguments.size();
	}

	public FunctionBlockExpression getBlock()
	{
		return block;
	}

	public boolean isMethod()
	{
		return method;
	}

	/**
	 * Marks this call as calling a method on the current object.
	 */
	public void setIsMethod()
	{
		this.method = true;
	}

	public boolean isInsideExtensionClass()
	{
		return insideExtensionClass;
	}

	public void setInsideExtensionClass(boolean insideExtensionClass)
	{
		this.insideExtensionClass = insideExtensionClass;
	}

	/**
	 * @return the accessors this call generates as a class modifier, or null when it is
	 * an ordinary call.
	 */
	public List<AccessorDeclaration> getAccessors()
	{
		return accessors;
	}

	public void setAccessors(List<AccessorDeclaration> accessors)
	{
		this.accessors = accessors;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFunctionCallExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return name;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(name.getLexeme()).append("(");
		for (int i = 0; i < arguments.size(); i++)
		{
			sb.append(arguments.get(i));
			if (i < arguments.size() - 1)
			{
				sb.append(", ");
			}
		}
		sb.append(")");
		if (block != null)
		{
			sb.append(" ").append(block);
		}
		return sb.toString();
	}
}
