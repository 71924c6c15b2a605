// File: src/main/java/org/lokray/quby/ast/declarations/Parameters.java

package org.lokray.quby.ast.declarations;

import org.lokray.quby.ast.expressions.Expression;
import org.lokray.quby.ast.expressions.VariableExpression;
import org.lokray.quby.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The parameter list of a function, constructor or block. Ordinary parameters are
 * usually variables, but the parser accepts any expression so that misuse such as a
 * field parameter can be reported. At most one {@code &block} parameter is kept aside
 * from the rest and does not count towards the arity.
 */
public class Parameters
{
	private final List<Expression> parameters = new ArrayList<>();
	private VariableExpression blockParameter = null;
	private VariableExpression extraBlockParameter = null; // a second block parameter, which is an error
	private int blockParameterPosition = -1;

	public Parameters()
	{
	}

	public Parameters(List<Expression> parameters)
	{
		for (Expression parameter : parameters)
		{
			add(parameter);
		}
	}

	public void add(Expression parameter)
	{
		if (parameter instanceof VariableExpression && ((VariableExpression) parameter).isBlockParameter())
		{
			setBlockParameter((VariableExpression) parameter);
		}
		else
		{
			parameters.add(parameter);
		}
	}

	private void setBlockParameter(VariableExpression parameter)
	{
		if (blockParameter != null)
		{
			extraBlockParameter = parameter;
		}
		else
		{
			blockParameter = parameter;
			blockParameterPosition = parameters.size();
		}
	}

	public List<Expression> getParameters()
	{
		return Collections.unmodifiableList(parameters);
	}

	public int size()
	{
		return parameters.size();
	}

	public boolean isEmpty()
	{
		return parameters.isEmpty() && blockParameter == null;
	}

	public VariableExpression getBlockParameter()
	{
		return blockParameter;
	}

	public VariableExpression getExtraBlockParameter()
	{
		return extraBlockParameter;
	}

	/**
	 * @return true when ordinary parameters follow the block parameter.
	 */
	public boolean isBlockParameterMisplaced()
	{
		return blockParameter != null && blockParameterPosition < parameters.size();
	}

	public Token getFirstToken()
	{
		if (!parameters.isEmpty())
		{
			return parameters.get(0).getFirstToken();
		}
		return blockParameter == null ? null : blockParameter.getFirstToken();
	}

	@Override
	public String toString()
	{
		List<Object> all = new ArrayList<>(parameters);
		if (blockParameter != null)
		{
			all.add("&" + blockParameter.getName());
		}
		return all.toString();
	}
}
