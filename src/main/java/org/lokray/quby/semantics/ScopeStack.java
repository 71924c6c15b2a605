// File: src/main/java/org/lokray/quby/semantics/ScopeStack.java

package org.lokray.quby.semantics;

import org.lokray.quby.ast.declarations.CallableDeclaration;
import org.lokray.quby.ast.expressions.VariableExpression;
import org.lokray.quby.util.Debug;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The lexical scopes of local variables, one frame per function body or block.
 * <p>
 * Lookups inside a function stop at the function's own root frame, so a function never
 * sees the variables of the code around it. Blocks on the other hand are closures and
 * see every frame up to that root. Variables first assigned inside a block of a
 * function are hoisted: when the function scope closes they are handed to the function
 * as pre-variables, to be declared at the top of its body.
 */
public class ScopeStack
{
	private final List<Map<String, VariableExpression>> frames = new ArrayList<>();
	private final List<Boolean> blockFrames = new ArrayList<>();

	// inner frames already popped while inside the current function
	private final List<Map<String, VariableExpression>> poppedFunctionFrames = new ArrayList<>();

	// number of frames belonging to the current function, its root frame included
	private int functionDepth = 0;
	private CallableDeclaration currentFunction = null;

	/**
	 * Pushes an ordinary frame.
	 */
	public void pushScope()
	{
		frames.add(new LinkedHashMap<>());
		blockFrames.add(Boolean.FALSE);

		if (isInsideFunction())
		{
			functionDepth++;
		}
	}

	/**
	 * Enters the body of a function, method, constructor or accessor.
	 *
	 * @throws IllegalStateException when already inside a function; callers reject
	 *                               nested definitions before getting here.
	 */
	public void pushFunctionScope(CallableDeclaration function)
	{
		if (currentFunction != null)
		{
			throw new IllegalStateException("Defining function '" + function.getName()
					+ "' whilst already inside function '" + currentFunction.getName() + "'");
		}

		Debug.log("entering function scope '%s'", function.getName());
		currentFunction = function;
		functionDepth++;
		frames.add(new LinkedHashMap<>());
		blockFrames.add(Boolean.FALSE);
	}

	/**
	 * Pushes the frame of a block, a closure passed to a call.
	 */
	public void pushBlockScope()
	{
		pushScope();
		blockFrames.set(blockFrames.size() - 1, Boolean.TRUE);
	}

	public void popScope()
	{
		if (frames.isEmpty())
		{
			throw new IllegalStateException("Popping a scope with no scope left on the stack");
		}

		blockFrames.remove(blockFrames.size() - 1);
		Map<String, VariableExpression> frame = frames.remove(frames.size() - 1);

		if (isInsideFunction())
		{
			functionDepth--;

			if (functionDepth <= 0)
			{
				hoistPreVariables(frame);
				Debug.log("leaving function scope '%s'", currentFunction.getName());

				currentFunction = null;
				functionDepth = 0;
				poppedFunctionFrames.clear();
			}
			else
			{
				poppedFunctionFrames.add(frame);
			}
		}
	}

	private void hoistPreVariables(Map<String, VariableExpression> rootFrame)
	{
		for (Map<String, VariableExpression> inner : poppedFunctionFrames)
		{
			for (Map.Entry<String, VariableExpression> entry : inner.entrySet())
			{
				if (!rootFrame.containsKey(entry.getKey()))
				{
					currentFunction.addPreVariable(entry.getValue());
				}
			}
		}
	}

	/**
	 * Declares the variable in the top frame.
	 */
	public void assign(VariableExpression variable)
	{
		frames.get(frames.size() - 1).put(variable.getCallName(), variable);
	}

	/**
	 * @return true when the variable is visible from the top frame.
	 */
	public boolean isDeclared(VariableExpression variable)
	{
		String callName = variable.getCallName();
		int stop = isInsideFunction() ? frames.size() - functionDepth : 0;

		for (int i = frames.size() - 1; i >= Math.max(stop, 0); i--)
		{
			if (frames.get(i).containsKey(callName))
			{
				return true;
			}
		}

		return false;
	}

	public boolean isDeclaredInCurrentFrame(VariableExpression variable)
	{
		return !frames.isEmpty() && frames.get(frames.size() - 1).containsKey(variable.getCallName());
	}

	public boolean isInsideFunction()
	{
		return currentFunction != null;
	}

	public boolean isInsideBlock()
	{
		return !blockFrames.isEmpty() && blockFrames.get(blockFrames.size() - 1);
	}

	public CallableDeclaration getCurrentFunction()
	{
		return currentFunction;
	}

	public int size()
	{
		return frames.size();
	}

	/**
	 * Drops every frame above the outermost one and leaves any function. Used to recover
	 * after a pass was aborted part way through a program.
	 */
	public void unwindToGlobal()
	{
		while (frames.size() > 1)
		{
			frames.remove(frames.size() - 1);
			blockFrames.remove(blockFrames.size() - 1);
		}
		currentFunction = null;
		functionDepth = 0;
		poppedFunctionFrames.clear();
	}
}
