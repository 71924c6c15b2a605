// File: src/main/java/org/lokray/quby/semantics/LateFunctionBinder.java

package org.lokray.quby.semantics;

import org.lokray.quby.ast.expressions.FunctionCallExpression;
import org.lokray.quby.util.Debug;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves calls without a receiver made inside a class, such as {@code area()}, once
 * every class is known. Such a call is a method call when the class or one of its super
 * classes has the method, even if it is declared later; otherwise it must be a free
 * function.
 */
public class LateFunctionBinder
{
	private final Validator validator;

	// class call name -> class
	private final Map<String, ClassValidator> classes = new LinkedHashMap<>();
	// class call name -> target call name -> call sites in source order
	private final Map<String, Map<String, List<FunctionCallExpression>>> pendingCalls = new LinkedHashMap<>();

	private ClassValidator currentClass = null;

	public LateFunctionBinder(Validator validator)
	{
		this.validator = validator;
	}

	public void setCurrentClass(ClassValidator classValidator)
	{
		this.currentClass = classValidator;
	}

	/**
	 * Queues a call made inside the current class for resolution at the end.
	 */
	public void recordPendingCall(FunctionCallExpression call)
	{
		if (currentClass == null)
		{
			throw new IllegalStateException("Call '" + call.getName() + "' queued outside of any class");
		}

		String classCallName = currentClass.getCallName();
		classes.putIfAbsent(classCallName, currentClass);
		pendingCalls.computeIfAbsent(classCallName, k -> new LinkedHashMap<>())
				.computeIfAbsent(call.getCallName(), k -> new ArrayList<>())
				.add(call);
	}

	/**
	 * Marks every queued call as a method call where the class hierarchy has the method,
	 * leaves it as a function call where a free function exists, and reports it
	 * otherwise.
	 *
	 * @param globalFunctions the call names of all free functions.
	 */
	public void resolve(Map<String, ?> globalFunctions)
	{
		for (Map.Entry<String, Map<String, List<FunctionCallExpression>>> classEntry : pendingCalls.entrySet())
		{
			ClassValidator klass = classes.get(classEntry.getKey());

			for (Map.Entry<String, List<FunctionCallExpression>> callEntry : classEntry.getValue().entrySet())
			{
				List<FunctionCallExpression> calls = callEntry.getValue();

				if (klass.hasMethodInHierarchy(callEntry.getKey()))
				{
					Debug.log("late bound '%s' in class '%s' as a method", callEntry.getKey(), klass.getName());
					for (FunctionCallExpression call : calls)
					{
						call.setIsMethod();
					}
				}
				else if (!globalFunctions.containsKey(callEntry.getKey()))
				{
					for (FunctionCallExpression call : calls)
					{
						validator.parseError(call.getFirstToken(),
								"Function '" + call.getName() + "' called with " + call.getNumParameters()
										+ " parameters, but is not defined in this class or as a function.");
					}
				}
			}
		}
	}
}
