// File: src/main/java/org/lokray/quby/semantics/ClassValidator.java

package org.lokray.quby.semantics;

import org.lokray.quby.ast.declarations.CallableDeclaration;
import org.lokray.quby.ast.declarations.ClassDeclaration;
import org.lokray.quby.ast.declarations.ClassHeader;
import org.lokray.quby.ast.declarations.ConstructorDeclaration;
import org.lokray.quby.ast.expressions.FieldExpression;
import org.lokray.quby.ast.expressions.FunctionCallExpression;
import org.lokray.quby.runtime.QubyRuntime;
import org.lokray.quby.util.Debug;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Everything known about one class, across all of its declarations: its methods,
 * its constructors by arity, and the fields and {@code this} methods its code uses.
 * Most checks wait for {@link #endValidate()}, when every class of the program is known.
 */
public class ClassValidator
{
	private final Validator validator;
	private final ClassDeclaration klass;
	private ClassHeader header;

	private final Map<String, CallableDeclaration> methods = new LinkedHashMap<>();
	private final Map<String, FunctionCallExpression> usedMethods = new LinkedHashMap<>();
	private final TreeMap<Integer, ConstructorDeclaration> constructors = new TreeMap<>();

	private final Map<String, FieldExpression> usedFields = new LinkedHashMap<>();
	private final Map<String, FieldExpression> assignedFields = new LinkedHashMap<>();

	private boolean printed = false;

	public ClassValidator(Validator validator, ClassDeclaration klass)
	{
		this.validator = validator;
		this.klass = klass;
		this.header = klass.getHeader();
	}

	/**
	 * @return the first declaration seen for this class.
	 */
	public ClassDeclaration getClassDeclaration()
	{
		return klass;
	}

	public String getName()
	{
		return klass.getName();
	}

	public String getCallName()
	{
		return klass.getCallName();
	}

	public boolean isExtensionClass()
	{
		return klass.isExtensionClass();
	}

	public ClassHeader getHeader()
	{
		return header;
	}

	/**
	 * Takes the super class from a later declaration of the same class.
	 */
	public void adoptHeader(ClassHeader header)
	{
		this.header = header;
	}

	/**
	 * @return the class this one inherits from, or null for the root class. Classes
	 * without a declared super class inherit from the root class.
	 */
	public String getSuperCallName()
	{
		String superCallName = klass.isExtensionClass()
				? QubyRuntime.ROOT_CLASS_CALL_NAME
				: header.getSuperCallName();

		return superCallName.equals(getCallName()) ? null : superCallName;
	}

	// --- Fields ---

	public void recordFieldUse(FieldExpression field)
	{
		usedFields.put(field.getCallName(), field);
	}

	public void recordFieldAssignment(FieldExpression field)
	{
		assignedFields.put(field.getCallName(), field);
	}

	/**
	 * @return true when this class assigns a field of the same name as the given one,
	 * which may belong to another class.
	 */
	public boolean hasField(FieldExpression field)
	{
		return hasFieldCallName(QubyRuntime.formatField(getName(), field.getName()));
	}

	public boolean hasFieldCallName(String callName)
	{
		return assignedFields.containsKey(callName);
	}

	// --- Methods ---

	public void declareMethod(CallableDeclaration method)
	{
		if (methods.containsKey(method.getCallName()))
		{
			validator.parseError(method.getFirstToken(),
					"Duplicate method '" + method.getName() + "' definition in class '" + getName() + "'.");
		}

		methods.put(method.getCallName(), method);
	}

	/**
	 * States if this class declares the method itself, ignoring super classes.
	 */
	public boolean hasOwnMethod(String callName)
	{
		return methods.containsKey(callName);
	}

	/**
	 * States if this class or any class it inherits from declares the method. A super
	 * class that cannot be found ends the search.
	 */
	public boolean hasMethodInHierarchy(String callName)
	{
		Set<String> seen = new HashSet<>();
		ClassValidator current = this;

		while (current != null && seen.add(current.getCallName()))
		{
			if (current.hasOwnMethod(callName))
			{
				return true;
			}

			String superCallName = current.getSuperCallName();
			current = superCallName == null ? null : validator.getClass(superCallName);
		}

		return false;
	}

	public CallableDeclaration getMethod(String callName)
	{
		return methods.get(callName);
	}

	public Collection<CallableDeclaration> getMethods()
	{
		return Collections.unmodifiableCollection(methods.values());
	}

	/**
	 * Records a call made on 'this' inside the class, checked once every class is known.
	 */
	public void recordThisMethodUse(FunctionCallExpression call)
	{
		if (!methods.containsKey(call.getCallName()))
		{
			usedMethods.put(call.getCallName(), call);
		}
	}

	// --- Constructors ---

	public void declareConstructor(ConstructorDeclaration constructor)
	{
		int arity = constructor.getNumParameters();

		if (constructors.containsKey(arity))
		{
			validator.parseError(constructor.getFirstToken(),
					"Duplicate constructor for class '" + getName() + "' with " + arity + " parameters.");
		}

		constructors.put(arity, constructor);
	}

	public boolean hasConstructor(int arity)
	{
		return constructors.containsKey(arity);
	}

	public boolean hasNoConstructors()
	{
		return constructors.isEmpty();
	}

	public Collection<ConstructorDeclaration> getConstructors()
	{
		return Collections.unmodifiableCollection(constructors.values());
	}

	// --- Printing ---

	/**
	 * Claims the right to print this class.
	 *
	 * @return true the first time, false ever after.
	 */
	public boolean markPrinted()
	{
		if (printed)
		{
			return false;
		}
		printed = true;
		return true;
	}

	/**
	 * Runs the checks that need every class of the program to be known.
	 */
	public void endValidate()
	{
		Debug.log("end validating class '%s'", getName());
		Debug.indent();

		addDefaultConstructor();
		List<ClassValidator> superClasses = collectSuperClasses();
		checkFields(superClasses);
		checkThisMethods();

		Debug.dedent();
	}

	private void addDefaultConstructor()
	{
		if (constructors.isEmpty() && !klass.isExtensionClass())
		{
			ConstructorDeclaration constructor = new ConstructorDeclaration(
					klass.getFirstToken().withLexeme("new"), null, null);
			constructor.setClass(klass);
			declareConstructor(constructor);
		}
	}

	/**
	 * Walks up the declared super classes, reporting a missing super class or a cycle.
	 *
	 * @return the super classes found, nearest first.
	 */
	private List<ClassValidator> collectSuperClasses()
	{
		List<ClassValidator> superClasses = new ArrayList<>();
		Set<String> seen = new HashSet<>();
		seen.add(getCallName());

		ClassHeader head = header;
		while (head.hasSuper())
		{
			ClassValidator superClass = validator.getClass(head.getSuperCallName());

			if (superClass == null)
			{
				if (!QubyRuntime.isCoreClass(head.getSuperName()))
				{
					validator.parseError(klass.getFirstToken(),
							"Super class not found: '" + head.getSuperName() + "', for class '" + getName() + "'.");
				}
				break;
			}
			else if (seen.contains(superClass.getCallName()))
			{
				// one report per cycle, not one per class in it
				if (validator.markCircularInheritance(seen))
				{
					validator.parseError(klass.getFirstToken(),
							"Circular inheritance tree is found for class '" + getName() + "'.");
				}
				break;
			}
			else
			{
				superClasses.add(superClass);
				seen.add(superClass.getCallName());
				head = superClass.getHeader();
			}
		}

		return superClasses;
	}

	private void checkFields(List<ClassValidator> superClasses)
	{
		for (Map.Entry<String, FieldExpression> entry : usedFields.entrySet())
		{
			if (assignedFields.containsKey(entry.getKey()))
			{
				continue;
			}

			FieldExpression field = entry.getValue();
			ClassValidator owner = null;
			for (ClassValidator superClass : superClasses)
			{
				if (superClass.hasField(field))
				{
					owner = superClass;
					break;
				}
			}

			if (owner != null)
			{
				validator.parseError(field.getFirstToken(),
						"Field '@" + field.getName() + "' from class '" + owner.getName()
								+ "' is accessed in sub-class '" + getName()
								+ "', however fields are private to each class.");
			}
			else
			{
				validator.parseError(field.getFirstToken(),
						"Field '@" + field.getName() + "' is used in class '" + getName()
								+ "' without ever being assigned to.");
			}
		}
	}

	private void checkThisMethods()
	{
		for (FunctionCallExpression call : usedMethods.values())
		{
			if (!methods.containsKey(call.getCallName()) && !hasMethodInHierarchy(call.getCallName()))
			{
				validator.searchMissingFunAndError(call, methods.values(), getName() + " method");
			}
		}
	}

	@Override
	public String toString()
	{
		return "ClassValidator(" + getName() + ", methods=" + methods.keySet() + ", constructors=" + constructors.keySet() + ")";
	}
}
