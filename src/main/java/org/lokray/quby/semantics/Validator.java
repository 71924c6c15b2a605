// File: src/main/java/org/lokray/quby/semantics/Validator.java
package org.lokray.quby.semantics;

import org.apache.log4j.Logger;
import org.lokray.quby.ast.Program;
import org.lokray.quby.ast.declarations.AccessorDeclaration;
import org.lokray.quby.ast.declarations.CallableDeclaration;
import org.lokray.quby.ast.declarations.ClassDeclaration;
import org.lokray.quby.ast.declarations.ClassHeader;
import org.lokray.quby.ast.declarations.ConstructorDeclaration;
import org.lokray.quby.ast.expressions.FieldExpression;
import org.lokray.quby.ast.expressions.FunctionCallExpression;
import org.lokray.quby.ast.expressions.GlobalVariableExpression;
import org.lokray.quby.ast.expressions.NewExpression;
import org.lokray.quby.ast.expressions.SuperCallExpression;
import org.lokray.quby.ast.expressions.SymbolExpression;
import org.lokray.quby.ast.expressions.VariableExpression;
import org.lokray.quby.ast.statements.PreInlineStatement;
import org.lokray.quby.lexer.Token;
import org.lokray.quby.runtime.QubyRuntime;
import org.lokray.quby.util.CompilerConfig;
import org.lokray.quby.util.Debug;
import org.lokray.quby.util.Diagnostic;
import org.lokray.quby.util.ErrorReporter;
import org.lokray.quby.util.ParseError;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * The state of one compilation: every program is validated against it in turn, then
 * {@link #endValidate()} runs the checks that need the whole program.
 * <p>
 * Validation has two stages. While walking each program the {@link ValidatingVisitor}
 * checks everything that can be checked locally and records the rest here: calls to
 * functions not yet seen, fields used, globals read, constructors called. Once every
 * program has been walked, {@link #endValidate()} resolves those records against
 * the complete set of classes and functions.
 */
public class Validator
{
	public static final String CRASH_MESSAGE = "Unknown issue with your code has caused the parser to crash!";

	private static final Logger LOG = Logger.getLogger(Validator.class);

	private final ErrorReporter reporter = new ErrorReporter();
	private final ValidatingVisitor visitor;

	private boolean strict;
	private boolean admin;

	// --- Scopes and context ---
	private final ScopeStack scopes = new ScopeStack();
	private ClassValidator currentClass = null;
	private boolean inParameters = false;
	private boolean inFunctionParameters = false;
	private boolean inConstructor = false;

	// --- Classes ---
	private final Map<String, ClassValidator> classes = new LinkedHashMap<>();
	private final RootClassProxy rootClass = new RootClassProxy();
	private final LateFunctionBinder lateBinder = new LateFunctionBinder(this);
	private final Set<String> circularClasses = new HashSet<>();

	// --- Functions and calls ---
	private final Map<String, CallableDeclaration> functions = new LinkedHashMap<>();
	private final List<FunctionCallExpression> usedFunctions = new ArrayList<>();
	private final Map<String, FunctionCallExpression> calledMethods = new LinkedHashMap<>();

	// --- Globals ---
	private final Set<String> assignedGlobals = new HashSet<>();
	private final Map<String, GlobalVariableExpression> usedGlobals = new LinkedHashMap<>();

	// --- Registries for code generation ---
	private final FunctionTable methodNames = new FunctionTable();
	private final SymbolTable symbols = new SymbolTable();
	private final List<PreInlineStatement> preInlines = new ArrayList<>();
	private final List<Program> programs = new ArrayList<>();

	private final Deque<DeferredCheck> deferredChecks = new ArrayDeque<>();

	public Validator(CompilerConfig config)
	{
		this.strict = config.isStrict();
		this.admin = config.isAdmin();
		this.visitor = new ValidatingVisitor(this);

		// the outermost scope, for top level code
		scopes.pushScope();
	}

	// --- Modes ---

	public void strictMode(boolean strict)
	{
		this.strict = strict;
	}

	public boolean isStrict()
	{
		return strict;
	}

	public void adminMode(boolean admin)
	{
		this.admin = admin;
	}

	public boolean isAdminMode()
	{
		return admin;
	}

	// --- Validation passes ---

	/**
	 * Validates one program. When the parser failed, its errors are reported instead and
	 * the program is not looked at.
	 *
	 * @param program     the parsed program, may be null when parsing produced nothing.
	 * @param parseErrors the errors from parsing, may be null or empty.
	 */
	public void validate(Program program, List<ParseError> parseErrors)
	{
		reporter.resetSourceName();

		if (parseErrors != null && !parseErrors.isEmpty())
		{
			for (ParseError error : parseErrors)
			{
				reporter.report(error.getSourceName(), error.getLine(), error.format());
			}
			return;
		}

		if (program == null)
		{
			// an empty submission is only worth reporting when nothing else went wrong
			if (!hasErrors())
			{
				strictError(null, "No source code provided");
			}
			return;
		}

		LOG.info("Validating " + program.getSourceName());
		Debug.indent();
		try
		{
			program.accept(visitor);
			programs.add(program);
		}
		catch (RuntimeException e)
		{
			LOG.error("Validation of " + program.getSourceName() + " failed", e);
			reporter.report(program.getSourceName(), Diagnostic.UNKNOWN_LINE, CRASH_MESSAGE);
			resetContext();
		}
		finally
		{
			Debug.dedent();
		}
	}

	/**
	 * Runs the checks that need every program to have been validated. In order:
	 * calls to undefined functions, globals read but never assigned, the checks of each
	 * class, method calls no class can answer, calls inside classes that were left
	 * unresolved, then the deferred checks in the order they were recorded.
	 */
	public void endValidate()
	{
		LOG.info("Finishing validation of " + programs.size() + " program(s), " + classes.size() + " class(es)");
		try
		{
			for (FunctionCallExpression call : usedFunctions)
			{
				if (!functions.containsKey(call.getCallName()))
				{
					searchMissingFunAndError(call, functions.values(), "function");
				}
			}

			for (Map.Entry<String, GlobalVariableExpression> global : usedGlobals.entrySet())
			{
				if (!assignedGlobals.contains(global.getKey()))
				{
					GlobalVariableExpression variable = global.getValue();
					parseError(variable.getFirstToken(), "Global used but never assigned to: '" + variable.getName() + "'.");
				}
			}

			for (ClassValidator klass : classes.values())
			{
				klass.endValidate();
			}

			checkCalledMethods();

			lateBinder.resolve(functions);

			while (!deferredChecks.isEmpty())
			{
				runDeferredCheck(deferredChecks.poll());
			}
		}
		catch (RuntimeException e)
		{
			LOG.error("Finishing validation failed", e);
			reporter.report((String) null, Diagnostic.UNKNOWN_LINE, CRASH_MESSAGE);
		}
	}

	private void checkCalledMethods()
	{
		for (FunctionCallExpression method : calledMethods.values())
		{
			boolean found = false;
			for (ClassValidator klass : classes.values())
			{
				if (klass.hasOwnMethod(method.getCallName()))
				{
					found = true;
					break;
				}
			}

			if (!found)
			{
				CallableDeclaration similar = searchForMethodLike(method);
				String name = method.getName();
				String message;

				if (similar != null && similar.getName().equalsIgnoreCase(name))
				{
					message = "Method '" + name + "' called with incorrect number of parameters, "
							+ method.getNumParameters() + " instead of " + similar.getNumParameters();
				}
				else if (similar != null)
				{
					message = "Method '" + name + "' called with " + method.getNumParameters()
							+ " parameters, but is not defined in any class. Did you mean: '" + similar.getName() + "'?";
				}
				else
				{
					message = "Method '" + name + "' called with " + method.getNumParameters()
							+ " parameters, but is not defined in any class.";
				}

				parseError(method.getFirstToken(), message);
			}
		}
	}

	private void runDeferredCheck(DeferredCheck check)
	{
		if (check instanceof DeferredCheck.SuperConstructorCheck)
		{
			checkSuperConstructor((DeferredCheck.SuperConstructorCheck) check);
		}
		else if (check instanceof DeferredCheck.NewInstanceCheck)
		{
			checkNewInstance(((DeferredCheck.NewInstanceCheck) check).getInstance());
		}
		else if (check instanceof DeferredCheck.AccessorCheck)
		{
			DeferredCheck.AccessorCheck accessorCheck = (DeferredCheck.AccessorCheck) check;
			checkAccessor(accessorCheck.getAccessor(), accessorCheck.getKlass());
		}
		else
		{
			throw new IllegalStateException("Unknown deferred check: " + check.getClass().getName());
		}
	}

	private void checkSuperConstructor(DeferredCheck.SuperConstructorCheck check)
	{
		SuperCallExpression call = check.getCall();
		ClassHeader header = check.getKlass().getHeader();
		ClassValidator superClass = getClass(header.getSuperCallName());

		if (superClass == null)
		{
			if (!QubyRuntime.isCoreClass(header.getSuperName()))
			{
				parseError(call.getFirstToken(), "Calling super to a non-existant super class: '" + header.getSuperName() + "'.");
			}
		}
		else if (!superClass.hasConstructor(call.getNumParameters()))
		{
			parseError(call.getFirstToken(), "No constructor found with " + call.getNumParameters()
					+ " parameters for super class: '" + header.getSuperName() + "'.");
		}
		else
		{
			call.setSuperClassName(superClass.getName());
		}
	}

	private void checkNewInstance(NewExpression instance)
	{
		ClassValidator klass = getClass(instance.getClassCallName());

		if (klass == null)
		{
			parseError(instance.getFirstToken(), "Making new instance of undefined class: '" + instance.getName() + "'.");
		}
		else if (klass.hasNoConstructors() && klass.isExtensionClass())
		{
			parseError(instance.getFirstToken(), "Cannot manually create new instances of '" + instance.getName()
					+ "', it doesn't have a constructor.");
		}
		else if (!klass.hasConstructor(instance.getNumParameters()))
		{
			parseError(instance.getFirstToken(), "Called constructor for class '" + instance.getName()
					+ "' with wrong number of parameters: " + instance.getNumParameters());
		}
		else
		{
			instance.setExtensionClass(klass.isExtensionClass());
		}
	}

	private void checkAccessor(AccessorDeclaration accessor, ClassValidator klass)
	{
		if (checkAccessorNameClash(accessor, klass))
		{
			FieldExpression field = accessor.getField();
			if (!klass.hasFieldCallName(field.getCallName()))
			{
				parseError(accessor.getFirstToken(), "field '" + field.getName() + "' never written to in class '"
						+ klass.getName() + "' for generating method " + accessor.getName());
			}
		}
	}

	/**
	 * Reports an accessor whose method is already declared by something else.
	 *
	 * @return true when there is no clash.
	 */
	public boolean checkAccessorNameClash(AccessorDeclaration accessor, ClassValidator klass)
	{
		CallableDeclaration current = klass.getMethod(accessor.getCallName());

		if (current != null && current != accessor)
		{
			String message = "'" + accessor.getModifierName() + "' modifier in class '" + klass.getName() + "' clashes with ";
			if (current.isAccessor())
			{
				message += "modifier '" + ((AccessorDeclaration) current).getModifierName()
						+ "', for generating: '" + accessor.getName() + "' method";
			}
			else
			{
				message += "defined method: '" + accessor.getName() + "'";
			}

			parseError(accessor.getFirstToken(), message);
			return false;
		}

		return true;
	}

	public void addDeferredCheck(DeferredCheck check)
	{
		deferredChecks.add(check);
	}

	/**
	 * Leaves every class and function after a pass was aborted part way through.
	 */
	private void resetContext()
	{
		currentClass = null;
		lateBinder.setCurrentClass(null);
		inParameters = false;
		inFunctionParameters = false;
		inConstructor = false;
		scopes.unwindToGlobal();
	}

	// --- Errors ---

	public void parseError(Token offset, String message)
	{
		reporter.report(offset, message);
	}

	/**
	 * Reports an error only in strict mode.
	 */
	public void strictError(Token offset, String message)
	{
		if (strict)
		{
			parseError(offset, message);
		}
	}

	public boolean hasErrors()
	{
		return reporter.hasErrors();
	}

	/**
	 * @return all diagnostics, sorted by source name and then line.
	 */
	public List<Diagnostic> getErrors()
	{
		return reporter.getDiagnostics();
	}

	// --- Context checks ---
	// Each reports the message when the check fails and returns whether it passed.

	private boolean ensureTest(boolean test, Token offset, String message)
	{
		if (!test)
		{
			parseError(offset, message);
		}
		return test;
	}

	public boolean ensureInClass(Token offset, String message)
	{
		return ensureTest(isInsideClass(), offset, message);
	}

	public boolean ensureInMethod(Token offset, String message)
	{
		return ensureTest(isInsideFun() && isInsideClass(), offset, message);
	}

	public boolean ensureInConstructor(Token offset, String message)
	{
		return ensureTest(isInsideFun() && isInsideClass() && isConstructor(), offset, message);
	}

	public boolean ensureInFun(Token offset, String message)
	{
		return ensureTest(isInsideFun(), offset, message);
	}

	public boolean ensureOutFun(Token offset, String message)
	{
		return ensureTest(!isInsideFun(), offset, message);
	}

	public boolean ensureOutBlock(Token offset, String message)
	{
		return ensureTest(!isInsideBlock(), offset, message);
	}

	public boolean ensureAdminMode(Token offset, String message)
	{
		return ensureTest(isAdminMode(), offset, message);
	}

	public boolean ensureOutParameters(Token offset, String message)
	{
		return ensureTest(!inParameters, offset, message);
	}

	public boolean ensureOutFunParameters(Token offset, String message)
	{
		return ensureTest(!isInsideFunParameters(), offset, message);
	}

	public boolean ensureInFunParameters(Token offset, String message)
	{
		return ensureTest(isInsideFunParameters(), offset, message);
	}

	// --- Classes ---

	/**
	 * Enters a class declaration. Declarations of a class that was seen before extend it.
	 */
	public ClassValidator setClass(ClassDeclaration klass)
	{
		if (currentClass != null)
		{
			parseError(klass.getFirstToken(), "Class '" + klass.getName() + "' is defined inside '"
					+ currentClass.getName() + "', cannot define a class within a class.");
		}

		ClassValidator classValidator = classes.get(klass.getCallName());
		if (classValidator == null)
		{
			classValidator = new ClassValidator(this, klass);
			classes.put(klass.getCallName(), classValidator);
		}
		else
		{
			ClassHeader oldHeader = classValidator.getHeader();
			ClassHeader newHeader = klass.getHeader();

			// the super class may be given by a later declaration
			if (!oldHeader.hasSuper() && newHeader.hasSuper())
			{
				classValidator.adoptHeader(newHeader);
			}
			else if (oldHeader.hasSuper() && newHeader.hasSuper()
					&& !oldHeader.getSuperCallName().equals(newHeader.getSuperCallName()))
			{
				parseError(klass.getFirstToken(), "Super class cannot be redefined for class '" + klass.getName() + "'.");
			}
		}

		if (klass.getCallName().equals(QubyRuntime.ROOT_CLASS_CALL_NAME))
		{
			rootClass.setClass(classValidator, klass);
		}
		lateBinder.setCurrentClass(classValidator);

		Debug.log("entering class '%s'", klass.getName());
		currentClass = classValidator;
		return classValidator;
	}

	public void unsetClass()
	{
		currentClass = null;
	}

	/**
	 * Re-enters a class after a wrongly nested class declaration was left.
	 */
	public void resumeClass(ClassValidator klass)
	{
		currentClass = klass;
		lateBinder.setCurrentClass(klass);
	}

	/**
	 * @return the class with the given call name, or null if no program declares it.
	 */
	public ClassValidator getClass(String callName)
	{
		return classes.get(callName);
	}

	public ClassValidator getCurrentClass()
	{
		return currentClass;
	}

	public RootClassProxy getRootClass()
	{
		return rootClass;
	}

	public boolean isInsideClass()
	{
		return currentClass != null;
	}

	public boolean isInsideExtensionClass()
	{
		return currentClass != null && currentClass.isExtensionClass();
	}

	/**
	 * @return true directly inside a class body, outside of any method.
	 */
	public boolean isInsideClassDefinition()
	{
		return isInsideClass() && !isInsideFun();
	}

	/**
	 * Records the classes of an inheritance cycle.
	 *
	 * @return true when none of them was part of a reported cycle before.
	 */
	boolean markCircularInheritance(Set<String> classCallNames)
	{
		boolean isNew = Collections.disjoint(circularClasses, classCallNames);
		circularClasses.addAll(classCallNames);
		return isNew;
	}

	public void useField(FieldExpression field)
	{
		currentClass.recordFieldUse(field);
	}

	public void assignField(FieldExpression field)
	{
		currentClass.recordFieldAssignment(field);
	}

	public void useThisClassFun(FunctionCallExpression call)
	{
		currentClass.recordThisMethodUse(call);
	}

	public void setInConstructor(boolean inConstructor)
	{
		this.inConstructor = inConstructor;
	}

	// --- Parameters ---

	/**
	 * @param inParameters         true while validating a parameter list.
	 * @param inFunctionParameters true when that list belongs to a function rather than a block.
	 */
	public void setParameters(boolean inParameters, boolean inFunctionParameters)
	{
		this.inParameters = inParameters;
		this.inFunctionParameters = inFunctionParameters;
	}

	public boolean isInsideParameters()
	{
		return inParameters;
	}

	public boolean isInsideFunParameters()
	{
		return inParameters && inFunctionParameters;
	}

	// --- Scopes ---

	public void pushScope()
	{
		scopes.pushScope();
	}

	public void pushFunScope(CallableDeclaration function)
	{
		scopes.pushFunctionScope(function);
	}

	public void pushBlockScope()
	{
		scopes.pushBlockScope();
	}

	public void popScope()
	{
		scopes.popScope();
	}

	public boolean isInsideFun()
	{
		return scopes.isInsideFunction();
	}

	public boolean isInsideBlock()
	{
		return scopes.isInsideBlock();
	}

	public CallableDeclaration getCurrentFun()
	{
		return scopes.getCurrentFunction();
	}

	public boolean isConstructor()
	{
		CallableDeclaration function = scopes.getCurrentFunction();
		return function != null && function.isConstructor();
	}

	public void assignVar(VariableExpression variable)
	{
		scopes.assign(variable);
	}

	public boolean containsVar(VariableExpression variable)
	{
		return scopes.isDeclared(variable);
	}

	public boolean containsLocalVar(VariableExpression variable)
	{
		return scopes.isDeclaredInCurrentFrame(variable);
	}

	// --- Globals ---

	public void assignGlobal(GlobalVariableExpression global)
	{
		assignedGlobals.add(global.getCallName());
	}

	public void useGlobal(GlobalVariableExpression global)
	{
		usedGlobals.put(global.getCallName(), global);
	}

	// --- Functions ---

	/**
	 * Declares a function, or a method or constructor of the current class.
	 */
	public void defineFun(CallableDeclaration function)
	{
		if (currentClass != null)
		{
			if (function.isConstructor())
			{
				currentClass.declareConstructor((ConstructorDeclaration) function);
			}
			else
			{
				currentClass.declareMethod(function);
				methodNames.add(function.getCallName(), function.getName());
			}
		}
		else
		{
			if (functions.containsKey(function.getCallName()))
			{
				parseError(function.getFirstToken(), "Function is already defined: '" + function.getName()
						+ "', with " + function.getNumParameters() + " parameters.");
			}

			functions.put(function.getCallName(), function);
		}
	}

	/**
	 * Records a call. Method calls are checked against all classes at the end. Inside a
	 * class a receiver-less call is a method call when the class already has the method,
	 * otherwise it waits for the late binder. Anywhere else it must be a function.
	 */
	public void useFun(FunctionCallExpression call)
	{
		if (call.isMethod())
		{
			calledMethods.put(call.getCallName(), call);
		}
		else if (isInsideClass())
		{
			if (currentClass.hasOwnMethod(call.getCallName()))
			{
				call.setIsMethod();
			}
			else
			{
				lateBinder.recordPendingCall(call);
			}
		}
		else if (!functions.containsKey(call.getCallName()))
		{
			usedFunctions.add(call);
		}
	}

	public Map<String, CallableDeclaration> getFunctions()
	{
		return Collections.unmodifiableMap(functions);
	}

	// --- Missing function search ---

	/**
	 * Looks for a method across all classes with the same name as the call, or failing
	 * that with a get/set variation of it.
	 *
	 * @return the closest method, or null.
	 */
	public CallableDeclaration searchForMethodLike(FunctionCallExpression call)
	{
		return searchForMethodLike(call, null);
	}

	/**
	 * As {@link #searchForMethodLike(FunctionCallExpression)}, searching only the given
	 * class when it is not null.
	 */
	public CallableDeclaration searchForMethodLike(FunctionCallExpression call, ClassValidator klass)
	{
		String name = call.getName().toLowerCase(Locale.ROOT);

		if (klass != null)
		{
			return searchMissingFunction(name, klass.getMethods());
		}

		CallableDeclaration alternative = null;
		for (ClassValidator candidate : classes.values())
		{
			CallableDeclaration found = searchMissingFunction(name, candidate.getMethods());

			if (found != null)
			{
				if (found.getName().toLowerCase(Locale.ROOT).equals(name))
				{
					return found;
				}
				else if (alternative == null)
				{
					alternative = found;
				}
			}
		}

		return alternative;
	}

	/**
	 * Finds a declaration with the given name, compared without case. A declaration with
	 * the exact name wins; otherwise the first one whose name is a get/set variation is
	 * returned: {@code getFoo} or {@code setFoo} for {@code foo}, and {@code foo} for
	 * {@code getFoo}.
	 *
	 * @param name       the lowercase name searched for.
	 * @param candidates the declarations to search.
	 * @return the declaration found, or null.
	 */
	public CallableDeclaration searchMissingFunction(String name, Collection<? extends CallableDeclaration> candidates)
	{
		List<String> alternativeNames = new ArrayList<>();
		if (name.length() > 3 && QubyRuntime.ACCESSOR_PREFIXES.contains(name.substring(0, 3)))
		{
			alternativeNames.add(name.substring(3));
		}
		else
		{
			for (String prefix : QubyRuntime.ACCESSOR_PREFIXES)
			{
				alternativeNames.add(prefix + name);
			}
		}

		CallableDeclaration alternative = null;
		for (CallableDeclaration candidate : candidates)
		{
			String candidateName = candidate.getName().toLowerCase(Locale.ROOT);

			if (candidateName.equals(name))
			{
				return candidate;
			}
			else if (alternative == null && alternativeNames.contains(candidateName))
			{
				alternative = candidate;
			}
		}

		return alternative;
	}

	/**
	 * Reports a call to something that does not exist, suggesting what was meant.
	 *
	 * @param kind what was called, e.g. "function" or "Foo method".
	 */
	public void searchMissingFunAndError(FunctionCallExpression call, Collection<? extends CallableDeclaration> candidates, String kind)
	{
		String name = call.getName();
		CallableDeclaration found = searchMissingFunction(name.toLowerCase(Locale.ROOT), candidates);
		String message;

		if (found != null && found.getName().equalsIgnoreCase(name))
		{
			message = "Called " + kind + " '" + name + "' with wrong number of parameters.";
		}
		else if (found != null)
		{
			message = "Called " + kind + " '" + name + "', but it is not defined, did you mean: '" + found.getName() + "'.";
		}
		else
		{
			message = "Undefined " + kind + " called: '" + name + "'.";
		}

		parseError(call.getFirstToken(), message);
	}

	// --- Registries ---

	public void addSymbol(SymbolExpression symbol)
	{
		symbols.add(symbol);
	}

	public void addPreInline(PreInlineStatement preInline)
	{
		preInlines.add(preInline);
	}

	public FunctionTable getMethodNames()
	{
		return methodNames;
	}

	public SymbolTable getSymbols()
	{
		return symbols;
	}

	public List<PreInlineStatement> getPreInlines()
	{
		return Collections.unmodifiableList(preInlines);
	}

	/**
	 * @return the programs validated without an internal failure, in submission order.
	 */
	public List<Program> getPrograms()
	{
		return Collections.unmodifiableList(programs);
	}
}
