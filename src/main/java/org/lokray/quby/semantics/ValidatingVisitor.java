// File: src/main/java/org/lokray/quby/semantics/ValidatingVisitor.java
package org.lokray.quby.semantics;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.ast.Program;
import org.lokray.quby.ast.declarations.AccessorDeclaration;
import org.lokray.quby.ast.declarations.AccessorDeclaration.AccessorKind;
import org.lokray.quby.ast.declarations.AdminMethodDeclaration;
import org.lokray.quby.ast.declarations.CallableDeclaration;
import org.lokray.quby.ast.declarations.ClassDeclaration;
import org.lokray.quby.ast.declarations.ClassHeader;
import org.lokray.quby.ast.declarations.ConstructorDeclaration;
import org.lokray.quby.ast.declarations.FunctionDeclaration;
import org.lokray.quby.ast.declarations.Parameters;
import org.lokray.quby.ast.expressions.*;
import org.lokray.quby.ast.statements.BlockStatement;
import org.lokray.quby.ast.statements.ExpressionStatement;
import org.lokray.quby.ast.statements.IfStatement;
import org.lokray.quby.ast.statements.PreInlineStatement;
import org.lokray.quby.ast.statements.ReturnStatement;
import org.lokray.quby.ast.statements.Statement;
import org.lokray.quby.ast.statements.WhileStatement;
import org.lokray.quby.runtime.QubyRuntime;
import org.lokray.quby.util.Debug;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Walks one program and applies the checks that only need the node and its context.
 * Everything that depends on the rest of the programs is recorded on the
 * {@link Validator} for {@link Validator#endValidate()}.
 * <p>
 * Every expression slot goes through {@link #check(Expression)}, which rebalances the
 * operator tree in it and stores the new root back in the slot.
 */
public class ValidatingVisitor implements ASTVisitor<Void>
{
	private final Validator validator;
	private final PrecedenceRebalancer rebalancer = new PrecedenceRebalancer();

	public ValidatingVisitor(Validator validator)
	{
		this.validator = validator;
	}

	/**
	 * Rebalances and validates an expression.
	 *
	 * @return the expression to store back where this one came from.
	 */
	private Expression check(Expression expression)
	{
		if (expression == null)
		{
			return null;
		}

		Expression root = rebalancer.rebalance(expression);
		root.accept(this);
		return root;
	}

	private void visitStatements(List<Statement> statements)
	{
		for (Statement statement : statements)
		{
			statement.accept(this);
		}
	}

	@Override
	public Void visitProgram(Program program)
	{
		Debug.log("program '%s', %d statement(s)", program.getSourceName(), program.getStatements().size());
		visitStatements(program.getStatements());
		return null;
	}

	// --- Declarations ---

	@Override
	public Void visitClassDeclaration(ClassDeclaration declaration)
	{
		String name = declaration.getName();
		ClassValidator outer = validator.getCurrentClass();

		validator.ensureOutFun(declaration.getFirstToken(), "Class '" + name + "' defined within a function, this is not allowed.");
		validator.ensureOutBlock(declaration.getFirstToken(), "Class '" + name + "' defined within a block, this is not allowed.");

		validator.setClass(declaration);
		validateHeader(declaration.getHeader());

		Debug.indent();
		visitStatements(declaration.getBody().getStatements());
		Debug.dedent();

		if (outer != null)
		{
			validator.resumeClass(outer);
		}
		else
		{
			validator.unsetClass();
		}
		return null;
	}

	private void validateHeader(ClassHeader header)
	{
		if (!header.hasSuper())
		{
			return;
		}

		String name = header.getName().toLowerCase(Locale.ROOT);
		String superName = header.getSuperName().toLowerCase(Locale.ROOT);

		if (name.equals(superName))
		{
			validator.parseError(header.getNameToken(), "Class '" + header.getName() + "' is extending itself.");
		}
		else if (superName.equals(QubyRuntime.ROOT_CLASS_NAME))
		{
			// naming the root class explicitly changes nothing
			return;
		}
		else if (QubyRuntime.isCoreClass(name))
		{
			validator.parseError(header.getNameToken(), "Core class '" + header.getName()
					+ "' cannot extend alternate class '" + header.getSuperName() + "'.");
		}
		else if (QubyRuntime.isCoreClass(superName))
		{
			validator.parseError(header.getNameToken(), "Class '" + header.getName()
					+ "' cannot extend core class '" + header.getSuperName() + "'.");
		}
	}

	@Override
	public Void visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		if (declaration.isFunction() && validator.isInsideClass())
		{
			declaration.setKind(FunctionDeclaration.FunctionKind.METHOD);
		}

		validateFunction(declaration);
		return null;
	}

	/**
	 * Shared by functions, methods, constructors and admin methods.
	 */
	private void validateFunction(FunctionDeclaration declaration)
	{
		boolean isOutFun = true;

		if (validator.isInsideFun())
		{
			CallableDeclaration other = validator.getCurrentFun();
			String otherType = other.isMethod() ? "method" : "function";

			validator.parseError(declaration.getFirstToken(), "Function '" + declaration.getName()
					+ "' is defined within " + otherType + " '" + other.getName() + "', this is not allowed.");
			isOutFun = false;
		}
		else
		{
			String type = declaration.isMethod() ? "Method" : "Function";
			validator.ensureOutBlock(declaration.getFirstToken(), type + " '" + declaration.getName()
					+ "' is within a block, this is not allowed.");
		}

		if (isOutFun)
		{
			validator.defineFun(declaration);
			validator.pushFunScope(declaration);
		}

		validator.setParameters(true, true);
		validateParameters(declaration.getParameters());
		validator.setParameters(false, false);

		visitStatements(declaration.getBody().getStatements());

		if (isOutFun)
		{
			validator.popScope();
		}
	}

	private void validateParameters(Parameters parameters)
	{
		VariableExpression blockParameter = parameters.getBlockParameter();
		if (blockParameter != null)
		{
			if (parameters.getExtraBlockParameter() != null)
			{
				validator.parseError(parameters.getExtraBlockParameter().getFirstToken(), "Only one block parameter is allowed.");
			}
			else if (parameters.isBlockParameterMisplaced())
			{
				validator.parseError(blockParameter.getFirstToken(), "Block parameter must be the last parameter.");
			}
		}

		for (Expression parameter : parameters.getParameters())
		{
			parameter.accept(this);
		}

		if (blockParameter != null)
		{
			blockParameter.accept(this);
		}
	}

	@Override
	public Void visitConstructorDeclaration(ConstructorDeclaration declaration)
	{
		if (validator.ensureInClass(declaration.getFirstToken(), "Constructors must be defined within a class."))
		{
			ClassValidator klass = validator.getCurrentClass();
			declaration.setClass(klass.getClassDeclaration());

			if (klass.isExtensionClass())
			{
				validator.ensureAdminMode(declaration.getFirstToken(), "Cannot add constructor to core class: '" + klass.getName() + "'");
			}

			validator.setInConstructor(true);
			validateFunction(declaration);
			validator.setInConstructor(false);
		}
		return null;
	}

	@Override
	public Void visitAdminMethodDeclaration(AdminMethodDeclaration declaration)
	{
		validator.ensureAdminMode(declaration.getFirstToken(), "Admin (or hash) methods cannot be defined without admin rights.");

		if (validator.ensureInClass(declaration.getFirstToken(), "Admin methods can only be defined within a class."))
		{
			validateFunction(declaration);
		}
		return null;
	}

	/**
	 * Declares an accessor produced by a class modifier. Whether its field is ever
	 * written is only known once the whole class has been seen.
	 */
	@Override
	public Void visitAccessorDeclaration(AccessorDeclaration declaration)
	{
		ClassValidator klass = validator.getCurrentClass();

		if (validator.checkAccessorNameClash(declaration, klass))
		{
			validator.defineFun(declaration);
			validator.pushFunScope(declaration);
			declaration.getField().accept(this);
			validator.popScope();

			validator.addDeferredCheck(new DeferredCheck.AccessorCheck(declaration, klass));
		}
		return null;
	}

	// --- Statements ---

	@Override
	public Void visitBlockStatement(BlockStatement statement)
	{
		visitStatements(statement.getStatements());
		return null;
	}

	@Override
	public Void visitExpressionStatement(ExpressionStatement statement)
	{
		statement.setExpression(check(statement.getExpression()));
		return null;
	}

	@Override
	public Void visitIfStatement(IfStatement statement)
	{
		for (IfStatement.Branch branch : statement.getBranches())
		{
			branch.setCondition(check(branch.getCondition()));
			branch.getBody().accept(this);
		}

		if (statement.getElseBranch() != null)
		{
			statement.getElseBranch().accept(this);
		}
		return null;
	}

	@Override
	public Void visitWhileStatement(WhileStatement statement)
	{
		statement.setCondition(check(statement.getCondition()));
		statement.getBody().accept(this);
		return null;
	}

	@Override
	public Void visitReturnStatement(ReturnStatement statement)
	{
		if (!validator.isInsideFun() && !validator.isInsideBlock())
		{
			validator.parseError(statement.getFirstToken(), "Return cannot be used outside a function or a block.");
		}

		statement.setValue(check(statement.getValue()));
		return null;
	}

	@Override
	public Void visitPreInlineStatement(PreInlineStatement statement)
	{
		validator.ensureAdminMode(statement.getFirstToken(), "inlining pre-JavaScript is not allowed outside of admin mode");
		validator.addPreInline(statement);
		return null;
	}

	// --- Operators ---

	@Override
	public Void visitBinaryExpression(BinaryExpression expression)
	{
		if (expression.getOperator() == Operator.INSTANCE_OF)
		{
			validateInstanceOf(expression);
		}
		else
		{
			expression.setRight(check(expression.getRight()));
			expression.setLeft(check(expression.getLeft()));
		}
		return null;
	}

	private void validateInstanceOf(BinaryExpression expression)
	{
		Expression right = expression.getRight();

		if (right instanceof JsVariableExpression)
		{
			if (validator.ensureAdminMode(expression.getFirstToken(), "JS inlining for instance check, is not allowed in Sandbox mode"))
			{
				expression.setRight(check(right));
				expression.setLeft(check(expression.getLeft()));
			}
		}
		else if (right instanceof VariableExpression)
		{
			// the right side names a class, it is not a variable read
			expression.setLeft(check(expression.getLeft()));
		}
		else
		{
			validator.parseError(expression.getFirstToken(), "expecting a class name for instance check");
		}
	}

	@Override
	public Void visitAssignmentExpression(AssignmentExpression expression)
	{
		Expression target = expression.getLeft();

		if (target instanceof Assignable)
		{
			((Assignable) target).markAssignment();
			if (target instanceof ArrayAccessExpression)
			{
				expression.setCollectionMode();
			}

			expression.setRight(check(expression.getRight()));
			expression.setLeft(check(target));
		}
		else if (target instanceof ThisExpression)
		{
			validator.parseError(target.getFirstToken(), "cannot assign a value to 'this'");
			expression.setRight(check(expression.getRight()));
		}
		else
		{
			validator.parseError(target.getFirstToken(), "Illegal assignment");
		}
		return null;
	}

	@Override
	public Void visitUnaryExpression(UnaryExpression expression)
	{
		expression.setOperand(check(expression.getOperand()));
		return null;
	}

	@Override
	public Void visitGroupingExpression(GroupingExpression expression)
	{
		expression.setExpression(check(expression.getExpression()));
		return null;
	}

	// --- Values and names ---

	@Override
	public Void visitLiteralExpression(LiteralExpression expression)
	{
		return null;
	}

	@Override
	public Void visitSymbolExpression(SymbolExpression expression)
	{
		validator.addSymbol(expression);
		return null;
	}

	@Override
	public Void visitVariableExpression(VariableExpression expression)
	{
		if (expression.isBlockParameter())
		{
			validator.ensureInFunParameters(expression.getFirstToken(), "Block parameters must be defined within a functions parameters.");
		}

		if (expression.isAssignment())
		{
			validator.assignVar(expression);
			// inside a block the variable may belong to the enclosing function
			expression.setUseVar(!validator.isInsideBlock());
		}
		else if (validator.isInsideParameters())
		{
			if (validator.containsLocalVar(expression))
			{
				validator.parseError(expression.getFirstToken(), "parameter variable name used multiple times '" + expression.getName() + "'");
			}
			validator.assignVar(expression);
		}
		else if (!validator.containsVar(expression))
		{
			validator.parseError(expression.getFirstToken(), "variable used before it's assigned to '" + expression.getName() + "'");
		}
		return null;
	}

	/**
	 * JavaScript variables live in the host environment, so reading one is never checked.
	 */
	@Override
	public Void visitJsVariableExpression(JsVariableExpression expression)
	{
		if (validator.ensureOutParameters(expression.getFirstToken(), "JS variable used as block parameter")
				&& validator.ensureAdminMode(expression.getFirstToken(), "inlining JS values not allowed in sandboxed mode"))
		{
			if (expression.isAssignment())
			{
				validator.assignVar(expression);
				expression.setUseVar(!validator.isInsideBlock());
			}
		}
		return null;
	}

	@Override
	public Void visitGlobalVariableExpression(GlobalVariableExpression expression)
	{
		String name = expression.getName();

		if (expression.isAssignment())
		{
			if (name.isEmpty())
			{
				validator.parseError(expression.getFirstToken(), "Global variable name is blank");
			}
			else
			{
				validator.assignGlobal(expression);
			}
		}
		else if (validator.ensureOutFunParameters(expression.getFirstToken(), "global variable '" + name + "' used as function parameter")
				&& validator.ensureOutParameters(expression.getFirstToken(), "global variable '" + name + "' used as block parameter"))
		{
			validator.useGlobal(expression);
		}
		return null;
	}

	@Override
	public Void visitFieldExpression(FieldExpression expression)
	{
		String name = expression.getName();

		if (validator.ensureOutFunParameters(expression.getFirstToken(), "class field '" + name + "' used as function parameter.")
				&& validator.ensureOutParameters(expression.getFirstToken(), "object field '" + name + "' used as block parameter")
				&& validator.ensureInClass(expression.getFirstToken(), "field '" + name + "' is used outside of a class, they can only be used inside.")
				&& validator.ensureInMethod(expression.getFirstToken(), "class field '" + name + "' is used outside of a method."))
		{
			ClassValidator klass = validator.getCurrentClass();
			expression.setClassName(klass.getName());

			if (name.isEmpty())
			{
				validator.parseError(expression.getFirstToken(), "no name provided for field of class " + klass.getName());
			}
			else
			{
				expression.setInsideExtensionClass(validator.isInsideExtensionClass());

				if (expression.isAssignment())
				{
					validator.assignField(expression);
				}
				else if (expression.isRecordUsage())
				{
					validator.useField(expression);
				}
			}
		}
		return null;
	}

	@Override
	public Void visitThisExpression(ThisExpression expression)
	{
		if (validator.ensureOutFunParameters(expression.getFirstToken(), "'this' used as function parameter")
				&& validator.ensureOutParameters(expression.getFirstToken(), "'this' used as a block parameter"))
		{
			validator.ensureInMethod(expression.getFirstToken(), "'this' is referenced outside of a class method (or you've named a variable 'this')");
		}

		expression.setInsideExtensionClass(validator.isInsideExtensionClass());
		return null;
	}

	// --- Calls ---

	/**
	 * Directly inside a class body a call is a class modifier, such as {@code getset :x},
	 * and generates accessor methods. Anywhere else it is a function call, or a method call
	 * on the current object when the class turns out to have the method.
	 */
	@Override
	public Void visitFunctionCallExpression(FunctionCallExpression expression)
	{
		if (validator.isInsideClassDefinition())
		{
			validateClassModifier(expression);
		}
		else
		{
			validateArguments(expression);
			expression.setInsideExtensionClass(validator.isInsideExtensionClass());
			validator.useFun(expression);
			validateBlock(expression.getBlock());
		}
		return null;
	}

	private void validateClassModifier(FunctionCallExpression expression)
	{
		String className = validator.getCurrentClass().getName();
		List<AccessorDeclaration> accessors = createAccessors(expression);

		if (accessors == null)
		{
			validator.parseError(expression.getFirstToken(), "Function '" + expression.getName()
					+ "' called within definition of class '" + className + "', this is not allowed.");
		}
		else if (expression.getBlock() != null)
		{
			validator.parseError(expression.getFirstToken(), "'" + expression.getName()
					+ "' modifier of class '" + className + "', cannot use a block.");
		}
		else
		{
			expression.setAccessors(accessors);
			for (AccessorDeclaration accessor : accessors)
			{
				accessor.accept(this);
			}
		}
	}

	/**
	 * @return the accessors the modifier generates, one or two per argument, or null when
	 * the call is not a known modifier.
	 */
	private List<AccessorDeclaration> createAccessors(FunctionCallExpression modifier)
	{
		List<AccessorKind> kinds = new ArrayList<>();
		List<String> prefixes = new ArrayList<>();

		switch (modifier.getName().toLowerCase(Locale.ROOT))
		{
			case "get":
				kinds.add(AccessorKind.READ);
				prefixes.add("get");
				break;
			case "set":
				kinds.add(AccessorKind.WRITE);
				prefixes.add("set");
				break;
			case "getset":
				kinds.add(AccessorKind.READ);
				prefixes.add("get");
				kinds.add(AccessorKind.WRITE);
				prefixes.add("set");
				break;
			case "read":
				kinds.add(AccessorKind.READ);
				prefixes.add("");
				break;
			case "write":
				kinds.add(AccessorKind.WRITE);
				prefixes.add("");
				break;
			case "attr":
				kinds.add(AccessorKind.READ);
				prefixes.add("");
				kinds.add(AccessorKind.WRITE);
				prefixes.add("");
				break;
			default:
				return null;
		}

		List<AccessorDeclaration> accessors = new ArrayList<>();
		for (Expression argument : modifier.getArguments())
		{
			String fieldName = accessorFieldName(argument);

			if (fieldName == null)
			{
				validator.parseError(argument.getFirstToken(), " Invalid parameter for generating '"
						+ modifier.getName() + "' method");
				continue;
			}

			for (int i = 0; i < kinds.size(); i++)
			{
				accessors.add(new AccessorDeclaration(modifier, kinds.get(i), prefixes.get(i), argument.getFirstToken(), fieldName));
			}
		}
		return accessors;
	}

	private static String accessorFieldName(Expression argument)
	{
		if (argument instanceof VariableExpression)
		{
			return ((VariableExpression) argument).getName();
		}
		else if (argument instanceof FieldExpression)
		{
			return ((FieldExpression) argument).getName();
		}
		else if (argument instanceof SymbolExpression)
		{
			return ((SymbolExpression) argument).getName();
		}
		return null;
	}

	@Override
	public Void visitMethodCallExpression(MethodCallExpression expression)
	{
		expression.setReceiver(check(expression.getReceiver()));
		validateArguments(expression);
		expression.setInsideExtensionClass(validator.isInsideExtensionClass());

		if (expression.getReceiver() instanceof ThisExpression && validator.isInsideClass())
		{
			validator.useThisClassFun(expression);
		}
		else
		{
			validator.useFun(expression);
		}

		validateBlock(expression.getBlock());
		return null;
	}

	@Override
	public Void visitSuperCallExpression(SuperCallExpression expression)
	{
		if (validator.ensureInConstructor(expression.getFirstToken(), "Super can only be called from within a constructor."))
		{
			validator.addDeferredCheck(new DeferredCheck.SuperConstructorCheck(expression, validator.getCurrentClass()));
		}

		validateArguments(expression);
		validateBlock(expression.getBlock());
		return null;
	}

	@Override
	public Void visitNewExpression(NewExpression expression)
	{
		validateArguments(expression);
		validateBlock(expression.getBlock());

		// the class may be declared further on
		validator.addDeferredCheck(new DeferredCheck.NewInstanceCheck(expression));
		return null;
	}

	@Override
	public Void visitNewJsInstanceExpression(NewJsInstanceExpression expression)
	{
		if (validator.ensureAdminMode(expression.getFirstToken(), "cannot create JS instances in Sandbox mode"))
		{
			expression.setTarget(check(expression.getTarget()));
		}

		List<Expression> arguments = expression.getArguments();
		for (int i = 0; i < arguments.size(); i++)
		{
			expression.setArgument(i, check(arguments.get(i)));
		}

		validateBlock(expression.getBlock());
		return null;
	}

	@Override
	public Void visitYieldExpression(YieldExpression expression)
	{
		validator.ensureInFun(expression.getFirstToken(), "Yield can only be used from inside a function.");

		List<Expression> arguments = expression.getArguments();
		for (int i = 0; i < arguments.size(); i++)
		{
			expression.setArgument(i, check(arguments.get(i)));
		}
		return null;
	}

	private void validateArguments(FunctionCallExpression call)
	{
		List<Expression> arguments = call.getArguments();
		for (int i = 0; i < arguments.size(); i++)
		{
			call.setArgument(i, check(arguments.get(i)));
		}
	}

	private void validateBlock(FunctionBlockExpression block)
	{
		if (block != null)
		{
			block.accept(this);
		}
	}

	// --- Collections ---

	@Override
	public Void visitArrayAccessExpression(ArrayAccessExpression expression)
	{
		expression.setIndex(check(expression.getIndex()));
		expression.setArray(check(expression.getArray()));
		return null;
	}

	@Override
	public Void visitArrayLiteralExpression(ArrayLiteralExpression expression)
	{
		List<Expression> elements = expression.getElements();
		for (int i = 0; i < elements.size(); i++)
		{
			expression.setElement(i, check(elements.get(i)));
		}
		return null;
	}

	@Override
	public Void visitHashLiteralExpression(HashLiteralExpression expression)
	{
		List<Expression> mappings = expression.getMappings();
		for (int i = 0; i < mappings.size(); i++)
		{
			expression.setMapping(i, check(mappings.get(i)));
		}
		return null;
	}

	// --- Blocks and inlining ---

	@Override
	public Void visitFunctionBlockExpression(FunctionBlockExpression expression)
	{
		if (expression.isMismatchedBraces())
		{
			validator.strictError(expression.getFirstToken(), "mismatched do-block syntax (i.e. 'do something() }')");
		}

		validator.pushBlockScope();

		validator.setParameters(true, false);
		validateParameters(expression.getParameters());
		validator.setParameters(false, false);

		visitStatements(expression.getBody().getStatements());

		validator.popScope();
		return null;
	}

	@Override
	public Void visitLambdaExpression(LambdaExpression expression)
	{
		return visitFunctionBlockExpression(expression);
	}

	@Override
	public Void visitInlineExpression(InlineExpression expression)
	{
		validator.ensureAdminMode(expression.getFirstToken(), "inlining JavaScript is not allowed outside of admin mode");
		return null;
	}
}
