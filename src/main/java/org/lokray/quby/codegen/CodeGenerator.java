// File: src/main/java/org/lokray/quby/codegen/CodeGenerator.java
package org.lokray.quby.codegen;

import org.apache.log4j.Logger;
import org.lokray.quby.ast.ASTNode;
import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.ast.Program;
import org.lokray.quby.ast.declarations.*;
import org.lokray.quby.ast.expressions.*;
import org.lokray.quby.ast.statements.*;
import org.lokray.quby.runtime.QubyRuntime;
import org.lokray.quby.semantics.ClassValidator;
import org.lokray.quby.semantics.Validator;
import org.lokray.quby.util.CompilerConfig;
import org.lokray.quby.util.Debug;

import java.util.ArrayList;
import java.util.List;

/**
 * CodeGenerator is responsible for traversing the validated AST and generating the
 * corresponding JavaScript.
 * <p>
 * Functions, classes and constructors are printed into the pre-code region of the
 * {@link Printer}, so they exist before any top level statement runs. Top level
 * statements go into the code region in program order.
 * <p>
 * Only programs that validated without errors may be generated.
 */
public class CodeGenerator implements ASTVisitor<Void>
{
	private static final Logger LOG = Logger.getLogger(CodeGenerator.class);

	private final Validator validator;
	private final CompilerConfig config;
	private final Printer printer = new Printer();

	public CodeGenerator(Validator validator, CompilerConfig config)
	{
		this.validator = validator;
		this.config = config;
	}

	/**
	 * Generates the pre-code followed by every validated program.
	 *
	 * @return the JavaScript source.
	 */
	public String generate()
	{
		LOG.info("Generating code for " + validator.getPrograms().size() + " program(s)");

		printer.setCodeMode(false);
		generatePreCode();
		printer.setCodeMode(true);

		for (Program program : validator.getPrograms())
		{
			program.accept(this);
		}

		return printer.toString();
	}

	Printer getPrinter()
	{
		return printer;
	}

	// --- Pre-code ---

	private void generatePreCode()
	{
		validator.getMethodNames().print(printer);
		validator.getSymbols().print(printer);
		printer.printArray(validator.getPreInlines(), this);

		generateNoSuchMethodStubs();

		// methods of the root class exist on every core class as well
		List<Statement> rootStatements = validator.getRootClass().getPrintStatements();
		for (String coreClass : QubyRuntime.CORE_CLASSES.keySet())
		{
			appendExtensionClassStmts(coreClass, rootStatements);
		}
	}

	/**
	 * Prints a stub for every method name that reports the missing method when called on
	 * an object without it, and installs the stubs on the core class prototypes.
	 */
	private void generateNoSuchMethodStubs()
	{
		if (config.isMethodMissing())
		{
			return;
		}

		ClassValidator rootClass = validator.getRootClass().getClassValidator();
		List<String> callNames = new ArrayList<>();

		printer.append("var ", QubyRuntime.FUNCTION_DEFAULT_TABLE_NAME, "={");
		for (String callName : validator.getMethodNames().getFunctions().keySet())
		{
			if (rootClass == null || !rootClass.hasOwnMethod(callName))
			{
				if (!callNames.isEmpty())
				{
					printer.append(",");
				}
				printer.append(callName, ":function(){noSuchMethodError(this,\"", callName, "\");}");
				callNames.add(callName);
			}
		}
		printer.append("}");
		printer.endStatement();

		for (String coreClass : QubyRuntime.CORE_CLASSES.keySet())
		{
			String prototype = QubyRuntime.translateClassName(coreClass) + ".prototype.";
			ClassValidator klass = validator.getClass(QubyRuntime.formatClass(coreClass));

			for (String callName : callNames)
			{
				if (klass == null || !klass.hasOwnMethod(callName))
				{
					printer.append(prototype, callName, "=", QubyRuntime.FUNCTION_DEFAULT_TABLE_NAME, ".", callName);
					printer.endStatement();
				}
			}
		}
	}

	/**
	 * Adds the methods and constructors found in a class body to a core class prototype.
	 */
	private void appendExtensionClassStmts(String className, List<Statement> statements)
	{
		String prototype = QubyRuntime.translateClassName(className) + ".prototype.";

		for (Statement statement : statements)
		{
			if (statement instanceof ConstructorDeclaration)
			{
				statement.accept(this);
				printer.endStatement();
			}
			else if (statement instanceof FunctionDeclaration)
			{
				printer.append(prototype);
				statement.accept(this);
				printer.endStatement();
			}
			else if (statement instanceof ExpressionStatement
					&& ((ExpressionStatement) statement).getExpression() instanceof FunctionCallExpression)
			{
				List<AccessorDeclaration> accessors = ((FunctionCallExpression) ((ExpressionStatement) statement).getExpression()).getAccessors();
				if (accessors != null)
				{
					for (AccessorDeclaration accessor : accessors)
					{
						printer.append(prototype);
						accessor.accept(this);
						printer.endStatement();
					}
				}
			}
		}
	}

	// --- Helpers ---

	private void printSeparated(List<? extends ASTNode> nodes)
	{
		for (int i = 0; i < nodes.size(); i++)
		{
			if (i > 0)
			{
				printer.append(",");
			}
			nodes.get(i).accept(this);
		}
	}

	/**
	 * Prints a value where Quby truthiness is needed: only false and null are false.
	 */
	private void printAsCondition(Expression expression)
	{
		if (expression instanceof LiteralExpression)
		{
			printer.append(((LiteralExpression) expression).isTrue() ? "true" : "false");
		}
		else if (expression instanceof GroupingExpression)
		{
			printer.append("(");
			printAsCondition(((GroupingExpression) expression).getExpression());
			printer.append(")");
		}
		else if ((expression instanceof BalancingExpression && ((BalancingExpression) expression).isResultBool())
				|| expression instanceof InlineExpression)
		{
			expression.accept(this);
		}
		else
		{
			String temp = printer.getTempVariable();

			printer.appendPre("var ", temp, ";");
			printer.append("((", temp, "=");
			expression.accept(this);
			printer.append(") !== null && ", temp, " !== false)");
			printer.appendPost("delete ", temp, ";");
		}
	}

	private void printCallArguments(List<Expression> arguments, FunctionBlockExpression block)
	{
		if (!arguments.isEmpty())
		{
			printSeparated(arguments);
			printer.append(",");
		}

		if (block != null)
		{
			block.accept(this);
		}
		else
		{
			printer.append("null");
		}
	}

	private void printFunCall(FunctionCallExpression call)
	{
		printer.append(call.getCallName(), "(");
		printCallArguments(call.getArguments(), call.getBlock());
		printer.append(")");
	}

	@Override
	public Void visitProgram(Program program)
	{
		Debug.log("printing program '%s'", program.getSourceName());
		printer.printArray(program.getStatements(), this);
		return null;
	}

	// --- Declarations ---

	@Override
	public Void visitClassDeclaration(ClassDeclaration declaration)
	{
		boolean wasCode = printer.isCodeMode();
		printer.setCodeMode(false);

		if (QubyRuntime.ROOT_CLASS_CALL_NAME.equals(declaration.getCallName()))
		{
			// the root class body was copied onto every core class with the pre-code
			Debug.log("skipping root class body");
		}
		else if (declaration.isExtensionClass())
		{
			appendExtensionClassStmts(declaration.getName(), declaration.getBody().getStatements());
		}
		else
		{
			ClassValidator klass = validator.getClass(declaration.getCallName());
			if (klass.markPrinted())
			{
				printClass(klass);
			}
		}
		printer.endStatement();

		printer.setCodeMode(wasCode);
		return null;
	}

	/**
	 * Prints the class as a JavaScript constructor function that installs the methods,
	 * followed by one {@code _new_} function per constructor.
	 */
	private void printClass(ClassValidator klass)
	{
		String superCallName = klass.getSuperCallName();

		printer.append("function ", klass.getCallName(), "() {");
		if (superCallName != null)
		{
			String superName = klass.getHeader().getSuperName();
			String superConstructor = QubyRuntime.isCoreClass(superName)
					? QubyRuntime.translateClassName(superName)
					: superCallName;
			printer.append(superConstructor, ".apply(this);");
		}
		printer.append("var ", QubyRuntime.THIS_VARIABLE, " = this;");

		for (CallableDeclaration method : klass.getMethods())
		{
			printer.append("this.");
			method.accept(this);
			printer.endStatement();
		}
		printer.append("}");
		printer.endStatement();

		for (ConstructorDeclaration constructor : klass.getConstructors())
		{
			constructor.accept(this);
			printer.endStatement();
		}
	}

	@Override
	public Void visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		boolean wasCode = printer.isCodeMode();
		if (!declaration.isMethod())
		{
			printer.setCodeMode(false);
		}

		if (declaration.isMethod())
		{
			printer.append(declaration.getCallName(), "=function");
		}
		else
		{
			printer.append("function ", declaration.getCallName());
		}

		printParameters(declaration, false);
		printBody(declaration);

		if (!declaration.isMethod())
		{
			printer.endStatement();
		}
		printer.setCodeMode(wasCode);
		return null;
	}

	private void printParameters(FunctionDeclaration declaration, boolean withThis)
	{
		printer.append("(");

		if (withThis)
		{
			printer.append(QubyRuntime.THIS_VARIABLE, ",");
		}

		Parameters parameters = declaration.getParameters();
		if (parameters.size() > 0)
		{
			printSeparated(parameters.getParameters());
			printer.append(",");
		}

		printer.append(QubyRuntime.BLOCK_VARIABLE, ")");
	}

	private void printBody(FunctionDeclaration declaration)
	{
		printer.append("{");
		printPreVariables(declaration);
		printer.flush();

		printer.printArray(declaration.getBody().getStatements(), this);

		if (declaration.isConstructor())
		{
			if (!((ConstructorDeclaration) declaration).isExtensionClass())
			{
				printer.append("return ", QubyRuntime.THIS_VARIABLE, ";");
			}
		}
		else
		{
			// every function returns something
			printer.append("return null;");
		}
		printer.append("}");
	}

	/**
	 * Declares the variables hoisted out of blocks, and copies the block parameter out
	 * of the block variable.
	 */
	private void printPreVariables(FunctionDeclaration declaration)
	{
		List<VariableExpression> preVariables = declaration.getPreVariables();
		VariableExpression blockParameter = declaration.getParameters().getBlockParameter();

		if (preVariables.isEmpty() && blockParameter == null)
		{
			return;
		}

		printer.append("var ");
		for (int i = 0; i < preVariables.size(); i++)
		{
			if (i > 0)
			{
				printer.append(",");
			}
			printer.append(preVariables.get(i).getCallName(), "=null");
		}

		if (blockParameter != null)
		{
			if (!preVariables.isEmpty())
			{
				printer.append(",");
			}
			printer.append(blockParameter.getCallName(), "=", QubyRuntime.BLOCK_VARIABLE);
		}
		printer.endStatement();
	}

	@Override
	public Void visitConstructorDeclaration(ConstructorDeclaration declaration)
	{
		printer.append("function ", declaration.getCallName());
		printParameters(declaration, !declaration.isExtensionClass());
		printBody(declaration);
		return null;
	}

	@Override
	public Void visitAdminMethodDeclaration(AdminMethodDeclaration declaration)
	{
		return visitFunctionDeclaration(declaration);
	}

	@Override
	public Void visitAccessorDeclaration(AccessorDeclaration declaration)
	{
		if (declaration.getKind() == AccessorDeclaration.AccessorKind.READ)
		{
			printer.append(declaration.getCallName(), "=function(){return ");
			declaration.getField().accept(this);
			printer.append(";}");
		}
		else
		{
			printer.append(declaration.getCallName(), "=function(t){return ");
			declaration.getField().accept(this);
			printer.append("=t;}");
		}
		return null;
	}

	// --- Statements ---

	@Override
	public Void visitBlockStatement(BlockStatement statement)
	{
		printer.printArray(statement.getStatements(), this);
		return null;
	}

	@Override
	public Void visitExpressionStatement(ExpressionStatement statement)
	{
		statement.getExpression().accept(this);
		return null;
	}

	@Override
	public Void visitIfStatement(IfStatement statement)
	{
		List<IfStatement.Branch> branches = statement.getBranches();
		for (int i = 0; i < branches.size(); i++)
		{
			IfStatement.Branch branch = branches.get(i);
			if (i > 0)
			{
				printer.append("else ");
			}

			printer.append("if(");
			printAsCondition(branch.getCondition());
			printer.append("){").flush();
			branch.getBody().accept(this);
			printer.append("}");
		}

		if (statement.getElseBranch() != null)
		{
			printer.append("else{");
			statement.getElseBranch().accept(this);
			printer.append("}");
		}
		return null;
	}

	@Override
	public Void visitWhileStatement(WhileStatement statement)
	{
		WhileStatement.LoopKind kind = statement.getKind();

		if (kind.isPostCondition())
		{
			// no flush needed, the body always runs first
			printer.append("do{");
			statement.getBody().accept(this);
			printer.append(kind.isNegated() ? "}while(!(" : "}while(");
			printAsCondition(statement.getCondition());
			printer.append(kind.isNegated() ? "))" : ")");
		}
		else
		{
			printer.append(kind.isNegated() ? "while(!(" : "while(");
			printAsCondition(statement.getCondition());
			printer.append(kind.isNegated() ? ")){" : "){").flush();
			statement.getBody().accept(this);
			printer.append("}");
		}
		return null;
	}

	@Override
	public Void visitReturnStatement(ReturnStatement statement)
	{
		printer.append("return ");
		if (statement.getValue() != null)
		{
			statement.getValue().accept(this);
		}
		else
		{
			printer.append("null");
		}
		return null;
	}

	@Override
	public Void visitPreInlineStatement(PreInlineStatement statement)
	{
		if (!statement.isPrinted())
		{
			printer.append(statement.getCode());
			statement.setPrinted();
		}
		return null;
	}

	// --- Operators ---

	@Override
	public Void visitBinaryExpression(BinaryExpression expression)
	{
		switch (expression.getOperator())
		{
			case BOOL_OR:
				printBoolOr(expression);
				break;
			case BOOL_AND:
				printBoolAnd(expression);
				break;
			case POWER:
				printer.append("Math.pow(");
				expression.getLeft().accept(this);
				printer.append(",");
				expression.getRight().accept(this);
				printer.append(")");
				break;
			case MAPPING:
				expression.getLeft().accept(this);
				printer.append(",");
				expression.getRight().accept(this);
				break;
			case INSTANCE_OF:
				printInstanceOf(expression);
				break;
			default:
				printOperator(expression, expression.getOperator().getSymbol());
				break;
		}
		return null;
	}

	private void printOperator(OperatorExpression expression, String symbol)
	{
		boolean bracket = config.isDoubleBracketOps();

		printer.append(bracket ? "((" : "(");
		expression.getLeft().accept(this);
		if (bracket)
		{
			printer.append(")");
		}

		printer.append(symbol);

		if (bracket)
		{
			printer.append("(");
		}
		expression.getRight().accept(this);
		printer.append(bracket ? "))" : ")");
	}

	private void printBoolOr(BinaryExpression expression)
	{
		String temp = printer.getTempVariable();

		printer.appendPre("var ", temp, ";");
		printer.append("(((", temp, "=");
		expression.getLeft().accept(this);
		printer.append(") === null || ", temp, " === false) ? (");
		expression.getRight().accept(this);
		printer.append(") : ", temp, ")");
		printer.appendPost("delete ", temp, ";");
	}

	private void printBoolAnd(BinaryExpression expression)
	{
		String temp = printer.getTempVariable();

		printer.appendPre("var ", temp, ";");
		printer.append("(((", temp, "=");
		expression.getLeft().accept(this);
		printer.append(") === null || ", temp, " === false) ? ", temp, " : (");
		expression.getRight().accept(this);
		printer.append("))");
		printer.appendPost("delete ", temp, ";");
	}

	/**
	 * The right side names a class, or in admin mode a JavaScript constructor.
	 */
	private void printInstanceOf(BinaryExpression expression)
	{
		Expression right = expression.getRight();
		String constructor;

		if (right instanceof JsVariableExpression)
		{
			constructor = ((JsVariableExpression) right).getCallName();
		}
		else if (right instanceof VariableExpression)
		{
			String className = ((VariableExpression) right).getName();
			constructor = QubyRuntime.isCoreClass(className)
					? QubyRuntime.translateClassName(className)
					: QubyRuntime.formatClass(className);
		}
		else
		{
			throw new IllegalStateException("instanceof against a " + right.getClass().getSimpleName());
		}

		printer.append("(");
		expression.getLeft().accept(this);
		printer.append(" instanceof ", constructor, ")");
	}

	@Override
	public Void visitAssignmentExpression(AssignmentExpression expression)
	{
		if (expression.isCollectionMode())
		{
			printer.append("quby_setCollection(");
			expression.getLeft().accept(this);
			printer.append(",");
			expression.getRight().accept(this);
			printer.append(")");
		}
		else
		{
			expression.getLeft().accept(this);
			printer.append("=");
			expression.getRight().accept(this);
		}
		return null;
	}

	@Override
	public Void visitUnaryExpression(UnaryExpression expression)
	{
		if (expression.getOperator() == Operator.NOT)
		{
			String temp = printer.getTempVariable();

			printer.appendPre("var ", temp, ";");
			printer.append("(((", temp, "=");
			expression.getOperand().accept(this);
			printer.append(") === null || ", temp, " === false) ? true : false)");
			printer.appendPost("delete ", temp, ";");
		}
		else
		{
			printer.append("(", expression.getOperator().getSymbol());
			expression.getOperand().accept(this);
			printer.append(")");
		}
		return null;
	}

	@Override
	public Void visitGroupingExpression(GroupingExpression expression)
	{
		printer.append("(");
		expression.getExpression().accept(this);
		printer.append(")");
		return null;
	}

	// --- Values and names ---

	@Override
	public Void visitLiteralExpression(LiteralExpression expression)
	{
		switch (expression.getKind())
		{
			case NUMBER:
				printer.append(expression.getText().replace("_", ""));
				break;
			case STRING:
				printer.append(expression.getText().replace("\n", "\\n"));
				break;
			case TRUE:
				printer.append("true");
				break;
			case FALSE:
				printer.append("false");
				break;
			default:
				printer.append("null");
				break;
		}
		return null;
	}

	@Override
	public Void visitSymbolExpression(SymbolExpression expression)
	{
		printer.append(expression.getCallName());
		return null;
	}

	@Override
	public Void visitVariableExpression(VariableExpression expression)
	{
		if (expression.isAssignment() && expression.isUseVar())
		{
			printer.append("var ");
		}
		printer.append(expression.getCallName());
		return null;
	}

	@Override
	public Void visitJsVariableExpression(JsVariableExpression expression)
	{
		return visitVariableExpression(expression);
	}

	@Override
	public Void visitGlobalVariableExpression(GlobalVariableExpression expression)
	{
		if (expression.isAssignment())
		{
			printer.append(expression.getCallName());
		}
		else
		{
			printer.append("quby_checkGlobal(", expression.getCallName(), ",'", expression.getName(), "')");
		}
		return null;
	}

	@Override
	public Void visitFieldExpression(FieldExpression expression)
	{
		// unbound fields were already reported
		if (expression.getClassName() == null)
		{
			return null;
		}

		String thisVariable = QubyRuntime.getThisVariable(expression.isInsideExtensionClass());
		String callName = expression.getCallName();

		if (expression.isAssignment())
		{
			printer.append(thisVariable, ".", callName);
		}
		else if (config.isInlineGetField())
		{
			printer.append("(", thisVariable, ".", callName,
					"===undefined?quby.runtime.fieldNotFoundError(", thisVariable, ",\"", expression.getDisplayName(), "\"):",
					thisVariable, ".", callName, ")");
		}
		else
		{
			printer.append("quby_getField(", thisVariable, ".", callName, ",", thisVariable, ",'", expression.getDisplayName(), "')");
		}
		return null;
	}

	@Override
	public Void visitThisExpression(ThisExpression expression)
	{
		printer.append(QubyRuntime.getThisVariable(expression.isInsideExtensionClass()));
		return null;
	}

	// --- Calls ---

	/**
	 * Class modifiers print nothing here, their accessors are printed with the class.
	 */
	@Override
	public Void visitFunctionCallExpression(FunctionCallExpression expression)
	{
		if (expression.getAccessors() != null)
		{
			return null;
		}

		if (expression.isMethod())
		{
			printer.append(QubyRuntime.getThisVariable(expression.isInsideExtensionClass()), ".");
		}
		printFunCall(expression);
		return null;
	}

	@Override
	public Void visitMethodCallExpression(MethodCallExpression expression)
	{
		if (expression.getReceiver() instanceof ThisExpression)
		{
			printer.append(QubyRuntime.getThisVariable(expression.isInsideExtensionClass()), ".");
		}
		else
		{
			printer.append("(");
			expression.getReceiver().accept(this);
			printer.append(").");
		}
		printFunCall(expression);
		return null;
	}

	@Override
	public Void visitSuperCallExpression(SuperCallExpression expression)
	{
		if (expression.getSuperClassName() != null)
		{
			String superConstructor = QubyRuntime.formatNew(expression.getSuperClassName(), expression.getNumParameters());

			printer.append(superConstructor, "(", QubyRuntime.THIS_VARIABLE, ",");
			printCallArguments(expression.getArguments(), expression.getBlock());
			printer.append(")");
		}
		return null;
	}

	@Override
	public Void visitNewExpression(NewExpression expression)
	{
		printer.append(expression.getCallName(), "(");

		// ordinary classes get a fresh object to initialise
		if (!expression.isExtensionClass())
		{
			printer.append("new ", expression.getClassCallName(), "(),");
		}

		printCallArguments(expression.getArguments(), expression.getBlock());
		printer.append(")");
		return null;
	}

	@Override
	public Void visitNewJsInstanceExpression(NewJsInstanceExpression expression)
	{
		printer.append("new ");
		expression.getTarget().accept(this);
		printer.append("(");

		printSeparated(expression.getArguments());
		if (expression.getBlock() != null)
		{
			if (!expression.getArguments().isEmpty())
			{
				printer.append(",");
			}
			expression.getBlock().accept(this);
		}

		printer.append(")");
		return null;
	}

	@Override
	public Void visitYieldExpression(YieldExpression expression)
	{
		List<Expression> arguments = expression.getArguments();

		printer.appendPre("quby_ensureBlock(", QubyRuntime.BLOCK_VARIABLE, ", ", String.valueOf(arguments.size()), ");");
		printer.append(QubyRuntime.BLOCK_VARIABLE, "(");
		printSeparated(arguments);
		printer.append(")");
		return null;
	}

	// --- Collections ---

	@Override
	public Void visitArrayAccessExpression(ArrayAccessExpression expression)
	{
		if (expression.isAssignment())
		{
			expression.getArray().accept(this);
			printer.append(",");
			expression.getIndex().accept(this);
		}
		else
		{
			printer.append("quby_getCollection(");
			expression.getArray().accept(this);
			printer.append(",");
			expression.getIndex().accept(this);
			printer.append(")");
		}
		return null;
	}

	@Override
	public Void visitArrayLiteralExpression(ArrayLiteralExpression expression)
	{
		printer.append("(new QubyArray([");
		printSeparated(expression.getElements());
		printer.append("]))");
		return null;
	}

	@Override
	public Void visitHashLiteralExpression(HashLiteralExpression expression)
	{
		printer.append("(new QubyHash(");
		printSeparated(expression.getMappings());
		printer.append("))");
		return null;
	}

	// --- Blocks and inlining ---

	@Override
	public Void visitFunctionBlockExpression(FunctionBlockExpression expression)
	{
		printer.append("function(");
		printSeparated(expression.getParameters().getParameters());
		printer.append("){").flush();

		printer.printArray(expression.getBody().getStatements(), this);

		printer.append("return null;", "}");
		return null;
	}

	@Override
	public Void visitLambdaExpression(LambdaExpression expression)
	{
		printer.append("(");
		visitFunctionBlockExpression(expression);
		printer.append(")");
		return null;
	}

	@Override
	public Void visitInlineExpression(InlineExpression expression)
	{
		printer.append(expression.getCode());
		return null;
	}
}
