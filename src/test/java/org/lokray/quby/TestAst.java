// File: src/test/java/org/lokray/quby/TestAst.java

package org.lokray.quby;

import org.lokray.quby.ast.Program;
import org.lokray.quby.ast.declarations.AdminMethodDeclaration;
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
import org.lokray.quby.lexer.Token;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds ASTs the way the parser would hand them over, for one source file. Every token
 * gets the current line, which {@link #line(int)} moves.
 */
public class TestAst
{
	private final String sourceName;
	private int line = 1;

	public TestAst(String sourceName)
	{
		this.sourceName = sourceName;
	}

	public TestAst line(int line)
	{
		this.line = line;
		return this;
	}

	public Token tok(String lexeme)
	{
		return new Token(lexeme, line, 1, sourceName);
	}

	public Program program(Statement... statements)
	{
		return new Program(sourceName, new ArrayList<>(Arrays.asList(statements)));
	}

	// --- Statements ---

	public ExpressionStatement stmt(Expression expression)
	{
		return new ExpressionStatement(expression);
	}

	public BlockStatement block(Statement... statements)
	{
		return new BlockStatement(new ArrayList<>(Arrays.asList(statements)));
	}

	public ReturnStatement ret(Expression value)
	{
		return new ReturnStatement(tok("return"), value);
	}

	public IfStatement ifThen(Expression condition, Statement... body)
	{
		List<IfStatement.Branch> branches = new ArrayList<>();
		branches.add(new IfStatement.Branch(condition, block(body)));
		return new IfStatement(tok("if"), branches, null);
	}

	public WhileStatement loop(WhileStatement.LoopKind kind, Expression condition, Statement... body)
	{
		return new WhileStatement(tok("while"), kind, condition, block(body));
	}

	// --- Declarations ---

	/**
	 * Parameter names starting with {@code &} become the block parameter.
	 */
	public Parameters params(String... names)
	{
		Parameters parameters = new Parameters();
		for (String name : names)
		{
			if (name.startsWith("&"))
			{
				parameters.add(new VariableExpression(tok(name), true));
			}
			else
			{
				parameters.add(new VariableExpression(tok(name)));
			}
		}
		return parameters;
	}

	public FunctionDeclaration def(String name, Parameters parameters, Statement... body)
	{
		return new FunctionDeclaration(tok(name), parameters, block(body));
	}

	public AdminMethodDeclaration adminDef(String name, Parameters parameters, Statement... body)
	{
		return new AdminMethodDeclaration(tok(name), parameters, block(body));
	}

	public PreInlineStatement preInline(String code)
	{
		return new PreInlineStatement(tok("#<pre#" + code + "#>#"));
	}

	public ConstructorDeclaration constructor(Parameters parameters, Statement... body)
	{
		return new ConstructorDeclaration(tok("new"), parameters, block(body));
	}

	public ClassDeclaration klass(String name, String superName, Statement... body)
	{
		ClassHeader header = new ClassHeader(tok(name), superName == null ? null : tok(superName));
		return new ClassDeclaration(header, block(body));
	}

	// --- Expressions ---

	public LiteralExpression num(String text)
	{
		return new LiteralExpression(tok(text), LiteralExpression.LiteralKind.NUMBER);
	}

	public LiteralExpression str(String text)
	{
		return new LiteralExpression(tok("\"" + text + "\""), LiteralExpression.LiteralKind.STRING);
	}

	public LiteralExpression bool(boolean value)
	{
		return new LiteralExpression(tok(String.valueOf(value)),
				value ? LiteralExpression.LiteralKind.TRUE : LiteralExpression.LiteralKind.FALSE);
	}

	public VariableExpression var(String name)
	{
		return new VariableExpression(tok(name));
	}

	public JsVariableExpression js(String name)
	{
		return new JsVariableExpression(tok("#" + name));
	}

	public FieldExpression field(String name)
	{
		return new FieldExpression(tok("@" + name));
	}

	public GlobalVariableExpression global(String name)
	{
		return new GlobalVariableExpression(tok("$" + name));
	}

	public SymbolExpression sym(String name)
	{
		return new SymbolExpression(tok(":" + name));
	}

	public ThisExpression self()
	{
		return new ThisExpression(tok("this"));
	}

	public InlineExpression inline(String code)
	{
		return new InlineExpression(tok("#<#" + code + "#>#"));
	}

	public AssignmentExpression assign(Expression target, Expression value)
	{
		return new AssignmentExpression(target, tok("="), value);
	}

	public BinaryExpression binary(Expression left, Operator operator, Expression right)
	{
		return new BinaryExpression(left, tok(operator.getSymbol()), operator, right);
	}

	public UnaryExpression unary(Operator operator, Expression operand)
	{
		return new UnaryExpression(tok(operator.getSymbol()), operator, operand);
	}

	public GroupingExpression group(Expression expression)
	{
		return new GroupingExpression(tok("("), expression);
	}

	public FunctionCallExpression call(String name, Expression... arguments)
	{
		return new FunctionCallExpression(tok(name), Arrays.asList(arguments), null);
	}

	public FunctionCallExpression callWithBlock(String name, FunctionBlockExpression block, Expression... arguments)
	{
		return new FunctionCallExpression(tok(name), Arrays.asList(arguments), block);
	}

	public MethodCallExpression method(Expression receiver, String name, Expression... arguments)
	{
		return new MethodCallExpression(receiver, tok(name), Arrays.asList(arguments), null);
	}

	public NewExpression newInstance(String className, Expression... arguments)
	{
		return new NewExpression(tok(className), Arrays.asList(arguments), null);
	}

	public SuperCallExpression superCall(Expression... arguments)
	{
		return new SuperCallExpression(tok("super"), Arrays.asList(arguments), null);
	}

	public YieldExpression yield(Expression... arguments)
	{
		return new YieldExpression(tok("yield"), Arrays.asList(arguments));
	}

	public FunctionBlockExpression doBlock(Parameters parameters, Statement... body)
	{
		return new FunctionBlockExpression(tok("do"), parameters, block(body), false);
	}

	/**
	 * A block opened with {@code do} and closed with a brace.
	 */
	public FunctionBlockExpression mismatchedBlock(Parameters parameters, Statement... body)
	{
		return new FunctionBlockExpression(tok("do"), parameters, block(body), true);
	}

	public LambdaExpression lambda(Parameters parameters, Statement... body)
	{
		return new LambdaExpression(tok("lambda"), parameters, block(body));
	}

	public NewJsInstanceExpression newJs(Expression target, Expression... arguments)
	{
		return new NewJsInstanceExpression(tok("new"), target, Arrays.asList(arguments), null);
	}

	public ArrayLiteralExpression array(Expression... elements)
	{
		return new ArrayLiteralExpression(tok("["), new ArrayList<>(Arrays.asList(elements)));
	}

	public ArrayAccessExpression index(Expression array, Expression index)
	{
		return new ArrayAccessExpression(array, index);
	}
}
