// File: src/main/java/org/lokray/quby/ast/declarations/FunctionDeclaration.java

package org.lokray.quby.ast.declarations;

import org.lokray.quby.ast.ASTVisitor;
import org.lokray.quby.ast.expressions.VariableExpression;
import org.lokray.quby.ast.statements.BlockStatement;
import org.lokray.quby.lexer.Token;
import org.lokray.quby.runtime.QubyRuntime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AST node representing a 'def name(params) ... end' declaration.
 * Outside a class it is a free function; the validator turns it into a method
 * when it finds it inside a class body.
 */
public class FunctionDeclaration implements CallableDeclaration
{
	public enum FunctionKind
	{
		FUNCTION,
		METHOD,
		CONSTRUCTOR
	}

	private final Token name;
	private final Parameters parameters;
	private final BlockStatement body;
	private FunctionKind kind;
	private String callName;
	// variables hoisted out of nested blocks, keyed by call name
	private final Map<String, VariableExpression> preVariables = new LinkedHashMap<>();

	/**
	 * Constructs a FunctionDeclaration.
	 *
	 * @param name       The function name token.
	 * @param parameters The parameter list, may be null for none.
	 * @param body       The function body, may be null for an empty body.
	 */
	public FunctionDeclaration(Token name, Parameters parameters, BlockStatement body)
	{
		this(name, parameters, body, FunctionKind.FUNCTION);
		this.callName = QubyRuntime.formatFun(name.getLexeme(), this.parameters.size());
	}

	protected FunctionDeclaration(Token name, Parameters parameters, BlockStatement body, FunctionKind kind)
	{
		this.name = name;
		this.parameters = parameters == null ? new Parameters() : parameters;
		this.body = body == null ? new BlockStatement() : body;
		this.kind = kind;
	}

	public Token getNameToken()
	{
		return name;
	}

	@Override
	public String getName()
	{
		return name.getLexeme();
	}

	@Override
	public String getCallName()
	{
		return callName;
	}

	protected void setCallName(String callName)
	{
		this.callName = callName;
	}

	public Parameters getParameters()
	{
		return parameters;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public int getNumParameters()
	{
		return parameters.size();
	}

	public FunctionKind getKind()
	{
		return kind;
	}

	public void setKind(FunctionKind kind)
	{
		this.kind = kind;
	}

	@Override
	public boolean isFunction()
	{
		return kind == FunctionKind.FUNCTION;
	}

	@Override
	public boolean isMethod()
	{
		return kind != FunctionKind.FUNCTION;
	}

	@Override
	public boolean isConstructor()
	{
		return kind == FunctionKind.CONSTRUCTOR;
	}

	@Override
	public boolean isAccessor()
	{
		return false;
	}

	@Override
	public void addPreVariable(VariableExpression variable)
	{
		preVariables.putIfAbsent(variable.getCallName(), variable);
	}

	public List<VariableExpression> getPreVariables()
	{
		return Collections.unmodifiableList(new ArrayList<>(preVariables.values()));
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFunctionDeclaration(this);
	}

	@Override
	public Token getFirstToken()
	{
		return name;
	}

	@Override
	public String toString()
	{
		return "def " + name.getLexeme() + parameters + " {\n" + body + "}";
	}
}
