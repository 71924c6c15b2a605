// File: src/test/java/org/lokray/quby/codegen/CodeGeneratorTest.java

package org.lokray.quby.codegen;

import org.junit.jupiter.api.Test;
import org.lokray.quby.QubyCompiler;
import org.lokray.quby.TestAst;
import org.lokray.quby.ast.Program;
import org.lokray.quby.ast.expressions.Operator;
import org.lokray.quby.ast.statements.WhileStatement;
import org.lokray.quby.util.CompilerConfig;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class CodeGeneratorTest
{
	private final TestAst ast = new TestAst("gen.q");

	private static CompilerConfig config(String... settings)
	{
		Properties props = new Properties();
		for (String setting : settings)
		{
			props.setProperty(setting, "true");
		}
		return new CompilerConfig(props);
	}

	private static String compile(CompilerConfig config, Program... programs)
	{
		QubyCompiler compiler = new QubyCompiler(config);
		for (Program program : programs)
		{
			compiler.validate(program, null);
		}

		String code = compiler.compile();
		assertTrue(compiler.getErrors().isEmpty(), compiler.getErrors().toString());
		return code;
	}

	private static String compile(Program... programs)
	{
		return compile(CompilerConfig.defaults(), programs);
	}

	private static int count(String haystack, String needle)
	{
		int found = 0;
		int from = haystack.indexOf(needle);
		while (from >= 0)
		{
			found++;
			from = haystack.indexOf(needle, from + needle.length());
		}
		return found;
	}

	@Test
	void smallestProgram()
	{
		String code = compile(ast.program(ast.stmt(ast.assign(ast.var("x"), ast.num("1")))));

		assertEquals("var _q_funs={};\nvar _q_no_funs={};\nvar _var_x=1;\n", code);
	}

	@Test
	void noStubsWhenMethodMissingIsHandled()
	{
		String code = compile(config("codegen.method_missing"), ast.program(ast.stmt(ast.assign(ast.var("x"), ast.num("1")))));

		assertEquals("var _q_funs={};\nvar _var_x=1;\n", code);
	}

	// --- Operators ---

	@Test
	void multiplicationBindsTighter()
	{
		// x = 2 * 3 + 1, built as 2 * (3 + 1)
		String code = compile(ast.program(ast.stmt(ast.assign(ast.var("x"),
				ast.binary(ast.num("2"), Operator.MULTIPLY, ast.binary(ast.num("3"), Operator.ADD, ast.num("1")))))));

		assertTrue(code.endsWith("var _var_x=((2*3)+1);\n"), code);
	}

	@Test
	void additionOfAProduct()
	{
		String code = compile(ast.program(ast.stmt(ast.assign(ast.var("x"),
				ast.binary(ast.num("1"), Operator.ADD, ast.binary(ast.num("2"), Operator.MULTIPLY, ast.num("3")))))));

		assertTrue(code.endsWith("var _var_x=(1+(2*3));\n"), code);
	}

	@Test
	void groupingIsKept()
	{
		String code = compile(ast.program(ast.stmt(ast.assign(ast.var("x"),
				ast.binary(ast.num("2"), Operator.MULTIPLY, ast.group(ast.binary(ast.num("3"), Operator.ADD, ast.num("1"))))))));

		assertTrue(code.endsWith("var _var_x=(2*((3+1)));\n"), code);
	}

	@Test
	void doubleBracketOperators()
	{
		String code = compile(config("codegen.double_bracket_ops"), ast.program(ast.stmt(ast.assign(ast.var("x"),
				ast.binary(ast.num("1"), Operator.ADD, ast.num("2"))))));

		assertTrue(code.endsWith("var _var_x=((1)+(2));\n"), code);
	}

	@Test
	void powerUsesMath()
	{
		String code = compile(ast.program(ast.stmt(ast.assign(ast.var("x"),
				ast.binary(ast.num("2"), Operator.POWER, ast.num("3"))))));

		assertTrue(code.endsWith("var _var_x=Math.pow(2,3);\n"), code);
	}

	@Test
	void booleanOperatorsFollowQubyTruthiness()
	{
		String code = compile(ast.program(
				ast.stmt(ast.assign(ast.var("a"), ast.num("1"))),
				ast.stmt(ast.assign(ast.var("b"), ast.num("2"))),
				ast.stmt(ast.assign(ast.var("c"), ast.binary(ast.var("a"), Operator.BOOL_OR, ast.var("b")))),
				ast.stmt(ast.assign(ast.var("d"), ast.binary(ast.var("a"), Operator.BOOL_AND, ast.var("b")))),
				ast.stmt(ast.assign(ast.var("e"), ast.unary(Operator.NOT, ast.var("a"))))));

		assertTrue(code.contains("var _t0;var _var_c=(((_t0=_var_a) === null || _t0 === false) ? (_var_b) : _t0);\ndelete _t0;"), code);
		assertTrue(code.contains("var _var_d=(((_t1=_var_a) === null || _t1 === false) ? _t1 : (_var_b));\n"), code);
		assertTrue(code.contains("var _var_e=(((_t2=_var_a) === null || _t2 === false) ? true : false);\n"), code);
	}

	@Test
	void instanceOfPrintsTheClassConstructor()
	{
		String code = compile(ast.program(
				ast.klass("Point", null),
				ast.stmt(ast.assign(ast.var("p"), ast.newInstance("Point"))),
				ast.stmt(ast.assign(ast.var("a"), ast.binary(ast.var("p"), Operator.INSTANCE_OF, ast.var("Point")))),
				ast.stmt(ast.assign(ast.var("b"), ast.binary(ast.var("p"), Operator.INSTANCE_OF, ast.var("Array"))))));

		assertTrue(code.contains("var _var_a=(_var_p instanceof _C_point);\n"), code);
		assertTrue(code.contains("var _var_b=(_var_p instanceof QubyArray);\n"), code);
	}

	// --- Values ---

	@Test
	void literals()
	{
		String code = compile(ast.program(
				ast.stmt(ast.assign(ast.var("n"), ast.num("1_000"))),
				ast.stmt(ast.assign(ast.var("s"), ast.str("a\nb")))));

		assertTrue(code.contains("var _var_n=1000;\n"), code);
		assertTrue(code.contains("var _var_s=\"a\\nb\";\n"), code);
	}

	@Test
	void symbolsAreDeclaredUpFront()
	{
		String code = compile(ast.program(ast.stmt(ast.assign(ast.var("s"), ast.sym("red")))));

		assertEquals("var _q_funs={};\nvar _sym_red = 'red';\nvar _q_no_funs={};\nvar _var_s=_sym_red;\n", code);
	}

	@Test
	void globalsAreCheckedWhenRead()
	{
		String code = compile(ast.program(
				ast.stmt(ast.assign(ast.global("count"), ast.num("1"))),
				ast.stmt(ast.assign(ast.var("x"), ast.global("count")))));

		assertTrue(code.contains("_g_count=1;\n"), code);
		assertTrue(code.contains("var _var_x=quby_checkGlobal(_g_count,'count');\n"), code);
	}

	@Test
	void collections()
	{
		String code = compile(ast.program(
				ast.stmt(ast.assign(ast.var("arr"), ast.array(ast.num("1"), ast.num("2")))),
				ast.stmt(ast.assign(ast.index(ast.var("arr"), ast.num("0")), ast.num("3"))),
				ast.stmt(ast.assign(ast.var("v"), ast.index(ast.var("arr"), ast.num("1"))))));

		assertTrue(code.contains("var _var_arr=(new QubyArray([1,2]));\n"), code);
		assertTrue(code.contains("quby_setCollection(_var_arr,0,3);\n"), code);
		assertTrue(code.contains("var _var_v=quby_getCollection(_var_arr,1);\n"), code);
	}

	// --- Statements ---

	@Test
	void literalConditionIsPrintedDirectly()
	{
		String code = compile(ast.program(ast.ifThen(ast.bool(true), ast.stmt(ast.assign(ast.var("z"), ast.num("2"))))));

		assertTrue(code.contains("if(true){var _var_z=2;\n}"), code);
	}

	@Test
	void variableConditionUsesATemporary()
	{
		String code = compile(ast.program(
				ast.stmt(ast.assign(ast.var("y"), ast.num("1"))),
				ast.ifThen(ast.var("y"), ast.stmt(ast.assign(ast.var("z"), ast.num("2"))))));

		assertTrue(code.contains("var _t0;if(((_t0=_var_y) !== null && _t0 !== false)){"), code);
	}

	@Test
	void loops()
	{
		String code = compile(ast.program(
				ast.loop(WhileStatement.LoopKind.UNTIL, ast.bool(false), ast.stmt(ast.assign(ast.var("i"), ast.num("1")))),
				ast.loop(WhileStatement.LoopKind.DO_WHILE, ast.bool(true), ast.stmt(ast.assign(ast.var("j"), ast.num("1"))))));

		assertTrue(code.contains("while(!(false)){var _var_i=1;\n}"), code);
		assertTrue(code.contains("do{var _var_j=1;\n}while(true)"), code);
	}

	// --- Functions ---

	@Test
	void functionsArePrintedBeforeTheCode()
	{
		String code = compile(ast.program(
				ast.stmt(ast.call("add", ast.num("1"), ast.num("2"))),
				ast.def("add", ast.params("a", "b"), ast.ret(ast.binary(ast.var("a"), Operator.ADD, ast.var("b"))))));

		String function = "function _f_add_2(_var_a,_var_b,_block){return (_var_a+_var_b);\nreturn null;};\n";
		String call = "_f_add_2(1,2,null);\n";

		assertTrue(code.contains(function), code);
		assertTrue(code.contains(call), code);
		assertTrue(code.indexOf(function) < code.indexOf(call), code);
	}

	@Test
	void blockVariablesAreDeclaredByTheFunction()
	{
		String code = compile(ast.program(
				ast.def("run", ast.params("&blk"), ast.stmt(ast.yield(ast.num("1")))),
				ast.def("f", ast.params(),
						ast.stmt(ast.callWithBlock("run", ast.doBlock(ast.params(), ast.stmt(ast.assign(ast.var("y"), ast.num("1")))))))));

		assertTrue(code.contains("function _f_run_0(_block){var _var_blk=_block;\nquby_ensureBlock(_block, 1);_block(1);\nreturn null;}"), code);
		assertTrue(code.contains("function _f_f_0(_block){var _var_y=null;\n_f_run_0(function(){_var_y=1;\nreturn null;});\nreturn null;}"), code);
	}

	// --- Classes ---

	@Test
	void classWithConstructorAndMethod()
	{
		String code = compile(ast.program(
				ast.klass("Point", null,
						ast.constructor(ast.params("x"), ast.stmt(ast.assign(ast.field("x"), ast.var("x")))),
						ast.def("getX", ast.params(), ast.ret(ast.field("x")))),
				ast.stmt(ast.assign(ast.var("p"), ast.newInstance("Point", ast.num("1")))),
				ast.stmt(ast.method(ast.var("p"), "getX"))));

		assertTrue(code.startsWith("var _q_funs={_f_getx_0:'getX'};\n"), code);
		assertTrue(code.contains("var _q_no_funs={_f_getx_0:function(){noSuchMethodError(this,\"_f_getx_0\");}};\n"), code);
		assertTrue(code.contains("QubyArray.prototype._f_getx_0=_q_no_funs._f_getx_0;\n"), code);
		assertTrue(code.contains("function _C_point() {QubyObject.apply(this);var _this = this;"
				+ "this._f_getx_0=function(_block){return quby_getField(_this._fld_point$x,_this,'x@Point');\nreturn null;};\n};\n"), code);
		assertTrue(code.contains("function _new_point_1(_this,_var_x,_block){_this._fld_point$x=_var_x;\nreturn _this;};\n"), code);
		assertTrue(code.contains("var _var_p=_new_point_1(new _C_point(),1,null);\n"), code);
		assertTrue(code.endsWith("(_var_p)._f_getx_0(null);\n"), code);
	}

	@Test
	void classWithoutConstructorGetsADefaultOne()
	{
		String code = compile(ast.program(
				ast.klass("Empty", null),
				ast.stmt(ast.assign(ast.var("e"), ast.newInstance("Empty")))));

		assertTrue(code.contains("function _new_empty_0(_this,_block){return _this;};\n"), code);
		assertTrue(code.contains("var _var_e=_new_empty_0(new _C_empty(),null);\n"), code);
	}

	@Test
	void subClassCallsItsSuperClass()
	{
		String code = compile(ast.program(
				ast.klass("A", null, ast.constructor(ast.params("a"))),
				ast.klass("B", "A", ast.constructor(ast.params(), ast.stmt(ast.superCall(ast.num("1")))))));

		assertTrue(code.contains("function _C_b() {_C_a.apply(this);"), code);
		assertTrue(code.contains("function _new_b_0(_this,_block){_new_a_1(_this,1,null);\nreturn _this;}"), code);
	}

	@Test
	void methodsCalledWithoutAReceiverUseThis()
	{
		String code = compile(ast.program(ast.klass("Shape", null,
				ast.def("describe", ast.params(), ast.ret(ast.call("area"))),
				ast.def("area", ast.params(), ast.ret(ast.num("1"))))));

		assertTrue(code.contains("this._f_describe_0=function(_block){return _this._f_area_0(null);\nreturn null;};\n"), code);
	}

	@Test
	void modifiersGenerateAccessors()
	{
		String code = compile(ast.program(ast.klass("A", null,
				ast.constructor(ast.params(), ast.stmt(ast.assign(ast.field("x"), ast.num("1")))),
				ast.stmt(ast.call("getset", ast.sym("x"))))));

		assertTrue(code.contains("this._f_getx_0=function(){return quby_getField(_this._fld_a$x,_this,'x@A');};\n"), code);
		assertTrue(code.contains("this._f_setx_1=function(t){return _this._fld_a$x=t;};\n"), code);
	}

	@Test
	void inlineFieldRead()
	{
		String code = compile(config("codegen.inline_get_field"), ast.program(ast.klass("A", null,
				ast.constructor(ast.params(), ast.stmt(ast.assign(ast.field("x"), ast.num("1")))),
				ast.def("x", ast.params(), ast.ret(ast.field("x"))))));

		assertTrue(code.contains("return (_this._fld_a$x===undefined?quby.runtime.fieldNotFoundError(_this,\"x@A\"):_this._fld_a$x);\n"), code);
	}

	@Test
	void coreClassMethodsGoOnThePrototype()
	{
		String code = compile(ast.program(ast.klass("Array", null, ast.def("first", ast.params(), ast.ret(ast.num("1"))))));

		assertTrue(code.contains("QubyArray.prototype._f_first_0=function(_block){return 1;\nreturn null;};\n"), code);
		assertTrue(code.contains("QubyHash.prototype._f_first_0=_q_no_funs._f_first_0;\n"), code);
		assertFalse(code.contains("QubyArray.prototype._f_first_0=_q_no_funs"), code);
	}

	@Test
	void rootClassMethodsGoOnEveryCoreClass()
	{
		String code = compile(ast.program(ast.klass("Object", null, ast.def("hello", ast.params(), ast.ret(ast.num("1"))))));

		assertEquals(1, count(code, "QubyObject.prototype._f_hello_0=function"), code);
		assertTrue(code.contains("String.prototype._f_hello_0=function(_block){return 1;\nreturn null;};\n"), code);
		assertTrue(code.contains("var _q_no_funs={};\n"), code);
	}

	// --- Admin mode ---

	@Test
	void preInlinesArePrintedOnceBeforeTheCode()
	{
		String code = compile(config("compiler.admin"), ast.program(
				ast.preInline("var lib = {}"),
				ast.stmt(ast.assign(ast.var("x"), ast.num("1")))));

		assertEquals("var _q_funs={};\nvar lib = {};\nvar _q_no_funs={};\nvar _var_x=1;\n", code);
	}

	@Test
	void javaScriptInstances()
	{
		String code = compile(config("compiler.admin"), ast.program(
				ast.stmt(ast.assign(ast.var("d"), ast.newJs(ast.js("Date"), ast.num("1"), ast.num("2"))))));

		assertTrue(code.endsWith("var _var_d=new Date(1,2);\n"), code);
	}

	@Test
	void adminMethodsKeepTheirName()
	{
		String code = compile(config("compiler.admin"), ast.program(ast.klass("Box", null,
				ast.adminDef("rawSize", ast.params(), ast.ret(ast.num("1"))))));

		assertTrue(code.contains("var _q_funs={rawSize:'rawSize'};\n"), code);
		assertTrue(code.contains("this.rawSize=function(_block){return 1;\nreturn null;};\n"), code);
	}

	@Test
	void lambdasAreWrappedFunctions()
	{
		String code = compile(ast.program(ast.stmt(ast.assign(ast.var("f"),
				ast.lambda(ast.params("x"), ast.ret(ast.var("x")))))));

		assertTrue(code.endsWith("var _var_f=(function(_var_x){return _var_x;\nreturn null;});\n"), code);
	}
}
