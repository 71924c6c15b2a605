// File: src/test/java/org/lokray/quby/QubyCompilerTest.java

package org.lokray.quby;

import org.junit.jupiter.api.Test;
import org.lokray.quby.util.CompilerConfig;
import org.lokray.quby.util.ParseError;

import java.util.Collections;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class QubyCompilerTest
{
	private final TestAst ast = new TestAst("main.q");

	@Test
	void compilesValidPrograms()
	{
		CompilerConfig config = CompilerConfig.defaults();
		QubyCompiler compiler = new QubyCompiler(config);
		compiler.validate(ast.program(ast.stmt(ast.assign(ast.var("x"), ast.num("1")))), null);

		String code = compiler.compile();

		assertSame(config, compiler.getConfig());
		assertEquals(1, compiler.getValidator().getPrograms().size());
		assertTrue(compiler.getErrors().isEmpty());
		assertTrue(code.endsWith("var _var_x=1;\n"), code);
	}

	@Test
	void functionsMayBeDefinedInALaterProgram()
	{
		TestAst lib = new TestAst("lib.q");
		QubyCompiler compiler = new QubyCompiler(CompilerConfig.defaults());
		compiler.validate(ast.program(ast.stmt(ast.call("greet"))), null);
		compiler.validate(lib.program(lib.def("greet", lib.params())), null);

		String code = compiler.compile();

		assertTrue(compiler.getErrors().isEmpty(), compiler.getErrors().toString());
		assertTrue(code.contains("function _f_greet_0(_block){return null;};\n"), code);
	}

	@Test
	void errorsProduceNoCode()
	{
		AtomicInteger finished = new AtomicInteger();
		QubyCompiler compiler = new QubyCompiler(CompilerConfig.defaults()).whenFinished(finished::incrementAndGet);
		compiler.validate(ast.program(ast.stmt(ast.var("missing"))), null);

		assertEquals("", compiler.compile());
		assertEquals(1, compiler.getErrors().size());
		assertEquals(1, finished.get());
	}

	@Test
	void parseErrorsAreReported()
	{
		QubyCompiler compiler = new QubyCompiler(CompilerConfig.defaults());
		compiler.validate(null, Collections.singletonList(ParseError.symbol("broken.q", 3, "}")));

		assertEquals("", compiler.compile());
		assertEquals(1, compiler.getErrors().size());
		assertEquals("broken.q", compiler.getErrors().get(0).getSourceName());
	}

	@Test
	void compilesOnlyOnce()
	{
		QubyCompiler compiler = new QubyCompiler(CompilerConfig.defaults());
		compiler.compile();

		assertThrows(IllegalStateException.class, compiler::compile);
		assertThrows(IllegalStateException.class, () -> compiler.validate(ast.program(), null));
	}
}
