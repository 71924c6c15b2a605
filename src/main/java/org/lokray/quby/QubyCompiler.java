// File: src/main/java/org/lokray/quby/QubyCompiler.java

package org.lokray.quby;

import org.apache.log4j.Logger;
import org.lokray.quby.ast.Program;
import org.lokray.quby.codegen.CodeGenerator;
import org.lokray.quby.semantics.Validator;
import org.lokray.quby.util.CompilerConfig;
import org.lokray.quby.util.Diagnostic;
import org.lokray.quby.util.ParseError;

import java.util.List;

/**
 * Entry point for the Quby compiler core.
 * This class orchestrates validation of each parsed program, and generation of the
 * JavaScript once every program has been seen.
 * <p>
 * Programs may arrive in any order; functions and classes used before the program that
 * defines them are resolved when {@link #compile()} is called.
 */
public class QubyCompiler
{
	private static final Logger LOG = Logger.getLogger(QubyCompiler.class);

	private final CompilerConfig config;
	private final Validator validator;

	private Runnable onFinish = null;
	private boolean finished = false;

	public QubyCompiler()
	{
		this(CompilerConfig.load());
	}

	public QubyCompiler(CompilerConfig config)
	{
		this.config = config;
		this.validator = new Validator(config);
	}

	/**
	 * Validates one parsed program. When {@code parseErrors} is not empty they are
	 * reported instead, and the program is skipped.
	 */
	public void validate(Program program, List<ParseError> parseErrors)
	{
		if (finished)
		{
			throw new IllegalStateException("Compilation has already finished");
		}

		validator.validate(program, parseErrors);
	}

	/**
	 * Sets a callback run once {@link #compile()} is done, errors or not.
	 */
	public QubyCompiler whenFinished(Runnable onFinish)
	{
		this.onFinish = onFinish;
		return this;
	}

	/**
	 * Runs the checks that need every program, then generates the JavaScript.
	 *
	 * @return the generated code, or an empty string when any error was reported. The
	 * errors are available from {@link #getErrors()}.
	 */
	public String compile()
	{
		if (finished)
		{
			throw new IllegalStateException("Compilation has already finished");
		}
		finished = true;

		validator.endValidate();

		String code;
		if (validator.hasErrors())
		{
			LOG.info("Compilation failed with " + validator.getErrors().size() + " error(s)");
			code = "";
		}
		else
		{
			code = new CodeGenerator(validator, config).generate();
			LOG.info("Compilation finished, generated " + code.length() + " characters");
		}

		if (onFinish != null)
		{
			onFinish.run();
		}
		return code;
	}

	/**
	 * @return every error reported so far, sorted by source and line.
	 */
	public List<Diagnostic> getErrors()
	{
		return validator.getErrors();
	}

	public Validator getValidator()
	{
		return validator;
	}

	public CompilerConfig getConfig()
	{
		return config;
	}
}
