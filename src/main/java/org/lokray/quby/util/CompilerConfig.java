// File: src/main/java/org/lokray/quby/util/CompilerConfig.java

package org.lokray.quby.util;

import org.apache.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Holds configuration settings for the Quby compiler, loaded from a properties file.
 * Provides sensible defaults if settings are not specified.
 */
public class CompilerConfig
{
	public static final String RESOURCE_NAME = "quby.properties";

	private static final Logger LOG = Logger.getLogger(CompilerConfig.class);

	private final boolean strict;
	private final boolean admin;
	private final boolean doubleBracketOps;
	private final boolean inlineGetField;
	private final boolean methodMissing;

	public CompilerConfig(Properties props)
	{
		this.strict = Boolean.parseBoolean(props.getProperty("compiler.strict", "true"));
		this.admin = Boolean.parseBoolean(props.getProperty("compiler.admin", "false"));
		// code generation hints
		this.doubleBracketOps = Boolean.parseBoolean(props.getProperty("codegen.double_bracket_ops", "false"));
		this.inlineGetField = Boolean.parseBoolean(props.getProperty("codegen.inline_get_field", "false"));
		this.methodMissing = Boolean.parseBoolean(props.getProperty("codegen.method_missing", "false"));
	}

	/**
	 * @return a configuration with every setting at its default.
	 */
	public static CompilerConfig defaults()
	{
		return new CompilerConfig(new Properties());
	}

	/**
	 * Reads {@value #RESOURCE_NAME} from the classpath. A missing or unreadable file
	 * leaves every setting at its default.
	 */
	public static CompilerConfig load()
	{
		Properties props = new Properties();

		try (InputStream input = CompilerConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME))
		{
			if (input != null)
			{
				props.load(input);
				LOG.debug("Loaded configuration from " + RESOURCE_NAME);
			}
			else
			{
				LOG.debug("No " + RESOURCE_NAME + " on the classpath, using default settings");
			}
		}
		catch (IOException e)
		{
			LOG.warn("Could not read " + RESOURCE_NAME + ". Using default settings.", e);
		}

		return new CompilerConfig(props);
	}

	public boolean isStrict()
	{
		return strict;
	}

	public boolean isAdmin()
	{
		return admin;
	}

	public boolean isDoubleBracketOps()
	{
		return doubleBracketOps;
	}

	public boolean isInlineGetField()
	{
		return inlineGetField;
	}

	/**
	 * When set, the runtime handles missing methods itself and no stub tables are printed.
	 */
	public boolean isMethodMissing()
	{
		return methodMissing;
	}
}
