// File: src/test/java/org/lokray/quby/util/CompilerConfigTest.java

package org.lokray.quby.util;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class CompilerConfigTest
{
	@Test
	void defaultsAreStrictWithEverythingElseOff()
	{
		CompilerConfig config = CompilerConfig.defaults();

		assertTrue(config.isStrict());
		assertFalse(config.isAdmin());
		assertFalse(config.isDoubleBracketOps());
		assertFalse(config.isInlineGetField());
		assertFalse(config.isMethodMissing());
	}

	@Test
	void propertiesAreRead()
	{
		Properties props = new Properties();
		props.setProperty("compiler.strict", "false");
		props.setProperty("compiler.admin", "true");
		props.setProperty("codegen.double_bracket_ops", "true");
		props.setProperty("codegen.inline_get_field", "true");
		props.setProperty("codegen.method_missing", "true");

		CompilerConfig config = new CompilerConfig(props);

		assertFalse(config.isStrict());
		assertTrue(config.isAdmin());
		assertTrue(config.isDoubleBracketOps());
		assertTrue(config.isInlineGetField());
		assertTrue(config.isMethodMissing());
	}

	@Test
	void bundledSettingsAreStrictWithoutAdmin()
	{
		CompilerConfig config = CompilerConfig.load();

		assertTrue(config.isStrict());
		assertFalse(config.isAdmin());
	}
}
