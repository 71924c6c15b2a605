// File: src/test/java/org/lokray/quby/util/DebugTest.java

package org.lokray.quby.util;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DebugTest
{
	@Test
	void loggingIsConfiguredFromTheClasspath()
	{
		assertEquals(Level.INFO, Logger.getRootLogger().getLevel());
		assertFalse(Debug.isEnabled());
	}

	@Test
	void raisingTheDebugLoggerEnablesTracing()
	{
		Logger logger = Logger.getLogger(Debug.class);
		Level previous = logger.getLevel();
		try
		{
			logger.setLevel(Level.DEBUG);
			assertTrue(Debug.isEnabled());

			Debug.indent();
			Debug.log("tracing %s", "on");
			Debug.dedent();
		}
		finally
		{
			logger.setLevel(previous);
		}
	}
}
