// File: src/test/java/org/lokray/quby/util/ParseErrorTest.java

package org.lokray.quby.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParseErrorTest
{
	@Test
	void failedRuleNamesTheMatch()
	{
		ParseError error = ParseError.symbol("a.q", 3, "end end");

		assertFalse(error.isTerminalError());
		assertEquals("error parsing 'end end'", error.format());
	}

	@Test
	void literalTerminalNamesOnlyTheTerminal()
	{
		ParseError error = ParseError.terminal("a.q", 3, "foo", "end", true);

		assertTrue(error.isTerminalError());
		assertEquals("syntax error near 'end'", error.format());
	}

	@Test
	void namedTerminalWithoutMatchNamesOnlyTheTerminal()
	{
		assertEquals("syntax error near 'identifier'", ParseError.terminal("a.q", 3, "  ", "identifier", false).format());
	}

	@Test
	void namedTerminalIncludesTheMatch()
	{
		ParseError error = ParseError.terminal("a.q", 3, "12", "identifier", false);
		assertEquals("syntax error near identifier '12'", error.format());
	}

	@Test
	void missingMatchIsEmpty()
	{
		assertEquals("", ParseError.symbol("a.q", 1, null).getMatch());
	}
}
