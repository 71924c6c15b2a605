// File: src/test/java/org/lokray/quby/util/ErrorReporterTest.java

package org.lokray.quby.util;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lokray.quby.lexer.Token;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ErrorReporterTest
{
	private ErrorReporter reporter;

	@BeforeEach
	void setUp()
	{
		reporter = new ErrorReporter();
	}

	@Test
	void diagnosticsAreSortedBySourceThenLine()
	{
		reporter.report("b.q", 1, "first");
		reporter.report("a.q", 7, "second");
		reporter.report("a.q", 2, "third");

		List<Diagnostic> diagnostics = reporter.getDiagnostics();

		assertEquals("third", diagnostics.get(0).getRawMessage());
		assertEquals("second", diagnostics.get(1).getRawMessage());
		assertEquals("first", diagnostics.get(2).getRawMessage());
	}

	@Test
	void equalPositionsKeepReportOrder()
	{
		reporter.report("a.q", 3, "one");
		reporter.report("a.q", 3, "two");

		List<Diagnostic> diagnostics = reporter.getDiagnostics();
		assertEquals("one", diagnostics.get(0).getRawMessage());
		assertEquals("two", diagnostics.get(1).getRawMessage());
	}

	@Test
	void unnamedDiagnosticTakesLastSourceName()
	{
		reporter.report("a.q", 1, "named");
		reporter.report((String) null, 4, "unnamed");

		assertEquals("a.q", reporter.getDiagnostics().get(1).getSourceName());
	}

	@Test
	void resetSourceNameLeavesNextDiagnosticUnnamed()
	{
		reporter.report("a.q", 1, "named");
		reporter.resetSourceName();
		reporter.report((String) null, 4, "unnamed");

		Diagnostic unnamed = reporter.getDiagnostics().get(0);
		assertNull(unnamed.getSourceName());
		assertEquals("line 4, unnamed", unnamed.toString());
	}

	@Test
	void tokenPositionIsUsed()
	{
		reporter.report(new Token("foo", 12, 3, "main.q"), "bad foo");

		Diagnostic diagnostic = reporter.getDiagnostics().get(0);
		assertEquals("main.q", diagnostic.getSourceName());
		assertEquals(12, diagnostic.getLine());
		assertEquals("line 12, bad foo", diagnostic.getMessage());
		assertEquals("main.q: line 12, bad foo", diagnostic.toString());
	}

	@Test
	void unknownLineHasNoPrefix()
	{
		reporter.report((Token) null, "crashed");

		Diagnostic diagnostic = reporter.getDiagnostics().get(0);
		assertEquals(Diagnostic.UNKNOWN_LINE, diagnostic.getLine());
		assertEquals("crashed", diagnostic.getMessage());
	}

	@Test
	void resetDiscardsEverything()
	{
		reporter.report("a.q", 1, "x");
		assertTrue(reporter.hasErrors());

		reporter.reset();
		assertFalse(reporter.hasErrors());
		assertTrue(reporter.getDiagnostics().isEmpty());
	}
}
