// File: src/test/java/org/lokray/quby/codegen/PrinterTest.java

package org.lokray.quby.codegen;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PrinterTest
{
	private Printer printer;

	@BeforeEach
	void setUp()
	{
		printer = new Printer();
	}

	@Test
	void preCodeComesBeforeCode()
	{
		printer.append("b()").endStatement();

		printer.setCodeMode(false);
		printer.append("function a(){}").endStatement();
		printer.setCodeMode(true);

		printer.append("c()").endStatement();

		assertEquals("function a(){};\nb();\nc();\n", printer.toString());
	}

	@Test
	void statementPartsAreOrderedAroundIt()
	{
		printer.appendPost("delete _t0;");
		printer.append("x=_t0");
		printer.appendPre("var _t0;");
		printer.endStatement();

		assertEquals("var _t0;x=_t0;\ndelete _t0;", printer.toString());
	}

	@Test
	void emptyStatementPrintsNothing()
	{
		printer.endStatement();
		printer.endStatement();

		assertEquals("", printer.toString());
	}

	@Test
	void unfinishedStatementsAreIncludedWithoutBeingConsumed()
	{
		printer.append("x");

		assertEquals("x", printer.toString());
		assertEquals("x", printer.toString());

		printer.append("=1").endStatement();
		assertEquals("x=1;\n", printer.toString());
	}

	@Test
	void flushKeepsTheStatementOpen()
	{
		printer.appendPre("var _t0;");
		printer.append("if(a){").flush();
		printer.append("b()").endStatement();

		assertEquals("var _t0;if(a){b();\n", printer.toString());
	}

	@Test
	void temporaryVariablesAreUnique()
	{
		assertEquals("_t0", printer.getTempVariable());
		assertEquals("_t1", printer.getTempVariable());
	}

	@Test
	void codeModeIsTheDefault()
	{
		assertTrue(printer.isCodeMode());
		printer.setCodeMode(false);
		assertFalse(printer.isCodeMode());
	}
}
