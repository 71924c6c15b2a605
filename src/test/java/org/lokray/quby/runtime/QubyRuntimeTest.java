// File: src/test/java/org/lokray/quby/runtime/QubyRuntimeTest.java

package org.lokray.quby.runtime;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QubyRuntimeTest
{
	@Test
	void namesAreLowercasedAndPrefixed()
	{
		assertEquals("_var_count", QubyRuntime.formatVar("Count"));
		assertEquals("_g_total", QubyRuntime.formatGlobal("Total"));
		assertEquals("_C_point", QubyRuntime.formatClass("Point"));
		assertEquals("_sym_red", QubyRuntime.formatSymbol("Red"));
	}

	@Test
	void functionsAreKeyedByArity()
	{
		assertEquals("_f_add_2", QubyRuntime.formatFun("add", 2));
		assertNotEquals(QubyRuntime.formatFun("add", 1), QubyRuntime.formatFun("add", 2));
		assertEquals("_new_point_0", QubyRuntime.formatNew("Point", 0));
	}

	@Test
	void fieldsArePrivateToTheirClass()
	{
		assertEquals("_fld_point$x", QubyRuntime.formatField("Point", "x"));
		assertNotEquals(QubyRuntime.formatField("Point", "x"), QubyRuntime.formatField("Point3D", "x"));
	}

	@Test
	void coreClassesTranslateToTheirPrototypes()
	{
		assertTrue(QubyRuntime.isCoreClass("Array"));
		assertTrue(QubyRuntime.isCoreClass("object"));
		assertFalse(QubyRuntime.isCoreClass("Point"));

		assertEquals("QubyArray", QubyRuntime.translateClassName("Array"));
		assertEquals("Number", QubyRuntime.translateClassName("number"));
		assertEquals("Point", QubyRuntime.translateClassName("Point"));
	}

	@Test
	void extensionClassesUseThisDirectly()
	{
		assertEquals("this", QubyRuntime.getThisVariable(true));
		assertEquals("_this", QubyRuntime.getThisVariable(false));
	}
}
