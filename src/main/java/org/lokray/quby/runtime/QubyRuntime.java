// File: src/main/java/org/lokray/quby/runtime/QubyRuntime.java

package org.lokray.quby.runtime;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Names shared between the compiler and the JavaScript runtime library, and the
 * formatting of call names. A call name is the lowercased, context prefixed identifier
 * an entity gets in the emitted code. Each context has its own prefix so a variable,
 * a function and a class of the same name never collide.
 */
public final class QubyRuntime
{
	public static final String VARIABLE_PREFIX = "_var_";
	public static final String GLOBAL_PREFIX = "_g_";
	public static final String FIELD_PREFIX = "_fld_";
	public static final String FUNCTION_PREFIX = "_f_";
	public static final String NEW_PREFIX = "_new_";
	public static final String CLASS_PREFIX = "_C_";
	public static final String SYMBOL_PREFIX = "_sym_";

	// separates class and field in a field call name; never part of a Quby identifier
	public static final String FIELD_CLASS_SEPARATOR = "$";
	// separates field and class in the names handed to the runtime for error messages
	public static final String FIELD_NAME_SEPARATOR = "@";

	public static final String THIS_VARIABLE = "_this";
	public static final String EXTENSION_THIS_VARIABLE = "this";
	public static final String BLOCK_VARIABLE = "_block";
	public static final String TEMP_VARIABLE = "_t";

	public static final String FUNCTION_TABLE_NAME = "_q_funs";
	public static final String FUNCTION_DEFAULT_TABLE_NAME = "_q_no_funs";

	public static final String ROOT_CLASS_NAME = "object";
	public static final String ROOT_CLASS_CALL_NAME = formatClass(ROOT_CLASS_NAME);

	/**
	 * The classes backed by JavaScript prototypes, keyed by lowercase Quby name.
	 */
	public static final Map<String, String> CORE_CLASSES;

	static
	{
		Map<String, String> core = new LinkedHashMap<>();
		core.put("object", "QubyObject");
		core.put("array", "QubyArray");
		core.put("hash", "QubyHash");
		core.put("string", "String");
		core.put("number", "Number");
		core.put("boolean", "Boolean");
		core.put("function", "Function");
		CORE_CLASSES = Collections.unmodifiableMap(core);
	}

	public static final List<String> ACCESSOR_PREFIXES = Collections.unmodifiableList(Arrays.asList("get", "set"));

	private QubyRuntime()
	{
	}

	private static String lower(String name)
	{
		return name.toLowerCase(Locale.ROOT);
	}

	public static String formatVar(String name)
	{
		return VARIABLE_PREFIX + lower(name);
	}

	public static String formatGlobal(String name)
	{
		return GLOBAL_PREFIX + lower(name);
	}

	/**
	 * Functions are keyed by name and arity, so {@code foo(a)} and {@code foo(a, b)} are
	 * different functions.
	 */
	public static String formatFun(String name, int numParameters)
	{
		return FUNCTION_PREFIX + lower(name) + "_" + numParameters;
	}

	public static String formatNew(String className, int numParameters)
	{
		return NEW_PREFIX + lower(className) + "_" + numParameters;
	}

	public static String formatClass(String className)
	{
		return CLASS_PREFIX + lower(className);
	}

	public static String formatField(String className, String fieldName)
	{
		return FIELD_PREFIX + lower(className) + FIELD_CLASS_SEPARATOR + lower(fieldName);
	}

	public static String formatSymbol(String symbol)
	{
		return SYMBOL_PREFIX + lower(symbol);
	}

	public static boolean isCoreClass(String name)
	{
		return CORE_CLASSES.containsKey(lower(name));
	}

	/**
	 * @return the JavaScript constructor behind a core class, or the name unchanged when
	 * it is not one.
	 */
	public static String translateClassName(String name)
	{
		String translated = CORE_CLASSES.get(lower(name));
		return translated == null ? name : translated;
	}

	/**
	 * Inside extension classes methods live on the prototype, so {@code this} is used
	 * directly instead of the captured {@value #THIS_VARIABLE}.
	 */
	public static String getThisVariable(boolean isExtensionClass)
	{
		return isExtensionClass ? EXTENSION_THIS_VARIABLE : THIS_VARIABLE;
	}
}
