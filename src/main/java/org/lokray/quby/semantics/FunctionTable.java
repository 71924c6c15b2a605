// File: src/main/java/org/lokray/quby/semantics/FunctionTable.java

package org.lokray.quby.semantics;

import org.lokray.quby.codegen.Printer;
import org.lokray.quby.runtime.QubyRuntime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Every method name declared in any class, by call name. The runtime uses the printed
 * table to turn a call name back into a readable name in error messages.
 */
public class FunctionTable
{
	// call name -> name as written
	private final Map<String, String> functions = new LinkedHashMap<>();

	public void add(String callName, String displayName)
	{
		functions.put(callName, displayName);
	}

	public boolean contains(String callName)
	{
		return functions.containsKey(callName);
	}

	public Map<String, String> getFunctions()
	{
		return Collections.unmodifiableMap(functions);
	}

	/**
	 * Prints {@code var _q_funs={callname:'Name',...};}.
	 */
	public void print(Printer printer)
	{
		printer.append("var ", QubyRuntime.FUNCTION_TABLE_NAME, "={");

		boolean first = true;
		for (Map.Entry<String, String> function : functions.entrySet())
		{
			if (!first)
			{
				printer.append(",");
			}
			printer.append(function.getKey(), ":'", function.getValue(), "'");
			first = false;
		}

		printer.append("}");
		printer.endStatement();
	}
}
