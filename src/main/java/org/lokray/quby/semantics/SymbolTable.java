// File: src/main/java/org/lokray/quby/semantics/SymbolTable.java

package org.lokray.quby.semantics;

import org.lokray.quby.ast.expressions.SymbolExpression;
import org.lokray.quby.codegen.Printer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The symbols used anywhere in the compiled programs. Each is printed once as a shared
 * string constant, so {@code :name} in two files refers to the same value.
 */
public class SymbolTable
{
	// call name -> symbol text
	private final Map<String, String> symbols = new LinkedHashMap<>();

	/**
	 * Registers a symbol. Registering the same symbol again has no effect.
	 */
	public void add(SymbolExpression symbol)
	{
		symbols.putIfAbsent(symbol.getCallName(), symbol.getName());
	}

	public boolean contains(String callName)
	{
		return symbols.containsKey(callName);
	}

	public Map<String, String> getSymbols()
	{
		return Collections.unmodifiableMap(symbols);
	}

	/**
	 * Prints one {@code var <callName> = '<symbol>';} statement per symbol.
	 */
	public void print(Printer printer)
	{
		for (Map.Entry<String, String> symbol : symbols.entrySet())
		{
			printer.append("var ", symbol.getKey(), " = '", symbol.getValue(), "'");
			printer.endStatement();
		}
	}
}
