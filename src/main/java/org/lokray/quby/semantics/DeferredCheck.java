// File: src/main/java/org/lokray/quby/semantics/DeferredCheck.java

package org.lokray.quby.semantics;

import org.lokray.quby.ast.declarations.AccessorDeclaration;
import org.lokray.quby.ast.expressions.NewExpression;
import org.lokray.quby.ast.expressions.SuperCallExpression;

/**
 * A check recorded while walking the programs and run once every class is known.
 * The validator drains them in the order they were added.
 */
public abstract class DeferredCheck
{
	private DeferredCheck()
	{
	}

	/**
	 * {@code super(...)} must reach an existing super class constructor of the same arity.
	 */
	public static final class SuperConstructorCheck extends DeferredCheck
	{
		private final SuperCallExpression call;
		private final ClassValidator klass;

		public SuperConstructorCheck(SuperCallExpression call, ClassValidator klass)
		{
			this.call = call;
			this.klass = klass;
		}

		public SuperCallExpression getCall()
		{
			return call;
		}

		public ClassValidator getKlass()
		{
			return klass;
		}
	}

	/**
	 * {@code new Foo(...)} must name a known class with a constructor of that arity.
	 */
	public static final class NewInstanceCheck extends DeferredCheck
	{
		private final NewExpression instance;

		public NewInstanceCheck(NewExpression instance)
		{
			this.instance = instance;
		}

		public NewExpression getInstance()
		{
			return instance;
		}
	}

	/**
	 * A generated accessor must not clash with another method, and its field must be
	 * assigned somewhere in the class.
	 */
	public static final class AccessorCheck extends DeferredCheck
	{
		private final AccessorDeclaration accessor;
		private final ClassValidator klass;

		public AccessorCheck(AccessorDeclaration accessor, ClassValidator klass)
		{
			this.accessor = accessor;
			this.klass = klass;
		}

		public AccessorDeclaration getAccessor()
		{
			return accessor;
		}

		public ClassValidator getKlass()
		{
			return klass;
		}
	}
}
