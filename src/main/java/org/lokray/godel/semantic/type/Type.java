package org.lokray.godel.semantic.type;

import org.lokray.godel.semantic.TypeSystemManager;

import java.util.Map;

/**
 * A type of the logic. Every variant is an immutable value: equality is structural and
 * transformations such as substitution always return a new instance.
 */
public interface Type
{
	String getName();

	/**
	 * Checks whether this type may be used wherever {@code other} is expected.
	 *
	 * @param other      The candidate supertype.
	 * @param typeSystem The manager holding the subtype hierarchy.
	 */
	boolean isSubtypeOf(Type other, TypeSystemManager typeSystem);

	/**
	 * Returns a copy of this type with every bound {@link TypeVariable} replaced.
	 */
	Type substituteTypeVariables(Map<TypeVariable, Type> bindings);

	<R> R accept(TypeVisitor<R> visitor);

	default Type substitute(Substitution substitution)
	{
		return substituteTypeVariables(substitution.asMap());
	}

	default boolean isFunction()
	{
		return false;
	}

	default boolean isAtomic()
	{
		return false;
	}
}
