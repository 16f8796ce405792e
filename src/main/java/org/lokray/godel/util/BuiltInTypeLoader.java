package org.lokray.godel.util;

import org.lokray.godel.semantic.TypeSystemManager;

import static org.lokray.godel.semantic.TypeSystemManager.*;

/**
 * Utility class responsible for defining the built-in base types before any parsing
 * happens.
 */
public class BuiltInTypeLoader
{
	/**
	 * Defines the base ontology (Entity, Agent, Event, Action, Proposition) and the
	 * primitive literal types in the given manager.
	 *
	 * @param typeSystem The freshly created manager.
	 */
	public static void defineBuiltIns(TypeSystemManager typeSystem)
	{
		typeSystem.defineAtomicType(ENTITY);
		typeSystem.defineAtomicType(AGENT, ENTITY);
		typeSystem.defineAtomicType(EVENT);
		typeSystem.defineAtomicType(ACTION, EVENT);
		typeSystem.defineAtomicType(PROPOSITION);

		typeSystem.defineAtomicType(BOOLEAN);
		typeSystem.defineAtomicType(INTEGER);
		typeSystem.defineAtomicType(STRING);
	}
}
