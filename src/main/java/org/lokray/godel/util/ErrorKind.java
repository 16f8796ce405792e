package org.lokray.godel.util;

/**
 * Broad category of a {@link Diagnostic}.
 */
public enum ErrorKind
{
	/** Unrecognized character span. Always fatal. */
	LEXICAL("Lexical Error"),
	/** Grammar violation: unexpected/missing token, empty input, malformed binder list. */
	PARSE("Syntax Error"),
	/** Invalid registration call on the type system. */
	TYPE_DEFINITION("Type Definition Error"),
	/** Unknown annotation, arity mismatch, subtype violation, unification failure. */
	TYPE("Type Error");

	private final String label;

	ErrorKind(String label)
	{
		this.label = label;
	}

	public String getLabel()
	{
		return label;
	}
}
