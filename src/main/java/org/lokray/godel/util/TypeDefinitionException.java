package org.lokray.godel.util;

/**
 * Raised synchronously by the type system when a registration call is invalid.
 */
public class TypeDefinitionException extends RuntimeException
{
	public enum Reason
	{
		DUPLICATE_TYPE,
		UNKNOWN_SUPERTYPE,
		DUPLICATE_SIGNATURE,
		UNKNOWN_TYPE,
		ARITY_MISMATCH,
		CYCLIC_HIERARCHY,
		MALFORMED_LIBRARY
	}

	private final Reason reason;

	public TypeDefinitionException(Reason reason, String message)
	{
		super(message);
		this.reason = reason;
	}

	public TypeDefinitionException(Reason reason, String message, Throwable cause)
	{
		super(message, cause);
		this.reason = reason;
	}

	public Reason getReason()
	{
		return reason;
	}

	public Diagnostic toDiagnostic()
	{
		return Diagnostic.at(ErrorKind.TYPE_DEFINITION, getMessage(), Diagnostic.NO_POSITION);
	}
}
