package org.lokray.godel.util;

/**
 * Raised when the lexer meets a character span that matches no token rule. A lexical
 * failure invalidates every downstream position, so it aborts the parse instead of being
 * accumulated.
 */
public class LexicalException extends RuntimeException
{
	private final int position;
	private final String offendingText;

	public LexicalException(String offendingText, int position)
	{
		super(String.format("Unknown token '%s' at position %d", offendingText, position));
		this.offendingText = offendingText;
		this.position = position;
	}

	public int getPosition()
	{
		return position;
	}

	public String getOffendingText()
	{
		return offendingText;
	}

	public Diagnostic toDiagnostic()
	{
		return Diagnostic.at(ErrorKind.LEXICAL, getMessage(), position);
	}
}
