package org.lokray.godel.util;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

/**
 * A custom error listener for the ANTLR parser that routes syntax errors into an
 * {@link ErrorHandler} instead of the console.
 */
public class SyntaxErrorListener extends BaseErrorListener
{
	private final ErrorHandler errorHandler;

	public SyntaxErrorListener(ErrorHandler errorHandler)
	{
		this.errorHandler = errorHandler;
	}

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e)
	{
		int position = charPositionInLine;
		if (offendingSymbol instanceof Token token && token.getStartIndex() >= 0)
		{
			position = token.getStartIndex();
		}
		errorHandler.logError(ErrorKind.PARSE, position, msg);
	}
}
