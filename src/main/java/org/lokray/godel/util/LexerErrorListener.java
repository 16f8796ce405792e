package org.lokray.godel.util;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.Interval;

/**
 * Turns the lexer's token recognition errors into a {@link LexicalException}, so an
 * unrecognized character never silently becomes an error token.
 */
public class LexerErrorListener extends BaseErrorListener
{
	public static final LexerErrorListener INSTANCE = new LexerErrorListener();

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e)
	{
		int position = charPositionInLine;
		String text = "";
		if (recognizer instanceof Lexer lexer)
		{
			position = lexer._tokenStartCharIndex;
			int stop = Math.min(lexer._input.index(), lexer._input.size() - 1);
			text = lexer._input.getText(Interval.of(position, Math.max(position, stop)));
		}
		Debug.logDebug(String.format("[Lexical Error] line %d:%d - %s", line, charPositionInLine + 1, msg));
		throw new LexicalException(text, position);
	}
}
