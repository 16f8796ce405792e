package org.lokray.godel.frontend;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.lokray.godel.ast.Node;
import org.lokray.godel.parser.LogicLexer;
import org.lokray.godel.parser.LogicParser;
import org.lokray.godel.semantic.TypeSystemManager;
import org.lokray.godel.semantic.type.Type;
import org.lokray.godel.util.Debug;
import org.lokray.godel.util.ErrorHandler;
import org.lokray.godel.util.ErrorKind;
import org.lokray.godel.util.LexerErrorListener;
import org.lokray.godel.util.LexicalException;
import org.lokray.godel.util.SyntaxErrorListener;

/**
 * Parses formulas and type expressions into typed values.
 * <p>
 * Grammar violations and bad type annotations are returned as diagnostics; only a
 * character that matches no token raises, as a {@link LexicalException}. An instance
 * keeps per-call state and must not be shared between threads.
 */
public class FormalLogicParser
{
	private final TypeSystemManager typeSystem;
	private final ErrorHandler errorHandler = new ErrorHandler();

	public FormalLogicParser(TypeSystemManager typeSystem)
	{
		this.typeSystem = typeSystem;
	}

	/**
	 * Parses a complete formula.
	 *
	 * @return the AST, or no node when the text is not a well-formed formula. TYPE
	 * diagnostics for recovered annotations may accompany a present node.
	 * @throws LexicalException if the text contains a character no token can start with.
	 */
	public ParseResult<Node> parse(String text)
	{
		errorHandler.reset();
		Debug.logDebug("Parsing formula: " + text);

		CommonTokenStream tokens = tokenize(text);
		if (tokens.LA(1) == Token.EOF)
		{
			errorHandler.logError(ErrorKind.PARSE, 0, "Empty expression");
			return ParseResult.failure(errorHandler.getDiagnostics());
		}

		LogicParser parser = newParser(tokens);
		LogicParser.FormulaContext tree = parser.formula();
		if (!isComplete(parser, tokens))
		{
			return ParseResult.failure(errorHandler.getDiagnostics());
		}

		AstBuilder builder = new AstBuilder(typeSystem, errorHandler);
		Node node = builder.visit(tree);
		if (node == null || errorHandler.hasErrors(ErrorKind.PARSE))
		{
			return ParseResult.failure(errorHandler.getDiagnostics());
		}

		Debug.logDebug("Parsed " + node + " : " + node.getType());
		return ParseResult.of(node, errorHandler.getDiagnostics());
	}

	/**
	 * Parses a standalone type expression such as {@code Agent}, {@code ?T} or
	 * {@code List[Agent]}. Unknown names yield {@code Entity} with a TYPE diagnostic.
	 */
	public ParseResult<Type> parseType(String text)
	{
		errorHandler.reset();

		CommonTokenStream tokens = tokenize(text);
		if (tokens.LA(1) == Token.EOF)
		{
			errorHandler.logError(ErrorKind.PARSE, 0, "Empty type expression");
			return ParseResult.failure(errorHandler.getDiagnostics());
		}

		LogicParser parser = newParser(tokens);
		LogicParser.TypeOnlyContext tree = parser.typeOnly();
		if (!isComplete(parser, tokens))
		{
			return ParseResult.failure(errorHandler.getDiagnostics());
		}

		Type type = new AstBuilder(typeSystem, errorHandler).resolveType(tree.typeExpression());
		return ParseResult.of(type, errorHandler.getDiagnostics());
	}

	// Lexes the whole input up front, so a lexical failure surfaces before any parsing.
	private CommonTokenStream tokenize(String text)
	{
		LogicLexer lexer = new LogicLexer(CharStreams.fromString(text));
		lexer.removeErrorListeners();
		lexer.addErrorListener(LexerErrorListener.INSTANCE);

		CommonTokenStream tokens = new CommonTokenStream(lexer);
		tokens.fill();
		return tokens;
	}

	private LogicParser newParser(CommonTokenStream tokens)
	{
		LogicParser parser = new LogicParser(tokens);
		parser.removeErrorListeners();
		parser.addErrorListener(new SyntaxErrorListener(errorHandler));
		return parser;
	}

	private boolean isComplete(LogicParser parser, CommonTokenStream tokens)
	{
		if (parser.getNumberOfSyntaxErrors() > 0)
		{
			Debug.logDebug("Parse failed with " + parser.getNumberOfSyntaxErrors() + " syntax error(s)");
			return false;
		}

		Token next = tokens.LT(1);
		if (next.getType() != Token.EOF)
		{
			errorHandler.logError(ErrorKind.PARSE, next.getStartIndex(), "Unexpected token '" + next.getText() + "'");
			return false;
		}
		return true;
	}
}
