package org.lokray.godel.frontend;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.lokray.godel.ast.ApplicationNode;
import org.lokray.godel.ast.ConnectiveKind;
import org.lokray.godel.ast.ConnectiveNode;
import org.lokray.godel.ast.ConstantNode;
import org.lokray.godel.ast.LambdaNode;
import org.lokray.godel.ast.ModalOpNode;
import org.lokray.godel.ast.ModalOperator;
import org.lokray.godel.ast.Node;
import org.lokray.godel.ast.QuantifierKind;
import org.lokray.godel.ast.QuantifierNode;
import org.lokray.godel.ast.VariableNode;
import org.lokray.godel.parser.LogicParser;
import org.lokray.godel.parser.LogicParserBaseVisitor;
import org.lokray.godel.semantic.TypeSystemManager;
import org.lokray.godel.semantic.type.FunctionType;
import org.lokray.godel.semantic.type.ParametricTypeConstructor;
import org.lokray.godel.semantic.type.Type;
import org.lokray.godel.semantic.type.TypeVariable;
import org.lokray.godel.util.ErrorHandler;
import org.lokray.godel.util.ErrorKind;
import org.lokray.godel.util.TypeDefinitionException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Walks a {@link LogicParser} parse tree and builds the typed AST, resolving type
 * annotations and symbol signatures against the {@link TypeSystemManager}.
 * <p>
 * A visit returns {@code null} once a grammar violation has been reported, and every
 * caller passes that on. One builder is used for exactly one parse.
 */
public class AstBuilder extends LogicParserBaseVisitor<Node>
{
	private final TypeSystemManager typeSystem;
	private final ErrorHandler errorHandler;

	// Binders currently in scope, by surface name. Replaced on entry to a binder and restored on exit.
	private Map<String, VariableNode> boundScope = new HashMap<>();
	private final Map<String, VariableNode> freeVariables = new HashMap<>();
	private int nextVarId = 0;

	public AstBuilder(TypeSystemManager typeSystem, ErrorHandler errorHandler)
	{
		this.typeSystem = typeSystem;
		this.errorHandler = errorHandler;
	}

	@Override
	public Node visitFormula(LogicParser.FormulaContext ctx)
	{
		return visit(ctx.expression());
	}

	/**
	 * Binary connectives chain to the left over their unary operands.
	 */
	@Override
	public Node visitExpression(LogicParser.ExpressionContext ctx)
	{
		Node left = visit(ctx.unary(0));
		for (int i = 0; i < ctx.logicalOperator().size(); i++)
		{
			Node right = visit(ctx.unary(i + 1));
			if (left == null || right == null)
			{
				return null;
			}
			ConnectiveKind kind = connectiveKind(ctx.logicalOperator(i).getStart());
			left = new ConnectiveNode(kind, List.of(left, right), typeSystem.getBooleanType());
		}
		return left;
	}

	private static ConnectiveKind connectiveKind(Token token)
	{
		return switch (token.getType())
		{
			case LogicParser.AND -> ConnectiveKind.AND;
			case LogicParser.OR -> ConnectiveKind.OR;
			case LogicParser.IMPLIES -> ConnectiveKind.IMPLIES;
			case LogicParser.EQUIV -> ConnectiveKind.EQUIV;
			default -> throw new IllegalStateException("Not a logical operator: " + token.getText());
		};
	}

	// --- Unary level ---

	@Override
	public Node visitNegation(LogicParser.NegationContext ctx)
	{
		Node operand = visit(ctx.unary());
		if (operand == null)
		{
			return null;
		}
		return new ConnectiveNode(ConnectiveKind.NOT, List.of(operand), typeSystem.getBooleanType());
	}

	@Override
	public Node visitModal(LogicParser.ModalContext ctx)
	{
		ModalOperator operator = switch (ctx.modalOperator().getStart().getType())
		{
			case LogicParser.KNOWS -> ModalOperator.KNOWS;
			case LogicParser.BELIEVES -> ModalOperator.BELIEVES;
			case LogicParser.POSSIBLE -> ModalOperator.POSSIBLE;
			case LogicParser.NECESSARY -> ModalOperator.NECESSARY;
			default -> throw new IllegalStateException("Not a modal operator: " + ctx.modalOperator().getText());
		};

		Node agentOrWorld = null;
		if (ctx.expression() != null)
		{
			agentOrWorld = visit(ctx.expression());
			if (agentOrWorld == null)
			{
				return null;
			}
		}

		Node proposition = visit(ctx.unary());
		if (proposition == null)
		{
			return null;
		}
		return new ModalOpNode(operator, proposition, typeSystem.getBooleanType(), agentOrWorld);
	}

	@Override
	public Node visitProbability(LogicParser.ProbabilityContext ctx)
	{
		Node proposition = visit(ctx.unary());
		if (proposition == null)
		{
			return null;
		}

		Map<String, Object> metadata = Map.of();
		if (ctx.NUMBER() != null)
		{
			metadata = Map.of(ModalOpNode.PROBABILITY_KEY, Double.parseDouble(ctx.NUMBER().getText()));
		}
		return new ModalOpNode(ModalOperator.PROBABILITY, proposition, typeSystem.getBooleanType(), null, metadata);
	}

	@Override
	public Node visitDefeasible(LogicParser.DefeasibleContext ctx)
	{
		Node proposition = visit(ctx.unary());
		if (proposition == null)
		{
			return null;
		}
		return new ModalOpNode(ModalOperator.DEFEASIBLE, proposition, typeSystem.getBooleanType());
	}

	@Override
	public Node visitQuantifiedUnary(LogicParser.QuantifiedUnaryContext ctx)
	{
		return visit(ctx.quantified());
	}

	// --- Binders ---

	@Override
	public Node visitQuantifier(LogicParser.QuantifierContext ctx)
	{
		QuantifierKind kind = ctx.getStart().getType() == LogicParser.FORALL ? QuantifierKind.FORALL : QuantifierKind.EXISTS;
		if (ctx.binder().isEmpty())
		{
			errorHandler.logError(ErrorKind.PARSE, ctx.getStart().getStartIndex(), "Expected at least one variable after " + kind.name());
			return null;
		}

		Map<String, VariableNode> outerScope = boundScope;
		boundScope = new HashMap<>(outerScope);
		try
		{
			List<VariableNode> bound = bindAll(ctx.binder());
			Node scope = visit(ctx.expression());
			if (scope == null)
			{
				return null;
			}
			return new QuantifierNode(kind, bound, scope, typeSystem.getBooleanType());
		}
		finally
		{
			boundScope = outerScope;
		}
	}

	@Override
	public Node visitLambda(LogicParser.LambdaContext ctx)
	{
		if (ctx.binder().isEmpty())
		{
			errorHandler.logError(ErrorKind.PARSE, ctx.getStart().getStartIndex(), "Expected at least one variable after LAMBDA");
			return null;
		}

		Map<String, VariableNode> outerScope = boundScope;
		boundScope = new HashMap<>(outerScope);
		try
		{
			List<VariableNode> bound = bindAll(ctx.binder());
			Node body = visit(ctx.expression());
			if (body == null)
			{
				return null;
			}

			List<Type> argumentTypes = new ArrayList<>();
			for (VariableNode var : bound)
			{
				argumentTypes.add(var.getType());
			}
			Type bodyType = body.getType() != null ? body.getType() : typeSystem.getBooleanType();
			return new LambdaNode(bound, body, new FunctionType(argumentTypes, bodyType));
		}
		finally
		{
			boundScope = outerScope;
		}
	}

	private List<VariableNode> bindAll(List<LogicParser.BinderContext> binders)
	{
		List<VariableNode> bound = new ArrayList<>();
		for (LogicParser.BinderContext binder : binders)
		{
			String name = binder.VARIABLE().getText();
			Type type = binder.typeExpression() != null ? resolveType(binder.typeExpression()) : typeSystem.getEntityType();
			VariableNode var = new VariableNode(name, nextVarId++, type);
			boundScope.put(name, var);
			bound.add(var);
		}
		return bound;
	}

	// --- Application and primaries ---

	@Override
	public Node visitApplicationQuantified(LogicParser.ApplicationQuantifiedContext ctx)
	{
		return visit(ctx.application());
	}

	@Override
	public Node visitApplication(LogicParser.ApplicationContext ctx)
	{
		Node operator = visit(ctx.primary());
		if (operator == null || ctx.LPAREN() == null)
		{
			return operator;
		}

		List<Node> arguments = new ArrayList<>();
		if (ctx.arguments() != null)
		{
			for (LogicParser.ExpressionContext argCtx : ctx.arguments().expression())
			{
				Node arg = visit(argCtx);
				if (arg == null)
				{
					return null;
				}
				arguments.add(arg);
			}
		}

		Type resultType = operator.getType() instanceof FunctionType functionType
				? functionType.getReturnType()
				: typeSystem.getBooleanType();
		return new ApplicationNode(operator, arguments, resultType);
	}

	@Override
	public Node visitParenthesized(LogicParser.ParenthesizedContext ctx)
	{
		return visit(ctx.expression());
	}

	/**
	 * A bound name resolves to its binder, a known free name to its first occurrence, and
	 * anything else becomes a new free variable.
	 */
	@Override
	public Node visitVariable(LogicParser.VariableContext ctx)
	{
		String name = ctx.VARIABLE().getText();
		Type annotated = ctx.typeExpression() != null ? resolveType(ctx.typeExpression()) : null;

		VariableNode existing = boundScope.get(name);
		if (existing == null)
		{
			existing = freeVariables.get(name);
		}

		if (existing != null)
		{
			if (annotated != null && !annotated.equals(existing.getType()))
			{
				errorHandler.logError(ErrorKind.TYPE, ctx.typeExpression().getStart().getStartIndex(), String.format(
						"Variable %s is annotated %s but was introduced with type %s", name, annotated, existing.getType()));
			}
			return existing;
		}

		VariableNode fresh = new VariableNode(name, nextVarId++, annotated != null ? annotated : typeSystem.getEntityType());
		freeVariables.put(name, fresh);
		return fresh;
	}

	@Override
	public Node visitConstant(LogicParser.ConstantContext ctx)
	{
		String name = ctx.CONSTANT().getText();
		Type annotated = ctx.typeExpression() != null ? resolveType(ctx.typeExpression()) : null;
		Optional<Type> signature = typeSystem.getSignature(name);

		// A registered signature always fixes the constant's type.
		if (signature.isPresent())
		{
			if (annotated != null && !annotated.equals(signature.get()))
			{
				errorHandler.logError(ErrorKind.TYPE, ctx.typeExpression().getStart().getStartIndex(), String.format(
						"Constant %s is annotated %s but is declared with type %s", name, annotated, signature.get()));
			}
			return new ConstantNode(name, signature.get());
		}
		return new ConstantNode(name, annotated != null ? annotated : typeSystem.getEntityType());
	}

	@Override
	public Node visitNumber(LogicParser.NumberContext ctx)
	{
		String text = ctx.NUMBER().getText();
		if (text.contains("."))
		{
			Type realType = typeSystem.getType("Float")
					.or(() -> typeSystem.getType("Real"))
					.orElseGet(typeSystem::getEntityType);
			return new ConstantNode(text, realType, Double.parseDouble(text));
		}
		return new ConstantNode(text, typeSystem.requireType(TypeSystemManager.INTEGER), parseInteger(text));
	}

	private static Number parseInteger(String text)
	{
		try
		{
			return Long.parseLong(text);
		}
		catch (NumberFormatException e)
		{
			// Too long for a long; the lexer guarantees the digits are well formed.
			return new BigInteger(text);
		}
	}

	@Override
	public Node visitString(LogicParser.StringContext ctx)
	{
		String text = ctx.STRING().getText();
		String content = text.substring(1, text.length() - 1);
		return new ConstantNode(content, typeSystem.requireType(TypeSystemManager.STRING), content);
	}

	@Override
	public Node visitTrueLiteral(LogicParser.TrueLiteralContext ctx)
	{
		return new ConstantNode("True", typeSystem.getBooleanType(), Boolean.TRUE);
	}

	@Override
	public Node visitFalseLiteral(LogicParser.FalseLiteralContext ctx)
	{
		return new ConstantNode("False", typeSystem.getBooleanType(), Boolean.FALSE);
	}

	// --- Type expressions ---

	/**
	 * Resolves a type expression. Unknown names and bad instantiations are reported as
	 * TYPE diagnostics and replaced by {@code Entity} so that parsing can go on.
	 */
	public Type resolveType(LogicParser.TypeExpressionContext ctx)
	{
		if (ctx instanceof LogicParser.TypeVariableContext varCtx)
		{
			return new TypeVariable(varCtx.VARIABLE().getText().substring(1));
		}
		if (ctx instanceof LogicParser.FunctionTypeContext fnCtx)
		{
			// The last type expression is the return type.
			List<LogicParser.TypeExpressionContext> parts = fnCtx.typeExpression();
			List<Type> argumentTypes = new ArrayList<>();
			for (int i = 0; i < parts.size() - 1; i++)
			{
				argumentTypes.add(resolveType(parts.get(i)));
			}
			return new FunctionType(argumentTypes, resolveType(parts.get(parts.size() - 1)));
		}

		LogicParser.NamedTypeContext named = (LogicParser.NamedTypeContext) ctx;
		String name = named.CONSTANT().getText();
		if (named.typeExpression().isEmpty())
		{
			Type type = typeSystem.getType(name).orElse(null);
			if (type == null)
			{
				return fallback(ctx, "Unknown type '" + name + "'");
			}
			if (type instanceof ParametricTypeConstructor constructor)
			{
				return fallback(ctx, String.format("Parametric type %s needs %d type argument(s)", name, constructor.getArity()));
			}
			return type;
		}

		List<Type> arguments = new ArrayList<>();
		for (LogicParser.TypeExpressionContext argCtx : named.typeExpression())
		{
			arguments.add(resolveType(argCtx));
		}
		try
		{
			return typeSystem.instantiate(name, arguments);
		}
		catch (TypeDefinitionException e)
		{
			return fallback(ctx, e.getMessage());
		}
	}

	private Type fallback(ParserRuleContext ctx, String message)
	{
		errorHandler.logError(ErrorKind.TYPE, ctx.getStart().getStartIndex(), message);
		return typeSystem.getEntityType();
	}

	@Override
	public Node visit(ParseTree tree)
	{
		return tree == null ? null : super.visit(tree);
	}
}
