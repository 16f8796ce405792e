package org.lokray.godel.ast;

import org.lokray.godel.semantic.type.Type;

import java.math.BigDecimal;
import java.util.stream.Collectors;

/**
 * Renders a node in the surface syntax accepted by the parser. Compound sub-formulas are
 * parenthesized, so the output re-parses to the same shape.
 */
public final class FormulaPrinter implements NodeVisitor<String>
{
	private static final FormulaPrinter INSTANCE = new FormulaPrinter();

	private FormulaPrinter()
	{
	}

	// Doubles would print small values in exponent form, which the lexer does not accept.
	private static String plain(Object value)
	{
		if (value instanceof Double)
		{
			return BigDecimal.valueOf((Double) value).toPlainString();
		}
		return String.valueOf(value);
	}

	public static String print(Node node)
	{
		return node.accept(INSTANCE);
	}

	private String nested(Node node)
	{
		String text = node.accept(this);
		boolean atomic = node instanceof ConstantNode || node instanceof VariableNode || node instanceof ApplicationNode;
		return atomic ? text : "(" + text + ")";
	}

	private static String binder(VariableNode variable)
	{
		Type type = variable.getType();
		return type == null ? variable.getName() : variable.getName() + ":" + type;
	}

	@Override
	public String visitConstant(ConstantNode node)
	{
		if (node.getValue() instanceof String)
		{
			return "\"" + node.getValue() + "\"";
		}
		return node.getName();
	}

	@Override
	public String visitVariable(VariableNode node)
	{
		return node.getName();
	}

	@Override
	public String visitApplication(ApplicationNode node)
	{
		String args = node.getArguments().stream()
				.map(this::nested)
				.collect(Collectors.joining(", "));
		return nested(node.getOperator()) + "(" + args + ")";
	}

	@Override
	public String visitQuantifier(QuantifierNode node)
	{
		String vars = node.getBoundVariables().stream()
				.map(FormulaPrinter::binder)
				.collect(Collectors.joining(" "));
		return node.getKind().getKeyword() + " " + vars + ". " + node.getScope().accept(this);
	}

	@Override
	public String visitConnective(ConnectiveNode node)
	{
		if (node.getKind().isUnary())
		{
			return "not " + nested(node.getOperands().get(0));
		}
		return node.getOperands().stream()
				.map(this::nested)
				.collect(Collectors.joining(" " + node.getKind().getKeyword() + " "));
	}

	@Override
	public String visitModalOp(ModalOpNode node)
	{
		StringBuilder sb = new StringBuilder(node.getOperator().getKeyword());
		Object probability = node.getMetadata(ModalOpNode.PROBABILITY_KEY);
		if (node.hasAgentOrWorld())
		{
			sb.append('[').append(node.getAgentOrWorld().accept(this)).append(']');
		}
		else if (node.getOperator() == ModalOperator.PROBABILITY && probability != null)
		{
			sb.append('[').append(plain(probability)).append(']');
		}
		return sb.append(' ').append(nested(node.getProposition())).toString();
	}

	@Override
	public String visitLambda(LambdaNode node)
	{
		String vars = node.getBoundVariables().stream()
				.map(FormulaPrinter::binder)
				.collect(Collectors.joining(" "));
		return "lambda " + vars + ". " + node.getBody().accept(this);
	}

	@Override
	public String visitDefinition(DefinitionNode node)
	{
		return "define " + node.getSymbolName() + ":" + node.getSymbolType() + " := " + node.getBody().accept(this);
	}
}
