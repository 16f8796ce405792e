package org.lokray.godel.ast;

import org.lokray.godel.semantic.type.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Application of a function or predicate to arguments. The operator may itself be a
 * variable or lambda in higher-order formulas.
 */
public final class ApplicationNode extends Node
{
	private final Node operator;
	private final List<Node> arguments;

	public ApplicationNode(Node operator, List<Node> arguments, Type type)
	{
		this(operator, arguments, type, null);
	}

	public ApplicationNode(Node operator, List<Node> arguments, Type type, Map<String, Object> metadata)
	{
		super(type, metadata);
		this.operator = Objects.requireNonNull(operator, "operator");
		this.arguments = List.copyOf(arguments);
	}

	public Node getOperator()
	{
		return operator;
	}

	public List<Node> getArguments()
	{
		return arguments;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor)
	{
		return visitor.visitApplication(this);
	}

	@Override
	public Node substitute(Map<VariableNode, Node> substitution)
	{
		Node newOperator = operator.substitute(substitution);
		boolean changed = newOperator != operator;
		List<Node> newArguments = new ArrayList<>(arguments.size());
		for (Node arg : arguments)
		{
			Node newArg = arg.substitute(substitution);
			changed |= newArg != arg;
			newArguments.add(newArg);
		}
		if (!changed)
		{
			return this;
		}
		return new ApplicationNode(newOperator, newArguments, getType(), getMetadata());
	}

	@Override
	public boolean containsVariable(VariableNode variable)
	{
		if (operator.containsVariable(variable))
		{
			return true;
		}
		return arguments.stream().anyMatch(arg -> arg.containsVariable(variable));
	}

	@Override
	protected ApplicationNode withReplacedMetadata(Map<String, Object> newMetadata)
	{
		return new ApplicationNode(operator, arguments, getType(), newMetadata);
	}

	@Override
	public boolean equals(Object obj)
	{
		if (!super.equals(obj))
		{
			return false;
		}
		ApplicationNode that = (ApplicationNode) obj;
		return operator.equals(that.operator) && arguments.equals(that.arguments);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(super.hashCode(), operator, arguments);
	}
}
