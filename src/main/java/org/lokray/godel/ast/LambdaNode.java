package org.lokray.godel.ast;

import org.lokray.godel.semantic.type.Type;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Lambda abstraction {@code lambda ?x ?y. body}.
 */
public final class LambdaNode extends Node
{
	private final List<VariableNode> boundVariables;
	private final Node body;

	public LambdaNode(List<VariableNode> boundVariables, Node body, Type type)
	{
		this(boundVariables, body, type, null);
	}

	public LambdaNode(List<VariableNode> boundVariables, Node body, Type type, Map<String, Object> metadata)
	{
		super(type, metadata);
		this.boundVariables = List.copyOf(boundVariables);
		this.body = Objects.requireNonNull(body, "body");
		if (this.boundVariables.isEmpty())
		{
			throw new IllegalArgumentException("lambda must bind at least one variable");
		}
	}

	public List<VariableNode> getBoundVariables()
	{
		return boundVariables;
	}

	public Node getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor)
	{
		return visitor.visitLambda(this);
	}

	@Override
	public Node substitute(Map<VariableNode, Node> substitution)
	{
		Binders.Result result = Binders.substitute(boundVariables, body, substitution);
		if (result == null || (result.body == body && result.boundVariables.equals(boundVariables)))
		{
			return this;
		}
		return new LambdaNode(result.boundVariables, result.body, getType(), getMetadata());
	}

	@Override
	public boolean containsVariable(VariableNode variable)
	{
		if (Binders.binds(boundVariables, variable))
		{
			return false;
		}
		return body.containsVariable(variable);
	}

	@Override
	protected LambdaNode withReplacedMetadata(Map<String, Object> newMetadata)
	{
		return new LambdaNode(boundVariables, body, getType(), newMetadata);
	}

	@Override
	public boolean equals(Object obj)
	{
		if (!super.equals(obj))
		{
			return false;
		}
		LambdaNode that = (LambdaNode) obj;
		return boundVariables.equals(that.boundVariables) && body.equals(that.body);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(super.hashCode(), boundVariables, body);
	}
}
