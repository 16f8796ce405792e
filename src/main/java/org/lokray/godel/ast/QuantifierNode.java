package org.lokray.godel.ast;

import org.lokray.godel.semantic.type.Type;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A universally or existentially quantified formula binding one or more variables.
 */
public final class QuantifierNode extends Node
{
	private final QuantifierKind kind;
	private final List<VariableNode> boundVariables;
	private final Node scope;

	public QuantifierNode(QuantifierKind kind, List<VariableNode> boundVariables, Node scope, Type type)
	{
		this(kind, boundVariables, scope, type, null);
	}

	public QuantifierNode(QuantifierKind kind, List<VariableNode> boundVariables, Node scope, Type type, Map<String, Object> metadata)
	{
		super(type, metadata);
		this.kind = Objects.requireNonNull(kind, "kind");
		this.boundVariables = List.copyOf(boundVariables);
		this.scope = Objects.requireNonNull(scope, "scope");
		if (this.boundVariables.isEmpty())
		{
			throw new IllegalArgumentException(kind + " must bind at least one variable");
		}
	}

	public QuantifierKind getKind()
	{
		return kind;
	}

	public List<VariableNode> getBoundVariables()
	{
		return boundVariables;
	}

	public Node getScope()
	{
		return scope;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor)
	{
		return visitor.visitQuantifier(this);
	}

	@Override
	public Node substitute(Map<VariableNode, Node> substitution)
	{
		Binders.Result result = Binders.substitute(boundVariables, scope, substitution);
		if (result == null || (result.body == scope && result.boundVariables.equals(boundVariables)))
		{
			return this;
		}
		return new QuantifierNode(kind, result.boundVariables, result.body, getType(), getMetadata());
	}

	@Override
	public boolean containsVariable(VariableNode variable)
	{
		if (Binders.binds(boundVariables, variable))
		{
			return false;
		}
		return scope.containsVariable(variable);
	}

	@Override
	protected QuantifierNode withReplacedMetadata(Map<String, Object> newMetadata)
	{
		return new QuantifierNode(kind, boundVariables, scope, getType(), newMetadata);
	}

	@Override
	public boolean equals(Object obj)
	{
		if (!super.equals(obj))
		{
			return false;
		}
		QuantifierNode that = (QuantifierNode) obj;
		return kind == that.kind && boundVariables.equals(that.boundVariables) && scope.equals(that.scope);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(super.hashCode(), kind, boundVariables, scope);
	}
}
