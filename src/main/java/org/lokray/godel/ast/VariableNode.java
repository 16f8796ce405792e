package org.lokray.godel.ast;

import org.lokray.godel.semantic.type.Type;

import java.util.Map;
import java.util.Objects;

/**
 * A variable occurrence or binder. The id is unique within one parse, so two variables
 * with the same surface name in different scopes stay distinct.
 */
public final class VariableNode extends Node
{
	private final String name;
	private final int varId;

	public VariableNode(String name, int varId, Type type)
	{
		this(name, varId, type, null);
	}

	public VariableNode(String name, int varId, Type type, Map<String, Object> metadata)
	{
		super(type, metadata);
		this.name = Objects.requireNonNull(name, "name");
		this.varId = varId;
	}

	public String getName()
	{
		return name;
	}

	public int getVarId()
	{
		return varId;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor)
	{
		return visitor.visitVariable(this);
	}

	@Override
	public Node substitute(Map<VariableNode, Node> substitution)
	{
		Node replacement = substitution.get(this);
		return replacement != null ? replacement : this;
	}

	@Override
	public boolean containsVariable(VariableNode variable)
	{
		return this.equals(variable);
	}

	@Override
	protected VariableNode withReplacedMetadata(Map<String, Object> newMetadata)
	{
		return new VariableNode(name, varId, getType(), newMetadata);
	}

	@Override
	public boolean equals(Object obj)
	{
		if (!super.equals(obj))
		{
			return false;
		}
		VariableNode that = (VariableNode) obj;
		return varId == that.varId && name.equals(that.name);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(super.hashCode(), name, varId);
	}
}
