package org.lokray.godel.ast;

import org.lokray.godel.semantic.type.Type;

import java.util.Map;
import java.util.Objects;

/**
 * A constant, function or predicate symbol, or a literal when {@link #getValue()} is set.
 */
public final class ConstantNode extends Node
{
	private final String name;
	private final Object value;

	public ConstantNode(String name, Type type)
	{
		this(name, type, null, null);
	}

	public ConstantNode(String name, Type type, Object value)
	{
		this(name, type, value, null);
	}

	public ConstantNode(String name, Type type, Object value, Map<String, Object> metadata)
	{
		super(type, metadata);
		this.name = Objects.requireNonNull(name, "name");
		this.value = value;
	}

	public String getName()
	{
		return name;
	}

	public Object getValue()
	{
		return value;
	}

	public boolean isLiteral()
	{
		return value != null;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor)
	{
		return visitor.visitConstant(this);
	}

	@Override
	public Node substitute(Map<VariableNode, Node> substitution)
	{
		return this;
	}

	@Override
	public boolean containsVariable(VariableNode variable)
	{
		return false;
	}

	@Override
	protected ConstantNode withReplacedMetadata(Map<String, Object> newMetadata)
	{
		return new ConstantNode(name, getType(), value, newMetadata);
	}

	@Override
	public boolean equals(Object obj)
	{
		if (!super.equals(obj))
		{
			return false;
		}
		ConstantNode that = (ConstantNode) obj;
		return name.equals(that.name) && Objects.equals(value, that.value);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(super.hashCode(), name, value);
	}
}
