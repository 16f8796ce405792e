package org.lokray.godel.ast;

import org.lokray.godel.semantic.type.Type;

import java.util.Map;
import java.util.Objects;

/**
 * Defines a constant, function or predicate symbol by an expression body.
 */
public final class DefinitionNode extends Node
{
	private final String symbolName;
	private final Type symbolType;
	private final Node body;

	public DefinitionNode(String symbolName, Type symbolType, Node body, Type type)
	{
		this(symbolName, symbolType, body, type, null);
	}

	public DefinitionNode(String symbolName, Type symbolType, Node body, Type type, Map<String, Object> metadata)
	{
		super(type, metadata);
		this.symbolName = Objects.requireNonNull(symbolName, "symbolName");
		this.symbolType = Objects.requireNonNull(symbolType, "symbolType");
		this.body = Objects.requireNonNull(body, "body");
	}

	public String getSymbolName()
	{
		return symbolName;
	}

	public Type getSymbolType()
	{
		return symbolType;
	}

	public Node getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor)
	{
		return visitor.visitDefinition(this);
	}

	@Override
	public Node substitute(Map<VariableNode, Node> substitution)
	{
		Node newBody = body.substitute(substitution);
		if (newBody == body)
		{
			return this;
		}
		return new DefinitionNode(symbolName, symbolType, newBody, getType(), getMetadata());
	}

	@Override
	public boolean containsVariable(VariableNode variable)
	{
		return body.containsVariable(variable);
	}

	@Override
	protected DefinitionNode withReplacedMetadata(Map<String, Object> newMetadata)
	{
		return new DefinitionNode(symbolName, symbolType, body, getType(), newMetadata);
	}

	@Override
	public boolean equals(Object obj)
	{
		if (!super.equals(obj))
		{
			return false;
		}
		DefinitionNode that = (DefinitionNode) obj;
		return symbolName.equals(that.symbolName) && symbolType.equals(that.symbolType) && body.equals(that.body);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(super.hashCode(), symbolName, symbolType, body);
	}
}
