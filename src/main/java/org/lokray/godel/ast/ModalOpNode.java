package org.lokray.godel.ast;

import org.lokray.godel.semantic.type.Type;

import java.util.Map;
import java.util.Objects;

/**
 * A modal qualifier around a proposition, with an optional agent (epistemic operators) or
 * world (alethic operators). {@code prob[p]} keeps its value under the
 * {@value #PROBABILITY_KEY} metadata key.
 */
public final class ModalOpNode extends Node
{
	public static final String PROBABILITY_KEY = "probability";

	private final ModalOperator operator;
	private final Node proposition;
	private final Node agentOrWorld;

	public ModalOpNode(ModalOperator operator, Node proposition, Type type)
	{
		this(operator, proposition, type, null, null);
	}

	public ModalOpNode(ModalOperator operator, Node proposition, Type type, Node agentOrWorld)
	{
		this(operator, proposition, type, agentOrWorld, null);
	}

	public ModalOpNode(ModalOperator operator, Node proposition, Type type, Node agentOrWorld, Map<String, Object> metadata)
	{
		super(type, metadata);
		this.operator = Objects.requireNonNull(operator, "operator");
		this.proposition = Objects.requireNonNull(proposition, "proposition");
		this.agentOrWorld = agentOrWorld;
	}

	public ModalOperator getOperator()
	{
		return operator;
	}

	public Node getProposition()
	{
		return proposition;
	}

	public Node getAgentOrWorld()
	{
		return agentOrWorld;
	}

	public boolean hasAgentOrWorld()
	{
		return agentOrWorld != null;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor)
	{
		return visitor.visitModalOp(this);
	}

	@Override
	public Node substitute(Map<VariableNode, Node> substitution)
	{
		Node newProposition = proposition.substitute(substitution);
		Node newAgent = agentOrWorld != null ? agentOrWorld.substitute(substitution) : null;
		if (newProposition == proposition && newAgent == agentOrWorld)
		{
			return this;
		}
		return new ModalOpNode(operator, newProposition, getType(), newAgent, getMetadata());
	}

	@Override
	public boolean containsVariable(VariableNode variable)
	{
		return proposition.containsVariable(variable)
				|| (agentOrWorld != null && agentOrWorld.containsVariable(variable));
	}

	@Override
	protected ModalOpNode withReplacedMetadata(Map<String, Object> newMetadata)
	{
		return new ModalOpNode(operator, proposition, getType(), agentOrWorld, newMetadata);
	}

	@Override
	public boolean equals(Object obj)
	{
		if (!super.equals(obj))
		{
			return false;
		}
		ModalOpNode that = (ModalOpNode) obj;
		return operator == that.operator && proposition.equals(that.proposition)
				&& Objects.equals(agentOrWorld, that.agentOrWorld);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(super.hashCode(), operator, proposition, agentOrWorld);
	}
}
