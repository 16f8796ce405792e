package org.lokray.godel.ast;

import org.lokray.godel.semantic.type.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A propositional connective. {@code NOT} takes exactly one operand, the others at least two.
 */
public final class ConnectiveNode extends Node
{
	private final ConnectiveKind kind;
	private final List<Node> operands;

	public ConnectiveNode(ConnectiveKind kind, List<Node> operands, Type type)
	{
		this(kind, operands, type, null);
	}

	public ConnectiveNode(ConnectiveKind kind, List<Node> operands, Type type, Map<String, Object> metadata)
	{
		super(type, metadata);
		this.kind = Objects.requireNonNull(kind, "kind");
		this.operands = List.copyOf(operands);
		if (kind.isUnary() && this.operands.size() != 1)
		{
			throw new IllegalArgumentException("NOT takes exactly one operand, got " + this.operands.size());
		}
		if (!kind.isUnary() && this.operands.size() < 2)
		{
			throw new IllegalArgumentException(kind + " takes at least two operands, got " + this.operands.size());
		}
	}

	public ConnectiveKind getKind()
	{
		return kind;
	}

	public List<Node> getOperands()
	{
		return operands;
	}

	@Override
	public <R> R accept(NodeVisitor<R> visitor)
	{
		return visitor.visitConnective(this);
	}

	@Override
	public Node substitute(Map<VariableNode, Node> substitution)
	{
		boolean changed = false;
		List<Node> newOperands = new ArrayList<>(operands.size());
		for (Node operand : operands)
		{
			Node newOperand = operand.substitute(substitution);
			changed |= newOperand != operand;
			newOperands.add(newOperand);
		}
		if (!changed)
		{
			return this;
		}
		return new ConnectiveNode(kind, newOperands, getType(), getMetadata());
	}

	@Override
	public boolean containsVariable(VariableNode variable)
	{
		return operands.stream().anyMatch(op -> op.containsVariable(variable));
	}

	@Override
	protected ConnectiveNode withReplacedMetadata(Map<String, Object> newMetadata)
	{
		return new ConnectiveNode(kind, operands, getType(), newMetadata);
	}

	@Override
	public boolean equals(Object obj)
	{
		if (!super.equals(obj))
		{
			return false;
		}
		ConnectiveNode that = (ConnectiveNode) obj;
		return kind == that.kind && operands.equals(that.operands);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(super.hashCode(), kind, operands);
	}
}
