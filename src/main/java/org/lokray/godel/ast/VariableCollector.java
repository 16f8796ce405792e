package org.lokray.godel.ast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Gathers variables of a subtree, either every occurrence and binder or only the free
 * occurrences.
 */
final class VariableCollector implements NodeVisitor<Void>
{
	private final boolean freeOnly;
	private final Set<VariableNode> found = new LinkedHashSet<>();
	private final Deque<List<VariableNode>> binders = new ArrayDeque<>();

	private VariableCollector(boolean freeOnly)
	{
		this.freeOnly = freeOnly;
	}

	static Set<VariableNode> freeVariables(Node node)
	{
		VariableCollector collector = new VariableCollector(true);
		node.accept(collector);
		return collector.found;
	}

	static Set<VariableNode> allVariables(Node node)
	{
		VariableCollector collector = new VariableCollector(false);
		node.accept(collector);
		return collector.found;
	}

	private boolean isBound(VariableNode variable)
	{
		for (List<VariableNode> scope : binders)
		{
			if (Binders.binds(scope, variable))
			{
				return true;
			}
		}
		return false;
	}

	private void enterBinder(List<VariableNode> bound, Node body)
	{
		if (!freeOnly)
		{
			found.addAll(bound);
		}
		binders.push(bound);
		body.accept(this);
		binders.pop();
	}

	@Override
	public Void visitConstant(ConstantNode node)
	{
		return null;
	}

	@Override
	public Void visitVariable(VariableNode node)
	{
		if (!freeOnly || !isBound(node))
		{
			found.add(node);
		}
		return null;
	}

	@Override
	public Void visitApplication(ApplicationNode node)
	{
		node.getOperator().accept(this);
		for (Node arg : node.getArguments())
		{
			arg.accept(this);
		}
		return null;
	}

	@Override
	public Void visitQuantifier(QuantifierNode node)
	{
		enterBinder(node.getBoundVariables(), node.getScope());
		return null;
	}

	@Override
	public Void visitConnective(ConnectiveNode node)
	{
		for (Node operand : node.getOperands())
		{
			operand.accept(this);
		}
		return null;
	}

	@Override
	public Void visitModalOp(ModalOpNode node)
	{
		if (node.hasAgentOrWorld())
		{
			node.getAgentOrWorld().accept(this);
		}
		node.getProposition().accept(this);
		return null;
	}

	@Override
	public Void visitLambda(LambdaNode node)
	{
		enterBinder(node.getBoundVariables(), node.getBody());
		return null;
	}

	@Override
	public Void visitDefinition(DefinitionNode node)
	{
		node.getBody().accept(this);
		return null;
	}
}
