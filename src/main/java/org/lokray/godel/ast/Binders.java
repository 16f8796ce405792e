package org.lokray.godel.ast;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Capture-avoiding substitution under a binder shared by quantifiers and lambdas.
 */
final class Binders
{
	private Binders()
	{
	}

	static final class Result
	{
		final List<VariableNode> boundVariables;
		final Node body;

		Result(List<VariableNode> boundVariables, Node body)
		{
			this.boundVariables = boundVariables;
			this.body = body;
		}
	}

	static boolean binds(List<VariableNode> boundVariables, VariableNode variable)
	{
		for (VariableNode bound : boundVariables)
		{
			if (bound.getVarId() == variable.getVarId())
			{
				return true;
			}
		}
		return false;
	}

	/**
	 * @return the renamed binders and new body, or {@code null} when nothing changes.
	 */
	static Result substitute(List<VariableNode> boundVariables, Node body, Map<VariableNode, Node> substitution)
	{
		// Entries for shadowed variables or variables absent from the body are irrelevant.
		Map<VariableNode, Node> relevant = new LinkedHashMap<>();
		for (Map.Entry<VariableNode, Node> entry : substitution.entrySet())
		{
			VariableNode key = entry.getKey();
			if (!binds(boundVariables, key) && body.containsVariable(key))
			{
				relevant.put(key, entry.getValue());
			}
		}
		if (relevant.isEmpty())
		{
			return null;
		}

		Set<String> incomingNames = new HashSet<>();
		Set<Integer> incomingIds = new HashSet<>();
		for (Node replacement : relevant.values())
		{
			for (VariableNode free : replacement.getFreeVariables())
			{
				incomingNames.add(free.getName());
				incomingIds.add(free.getVarId());
			}
		}

		int nextId = maxVariableId(boundVariables, body, substitution) + 1;
		Map<VariableNode, Node> renaming = new HashMap<>();
		List<VariableNode> newBound = new ArrayList<>(boundVariables.size());
		for (VariableNode bound : boundVariables)
		{
			if (incomingNames.contains(bound.getName()) || incomingIds.contains(bound.getVarId()))
			{
				int freshId = nextId++;
				VariableNode renamed = new VariableNode(bound.getName() + "_" + freshId, freshId,
						bound.getType(), bound.getMetadata());
				renaming.put(bound, renamed);
				newBound.add(renamed);
			}
			else
			{
				newBound.add(bound);
			}
		}

		Node newBody = renaming.isEmpty() ? body : body.substitute(renaming);
		newBody = newBody.substitute(relevant);
		return new Result(newBound, newBody);
	}

	private static int maxVariableId(List<VariableNode> boundVariables, Node body, Map<VariableNode, Node> substitution)
	{
		int max = -1;
		for (VariableNode v : boundVariables)
		{
			max = Math.max(max, v.getVarId());
		}
		for (VariableNode v : body.getAllVariables())
		{
			max = Math.max(max, v.getVarId());
		}
		for (Map.Entry<VariableNode, Node> entry : substitution.entrySet())
		{
			max = Math.max(max, entry.getKey().getVarId());
			for (VariableNode v : entry.getValue().getAllVariables())
			{
				max = Math.max(max, v.getVarId());
			}
		}
		return max;
	}
}
