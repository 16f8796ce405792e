package org.lokray.godel.semantic;

import org.lokray.godel.ast.VariableNode;
import org.lokray.godel.semantic.type.Type;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A chain of scopes mapping variable ids to types. Lookups walk outwards through the
 * enclosing scopes; bindings are only ever added to the current scope.
 */
public class TypeEnvironment
{
	private final TypeEnvironment parent;
	private final Map<Integer, Type> bindings = new HashMap<>();

	public TypeEnvironment()
	{
		this(null);
	}

	public TypeEnvironment(TypeEnvironment parent)
	{
		this.parent = parent;
	}

	public TypeEnvironment getParent()
	{
		return parent;
	}

	/**
	 * Resolves the variable through the scope chain, without falling back to the type the
	 * node carries.
	 */
	public Optional<Type> resolve(VariableNode variable)
	{
		Type local = bindings.get(variable.getVarId());
		if (local != null)
		{
			return Optional.of(local);
		}
		if (parent != null)
		{
			return parent.resolve(variable);
		}
		return Optional.empty();
	}

	/**
	 * @return the bound type, else the type stored on the node, else {@code null}.
	 */
	public Type getType(VariableNode variable)
	{
		return resolve(variable).orElse(variable.getType());
	}

	public void setType(VariableNode variable, Type type)
	{
		bindings.put(variable.getVarId(), type);
	}

	public boolean isBoundLocally(VariableNode variable)
	{
		return bindings.containsKey(variable.getVarId());
	}

	public TypeEnvironment extend()
	{
		return new TypeEnvironment(this);
	}

	/**
	 * Duplicates this scope's bindings under the same parent.
	 */
	public TypeEnvironment copy()
	{
		TypeEnvironment copy = new TypeEnvironment(parent);
		copy.bindings.putAll(bindings);
		return copy;
	}
}
