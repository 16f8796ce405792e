package org.lokray.godel.ast;

import org.lokray.godel.semantic.type.Type;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Base class of the typed logical AST. Nodes are immutable values: substitution and
 * metadata updates return new nodes that share every unchanged child.
 */
public abstract class Node
{
	private final Type type;
	private final Map<String, Object> metadata;

	protected Node(Type type, Map<String, Object> metadata)
	{
		this.type = type;
		this.metadata = metadata == null || metadata.isEmpty()
				? Collections.emptyMap()
				: Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
	}

	/**
	 * The node's type, or {@code null} for externally built nodes whose type is left to
	 * inference.
	 */
	public Type getType()
	{
		return type;
	}

	public Map<String, Object> getMetadata()
	{
		return metadata;
	}

	public Object getMetadata(String key)
	{
		return metadata.get(key);
	}

	public abstract <R> R accept(NodeVisitor<R> visitor);

	/**
	 * Replaces free occurrences of the mapped variables. Binders whose variables would
	 * capture a replacement are alpha-renamed first.
	 */
	public abstract Node substitute(Map<VariableNode, Node> substitution);

	/**
	 * Checks whether {@code variable} occurs free in this subtree.
	 */
	public abstract boolean containsVariable(VariableNode variable);

	protected abstract Node withReplacedMetadata(Map<String, Object> newMetadata);

	public Node withMetadata(String key, Object value)
	{
		Map<String, Object> updated = new LinkedHashMap<>(metadata);
		updated.put(key, value);
		return withReplacedMetadata(updated);
	}

	public Node withMetadata(Map<String, Object> updates)
	{
		Map<String, Object> updated = new LinkedHashMap<>(metadata);
		updated.putAll(updates);
		return withReplacedMetadata(updated);
	}

	public Set<VariableNode> getFreeVariables()
	{
		return VariableCollector.freeVariables(this);
	}

	public Set<VariableNode> getAllVariables()
	{
		return VariableCollector.allVariables(this);
	}

	@Override
	public boolean equals(Object obj)
	{
		if (this == obj)
		{
			return true;
		}
		if (obj == null || getClass() != obj.getClass())
		{
			return false;
		}
		Node that = (Node) obj;
		return Objects.equals(type, that.type) && metadata.equals(that.metadata);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(getClass(), type, metadata);
	}

	@Override
	public String toString()
	{
		return FormulaPrinter.print(this);
	}
}
