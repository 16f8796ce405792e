package org.lokray.godel.semantic;

import org.lokray.godel.semantic.type.Type;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The "is-a" graph between atomic and instantiated parametric types. Edges point from a
 * type to its direct supertypes; subtype queries are reachability over those edges.
 * <p>
 * Ancestor sets are computed by BFS on first use and cached until the next edge is added.
 * Mutation is expected from a single writer at a time (see {@link TypeSystemManager}).
 */
public class TypeHierarchy
{
	private final Map<Type, Set<Type>> directSupertypes = new ConcurrentHashMap<>();
	private final Map<Type, Set<Type>> ancestorCache = new ConcurrentHashMap<>();

	public synchronized void addNode(Type type)
	{
		directSupertypes.putIfAbsent(type, Collections.emptySet());
	}

	public synchronized void addEdge(Type subtype, Type supertype)
	{
		addNode(supertype);
		Set<Type> current = directSupertypes.getOrDefault(subtype, Collections.emptySet());
		// Copy-on-write so readers iterating the old set are unaffected.
		Set<Type> updated = new LinkedHashSet<>(current);
		updated.add(supertype);
		directSupertypes.put(subtype, Collections.unmodifiableSet(updated));
		ancestorCache.clear();
	}

	public boolean containsNode(Type type)
	{
		return directSupertypes.containsKey(type);
	}

	public Set<Type> getDirectSupertypes(Type type)
	{
		return directSupertypes.getOrDefault(type, Collections.emptySet());
	}

	/**
	 * All strict ancestors of {@code type}, nearest first.
	 */
	public Set<Type> getAncestors(Type type)
	{
		if (!containsNode(type))
		{
			return Collections.emptySet();
		}
		return ancestorCache.computeIfAbsent(type, this::computeAncestors);
	}

	public boolean isReachable(Type from, Type to)
	{
		if (!containsNode(from) || !containsNode(to))
		{
			return false;
		}
		return from.equals(to) || getAncestors(from).contains(to);
	}

	private Set<Type> computeAncestors(Type start)
	{
		Set<Type> visited = new LinkedHashSet<>();
		Deque<Type> queue = new ArrayDeque<>(getDirectSupertypes(start));
		while (!queue.isEmpty())
		{
			Type next = queue.poll();
			if (visited.add(next))
			{
				queue.addAll(getDirectSupertypes(next));
			}
		}
		visited.remove(start);
		return Collections.unmodifiableSet(visited);
	}
}
