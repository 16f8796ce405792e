package org.lokray.godel.semantic.type;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An immutable mapping from type variables to types, as produced by unification.
 */
public final class Substitution
{
	private static final Substitution EMPTY = new Substitution(Collections.emptyMap());

	private final Map<TypeVariable, Type> bindings;

	private Substitution(Map<TypeVariable, Type> bindings)
	{
		this.bindings = bindings;
	}

	public static Substitution empty()
	{
		return EMPTY;
	}

	public static Substitution of(TypeVariable variable, Type type)
	{
		Map<TypeVariable, Type> map = new LinkedHashMap<>();
		map.put(variable, type);
		return new Substitution(Collections.unmodifiableMap(map));
	}

	public static Substitution of(Map<TypeVariable, Type> bindings)
	{
		if (bindings.isEmpty())
		{
			return EMPTY;
		}
		return new Substitution(Collections.unmodifiableMap(new LinkedHashMap<>(bindings)));
	}

	public Type get(TypeVariable variable)
	{
		return bindings.get(variable);
	}

	public boolean isEmpty()
	{
		return bindings.isEmpty();
	}

	public int size()
	{
		return bindings.size();
	}

	public Map<TypeVariable, Type> asMap()
	{
		return bindings;
	}

	public Type apply(Type type)
	{
		return isEmpty() ? type : type.substituteTypeVariables(bindings);
	}

	/**
	 * Returns {@code next} after {@code this}: {@code next} is applied to the range of this
	 * substitution first, then the bindings of {@code next} for unbound variables are added.
	 */
	public Substitution compose(Substitution next)
	{
		if (next.isEmpty())
		{
			return this;
		}
		if (this.isEmpty())
		{
			return next;
		}

		Map<TypeVariable, Type> merged = new LinkedHashMap<>();
		for (Map.Entry<TypeVariable, Type> entry : bindings.entrySet())
		{
			merged.put(entry.getKey(), next.apply(entry.getValue()));
		}
		for (Map.Entry<TypeVariable, Type> entry : next.bindings.entrySet())
		{
			merged.putIfAbsent(entry.getKey(), entry.getValue());
		}
		return new Substitution(Collections.unmodifiableMap(merged));
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
		return bindings.equals(((Substitution) obj).bindings);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(bindings);
	}

	@Override
	public String toString()
	{
		return bindings.entrySet().stream()
				.map(e -> e.getKey() + " := " + e.getValue())
				.collect(Collectors.joining(", ", "{", "}"));
	}
}
