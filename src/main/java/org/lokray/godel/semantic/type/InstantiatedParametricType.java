package org.lokray.godel.semantic.type;

import org.lokray.godel.semantic.TypeSystemManager;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A parametric type with concrete arguments, such as {@code List[Entity]} or
 * {@code Map[String, Agent]}.
 */
public final class InstantiatedParametricType implements Type
{
	private final ParametricTypeConstructor constructor;
	private final List<Type> actualTypeArguments;

	public InstantiatedParametricType(ParametricTypeConstructor constructor, List<Type> actualTypeArguments)
	{
		this.constructor = Objects.requireNonNull(constructor, "constructor");
		if (actualTypeArguments.size() != constructor.getArity())
		{
			throw new IllegalArgumentException(String.format("Expected %d type arguments for %s, got %d",
					constructor.getArity(), constructor.getName(), actualTypeArguments.size()));
		}
		this.actualTypeArguments = List.copyOf(actualTypeArguments);
	}

	public ParametricTypeConstructor getConstructor()
	{
		return constructor;
	}

	public List<Type> getActualTypeArguments()
	{
		return actualTypeArguments;
	}

	@Override
	public String getName()
	{
		String args = actualTypeArguments.stream()
				.map(Type::toString)
				.collect(Collectors.joining(", "));
		return constructor.getName() + "[" + args + "]";
	}

	@Override
	public boolean isSubtypeOf(Type other, TypeSystemManager typeSystem)
	{
		if (this.equals(other))
		{
			return true;
		}

		if (other instanceof InstantiatedParametricType otherInstance
				&& constructor.equals(otherInstance.constructor))
		{
			// Invariant arguments: List[Agent] is not a List[Entity] unless a fact says so.
			if (actualTypeArguments.equals(otherInstance.actualTypeArguments))
			{
				return true;
			}
		}

		return typeSystem.isDeclaredSubtype(this, other);
	}

	@Override
	public Type substituteTypeVariables(Map<TypeVariable, Type> bindings)
	{
		List<Type> newArgs = new ArrayList<>(actualTypeArguments.size());
		for (Type arg : actualTypeArguments)
		{
			newArgs.add(arg.substituteTypeVariables(bindings));
		}
		return new InstantiatedParametricType(constructor, newArgs);
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor)
	{
		return visitor.visitInstantiatedParametricType(this);
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
		InstantiatedParametricType that = (InstantiatedParametricType) obj;
		return constructor.equals(that.constructor) && actualTypeArguments.equals(that.actualTypeArguments);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash("InstantiatedParametricType", constructor, actualTypeArguments);
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
