package org.lokray.godel.semantic.type;

import org.lokray.godel.semantic.TypeSystemManager;

import java.util.Map;
import java.util.Objects;

/**
 * A placeholder solved by unification, written {@code ?T} in type annotations.
 */
public final class TypeVariable implements Type
{
	private final String name;

	public TypeVariable(String name)
	{
		if (name == null || name.isBlank())
		{
			throw new IllegalArgumentException("Type variable name must not be empty");
		}
		this.name = name;
	}

	@Override
	public String getName()
	{
		return name;
	}

	/**
	 * A type variable is only a subtype of itself. Solving it is unification's job.
	 */
	@Override
	public boolean isSubtypeOf(Type other, TypeSystemManager typeSystem)
	{
		return this.equals(other);
	}

	@Override
	public Type substituteTypeVariables(Map<TypeVariable, Type> bindings)
	{
		Type bound = bindings.get(this);
		return bound != null ? bound : this;
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor)
	{
		return visitor.visitTypeVariable(this);
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
		return name.equals(((TypeVariable) obj).name);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash("TypeVariable", name);
	}

	@Override
	public String toString()
	{
		return "?" + name;
	}
}
