package org.lokray.godel.semantic.type;

import org.lokray.godel.semantic.TypeSystemManager;

import java.util.Map;
import java.util.Objects;

/**
 * A nominal, non-decomposable type such as {@code Entity}, {@code Agent} or {@code Boolean}.
 */
public final class AtomicType implements Type
{
	private final String name;

	public AtomicType(String name)
	{
		if (name == null || name.isBlank())
		{
			throw new IllegalArgumentException("Atomic type name must not be empty");
		}
		this.name = name;
	}

	@Override
	public String getName()
	{
		return name;
	}

	/**
	 * Atomic subtyping is graph reachability in the manager's hierarchy, which also covers
	 * explicit facts such as {@code StringList <: List[String]}.
	 */
	@Override
	public boolean isSubtypeOf(Type other, TypeSystemManager typeSystem)
	{
		if (this.equals(other))
		{
			return true;
		}
		return typeSystem.isDeclaredSubtype(this, other);
	}

	@Override
	public Type substituteTypeVariables(Map<TypeVariable, Type> bindings)
	{
		return this;
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor)
	{
		return visitor.visitAtomicType(this);
	}

	@Override
	public boolean isAtomic()
	{
		return true;
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
		return name.equals(((AtomicType) obj).name);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash("AtomicType", name);
	}

	@Override
	public String toString()
	{
		return name;
	}
}
