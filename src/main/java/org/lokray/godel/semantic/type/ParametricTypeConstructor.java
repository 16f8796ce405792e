package org.lokray.godel.semantic.type;

import org.lokray.godel.semantic.TypeSystemManager;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A generic template such as {@code List[?T]}. Only instantiations appear in the hierarchy.
 */
public final class ParametricTypeConstructor implements Type
{
	private final String name;
	private final List<TypeVariable> typeParameters;

	public ParametricTypeConstructor(String name, List<TypeVariable> typeParameters)
	{
		if (name == null || name.isBlank())
		{
			throw new IllegalArgumentException("Type constructor name must not be empty");
		}
		this.name = name;
		this.typeParameters = List.copyOf(typeParameters);
	}

	@Override
	public String getName()
	{
		return name;
	}

	public List<TypeVariable> getTypeParameters()
	{
		return typeParameters;
	}

	public int getArity()
	{
		return typeParameters.size();
	}

	public InstantiatedParametricType instantiate(List<Type> actualTypeArguments)
	{
		return new InstantiatedParametricType(this, actualTypeArguments);
	}

	@Override
	public boolean isSubtypeOf(Type other, TypeSystemManager typeSystem)
	{
		return this.equals(other);
	}

	// The parameters are binders of the template, so substitution leaves them alone.
	@Override
	public Type substituteTypeVariables(Map<TypeVariable, Type> bindings)
	{
		return this;
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor)
	{
		return visitor.visitParametricTypeConstructor(this);
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
		ParametricTypeConstructor that = (ParametricTypeConstructor) obj;
		return name.equals(that.name) && typeParameters.equals(that.typeParameters);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash("ParametricTypeConstructor", name, typeParameters);
	}

	@Override
	public String toString()
	{
		String params = typeParameters.stream()
				.map(TypeVariable::toString)
				.collect(Collectors.joining(", "));
		return name + "[" + params + "]";
	}
}
