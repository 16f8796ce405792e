package org.lokray.godel.semantic.type;

import org.lokray.godel.semantic.TypeSystemManager;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The type of a function or predicate symbol: {@code (A1, ..., An) -> R}. The arity is
 * fixed at construction.
 */
public final class FunctionType implements Type
{
	private final List<Type> argumentTypes;
	private final Type returnType;

	public FunctionType(List<Type> argumentTypes, Type returnType)
	{
		Objects.requireNonNull(argumentTypes, "argumentTypes");
		for (Type t : argumentTypes)
		{
			Objects.requireNonNull(t, "argument type");
		}
		this.argumentTypes = List.copyOf(argumentTypes);
		this.returnType = Objects.requireNonNull(returnType, "returnType");
	}

	public List<Type> getArgumentTypes()
	{
		return argumentTypes;
	}

	public Type getReturnType()
	{
		return returnType;
	}

	public int getArity()
	{
		return argumentTypes.size();
	}

	@Override
	public String getName()
	{
		String args = argumentTypes.stream()
				.map(Type::toString)
				.collect(Collectors.joining(", "));
		return "(" + args + ") -> " + returnType;
	}

	/**
	 * Contravariant in the arguments, covariant in the return type.
	 */
	@Override
	public boolean isSubtypeOf(Type other, TypeSystemManager typeSystem)
	{
		if (this.equals(other))
		{
			return true;
		}
		if (!(other instanceof FunctionType otherFunction))
		{
			return false;
		}
		if (getArity() != otherFunction.getArity())
		{
			return false;
		}

		for (int i = 0; i < argumentTypes.size(); i++)
		{
			if (!typeSystem.isSubtype(otherFunction.argumentTypes.get(i), argumentTypes.get(i)))
			{
				return false;
			}
		}
		return typeSystem.isSubtype(returnType, otherFunction.returnType);
	}

	@Override
	public Type substituteTypeVariables(Map<TypeVariable, Type> bindings)
	{
		List<Type> newArgs = new ArrayList<>(argumentTypes.size());
		for (Type arg : argumentTypes)
		{
			newArgs.add(arg.substituteTypeVariables(bindings));
		}
		return new FunctionType(newArgs, returnType.substituteTypeVariables(bindings));
	}

	@Override
	public <R> R accept(TypeVisitor<R> visitor)
	{
		return visitor.visitFunctionType(this);
	}

	@Override
	public boolean isFunction()
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
		FunctionType that = (FunctionType) obj;
		return argumentTypes.equals(that.argumentTypes) && returnType.equals(that.returnType);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash("FunctionType", argumentTypes, returnType);
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
