package org.lokray.godel.semantic.type;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the type variables occurring in argument, return and parametric-argument
 * positions of a type.
 */
public class TypeVariableCollector implements TypeVisitor<Set<TypeVariable>>
{
	private final Set<TypeVariable> found = new LinkedHashSet<>();

	public static Set<TypeVariable> collect(Type type)
	{
		return type.accept(new TypeVariableCollector());
	}

	public static boolean occursIn(TypeVariable variable, Type type)
	{
		return collect(type).contains(variable);
	}

	@Override
	public Set<TypeVariable> visitAtomicType(AtomicType type)
	{
		return found;
	}

	@Override
	public Set<TypeVariable> visitFunctionType(FunctionType type)
	{
		for (Type arg : type.getArgumentTypes())
		{
			arg.accept(this);
		}
		type.getReturnType().accept(this);
		return found;
	}

	@Override
	public Set<TypeVariable> visitTypeVariable(TypeVariable type)
	{
		found.add(type);
		return found;
	}

	// A constructor's parameters are bound by the template itself.
	@Override
	public Set<TypeVariable> visitParametricTypeConstructor(ParametricTypeConstructor type)
	{
		return found;
	}

	@Override
	public Set<TypeVariable> visitInstantiatedParametricType(InstantiatedParametricType type)
	{
		for (Type arg : type.getActualTypeArguments())
		{
			arg.accept(this);
		}
		return found;
	}
}
