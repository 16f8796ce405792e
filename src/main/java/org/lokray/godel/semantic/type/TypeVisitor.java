package org.lokray.godel.semantic.type;

/**
 * Double dispatch over the type variants.
 */
public interface TypeVisitor<R>
{
	R visitAtomicType(AtomicType type);

	R visitFunctionType(FunctionType type);

	R visitTypeVariable(TypeVariable type);

	R visitParametricTypeConstructor(ParametricTypeConstructor type);

	R visitInstantiatedParametricType(InstantiatedParametricType type);
}
