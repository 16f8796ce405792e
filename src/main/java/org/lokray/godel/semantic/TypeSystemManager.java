package org.lokray.godel.semantic;

import org.lokray.godel.ast.Node;
import org.lokray.godel.semantic.type.AtomicType;
import org.lokray.godel.semantic.type.FunctionType;
import org.lokray.godel.semantic.type.InstantiatedParametricType;
import org.lokray.godel.semantic.type.ParametricTypeConstructor;
import org.lokray.godel.semantic.type.Substitution;
import org.lokray.godel.semantic.type.Type;
import org.lokray.godel.semantic.type.TypeVariable;
import org.lokray.godel.semantic.type.TypeVariableCollector;
import org.lokray.godel.util.BuiltInTypeLoader;
import org.lokray.godel.util.Debug;
import org.lokray.godel.util.Diagnostic;
import org.lokray.godel.util.TypeDefinitionException;
import org.lokray.godel.util.TypeDefinitionException.Reason;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owns the type registry, the subtype hierarchy and the symbol signature table, and is the
 * entry point for subtyping, unification, inference and checking.
 * <p>
 * Registration methods are synchronized, so writers are serialized. Once registration is
 * done the manager is read-only and may be shared by any number of parsing or checking
 * threads.
 */
public class TypeSystemManager
{
	public static final String ENTITY = "Entity";
	public static final String AGENT = "Agent";
	public static final String EVENT = "Event";
	public static final String ACTION = "Action";
	public static final String PROPOSITION = "Proposition";
	public static final String BOOLEAN = "Boolean";
	public static final String INTEGER = "Integer";
	public static final String STRING = "String";

	private final Map<String, Type> types = new ConcurrentHashMap<>();
	private final List<String> typeOrder = new CopyOnWriteArrayList<>();
	private final Map<String, Type> signatures = new ConcurrentHashMap<>();
	private final List<String> signatureOrder = new CopyOnWriteArrayList<>();
	private final List<Map.Entry<Type, Type>> explicitSubtypeFacts = new CopyOnWriteArrayList<>();
	private final Set<String> builtInNames;
	private final TypeHierarchy hierarchy = new TypeHierarchy();

	public TypeSystemManager()
	{
		BuiltInTypeLoader.defineBuiltIns(this);
		this.builtInNames = Set.copyOf(typeOrder);
	}

	// --- Registration ---

	public AtomicType defineAtomicType(String typeName, String... supertypes)
	{
		return defineAtomicType(typeName, Arrays.asList(supertypes));
	}

	/**
	 * Registers a new atomic type with an edge to each named supertype.
	 *
	 * @throws TypeDefinitionException if the name is taken, or a supertype is unknown or
	 *                                 not atomic.
	 */
	public synchronized AtomicType defineAtomicType(String typeName, List<String> supertypes)
	{
		requireFreeTypeName(typeName);

		List<AtomicType> resolvedSupertypes = new ArrayList<>();
		for (String supertypeName : supertypes)
		{
			Type supertype = types.get(supertypeName);
			if (supertype == null)
			{
				throw new TypeDefinitionException(Reason.UNKNOWN_SUPERTYPE,
						"Supertype " + supertypeName + " not defined");
			}
			if (!(supertype instanceof AtomicType atomicSupertype))
			{
				throw new TypeDefinitionException(Reason.UNKNOWN_SUPERTYPE,
						"Supertype " + supertypeName + " is not an atomic type");
			}
			resolvedSupertypes.add(atomicSupertype);
		}

		AtomicType atomicType = new AtomicType(typeName);
		register(typeName, atomicType);
		hierarchy.addNode(atomicType);
		for (AtomicType supertype : resolvedSupertypes)
		{
			hierarchy.addEdge(atomicType, supertype);
		}
		Debug.logDebug("Defined atomic type " + typeName + (supertypes.isEmpty() ? "" : " <: " + supertypes));
		return atomicType;
	}

	public synchronized ParametricTypeConstructor defineParametricTypeConstructor(String name, List<String> typeParameterNames)
	{
		requireFreeTypeName(name);
		if (typeParameterNames.isEmpty())
		{
			throw new TypeDefinitionException(Reason.ARITY_MISMATCH,
					"Parametric type " + name + " needs at least one type parameter");
		}
		List<TypeVariable> params = new ArrayList<>();
		for (String paramName : typeParameterNames)
		{
			params.add(new TypeVariable(paramName.startsWith("?") ? paramName.substring(1) : paramName));
		}
		ParametricTypeConstructor constructor = new ParametricTypeConstructor(name, params);
		register(name, constructor);
		Debug.logDebug("Defined parametric type constructor " + constructor);
		return constructor;
	}

	public InstantiatedParametricType instantiate(String constructorName, List<Type> typeArguments)
	{
		Type type = types.get(constructorName);
		if (!(type instanceof ParametricTypeConstructor constructor))
		{
			throw new TypeDefinitionException(Reason.UNKNOWN_TYPE,
					"Parametric type constructor " + constructorName + " not defined");
		}
		if (constructor.getArity() != typeArguments.size())
		{
			throw new TypeDefinitionException(Reason.ARITY_MISMATCH, String.format(
					"Expected %d type arguments for %s, got %d", constructor.getArity(), constructorName, typeArguments.size()));
		}
		return constructor.instantiate(typeArguments);
	}

	/**
	 * Records an explicit "is-a" fact between two hierarchy nodes, for example
	 * {@code List[Agent] <: Collection[Agent]} or {@code Roster <: List[Agent]}.
	 */
	public synchronized void defineSubtypeRelation(Type subtype, Type supertype)
	{
		requireHierarchyNode(subtype);
		requireHierarchyNode(supertype);
		if (subtype.equals(supertype))
		{
			return;
		}
		if (isDeclaredSubtype(supertype, subtype))
		{
			throw new TypeDefinitionException(Reason.CYCLIC_HIERARCHY,
					"Declaring " + subtype + " <: " + supertype + " would create a cycle");
		}
		hierarchy.addNode(subtype);
		hierarchy.addEdge(subtype, supertype);
		explicitSubtypeFacts.add(Map.entry(subtype, supertype));
		Debug.logDebug("Defined subtype relation " + subtype + " <: " + supertype);
	}

	public void defineFunctionSignature(String symbol, List<String> argumentTypeNames, String returnTypeName)
	{
		List<Type> argumentTypes = new ArrayList<>();
		for (String argTypeName : argumentTypeNames)
		{
			argumentTypes.add(requireType(argTypeName));
		}
		Type returnType = requireType(returnTypeName);
		defineSignature(symbol, new FunctionType(argumentTypes, returnType));
	}

	public void defineConstant(String symbol, String typeName)
	{
		defineSignature(symbol, requireType(typeName));
	}

	/**
	 * Binds a symbol to its type: a {@link FunctionType} for functions and predicates, any
	 * other type for constants.
	 */
	public synchronized void defineSignature(String symbol, Type type)
	{
		Objects.requireNonNull(type, "type");
		if (signatures.containsKey(symbol))
		{
			throw new TypeDefinitionException(Reason.DUPLICATE_SIGNATURE,
					"Symbol " + symbol + " already has a signature");
		}
		signatures.put(symbol, type);
		signatureOrder.add(symbol);
		Debug.logDebug("Defined signature " + symbol + " : " + type);
	}

	private void requireFreeTypeName(String typeName)
	{
		if (typeName == null || typeName.isBlank())
		{
			throw new IllegalArgumentException("Type name must not be empty");
		}
		if (types.containsKey(typeName))
		{
			throw new TypeDefinitionException(Reason.DUPLICATE_TYPE, "Type " + typeName + " already defined");
		}
	}

	private void register(String name, Type type)
	{
		types.put(name, type);
		typeOrder.add(name);
	}

	private void requireHierarchyNode(Type type)
	{
		if (type instanceof AtomicType)
		{
			if (!type.equals(types.get(type.getName())))
			{
				throw new TypeDefinitionException(Reason.UNKNOWN_TYPE, "Type " + type.getName() + " not defined");
			}
		}
		else if (type instanceof InstantiatedParametricType instance)
		{
			ParametricTypeConstructor constructor = instance.getConstructor();
			if (!constructor.equals(types.get(constructor.getName())))
			{
				throw new TypeDefinitionException(Reason.UNKNOWN_TYPE,
						"Parametric type constructor " + constructor.getName() + " not defined");
			}
		}
		else
		{
			throw new TypeDefinitionException(Reason.UNKNOWN_TYPE,
					"Only atomic and instantiated parametric types take part in the hierarchy, got " + type);
		}
	}

	// --- Queries ---

	public Optional<Type> getType(String typeName)
	{
		return Optional.ofNullable(types.get(typeName));
	}

	public Type requireType(String typeName)
	{
		Type type = types.get(typeName);
		if (type == null)
		{
			throw new TypeDefinitionException(Reason.UNKNOWN_TYPE, "Type " + typeName + " not defined");
		}
		return type;
	}

	public AtomicType getEntityType()
	{
		return (AtomicType) requireType(ENTITY);
	}

	public AtomicType getAgentType()
	{
		return (AtomicType) requireType(AGENT);
	}

	public AtomicType getBooleanType()
	{
		return (AtomicType) requireType(BOOLEAN);
	}

	public Optional<Type> getSignature(String symbol)
	{
		return Optional.ofNullable(signatures.get(symbol));
	}

	public boolean hasSignature(String symbol)
	{
		return signatures.containsKey(symbol);
	}

	/** Registered type names in registration order. */
	public List<String> getTypeNames()
	{
		return Collections.unmodifiableList(typeOrder);
	}

	/** Symbols with a signature, in registration order. */
	public List<String> getSignatureSymbols()
	{
		return Collections.unmodifiableList(signatureOrder);
	}

	public List<Map.Entry<Type, Type>> getExplicitSubtypeFacts()
	{
		return Collections.unmodifiableList(explicitSubtypeFacts);
	}

	public boolean isBuiltIn(String typeName)
	{
		return builtInNames.contains(typeName);
	}

	public Set<Type> getDirectSupertypes(Type type)
	{
		return hierarchy.getDirectSupertypes(type);
	}

	// --- Subtyping ---

	public boolean isSubtype(Type subtype, Type supertype)
	{
		if (subtype == null || supertype == null)
		{
			return false;
		}
		if (subtype.equals(supertype))
		{
			return true;
		}
		if (subtype instanceof AtomicType && supertype instanceof AtomicType)
		{
			return hierarchy.isReachable(subtype, supertype);
		}
		return subtype.isSubtypeOf(supertype, this);
	}

	/**
	 * Reachability in the hierarchy graph alone, without structural rules.
	 */
	public boolean isDeclaredSubtype(Type subtype, Type supertype)
	{
		return hierarchy.isReachable(subtype, supertype);
	}

	// --- Unification ---

	/**
	 * Computes a substitution that makes both types equal. When both sides are distinct
	 * type variables, the left one is bound to the right one.
	 *
	 * @return the most general unifier, or empty when the types do not unify.
	 */
	public Optional<Substitution> unifyTypes(Type left, Type right)
	{
		Objects.requireNonNull(left, "left");
		Objects.requireNonNull(right, "right");

		if (left.equals(right))
		{
			return Optional.of(Substitution.empty());
		}
		if (left instanceof TypeVariable leftVar)
		{
			return bind(leftVar, right);
		}
		if (right instanceof TypeVariable rightVar)
		{
			return bind(rightVar, left);
		}

		if (left instanceof FunctionType leftFn && right instanceof FunctionType rightFn)
		{
			if (leftFn.getArity() != rightFn.getArity())
			{
				return Optional.empty();
			}
			Optional<Substitution> returnUnifier = unifyTypes(leftFn.getReturnType(), rightFn.getReturnType());
			if (returnUnifier.isEmpty())
			{
				return Optional.empty();
			}
			return unifyPairwise(leftFn.getArgumentTypes(), rightFn.getArgumentTypes(), returnUnifier.get());
		}

		if (left instanceof InstantiatedParametricType leftInst && right instanceof InstantiatedParametricType rightInst)
		{
			if (!leftInst.getConstructor().equals(rightInst.getConstructor())
					|| leftInst.getActualTypeArguments().size() != rightInst.getActualTypeArguments().size())
			{
				return Optional.empty();
			}
			return unifyPairwise(leftInst.getActualTypeArguments(), rightInst.getActualTypeArguments(), Substitution.empty());
		}

		return Optional.empty();
	}

	private Optional<Substitution> bind(TypeVariable variable, Type type)
	{
		if (TypeVariableCollector.occursIn(variable, type))
		{
			return Optional.empty();
		}
		return Optional.of(Substitution.of(variable, type));
	}

	private Optional<Substitution> unifyPairwise(List<Type> left, List<Type> right, Substitution accumulated)
	{
		Substitution current = accumulated;
		for (int i = 0; i < left.size(); i++)
		{
			Optional<Substitution> step = unifyTypes(current.apply(left.get(i)), current.apply(right.get(i)));
			if (step.isEmpty())
			{
				return Optional.empty();
			}
			current = current.compose(step.get());
		}
		return Optional.of(current);
	}

	// --- Inference and checking ---

	public InferenceResult inferExpressionType(Node node, TypeEnvironment environment)
	{
		InferenceResult result = node.accept(new TypeInferenceVisitor(this, environment));
		Debug.logDebug("Inferred " + node + " : " + (result.hasErrors() ? result.getErrors() : result.getType()));
		return result;
	}

	public List<Diagnostic> checkExpressionType(Node node, Type expectedType, TypeEnvironment environment)
	{
		List<Diagnostic> errors = node.accept(new TypeCheckingVisitor(this, environment, expectedType));
		Debug.logDebug("Checked " + node + " against " + expectedType + ": " + errors.size() + " error(s)");
		return errors;
	}
}
