package org.lokray.godel.semantic;

import org.lokray.godel.ast.ApplicationNode;
import org.lokray.godel.ast.ConnectiveNode;
import org.lokray.godel.ast.ConstantNode;
import org.lokray.godel.ast.DefinitionNode;
import org.lokray.godel.ast.LambdaNode;
import org.lokray.godel.ast.ModalOpNode;
import org.lokray.godel.ast.Node;
import org.lokray.godel.ast.NodeVisitor;
import org.lokray.godel.ast.QuantifierNode;
import org.lokray.godel.ast.VariableNode;
import org.lokray.godel.semantic.type.FunctionType;
import org.lokray.godel.semantic.type.Substitution;
import org.lokray.godel.semantic.type.Type;
import org.lokray.godel.semantic.type.TypeVariableCollector;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.lokray.godel.util.Diagnostic.typeError;

/**
 * Infers the type of each node kind. Every visit stops at the first error it meets and
 * returns it, leaving sibling expressions unchecked.
 */
public class TypeInferenceVisitor implements NodeVisitor<InferenceResult>
{
	private final TypeSystemManager typeSystem;
	private final TypeEnvironment environment;

	public TypeInferenceVisitor(TypeSystemManager typeSystem, TypeEnvironment environment)
	{
		this.typeSystem = typeSystem;
		this.environment = environment;
	}

	@Override
	public InferenceResult visitConstant(ConstantNode node)
	{
		if (node.getType() == null)
		{
			return InferenceResult.failure(typeError("Cannot determine type for constant " + node.getName(), node));
		}
		return InferenceResult.of(node.getType());
	}

	@Override
	public InferenceResult visitVariable(VariableNode node)
	{
		Type varType = environment.getType(node);
		if (varType == null)
		{
			return InferenceResult.failure(typeError("Cannot determine type for variable " + node.getName(), node));
		}
		return InferenceResult.of(varType);
	}

	/**
	 * The operator must be a function of matching arity and every argument a subtype of its
	 * parameter. Parameters mentioning type variables are solved by unification first.
	 */
	@Override
	public InferenceResult visitApplication(ApplicationNode node)
	{
		InferenceResult operatorResult = node.getOperator().accept(this);
		if (operatorResult.hasErrors())
		{
			return operatorResult;
		}

		if (!(operatorResult.getType() instanceof FunctionType functionType))
		{
			return InferenceResult.failure(typeError("Operator " + node.getOperator() + " is not a function", node.getOperator()));
		}

		List<Node> arguments = node.getArguments();
		if (arguments.size() != functionType.getArity())
		{
			return InferenceResult.failure(typeError(String.format("Function expects %d arguments, got %d",
					functionType.getArity(), arguments.size()), node));
		}

		Substitution solved = Substitution.empty();
		for (int i = 0; i < arguments.size(); i++)
		{
			Node arg = arguments.get(i);
			InferenceResult argResult = arg.accept(this);
			if (argResult.hasErrors())
			{
				return argResult;
			}

			Type argType = argResult.getType();
			Type paramType = solved.apply(functionType.getArgumentTypes().get(i));
			if (typeSystem.isSubtype(argType, paramType))
			{
				continue;
			}

			if (!TypeVariableCollector.collect(paramType).isEmpty())
			{
				Optional<Substitution> unifier = typeSystem.unifyTypes(paramType, argType);
				if (unifier.isPresent())
				{
					solved = solved.compose(unifier.get());
					continue;
				}
				return InferenceResult.failure(typeError(String.format("Cannot unify argument %d of type %s with parameter type %s",
						i + 1, argType, paramType), arg));
			}

			return InferenceResult.failure(typeError(String.format("Argument %d has type %s, expected %s",
					i + 1, argType, paramType), arg));
		}

		return InferenceResult.of(solved.apply(functionType.getReturnType()));
	}

	@Override
	public InferenceResult visitQuantifier(QuantifierNode node)
	{
		Type booleanType = typeSystem.getBooleanType();

		TypeInferenceVisitor scopeVisitor = new TypeInferenceVisitor(typeSystem, bind(node.getBoundVariables()));
		InferenceResult scopeResult = node.getScope().accept(scopeVisitor);
		if (scopeResult.hasErrors())
		{
			return scopeResult;
		}

		if (!typeSystem.isSubtype(scopeResult.getType(), booleanType))
		{
			return InferenceResult.failure(typeError(String.format("Quantifier scope has type %s, expected %s",
					scopeResult.getType(), booleanType), node.getScope()));
		}
		return InferenceResult.of(booleanType);
	}

	@Override
	public InferenceResult visitConnective(ConnectiveNode node)
	{
		Type booleanType = typeSystem.getBooleanType();

		for (Node operand : node.getOperands())
		{
			InferenceResult operandResult = operand.accept(this);
			if (operandResult.hasErrors())
			{
				return operandResult;
			}
			if (!typeSystem.isSubtype(operandResult.getType(), booleanType))
			{
				return InferenceResult.failure(typeError(String.format("Connective operand has type %s, expected %s",
						operandResult.getType(), booleanType), operand));
			}
		}
		return InferenceResult.of(booleanType);
	}

	@Override
	public InferenceResult visitModalOp(ModalOpNode node)
	{
		Type booleanType = typeSystem.getBooleanType();

		InferenceResult propResult = node.getProposition().accept(this);
		if (propResult.hasErrors())
		{
			return propResult;
		}
		if (!typeSystem.isSubtype(propResult.getType(), booleanType))
		{
			return InferenceResult.failure(typeError(String.format("Modal proposition has type %s, expected %s",
					propResult.getType(), booleanType), node.getProposition()));
		}

		if (node.hasAgentOrWorld() && node.getOperator().isEpistemic())
		{
			Type agentType = typeSystem.getAgentType();
			InferenceResult agentResult = node.getAgentOrWorld().accept(this);
			if (agentResult.hasErrors())
			{
				return agentResult;
			}
			if (!typeSystem.isSubtype(agentResult.getType(), agentType))
			{
				return InferenceResult.failure(typeError(String.format("Modal agent has type %s, expected %s",
						agentResult.getType(), agentType), node.getAgentOrWorld()));
			}
		}
		return InferenceResult.of(booleanType);
	}

	@Override
	public InferenceResult visitLambda(LambdaNode node)
	{
		List<Type> argTypes = new ArrayList<>();
		for (VariableNode var : node.getBoundVariables())
		{
			if (var.getType() == null)
			{
				return InferenceResult.failure(typeError("Cannot determine type for bound variable " + var.getName(), var));
			}
			argTypes.add(var.getType());
		}

		TypeInferenceVisitor bodyVisitor = new TypeInferenceVisitor(typeSystem, bind(node.getBoundVariables()));
		InferenceResult bodyResult = node.getBody().accept(bodyVisitor);
		if (bodyResult.hasErrors())
		{
			return bodyResult;
		}
		return InferenceResult.of(new FunctionType(argTypes, bodyResult.getType()));
	}

	@Override
	public InferenceResult visitDefinition(DefinitionNode node)
	{
		InferenceResult bodyResult = node.getBody().accept(this);
		if (bodyResult.hasErrors())
		{
			return bodyResult;
		}
		if (!typeSystem.isSubtype(bodyResult.getType(), node.getSymbolType()))
		{
			return InferenceResult.failure(typeError(String.format("Definition body has type %s, but symbol %s is defined with type %s",
					bodyResult.getType(), node.getSymbolName(), node.getSymbolType()), node));
		}
		return InferenceResult.of(node.getSymbolType());
	}

	// Binds in a child scope so the caller's environment is untouched after the binder.
	private TypeEnvironment bind(List<VariableNode> boundVariables)
	{
		TypeEnvironment scope = environment.extend();
		for (VariableNode var : boundVariables)
		{
			if (var.getType() != null)
			{
				scope.setType(var, var.getType());
			}
		}
		return scope;
	}
}
