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
import org.lokray.godel.semantic.type.Type;
import org.lokray.godel.util.Diagnostic;

import java.util.List;

/**
 * Checks a node against an expected type by inferring its type and testing subtyping.
 */
public class TypeCheckingVisitor implements NodeVisitor<List<Diagnostic>>
{
	private final TypeSystemManager typeSystem;
	private final Type expectedType;
	private final TypeInferenceVisitor inferenceVisitor;

	public TypeCheckingVisitor(TypeSystemManager typeSystem, TypeEnvironment environment, Type expectedType)
	{
		this.typeSystem = typeSystem;
		this.expectedType = expectedType;
		this.inferenceVisitor = new TypeInferenceVisitor(typeSystem, environment);
	}

	private List<Diagnostic> check(Node node, InferenceResult inferred, String description)
	{
		if (inferred.hasErrors())
		{
			return inferred.getErrors();
		}
		if (!typeSystem.isSubtype(inferred.getType(), expectedType))
		{
			return List.of(Diagnostic.typeError(String.format("%s has type %s, expected %s",
					description, inferred.getType(), expectedType), node));
		}
		return List.of();
	}

	@Override
	public List<Diagnostic> visitConstant(ConstantNode node)
	{
		return check(node, inferenceVisitor.visitConstant(node), "Constant " + node.getName());
	}

	@Override
	public List<Diagnostic> visitVariable(VariableNode node)
	{
		return check(node, inferenceVisitor.visitVariable(node), "Variable " + node.getName());
	}

	@Override
	public List<Diagnostic> visitApplication(ApplicationNode node)
	{
		return check(node, inferenceVisitor.visitApplication(node), "Application");
	}

	@Override
	public List<Diagnostic> visitQuantifier(QuantifierNode node)
	{
		return check(node, inferenceVisitor.visitQuantifier(node), "Quantifier");
	}

	@Override
	public List<Diagnostic> visitConnective(ConnectiveNode node)
	{
		return check(node, inferenceVisitor.visitConnective(node), "Connective");
	}

	@Override
	public List<Diagnostic> visitModalOp(ModalOpNode node)
	{
		return check(node, inferenceVisitor.visitModalOp(node), "Modal operator");
	}

	@Override
	public List<Diagnostic> visitLambda(LambdaNode node)
	{
		return check(node, inferenceVisitor.visitLambda(node), "Lambda");
	}

	@Override
	public List<Diagnostic> visitDefinition(DefinitionNode node)
	{
		return check(node, inferenceVisitor.visitDefinition(node), "Definition");
	}
}
