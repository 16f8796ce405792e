package org.lokray.godel.ast;

/**
 * Double dispatch over the eight AST node kinds. Adding a node kind adds a method here,
 * so every visitor has to handle it.
 */
public interface NodeVisitor<R>
{
	R visitConstant(ConstantNode node);

	R visitVariable(VariableNode node);

	R visitApplication(ApplicationNode node);

	R visitQuantifier(QuantifierNode node);

	R visitConnective(ConnectiveNode node);

	R visitModalOp(ModalOpNode node);

	R visitLambda(LambdaNode node);

	R visitDefinition(DefinitionNode node);
}
