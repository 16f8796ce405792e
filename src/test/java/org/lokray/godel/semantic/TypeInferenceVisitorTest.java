package org.lokray.godel.semantic;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lokray.godel.ast.ApplicationNode;
import org.lokray.godel.ast.ConstantNode;
import org.lokray.godel.ast.DefinitionNode;
import org.lokray.godel.ast.Node;
import org.lokray.godel.ast.QuantifierKind;
import org.lokray.godel.ast.QuantifierNode;
import org.lokray.godel.ast.VariableNode;
import org.lokray.godel.frontend.FormalLogicParser;
import org.lokray.godel.frontend.ParseResult;
import org.lokray.godel.semantic.type.FunctionType;
import org.lokray.godel.semantic.type.Type;
import org.lokray.godel.semantic.type.TypeVariable;
import org.lokray.godel.util.Diagnostic;
import org.lokray.godel.util.ErrorKind;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TypeInferenceVisitorTest
{
	private TypeSystemManager ts;
	private FormalLogicParser parser;

	@BeforeEach
	void setUp()
	{
		ts = new TypeSystemManager();
		ts.defineFunctionSignature("Human", List.of("Entity"), "Boolean");
		ts.defineFunctionSignature("Mortal", List.of("Entity"), "Boolean");
		ts.defineFunctionSignature("Gives", List.of("Agent", "Agent"), "Boolean");
		ts.defineConstant("John", "Agent");
		parser = new FormalLogicParser(ts);
	}

	private Node parse(String text)
	{
		ParseResult<Node> result = parser.parse(text);
		assertTrue(result.isPresent(), () -> "parse failed: " + result.getErrors());
		return result.getValue();
	}

	private InferenceResult infer(String text)
	{
		return ts.inferExpressionType(parse(text), new TypeEnvironment());
	}

	@Test
	void wellTypedFormulasAreBoolean()
	{
		for (String text : List.of(
				"forall ?x:Entity. Human(?x) implies Mortal(?x)",
				"exists ?a:Agent. Human(?a)",
				"not Human(Socrates) or Mortal(John)",
				"knows[John] Human(Socrates)",
				"possible[Socrates] Human(Socrates)",
				"prob[0.3] defeasibly Human(Socrates)"))
		{
			InferenceResult result = infer(text);
			assertFalse(result.hasErrors(), () -> text + ": " + result.getErrors());
			assertEquals(ts.getBooleanType(), result.getType(), text);
		}
	}

	@Test
	void constantsAndVariables()
	{
		assertEquals(ts.getAgentType(), infer("John").getType());

		VariableNode untyped = new VariableNode("?v", 5, null);
		InferenceResult missing = ts.inferExpressionType(untyped, new TypeEnvironment());
		assertTrue(missing.type().isEmpty());
		assertEquals("Cannot determine type for variable ?v", missing.getErrors().get(0).getMessage());
		assertSame(untyped, missing.getErrors().get(0).getNode());

		TypeEnvironment env = new TypeEnvironment();
		env.setType(untyped, ts.getAgentType());
		assertEquals(ts.getAgentType(), ts.inferExpressionType(untyped, env).getType());

		InferenceResult noType = ts.inferExpressionType(new ConstantNode("Thing", null), new TypeEnvironment());
		assertEquals("Cannot determine type for constant Thing", noType.getErrors().get(0).getMessage());
	}

	@Test
	void applicationArityMismatch()
	{
		InferenceResult result = infer("Human(Socrates, Plato)");
		assertEquals(1, result.getErrors().size());
		assertEquals("Function expects 1 arguments, got 2", result.getErrors().get(0).getMessage());
		assertEquals(ErrorKind.TYPE, result.getErrors().get(0).getKind());
	}

	@Test
	void applicationStopsAtTheFirstBadArgument()
	{
		InferenceResult result = infer("Gives(Rock, Stone)");
		assertEquals(1, result.getErrors().size());
		assertEquals("Argument 1 has type Entity, expected Agent", result.getErrors().get(0).getMessage());
		assertEquals("Rock", result.getErrors().get(0).getNode().toString());
	}

	@Test
	void subtypeArgumentsAreAccepted()
	{
		assertEquals(ts.getBooleanType(), infer("Human(John)").getType());
		assertFalse(infer("Gives(John, John)").hasErrors());
	}

	@Test
	void operatorMustBeAFunction()
	{
		InferenceResult result = infer("Socrates(Plato)");
		assertEquals("Operator Socrates is not a function", result.getErrors().get(0).getMessage());
	}

	@Test
	void connectiveOperandsMustBeBoolean()
	{
		InferenceResult result = infer("Socrates and Human(Socrates)");
		assertEquals("Connective operand has type Entity, expected Boolean", result.getErrors().get(0).getMessage());
	}

	@Test
	void quantifierScopeMustBeBoolean()
	{
		InferenceResult result = infer("forall ?x. ?x");
		assertEquals("Quantifier scope has type Entity, expected Boolean", result.getErrors().get(0).getMessage());
	}

	@Test
	void epistemicAgentMustBeAnAgent()
	{
		InferenceResult result = infer("believes[Socrates] Human(Socrates)");
		assertEquals("Modal agent has type Entity, expected Agent", result.getErrors().get(0).getMessage());

		InferenceResult proposition = infer("necessary Socrates");
		assertEquals("Modal proposition has type Entity, expected Boolean", proposition.getErrors().get(0).getMessage());
	}

	@Test
	void lambdaBuildsAFunctionType()
	{
		InferenceResult result = infer("lambda ?x:Agent ?y. Gives(?x, John)");
		assertEquals(new FunctionType(List.of(ts.getAgentType(), ts.getEntityType()), ts.getBooleanType()), result.getType());
	}

	@Test
	void binderTypesDoNotLeakIntoTheCallerEnvironment()
	{
		QuantifierNode quantifier = (QuantifierNode) parse("forall ?x:Agent. Human(?x)");
		TypeEnvironment env = new TypeEnvironment();

		assertFalse(ts.inferExpressionType(quantifier, env).hasErrors());
		assertTrue(env.resolve(quantifier.getBoundVariables().get(0)).isEmpty());
	}

	@Test
	void polymorphicSignaturesAreSolvedByUnification()
	{
		TypeVariable t = new TypeVariable("T");
		ts.defineSignature("Same", new FunctionType(List.of(t, t), ts.getBooleanType()));
		ts.defineParametricTypeConstructor("List", List.of("T"));
		ts.defineSignature("Head", new FunctionType(List.of(ts.instantiate("List", List.of(t))), t));
		ts.defineSignature("Crew", ts.instantiate("List", List.of(ts.getAgentType())));

		assertEquals(ts.getBooleanType(), infer("Same(John, John)").getType());
		assertEquals(ts.getAgentType(), infer("Head(Crew)").getType());

		InferenceResult clash = infer("Same(John, 42)");
		assertEquals("Argument 2 has type Integer, expected Agent", clash.getErrors().get(0).getMessage());
	}

	@Test
	void definitionBodyMustMatchTheDeclaredType()
	{
		Node body = parse("lambda ?x:Entity. Human(?x)");
		Type declared = new FunctionType(List.of(ts.getEntityType()), ts.getBooleanType());

		DefinitionNode ok = new DefinitionNode("IsHuman", declared, body, declared);
		assertEquals(declared, ts.inferExpressionType(ok, new TypeEnvironment()).getType());

		// A predicate over entities also accepts agents.
		Type narrower = new FunctionType(List.of(ts.getAgentType()), ts.getBooleanType());
		assertFalse(ts.inferExpressionType(new DefinitionNode("IsHuman", narrower, body, narrower), new TypeEnvironment()).hasErrors());

		DefinitionNode bad = new DefinitionNode("IsHuman", ts.getAgentType(), body, ts.getAgentType());
		List<Diagnostic> errors = ts.inferExpressionType(bad, new TypeEnvironment()).getErrors();
		assertEquals(1, errors.size());
		assertEquals("Definition body has type (Entity) -> Boolean, but symbol IsHuman is defined with type Agent", errors.get(0).getMessage());
	}

	@Test
	void externallyBuiltNodesNeedNoStoredTypes()
	{
		VariableNode a = new VariableNode("?a", 0, ts.getAgentType());
		ConstantNode gives = new ConstantNode("Gives", ts.getSignature("Gives").orElseThrow());
		ApplicationNode app = new ApplicationNode(gives, List.of(a, a), null);
		QuantifierNode q = new QuantifierNode(QuantifierKind.EXISTS, List.of(a), app, null);

		InferenceResult result = ts.inferExpressionType(q, new TypeEnvironment());
		assertFalse(result.hasErrors(), () -> result.getErrors().toString());
		assertEquals(ts.getBooleanType(), result.getType());
	}
}
