package org.lokray.godel.semantic;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lokray.godel.ast.Node;
import org.lokray.godel.frontend.FormalLogicParser;
import org.lokray.godel.semantic.type.FunctionType;
import org.lokray.godel.util.Diagnostic;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TypeCheckingVisitorTest
{
	private TypeSystemManager ts;
	private FormalLogicParser parser;

	@BeforeEach
	void setUp()
	{
		ts = new TypeSystemManager();
		ts.defineFunctionSignature("Human", List.of("Entity"), "Boolean");
		ts.defineConstant("John", "Agent");
		parser = new FormalLogicParser(ts);
	}

	private List<Diagnostic> check(String text, String expectedType)
	{
		Node node = parser.parse(text).value().orElseThrow();
		return ts.checkExpressionType(node, ts.requireType(expectedType), new TypeEnvironment());
	}

	@Test
	void acceptsSubtypesOfTheExpectedType()
	{
		assertTrue(check("Human(Socrates)", "Boolean").isEmpty());
		assertTrue(check("John", "Entity").isEmpty());
		assertTrue(check("John", "Agent").isEmpty());
		assertTrue(check("forall ?x. Human(?x)", "Boolean").isEmpty());
	}

	@Test
	void reportsMismatchesAgainstTheNode()
	{
		List<Diagnostic> errors = check("Human(Socrates)", "Entity");
		assertEquals(1, errors.size());
		assertEquals("Application has type Boolean, expected Entity", errors.get(0).getMessage());
		assertEquals("Human(Socrates)", errors.get(0).getNode().toString());

		assertEquals("Constant Socrates has type Entity, expected Agent", check("Socrates", "Agent").get(0).getMessage());
		assertEquals("Quantifier has type Boolean, expected Proposition",
				check("exists ?x. Human(?x)", "Proposition").get(0).getMessage());
	}

	@Test
	void inferenceErrorsArePassedThrough()
	{
		List<Diagnostic> errors = check("Human(Socrates, Plato)", "Boolean");
		assertEquals(List.of("Function expects 1 arguments, got 2"), errors.stream().map(Diagnostic::getMessage).toList());
	}

	@Test
	void checksLambdasAgainstFunctionTypes()
	{
		Node lambda = parser.parse("lambda ?x. Human(?x)").getValue();

		FunctionType overAgents = new FunctionType(List.of(ts.getAgentType()), ts.getBooleanType());
		assertTrue(ts.checkExpressionType(lambda, overAgents, new TypeEnvironment()).isEmpty());

		FunctionType returnsEntity = new FunctionType(List.of(ts.getEntityType()), ts.getEntityType());
		assertEquals(1, ts.checkExpressionType(lambda, returnsEntity, new TypeEnvironment()).size());
	}
}
