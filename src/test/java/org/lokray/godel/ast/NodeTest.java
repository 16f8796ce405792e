package org.lokray.godel.ast;

import org.junit.jupiter.api.Test;
import org.lokray.godel.semantic.type.AtomicType;
import org.lokray.godel.semantic.type.FunctionType;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class NodeTest
{
	private static final AtomicType ENTITY = new AtomicType("Entity");
	private static final AtomicType AGENT = new AtomicType("Agent");
	private static final AtomicType BOOLEAN = new AtomicType("Boolean");
	private static final ConstantNode LOVES = new ConstantNode("Loves", new FunctionType(List.of(ENTITY, ENTITY), BOOLEAN));
	private static final ConstantNode HUMAN = new ConstantNode("Human", new FunctionType(List.of(ENTITY), BOOLEAN));

	private static ApplicationNode loves(Node a, Node b)
	{
		return new ApplicationNode(LOVES, List.of(a, b), BOOLEAN);
	}

	private static ApplicationNode human(Node a)
	{
		return new ApplicationNode(HUMAN, List.of(a), BOOLEAN);
	}

	@Test
	void variablesWithTheSameNameButDifferentIdsDiffer()
	{
		assertEquals(new VariableNode("?x", 1, ENTITY), new VariableNode("?x", 1, ENTITY));
		assertNotEquals(new VariableNode("?x", 1, ENTITY), new VariableNode("?x", 2, ENTITY));
		assertNotEquals(new VariableNode("?x", 1, ENTITY), new VariableNode("?x", 1, AGENT));
		assertNotEquals(new VariableNode("?x", 1, ENTITY), new ConstantNode("?x", ENTITY));
	}

	@Test
	void structurallyEqualTreesHashAlike()
	{
		VariableNode x = new VariableNode("?x", 0, ENTITY);
		Node a = new QuantifierNode(QuantifierKind.FORALL, List.of(x), human(x), BOOLEAN);
		Node b = new QuantifierNode(QuantifierKind.FORALL, List.of(new VariableNode("?x", 0, ENTITY)),
				human(new VariableNode("?x", 0, ENTITY)), BOOLEAN);

		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
		assertEquals(1, Set.of(a, b).size());
		assertNotEquals(a, new QuantifierNode(QuantifierKind.EXISTS, List.of(x), human(x), BOOLEAN));
	}

	@Test
	void metadataUpdatesAreCopyOnWrite()
	{
		VariableNode x = new VariableNode("?x", 0, ENTITY);
		ApplicationNode original = human(x);

		Node tagged = original.withMetadata("source", "test");

		assertTrue(original.getMetadata().isEmpty());
		assertEquals("test", tagged.getMetadata("source"));
		assertSame(original.getOperator(), ((ApplicationNode) tagged).getOperator());
		assertSame(x, ((ApplicationNode) tagged).getArguments().get(0));
		assertNotEquals(original, tagged);
		assertThrows(UnsupportedOperationException.class, () -> tagged.getMetadata().put("k", "v"));

		Node more = tagged.withMetadata(Map.of("confidence", 0.5));
		assertEquals(Map.of("source", "test", "confidence", 0.5), more.getMetadata());
	}

	@Test
	void connectivesCheckTheirOperandCount()
	{
		ConstantNode p = new ConstantNode("P", BOOLEAN);
		assertThrows(IllegalArgumentException.class, () -> new ConnectiveNode(ConnectiveKind.NOT, List.of(p, p), BOOLEAN));
		assertThrows(IllegalArgumentException.class, () -> new ConnectiveNode(ConnectiveKind.AND, List.of(p), BOOLEAN));
		assertThrows(IllegalArgumentException.class, () -> new LambdaNode(List.of(), p, BOOLEAN));
	}

	@Test
	void containsVariableIgnoresBoundOccurrences()
	{
		VariableNode x = new VariableNode("?x", 0, ENTITY);
		VariableNode y = new VariableNode("?y", 1, ENTITY);
		Node formula = new QuantifierNode(QuantifierKind.FORALL, List.of(x), loves(x, y), BOOLEAN);

		assertFalse(formula.containsVariable(x));
		assertTrue(formula.containsVariable(y));
		assertEquals(Set.of(y), formula.getFreeVariables());
		assertEquals(Set.of(x, y), formula.getAllVariables());
	}

	@Test
	void substitutionReplacesFreeOccurrencesOnly()
	{
		VariableNode x = new VariableNode("?x", 0, ENTITY);
		ConstantNode socrates = new ConstantNode("Socrates", ENTITY);

		Node open = new ConnectiveNode(ConnectiveKind.AND, List.of(human(x),
				new QuantifierNode(QuantifierKind.EXISTS, List.of(x), human(x), BOOLEAN)), BOOLEAN);

		Node result = open.substitute(Map.of(x, socrates));

		assertEquals("Human(Socrates) and (exists ?x:Entity. Human(?x))", result.toString());
		assertFalse(result.containsVariable(x));
		assertSame(open, open.substitute(Map.of(new VariableNode("?z", 9, ENTITY), socrates)));
	}

	@Test
	void substitutionAvoidsCapture()
	{
		VariableNode x = new VariableNode("?x", 0, ENTITY);
		VariableNode y = new VariableNode("?y", 1, ENTITY);
		VariableNode boundZ = new VariableNode("?z", 2, ENTITY);
		VariableNode freeZ = new VariableNode("?z", 3, ENTITY);

		// forall ?z. Loves(?x, ?y)  with  ?x -> ?z
		QuantifierNode formula = new QuantifierNode(QuantifierKind.FORALL, List.of(boundZ), loves(x, y), BOOLEAN);
		QuantifierNode result = (QuantifierNode) formula.substitute(Map.of(x, freeZ));

		VariableNode renamed = result.getBoundVariables().get(0);
		assertNotEquals(freeZ, renamed);
		assertNotEquals(boundZ, renamed);
		assertEquals("?z_4", renamed.getName());
		assertEquals(4, renamed.getVarId());
		assertEquals(ENTITY, renamed.getType());

		assertEquals(loves(freeZ, y), result.getScope());
		assertTrue(result.containsVariable(freeZ));
		assertEquals(Set.of(freeZ, y), result.getFreeVariables());
	}

	@Test
	void renamedBinderKeepsItsOwnOccurrences()
	{
		VariableNode x = new VariableNode("?x", 0, ENTITY);
		VariableNode boundY = new VariableNode("?y", 1, ENTITY);
		VariableNode freeY = new VariableNode("?y", 7, ENTITY);

		// lambda ?y. Loves(?x, ?y)  with  ?x -> ?y
		LambdaNode lambda = new LambdaNode(List.of(boundY), loves(x, boundY), new FunctionType(List.of(ENTITY), BOOLEAN));
		LambdaNode result = (LambdaNode) lambda.substitute(Map.of(x, freeY));

		VariableNode renamed = result.getBoundVariables().get(0);
		assertEquals(8, renamed.getVarId());
		assertEquals(loves(freeY, renamed), result.getBody());
		assertEquals(lambda.getType(), result.getType());
	}

	@Test
	void binderWithoutClashIsKept()
	{
		VariableNode x = new VariableNode("?x", 0, ENTITY);
		VariableNode y = new VariableNode("?y", 1, ENTITY);
		ConstantNode plato = new ConstantNode("Plato", ENTITY);

		QuantifierNode formula = new QuantifierNode(QuantifierKind.EXISTS, List.of(y), loves(x, y), BOOLEAN);
		QuantifierNode result = (QuantifierNode) formula.substitute(Map.of(x, plato));

		assertSame(y, result.getBoundVariables().get(0));
		assertEquals(loves(plato, y), result.getScope());
	}

	@Test
	void modalAndDefinitionNodesSubstituteIntoEveryChild()
	{
		VariableNode a = new VariableNode("?a", 0, AGENT);
		ConstantNode john = new ConstantNode("John", AGENT);

		ModalOpNode knows = new ModalOpNode(ModalOperator.KNOWS, human(a), BOOLEAN, a);
		ModalOpNode result = (ModalOpNode) knows.substitute(Map.of(a, john));
		assertEquals(john, result.getAgentOrWorld());
		assertEquals(human(john), result.getProposition());

		DefinitionNode def = new DefinitionNode("Fact", BOOLEAN, human(a), BOOLEAN);
		assertTrue(def.containsVariable(a));
		assertEquals(human(john), ((DefinitionNode) def.substitute(Map.of(a, john))).getBody());
	}

	@Test
	void printerRendersSurfaceSyntax()
	{
		VariableNode x = new VariableNode("?x", 0, ENTITY);
		ConstantNode john = new ConstantNode("John", AGENT);
		Node implies = new ConnectiveNode(ConnectiveKind.IMPLIES, List.of(human(x), new ConnectiveNode(ConnectiveKind.NOT,
				List.of(human(john)), BOOLEAN)), BOOLEAN);

		assertEquals("forall ?x:Entity. Human(?x) implies (not Human(John))",
				new QuantifierNode(QuantifierKind.FORALL, List.of(x), implies, BOOLEAN).toString());
		assertEquals("knows[John] Human(John)", new ModalOpNode(ModalOperator.KNOWS, human(john), BOOLEAN, john).toString());
		assertEquals("prob[0.8] Human(John)", new ModalOpNode(ModalOperator.PROBABILITY, human(john), BOOLEAN, null,
				Map.of(ModalOpNode.PROBABILITY_KEY, 0.8)).toString());
		assertEquals("\"hi\"", new ConstantNode("hi", new AtomicType("String"), "hi").toString());
	}
}
