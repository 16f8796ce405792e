package org.lokray.godel.semantic;

import org.junit.jupiter.api.Test;
import org.lokray.godel.ast.VariableNode;
import org.lokray.godel.semantic.type.AtomicType;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TypeEnvironmentTest
{
	private static final AtomicType ENTITY = new AtomicType("Entity");
	private static final AtomicType AGENT = new AtomicType("Agent");

	@Test
	void lookupWalksOutwardsThenFallsBackToTheNode()
	{
		VariableNode x = new VariableNode("?x", 0, ENTITY);
		VariableNode untyped = new VariableNode("?y", 1, null);

		TypeEnvironment root = new TypeEnvironment();
		root.setType(x, AGENT);
		TypeEnvironment child = root.extend();

		assertEquals(AGENT, child.getType(x));
		assertEquals(Optional.of(AGENT), child.resolve(x));
		assertFalse(child.isBoundLocally(x));
		assertNull(child.getType(untyped));
		assertEquals(ENTITY, new TypeEnvironment().getType(x));
	}

	@Test
	void childBindingsShadowWithoutTouchingTheParent()
	{
		VariableNode x = new VariableNode("?x", 0, null);
		TypeEnvironment root = new TypeEnvironment();
		root.setType(x, ENTITY);

		TypeEnvironment child = root.extend();
		child.setType(x, AGENT);

		assertEquals(AGENT, child.getType(x));
		assertEquals(ENTITY, root.getType(x));
		assertSame(root, child.getParent());
	}

	@Test
	void variablesAreKeyedById()
	{
		TypeEnvironment env = new TypeEnvironment();
		env.setType(new VariableNode("?x", 7, null), AGENT);

		assertEquals(AGENT, env.getType(new VariableNode("?renamed", 7, ENTITY)));
		assertEquals(ENTITY, env.getType(new VariableNode("?x", 8, ENTITY)));
	}

	@Test
	void copyKeepsTheParent()
	{
		VariableNode x = new VariableNode("?x", 0, null);
		VariableNode y = new VariableNode("?y", 1, null);
		TypeEnvironment root = new TypeEnvironment();
		root.setType(y, ENTITY);
		TypeEnvironment scope = root.extend();
		scope.setType(x, AGENT);

		TypeEnvironment copy = scope.copy();
		copy.setType(x, ENTITY);

		assertSame(root, copy.getParent());
		assertEquals(ENTITY, copy.getType(y));
		assertEquals(ENTITY, copy.getType(x));
		assertEquals(AGENT, scope.getType(x));
	}
}
