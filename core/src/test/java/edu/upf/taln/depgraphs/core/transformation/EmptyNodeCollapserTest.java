package edu.upf.taln.depgraphs.core.transformation;

import edu.upf.taln.depgraphs.core.TestUtils;
import edu.upf.taln.depgraphs.core.structures.Graph;
import edu.upf.taln.depgraphs.core.structures.NodeId;
import org.apache.commons.lang3.tuple.Triple;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class EmptyNodeCollapserTest
{
	private static final NodeId n1 = NodeId.regular(1);
	private static final NodeId n2 = NodeId.regular(2);
	private static final NodeId e11 = NodeId.empty(1, 1);

	@Test
	public void testSingleEmptyNode()
	{
		final Graph g = TestUtils.graph(
				"1 eats eat VERB _ _ 0 root 0:root _",
				"1.1 eats eat VERB _ _ _ _ 1:conj _",
				"2 Mary Mary PROPN _ _ 1 nsubj 1.1:nsubj _");

		final List<Triple<NodeId, NodeId, String>> added = new EmptyNodeCollapser().collapse(g);
		Assert.assertEquals(1, added.size());
		Assert.assertEquals(Triple.of(n1, n2, "conj>nsubj"), added.get(0));

		Assert.assertFalse(g.hasNode(e11));
		Assert.assertEquals(2, g.size());
		Assert.assertEquals("1:conj>nsubj", g.node(n2).getDepsString());
		Assert.assertEquals(1, g.node(n1).getOutDegree());
	}

	@Test
	public void testKeepIds()
	{
		final Graph g = TestUtils.graph(
				"1 eats eat VERB _ _ 0 root 0:root _",
				"1.1 eats eat VERB _ _ _ _ 1:conj _",
				"2 Mary Mary PROPN _ _ 1 nsubj 1.1:nsubj _");

		new EmptyNodeCollapser(true, ">").collapse(g);
		Assert.assertTrue(g.hasEdge(n1, n2, "conj>1.1>nsubj"));
	}

	@Test
	public void testChainOfEmptyNodes()
	{
		final Graph g = TestUtils.graph(
				"1 eats eat VERB _ _ 0 root 0:root _",
				"1.1 _ _ _ _ _ _ _ 1:conj _",
				"1.2 _ _ _ _ _ _ _ 1.1:orphan _",
				"2 Mary Mary PROPN _ _ 1 nsubj 1.2:nsubj _");

		final List<Triple<NodeId, NodeId, String>> added = new EmptyNodeCollapser().collapse(g);
		Assert.assertEquals(1, added.size());
		Assert.assertEquals("conj>orphan>nsubj", added.get(0).getRight());
		Assert.assertEquals(2, g.size());
		Assert.assertEquals("1:conj>orphan>nsubj", g.node(n2).getDepsString());
	}

	@Test
	public void testCycleThroughEmptyNodes()
	{
		final Graph g = TestUtils.graph(
				"1 eats eat VERB _ _ 0 root 0:root _",
				"1.1 _ _ _ _ _ _ _ 1:conj|1.2:y _",
				"1.2 _ _ _ _ _ _ _ 1.1:x _",
				"2 Mary Mary PROPN _ _ 1 nsubj 1.2:nsubj _");

		final List<Triple<NodeId, NodeId, String>> added = new EmptyNodeCollapser().collapse(g);
		Assert.assertEquals(1, added.size());
		Assert.assertEquals(Triple.of(n1, n2, "conj>x>nsubj"), added.get(0));
		Assert.assertEquals(2, g.size());
	}

	@Test
	public void testDanglingEmptyNode()
	{
		final Graph g = TestUtils.graph(
				"1 eats eat VERB _ _ 0 root 0:root _",
				"1.1 _ _ _ _ _ _ _ 1:conj _",
				"2 Mary Mary PROPN _ _ 1 nsubj 1:nsubj _");

		Assert.assertTrue(new EmptyNodeCollapser().collapse(g).isEmpty());
		Assert.assertFalse(g.hasNode(e11));
		Assert.assertEquals("1:nsubj", g.node(n2).getDepsString());
		Assert.assertEquals(1, g.node(n1).getOutDegree());
	}

	@Test
	public void testResultsOrderedByChildThenParent()
	{
		final Graph g = TestUtils.graph(
				"1 Peter Peter PROPN _ _ 2 nsubj 2:nsubj|3:nsubj _",
				"2 eats eat VERB _ _ 0 root 0:root _",
				"3 drinks drink VERB _ _ 2 conj 2:conj _",
				"3.1 _ _ _ _ _ _ _ 2:conj|3:conj _",
				"4 Mary Mary PROPN _ _ 3 conj 3.1:nsubj _",
				"5 wine wine NOUN _ _ 4 orphan 3.1:obj _");

		final List<Triple<NodeId, NodeId, String>> added = new EmptyNodeCollapser().collapse(g);
		Assert.assertEquals(4, added.size());
		Assert.assertEquals(Triple.of(n2, NodeId.regular(4), "conj>nsubj"), added.get(0));
		Assert.assertEquals(Triple.of(NodeId.regular(3), NodeId.regular(4), "conj>nsubj"), added.get(1));
		Assert.assertEquals(Triple.of(n2, NodeId.regular(5), "conj>obj"), added.get(2));
		Assert.assertEquals(Triple.of(NodeId.regular(3), NodeId.regular(5), "conj>obj"), added.get(3));

		// Edges between regular nodes survive
		Assert.assertEquals("2:nsubj|3:nsubj", g.node(n1).getDepsString());
		Assert.assertEquals("2:conj", g.node(NodeId.regular(3)).getDepsString());
	}

	@Test
	public void testNoEmptyNodes()
	{
		final Graph g = TestUtils.graph(
				"1 John John PROPN _ _ 2 nsubj 2:nsubj _",
				"2 runs run VERB _ _ 0 root 0:root _");
		final List<String> before = g.toConllu();
		Assert.assertTrue(new EmptyNodeCollapser().collapse(g).isEmpty());
		Assert.assertEquals(before, g.toConllu());
	}
}
