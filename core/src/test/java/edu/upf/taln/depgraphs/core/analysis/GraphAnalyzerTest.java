package edu.upf.taln.depgraphs.core.analysis;

import edu.upf.taln.depgraphs.core.Options;
import edu.upf.taln.depgraphs.core.TestUtils;
import edu.upf.taln.depgraphs.core.analysis.GraphStatistics.Counter;
import edu.upf.taln.depgraphs.core.structures.Graph;
import edu.upf.taln.depgraphs.core.structures.Node;
import edu.upf.taln.depgraphs.core.structures.NodeId;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Optional;

public class GraphAnalyzerTest
{
	@Test
	public void testDegreeCategories()
	{
		final Graph g = new Graph();
		final NodeId a = NodeId.regular(1);
		final NodeId b = NodeId.regular(2);
		final NodeId c = NodeId.regular(3);
		final NodeId d = NodeId.regular(4);
		final NodeId e = NodeId.regular(5);
		for (NodeId id : List.of(a, b, c, d, e))
			g.addNode(new Node(id));
		g.addEdge(NodeId.ROOT, a, "root");
		g.addEdge(a, b, "obj");
		g.addEdge(d, b, "nsubj");
		g.addEdge(NodeId.ROOT, c, "root");
		g.addEdge(b, c, "conj");

		Assert.assertEquals(DegreeCategory.SingleTop, GraphAnalyzer.classify(g.node(a)));
		Assert.assertEquals(DegreeCategory.MultiParent, GraphAnalyzer.classify(g.node(b)));
		Assert.assertEquals(DegreeCategory.MultiParentTop, GraphAnalyzer.classify(g.node(c)));
		Assert.assertEquals(DegreeCategory.Independent, GraphAnalyzer.classify(g.node(d)));
		Assert.assertEquals(DegreeCategory.Singleton, GraphAnalyzer.classify(g.node(e)));

		final GraphStatistics stats = new GraphStatistics();
		GraphAnalyzer.countDegrees(g, stats);
		Assert.assertEquals(1, stats.get(Counter.Graphs));
		Assert.assertEquals(5, stats.get(Counter.Nodes));
		Assert.assertEquals(5, stats.get(Counter.Overt_nodes));
		Assert.assertEquals(3, stats.get(Counter.Edges));
		Assert.assertEquals(1, stats.get(Counter.Singletons));
		Assert.assertEquals(1, stats.get(Counter.Top1));
		Assert.assertEquals(1, stats.get(Counter.Top2));
		Assert.assertEquals(2, stats.get(Counter.In2plus));
		Assert.assertEquals(1, stats.get(Counter.Independent));
	}

	@Test
	public void testSingleTopRequiresRootParent()
	{
		final Graph g = TestUtils.graph(
				"1 eats eat VERB _ _ 0 root 0:root _",
				"2 apples apple NOUN _ _ 1 obj 1:obj _");
		Assert.assertEquals(DegreeCategory.SingleTop, GraphAnalyzer.classify(g.node(NodeId.regular(1))));
		Assert.assertEquals(1, g.node(NodeId.regular(2)).getInDegree());
		Assert.assertEquals(DegreeCategory.Other, GraphAnalyzer.classify(g.node(NodeId.regular(2))));
	}

	@Test
	public void testFindCycle()
	{
		final Graph g = new Graph();
		final NodeId a = NodeId.regular(1);
		final NodeId b = NodeId.regular(2);
		g.addNode(new Node(a));
		g.addNode(new Node(b));
		g.addEdge(a, b, "x");
		g.addEdge(b, a, "y");

		final Optional<List<NodeId>> cycle = GraphAnalyzer.findCycle(g);
		Assert.assertTrue(cycle.isPresent());
		Assert.assertEquals(3, cycle.get().size());
		Assert.assertEquals(cycle.get().get(0), cycle.get().get(2));
		Assert.assertTrue(cycle.get().contains(a));
		Assert.assertTrue(cycle.get().contains(b));
	}

	@Test
	public void testCycleFoundFromOutsideNode()
	{
		final Graph g = TestUtils.graph(
				"1 a a X _ _ 0 root 0:root|3:x _",
				"2 b b X _ _ 1 dep 1:dep _",
				"3 c c X _ _ 2 dep 2:dep _",
				"4 d d X _ _ 3 dep 3:dep _");

		final List<NodeId> cycle = GraphAnalyzer.findCycle(g).orElseThrow();
		Assert.assertEquals(4, cycle.size());
		Assert.assertEquals(cycle.get(0), cycle.get(3));
		Assert.assertFalse(cycle.contains(NodeId.regular(4)));
	}

	@Test
	public void testNoCycleInTree()
	{
		final Graph g = TestUtils.graph(
				"1 John John PROPN _ _ 2 nsubj 2:nsubj _",
				"2 runs run VERB _ _ 0 root 0:root _",
				"3 fast fast ADV _ _ 2 advmod 2:advmod|1:dep _");
		Assert.assertFalse(GraphAnalyzer.findCycle(g).isPresent());
	}

	@Test
	public void testConnectivity()
	{
		final Graph g = TestUtils.graph(
				"1 a a X _ _ 0 root 0:root _",
				"2 b b X _ _ 1 dep 1:dep _",
				"3 c c X _ _ 0 root 0:root _",
				"4 d d X _ _ 3 dep 3:dep _",
				"5 e e X _ _ 4 dep _ _");

		// The root does not connect components and singletons are ignored
		Assert.assertFalse(GraphAnalyzer.isConnected(g));
		g.addEdge(NodeId.regular(2), NodeId.regular(4), "dep");
		Assert.assertTrue(GraphAnalyzer.isConnected(g));
	}

	@Test
	public void testAnalyze()
	{
		final Options options = new Options();
		options.report_cycles = true;
		final GraphAnalyzer analyzer = new GraphAnalyzer(options);
		final GraphStatistics stats = new GraphStatistics();

		analyzer.analyze(TestUtils.graph(
				"# sent_id = tree",
				"1 John John PROPN _ _ 2 nsubj 2:nsubj _",
				"2 runs run VERB _ _ 0 root 0:root _"), stats);
		analyzer.analyze(TestUtils.graph(
				"# sent_id = cyclic",
				"1 who who PRON _ _ 2 nsubj 2:nsubj _",
				"2 came come VERB _ _ 0 root 0:root|1:acl _"), stats);

		Assert.assertEquals(2, stats.get(Counter.Graphs));
		Assert.assertEquals(4, stats.get(Counter.Nodes));
		Assert.assertEquals(1, stats.get(Counter.Cyclic_graphs));
		Assert.assertEquals(0, stats.get(Counter.Unconnected_graphs));
		Assert.assertEquals(1, stats.getCycleReports().size());
		Assert.assertTrue(stats.getCycleReports().get(0).contains("# sent_id = cyclic"));
		Assert.assertTrue(stats.getCycleReports().get(0).contains("The cycle: "));
		Assert.assertTrue(stats.printReport().startsWith("2 graphs\n4 nodes\n"));
	}
}
