package edu.upf.taln.depgraphs.core.analysis;

import edu.upf.taln.depgraphs.core.Options;
import edu.upf.taln.depgraphs.core.analysis.GraphStatistics.Counter;
import edu.upf.taln.depgraphs.core.structures.*;
import edu.upf.taln.depgraphs.core.utils.DebugUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.graph.AsSubgraph;
import org.jgrapht.graph.DirectedPseudograph;

import java.util.*;

import static java.util.stream.Collectors.toSet;

/**
 * Read-only tests of graph properties of the enhanced graph: degrees, cycles and connectivity. Findings are
 * reported, never repaired.
 */
public class GraphAnalyzer
{
	private final Options options;
	private final EnhancementClassifier classifier;
	private final static Logger log = LogManager.getLogger();

	public GraphAnalyzer(Options options)
	{
		this.options = options;
		this.classifier = new EnhancementClassifier(options.report_basenh);
	}

	/**
	 * Runs all tests on a sentence graph and adds the results to the statistics.
	 */
	public void analyze(Graph g, GraphStatistics stats)
	{
		countDegrees(g, stats);

		final Optional<List<NodeId>> cycle = findCycle(g);
		if (cycle.isPresent())
		{
			stats.increment(Counter.Cyclic_graphs);
			log.debug("Cycle in sentence " + DebugUtils.getSentenceId(g) + ": " + cycle.get());
			if (options.report_cycles)
				stats.addCycleReport(DebugUtils.printCycle(g, cycle.get()));
		}

		if (!isConnected(g))
			stats.increment(Counter.Unconnected_graphs);

		classifier.classify(g, stats);
	}

	public static DegreeCategory classify(Node n)
	{
		final int indegree = n.getInDegree();
		final int outdegree = n.getOutDegree();

		if (indegree == 0 && outdegree == 0)
			return DegreeCategory.Singleton;
		if (indegree == 0)
			return DegreeCategory.Independent;
		if (indegree == 1)
			return n.getInEdges().get(0).getId().isRoot() ? DegreeCategory.SingleTop : DegreeCategory.Other;
		if (n.getInEdges().stream().anyMatch(e -> e.getId().isRoot()))
			return DegreeCategory.MultiParentTop;
		return DegreeCategory.MultiParent;
	}

	public static void countDegrees(Graph g, GraphStatistics stats)
	{
		stats.increment(Counter.Graphs);
		for (Node n : g.getNodes())
		{
			stats.increment(Counter.Nodes);
			stats.increment(n.isEmpty() ? Counter.Empty_nodes : Counter.Overt_nodes);
			// Edges from 0 are not counted because the root is not among the nodes
			stats.add(Counter.Edges, n.getOutDegree());

			switch (classify(n))
			{
				case Singleton:
					stats.increment(Counter.Singletons);
					break;
				case Independent:
					stats.increment(Counter.Independent);
					break;
				case SingleTop:
					stats.increment(Counter.Top1);
					break;
				case MultiParentTop:
					stats.increment(Counter.Top2);
					stats.increment(Counter.In2plus);
					break;
				case MultiParent:
					stats.increment(Counter.In2plus);
					break;
				case Other:
				default:
					break;
			}
		}
	}

	/**
	 * Looks for a directed cycle and stops at the first one. Partial paths are expanded depth-first; a node that
	 * has already been expanded is not expanded again, since any cycle through it has been found from there.
	 *
	 * @return the cycle as a list of ids starting and ending with the same id, or empty if the graph is acyclic
	 */
	public static Optional<List<NodeId>> findCycle(Graph g)
	{
		final Deque<List<NodeId>> stack = new ArrayDeque<>();
		g.getNodes().forEach(n -> stack.push(List.of(n.getId())));
		final Set<NodeId> processed = new HashSet<>();

		while (!stack.isEmpty())
		{
			final List<NodeId> path = stack.pop();
			final NodeId current = path.get(path.size() - 1);
			if (processed.contains(current))
				continue;

			for (Edge e : g.node(current).getOutEdges())
			{
				final NodeId child = e.getId();
				final int index = path.indexOf(child);
				if (index >= 0)
				{
					// The path may start outside the cycle, so its prefix is dropped
					final List<NodeId> cycle = new ArrayList<>(path.subList(index, path.size()));
					cycle.add(child);
					return Optional.of(cycle);
				}

				final List<NodeId> extended = new ArrayList<>(path);
				extended.add(child);
				stack.push(extended);
			}
			processed.add(current);
		}

		return Optional.empty();
	}

	/**
	 * Checks that all nodes with at least one edge belong to the same component. Singletons are ignored and the
	 * root does not connect its children.
	 */
	public static boolean isConnected(Graph g)
	{
		final Set<NodeId> non_singletons = g.getNodes().stream()
				.filter(n -> n.getInDegree() + n.getOutDegree() > 0)
				.map(Node::getId)
				.collect(toSet());

		final DirectedPseudograph<NodeId, Relation> enhanced = g.asEnhancedGraph();
		final AsSubgraph<NodeId, Relation> subgraph = new AsSubgraph<>(enhanced, non_singletons);
		return new ConnectivityInspector<>(subgraph).connectedSets().size() <= 1;
	}
}
