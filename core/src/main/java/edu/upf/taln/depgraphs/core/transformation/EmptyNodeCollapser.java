package edu.upf.taln.depgraphs.core.transformation;

import edu.upf.taln.depgraphs.core.structures.Edge;
import edu.upf.taln.depgraphs.core.structures.Graph;
import edu.upf.taln.depgraphs.core.structures.Node;
import edu.upf.taln.depgraphs.core.structures.NodeId;
import edu.upf.taln.depgraphs.core.utils.DebugUtils;
import org.apache.commons.lang3.tuple.Triple;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Removes empty nodes from the enhanced graph. Every path that goes from a regular node through one or more empty
 * nodes to another regular node is replaced by a single edge whose label concatenates the labels along the path,
 * e.g. conj>nsubj. Empty nodes not traversed by any such path are removed and their edges are lost.
 */
public class EmptyNodeCollapser
{
	private final boolean keep_ids;
	private final String separator;
	private final static Logger log = LogManager.getLogger();

	public EmptyNodeCollapser()
	{
		this(false, ">");
	}

	/**
	 * @param keep_ids  if true, collapsed labels keep the ids of the empty nodes, e.g. conj>33.1>nsubj
	 * @param separator placed between the parts of collapsed labels
	 */
	public EmptyNodeCollapser(boolean keep_ids, String separator)
	{
		this.keep_ids = keep_ids;
		this.separator = separator;
	}

	/**
	 * @return added edges as (parent, child, label) triples, ordered by child and then by parent
	 */
	public List<Triple<NodeId, NodeId, String>> collapse(Graph g)
	{
		final List<Node> empty_nodes = g.getNodes().stream()
				.filter(Node::isEmpty)
				.collect(Collectors.toList());
		if (empty_nodes.isEmpty())
			return Collections.emptyList();

		final List<EnhancedPath> paths = findPaths(g);
		final List<EnhancedPath> results = paths.stream()
				.filter(p -> p.getLength() > 1)
				.collect(Collectors.toList());

		// Empty nodes with a parent whose content does not survive in any collapsed edge
		final Set<NodeId> traversed = paths.stream()
				.flatMap(p -> p.getIntermediateNodes().stream())
				.collect(Collectors.toSet());
		empty_nodes.stream()
				.filter(n -> n.getInDegree() > 0)
				.filter(n -> !traversed.contains(n.getId()))
				.forEach(n -> log.warn("Collapsing empty node " + n.getId() + " in sentence " + DebugUtils.getSentenceId(g) +
						" loses information: no path leads from it to a regular node"));

		for (Node n : empty_nodes)
		{
			new ArrayList<>(n.getInEdges()).forEach(e -> g.removeEdge(e.getId(), n.getId(), e.getDeprel()));
			new ArrayList<>(n.getOutEdges()).forEach(e -> g.removeEdge(n.getId(), e.getId(), e.getDeprel()));
			g.removeNode(n.getId());
		}

		final List<Triple<NodeId, NodeId, String>> added = new ArrayList<>();
		for (EnhancedPath p : results)
		{
			final String label = p.getLabel(separator, keep_ids);
			g.addEdge(p.getFirst(), p.getLast(), label);
			added.add(Triple.of(p.getFirst(), p.getLast(), label));
			log.debug("Collapsed " + p + " into " + p.getFirst() + " " + label + " " + p.getLast());
		}

		return added;
	}

	/**
	 * Splices edges through empty nodes until both ends of every path are regular nodes.
	 *
	 * @return finished paths, including single edges between regular nodes, ordered by child and then by parent
	 */
	List<EnhancedPath> findPaths(Graph g)
	{
		final List<EnhancedPath> finished = new ArrayList<>();
		final Deque<EnhancedPath> out_of_empty = new ArrayDeque<>();
		final List<EnhancedPath> into_empty = new ArrayList<>();
		final Set<EnhancedPath> seen = new HashSet<>();

		final List<Node> nodes = new ArrayList<>();
		nodes.add(g.getRoot());
		nodes.addAll(g.getNodes());
		for (Node n : nodes)
		{
			for (Edge e : n.getOutEdges())
			{
				final EnhancedPath p = EnhancedPath.of(n.getId(), e.getDeprel(), e.getId());
				seen.add(p);
				if (p.isFinished())
					finished.add(p);
				if (p.getFirst().isEmpty())
					out_of_empty.add(p);
				if (p.getLast().isEmpty())
					into_empty.add(p);
			}
		}

		while (!out_of_empty.isEmpty())
		{
			final EnhancedPath tail = out_of_empty.poll();
			for (EnhancedPath head : new ArrayList<>(into_empty))
			{
				if (!head.getLast().equals(tail.getFirst()))
					continue;

				final EnhancedPath p = head.append(tail);
				if (p.visitsNodeTwice())
				{
					log.warn("Ignoring enhanced path " + p + " in sentence " + DebugUtils.getSentenceId(g) +
							" because it visits a node twice");
					continue;
				}
				if (!seen.add(p))
					continue;

				if (p.isFinished())
					finished.add(p);
				if (p.getFirst().isEmpty())
					out_of_empty.add(p);
				if (p.getLast().isEmpty())
					into_empty.add(p);
			}
		}

		finished.sort(Comparator.comparing(EnhancedPath::getLast).thenComparing(EnhancedPath::getFirst));
		return finished;
	}
}
