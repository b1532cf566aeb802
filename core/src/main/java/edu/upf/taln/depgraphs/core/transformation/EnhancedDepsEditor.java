package edu.upf.taln.depgraphs.core.transformation;

import edu.upf.taln.depgraphs.core.structures.Edge;
import edu.upf.taln.depgraphs.core.structures.Graph;
import edu.upf.taln.depgraphs.core.structures.Node;
import edu.upf.taln.depgraphs.core.structures.NodeId;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Optional;

/**
 * Bulk edits of the DEPS column.
 */
public class EnhancedDepsEditor
{
	public static final String root_label = "root";
	private final static Logger log = LogManager.getLogger();

	/**
	 * Adds the basic dependency of every word to the enhanced graph.
	 *
	 * @param replace if true, enhanced edges entering a word are removed before its basic edge is added
	 * @return number of edges added
	 */
	public static int copyBasicToEnhanced(Graph g, boolean replace)
	{
		int num_added = 0;
		for (Node n : g.getNodes())
		{
			if (!n.getId().isRegular())
				continue;
			if (replace)
				removeInEdges(g, n);

			final Optional<Edge> basic = n.getBasicEdge();
			if (basic.isEmpty())
				continue;
			if (!g.hasNode(basic.get().getId()))
			{
				log.warn("Basic parent " + basic.get().getId() + " of node " + n.getId() + " is not in the graph");
				continue;
			}
			if (basic.get().getId().isRange())
			{
				log.warn("Basic parent of node " + n.getId() + " is the multiword token " + basic.get().getId());
				continue;
			}
			if (!g.hasEdge(basic.get().getId(), n.getId(), basic.get().getDeprel()))
			{
				g.addEdge(basic.get().getId(), n.getId(), basic.get().getDeprel());
				++num_added;
			}
		}
		return num_added;
	}

	/**
	 * @return number of edges removed
	 */
	public static int removeEnhanced(Graph g)
	{
		int num_removed = 0;
		for (Node n : g.getNodes(true))
			num_removed += removeInEdges(g, n);
		return num_removed;
	}

	/**
	 * Relabels enhanced edges from the root as 'root', the only relation allowed from 0.
	 *
	 * @return number of edges relabeled
	 */
	public static int normalize(Graph g)
	{
		int num_relabeled = 0;
		for (Edge e : new ArrayList<>(g.getRoot().getOutEdges()))
		{
			if (e.getDeprel().equals(root_label))
				continue;
			log.debug("Relabeling " + NodeId.ROOT + ":" + e.getDeprel() + " of node " + e.getId() + " as " + root_label);
			g.removeEdge(NodeId.ROOT, e.getId(), e.getDeprel());
			g.addEdge(NodeId.ROOT, e.getId(), root_label);
			++num_relabeled;
		}
		return num_relabeled;
	}

	private static int removeInEdges(Graph g, Node n)
	{
		final ArrayList<Edge> iedges = new ArrayList<>(n.getInEdges());
		iedges.forEach(e -> g.removeEdge(e.getId(), n.getId(), e.getDeprel()));
		return iedges.size();
	}
}
