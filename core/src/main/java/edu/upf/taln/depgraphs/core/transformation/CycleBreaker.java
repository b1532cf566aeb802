package edu.upf.taln.depgraphs.core.transformation;

import edu.upf.taln.depgraphs.core.structures.Graph;
import edu.upf.taln.depgraphs.core.structures.Misc;
import edu.upf.taln.depgraphs.core.structures.Node;
import edu.upf.taln.depgraphs.core.structures.NodeId;
import edu.upf.taln.depgraphs.core.utils.DebugUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Breaks cycles in the basic tree. Each node is followed up to the root; when the walk returns to a node it has
 * already visited, the edge that closed the cycle is reattached to the root and the former parent is saved in MISC.
 * Enhanced edges are not touched.
 */
public class CycleBreaker
{
	private final String attribute;
	private final static Logger log = LogManager.getLogger();

	public CycleBreaker()
	{
		this("Cycle");
	}

	public CycleBreaker(String attribute)
	{
		this.attribute = attribute;
	}

	/**
	 * @return number of edges reattached to the root
	 */
	public int breakCycles(Graph g)
	{
		int num_cuts = 0;
		for (Node start : g.getNodes())
		{
			if (!start.getId().isRegular())
				continue;

			final Set<NodeId> visited = new HashSet<>();
			Node last = null;
			NodeId j = start.getId();
			while (!j.isRoot())
			{
				if (visited.contains(j))
				{
					// last -> j closes the cycle
					saveInMisc(last, j);
					last.setBasicParent(NodeId.ROOT, last.getBasicDeprel().orElse(null));
					log.debug("Broke basic cycle by detaching " + last.getId() + " from " + j);
					++num_cuts;
					break;
				}

				visited.add(j);
				last = g.node(j);
				j = getParent(g, last);
			}
		}

		if (num_cuts > 0)
			log.info("Removed " + num_cuts + " cycle(s) from basic tree of sentence " + DebugUtils.getSentenceId(g));
		return num_cuts;
	}

	// Words that are not attached, or attached to something else than a word, are treated as children of the root
	private static NodeId getParent(Graph g, Node n)
	{
		return n.getBasicParent()
				.filter(NodeId::isRegular)
				.filter(g::hasNode)
				.orElse(NodeId.ROOT);
	}

	private void saveInMisc(Node node, NodeId former_parent)
	{
		final Misc misc = node.getMisc();
		final List<String> values = new ArrayList<>(misc.getAll(attribute));
		misc.remove(attribute);
		if (values.size() > 1)
			log.warn("MISC of node " + node.getId() + " already contains multiple " + attribute + "= attributes");

		if (values.isEmpty())
			values.add(former_parent.toString());
		else
		{
			final int last = values.size() - 1;
			values.set(last, values.get(last) + ":" + former_parent);
		}
		values.forEach(v -> misc.add(attribute, v));
	}
}
