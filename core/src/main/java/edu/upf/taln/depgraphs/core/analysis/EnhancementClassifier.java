package edu.upf.taln.depgraphs.core.analysis;

import edu.upf.taln.depgraphs.core.analysis.GraphStatistics.Counter;
import edu.upf.taln.depgraphs.core.structures.Edge;
import edu.upf.taln.depgraphs.core.structures.Graph;
import edu.upf.taln.depgraphs.core.structures.Node;
import edu.upf.taln.depgraphs.core.structures.NodeId;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Looks for signals of the enhancements defined in Enhanced Universal Dependencies v2 by comparing the basic tree
 * with the enhanced graph:
 * <ol>
 *     <li>Ellipsis (gapping)</li>
 *     <li>Coordination (propagation of dependencies to conjuncts)</li>
 *     <li>Control verbs</li>
 *     <li>Relative clauses</li>
 *     <li>Case markers added to relation labels</li>
 * </ol>
 * The tests are heuristics over relation labels and edge topology. Labels are matched by type, i.e. "conj" also
 * matches "conj:and".
 */
public class EnhancementClassifier
{
	public static final String edge_type_attribute = "Edep";
	private static final Pattern unusual_label = Pattern.compile(":.*:|[^a-z:]");
	private static final Pattern ref_deps = Pattern.compile("^\\d+(\\.\\d+)?:ref$");
	private static final Pattern empty_parent_deps = Pattern.compile("^\\d+\\.\\d+:([a-z:]+)$");
	private final boolean report_discrepancies;
	private final static Logger log = LogManager.getLogger();

	public EnhancementClassifier()
	{
		this(false);
	}

	public EnhancementClassifier(boolean report_discrepancies)
	{
		this.report_discrepancies = report_discrepancies;
	}

	public void classify(Graph g, GraphStatistics stats)
	{
		int num_empty_nodes = 0;
		for (Node node : g.getNodes())
		{
			compareWithBasic(node, stats);

			// The presence of an empty node signals that gapping is resolved
			if (node.isEmpty())
			{
				stats.increment(Counter.Gapping);
				++num_empty_nodes;
			}
			if (isSharedParent(node))
				stats.increment(Counter.Coord_shared_parent);
			if (isSharedDependent(g, node))
				stats.increment(Counter.Coord_shared_dependent);
			if (isControlledSubject(g, node))
				stats.increment(Counter.Controlled_subject);
			if (node.getInEdges().stream().anyMatch(e -> hasType(e.getDeprel(), "ref")))
				stats.increment(Counter.Relative_clause);
			if (isCaseDeprel(node))
				stats.increment(Counter.Case_deprel);
		}
		stats.addGraphWithEmptyNodes(num_empty_nodes);
	}

	/**
	 * Compares the enhanced incoming edges of a node with its basic incoming edge. Empty nodes have no basic edge,
	 * so all their incoming edges are enhanced only.
	 */
	void compareWithBasic(Node node, GraphStatistics stats)
	{
		final Optional<Edge> basic = node.isEmpty() ? Optional.empty() : node.getBasicEdge();
		boolean basic_found = false;

		for (Edge e : node.getInEdges())
		{
			if (basic.isEmpty() || !basic.get().getId().equals(e.getId()))
			{
				stats.increment(Counter.Edge_enhanced_only);
				report(stats, "edge enhanced only: " + e.getDeprel());
			}
			// Same parent in basic and enhanced, compare relation types
			else if (basic.get().getDeprel().equals(e.getDeprel()))
			{
				stats.increment(Counter.Edge_basic_and_enhanced);
				basic_found = true;
			}
			else
			{
				// e.g. basic 'obl', enhanced 'obl:in'
				if (getMainType(basic.get().getDeprel()).equals(getMainType(e.getDeprel())))
					stats.increment(Counter.Edge_enhanced_type);
				else
					stats.increment(Counter.Edge_incompatible_type);
				basic_found = true;
				report(stats, "edge enhanced type: " + basic.get().getDeprel() + " --> " + e.getDeprel());
			}
		}

		if (basic.isPresent() && !basic_found)
		{
			stats.increment(Counter.Edge_basic_only);
			if (report_discrepancies)
			{
				final Edge b = basic.get();
				final String deps = node.getDepsString();
				final String details;
				if (ref_deps.matcher(deps).matches())
					details = b.getDeprel() + "   ref";
				else if (empty_parent_deps.matcher(deps).matches())
					details = "1 " + b.getDeprel() + "   1.1:" + deps.substring(deps.indexOf(':') + 1);
				else
					details = b.getId() + " " + b.getDeprel() + "   " + deps;
				stats.addDiscrepancy("edge basic only: " + b.getDeprel() + " [" + details + "]");
			}
		}
	}

	/**
	 * Labels every enhanced edge with the enhancements that explain it, and every basic edge missing from the
	 * enhanced graph with the reason it is missing. Each label is appended to the MISC column of the child as
	 * Edep=T:parent:deprel, where T is the code of an {@link EdgeType}. An edge explained by several enhancements
	 * gets one label per enhancement.
	 *
	 * @return number of labels added
	 */
	public int annotate(Graph g)
	{
		int num_labels = 0;
		for (Node node : g.getNodes())
			num_labels += annotate(g, node);
		return num_labels;
	}

	private int annotate(Graph g, Node node)
	{
		final boolean coparent = isSharedParent(node);
		final Set<NodeId> conj_grandparents = getConjGrandparents(g, node);
		final Optional<Edge> basic = node.isEmpty() ? Optional.empty() : node.getBasicEdge();
		boolean basic_found = false;
		boolean empty_parent_found = false;
		boolean ref_found = false;
		int num_labels = 0;

		for (Edge e : node.getInEdges())
		{
			final List<EdgeType> types = new ArrayList<>();
			if (basic.isPresent() && basic.get().getId().equals(e.getId()))
			{
				final String basic_deprel = basic.get().getDeprel();
				if (basic_deprel.equals(e.getDeprel()))
					types.add(EdgeType.Basic);
				else if (getMainType(basic_deprel).equals(getMainType(e.getDeprel())))
					types.add(EdgeType.Cased);
				else
					types.add(EdgeType.Relabeled);
				basic_found = true;
			}
			else
			{
				if (basic.isEmpty())
				{
					if (node.isEmpty())
						types.add(EdgeType.Gapping);
					else
					{
						log.warn("Node " + node.getId() + " has no basic parent but is not empty");
						types.add(EdgeType.Enhanced);
					}
				}
				else if (e.getId().isEmpty())
				{
					types.add(EdgeType.Gapping);
					empty_parent_found = true;
				}

				final boolean conj = hasType(e.getDeprel(), "conj");
				if (coparent && !conj)
					types.add(EdgeType.Coparent);
				if (!conj && conj_grandparents.contains(e.getId()))
					types.add(EdgeType.Codepend);
				if (isExternalSubject(g, node, e))
					types.add(EdgeType.Xsubj);
				if (hasType(e.getDeprel(), "ref"))
				{
					types.add(EdgeType.Relcl);
					ref_found = true;
				}
				// Relative clause cycle: the parent is reachable from the node
				if (isPathFromTo(g, node.getId(), e.getId()))
					types.add(EdgeType.Relcl);

				if (types.isEmpty())
					types.add(EdgeType.Enhanced);
			}

			for (EdgeType t : types)
				save(node, t, e);
			num_labels += types.size();
		}

		if (basic.isPresent() && !basic_found)
		{
			if (empty_parent_found)
				save(node, EdgeType.Orphan, basic.get());
			else if (ref_found)
				save(node, EdgeType.Relpron, basic.get());
			else
				save(node, EdgeType.Missing, basic.get());
			++num_labels;
		}

		return num_labels;
	}

	// The node is subject of P, P is xcomp of G, and the node is a core argument or oblique of G
	private static boolean isExternalSubject(Graph g, Node node, Edge e)
	{
		if (!hasType(e.getDeprel(), "nsubj") && !hasType(e.getDeprel(), "csubj"))
			return false;
		return g.node(e.getId()).getInEdges().stream()
				.filter(pe -> hasType(pe.getDeprel(), "xcomp"))
				.map(pe -> relation(g, pe.getId(), node.getId()))
				.flatMap(Optional::stream)
				.anyMatch(r -> hasType(r, "nsubj") || hasType(r, "csubj") || hasType(r, "obj") ||
						hasType(r, "iobj") || hasType(r, "obl"));
	}

	/**
	 * @return true if a directed path of enhanced edges leads from one node to the other, or both are the same node
	 */
	static boolean isPathFromTo(Graph g, NodeId from, NodeId to)
	{
		final Set<NodeId> visited = new HashSet<>();
		final Deque<NodeId> pending = new ArrayDeque<>();
		pending.push(from);
		while (!pending.isEmpty())
		{
			final NodeId id = pending.pop();
			if (id.equals(to))
				return true;
			if (!visited.add(id))
				continue;
			g.getNode(id).ifPresent(n -> n.getOutEdges().stream()
					.map(Edge::getId)
					.filter(c -> !visited.contains(c))
					.forEach(pending::push));
		}
		return false;
	}

	private static void save(Node node, EdgeType type, Edge e)
	{
		node.getMisc().add(edge_type_attribute, type.getCode() + ":" + e.getId() + ":" + e.getDeprel());
	}

	// Parent propagation in coordination: a 'conj' parent accompanied by a parent with another relation
	static boolean isSharedParent(Node node)
	{
		final List<Edge> iedges = node.getInEdges();
		return iedges.size() >= 2 &&
				iedges.stream().anyMatch(e -> hasType(e.getDeprel(), "conj")) &&
				iedges.stream().anyMatch(e -> !hasType(e.getDeprel(), "conj"));
	}

	// Shared dependent: a non-conj parent P is a conjunct of G, and G is also a non-conj parent of the node
	static boolean isSharedDependent(Graph g, Node node)
	{
		final Set<NodeId> conj_grandparents = getConjGrandparents(g, node);
		return node.getInEdges().stream()
				.filter(e -> !hasType(e.getDeprel(), "conj"))
				.anyMatch(e -> conj_grandparents.contains(e.getId()));
	}

	/**
	 * @return nodes G such that a non-conj parent of the node is a conjunct of G. Empty if the node has less than
	 * two parents.
	 */
	static Set<NodeId> getConjGrandparents(Graph g, Node node)
	{
		final List<Edge> iedges = node.getInEdges();
		if (iedges.size() < 2)
			return Collections.emptySet();

		final Set<NodeId> conj_grandparents = new HashSet<>();
		iedges.stream()
				.filter(e -> !hasType(e.getDeprel(), "conj"))
				.map(e -> g.node(e.getId()))
				.flatMap(p -> p.getInEdges().stream())
				.filter(e -> hasType(e.getDeprel(), "conj"))
				.map(Edge::getId)
				.forEach(conj_grandparents::add);
		return conj_grandparents;
	}

	// Subject propagation through xcomp: nsubj of P, P is xcomp of G, and a core argument of G
	static boolean isControlledSubject(Graph g, Node node)
	{
		return node.getInEdges().stream()
				.filter(e -> hasType(e.getDeprel(), "nsubj"))
				.map(e -> g.node(e.getId()))
				.flatMap(p -> p.getInEdges().stream())
				.filter(e -> hasType(e.getDeprel(), "xcomp"))
				.map(e -> relation(g, e.getId(), node.getId()))
				.flatMap(Optional::stream)
				.anyMatch(r -> hasType(r, "nsubj") || hasType(r, "obj") || hasType(r, "iobj"));
	}

	// Adpositions and case features in enhanced relations
	static boolean isCaseDeprel(Node node)
	{
		final List<Edge> iedges = node.getInEdges();
		if (iedges.stream().anyMatch(e -> unusual_label.matcher(e.getDeprel()).find()))
			return true;

		final Optional<Edge> basic = node.getBasicEdge();
		if (basic.isEmpty())
			return false;
		final String prefix = basic.get().getDeprel() + ":";
		return iedges.stream()
				.filter(e -> e.getId().equals(basic.get().getId()))
				.anyMatch(e -> e.getDeprel().startsWith(prefix) && e.getDeprel().length() > prefix.length());
	}

	/**
	 * @return label of the relation from p to c. The guidelines allow at most one relation between two nodes.
	 */
	static Optional<String> relation(Graph g, NodeId p, NodeId c)
	{
		final List<String> relations = g.getRelations(p, c);
		if (relations.isEmpty())
			return Optional.empty();
		if (relations.size() > 1)
			log.warn("Enhanced graph should not connect the same two nodes twice: " + p + " -> " + c + " " + relations);
		return Optional.of(relations.get(0));
	}

	static boolean hasType(String deprel, String type)
	{
		return deprel.equals(type) || deprel.startsWith(type + ":");
	}

	static String getMainType(String deprel)
	{
		final int colon = deprel.indexOf(':');
		return colon > 0 ? deprel.substring(0, colon) : deprel;
	}

	private void report(GraphStatistics stats, String key)
	{
		if (report_discrepancies)
			stats.addDiscrepancy(key);
	}
}
