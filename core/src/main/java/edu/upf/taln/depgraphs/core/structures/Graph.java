package edu.upf.taln.depgraphs.core.structures;

import com.google.common.base.Splitter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jgrapht.graph.DirectedPseudograph;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A CoNLL-U sentence: the nodes indexed by their ids plus the sentence-level comments. The artificial root node 0
 * is created along with the graph. Edges are stored in the nodes and refer to other nodes by id, so removing a node
 * leaves dangling edges unless the caller removes them first.
 */
public class Graph
{
	public static final int num_fields = 10;
	private static final Pattern dep_pattern = Pattern.compile("^(\\d+(?:\\.\\d+)?):(.+)$");
	private final static Logger log = LogManager.getLogger();

	private final List<String> comments = new ArrayList<>();
	private final SortedMap<NodeId, Node> nodes = new TreeMap<>();

	public Graph()
	{
		nodes.put(NodeId.ROOT, new Node(NodeId.ROOT));
	}

	/**
	 * Creates a graph from the lines of a sentence. The final empty line may or may not be included.
	 * Lines with a wrong number of fields are reported and read as well as possible.
	 *
	 * @throws GraphException if ids are repeated or edges refer to missing nodes
	 */
	public static Graph fromConllu(List<String> lines)
	{
		final Graph graph = new Graph();
		for (String line : lines)
		{
			if (line.startsWith("#"))
				graph.comments.add(line);
			else if (!line.isEmpty() && Character.isDigit(line.charAt(0)))
			{
				final String[] fields = splitFields(line);
				final Node node;
				try
				{
					node = Node.fromConllu(fields);
				}
				catch (IllegalArgumentException e)
				{
					log.warn("Skipping line with invalid id: " + line);
					continue;
				}
				graph.addNode(node);
			}
			else if (!line.trim().isEmpty())
				log.warn("Skipping line that is neither a comment nor a node: " + line);
		}

		// Once all nodes have been added to the graph, we can draw edges between them.
		for (Node node : graph.getNodes(true))
		{
			graph.setBasicDepFromConllu(node);
			graph.setDepsFromConllu(node);
			node.clearRawColumns();
		}

		return graph;
	}

	/**
	 * @return lines of the sentence without the final empty line
	 */
	public List<String> toConllu()
	{
		final List<String> lines = new ArrayList<>(comments);
		getNodes(true).stream()
				.map(Node::toConllu)
				.map(fields -> String.join("\t", fields))
				.forEach(lines::add);
		return lines;
	}

	public List<String> getComments() { return comments; }

	public boolean hasNode(NodeId id)
	{
		return nodes.containsKey(Objects.requireNonNull(id, "Undefined id"));
	}

	public Optional<Node> getNode(NodeId id)
	{
		return Optional.ofNullable(nodes.get(Objects.requireNonNull(id, "Undefined id")));
	}

	/**
	 * Same as {@link #getNode(NodeId)} but fails if the node does not exist.
	 */
	public Node node(NodeId id)
	{
		return getNode(id).orElseThrow(() -> new GraphException(GraphException.Type.UnknownNode, "Unknown node '" + id + "'"));
	}

	public Node getRoot() { return nodes.get(NodeId.ROOT); }

	/**
	 * @return all nodes except the root and the multiword tokens, ordered by id
	 */
	public List<Node> getNodes() { return getNodes(false); }

	public List<Node> getNodes(boolean include_ranges)
	{
		return nodes.values().stream()
				.filter(n -> !n.isRoot())
				.filter(n -> include_ranges || !n.isRange())
				.collect(Collectors.toList());
	}

	public int size() { return nodes.size() - 1; }

	public void addNode(Node node)
	{
		final NodeId id = node.getId();
		if (id == null)
			throw new GraphException(GraphException.Type.MissingId, "Cannot add node with undefined id");
		if (nodes.containsKey(id))
			throw new GraphException(GraphException.Type.DuplicateId, "There is already a node with id " + id + " in the graph");
		nodes.put(id, node);
	}

	/**
	 * Removes a node without changing the ids of the remaining nodes. Edges pointing to the removed node from
	 * other nodes are left untouched. The root is never removed.
	 */
	public Optional<Node> removeNode(NodeId id)
	{
		if (Objects.requireNonNull(id, "Undefined id").isRoot())
		{
			log.warn("Ignoring attempt to remove the root node");
			return Optional.empty();
		}
		return Optional.ofNullable(nodes.remove(id));
	}

	/**
	 * Adds an enhanced edge between two nodes that are already in the graph. Adding an existing edge has no effect.
	 *
	 * @throws GraphException if a node is missing or is a multiword token
	 */
	public void addEdge(NodeId source, NodeId target, String deprel)
	{
		final Node src = node(source);
		final Node tgt = node(target);
		if (src.isRange() || tgt.isRange())
			throw new GraphException(GraphException.Type.RangeNode, "Multiword token cannot take part in edge '" + source + " --- " + deprel + " ---> " + target + "'");
		src.addOutEdge(new Edge(target, deprel));
		tgt.addInEdge(new Edge(source, deprel));
	}

	public void removeEdge(NodeId source, NodeId target, String deprel)
	{
		final Node src = node(source);
		final Node tgt = node(target);
		src.removeOutEdge(new Edge(target, deprel));
		tgt.removeInEdge(new Edge(source, deprel));
	}

	public boolean hasEdge(NodeId source, NodeId target, String deprel)
	{
		return getNode(target).map(n -> n.getInEdges().contains(new Edge(source, deprel))).orElse(false);
	}

	/**
	 * @return labels of all enhanced edges from p to c
	 */
	public List<String> getRelations(NodeId p, NodeId c)
	{
		return getNode(p).map(n -> n.getOutEdges().stream()
				.filter(e -> e.getId().equals(c))
				.map(Edge::getDeprel)
				.collect(Collectors.toList()))
				.orElse(Collections.emptyList());
	}

	public List<NodeId> getBasicChildren(NodeId id)
	{
		return nodes.values().stream()
				.filter(n -> n.getBasicParent().map(id::equals).orElse(false))
				.map(Node::getId)
				.collect(Collectors.toList());
	}

	/**
	 * Checks whether a node depends directly or indirectly on another node in the basic tree. The walk is bounded by
	 * the number of nodes, so it terminates even if the basic tree contains a cycle.
	 */
	public boolean basicDependsOn(NodeId id, NodeId ancestor)
	{
		Optional<NodeId> current = node(id).getBasicParent();
		for (int steps = 0; current.isPresent() && steps <= nodes.size(); ++steps)
		{
			if (current.get().equals(ancestor))
				return true;
			current = getNode(current.get()).flatMap(Node::getBasicParent);
		}
		return false;
	}

	/**
	 * @return a jgrapht view of the enhanced graph including the root. Multiword tokens are left out.
	 */
	public DirectedPseudograph<NodeId, Relation> asEnhancedGraph()
	{
		final DirectedPseudograph<NodeId, Relation> g = new DirectedPseudograph<>(Relation.class);
		nodes.values().stream()
				.filter(n -> !n.isRange())
				.map(Node::getId)
				.forEach(g::addVertex);
		nodes.values().stream()
				.filter(n -> !n.isRange())
				.forEach(n -> n.getOutEdges().stream()
						.filter(e -> g.containsVertex(e.getId()))
						.forEach(e -> g.addEdge(n.getId(), e.getId(), new Relation(e.getDeprel()))));
		return g;
	}

	private void setBasicDepFromConllu(Node node)
	{
		if (node.isRange())
			return;

		final String head = node.getRawHead();
		if (head == null || head.isEmpty() || head.equals("_"))
			return;

		if (!NodeId.isValid(head))
			throw new GraphException(GraphException.Type.UnknownNode, "Basic dependency '" + node.getRawDeprel() + "' of node " + node.getId() + " from invalid node '" + head + "'");
		final NodeId parent = NodeId.parse(head);
		if (!hasNode(parent))
			throw new GraphException(GraphException.Type.UnknownNode, "Basic dependency '" + node.getRawDeprel() + "' of node " + node.getId() + " from a non-existent node '" + head + "'");
		node.setBasicParent(parent, node.getRawDeprel());
	}

	private void setDepsFromConllu(Node node)
	{
		if (node.isRange())
			return;

		final String deps = node.getRawDeps();
		if (deps == null || deps.isEmpty() || deps.equals("_"))
			return;

		for (String dep : Splitter.on('|').split(deps))
		{
			final Matcher m = dep_pattern.matcher(dep);
			if (!m.matches())
			{
				log.warn("Cannot understand dep '" + dep + "' of node " + node.getId());
				continue;
			}

			final NodeId parent = NodeId.parse(m.group(1));
			final String deprel = m.group(2);
			if (!hasNode(parent))
				throw new GraphException(GraphException.Type.UnknownNode, "Incoming dependency '" + deprel + "' of node " + node.getId() + " from a non-existent node '" + parent + "'");
			if (hasEdge(parent, node.getId(), deprel))
				log.warn("Ignoring repeated declaration of edge '" + parent + " --- " + deprel + " ---> " + node.getId() + "'");
			else
				addEdge(parent, node.getId(), deprel);
		}
	}

	private static String[] splitFields(String line)
	{
		final String[] fields = line.split("\t", -1);
		if (fields.length == num_fields)
			return fields;

		log.warn("A CoNLL-U line should have " + num_fields + " fields but this one has " + fields.length + ": " + line);
		final String[] fixed = new String[num_fields];
		for (int i = 0; i < num_fields; ++i)
			fixed[i] = i < fields.length ? fields[i] : "_";
		return fixed;
	}
}
