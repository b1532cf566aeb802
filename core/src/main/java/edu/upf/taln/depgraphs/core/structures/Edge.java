package edu.upf.taln.depgraphs.core.structures;

import java.io.Serializable;
import java.util.Comparator;
import java.util.Objects;

/**
 * One end of an enhanced dependency as seen from the other end: the id of the neighbour node and the relation label.
 * Incoming edges of a node point to its parents, outgoing edges to its children.
 */
public final class Edge implements Serializable
{
	/** Order of items in the DEPS column: parent id, then relation label */
	public static final Comparator<Edge> conllu_order = Comparator.comparing(Edge::getId).thenComparing(Edge::getDeprel);

	private final NodeId id;
	private final String deprel;
	private final static long serialVersionUID = 1L;

	public Edge(NodeId id, String deprel)
	{
		this.id = Objects.requireNonNull(id);
		this.deprel = Objects.requireNonNull(deprel);
	}

	public NodeId getId() { return id; }
	public String getDeprel() { return deprel; }

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		Edge edge = (Edge) o;
		return id.equals(edge.id) && deprel.equals(edge.deprel);
	}

	@Override
	public int hashCode()
	{
		return 31 * id.hashCode() + deprel.hashCode();
	}

	@Override
	public String toString() { return id + ":" + deprel; }
}
