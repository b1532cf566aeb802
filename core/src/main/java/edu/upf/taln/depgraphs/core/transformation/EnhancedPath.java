package edu.upf.taln.depgraphs.core.transformation;

import edu.upf.taln.depgraphs.core.structures.NodeId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

/**
 * Sequence of enhanced edges p -l1-> x1 -l2-> ... -ln-> c, stored as the n+1 node ids and the n labels.
 * Instances are immutable.
 */
final class EnhancedPath
{
	private final List<NodeId> nodes;
	private final List<String> labels;

	static EnhancedPath of(NodeId parent, String label, NodeId child)
	{
		return new EnhancedPath(List.of(parent, child), List.of(label));
	}

	private EnhancedPath(List<NodeId> nodes, List<String> labels)
	{
		this.nodes = Collections.unmodifiableList(nodes);
		this.labels = Collections.unmodifiableList(labels);
	}

	NodeId getFirst() { return nodes.get(0); }
	NodeId getLast() { return nodes.get(nodes.size() - 1); }
	List<String> getLabels() { return labels; }
	int getLength() { return labels.size(); }

	// Ids between the two ends
	List<NodeId> getIntermediateNodes() { return nodes.subList(1, nodes.size() - 1); }

	/**
	 * @return this path followed by other, which must start where this one ends
	 */
	EnhancedPath append(EnhancedPath other)
	{
		if (!getLast().equals(other.getFirst()))
			throw new IllegalArgumentException("Cannot append " + other + " to " + this);

		final List<NodeId> joined_nodes = new ArrayList<>(nodes);
		joined_nodes.addAll(other.nodes.subList(1, other.nodes.size()));
		final List<String> joined_labels = new ArrayList<>(labels);
		joined_labels.addAll(other.labels);
		return new EnhancedPath(joined_nodes, joined_labels);
	}

	boolean visitsNodeTwice()
	{
		return new HashSet<>(nodes).size() < nodes.size();
	}

	boolean isFinished()
	{
		return !getFirst().isEmpty() && !getLast().isEmpty();
	}

	/**
	 * @param keep_ids if true, the ids of intermediate nodes appear between the labels
	 */
	String getLabel(String separator, boolean keep_ids)
	{
		final StringBuilder label = new StringBuilder(labels.get(0));
		for (int i = 1; i < labels.size(); ++i)
		{
			if (keep_ids)
				label.append(separator).append(nodes.get(i));
			label.append(separator).append(labels.get(i));
		}
		return label.toString();
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		EnhancedPath that = (EnhancedPath) o;
		return nodes.equals(that.nodes) && labels.equals(that.labels);
	}

	@Override
	public int hashCode()
	{
		return 31 * nodes.hashCode() + labels.hashCode();
	}

	@Override
	public String toString()
	{
		final StringBuilder s = new StringBuilder().append(nodes.get(0));
		for (int i = 0; i < labels.size(); ++i)
			s.append(" ").append(labels.get(i)).append(" ").append(nodes.get(i + 1));
		return s.toString();
	}
}
