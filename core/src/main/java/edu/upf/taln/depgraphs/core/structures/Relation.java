package edu.upf.taln.depgraphs.core.structures;

import org.jgrapht.graph.DefaultEdge;

/**
 * Enhanced dependency in a jgrapht view of a sentence. The same two nodes may be linked by several relations with
 * different deprels, so relations are compared by identity.
 */
public class Relation extends DefaultEdge
{
	private final String deprel;
	private final static long serialVersionUID = 1L;

	public Relation(String deprel)
	{
		this.deprel = deprel;
	}

	public String getDeprel() { return deprel; }
	public NodeId getParent() { return (NodeId) getSource(); }
	public NodeId getChild() { return (NodeId) getTarget(); }

	/**
	 * @return the relation as stored in the DEPS column of the child
	 */
	public Edge toEdge() { return new Edge(getParent(), deprel); }

	@Override
	public String toString() { return getParent() + " --- " + deprel + " ---> " + getChild(); }
}
