package edu.upf.taln.depgraphs.core.structures;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A line of a CoNLL-U sentence: a word, an empty node or a multiword token. Enhanced edges are stored on both of
 * their ends and refer to the other end by id, never by reference.
 */
public class Node implements Serializable
{
	private final NodeId id;
	private String form;
	private String lemma;
	private String upos;
	private String xpos;
	private Features feats = new Features();
	private Misc misc = new Misc();
	private NodeId bparent; // null if not part of the basic tree
	private String bdeprel;
	private final List<Edge> iedges = new ArrayList<>(); // enhanced parents
	private final List<Edge> oedges = new ArrayList<>(); // enhanced children
	// Raw columns kept until the graph draws the edges
	private String rawHead;
	private String rawDeprel;
	private String rawDeps;
	private final static long serialVersionUID = 1L;

	public Node(NodeId id)
	{
		this.id = id;
	}

	public Node(NodeId id, String form, String lemma, String upos, String xpos)
	{
		this.id = id;
		this.form = form;
		this.lemma = lemma;
		this.upos = upos;
		this.xpos = xpos;
	}

	/**
	 * Creates a node from the ten fields of a CoNLL-U line. HEAD, DEPREL and DEPS are kept as raw strings until
	 * the node is added to a graph along with the rest of the sentence.
	 */
	public static Node fromConllu(String[] fields)
	{
		final Node node = new Node(NodeId.parse(fields[0]), fields[1], fields[2], fields[3], fields[4]);
		node.feats = Features.parse(fields[5]);
		node.rawHead = fields[6];
		node.rawDeprel = fields[7];
		node.rawDeps = fields[8];
		node.misc = Misc.parse(fields[9]);
		return node;
	}

	public NodeId getId() { return id; }
	public String getForm() { return form; }
	public void setForm(String form) { this.form = form; }
	public String getLemma() { return lemma; }
	public void setLemma(String lemma) { this.lemma = lemma; }
	public String getUpos() { return upos; }
	public void setUpos(String upos) { this.upos = upos; }
	public String getXpos() { return xpos; }
	public void setXpos(String xpos) { this.xpos = xpos; }
	public Features getFeats() { return feats; }
	public void setFeats(Features feats) { this.feats = feats == null ? new Features() : feats; }
	public Misc getMisc() { return misc; }
	public void setMisc(Misc misc) { this.misc = misc == null ? new Misc() : misc; }

	public boolean isRoot() { return id != null && id.isRoot(); }
	public boolean isEmpty() { return id != null && id.isEmpty(); }
	public boolean isRange() { return id != null && id.isRange(); }

	public Optional<NodeId> getBasicParent() { return Optional.ofNullable(bparent); }
	public Optional<String> getBasicDeprel() { return Optional.ofNullable(bdeprel); }

	public void setBasicParent(NodeId parent, String deprel)
	{
		this.bparent = parent;
		this.bdeprel = deprel;
	}

	public void clearBasicParent()
	{
		this.bparent = null;
		this.bdeprel = null;
	}

	/** @return the incoming basic edge, empty for empty nodes, ranges and unattached words */
	public Optional<Edge> getBasicEdge()
	{
		if (bparent == null || bdeprel == null)
			return Optional.empty();
		return Optional.of(new Edge(bparent, bdeprel));
	}

	public List<Edge> getInEdges() { return Collections.unmodifiableList(iedges); }
	public List<Edge> getOutEdges() { return Collections.unmodifiableList(oedges); }
	public int getInDegree() { return iedges.size(); }
	public int getOutDegree() { return oedges.size(); }

	public List<NodeId> getParents()
	{
		return iedges.stream().map(Edge::getId).distinct().collect(Collectors.toList());
	}

	public List<NodeId> getChildren()
	{
		return oedges.stream().map(Edge::getId).distinct().collect(Collectors.toList());
	}

	// Edge lists are only modified through Graph, which keeps both ends in sync
	boolean addInEdge(Edge e) { return !iedges.contains(e) && iedges.add(e); }
	boolean addOutEdge(Edge e) { return !oedges.contains(e) && oedges.add(e); }
	boolean removeInEdge(Edge e) { return iedges.removeIf(e::equals); }
	boolean removeOutEdge(Edge e) { return oedges.removeIf(e::equals); }

	String getRawHead() { return rawHead; }
	String getRawDeprel() { return rawDeprel; }
	String getRawDeps() { return rawDeps; }

	void clearRawColumns()
	{
		rawHead = null;
		rawDeprel = null;
		rawDeps = null;
	}

	public String getDepsString()
	{
		if (iedges.isEmpty())
			return "_";
		return iedges.stream()
				.sorted(Edge.conllu_order)
				.map(Edge::toString)
				.collect(Collectors.joining("|"));
	}

	public String[] toConllu()
	{
		return new String[]{
				id.toString(),
				valueOrBlank(form),
				valueOrBlank(lemma),
				valueOrBlank(upos),
				valueOrBlank(xpos),
				feats.toConllu(),
				bparent == null ? "_" : bparent.toString(),
				valueOrBlank(bdeprel),
				getDepsString(),
				misc.toConllu()};
	}

	@Override
	public String toString()
	{
		return id + ":" + form;
	}

	private static String valueOrBlank(String value)
	{
		return value == null || value.isEmpty() ? "_" : value;
	}
}
