package edu.upf.taln.depgraphs.core.analysis;

/**
 * Reason why an enhanced edge exists, or why a basic edge is missing from the enhanced graph. An edge may have
 * several reasons at once.
 */
public enum EdgeType
{
	Basic('B'),     // same parent and deprel as the basic edge
	Cased('C'),     // same parent as the basic edge, deprel extended with a subtype, e.g. obl -> obl:in
	Relabeled('L'), // same parent as the basic edge, different deprel
	Gapping('G'),   // parent or child is an empty node
	Orphan('O'),    // basic edge replaced by an edge from an empty node
	Coparent('P'),  // parent shared by conjuncts, propagated to a non-first conjunct
	Codepend('S'),  // dependent shared by conjuncts, propagated from a non-first conjunct
	Xsubj('X'),     // external subject of a controlled predicate
	Relcl('R'),     // 'ref' edge or edge closing a cycle through a relative clause
	Relpron('W'),   // basic edge of a relative pronoun replaced by 'ref'
	Missing('M'),   // basic edge missing for no recognized reason
	Enhanced('E');  // enhanced-only edge for no recognized reason

	private final char code;

	EdgeType(char code)
	{
		this.code = code;
	}

	public char getCode() { return code; }
}
