package edu.upf.taln.depgraphs.core.analysis;

/**
 * Classification of a node by the number of incoming and outgoing enhanced edges
 */
public enum DegreeCategory
{
	Singleton, // no incoming and no outgoing edges
	Independent, // no incoming edges but at least one outgoing; not a top node, which would depend on 0
	SingleTop, // only depends on 0
	MultiParent, // in-degree greater than 1
	MultiParentTop, // in-degree greater than 1, one of the parents is 0
	Other // single parent other than 0
}
