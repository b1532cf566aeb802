package edu.upf.taln.depgraphs.core.io;

import edu.upf.taln.depgraphs.core.structures.Graph;

import java.util.List;

/**
 * Base class for classes reading documents into sentence graphs.
 */
public interface DocumentReader
{
	List<Graph> read(String inDocumentContents);
}
