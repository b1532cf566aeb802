package edu.upf.taln.depgraphs.core.io;

import edu.upf.taln.depgraphs.core.structures.Graph;

import java.util.List;

public interface DocumentWriter
{
	String write(List<Graph> graphs);
}
