package edu.upf.taln.depgraphs.core.io;

import edu.upf.taln.depgraphs.core.structures.Graph;

import java.util.List;

public class ConlluWriter implements DocumentWriter
{
	/**
	 * @return the lines of every graph, each sentence followed by a blank line
	 */
	@Override
	public String write(List<Graph> graphs)
	{
		final StringBuilder s = new StringBuilder();
		graphs.forEach(g ->
		{
			g.toConllu().forEach(l -> s.append(l).append("\n"));
			s.append("\n");
		});
		return s.toString();
	}
}
