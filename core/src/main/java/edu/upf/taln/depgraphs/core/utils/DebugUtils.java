package edu.upf.taln.depgraphs.core.utils;

import edu.upf.taln.depgraphs.core.structures.Graph;
import edu.upf.taln.depgraphs.core.structures.Node;
import edu.upf.taln.depgraphs.core.structures.NodeId;

import java.text.DecimalFormat;
import java.text.NumberFormat;
import java.util.List;

import static java.util.stream.Collectors.joining;

public class DebugUtils
{
	public static final int LOGGING_STEP_SIZE = 10000;
	private final static NumberFormat int_format = new DecimalFormat("#,###");

	public static String printInteger(int i)
	{
		return int_format.format(i);
	}

	public static String getSentenceId(Graph g)
	{
		return g.getComments().stream()
				.filter(c -> c.matches("^#\\s*sent_id\\b.*"))
				.map(c -> c.replaceFirst("^#\\s*sent_id\\s*=?\\s*", ""))
				.findFirst()
				.orElse("(no sent_id)");
	}

	// Prints each node of a path as id:form
	public static String printPath(Graph g, List<NodeId> path)
	{
		return path.stream()
				.map(id -> id + ":" + g.getNode(id).map(Node::getForm).orElse("_"))
				.collect(joining(" "));
	}

	public static String printCycle(Graph g, List<NodeId> cycle)
	{
		final StringBuilder report = new StringBuilder("Found a cycle in this sentence:\n");
		g.getComments().forEach(c -> report.append(c).append("\n"));
		report.append("The cycle: ").append(printPath(g, cycle)).append("\n");
		return report.toString();
	}
}
