package edu.upf.taln.depgraphs.core.analysis;

import com.google.common.collect.EnumMultiset;
import com.google.common.collect.Multiset;
import com.google.common.collect.SortedMultiset;
import com.google.common.collect.TreeMultiset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Counts collected over a sequence of sentence graphs. One accumulator is created per run and handed to every
 * per-sentence analysis.
 */
public class GraphStatistics
{
	public enum Counter
	{
		Graphs, Nodes, Overt_nodes, Empty_nodes, Edges,
		Singletons, In2plus, Top1, Top2, Independent,
		Cyclic_graphs, Unconnected_graphs,
		Edge_basic_only, Edge_basic_and_enhanced, Edge_enhanced_type, Edge_incompatible_type, Edge_enhanced_only,
		Gapping, Coord_shared_parent, Coord_shared_dependent, Controlled_subject, Relative_clause, Case_deprel
	}

	private final Multiset<Counter> counts = EnumMultiset.create(Counter.class);
	private final SortedMultiset<Integer> graphs_with_n_empty_nodes = TreeMultiset.create();
	private final SortedMultiset<String> discrepancies = TreeMultiset.create(); // basic vs. enhanced, only if requested
	private final List<String> cycle_reports = new ArrayList<>();

	public void increment(Counter c) { counts.add(c); }
	public void add(Counter c, int n) { counts.add(c, n); }
	public int get(Counter c) { return counts.count(c); }

	public void addGraphWithEmptyNodes(int num_empty) { graphs_with_n_empty_nodes.add(num_empty); }
	public int getGraphsWithEmptyNodes(int num_empty) { return graphs_with_n_empty_nodes.count(num_empty); }

	public void addDiscrepancy(String key) { discrepancies.add(key); }
	public SortedMultiset<String> getDiscrepancies() { return discrepancies; }

	public void addCycleReport(String report) { cycle_reports.add(report); }
	public List<String> getCycleReports() { return Collections.unmodifiableList(cycle_reports); }

	public String printReport()
	{
		final StringBuilder s = new StringBuilder();
		s.append(get(Counter.Graphs)).append(" graphs\n");
		s.append(get(Counter.Nodes)).append(" nodes\n");
		s.append("  ").append(get(Counter.Overt_nodes)).append(" overt surface nodes\n");
		s.append("  ").append(get(Counter.Empty_nodes)).append(" empty nodes\n");
		if (graphs_with_n_empty_nodes.elementSet().size() > 1 ||
				(graphs_with_n_empty_nodes.elementSet().size() == 1 && graphs_with_n_empty_nodes.firstEntry().getElement() != 0))
		{
			graphs_with_n_empty_nodes.entrySet().forEach(e ->
					s.append("    ").append(e.getCount()).append(" graphs with ").append(e.getElement()).append(" empty nodes\n"));
		}
		s.append(get(Counter.Edges)).append(" edges (not counting dependencies on 0)\n");
		s.append(get(Counter.Singletons)).append(" singletons\n");
		s.append(get(Counter.In2plus)).append(" nodes with in-degree greater than 1\n");
		s.append(get(Counter.Top1)).append(" top nodes only depending on 0\n");
		s.append(get(Counter.Top2)).append(" top nodes with in-degree greater than 1\n");
		s.append(get(Counter.Independent)).append(" independent non-top nodes (zero in, nonzero out)\n");
		s.append(get(Counter.Cyclic_graphs)).append(" graphs that contain at least one cycle\n");
		s.append(get(Counter.Unconnected_graphs)).append(" graphs with multiple non-singleton components\n");
		s.append("Enhancements defined in Enhanced Universal Dependencies v2 (number of observed signals that the enhancement is applied):\n");
		s.append("* Edge basic only:        ").append(get(Counter.Edge_basic_only)).append("\n");
		s.append("* Edge basic & enhanced:  ").append(get(Counter.Edge_basic_and_enhanced)).append("\n");
		s.append("* Edge enhanced type:     ").append(get(Counter.Edge_enhanced_type)).append("\n");
		s.append("* Edge incompatible type: ").append(get(Counter.Edge_incompatible_type)).append("\n");
		s.append("* Edge enhanced only:     ").append(get(Counter.Edge_enhanced_only)).append("\n");
		s.append("* Gapping:                ").append(get(Counter.Gapping)).append("\n");
		s.append("* Coord shared parent:    ").append(get(Counter.Coord_shared_parent)).append("\n");
		s.append("* Coord shared depend:    ").append(get(Counter.Coord_shared_dependent)).append("\n");
		s.append("* Controlled subject:     ").append(get(Counter.Controlled_subject)).append("\n");
		s.append("* Relative clause:        ").append(get(Counter.Relative_clause)).append("\n");
		s.append("* Deprel with case:       ").append(get(Counter.Case_deprel)).append("\n");
		if (!discrepancies.isEmpty())
		{
			s.append("\n");
			discrepancies.entrySet().forEach(e -> s.append(e.getCount()).append("\t").append(e.getElement()).append("\n"));
		}
		return s.toString();
	}
}
