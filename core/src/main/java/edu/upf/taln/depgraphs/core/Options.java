package edu.upf.taln.depgraphs.core;

public class Options
{
	public boolean keep_empty_node_ids = false; // keep ids of collapsed empty nodes in relation labels, e.g. conj>33.1>nsubj instead of conj>nsubj
	public boolean report_cycles = false; // report each sentence where a cycle is found in the enhanced graph
	public boolean report_basenh = false; // report each type of discrepancy between the basic tree and the enhanced graph
	public boolean replace_enhanced = false; // when copying basic dependencies to the enhanced graph, discard the previous enhanced edges
	public String cycle_attribute = "Cycle"; // MISC attribute storing the parents removed to break basic cycles
	public String path_separator = ">"; // separates relations of collapsed paths

	public Options() {}

	public Options(Options o)
	{
		this.keep_empty_node_ids = o.keep_empty_node_ids;
		this.report_cycles = o.report_cycles;
		this.report_basenh = o.report_basenh;
		this.replace_enhanced = o.replace_enhanced;
		this.cycle_attribute = o.cycle_attribute;
		this.path_separator = o.path_separator;
	}

	@Override
	public String toString()
	{
		return  "Options:" +
				"\n\tkeep_empty_node_ids = " + keep_empty_node_ids +
				"\n\treport_cycles = " + report_cycles +
				"\n\treport_basenh = " + report_basenh +
				"\n\treplace_enhanced = " + replace_enhanced +
				"\n\tcycle_attribute = " + cycle_attribute +
				"\n\tpath_separator = " + path_separator;
	}
}
