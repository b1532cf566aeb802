package edu.upf.taln.depgraphs.tools;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.google.common.base.Stopwatch;
import edu.upf.taln.depgraphs.core.Options;
import edu.upf.taln.depgraphs.core.analysis.EnhancementClassifier;
import edu.upf.taln.depgraphs.core.analysis.GraphAnalyzer;
import edu.upf.taln.depgraphs.core.analysis.GraphStatistics;
import edu.upf.taln.depgraphs.core.io.ConlluReader;
import edu.upf.taln.depgraphs.core.io.ConlluWriter;
import edu.upf.taln.depgraphs.core.structures.Graph;
import edu.upf.taln.depgraphs.core.transformation.CycleBreaker;
import edu.upf.taln.depgraphs.core.transformation.EmptyNodeCollapser;
import edu.upf.taln.depgraphs.core.transformation.EnhancedDepsEditor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.List;
import java.util.function.ToIntFunction;

public class Driver
{
	public static final String break_cycles_command = "break-cycles";
	public static final String collapse_empty_command = "collapse-empty";
	public static final String properties_command = "properties";
	public static final String copy_basic_command = "copy-basic";
	public static final String remove_enhanced_command = "remove-enhanced";
	public static final String normalize_command = "normalize";
	public static final String classify_relations_command = "classify-relations";
	private final static Logger log = LogManager.getLogger();

	private static abstract class BaseCommand
	{
		@Parameter(names = {"-i", "-input"}, description = "Path to CoNLL-U input file", arity = 1, required = true,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		protected Path input;
		@Parameter(names = {"-o", "-output"}, description = "Path to output file. If not set, output is written to stdout", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.ValidPathToFile.class)
		protected Path output = null;
		@Parameter(names = {"-p", "-properties"}, description = "Path to properties file with default option values", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		protected Path properties = null;

		Options getOptions()
		{
			return properties != null ? new ToolProperties(properties).getOptions() : new Options();
		}
	}

	@SuppressWarnings("unused")
	@Parameters(commandDescription = "Break cycles in the basic trees, keeping removed parents in MISC")
	private static class BreakCyclesCommand extends BaseCommand
	{
		@Parameter(names = {"-a", "-attribute"}, description = "MISC attribute where removed parents are stored", arity = 1,
				validateWith = CMLCheckers.AttributeName.class)
		private String attribute = null;
	}

	@SuppressWarnings("unused")
	@Parameters(commandDescription = "Replace paths through empty nodes with edges with concatenated labels")
	private static class CollapseEmptyCommand extends BaseCommand
	{
		@Parameter(names = {"-k", "-keep_ids"}, description = "Keep ids of empty nodes in relation labels")
		private boolean keep_ids = false;
	}

	@SuppressWarnings("unused")
	@Parameters(commandDescription = "Print statistics of the properties of enhanced graphs")
	private static class PropertiesCommand extends BaseCommand
	{
		@Parameter(names = {"-rc", "-report_cycles"}, description = "Report every sentence that contains a cycle")
		private boolean report_cycles = false;
		@Parameter(names = {"-rb", "-report_basenh"}, description = "Report discrepancies between basic and enhanced edges")
		private boolean report_basenh = false;
	}

	@SuppressWarnings("unused")
	@Parameters(commandDescription = "Copy basic dependencies to the enhanced graph")
	private static class CopyBasicCommand extends BaseCommand
	{
		@Parameter(names = {"-r", "-replace"}, description = "Remove existing enhanced dependencies first")
		private boolean replace = false;
	}

	@SuppressWarnings("unused")
	@Parameters(commandDescription = "Remove all enhanced dependencies")
	private static class RemoveEnhancedCommand extends BaseCommand
	{
	}

	@SuppressWarnings("unused")
	@Parameters(commandDescription = "Relabel enhanced dependencies on 0 as root")
	private static class NormalizeCommand extends BaseCommand
	{
	}

	@SuppressWarnings("unused")
	@Parameters(commandDescription = "Label enhanced and missing basic relations with their enhancement type in MISC (Edep=T:parent:deprel)")
	private static class ClassifyRelationsCommand extends BaseCommand
	{
	}

	public static void main(String[] args)
	{
		BreakCyclesCommand breakCycles = new BreakCyclesCommand();
		CollapseEmptyCommand collapseEmpty = new CollapseEmptyCommand();
		PropertiesCommand properties = new PropertiesCommand();
		CopyBasicCommand copyBasic = new CopyBasicCommand();
		RemoveEnhancedCommand removeEnhanced = new RemoveEnhancedCommand();
		NormalizeCommand normalize = new NormalizeCommand();
		ClassifyRelationsCommand classifyRelations = new ClassifyRelationsCommand();

		JCommander jc = new JCommander();
		jc.addCommand(break_cycles_command, breakCycles);
		jc.addCommand(collapse_empty_command, collapseEmpty);
		jc.addCommand(properties_command, properties);
		jc.addCommand(copy_basic_command, copyBasic);
		jc.addCommand(remove_enhanced_command, removeEnhanced);
		jc.addCommand(normalize_command, normalize);
		jc.addCommand(classify_relations_command, classifyRelations);
		jc.parse(args);

		DateFormat dateFormat = new SimpleDateFormat("dd/MM/yyyy HH:mm:ss");
		Date date = new Date();
		log.info(dateFormat.format(date) + " running \n\t" + String.join("\n\t", args));

		final String command = jc.getParsedCommand();
		if (command == null)
		{
			jc.usage();
			return;
		}

		switch (command)
		{
			case break_cycles_command:
			{
				Options options = breakCycles.getOptions();
				if (breakCycles.attribute != null)
					options.cycle_attribute = breakCycles.attribute;
				final CycleBreaker breaker = new CycleBreaker(options.cycle_attribute);
				transform(breakCycles, breaker::breakCycles, "cycles broken");
				break;
			}
			case collapse_empty_command:
			{
				Options options = collapseEmpty.getOptions();
				options.keep_empty_node_ids |= collapseEmpty.keep_ids;
				final EmptyNodeCollapser collapser = new EmptyNodeCollapser(options.keep_empty_node_ids, options.path_separator);
				transform(collapseEmpty, g -> collapser.collapse(g).size(), "collapsed edges added");
				break;
			}
			case properties_command:
			{
				Options options = properties.getOptions();
				options.report_cycles |= properties.report_cycles;
				options.report_basenh |= properties.report_basenh;
				analyze(properties, options);
				break;
			}
			case copy_basic_command:
			{
				Options options = copyBasic.getOptions();
				options.replace_enhanced |= copyBasic.replace;
				final boolean replace = options.replace_enhanced;
				transform(copyBasic, g -> EnhancedDepsEditor.copyBasicToEnhanced(g, replace), "enhanced edges added");
				break;
			}
			case remove_enhanced_command:
				transform(removeEnhanced, EnhancedDepsEditor::removeEnhanced, "enhanced edges removed");
				break;
			case normalize_command:
				transform(normalize, EnhancedDepsEditor::normalize, "edges relabeled");
				break;
			case classify_relations_command:
			{
				final EnhancementClassifier classifier = new EnhancementClassifier();
				transform(classifyRelations, classifier::annotate, "relation labels added");
				break;
			}
			default:
				jc.usage();
				break;
		}
	}

	/**
	 * Reads the input, applies a transformation to every graph and writes the modified graphs.
	 *
	 * @param transformation returns the number of changes made to a graph
	 */
	private static void transform(BaseCommand command, ToIntFunction<Graph> transformation, String description)
	{
		Stopwatch timer = Stopwatch.createStarted();
		final List<Graph> graphs = new ConlluReader().read(FileUtils.readTextFile(command.input));
		final int num_changes = graphs.stream()
				.mapToInt(transformation)
				.sum();
		writeOutput(command.output, new ConlluWriter().write(graphs));
		log.info(num_changes + " " + description + " in " + graphs.size() + " graphs, took " + timer.stop());
	}

	private static void analyze(BaseCommand command, Options options)
	{
		Stopwatch timer = Stopwatch.createStarted();
		final List<Graph> graphs = new ConlluReader().read(FileUtils.readTextFile(command.input));
		final GraphAnalyzer analyzer = new GraphAnalyzer(options);
		final GraphStatistics stats = new GraphStatistics();
		graphs.forEach(g -> analyzer.analyze(g, stats));

		final StringBuilder report = new StringBuilder();
		stats.getCycleReports().forEach(r -> report.append(r).append("\n"));
		report.append(stats.printReport());
		writeOutput(command.output, report.toString());
		log.info("Analysis of " + graphs.size() + " graphs took " + timer.stop());
	}

	private static void writeOutput(Path output, String text)
	{
		if (output != null)
			FileUtils.writeTextToFile(output, text);
		else
		{
			System.out.print(text);
			System.out.flush();
		}
	}
}
