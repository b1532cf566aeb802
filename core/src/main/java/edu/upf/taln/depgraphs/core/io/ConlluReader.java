package edu.upf.taln.depgraphs.core.io;

import com.google.common.base.Splitter;
import com.google.common.base.Stopwatch;
import edu.upf.taln.depgraphs.core.structures.Graph;
import edu.upf.taln.depgraphs.core.structures.GraphException;
import edu.upf.taln.depgraphs.core.utils.DebugUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads CoNLL-U documents. Sentences are separated by blank lines; the last sentence may lack its final blank line.
 */
public class ConlluReader implements DocumentReader
{
	private final static Logger log = LogManager.getLogger();

	/**
	 * @return the lines of each sentence, without the blank separator lines
	 */
	public static List<List<String>> readSentences(String text)
	{
		final List<List<String>> sentences = new ArrayList<>();
		List<String> current = new ArrayList<>();
		for (String line : Splitter.onPattern("\r?\n").split(text))
		{
			if (line.trim().isEmpty())
			{
				if (!current.isEmpty())
				{
					sentences.add(current);
					current = new ArrayList<>();
				}
			}
			else
				current.add(line);
		}
		if (!current.isEmpty())
			sentences.add(current);

		return sentences;
	}

	/**
	 * Sentences that cannot be turned into a graph are logged and left out of the results.
	 */
	@Override
	public List<Graph> read(String text)
	{
		final Stopwatch timer = Stopwatch.createStarted();
		final List<List<String>> sentences = readSentences(text);
		final List<Graph> graphs = new ArrayList<>();

		int counter = 0;
		for (List<String> sentence : sentences)
		{
			++counter;
			try
			{
				graphs.add(Graph.fromConllu(sentence));
			}
			catch (GraphException e)
			{
				log.error("Skipping sentence " + counter + ": " + e);
			}

			if (counter % DebugUtils.LOGGING_STEP_SIZE == 0)
				log.info(DebugUtils.printInteger(counter) + " sentences read");
		}

		log.info("Read " + DebugUtils.printInteger(graphs.size()) + " graphs out of " +
				DebugUtils.printInteger(sentences.size()) + " sentences in " + timer.stop());
		return graphs;
	}
}
