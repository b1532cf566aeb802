package edu.upf.taln.depgraphs.tools;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class DriverTest
{
	private static final String sentence =
			"# sent_id = gapping\n" +
			"1\tMary\tMary\tPROPN\t_\t_\t2\tnsubj\t2:nsubj\t_\n" +
			"2\teats\teat\tVERB\t_\t_\t0\troot\t0:root\t_\n" +
			"2.1\teats\teat\tVERB\t_\t_\t_\t_\t2:conj\t_\n" +
			"3\tPeter\tPeter\tPROPN\t_\t_\t2\tconj\t2.1:nsubj\t_\n" +
			"\n";

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private Path input() throws Exception
	{
		final Path in = folder.newFile("in.conllu").toPath();
		Files.write(in, sentence.getBytes(StandardCharsets.UTF_8));
		return in;
	}

	private static String read(Path file) throws Exception
	{
		return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
	}

	@Test
	public void testCollapseEmpty() throws Exception
	{
		final Path in = input();
		final Path out = new File(folder.getRoot(), "out.conllu").toPath();
		Driver.main(new String[]{Driver.collapse_empty_command, "-i", in.toString(), "-o", out.toString()});

		final String result = read(out);
		Assert.assertTrue(result.contains("3\tPeter\tPeter\tPROPN\t_\t_\t2\tconj\t2:conj>nsubj\t_\n"));
		Assert.assertFalse(result.contains("2.1\t"));
	}

	@Test
	public void testCollapseEmptyKeepingIds() throws Exception
	{
		final Path in = input();
		final Path out = new File(folder.getRoot(), "out.conllu").toPath();
		Driver.main(new String[]{Driver.collapse_empty_command, "-i", in.toString(), "-o", out.toString(), "-k"});
		Assert.assertTrue(read(out).contains("2:conj>2.1>nsubj"));
	}

	@Test
	public void testProperties() throws Exception
	{
		final Path in = input();
		final Path out = new File(folder.getRoot(), "report.txt").toPath();
		Driver.main(new String[]{Driver.properties_command, "-i", in.toString(), "-o", out.toString(), "-rb"});

		final String report = read(out);
		Assert.assertTrue(report.startsWith("1 graphs\n4 nodes\n"));
		Assert.assertTrue(report.contains("* Gapping:                1\n"));
		Assert.assertTrue(report.contains("edge basic only: conj [1 conj   1.1:nsubj]"));
	}

	@Test
	public void testClassifyRelations() throws Exception
	{
		final Path in = input();
		final Path out = new File(folder.getRoot(), "out.conllu").toPath();
		Driver.main(new String[]{Driver.classify_relations_command, "-i", in.toString(), "-o", out.toString()});

		final String result = read(out);
		Assert.assertTrue(result.contains("1\tMary\tMary\tPROPN\t_\t_\t2\tnsubj\t2:nsubj\tEdep=B:2:nsubj\n"));
		Assert.assertTrue(result.contains("2.1\teats\teat\tVERB\t_\t_\t_\t_\t2:conj\tEdep=G:2:conj\n"));
		Assert.assertTrue(result.contains("\t2.1:nsubj\tEdep=G:2.1:nsubj|Edep=O:2:conj\n"));
	}

	@Test
	public void testRemoveEnhancedWithProperties() throws Exception
	{
		final Path in = input();
		final Path props = folder.newFile("tools.properties").toPath();
		Files.write(props, "dg.copy.replace=true\n".getBytes(StandardCharsets.UTF_8));
		final Path out = new File(folder.getRoot(), "out.conllu").toPath();

		Driver.main(new String[]{Driver.remove_enhanced_command, "-i", in.toString(), "-o", out.toString(), "-p", props.toString()});
		final String removed = read(out);
		Assert.assertTrue(removed.contains("1\tMary\tMary\tPROPN\t_\t_\t2\tnsubj\t_\t_\n"));

		final Path copied = new File(folder.getRoot(), "copied.conllu").toPath();
		Driver.main(new String[]{Driver.copy_basic_command, "-i", out.toString(), "-o", copied.toString(), "-p", props.toString()});
		Assert.assertTrue(read(copied).contains("3\tPeter\tPeter\tPROPN\t_\t_\t2\tconj\t2:conj\t_\n"));
	}
}
