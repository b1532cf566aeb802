package edu.upf.taln.depgraphs.tools;

import com.beust.jcommander.ParameterException;
import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;

public class CMLCheckersTest
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testPathToExistingFile() throws Exception
	{
		final File file = folder.newFile("in.conllu");
		new CMLCheckers.PathToExistingFile().validate("-i", file.getPath());

		try
		{
			new CMLCheckers.PathToExistingFile().validate("-i", new File(folder.getRoot(), "missing.conllu").getPath());
			Assert.fail("Missing file accepted");
		}
		catch (ParameterException e)
		{
			Assert.assertTrue(e.getMessage().contains("missing.conllu"));
		}
	}

	@Test(expected = ParameterException.class)
	public void testFolderIsNotAFile()
	{
		new CMLCheckers.PathToExistingFile().validate("-i", folder.getRoot().getPath());
	}

	@Test
	public void testValidPathToFile()
	{
		new CMLCheckers.ValidPathToFile().validate("-o", new File(folder.getRoot(), "out.conllu").getPath());

		try
		{
			new CMLCheckers.ValidPathToFile().validate("-o", new File(folder.getRoot(), "no/such/folder/out.conllu").getPath());
			Assert.fail("Output in missing folder accepted");
		}
		catch (ParameterException e)
		{
			Assert.assertTrue(e.getMessage().contains("out.conllu"));
		}
	}

	@Test
	public void testAttributeName()
	{
		new CMLCheckers.AttributeName().validate("-a", "Cycle");
		try
		{
			new CMLCheckers.AttributeName().validate("-a", "Cy=cle");
			Assert.fail("Invalid attribute accepted");
		}
		catch (ParameterException e)
		{
			Assert.assertTrue(e.getMessage().contains("Cy=cle"));
		}
	}
}
