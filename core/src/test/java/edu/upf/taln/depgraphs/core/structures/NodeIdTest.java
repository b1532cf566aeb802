package edu.upf.taln.depgraphs.core.structures;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public class NodeIdTest
{
	@Test
	public void testOrdering()
	{
		final List<String> sorted = Arrays.asList("10", "1.2", "2", "1", "1-2", "0", "1.1").stream()
				.map(NodeId::parse)
				.sorted()
				.map(NodeId::toString)
				.collect(Collectors.toList());

		// Multiword tokens precede their first word, empty nodes follow the word they are attached to
		Assert.assertEquals(Arrays.asList("0", "1-2", "1", "1.1", "1.2", "2", "10"), sorted);
	}

	@Test
	public void testParse()
	{
		Assert.assertTrue(NodeId.parse("0").isRoot());
		Assert.assertEquals(NodeId.ROOT, NodeId.regular(0));
		Assert.assertTrue(NodeId.parse("3").isRegular());

		final NodeId empty = NodeId.parse("8.2");
		Assert.assertTrue(empty.isEmpty());
		Assert.assertEquals(8, empty.getMajor());
		Assert.assertEquals(2, empty.getMinor());
		Assert.assertEquals(NodeId.empty(8, 2), empty);

		final NodeId range = NodeId.parse("4-5");
		Assert.assertTrue(range.isRange());
		Assert.assertEquals(0, range.getMinor());
		Assert.assertEquals(5, range.getRangeEnd());
		Assert.assertEquals("4-5", range.toString());
	}

	@Test
	public void testInvalidIds()
	{
		Assert.assertFalse(NodeId.isValid("1.a"));
		Assert.assertFalse(NodeId.isValid("_"));
		Assert.assertFalse(NodeId.isValid("-1"));
		Assert.assertTrue(NodeId.isValid("12.3"));

		try
		{
			NodeId.parse("abc");
			Assert.fail("Invalid id accepted");
		}
		catch (IllegalArgumentException e)
		{
			Assert.assertTrue(e.getMessage().contains("abc"));
		}
	}
}
