package edu.upf.taln.depgraphs.core.structures;

import com.google.common.collect.ComparisonChain;

import javax.annotation.Nonnull;
import java.io.Serializable;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifier of a line in a CoNLL-U sentence: a regular token (or the artificial root 0), an empty node N.M
 * introduced for elided material, or a multiword token range N-M.
 */
public final class NodeId implements Comparable<NodeId>, Serializable
{
	public enum Type
	{Regular, Empty, Range}

	public static final NodeId ROOT = new NodeId(Type.Regular, 0, 0);
	private static final Pattern id_pattern = Pattern.compile("^(\\d+)(?:\\.(\\d+)|-(\\d+))?$");
	private final static long serialVersionUID = 1L;

	private final Type type;
	private final int major;
	private final int minor; // decimal part of empty nodes, end of ranges, 0 otherwise

	private NodeId(Type type, int major, int minor)
	{
		this.type = type;
		this.major = major;
		this.minor = minor;
	}

	public static NodeId regular(int id)
	{
		if (id < 0)
			throw new IllegalArgumentException("Negative node id " + id);
		return id == 0 ? ROOT : new NodeId(Type.Regular, id, 0);
	}

	public static NodeId empty(int major, int minor)
	{
		if (major < 0 || minor < 1)
			throw new IllegalArgumentException("Invalid empty node id " + major + "." + minor);
		return new NodeId(Type.Empty, major, minor);
	}

	public static NodeId range(int start, int end)
	{
		if (start < 1 || end < start)
			throw new IllegalArgumentException("Invalid multiword token range " + start + "-" + end);
		return new NodeId(Type.Range, start, end);
	}

	public static NodeId parse(String id)
	{
		if (id == null)
			throw new IllegalArgumentException("Undefined node id");
		final Matcher m = id_pattern.matcher(id);
		if (!m.matches())
			throw new IllegalArgumentException("Unexpected node id '" + id + "'");

		try
		{
			final int major = Integer.parseInt(m.group(1));
			if (m.group(2) != null)
				return empty(major, Integer.parseInt(m.group(2)));
			if (m.group(3) != null)
				return range(major, Integer.parseInt(m.group(3)));
			return regular(major);
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("Unexpected node id '" + id + "'", e);
		}
	}

	public static boolean isValid(String id)
	{
		return id != null && id_pattern.matcher(id).matches();
	}

	public Type getType() { return type; }
	public int getMajor() { return major; }
	public int getMinor() { return type == Type.Empty ? minor : 0; }
	public int getRangeEnd() { return type == Type.Range ? minor : major; }
	public boolean isRoot() { return type == Type.Regular && major == 0; }
	public boolean isRegular() { return type == Type.Regular; }
	public boolean isEmpty() { return type == Type.Empty; }
	public boolean isRange() { return type == Type.Range; }

	/**
	 * Order in which lines appear in a CoNLL-U sentence. Empty node decimals are compared as integers, so that
	 * 3.14 comes after 3.2, and a multiword token line comes before the first word it spans.
	 */
	@Override
	public int compareTo(@Nonnull NodeId o)
	{
		return ComparisonChain.start()
				.compare(major, o.major)
				.compare(getMinor(), o.getMinor())
				.compare(o.type == Type.Range ? o.minor : 0, type == Type.Range ? minor : 0)
				.result();
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		NodeId other = (NodeId) o;
		return type == other.type && major == other.major && minor == other.minor;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(type, major, minor);
	}

	@Override
	public String toString()
	{
		switch (type)
		{
			case Empty:
				return major + "." + minor;
			case Range:
				return major + "-" + minor;
			case Regular:
			default:
				return Integer.toString(major);
		}
	}
}
