package edu.upf.taln.depgraphs.core.structures;

import com.google.common.base.Splitter;
import org.apache.commons.lang3.tuple.Pair;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Attributes in the MISC column. Unlike features, their order is preserved and an attribute may be a bare flag
 * without a value.
 */
public final class Misc implements Serializable
{
	private final List<Pair<String, String>> attributes = new ArrayList<>(); // value is null for bare flags
	private final static long serialVersionUID = 1L;

	public Misc() {}

	public Misc(Misc other)
	{
		attributes.addAll(other.attributes);
	}

	public static Misc parse(String misc)
	{
		final Misc m = new Misc();
		if (misc == null)
			return m;
		final String trimmed = misc.trim();
		if (trimmed.isEmpty() || trimmed.equals("_"))
			return m;

		for (String item : Splitter.on('|').split(trimmed))
		{
			final int eq = item.indexOf('=');
			if (eq < 0)
				m.attributes.add(Pair.of(item, null));
			else
				m.attributes.add(Pair.of(item.substring(0, eq), item.substring(eq + 1)));
		}
		return m;
	}

	/**
	 * @return value of the last attribute with this key; an empty string for bare flags
	 */
	public Optional<String> get(String key)
	{
		for (int i = attributes.size() - 1; i >= 0; --i)
		{
			final Pair<String, String> a = attributes.get(i);
			if (a.getLeft().equals(key))
				return Optional.of(a.getRight() == null ? "" : a.getRight());
		}
		return Optional.empty();
	}

	public List<String> getAll(String key)
	{
		return attributes.stream()
				.filter(a -> a.getLeft().equals(key))
				.map(a -> a.getRight() == null ? "" : a.getRight())
				.collect(Collectors.toList());
	}

	public boolean contains(String key)
	{
		return attributes.stream().anyMatch(a -> a.getLeft().equals(key));
	}

	// Replaces the value of the last attribute with this key, or appends a new attribute
	public void set(String key, String value)
	{
		Objects.requireNonNull(key);
		for (int i = attributes.size() - 1; i >= 0; --i)
		{
			if (attributes.get(i).getLeft().equals(key))
			{
				attributes.set(i, Pair.of(key, value));
				return;
			}
		}
		attributes.add(Pair.of(key, value));
	}

	public void add(String key, String value)
	{
		attributes.add(Pair.of(Objects.requireNonNull(key), value));
	}

	public int remove(String key)
	{
		final int before = attributes.size();
		attributes.removeIf(a -> a.getLeft().equals(key));
		return before - attributes.size();
	}

	public boolean isEmpty() { return attributes.isEmpty(); }
	public int size() { return attributes.size(); }

	public String toConllu()
	{
		if (attributes.isEmpty())
			return "_";
		return attributes.stream()
				.map(a -> a.getRight() == null ? a.getLeft() : a.getLeft() + "=" + a.getRight())
				.collect(Collectors.joining("|"));
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return attributes.equals(((Misc) o).attributes);
	}

	@Override
	public int hashCode() { return attributes.hashCode(); }

	@Override
	public String toString() { return toConllu(); }
}
