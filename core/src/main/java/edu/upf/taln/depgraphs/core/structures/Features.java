package edu.upf.taln.depgraphs.core.structures;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Serializable;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Morphological features of a node (FEATS column). Keys are unique, serialization sorts them alphabetically
 * ignoring case.
 */
public final class Features implements Serializable
{
	private static final Pattern feature_pattern = Pattern.compile("^([A-Za-z\\[\\]]+)=([A-Za-z0-9,]+)$");
	private static final Comparator<String> key_order = String.CASE_INSENSITIVE_ORDER.thenComparing(Comparator.naturalOrder());
	private final static Logger log = LogManager.getLogger();
	private final static long serialVersionUID = 1L;

	private final Map<String, String> features = new LinkedHashMap<>();

	public Features() {}

	public Features(Features other)
	{
		features.putAll(other.features);
	}

	public static Features parse(String feats)
	{
		final Features f = new Features();
		if (feats == null || feats.isEmpty() || feats.equals("_"))
			return f;

		for (String pair : Splitter.on('|').split(feats))
		{
			final Matcher m = feature_pattern.matcher(pair);
			if (!m.matches())
			{
				log.warn("Unrecognized feature-value pair '" + pair + "'");
				continue;
			}

			final String key = m.group(1);
			final String value = m.group(2);
			if (f.features.containsKey(key))
				log.warn("Duplicate feature definition: '" + key + "=" + f.features.get(key) + "' will be overwritten with '" + key + "=" + value + "'");
			f.features.put(key, value);
		}

		return f;
	}

	public Optional<String> get(String key) { return Optional.ofNullable(features.get(key)); }
	public boolean contains(String key) { return features.containsKey(key); }
	public void set(String key, String value) { features.put(Objects.requireNonNull(key), Objects.requireNonNull(value)); }
	public Optional<String> remove(String key) { return Optional.ofNullable(features.remove(key)); }
	public boolean isEmpty() { return features.isEmpty(); }
	public int size() { return features.size(); }

	public SortedMap<String, String> asSortedMap()
	{
		final SortedMap<String, String> sorted = new TreeMap<>(key_order);
		sorted.putAll(features);
		return sorted;
	}

	public String toConllu()
	{
		if (features.isEmpty())
			return "_";
		return Joiner.on('|').withKeyValueSeparator('=').join(asSortedMap());
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return features.equals(((Features) o).features);
	}

	@Override
	public int hashCode() { return features.hashCode(); }

	@Override
	public String toString() { return toConllu(); }
}
