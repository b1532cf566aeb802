package edu.upf.taln.depgraphs.tools;

import edu.upf.taln.depgraphs.core.Options;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Default values of the command-line options read from a properties file. Keys missing from the file keep the
 * defaults in {@link Options}.
 */
public class ToolProperties
{
	public static final String keep_ids_key = "dg.collapse.keep_ids";
	public static final String report_cycles_key = "dg.report.cycles";
	public static final String report_basenh_key = "dg.report.basenh";
	public static final String replace_key = "dg.copy.replace";
	public static final String cycle_attribute_key = "dg.cycles.attribute";
	private final Properties prop = new Properties();
	private final static Logger log = LogManager.getLogger();

	public ToolProperties(Path file)
	{
		try (InputStream input = Files.newInputStream(file))
		{
			prop.load(input);
		}
		catch (IOException e)
		{
			log.error("Failed to load properties from " + file + ": " + e);
			throw new RuntimeException("Failed to load properties from " + file, e);
		}
	}

	public Options getOptions()
	{
		final Options options = new Options();
		options.keep_empty_node_ids = getBoolean(keep_ids_key, options.keep_empty_node_ids);
		options.report_cycles = getBoolean(report_cycles_key, options.report_cycles);
		options.report_basenh = getBoolean(report_basenh_key, options.report_basenh);
		options.replace_enhanced = getBoolean(replace_key, options.replace_enhanced);
		final String attribute = prop.getProperty(cycle_attribute_key);
		if (attribute != null && !attribute.trim().isEmpty())
			options.cycle_attribute = attribute.trim();
		return options;
	}

	private boolean getBoolean(String key, boolean default_value)
	{
		final String value = prop.getProperty(key);
		if (value == null || value.trim().isEmpty())
			return default_value;
		if (!value.trim().equalsIgnoreCase("true") && !value.trim().equalsIgnoreCase("false"))
			throw new RuntimeException(value + " is not a valid value for " + key);
		return Boolean.parseBoolean(value.trim());
	}
}
