package edu.upf.taln.depgraphs.core.structures;

/**
 * Structural violation of the graph API. Continuing after one would leave the sentence in an inconsistent state,
 * so callers are expected to give up on the current sentence.
 */
public class GraphException extends RuntimeException
{
	public enum Type
	{DuplicateId, MissingId, UnknownNode, RangeNode}

	private final Type type;
	private final static long serialVersionUID = 1L;

	public GraphException(Type type, String message)
	{
		super(message);
		this.type = type;
	}

	public Type getType() { return type; }

	@Override
	public String toString()
	{
		return type + ": " + getMessage();
	}
}
