package org.lokray.godel.util;

import org.lokray.godel.ast.Node;

import java.util.Objects;

/**
 * A single accumulated error. Parse-time diagnostics carry a character offset into the
 * source text; type-checking diagnostics carry the offending node instead.
 */
public final class Diagnostic
{
	public static final int NO_POSITION = -1;

	private final ErrorKind kind;
	private final String message;
	private final int position;
	private final Node node;

	public Diagnostic(ErrorKind kind, String message, int position, Node node)
	{
		this.kind = Objects.requireNonNull(kind, "kind");
		this.message = Objects.requireNonNull(message, "message");
		this.position = position;
		this.node = node;
	}

	public static Diagnostic at(ErrorKind kind, String message, int position)
	{
		return new Diagnostic(kind, message, position, null);
	}

	public static Diagnostic typeError(String message, Node node)
	{
		return new Diagnostic(ErrorKind.TYPE, message, NO_POSITION, node);
	}

	public ErrorKind getKind()
	{
		return kind;
	}

	public String getMessage()
	{
		return message;
	}

	public int getPosition()
	{
		return position;
	}

	public Node getNode()
	{
		return node;
	}

	public boolean hasPosition()
	{
		return position != NO_POSITION;
	}

	@Override
	public boolean equals(Object obj)
	{
		if (this == obj)
		{
			return true;
		}
		if (obj == null || getClass() != obj.getClass())
		{
			return false;
		}
		Diagnostic that = (Diagnostic) obj;
		return kind == that.kind && position == that.position
				&& message.equals(that.message) && Objects.equals(node, that.node);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(kind, message, position, node);
	}

	@Override
	public String toString()
	{
		if (hasPosition())
		{
			return String.format("[%s] position %d - %s", kind.getLabel(), position, message);
		}
		if (node != null)
		{
			return String.format("[%s] at '%s' - %s", kind.getLabel(), node, message);
		}
		return String.format("[%s] %s", kind.getLabel(), message);
	}
}
