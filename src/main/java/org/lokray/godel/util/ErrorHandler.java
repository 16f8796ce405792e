package org.lokray.godel.util;

import org.lokray.godel.ast.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the diagnostics of one parse or type-checking call and echoes each to the
 * error log as it arrives.
 */
public class ErrorHandler
{
	private final List<Diagnostic> diagnostics = new ArrayList<>();

	public void report(Diagnostic diagnostic)
	{
		Debug.logError(diagnostic.toString());
		diagnostics.add(diagnostic);
	}

	public void logError(ErrorKind kind, int position, String msg)
	{
		report(Diagnostic.at(kind, msg, position));
	}

	public void logTypeError(Node node, String msg)
	{
		report(Diagnostic.typeError(msg, node));
	}

	public boolean hasErrors()
	{
		return !diagnostics.isEmpty();
	}

	public boolean hasErrors(ErrorKind kind)
	{
		return diagnostics.stream().anyMatch(d -> d.getKind() == kind);
	}

	public List<Diagnostic> getDiagnostics()
	{
		return Collections.unmodifiableList(diagnostics);
	}

	public void reset()
	{
		diagnostics.clear();
	}
}
