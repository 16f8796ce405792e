package org.lokray.godel.semantic;

import org.lokray.godel.semantic.type.Type;
import org.lokray.godel.util.Diagnostic;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of inferring a node's type: the type when inference succeeded, and the errors
 * otherwise.
 */
public final class InferenceResult
{
	private final Type type;
	private final List<Diagnostic> errors;

	private InferenceResult(Type type, List<Diagnostic> errors)
	{
		this.type = type;
		this.errors = List.copyOf(errors);
	}

	public static InferenceResult of(Type type)
	{
		return new InferenceResult(type, List.of());
	}

	public static InferenceResult failure(Diagnostic error)
	{
		return new InferenceResult(null, List.of(error));
	}

	public static InferenceResult failure(List<Diagnostic> errors)
	{
		return new InferenceResult(null, errors);
	}

	public Type getType()
	{
		return type;
	}

	public Optional<Type> type()
	{
		return Optional.ofNullable(type);
	}

	public List<Diagnostic> getErrors()
	{
		return errors;
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}

	@Override
	public String toString()
	{
		return hasErrors() ? "InferenceResult" + errors : "InferenceResult[" + type + "]";
	}
}
