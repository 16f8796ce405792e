package org.lokray.godel.frontend;

import org.lokray.godel.util.Diagnostic;
import org.lokray.godel.util.ErrorKind;

import java.util.List;
import java.util.Optional;

/**
 * The product of one parse call: the value, absent when parsing failed, and every
 * diagnostic recorded along the way. A present value may still come with TYPE diagnostics
 * for annotations that fell back to a default type.
 */
public final class ParseResult<T>
{
	private final T value;
	private final List<Diagnostic> errors;

	private ParseResult(T value, List<Diagnostic> errors)
	{
		this.value = value;
		this.errors = List.copyOf(errors);
	}

	public static <T> ParseResult<T> of(T value, List<Diagnostic> errors)
	{
		return new ParseResult<>(value, errors);
	}

	public static <T> ParseResult<T> failure(List<Diagnostic> errors)
	{
		return new ParseResult<>(null, errors);
	}

	public T getValue()
	{
		return value;
	}

	public Optional<T> value()
	{
		return Optional.ofNullable(value);
	}

	public boolean isPresent()
	{
		return value != null;
	}

	public List<Diagnostic> getErrors()
	{
		return errors;
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}

	public boolean hasErrors(ErrorKind kind)
	{
		return errors.stream().anyMatch(e -> e.getKind() == kind);
	}

	@Override
	public String toString()
	{
		return "ParseResult[" + value + ", errors=" + errors + "]";
	}
}
