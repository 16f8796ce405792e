package org.lokray.godel.ast;

public enum QuantifierKind
{
	FORALL("forall"),
	EXISTS("exists");

	private final String keyword;

	QuantifierKind(String keyword)
	{
		this.keyword = keyword;
	}

	public String getKeyword()
	{
		return keyword;
	}
}
