package org.lokray.godel.ast;

public enum ConnectiveKind
{
	AND("and"),
	OR("or"),
	NOT("not"),
	IMPLIES("implies"),
	EQUIV("equiv");

	private final String keyword;

	ConnectiveKind(String keyword)
	{
		this.keyword = keyword;
	}

	public String getKeyword()
	{
		return keyword;
	}

	public boolean isUnary()
	{
		return this == NOT;
	}
}
