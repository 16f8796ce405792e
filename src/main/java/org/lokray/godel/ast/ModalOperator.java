package org.lokray.godel.ast;

/**
 * Epistemic, alethic, probabilistic and defeasible qualifiers on a proposition.
 */
public enum ModalOperator
{
	KNOWS("knows"),
	BELIEVES("believes"),
	POSSIBLE("possible"),
	NECESSARY("necessary"),
	PROBABILITY("prob"),
	DEFEASIBLE("defeasibly");

	private final String keyword;

	ModalOperator(String keyword)
	{
		this.keyword = keyword;
	}

	public String getKeyword()
	{
		return keyword;
	}

	/**
	 * Epistemic operators take an agent, whose type must be a subtype of {@code Agent}.
	 */
	public boolean isEpistemic()
	{
		return this == KNOWS || this == BELIEVES;
	}
}
