package org.lokray.godel.dto;

public class SubtypeRelationDTO
{
	public String subtype;
	public String supertype;
}
