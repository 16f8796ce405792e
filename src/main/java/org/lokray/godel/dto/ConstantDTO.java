package org.lokray.godel.dto;

public class ConstantDTO
{
	public String symbol;
	public String type;
}
