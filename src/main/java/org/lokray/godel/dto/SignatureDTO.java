package org.lokray.godel.dto;

import java.util.ArrayList;
import java.util.List;

public class SignatureDTO
{
	public String symbol;
	public List<String> argumentTypes = new ArrayList<>();
	public String returnType;
}
