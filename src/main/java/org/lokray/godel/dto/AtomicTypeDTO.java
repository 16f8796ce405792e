package org.lokray.godel.dto;

import java.util.ArrayList;
import java.util.List;

public class AtomicTypeDTO
{
	public String name;
	public List<String> supertypes = new ArrayList<>();
}
