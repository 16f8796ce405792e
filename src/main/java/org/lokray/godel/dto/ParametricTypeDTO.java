package org.lokray.godel.dto;

import java.util.ArrayList;
import java.util.List;

public class ParametricTypeDTO
{
	public String name;
	public List<String> typeParameters = new ArrayList<>();
}
