package org.lokray.godel.dto;

import java.util.ArrayList;
import java.util.List;

public class TypeLibraryDTO
{
	public String name;
	public List<AtomicTypeDTO> types = new ArrayList<>();
	public List<ParametricTypeDTO> parametricTypes = new ArrayList<>();
	public List<SignatureDTO> signatures = new ArrayList<>();
	public List<ConstantDTO> constants = new ArrayList<>();
	public List<SubtypeRelationDTO> subtypeRelations = new ArrayList<>();
}
