package org.lokray.godel.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.lokray.godel.dto.AtomicTypeDTO;
import org.lokray.godel.dto.ConstantDTO;
import org.lokray.godel.dto.ParametricTypeDTO;
import org.lokray.godel.dto.SignatureDTO;
import org.lokray.godel.dto.SubtypeRelationDTO;
import org.lokray.godel.dto.TypeLibraryDTO;
import org.lokray.godel.semantic.TypeSystemManager;
import org.lokray.godel.semantic.type.AtomicType;
import org.lokray.godel.semantic.type.FunctionType;
import org.lokray.godel.semantic.type.ParametricTypeConstructor;
import org.lokray.godel.semantic.type.Type;
import org.lokray.godel.semantic.type.TypeVariable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;

/**
 * Writes everything registered on top of the built-in types back out as a type library
 * that {@link TypeLibraryLoader} can read into a fresh manager.
 */
public class TypeLibraryExporter
{
	public static TypeLibraryDTO toDTO(TypeSystemManager typeSystem, String libraryName)
	{
		TypeLibraryDTO lib = new TypeLibraryDTO();
		lib.name = libraryName;

		for (String name : typeSystem.getTypeNames())
		{
			if (typeSystem.isBuiltIn(name))
			{
				continue;
			}
			Type type = typeSystem.requireType(name);
			if (type instanceof AtomicType atomic)
			{
				lib.types.add(atomicToDTO(typeSystem, atomic));
			}
			else if (type instanceof ParametricTypeConstructor constructor)
			{
				ParametricTypeDTO dto = new ParametricTypeDTO();
				dto.name = constructor.getName();
				for (TypeVariable param : constructor.getTypeParameters())
				{
					dto.typeParameters.add(param.toString());
				}
				lib.parametricTypes.add(dto);
			}
		}

		for (String symbol : typeSystem.getSignatureSymbols())
		{
			Type type = typeSystem.getSignature(symbol).orElseThrow();
			if (type instanceof FunctionType functionType)
			{
				SignatureDTO dto = new SignatureDTO();
				dto.symbol = symbol;
				for (Type arg : functionType.getArgumentTypes())
				{
					dto.argumentTypes.add(arg.toString());
				}
				dto.returnType = functionType.getReturnType().toString();
				lib.signatures.add(dto);
			}
			else
			{
				ConstantDTO dto = new ConstantDTO();
				dto.symbol = symbol;
				dto.type = type.toString();
				lib.constants.add(dto);
			}
		}

		for (Map.Entry<Type, Type> fact : typeSystem.getExplicitSubtypeFacts())
		{
			SubtypeRelationDTO dto = new SubtypeRelationDTO();
			dto.subtype = fact.getKey().toString();
			dto.supertype = fact.getValue().toString();
			lib.subtypeRelations.add(dto);
		}
		return lib;
	}

	// Supertypes added through explicit subtype relations are exported with those relations instead.
	private static AtomicTypeDTO atomicToDTO(TypeSystemManager typeSystem, AtomicType atomic)
	{
		AtomicTypeDTO dto = new AtomicTypeDTO();
		dto.name = atomic.getName();
		for (Type supertype : typeSystem.getDirectSupertypes(atomic))
		{
			boolean explicit = typeSystem.getExplicitSubtypeFacts().stream()
					.anyMatch(f -> f.getKey().equals(atomic) && f.getValue().equals(supertype));
			if (!explicit && supertype instanceof AtomicType)
			{
				dto.supertypes.add(supertype.getName());
			}
		}
		return dto;
	}

	public static String toJson(TypeSystemManager typeSystem, String libraryName)
	{
		Gson gson = new GsonBuilder().setPrettyPrinting().create();
		return gson.toJson(toDTO(typeSystem, libraryName));
	}

	/**
	 * Writes the library to a JSON file, creating parent directories as needed.
	 */
	public static void write(TypeSystemManager typeSystem, String libraryName, Path outPath) throws IOException
	{
		Path parent = outPath.toAbsolutePath().getParent();
		if (parent != null)
		{
			Files.createDirectories(parent);
		}
		Files.writeString(outPath, toJson(typeSystem, libraryName), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logInfo("Wrote type library to: " + outPath);
	}
}
