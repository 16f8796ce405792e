package org.lokray.godel.util;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.lokray.godel.dto.AtomicTypeDTO;
import org.lokray.godel.dto.ConstantDTO;
import org.lokray.godel.dto.ParametricTypeDTO;
import org.lokray.godel.dto.SignatureDTO;
import org.lokray.godel.dto.SubtypeRelationDTO;
import org.lokray.godel.dto.TypeLibraryDTO;
import org.lokray.godel.frontend.FormalLogicParser;
import org.lokray.godel.frontend.ParseResult;
import org.lokray.godel.semantic.TypeSystemManager;
import org.lokray.godel.semantic.type.FunctionType;
import org.lokray.godel.semantic.type.Type;
import org.lokray.godel.util.TypeDefinitionException.Reason;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a JSON type library and registers its contents with a {@link TypeSystemManager}.
 * <p>
 * Sections are applied in the order atomic types, parametric types, function signatures,
 * constants, subtype relations, so later sections may refer to names declared by earlier
 * ones. Registration stops at the first invalid entry.
 */
public class TypeLibraryLoader
{
	private static final Gson GSON = new Gson();

	private final TypeSystemManager typeSystem;
	private final FormalLogicParser typeParser;

	public TypeLibraryLoader(TypeSystemManager typeSystem)
	{
		this.typeSystem = typeSystem;
		this.typeParser = new FormalLogicParser(typeSystem);
	}

	public TypeLibraryDTO load(Path path) throws IOException
	{
		Debug.logDebug("Loading type library from: " + path);
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8))
		{
			return load(reader);
		}
	}

	public TypeLibraryDTO loadResource(String resourceName) throws IOException
	{
		InputStream in = TypeLibraryLoader.class.getClassLoader().getResourceAsStream(resourceName);
		if (in == null)
		{
			throw new FileNotFoundException("Type library resource not found: " + resourceName);
		}
		Debug.logDebug("Loading type library from classpath: " + resourceName);
		try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8))
		{
			return load(reader);
		}
	}

	/**
	 * @return the library as read, after it has been registered.
	 * @throws TypeDefinitionException if the document is malformed or an entry is rejected.
	 */
	public TypeLibraryDTO load(Reader reader)
	{
		TypeLibraryDTO library;
		try
		{
			library = GSON.fromJson(reader, TypeLibraryDTO.class);
		}
		catch (JsonParseException e)
		{
			throw new TypeDefinitionException(Reason.MALFORMED_LIBRARY, "Malformed type library: " + e.getMessage(), e);
		}
		if (library == null)
		{
			throw new TypeDefinitionException(Reason.MALFORMED_LIBRARY, "Type library is empty");
		}
		apply(library);
		return library;
	}

	public void apply(TypeLibraryDTO library)
	{
		for (AtomicTypeDTO dto : orEmpty(library.types))
		{
			typeSystem.defineAtomicType(requireName(dto.name, "atomic type"), orEmpty(dto.supertypes));
		}
		for (ParametricTypeDTO dto : orEmpty(library.parametricTypes))
		{
			typeSystem.defineParametricTypeConstructor(requireName(dto.name, "parametric type"), orEmpty(dto.typeParameters));
		}
		for (SignatureDTO dto : orEmpty(library.signatures))
		{
			String symbol = requireName(dto.symbol, "signature");
			List<Type> argumentTypes = new ArrayList<>();
			for (String argType : orEmpty(dto.argumentTypes))
			{
				argumentTypes.add(parseType(argType, symbol));
			}
			typeSystem.defineSignature(symbol, new FunctionType(argumentTypes, parseType(dto.returnType, symbol)));
		}
		for (ConstantDTO dto : orEmpty(library.constants))
		{
			String symbol = requireName(dto.symbol, "constant");
			typeSystem.defineSignature(symbol, parseType(dto.type, symbol));
		}
		for (SubtypeRelationDTO dto : orEmpty(library.subtypeRelations))
		{
			String context = dto.subtype + " <: " + dto.supertype;
			typeSystem.defineSubtypeRelation(parseType(dto.subtype, context), parseType(dto.supertype, context));
		}

		Debug.logInfo(String.format("Loaded type library%s: %d types, %d parametric types, %d signatures, %d constants",
				library.name == null ? "" : " '" + library.name + "'",
				orEmpty(library.types).size(), orEmpty(library.parametricTypes).size(),
				orEmpty(library.signatures).size(), orEmpty(library.constants).size()));
	}

	private Type parseType(String text, String context)
	{
		if (text == null)
		{
			throw new TypeDefinitionException(Reason.MALFORMED_LIBRARY, "Missing type in entry for " + context);
		}

		ParseResult<Type> result;
		try
		{
			result = typeParser.parseType(text);
		}
		catch (LexicalException e)
		{
			throw new TypeDefinitionException(Reason.MALFORMED_LIBRARY,
					"Malformed type '" + text + "' in entry for " + context + ": " + e.getMessage(), e);
		}

		if (result.hasErrors(ErrorKind.PARSE))
		{
			throw new TypeDefinitionException(Reason.MALFORMED_LIBRARY,
					"Malformed type '" + text + "' in entry for " + context + ": " + result.getErrors().get(0).getMessage());
		}
		if (result.hasErrors())
		{
			throw new TypeDefinitionException(Reason.UNKNOWN_TYPE,
					result.getErrors().get(0).getMessage() + " in entry for " + context);
		}
		return result.getValue();
	}

	private static String requireName(String name, String what)
	{
		if (name == null || name.isBlank())
		{
			throw new TypeDefinitionException(Reason.MALFORMED_LIBRARY, "Unnamed " + what + " in type library");
		}
		return name;
	}

	private static <T> List<T> orEmpty(List<T> list)
	{
		return list == null ? List.of() : list;
	}
}
