/*
 * Copyright © 2023 GlobalMentor, Inc. <https://www.globalmentor.com/>
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.corefw;

import static java.util.Objects.*;

import java.io.*;
import java.lang.reflect.Type;
import java.nio.file.*;

import javax.annotation.*;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.exc.*;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

/**
 * Shared definitions and common utilities for marshalling JSON and YAML trees.
 * @implNote Trees are read as plain Java structures: {@link java.util.LinkedHashMap} for objects (preserving key order), {@link java.util.ArrayList} for
 *           arrays, and boxed scalars.
 */
public class Marshalling {

	/** Original object mapper for internal conversions. */
	private static final ObjectMapper OBJECT_MAPPER;

	/** Reader for JSON deserialization. */
	public static final ObjectReader JSON_READER;

	/** Writer for JSON serialization. */
	public static final ObjectWriter JSON_WRITER;

	/** Writer for indented JSON serialization, used for files meant to be read by people. */
	public static final ObjectWriter JSON_PRETTY_WRITER;

	/** Reader for YAML deserialization. */
	public static final ObjectReader YAML_READER;

	/** Writer for YAML serialization. */
	public static final ObjectWriter YAML_WRITER;

	/**
	 * Factory for creating an appropriately configured Jackson JSON object mapper.
	 * @return A new instance of an object mapper, correctly configured for marshalling.
	 */
	private static ObjectMapper createJsonObjectMapper() {
		return JsonMapper.builder().addModule(new Jdk8Module()) //
				.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES) //
				.build();
	}

	/**
	 * Factory for creating an appropriately configured Jackson YAML object mapper.
	 * @return A new instance of an object mapper for YAML.
	 */
	private static ObjectMapper createYamlObjectMapper() {
		return YAMLMapper.builder().addModule(new Jdk8Module()) //
				.disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER) //
				.enable(YAMLGenerator.Feature.MINIMIZE_QUOTES) //
				.build();
	}

	static {
		OBJECT_MAPPER = createJsonObjectMapper();
		JSON_READER = OBJECT_MAPPER.reader();
		JSON_WRITER = OBJECT_MAPPER.writer();
		JSON_PRETTY_WRITER = OBJECT_MAPPER.writerWithDefaultPrettyPrinter();
		final ObjectMapper yamlObjectMapper = createYamlObjectMapper();
		YAML_READER = yamlObjectMapper.reader();
		YAML_WRITER = yamlObjectMapper.writer();
	}

	/**
	 * Converts a value (which may be a node in a map of already parsed JSON or YAML) to the indicated type.
	 * @param <T> The expected type.
	 * @param fromValue The existing value.
	 * @param toValueType The destination type, which may be a {@link Class} or some other type that provides further generics information.
	 * @return The converted value.
	 * @throws IllegalArgumentException if the argument cannot be converted.
	 */
	public static <T> T convertValue(final Object fromValue, final Type toValueType) throws IllegalArgumentException {
		return OBJECT_MAPPER.convertValue(fromValue, OBJECT_MAPPER.getTypeFactory().constructType(toValueType));
	}

	/**
	 * Parses a JSON document into a tree of plain Java objects.
	 * @param json The JSON text.
	 * @return The parsed tree, which will be <code>null</code> if the document is JSON <code>null</code>.
	 * @throws MarshalException if the text is not valid JSON.
	 */
	public static Object readJsonTree(@Nonnull final String json) throws MarshalException {
		try {
			return JSON_READER.forType(Object.class).readValue(json);
		} catch(final JsonProcessingException jsonProcessingException) {
			throw new MarshalException("Error parsing JSON: " + jsonProcessingException.getOriginalMessage(), jsonProcessingException);
		}
	}

	/**
	 * Parses a YAML document into a tree of plain Java objects.
	 * @param inputStream The input stream from which to read the YAML.
	 * @return The parsed tree, which will be <code>null</code> for an empty document.
	 * @throws IOException If an I/O error occurs.
	 * @throws MarshalException if the content is not valid YAML.
	 */
	public static Object readYamlTree(@Nonnull final InputStream inputStream) throws IOException, MarshalException {
		try {
			return YAML_READER.forType(Object.class).readValue(inputStream);
		} catch(final StreamReadException | DatabindException jacksonException) {
			throw new MarshalException("Error parsing YAML: " + jacksonException.getOriginalMessage(), jacksonException);
		}
	}

	/**
	 * Reads a file as a tree, choosing the format from the file extension: <code>.yml</code> and <code>.yaml</code> are read as YAML; anything else as
	 * JSON (YAML being a superset of JSON, this distinction only affects error messages).
	 * @param file The file to read.
	 * @return The parsed tree.
	 * @throws IOException If an I/O error occurs, including the file not existing.
	 * @throws MarshalException if the content cannot be parsed.
	 */
	public static Object readTree(@Nonnull final Path file) throws IOException, MarshalException {
		final String filename = requireNonNull(file.getFileName(), "File path has no filename.").toString();
		try (final InputStream inputStream = new BufferedInputStream(Files.newInputStream(file))) {
			if(filename.endsWith(".yml") || filename.endsWith(".yaml")) {
				return readYamlTree(inputStream);
			}
			try {
				return JSON_READER.forType(Object.class).readValue(inputStream);
			} catch(final StreamReadException | DatabindException jacksonException) {
				throw new MarshalException("Error parsing JSON file `%s`: %s".formatted(file, jacksonException.getOriginalMessage()), jacksonException);
			}
		}
	}

	/**
	 * Serializes a tree to compact JSON.
	 * @param value The value to serialize.
	 * @return The JSON text.
	 * @throws MarshalException if the value cannot be serialized.
	 */
	public static String toJson(@Nullable final Object value) throws MarshalException {
		return write(JSON_WRITER, value);
	}

	/**
	 * Serializes a tree to indented JSON.
	 * @param value The value to serialize.
	 * @return The JSON text.
	 * @throws MarshalException if the value cannot be serialized.
	 */
	public static String toPrettyJson(@Nullable final Object value) throws MarshalException {
		return write(JSON_PRETTY_WRITER, value);
	}

	/**
	 * Serializes a tree to YAML.
	 * @param value The value to serialize.
	 * @return The YAML text.
	 * @throws MarshalException if the value cannot be serialized.
	 */
	public static String toYaml(@Nullable final Object value) throws MarshalException {
		return write(YAML_WRITER, value);
	}

	private static String write(@Nonnull final ObjectWriter writer, @Nullable final Object value) throws MarshalException {
		try {
			return writer.writeValueAsString(value);
		} catch(final JsonProcessingException jsonProcessingException) {
			throw new MarshalException("Unexpected error serializing value.", jsonProcessingException);
		}
	}

}
