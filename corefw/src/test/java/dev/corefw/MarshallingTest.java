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

import static dev.corefw.Marshalling.*;
import static java.nio.charset.StandardCharsets.*;
import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import java.io.*;
import java.nio.file.*;
import java.util.*;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tests of {@link Marshalling}.
 */
public class MarshallingTest {

	@Test
	void testReadJsonTreePreservesKeyOrder() {
		final Object tree = readJsonTree("{\"z\": 1, \"a\": [\"bar\", true], \"m\": null}");
		assertThat(tree, is(instanceOf(LinkedHashMap.class)));
		assertThat(new ArrayList<>(((Map<?, ?>)tree).keySet()), is(List.of("z", "a", "m")));
		assertThat(((Map<?, ?>)tree).get("a"), is(List.of("bar", true)));
	}

	@Test
	void testReadJsonTreeInvalidThrowsMarshalException() {
		assertThrows(MarshalException.class, () -> readJsonTree("{\"unterminated\": "));
	}

	@Test
	void testReadYamlTree() throws IOException {
		final String yaml = """
				MetaSourceBucket:
				  bucket: meta-bucket
				  rootPath: /services
				Modules:
				  - type: PackageFile
				    include: true
				""";
		final Object tree = readYamlTree(new ByteArrayInputStream(yaml.getBytes(UTF_8)));
		assertThat(tree, is(Map.of("MetaSourceBucket", Map.of("bucket", "meta-bucket", "rootPath", "/services"), "Modules",
				List.of(Map.of("type", "PackageFile", "include", true)))));
	}

	@Test
	void testReadTreeChoosesFormatByExtension(@TempDir final Path tempDir) throws IOException {
		final Path yamlFile = Files.writeString(tempDir.resolve("config.yml"), "foo: bar\n", UTF_8);
		final Path jsonFile = Files.writeString(tempDir.resolve("package.json"), "{\"foo\": \"bar\"}", UTF_8);
		assertThat(readTree(yamlFile), is(Map.of("foo", "bar")));
		assertThat(readTree(jsonFile), is(Map.of("foo", "bar")));
		final Path badJsonFile = Files.writeString(tempDir.resolve("bad.json"), "foo: bar", UTF_8);
		assertThrows(MarshalException.class, () -> readTree(badJsonFile));
		assertThrows(NoSuchFileException.class, () -> readTree(tempDir.resolve("missing.json")));
	}

	record Bucket(@JsonProperty("bucket") String bucket, @JsonProperty("awsRegion") String awsRegion) {
	}

	/** @see Marshalling#convertValue(Object, java.lang.reflect.Type) */
	@Test
	void testConvertValueToRecord() {
		final Bucket bucket = convertValue(Map.of("bucket", "meta", "awsRegion", "us-west-2", "ignored", 1), Bucket.class);
		assertThat(bucket, is(new Bucket("meta", "us-west-2")));
	}

	@Test
	void testToJson() {
		final Map<String, Object> tree = new LinkedHashMap<>();
		tree.put("b", 1);
		tree.put("a", List.of("x"));
		assertThat(toJson(tree), is("{\"b\":1,\"a\":[\"x\"]}"));
	}

	@Test
	void testToYamlOmitsDocumentStartMarker() {
		assertThat(toYaml(Map.of("name", "users")), is("name: users\n"));
	}

}
