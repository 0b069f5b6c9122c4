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

import static dev.corefw.Variables.*;
import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;

import java.util.*;

import org.junit.jupiter.api.*;

/**
 * Tests of {@link Variables}.
 */
public class VariablesTest {

	@Test
	void testIdentifier() {
		assertThat(identifier("gitBranch"), is("${gitBranch}"));
	}

	@Test
	void testSubstituteStringValue() {
		assertThat(substitute("Deploy ${serviceName} on ${gitBranch}.", Map.of("serviceName", "users", "gitBranch", "develop")),
				is("Deploy users on develop."));
	}

	@Test
	void testSubstituteReplacesEveryOccurrence() {
		assertThat(substitute("${x}-${x}-${x}", Map.of("x", "a")), is("a-a-a"));
	}

	/** An unknown identifier is left verbatim. */
	@Test
	void testSubstituteUnknownIdentifierPassesThrough() {
		assertThat(substitute("prefix-${unknown}-${known}", Map.of("known", "k")), is("prefix-${unknown}-k"));
	}

	@Test
	void testSubstituteNoVariablesReturnsEqualTree() {
		final Map<String, Object> tree = new LinkedHashMap<>();
		tree.put("a", "${a}");
		tree.put("b", List.of(1, true, "x"));
		assertThat(substitute(tree, Map.of()), is(tree));
	}

	/** A non-string value replaces the entire string node, changing its type. */
	@Test
	void testSubstituteNonStringValueReplacesWholeNode() {
		final Map<String, Object> variableMap = new LinkedHashMap<>();
		variableMap.put("methodRefNames", List.of("AagMethodUsersGet", "AagMethodUsersPost"));
		assertThat(substitute(Map.of("DependsOn", "${methodRefNames}"), variableMap), is(Map.of("DependsOn", List.of("AagMethodUsersGet", "AagMethodUsersPost"))));
		assertThat(substitute("text around ${count}", Map.of("count", 5)), is(5));
	}

	/** Once a node is replaced by a non-string value, no further variables are applied to it. */
	@Test
	void testSubstituteNonStringValueStopsFurtherSubstitution() {
		final Map<String, Object> variableMap = new LinkedHashMap<>();
		variableMap.put("first", Map.of("ref", "${second}"));
		variableMap.put("second", "replaced");
		assertThat(substitute("${first}", variableMap), is(Map.of("ref", "${second}")));
	}

	@Test
	void testSubstituteNullValueReplacesWholeNode() {
		final Map<String, Object> variableMap = new HashMap<>();
		variableMap.put("nothing", null);
		final List<Object> expected = new ArrayList<>();
		expected.add(null);
		expected.add("keep");
		assertThat(substitute(List.of("a ${nothing}", "keep"), variableMap), is(expected));
	}

	/** Variables are applied in map order; a value introducing a later identifier is expanded by that later variable. */
	@Test
	void testSubstituteAppliesVariablesInOrder() {
		final Map<String, Object> variableMap = new LinkedHashMap<>();
		variableMap.put("a", "${b}!");
		variableMap.put("b", "B");
		assertThat(substitute("${a}", variableMap), is("B!"));
		final Map<String, Object> reversed = new LinkedHashMap<>();
		reversed.put("b", "B");
		reversed.put("a", "${b}!");
		assertThat(substitute("${a}", reversed), is("${b}!"));
	}

	/** A value containing its own identifier is not expanded again, so substitution terminates. */
	@Test
	void testSubstituteSelfReferenceTerminates() {
		assertThat(substitute("${loop}", Map.of("loop", "x${loop}")), is("x${loop}"));
	}

	/** Only the identifiers in the original string are replaced; an identifier formed by a replacement and its surrounding text is left as is. */
	@Test
	void testSubstituteDoesNotRescanReplacedText() {
		assertThat(substitute("${${x}}", Map.of("x", "x")), is("${x}"));
	}

	/** Substituting again changes nothing when no variable value contains an identifier. */
	@Test
	void testSubstituteIsIdempotent() {
		final Map<String, Object> variables = new LinkedHashMap<>();
		variables.put("stage", "develop");
		variables.put("region", "us-east-1");
		variables.put("timeout", 30);
		variables.put("tags", List.of("facade", "api"));
		final Map<String, Object> tree = new LinkedHashMap<>();
		tree.put("Name", "api-${stage}-${region}");
		tree.put("Timeout", "${timeout}");
		tree.put("Tags", "${tags}");
		tree.put("Unknown", "${missing}");
		tree.put("Stages", List.of(Map.of("StageName", "${stage}", "Variables", List.of("${region}", 7, true)), "literal"));
		final Object substituted = substitute(tree, variables);
		assertThat(substitute(substituted, variables), is(substituted));
		assertThat(substituted, is(Map.of("Name", "api-develop-us-east-1", "Timeout", 30, "Tags", List.of("facade", "api"), "Unknown", "${missing}", "Stages",
				List.of(Map.of("StageName", "develop", "Variables", List.of("us-east-1", 7, true)), "literal"))));
	}

	@Test
	void testSubstituteRecursesIntoContainers() {
		final Map<String, Object> tree = new LinkedHashMap<>();
		tree.put("Type", "AWS::ApiGateway::RestApi");
		tree.put("Properties", Map.of("Name", "${apiName}", "Tags", List.of(Map.of("Value", "${gitBranch}"))));
		tree.put("Count", 3);
		final Map<String, Object> result = substituteObject(tree, Map.of("apiName", "facade", "gitBranch", "master"));
		assertThat(result.get("Type"), is("AWS::ApiGateway::RestApi"));
		assertThat(result.get("Properties"), is(Map.of("Name", "facade", "Tags", List.of(Map.of("Value", "master")))));
		assertThat(result.get("Count"), is(3));
		assertThat(tree.get("Properties"), is(Map.of("Name", "${apiName}", "Tags", List.of(Map.of("Value", "${gitBranch}"))))); //input untouched
	}

	@Test
	void testSubstituteObjectPreservesKeyOrder() {
		final Map<String, Object> tree = new LinkedHashMap<>();
		tree.put("z", "1");
		tree.put("a", "2");
		tree.put("m", "3");
		assertThat(new ArrayList<>(substituteObject(tree, Map.of()).keySet()), is(List.of("z", "a", "m")));
	}

	@Test
	void testSubstituteOtherScalarsUnchanged() {
		assertThat(substitute(42, Map.of("x", "y")), is(42));
		assertThat(substitute(true, Map.of("x", "y")), is(true));
		assertThat(substitute(null, Map.of("x", "y")), is(nullValue()));
	}

	/** Specific variables override global variables with the same name. */
	@Test
	void testSubstituteWithGlobalVariables() {
		final Map<String, Object> globals = new LinkedHashMap<>();
		globals.put("gitBranch", "master");
		globals.put("serviceName", "aggregator");
		assertThat(substitute("${serviceName}/${gitBranch}/${apiName}", globals, Map.of("apiName", "api", "gitBranch", "develop")),
				is("aggregator/develop/api"));
	}

	@Test
	void testOverlayOrder() {
		final Map<String, Object> base = new LinkedHashMap<>();
		base.put("a", "1");
		base.put("b", "2");
		final Map<String, Object> overrides = new LinkedHashMap<>();
		overrides.put("c", "3");
		overrides.put("a", "override");
		final Map<String, Object> result = overlay(base, overrides);
		assertThat(new ArrayList<>(result.keySet()), is(List.of("a", "b", "c")));
		assertThat(result.get("a"), is("override"));
	}

}
