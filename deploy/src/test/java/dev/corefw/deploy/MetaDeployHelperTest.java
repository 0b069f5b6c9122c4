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

package dev.corefw.deploy;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;

import java.util.*;

import org.junit.jupiter.api.*;

import dev.corefw.Marshalling;

/**
 * Tests of {@link MetaDeployHelper}.
 */
public class MetaDeployHelperTest {

	@Test
	void testWithoutCommentsAtEveryLevel() {
		final Object tree = Marshalling.readJsonTree("""
				{"//": "top", "name": "users", "//note": "x",
				 "functions": [{"//": "inner", "handler": "index.handler"}],
				 "path/with/slash": true}
				""");
		assertThat(MetaDeployHelper.withoutComments(tree),
				is(Map.of("name", "users", "functions", List.of(Map.of("handler", "index.handler")), "path/with/slash", true)));
	}

	@Test
	void testWithoutCommentsPreservesOrder() {
		final Object tree = Marshalling.readJsonTree("{\"c\": 1, \"//\": 0, \"a\": 2, \"b\": 3}");
		@SuppressWarnings("unchecked")
		final Map<String, Object> result = (Map<String, Object>)MetaDeployHelper.withoutComments(tree);
		assertThat(new ArrayList<>(result.keySet()), is(List.of("c", "a", "b")));
	}

	@Test
	void testWithoutCommentsScalars() {
		assertThat(MetaDeployHelper.withoutComments("//text"), is("//text"));
		assertThat(MetaDeployHelper.withoutComments(null), is(nullValue()));
	}

}
