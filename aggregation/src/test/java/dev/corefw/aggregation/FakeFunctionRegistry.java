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

package dev.corefw.aggregation;

import java.util.*;
import java.util.concurrent.CompletableFuture;

import dev.corefw.cloud.*;

/**
 * A function registry serving a fixed list of functions in pages, for testing.
 */
class FakeFunctionRegistry implements FunctionRegistry {

	final List<FunctionRecord> functions;

	int requestCount = 0;

	FakeFunctionRegistry(final List<FunctionRecord> functions) {
		this.functions = List.copyOf(functions);
	}

	@Override
	public CompletableFuture<FunctionPage> listFunctions(final int pageSize, final String marker) {
		requestCount++;
		final int start = marker == null ? 0 : Integer.parseInt(marker);
		final int end = Math.min(start + pageSize, functions.size());
		final Optional<String> nextMarker = end < functions.size() ? Optional.of(Integer.toString(end)) : Optional.empty();
		return CompletableFuture.completedFuture(new FunctionPage(functions.subList(start, end), nextMarker));
	}

	static FunctionRecord function(final String name, final String versionHash, final String branch) {
		return new FunctionRecord("arn:aws:lambda:us-east-1:123456789012:function:" + name, name, Optional.ofNullable(versionHash), Optional.ofNullable(branch));
	}

}
