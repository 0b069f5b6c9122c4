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

import static java.util.Collections.*;

import java.util.*;

import javax.annotation.*;

/**
 * The endpoints of all services, keyed by API path and then by HTTP method.
 * @implNote Paths and methods are iterated in the order in which they were first added. Adding an endpoint for an existing path and method replaces the
 *           previous endpoint in place.
 */
public final class EndpointMap {

	private final Map<String, Map<HttpMethod, EndpointDescriptor>> endpointsByPath = new LinkedHashMap<>();

	private int resolvedCount = 0;

	/**
	 * Adds an endpoint, replacing any existing endpoint with the same path and method.
	 * @param endpoint The endpoint to add.
	 */
	public void add(@Nonnull final EndpointDescriptor endpoint) {
		endpointsByPath.computeIfAbsent(endpoint.path(), __ -> new LinkedHashMap<>()).put(endpoint.method(), endpoint);
		resolvedCount++;
	}

	/** @return The number of endpoints added, including any that were later replaced. */
	public int getResolvedCount() {
		return resolvedCount;
	}

	/** @return An unmodifiable view of the API paths, in order. */
	public Set<String> getPaths() {
		return unmodifiableSet(endpointsByPath.keySet());
	}

	/**
	 * Returns the endpoints of a path.
	 * @param path The API path.
	 * @return An unmodifiable view of the endpoints of the path keyed by method, in order; empty if the path has no endpoints.
	 */
	public Map<HttpMethod, EndpointDescriptor> getEndpoints(@Nonnull final String path) {
		return unmodifiableMap(endpointsByPath.getOrDefault(path, emptyMap()));
	}

	/**
	 * Finds the endpoint for a path and method.
	 * @param path The API path.
	 * @param method The HTTP method.
	 * @return The endpoint, if any.
	 */
	public Optional<EndpointDescriptor> findEndpoint(@Nonnull final String path, @Nonnull final HttpMethod method) {
		return Optional.ofNullable(getEndpoints(path).get(method));
	}

	/** @return <code>true</code> if no endpoints have been added. */
	public boolean isEmpty() {
		return endpointsByPath.isEmpty();
	}

	@Override
	public String toString() {
		return endpointsByPath.toString();
	}

}
