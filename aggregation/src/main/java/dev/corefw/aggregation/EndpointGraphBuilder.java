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

import javax.annotation.*;

import dev.corefw.Corefw;
import io.clogr.Clogged;

/**
 * Builds the map of API endpoints from the HTTP events declared in the Serverless specifications of services.
 * <p>
 * A function is considered only if it has an <code>environment</code> with a valid {@value Corefw#ENV_VERSION_HASH}, and an <code>events</code> array.
 * Events without an <code>http</code> object are ignored; HTTP events are accepted only if they have a <code>path</code>, a supported <code>method</code>,
 * and the {@value #INTEGRATION_LAMBDA_PROXY} <code>integration</code>. Every other problem is logged as a warning and the function or event is skipped.
 * </p>
 */
public class EndpointGraphBuilder implements Clogged {

	/** The only supported HTTP event integration. */
	public static final String INTEGRATION_LAMBDA_PROXY = "lambda-proxy";

	/**
	 * Builds the endpoint map of a group of services.
	 * @param bundles The metadata of the services.
	 * @return The endpoints of all the services.
	 */
	public EndpointMap buildEndpointMap(@Nonnull final Collection<ServiceBundle> bundles) {
		getLogger().info("Resolving endpoint data.");
		final EndpointMap endpointMap = new EndpointMap();
		for(final ServiceBundle bundle : bundles) {
			if(!(bundle.serverless().map(serverless -> serverless.get("functions")).orElse(null) instanceof Map<?, ?> functions)) {
				getLogger().debug("Service `{}` declares no functions.", bundle.name());
				continue;
			}
			functions.forEach((key, function) -> {
				if(function instanceof Map<?, ?> functionDefinition) {
					addFunctionEndpoints(endpointMap, bundle.name(), String.valueOf(key), functionDefinition);
				} else {
					getLogger().atWarn().log("Skipping function `{}` from service `{}`; the function definition is not an object.", key, bundle.name());
				}
			});
		}
		getLogger().info("Resolved {} endpoints.", endpointMap.getResolvedCount());
		return endpointMap;
	}

	/**
	 * Adds the endpoints declared by the HTTP events of a single function.
	 * @param endpointMap The endpoint map being built.
	 * @param serviceName The name of the declaring service.
	 * @param shortFunctionName The key of the function in the Serverless specification.
	 * @param function The function definition.
	 * @return The number of valid HTTP events found.
	 */
	int addFunctionEndpoints(@Nonnull final EndpointMap endpointMap, @Nonnull final String serviceName, @Nonnull final String shortFunctionName,
			@Nonnull final Map<?, ?> function) {
		final String functionName = findNonEmptyString(function.get("name")).orElse(shortFunctionName);
		if(!(function.get("environment") instanceof Map<?, ?> environment)) {
			getLogger().atWarn().log("Skipping function `{}` from service `{}`; no environment variables defined.", shortFunctionName, serviceName);
			return 0;
		}
		final Object versionHash = environment.get(Corefw.ENV_VERSION_HASH);
		if(!Corefw.isVersionHash(versionHash)) {
			getLogger().atWarn().log("Skipping function `{}` from service `{}`; missing or invalid `{}` environment variable.", shortFunctionName, serviceName,
					Corefw.ENV_VERSION_HASH);
			return 0;
		}
		if(!(function.get("events") instanceof List<?> events)) {
			getLogger().atWarn().log("Skipping function `{}` from service `{}`; no events are defined for this function.", shortFunctionName, serviceName);
			return 0;
		}
		final Optional<String> description = Optional.ofNullable(function.get("description")).filter(String.class::isInstance).map(String.class::cast);
		int validEventCount = 0;
		for(final Object event : events) {
			if(!(event instanceof Map<?, ?> eventDefinition) || !(eventDefinition.get("http") instanceof Map<?, ?> http)) {
				continue; //not an HTTP event
			}
			final Optional<String> foundPath = findNonEmptyString(http.get("path"));
			if(foundPath.isEmpty()) {
				getLogger().atWarn().log("Invalid HTTP event found for `{}` from service `{}`; the `path` is undefined or invalid.", shortFunctionName, serviceName);
				continue;
			}
			final Optional<String> foundMethodToken = findNonEmptyString(http.get("method"));
			if(foundMethodToken.isEmpty()) {
				getLogger().atWarn().log("Invalid HTTP event found for `{}` from service `{}`; the `method` is undefined or invalid.", shortFunctionName,
						serviceName);
				continue;
			}
			final Optional<HttpMethod> foundMethod = HttpMethod.findByToken(foundMethodToken.get());
			if(foundMethod.isEmpty()) {
				getLogger().atWarn().log("Invalid HTTP event found for `{}` from service `{}`; the `method` specified (`{}`) is not supported.", shortFunctionName,
						serviceName, foundMethodToken.get());
				continue;
			}
			final Optional<String> foundIntegration = findNonEmptyString(http.get("integration"));
			if(foundIntegration.isEmpty()) {
				getLogger().atWarn().log("Invalid HTTP event found for `{}` from service `{}`; the `integration` is undefined or invalid.", shortFunctionName,
						serviceName);
				continue;
			}
			if(!INTEGRATION_LAMBDA_PROXY.equals(foundIntegration.get())) {
				getLogger().atWarn().log("Invalid HTTP event found for `{}` from service `{}`; the `integration` specified (`{}`) is not supported.",
						shortFunctionName, serviceName, foundIntegration.get());
				continue;
			}
			final String path = foundPath.get();
			final HttpMethod method = foundMethod.get();
			getLogger().debug("Identified path `{} {}` -> `{}`.", method, path, functionName);
			endpointMap.add(new EndpointDescriptor(functionName, shortFunctionName, description, path, method, serviceName,
					((String)versionHash).toLowerCase(Locale.ROOT)));
			validEventCount++;
		}
		if(validEventCount == 0) {
			getLogger().atWarn().log("Skipping function `{}` from service `{}`; no valid HTTP events were found.", shortFunctionName, serviceName);
		}
		return validEventCount;
	}

	private static Optional<String> findNonEmptyString(@Nullable final Object value) {
		return value instanceof String string && !string.isEmpty() ? Optional.of(string) : Optional.empty();
	}

}
