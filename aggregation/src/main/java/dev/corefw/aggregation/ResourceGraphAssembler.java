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

import static com.globalmentor.java.Conditions.*;
import static dev.corefw.aggregation.RefNames.*;
import static java.util.Objects.*;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.*;

import javax.annotation.*;

import dev.corefw.Variables;
import dev.corefw.cloud.FunctionRecord;
import io.clogr.Clogged;

/**
 * Assembles the API facade template from an endpoint map and the relevant deployed functions.
 * <p>
 * The template contains, in order: the REST API; a resource for every distinct path prefix; a method for every endpoint whose function is deployed; an
 * invoke permission for every deployed function; and a single deployment depending on all the methods.
 * </p>
 */
public class ResourceGraphAssembler implements Clogged {

	/** The template section containing the resources. */
	public static final String RESOURCES = "Resources";

	/** The text preceding the generation time in the deployment description. */
	static final String DEPLOYMENT_DESCRIPTION_PREFIX = "Generated by the CoreMicroservices::ServiceAggregator on ";

	private final Clock clock;

	/** Constructor using the system clock in the default time zone. */
	public ResourceGraphAssembler() {
		this(Clock.systemDefaultZone());
	}

	/**
	 * Clock constructor.
	 * @param clock The clock providing the time of generation.
	 */
	public ResourceGraphAssembler(@Nonnull final Clock clock) {
		this.clock = requireNonNull(clock);
	}

	/**
	 * Assembles the API facade template.
	 * @param endpointMap The endpoints of all services.
	 * @param functions The relevant deployed functions, keyed by lowercase version hash.
	 * @param apiName The name of the REST API.
	 * @param globalVariables The common global variables, which must include <code>gitBranch</code>.
	 * @return A new template.
	 */
	public Map<String, Object> assemble(@Nonnull final EndpointMap endpointMap, @Nonnull final Map<String, FunctionRecord> functions,
			@Nonnull final String apiName, @Nonnull final Map<String, ?> globalVariables) {
		getLogger().info("Generating the CloudFormation template for API `{}`.", apiName);
		final Map<String, Object> templateVariables = Variables.overlay(globalVariables, Map.of("apiName", apiName, "apiRefName", API_REF_NAME));
		final Map<String, Object> template = TemplateFragment.OUTER.render(templateVariables);
		final Map<String, Object> resources = getResources(template);
		resources.put(API_REF_NAME, TemplateFragment.REST_API.render(templateVariables));
		addPathResources(resources, endpointMap, templateVariables);
		final List<String> methodRefNames = addMethods(resources, endpointMap, functions, templateVariables);
		addPermissions(resources, functions, templateVariables);
		addDeployment(resources, methodRefNames, templateVariables);
		return template;
	}

	/**
	 * Returns the resources section of a template.
	 * @param template The template.
	 * @return The mutable resources of the template.
	 * @throws IllegalStateException if the template has no resources object.
	 */
	static Map<String, Object> getResources(@Nonnull final Map<String, Object> template) {
		final Object resources = template.get(RESOURCES);
		checkState(resources instanceof Map, "Template has no `%s` object.", RESOURCES);
		@SuppressWarnings("unchecked")
		final Map<String, Object> resourceMap = (Map<String, Object>)resources;
		return resourceMap;
	}

	/**
	 * Splits an API path into its non-empty segments.
	 * @param path The API path, which may have leading or trailing slashes.
	 * @return The path segments.
	 */
	static List<String> getPathSegments(@Nonnull final String path) {
		final List<String> segments = new ArrayList<>();
		for(final String segment : path.split("/")) {
			if(!segment.isEmpty()) {
				segments.add(segment);
			}
		}
		return segments;
	}

	/**
	 * Adds a resource for each distinct path prefix of all the endpoint paths, each attached to the resource of its parent prefix.
	 * @param resources The template resources.
	 * @param endpointMap The endpoints of all services.
	 * @param templateVariables The template variables.
	 */
	void addPathResources(@Nonnull final Map<String, Object> resources, @Nonnull final EndpointMap endpointMap,
			@Nonnull final Map<String, Object> templateVariables) {
		for(final String path : endpointMap.getPaths()) {
			String parentPath = null;
			String parentRefName = null;
			for(final String segment : getPathSegments(path)) {
				final String fullPath = parentPath == null ? segment : parentPath + "/" + segment;
				final String refName = resourceRefName(fullPath);
				if(!resources.containsKey(refName)) {
					final Map<String, Object> variables = new LinkedHashMap<>(templateVariables);
					variables.put("pathPart", segment);
					final TemplateFragment fragment;
					if(parentRefName == null) {
						fragment = TemplateFragment.ROOT_RESOURCE;
					} else {
						fragment = TemplateFragment.CHILD_RESOURCE;
						variables.put("parentRefName", parentRefName);
					}
					resources.put(refName, fragment.render(variables));
				}
				parentPath = fullPath;
				parentRefName = refName;
			}
		}
	}

	/**
	 * Adds a method for each endpoint with a deployed function.
	 * @param resources The template resources.
	 * @param endpointMap The endpoints of all services.
	 * @param functions The relevant deployed functions, keyed by lowercase version hash.
	 * @param templateVariables The template variables.
	 * @return The logical names of the methods added, in order.
	 */
	List<String> addMethods(@Nonnull final Map<String, Object> resources, @Nonnull final EndpointMap endpointMap,
			@Nonnull final Map<String, FunctionRecord> functions, @Nonnull final Map<String, Object> templateVariables) {
		final List<String> methodRefNames = new ArrayList<>();
		for(final String path : endpointMap.getPaths()) {
			if(getPathSegments(path).isEmpty()) { //the API root itself has no path resource
				getLogger().atWarn().log("Skipping method mappings for path `{}`; methods on the API root are not supported.", path);
				continue;
			}
			final String resourceRefName = resourceRefName(path);
			endpointMap.getEndpoints(path).forEach((method, endpoint) -> {
				final FunctionRecord function = functions.get(endpoint.versionHash());
				if(function == null) {
					getLogger().atWarn().log("Skipping method mapping for `{} {}`; could not find a deployed function with version hash `{}`.", method, path,
							endpoint.versionHash());
					return;
				}
				final String refName = methodRefName(path, method);
				final Map<String, Object> variables = new LinkedHashMap<>(templateVariables);
				variables.put("httpMethod", method.name());
				variables.put("resourceRefName", resourceRefName);
				variables.put("lambdaFunctionArn", function.functionArn());
				variables.put("lambdaFunctionName", function.functionName());
				resources.put(refName, TemplateFragment.METHOD.render(variables));
				methodRefNames.add(refName);
			});
		}
		return methodRefNames;
	}

	/**
	 * Adds a permission for the API to invoke each of the relevant functions, whether or not an endpoint maps to it.
	 * @param resources The template resources.
	 * @param functions The relevant deployed functions.
	 * @param templateVariables The template variables.
	 */
	void addPermissions(@Nonnull final Map<String, Object> resources, @Nonnull final Map<String, FunctionRecord> functions,
			@Nonnull final Map<String, Object> templateVariables) {
		for(final FunctionRecord function : functions.values()) {
			final Map<String, Object> variables = new LinkedHashMap<>(templateVariables);
			variables.put("lambdaFunctionArn", function.functionArn());
			variables.put("lambdaFunctionName", function.functionName());
			resources.put(permissionRefName(function.functionName()), TemplateFragment.PERMISSION.render(variables));
		}
	}

	/**
	 * Adds a deployment of the API, named uniquely for the time of generation.
	 * @param resources The template resources.
	 * @param methodRefNames The logical names of all the methods, on which the deployment depends.
	 * @param templateVariables The template variables.
	 */
	void addDeployment(@Nonnull final Map<String, Object> resources, @Nonnull final List<String> methodRefNames,
			@Nonnull final Map<String, Object> templateVariables) {
		final ZonedDateTime now = ZonedDateTime.now(clock);
		final Map<String, Object> variables = new LinkedHashMap<>(templateVariables);
		variables.put("description", DEPLOYMENT_DESCRIPTION_PREFIX + now.truncatedTo(ChronoUnit.SECONDS).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
		variables.put("methodRefNames", List.copyOf(methodRefNames));
		resources.put(deploymentRefName(now.toLocalDateTime()), TemplateFragment.DEPLOYMENT.render(variables));
	}

}
