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

import java.io.*;
import java.util.*;

import javax.annotation.*;

import dev.corefw.*;

/**
 * The fragments from which the API facade template is assembled, each stored as a JSON resource containing variable identifiers.
 * @see Variables
 */
public enum TemplateFragment {

	/** The template scaffold, with an empty <code>Resources</code> object. */
	OUTER("Outer.json"),
	/** The REST API. */
	REST_API("RestApi.json"),
	/** A resource for the first segment of a path, attached to the API root. */
	ROOT_RESOURCE("RootResource.json"),
	/** A resource for a subsequent path segment, attached to the resource of the preceding segment. */
	CHILD_RESOURCE("ChildResource.json"),
	/** A method integrated with a function. */
	METHOD("Method.json"),
	/** A deployment of the API to a stage. */
	DEPLOYMENT("Deployment.json"),
	/** A permission for the API to invoke a function. */
	PERMISSION("Permission.json");

	/** The directory of the fragment resources, relative to this class. */
	static final String RESOURCE_DIRECTORY = "cloudformation/";

	private final String resourceName;

	/** The fragment tree, loaded lazily and never modified. */
	@Nullable
	private volatile Map<String, Object> tree = null;

	TemplateFragment(@Nonnull final String resourceName) {
		this.resourceName = resourceName;
	}

	/** @return The name of the fragment resource. */
	public String getResourceName() {
		return resourceName;
	}

	/**
	 * Renders the fragment by substituting variables throughout it.
	 * @param variables The variables to substitute.
	 * @return A new tree of the rendered fragment, which the caller may modify.
	 */
	public Map<String, Object> render(@Nonnull final Map<String, ?> variables) {
		return Variables.substituteObject(getTree(), variables);
	}

	private Map<String, Object> getTree() {
		Map<String, Object> fragmentTree = tree;
		if(fragmentTree == null) {
			fragmentTree = loadTree();
			tree = fragmentTree;
		}
		return fragmentTree;
	}

	private Map<String, Object> loadTree() {
		final String resourcePath = RESOURCE_DIRECTORY + resourceName;
		try (final InputStream inputStream = TemplateFragment.class.getResourceAsStream(resourcePath)) {
			checkState(inputStream != null, "Missing template fragment resource `%s`.", resourcePath);
			@SuppressWarnings("unchecked")
			final Map<String, Object> fragmentTree = (Map<String, Object>)Marshalling.JSON_READER.forType(Map.class).readValue(inputStream);
			return fragmentTree;
		} catch(final IOException ioException) {
			throw new UncheckedIOException("Error loading template fragment resource `%s`.".formatted(resourcePath), ioException);
		}
	}

}
