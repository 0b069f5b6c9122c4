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

package dev.corefw.deploy.module;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import javax.annotation.*;

import dev.corefw.*;
import dev.corefw.deploy.target.MetaDeployTarget;

/**
 * A module deploying a single object, as a JSON file, a YAML file, or both.
 * @implSpec The JSON filename defaults to the module's own filename, but only if no YAML filename is configured. Thus by default the object is deployed
 *           only as JSON; configuring only a YAML filename deploys it only as YAML.
 */
public abstract class ObjectFileModule extends MetaDeployModule {

	private final Optional<String> jsonFilename;

	/** @return The destination of the JSON file, if the object is to be deployed as JSON. */
	public Optional<String> getJsonFilename() {
		return jsonFilename;
	}

	private final Optional<String> yamlFilename;

	/** @return The destination of the YAML file, if the object is to be deployed as YAML. */
	public Optional<String> getYamlFilename() {
		return yamlFilename;
	}

	/**
	 * Constructor.
	 * @param project The project of the service being deployed.
	 * @param name The name of this module, or <code>null</code> to use the simple name of the class.
	 * @param defaultJsonFilename The JSON filename to use if neither a JSON nor a YAML filename is configured.
	 * @param jsonFilename The configured destination of the JSON file, or <code>null</code> if none is configured.
	 * @param yamlFilename The configured destination of the YAML file, or <code>null</code> if none is configured.
	 */
	protected ObjectFileModule(@Nonnull final ServiceProject project, @Nullable final String name, @Nonnull final String defaultJsonFilename,
			@Nullable final String jsonFilename, @Nullable final String yamlFilename) {
		super(project, name);
		this.yamlFilename = Optional.ofNullable(yamlFilename);
		this.jsonFilename = Optional.ofNullable(jsonFilename).or(() -> yamlFilename == null ? Optional.of(defaultJsonFilename) : Optional.empty());
	}

	/**
	 * Produces the object to deploy.
	 * @return The object tree.
	 * @throws ConfigurationException if the object cannot be loaded.
	 */
	protected abstract Object loadObject();

	/**
	 * {@inheritDoc}
	 * @implSpec The JSON file, if any, is stored before the YAML file.
	 */
	@Override
	protected CompletableFuture<Void> deployToTarget(final MetaDeployTarget target) {
		final Object object;
		try {
			object = loadObject();
		} catch(final ConfigurationException configurationException) {
			return CompletableFuture.failedFuture(configurationException);
		}
		final CompletableFuture<Void> jsonFuture = jsonFilename.map(filename -> target.putObjectAsJson(filename, object))
				.orElseGet(() -> CompletableFuture.completedFuture(null));
		return jsonFuture.thenCompose(__ -> yamlFilename.map(filename -> target.putObjectAsYaml(filename, object))
				.orElseGet(() -> CompletableFuture.completedFuture(null)));
	}

}
