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

import java.util.*;
import java.util.concurrent.CompletableFuture;

import javax.annotation.*;

import dev.corefw.*;
import dev.corefw.deploy.MetaDeployHelper;
import dev.corefw.deploy.target.MetaDeployTarget;

/**
 * A unit of metadata deployed to every target.
 */
public abstract class MetaDeployModule extends MetaDeployHelper {

	/**
	 * Constructor.
	 * @param project The project of the service being deployed.
	 * @param name The name of this module, or <code>null</code> to use the simple name of the class.
	 */
	protected MetaDeployModule(@Nonnull final ServiceProject project, @Nullable final String name) {
		super(project, name);
		getLogger().info("Initializing module `{}`.", getName());
	}

	/**
	 * Deploys this module to each of the targets in turn.
	 * @param targets The prepared deploy targets.
	 * @return A future completing when the module has been deployed to all the targets.
	 */
	public CompletableFuture<Void> execute(@Nonnull final List<? extends MetaDeployTarget> targets) {
		getLogger().info("Executing metadata deployment module `{}`.", getName());
		CompletableFuture<Void> future = CompletableFuture.completedFuture(null);
		for(int i = 0; i < targets.size(); i++) {
			final int targetNumber = i + 1;
			final MetaDeployTarget target = targets.get(i);
			future = future.thenCompose(__ -> {
				getLogger().info("Deploying to target #{} ({} -> {}).", targetNumber, getName(), target.getName());
				return deployToTarget(target);
			});
		}
		return future.thenRun(() -> getLogger().info("All operations for module `{}` have completed successfully.", getName()));
	}

	/**
	 * Deploys this module to a single target.
	 * @param target The target.
	 * @return A future completing when the deployment to the target is complete.
	 */
	protected abstract CompletableFuture<Void> deployToTarget(@Nonnull MetaDeployTarget target);

	/**
	 * Loads a JSON or YAML file of the service containing an object, choosing the format from the file extension.
	 * @param relativePath The path of the file relative to the service root.
	 * @return The object in the file.
	 * @throws ConfigurationException if the file cannot be read or parsed, or does not contain an object.
	 */
	protected Map<String, Object> loadObjectFile(@Nonnull final String relativePath) {
		final Object tree = relativePath.endsWith(".yml") || relativePath.endsWith(".yaml") ? getProject().loadYamlFile(relativePath)
				: getProject().loadJsonFile(relativePath);
		if(!(tree instanceof Map<?, ?> map)) {
			throw new ConfigurationException("File `%s` does not contain an object.".formatted(relativePath));
		}
		@SuppressWarnings("unchecked")
		final Map<String, Object> object = (Map<String, Object>)map;
		return object;
	}

}
