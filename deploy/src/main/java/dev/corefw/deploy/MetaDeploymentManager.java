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

import static java.util.Objects.*;
import static java.util.stream.Collectors.*;

import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import javax.annotation.*;

import dev.corefw.*;
import dev.corefw.cloud.ObjectStorage;
import dev.corefw.cloud.aws.*;
import dev.corefw.deploy.module.*;
import dev.corefw.deploy.target.*;
import io.clogr.Clogged;

/**
 * Deploys the metadata of a service to one or more targets, as configured in the {@value #CONFIG_SECTION} section of {@value #CONFIG_PATH}.
 * <p>
 * An example configuration:
 * </p>
 *
 * <pre>{@code
 * MetaDeploy:
 *   DeployTargets:
 *     - type: AwsS3Bucket
 *       bucket: my-meta-bucket
 *       rootPath: /services/${serviceNameShort}/latest
 *       cleanFirst: true
 *   Modules:
 *     - type: PackageFile
 *       include: true
 *     - type: ServerlessSpec
 *       include: true
 *     - type: StaticDirectory
 *       include: false
 *       sourcePathRel: docs
 *       destPathRel: docs
 * }</pre>
 * <p>
 * All targets are prepared concurrently. Then each included module is executed in the order configured, deploying to each target in turn.
 * </p>
 */
public class MetaDeploymentManager implements Clogged {

	/** The location of the configuration file, relative to the service root. */
	public static final String CONFIG_PATH = "config/corefw.config.yml";

	/** The section of the configuration file configuring metadata deployment. */
	public static final String CONFIG_SECTION = "MetaDeploy";

	/** The property listing the deploy targets. */
	public static final String DEPLOY_TARGETS_PROPERTY = "DeployTargets";

	/** The property listing the modules. */
	public static final String MODULES_PROPERTY = "Modules";

	/** The property giving the type of a target or module. */
	public static final String TYPE_PROPERTY = "type";

	/** The property that must be <code>true</code> for a module to be executed. */
	public static final String INCLUDE_PROPERTY = "include";

	private final ServiceProject project;

	/** @return The project of the service being deployed. */
	public ServiceProject getProject() {
		return project;
	}

	private final Function<String, ObjectStorage> objectStorageForRegion;

	/**
	 * Service project constructor, deploying to AWS.
	 * @param project The project of the service being deployed.
	 */
	public MetaDeploymentManager(@Nonnull final ServiceProject project) {
		this(project, AwsS3ObjectStorage::forRegion);
	}

	/**
	 * Service project and object storage constructor.
	 * @param project The project of the service being deployed.
	 * @param objectStorageForRegion The strategy for accessing object storage in an AWS region.
	 */
	public MetaDeploymentManager(@Nonnull final ServiceProject project, @Nonnull final Function<String, ObjectStorage> objectStorageForRegion) {
		this.project = requireNonNull(project);
		this.objectStorageForRegion = requireNonNull(objectStorageForRegion);
	}

	/**
	 * Runs the metadata deployment.
	 * @return A future completing when all modules have been deployed to all targets.
	 * @throws ConfigurationException if the deployment configuration is missing or invalid.
	 */
	public CompletableFuture<Void> execute() {
		getLogger().info("The Metadata Deployment Manager is starting.");
		final Map<String, Object> deployConfig = loadDeployConfig();
		final List<MetaDeployTarget> targets = createTargets(deployConfig);
		final List<MetaDeployModule> modules = createModules(deployConfig);
		return prepareTargets(targets).thenCompose(__ -> executeModules(modules, targets))
				.thenRun(() -> getLogger().info("Metadata deployment complete."));
	}

	/**
	 * Loads and validates the deployment configuration.
	 * @return The {@value #CONFIG_SECTION} section of the configuration, with the common global variables substituted.
	 * @throws ConfigurationException if the configuration is missing or invalid.
	 */
	Map<String, Object> loadDeployConfig() {
		final Map<String, Object> config = project.loadConfigFile(CONFIG_PATH);
		final Object deployConfig = config.get(CONFIG_SECTION);
		if(deployConfig == null) {
			throw new ConfigurationException(
					"The configuration in `%s` does not contain a `%s` property, which is required for metadata deployment.".formatted(CONFIG_PATH, CONFIG_SECTION));
		}
		if(!(deployConfig instanceof Map<?, ?> deployConfigMap)) {
			throw new ConfigurationException("The `%s` configuration in `%s` is invalid or malformed.".formatted(CONFIG_SECTION, CONFIG_PATH));
		}
		@SuppressWarnings("unchecked")
		final Map<String, Object> deployConfigObject = (Map<String, Object>)deployConfigMap;
		if(getConfigObjects(deployConfigObject, DEPLOY_TARGETS_PROPERTY).isEmpty()) {
			throw new ConfigurationException("Metadata deployment requires at least one deploy target (`%s`).".formatted(DEPLOY_TARGETS_PROPERTY));
		}
		if(getConfigObjects(deployConfigObject, MODULES_PROPERTY).isEmpty()) {
			throw new ConfigurationException("Metadata deployment requires at least one module to be defined (`%s`).".formatted(MODULES_PROPERTY));
		}
		return deployConfigObject;
	}

	/**
	 * Creates the deploy targets from the deployment configuration.
	 * @param deployConfig The deployment configuration.
	 * @return The configured targets, in order.
	 * @throws ConfigurationException if a target has a missing or unknown type, or is otherwise invalid.
	 */
	List<MetaDeployTarget> createTargets(@Nonnull final Map<String, Object> deployConfig) {
		getLogger().info("Initializing deploy targets.");
		return getConfigObjects(deployConfig, DEPLOY_TARGETS_PROPERTY).stream().map(this::createTarget).collect(toList());
	}

	/**
	 * Creates a single deploy target.
	 * @param targetConfig The configuration of the target.
	 * @return The new target.
	 * @throws ConfigurationException if the target has a missing or unknown type, or is otherwise invalid.
	 */
	MetaDeployTarget createTarget(@Nonnull final Map<String, Object> targetConfig) {
		final String type = getType(targetConfig);
		return switch(type) {
			case AwsS3Bucket.TYPE -> {
				final AwsS3Bucket.Settings settings = toSettings(targetConfig, AwsS3Bucket.Settings.class, type);
				yield new AwsS3Bucket(project, settings, objectStorageForRegion.apply(settings.awsRegion()));
			}
			default -> throw new ConfigurationException("Unknown deploy target type `%s`.".formatted(type));
		};
	}

	/**
	 * Creates the included modules from the deployment configuration. Modules not explicitly included are skipped with a warning.
	 * @param deployConfig The deployment configuration.
	 * @return The included modules, in order.
	 * @throws ConfigurationException if an included module has a missing or unknown type, or is otherwise invalid.
	 */
	List<MetaDeployModule> createModules(@Nonnull final Map<String, Object> deployConfig) {
		getLogger().info("Initializing modules.");
		final List<MetaDeployModule> modules = new ArrayList<>();
		for(final Map<String, Object> moduleConfig : getConfigObjects(deployConfig, MODULES_PROPERTY)) {
			if(Boolean.TRUE.equals(moduleConfig.get(INCLUDE_PROPERTY))) {
				modules.add(createModule(moduleConfig));
			} else if(moduleConfig.get(TYPE_PROPERTY) != null) {
				getLogger().atWarn().log("An instance of a `{}` deployment module is disabled and will not be executed.", moduleConfig.get(TYPE_PROPERTY));
			}
		}
		return modules;
	}

	/**
	 * Creates a single module.
	 * @param moduleConfig The configuration of the module.
	 * @return The new module.
	 * @throws ConfigurationException if the module has a missing or unknown type, or is otherwise invalid.
	 */
	MetaDeployModule createModule(@Nonnull final Map<String, Object> moduleConfig) {
		final String type = getType(moduleConfig);
		return switch(type) {
			case PackageFile.TYPE -> new PackageFile(project, toSettings(moduleConfig, PackageFile.Settings.class, type));
			case ServerlessSpec.TYPE -> new ServerlessSpec(project, toSettings(moduleConfig, ServerlessSpec.Settings.class, type));
			case OpenApiSpec.TYPE -> new OpenApiSpec(project, toSettings(moduleConfig, OpenApiSpec.Settings.class, type));
			case StaticDirectory.TYPE -> new StaticDirectory(project, toSettings(moduleConfig, StaticDirectory.Settings.class, type));
			default -> throw new ConfigurationException("Unknown deployment module type `%s`.".formatted(type));
		};
	}

	/**
	 * Prepares all targets concurrently.
	 * @param targets The targets to prepare.
	 * @return A future completing when all targets are prepared.
	 */
	CompletableFuture<Void> prepareTargets(@Nonnull final List<MetaDeployTarget> targets) {
		return CompletableFuture.allOf(targets.stream().map(MetaDeployTarget::prepare).toArray(CompletableFuture[]::new));
	}

	/**
	 * Executes modules one after another, in order.
	 * @param modules The modules to execute.
	 * @param targets The prepared targets.
	 * @return A future completing when all the modules have been executed.
	 */
	CompletableFuture<Void> executeModules(@Nonnull final List<MetaDeployModule> modules, @Nonnull final List<MetaDeployTarget> targets) {
		CompletableFuture<Void> future = CompletableFuture.completedFuture(null);
		for(final MetaDeployModule module : modules) {
			future = future.thenCompose(__ -> {
				getLogger().info("Deferring to module `{}`.", module.getName());
				return module.execute(targets);
			});
		}
		return future;
	}

	/**
	 * Retrieves a list of configuration objects.
	 * @param config The configuration containing the list.
	 * @param property The name of the list property.
	 * @return The objects in the list; empty if the property is missing or is not a list.
	 * @throws ConfigurationException if an item of the list is not an object.
	 */
	static List<Map<String, Object>> getConfigObjects(@Nonnull final Map<String, Object> config, @Nonnull final String property) {
		if(!(config.get(property) instanceof List<?> list)) {
			return List.of();
		}
		final List<Map<String, Object>> objects = new ArrayList<>(list.size());
		for(final Object item : list) {
			if(!(item instanceof Map<?, ?> map)) {
				throw new ConfigurationException("Each item of `%s` must be an object.".formatted(property));
			}
			@SuppressWarnings("unchecked")
			final Map<String, Object> object = (Map<String, Object>)map;
			objects.add(object);
		}
		return objects;
	}

	private static String getType(@Nonnull final Map<String, Object> config) {
		if(!(config.get(TYPE_PROPERTY) instanceof String type) || type.isEmpty()) {
			throw new ConfigurationException("Missing `%s` of deploy target or module.".formatted(TYPE_PROPERTY));
		}
		return type;
	}

	/**
	 * Converts the configuration of a target or module to its settings.
	 * @param <S> The type of settings.
	 * @param config The configuration.
	 * @param settingsClass The class of the settings.
	 * @param type The type of target or module, for error messages.
	 * @return The settings.
	 * @throws ConfigurationException if the configuration is invalid.
	 */
	static <S> S toSettings(@Nonnull final Map<String, Object> config, @Nonnull final Class<S> settingsClass, @Nonnull final String type) {
		try {
			return Marshalling.convertValue(config, settingsClass);
		} catch(final IllegalArgumentException illegalArgumentException) {
			for(Throwable cause = illegalArgumentException.getCause(); cause != null; cause = cause.getCause()) {
				if(cause instanceof ConfigurationException configurationException) { //thrown from a settings constructor
					throw configurationException;
				}
			}
			throw new ConfigurationException("Invalid configuration of `%s`: %s".formatted(type, illegalArgumentException.getMessage()), illegalArgumentException);
		}
	}

	/**
	 * Deploys the metadata of the service in the working directory, waiting for deployment to finish.
	 * @param args The command-line arguments; an optional path to the service root.
	 */
	public static void main(@Nonnull final String[] args) {
		final ServiceProject project = ServiceProject.load(Path.of(args.length > 0 ? args[0] : "."));
		final MetaDeploymentManager metaDeploymentManager = new MetaDeploymentManager(project);
		metaDeploymentManager.execute().whenComplete((__, throwable) -> {
			if(throwable != null) {
				metaDeploymentManager.getLogger().error("Metadata deployment failed.", CorefwPlatformAws.unwrap(throwable));
			}
		}).join();
	}

}
