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

import static java.nio.charset.StandardCharsets.*;
import static java.util.Objects.*;

import java.io.*;
import java.nio.file.*;
import java.util.*;
import java.util.regex.Pattern;

import javax.annotation.*;

import io.clogr.Clogged;

/**
 * The project of a single service, rooted in a directory containing at least a <code>package.json</code> descriptor.
 * <p>
 * The project provides the <dfn>common global variables</dfn> available to every configuration file and template processed by CoreFW tooling: the version
 * components and name of the service, and the Git branch being built.
 * </p>
 * @apiNote All information is loaded once when the project is loaded, and is thereafter passed down explicitly to whatever needs it.
 */
public final class ServiceProject implements Clogged {

	/** The name of the package descriptor in the service root. */
	public static final String PACKAGE_FILENAME = "package.json";

	/** The location of the Git <code>HEAD</code> file, relative to the service root. */
	public static final String GIT_HEAD_PATH = ".git/HEAD";

	/** The prefix conventionally given to service package names, removed to produce the short name. */
	public static final String SERVICE_NAME_PREFIX = "sls-service-";

	/** Characters that are not expected in a Git <code>HEAD</code> reference. */
	private static final Pattern GIT_HEAD_INVALID_CHARACTERS = Pattern.compile("[^a-zA-Z0-9\\-:/.]+");

	/** The version returned for missing minor and revision components. */
	private static final String MISSING_VERSION_COMPONENT = "0";

	private final Path rootPath;

	/** @return The absolute path to the service root directory. */
	public Path getRootPath() {
		return rootPath;
	}

	private final Map<String, Object> packageData;

	/** @return The unmodifiable contents of the service package descriptor. */
	public Map<String, Object> getPackageData() {
		return packageData;
	}

	private final String serviceName;

	/** @return The name of the service, either as explicitly provided or as given in the package descriptor. */
	public String getServiceName() {
		return serviceName;
	}

	private final String versionFull;

	/** @return The full version string of the service, as given in the package descriptor. */
	public String getVersionFull() {
		return versionFull;
	}

	private final String gitBranch;

	/** @return The Git branch being built. */
	public String getGitBranch() {
		return gitBranch;
	}

	/**
	 * Constructor.
	 * @param rootPath The absolute path to the service root directory.
	 * @param packageData The contents of the service package descriptor.
	 * @param serviceName The explicit name of the service, or <code>null</code> if the name should be taken from the package descriptor.
	 * @param gitBranch The Git branch being built.
	 * @throws ConfigurationException if the package descriptor has a missing or invalid <code>version</code>, or a missing or invalid <code>name</code> when no
	 *           explicit service name is given.
	 */
	ServiceProject(@Nonnull final Path rootPath, @Nonnull final Map<String, Object> packageData, @Nullable final String serviceName,
			@Nonnull final String gitBranch) {
		this.rootPath = requireNonNull(rootPath);
		this.packageData = Collections.unmodifiableMap(new LinkedHashMap<>(packageData));
		this.versionFull = requireNonEmptyString(packageData.get("version"), "Missing or invalid `version` specified in `%s`.".formatted(PACKAGE_FILENAME));
		this.serviceName = serviceName != null ? serviceName
				: requireNonEmptyString(packageData.get("name"), "Missing or invalid service `name` specified in `%s`.".formatted(PACKAGE_FILENAME));
		this.gitBranch = requireNonNull(gitBranch);
	}

	/**
	 * Loads a service project from its root directory, using the process environment to resolve the Git branch.
	 * @param rootPath The path to the service root directory.
	 * @return The loaded service project.
	 * @throws ConfigurationException if the package descriptor cannot be loaded or is invalid, or if the Git branch cannot be determined.
	 * @see #load(Path, String, Map)
	 */
	public static ServiceProject load(@Nonnull final Path rootPath) {
		return load(rootPath, null, System.getenv());
	}

	/**
	 * Loads a service project from its root directory.
	 * @implSpec The Git branch is taken from the {@value Corefw#ENV_GIT_BRANCH} environment variable; otherwise from {@value Corefw#ENV_TRAVIS_BRANCH};
	 *           otherwise it is read from the project's {@value #GIT_HEAD_PATH} file.
	 * @param rootPath The path to the service root directory.
	 * @param serviceName The explicit name of the service, or <code>null</code> if the name should be taken from the package descriptor.
	 * @param environment The environment variables to consult.
	 * @return The loaded service project.
	 * @throws ConfigurationException if the package descriptor cannot be loaded or is invalid, or if the Git branch cannot be determined.
	 */
	public static ServiceProject load(@Nonnull final Path rootPath, @Nullable final String serviceName, @Nonnull final Map<String, String> environment) {
		final Path absoluteRootPath = rootPath.toAbsolutePath().normalize();
		final Map<String, Object> packageData = loadObjectFile(absoluteRootPath.resolve(PACKAGE_FILENAME));
		final String gitBranch = Optional.ofNullable(environment.get(Corefw.ENV_GIT_BRANCH))
				.or(() -> Optional.ofNullable(environment.get(Corefw.ENV_TRAVIS_BRANCH))).orElseGet(() -> readGitBranch(absoluteRootPath));
		return new ServiceProject(absoluteRootPath, packageData, serviceName, gitBranch);
	}

	/** @return The shortened service name, without the conventional {@value #SERVICE_NAME_PREFIX} prefix. */
	public String getServiceNameShort() {
		return serviceName.replace(SERVICE_NAME_PREFIX, "");
	}

	/** @return The major version component of the service. */
	public String getVersionMajor() {
		return versionFull.split("\\.")[0];
	}

	/** @return The minor version component of the service, or <code>"0"</code> if there is none. */
	public String getVersionMinor() {
		final String[] components = versionFull.split("\\.");
		return components.length < 2 ? MISSING_VERSION_COMPONENT : components[1];
	}

	/** @return The revision version component of the service, or <code>"0"</code> if there is none. */
	public String getVersionRevision() {
		final String[] components = versionFull.split("\\.");
		return components.length < 3 ? MISSING_VERSION_COMPONENT : components[2];
	}

	/**
	 * Returns the variables available to all configuration files and templates.
	 * @return A new mutable map of the common global variables, in a stable order.
	 */
	public Map<String, Object> getCommonGlobalVariables() {
		final Map<String, Object> variables = new LinkedHashMap<>();
		variables.put("versionMajor", getVersionMajor());
		variables.put("versionMinor", getVersionMinor());
		variables.put("versionRevision", getVersionRevision());
		variables.put("versionFull", getVersionFull());
		variables.put("serviceName", getServiceName());
		variables.put("serviceNameShort", getServiceNameShort());
		variables.put("gitBranch", getGitBranch());
		return variables;
	}

	/**
	 * Resolves a path relative to the service root.
	 * @param relativePath The path relative to the service root.
	 * @return The resolved absolute path.
	 */
	public Path resolve(@Nonnull final String relativePath) {
		return rootPath.resolve(relativePath).normalize();
	}

	/**
	 * Loads a JSON or YAML file in the service project and substitutes the common global variables throughout it.
	 * @param relativePath The path of the file relative to the service root.
	 * @return The loaded object with variables substituted.
	 * @throws ConfigurationException if the file cannot be read, cannot be parsed, or does not contain an object.
	 */
	public Map<String, Object> loadConfigFile(@Nonnull final String relativePath) {
		final Map<String, Object> config = loadObjectFile(resolve(relativePath));
		getLogger().atDebug().log("Loaded configuration file `{}`.", relativePath);
		return Variables.substituteObject(config, getCommonGlobalVariables());
	}

	/**
	 * Loads a YAML file in the service project as a tree.
	 * @param relativePath The path of the file relative to the service root.
	 * @return The loaded tree, without variables substituted.
	 * @throws ConfigurationException if the file cannot be read or parsed.
	 */
	public Object loadYamlFile(@Nonnull final String relativePath) {
		final Path file = resolve(relativePath);
		try (final InputStream inputStream = new BufferedInputStream(Files.newInputStream(file))) {
			return Marshalling.readYamlTree(inputStream);
		} catch(final IOException | MarshalException exception) {
			throw new ConfigurationException("Could not load YAML file `%s`: %s".formatted(file, exception.getMessage()), exception);
		}
	}

	/**
	 * Loads a JSON file in the service project as a tree.
	 * @param relativePath The path of the file relative to the service root.
	 * @return The loaded tree, without variables substituted.
	 * @throws ConfigurationException if the file cannot be read or parsed.
	 */
	public Object loadJsonFile(@Nonnull final String relativePath) {
		final Path file = resolve(relativePath);
		try {
			return Marshalling.readJsonTree(Files.readString(file, UTF_8));
		} catch(final IOException | MarshalException exception) {
			throw new ConfigurationException("Could not load JSON file `%s`: %s".formatted(file, exception.getMessage()), exception);
		}
	}

	/**
	 * Loads a file containing a JSON or YAML object.
	 * @param file The file to load.
	 * @return The object in the file.
	 * @throws ConfigurationException if the file cannot be read, cannot be parsed, or does not contain an object.
	 */
	static Map<String, Object> loadObjectFile(@Nonnull final Path file) {
		final Object tree;
		try {
			tree = Marshalling.readTree(file);
		} catch(final NoSuchFileException noSuchFileException) {
			throw new ConfigurationException("Missing required file `%s`.".formatted(file), noSuchFileException);
		} catch(final IOException | MarshalException exception) {
			throw new ConfigurationException("Could not read file `%s`: %s".formatted(file, exception.getMessage()), exception);
		}
		if(!(tree instanceof Map<?, ?> map)) {
			throw new ConfigurationException("File `%s` does not contain an object.".formatted(file));
		}
		@SuppressWarnings("unchecked")
		final Map<String, Object> object = (Map<String, Object>)map;
		return object;
	}

	/**
	 * Determines the current Git branch by reading the Git <code>HEAD</code> file of a project.
	 * @param rootPath The service root directory.
	 * @return The name of the branch, which is the last segment of the <code>HEAD</code> reference.
	 * @throws ConfigurationException if the <code>HEAD</code> file is missing, or its contents are not a recognized branch reference.
	 */
	static String readGitBranch(@Nonnull final Path rootPath) {
		final String gitHeadContents;
		try {
			gitHeadContents = Files.readString(rootPath.resolve(GIT_HEAD_PATH), UTF_8);
		} catch(final IOException ioException) {
			throw new ConfigurationException("Missing `%s` file, which is required to resolve the current Git branch.".formatted(GIT_HEAD_PATH), ioException);
		}
		return parseGitBranch(gitHeadContents);
	}

	/**
	 * Parses a Git branch name from the contents of a Git <code>HEAD</code> file, e.g. <code>ref: refs/heads/master</code>.
	 * @param gitHeadContents The contents of the Git <code>HEAD</code> file.
	 * @return The name of the branch, which is the last segment of the reference.
	 * @throws ConfigurationException if the contents are not a recognized branch reference, such as for a detached <code>HEAD</code>.
	 */
	static String parseGitBranch(@Nonnull final String gitHeadContents) {
		final String reference = GIT_HEAD_INVALID_CHARACTERS.matcher(gitHeadContents).replaceAll("");
		if(!reference.startsWith("ref:") || reference.indexOf('/') < 0) {
			throw new ConfigurationException("Could not resolve the current Git branch; the contents of `%s` were not recognized.".formatted(GIT_HEAD_PATH));
		}
		return reference.substring(reference.lastIndexOf('/') + 1);
	}

	private static String requireNonEmptyString(@Nullable final Object value, @Nonnull final String errorMessage) {
		if(!(value instanceof String string) || string.isEmpty()) {
			throw new ConfigurationException(errorMessage);
		}
		return string;
	}

}
