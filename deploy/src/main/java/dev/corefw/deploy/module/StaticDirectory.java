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

import static java.util.stream.Collectors.*;

import java.io.*;
import java.nio.file.*;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

import javax.annotation.*;

import com.fasterxml.jackson.annotation.*;

import dev.corefw.*;
import dev.corefw.deploy.*;
import dev.corefw.deploy.target.MetaDeployTarget;

/**
 * Deploys all the files of a directory in the service, recursively, preserving their relative locations.
 */
public class StaticDirectory extends MetaDeployModule {

	/** The type of this module in the deployment configuration. */
	public static final String TYPE = "StaticDirectory";

	private final String sourcePathRel;

	/** @return The directory to deploy, relative to the service root. */
	public String getSourcePathRel() {
		return sourcePathRel;
	}

	private final String destPathRel;

	/** @return The destination directory, relative to the root of each target. */
	public String getDestPathRel() {
		return destPathRel;
	}

	/**
	 * Constructor.
	 * @param project The project of the service being deployed.
	 * @param settings The configuration of this module.
	 */
	public StaticDirectory(@Nonnull final ServiceProject project, @Nonnull final Settings settings) {
		super(project, settings.name());
		this.sourcePathRel = settings.sourcePathRel() != null ? settings.sourcePathRel() : "";
		this.destPathRel = settings.destPathRel() != null ? settings.destPathRel() : "";
	}

	/** @return The absolute path of the directory to deploy. */
	public Path getSourcePathAbs() {
		return resolveLocalAbs(sourcePathRel);
	}

	@Override
	protected CompletableFuture<Void> deployToTarget(final MetaDeployTarget target) {
		final List<DeploymentFile> files;
		try {
			files = findFiles();
		} catch(final ConfigurationException configurationException) {
			return CompletableFuture.failedFuture(configurationException);
		}
		getLogger().debug("Found {} files to deploy in `{}`.", files.size(), getSourcePathAbs());
		return target.deployFiles(files);
	}

	/**
	 * Finds the files to deploy and determines their destinations.
	 * @return The files to deploy, in path order.
	 * @throws ConfigurationException if the source directory does not exist or cannot be walked.
	 */
	List<DeploymentFile> findFiles() {
		final Path sourcePathAbs = getSourcePathAbs();
		if(!Files.isDirectory(sourcePathAbs)) {
			throw new ConfigurationException("Static directory `%s` does not exist.".formatted(sourcePathAbs));
		}
		try (final Stream<Path> paths = Files.walk(sourcePathAbs)) {
			return paths.filter(Files::isRegularFile).sorted()
					.map(file -> new DeploymentFile(resolveServiceRel(file), resolveTargetRel(sourcePathAbs.relativize(file)))).collect(toList());
		} catch(final IOException | UncheckedIOException exception) {
			throw new ConfigurationException("Could not read static directory `%s`: %s".formatted(sourcePathAbs, exception.getMessage()), exception);
		}
	}

	/**
	 * Determines the destination of a file relative to the root of a target.
	 * @param sourceRelativePath The path of the file relative to the source directory.
	 * @return The destination path, beginning with a slash.
	 */
	String resolveTargetRel(@Nonnull final Path sourceRelativePath) {
		final List<String> parts = new ArrayList<>();
		parts.add(DeployPaths.SEPARATOR);
		parts.add(destPathRel);
		sourceRelativePath.forEach(segment -> parts.add(segment.toString()));
		return DeployPaths.join(parts.toArray(String[]::new));
	}

	/**
	 * The configuration of a static directory module.
	 * @param name The name of the module for logging, or <code>null</code> to use the type.
	 * @param sourcePathRel The directory to deploy, relative to the service root, or <code>null</code> for the service root itself.
	 * @param destPathRel The destination directory, relative to the root of each target, or <code>null</code> for the target root.
	 */
	public record Settings(@JsonProperty("name") @Nullable String name, @JsonProperty("sourcePathRel") @Nullable String sourcePathRel,
			@JsonProperty("destPathRel") @Nullable String destPathRel) {
	}

}
