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

import java.nio.file.Path;
import java.util.*;

import javax.annotation.*;

import dev.corefw.ServiceProject;
import io.clogr.Clogged;

/**
 * Base class of the modules and targets taking part in a metadata deployment.
 * <p>
 * Each helper has a name, which defaults to the simple name of its class; giving helpers distinct names tells them apart in the log when the same type of
 * helper is used more than once.
 * </p>
 */
public abstract class MetaDeployHelper implements Clogged {

	/** The prefix of object keys that are treated as comments and never deployed. */
	public static final String COMMENT_KEY_PREFIX = "//";

	private final ServiceProject project;

	/** @return The project of the service being deployed. */
	public ServiceProject getProject() {
		return project;
	}

	private final String name;

	/** @return The name of this helper for logging. */
	public String getName() {
		return name;
	}

	/**
	 * Constructor.
	 * @param project The project of the service being deployed.
	 * @param name The name of this helper, or <code>null</code> to use the simple name of the class.
	 */
	protected MetaDeployHelper(@Nonnull final ServiceProject project, @Nullable final String name) {
		this.project = requireNonNull(project);
		this.name = name != null ? name : getClass().getSimpleName();
	}

	/**
	 * Resolves a path relative to the service root.
	 * @param localRelativePath The path relative to the service root; a leading slash is ignored.
	 * @return The absolute local path.
	 */
	public Path resolveLocalAbs(@Nonnull final String localRelativePath) {
		return project.resolve(DeployPaths.toRelative(localRelativePath));
	}

	/**
	 * Determines the path of a local file relative to the service root.
	 * @param localAbsolutePath The absolute local path.
	 * @return The slash-separated path relative to the service root.
	 */
	public String resolveServiceRel(@Nonnull final Path localAbsolutePath) {
		final Path relativePath = project.getRootPath().relativize(localAbsolutePath.toAbsolutePath().normalize());
		final StringJoiner pathJoiner = new StringJoiner(DeployPaths.SEPARATOR);
		relativePath.forEach(segment -> pathJoiner.add(segment.toString()));
		return pathJoiner.toString();
	}

	/**
	 * Returns a copy of a tree with all comment entries removed at every level, that is, object entries with keys starting with
	 * {@value #COMMENT_KEY_PREFIX}.
	 * @param tree The tree.
	 * @return A tree with no comment entries.
	 */
	public static Object withoutComments(@Nullable final Object tree) {
		if(tree instanceof Map<?, ?> map) {
			final Map<String, Object> result = new LinkedHashMap<>();
			map.forEach((key, value) -> {
				final String stringKey = String.valueOf(key);
				if(!stringKey.startsWith(COMMENT_KEY_PREFIX)) {
					result.put(stringKey, withoutComments(value));
				}
			});
			return result;
		}
		if(tree instanceof List<?> list) {
			final List<Object> result = new ArrayList<>(list.size());
			list.forEach(item -> result.add(withoutComments(item)));
			return result;
		}
		return tree;
	}

	@Override
	public String toString() {
		return name;
	}

}
