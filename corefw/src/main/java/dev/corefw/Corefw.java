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

/**
 * Definitions shared by CoreFW services and tooling.
 */
public class Corefw {

	/**
	 * The function environment variable holding the 32-character hexadecimal version hash that correlates a deployed function with the service metadata
	 * that declared it.
	 */
	public static final String ENV_VERSION_HASH = "COREFW_VERSION_HASH";

	/** The function environment variable holding the Git branch from which a service was deployed. */
	public static final String ENV_SERVICE_BRANCH = "COREFW_SERVICE_BRANCH";

	/** The required length of a version hash. */
	public static final int VERSION_HASH_LENGTH = 32;

	/** The stack tag marking a deployment stack as an aggregated API facade. */
	public static final String TAG_IS_FACADE = "COREFW_IS_FACADE";

	/** The environment variable that may explicitly provide the Git branch. */
	public static final String ENV_GIT_BRANCH = "GIT_BRANCH";

	/** The CI environment variable that may provide the Git branch if {@value #ENV_GIT_BRANCH} is not set. */
	public static final String ENV_TRAVIS_BRANCH = "TRAVIS_BRANCH";

	/**
	 * Determines whether the given value is usable as a version hash: a string of exactly {@value #VERSION_HASH_LENGTH} characters.
	 * @apiNote No hexadecimal check is made, as functions are correlated by the hash string itself.
	 * @param value The value to check, which may be <code>null</code> or of any type.
	 * @return <code>true</code> if the value is a string of the version hash length.
	 */
	public static boolean isVersionHash(final Object value) {
		return value instanceof String string && string.length() == VERSION_HASH_LENGTH;
	}

}
