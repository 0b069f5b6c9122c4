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

package dev.corefw.cloud;

import static java.util.Objects.*;

import java.util.Optional;

import javax.annotation.*;

/**
 * Information about a single deployed compute function.
 * @param functionArn The Amazon Resource Name (or equivalent provider identifier) of the function.
 * @param functionName The name of the function.
 * @param versionHash The version hash from the function environment, if present.
 * @param branch The Git branch from which the function was deployed, if present in the function environment.
 */
public record FunctionRecord(@Nonnull String functionArn, @Nonnull String functionName, @Nonnull Optional<String> versionHash,
		@Nonnull Optional<String> branch) {

	/**
	 * Constructor.
	 * @param functionArn The Amazon Resource Name (or equivalent provider identifier) of the function.
	 * @param functionName The name of the function.
	 * @param versionHash The version hash from the function environment, if present.
	 * @param branch The Git branch from which the function was deployed, if present in the function environment.
	 */
	public FunctionRecord {
		requireNonNull(functionArn);
		requireNonNull(functionName);
		requireNonNull(versionHash);
		requireNonNull(branch);
	}

}
