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

import javax.annotation.*;

/**
 * Indicates that a deployment stack did not reach any of the awaited states within the allowed number of polling attempts.
 * @apiNote This is distinct from a {@link StackOperationException}; the stack operation may still be in progress.
 */
public class StackTimeoutException extends CloudOperationException {

	private static final long serialVersionUID = 1L;

	private final String stackId;

	/** @return The identifier of the stack being waited on. */
	public String getStackId() {
		return stackId;
	}

	private final int attemptCount;

	/** @return The number of polling attempts made. */
	public int getAttemptCount() {
		return attemptCount;
	}

	/**
	 * Stack and attempts constructor.
	 * @param stackId The identifier of the stack being waited on.
	 * @param attemptCount The number of polling attempts made.
	 */
	public StackTimeoutException(@Nonnull final String stackId, final int attemptCount) {
		super("Timeout while waiting for the status of stack `%s` after %d attempts.".formatted(stackId, attemptCount));
		this.stackId = requireNonNull(stackId);
		this.attemptCount = attemptCount;
	}

}
