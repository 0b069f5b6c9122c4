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
 * Indicates that a deployment stack operation reached a terminal state other than success, such as a rollback.
 */
public class StackOperationException extends CloudOperationException {

	private static final long serialVersionUID = 1L;

	private final String stackId;

	/** @return The identifier of the stack being operated on. */
	public String getStackId() {
		return stackId;
	}

	private final String stackStatus;

	/** @return The terminal status the stack reached. */
	public String getStackStatus() {
		return stackStatus;
	}

	/**
	 * Stack and status constructor.
	 * @param stackId The identifier of the stack being operated on.
	 * @param stackStatus The terminal status the stack reached.
	 * @param message An explanation of the problem, or <code>null</code> if no message should be used.
	 */
	public StackOperationException(@Nonnull final String stackId, @Nonnull final String stackStatus, @Nullable final String message) {
		super(message);
		this.stackId = requireNonNull(stackId);
		this.stackStatus = requireNonNull(stackStatus);
	}

}
