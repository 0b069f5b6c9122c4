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

import javax.annotation.*;

import dev.corefw.CorefwException;

/**
 * Indicates that an operation on a cloud provider failed, such as a storage, function registry or deployment stack call.
 * @apiNote The message identifies the remote operation that failed; the cause, if any, is the underlying provider exception.
 */
public class CloudOperationException extends CorefwException {

	private static final long serialVersionUID = 1L;

	/**
	 * Message constructor.
	 * @param message An explanation of the problem, or <code>null</code> if no message should be used.
	 */
	public CloudOperationException(@Nullable final String message) {
		this(message, null);
	}

	/**
	 * Cause constructor. The message of the cause will be used if available.
	 * @param cause The cause error or <code>null</code> if the cause is nonexistent or unknown.
	 */
	public CloudOperationException(@Nullable final Throwable cause) {
		this(cause == null ? null : cause.toString(), cause);
	}

	/**
	 * Message and cause constructor.
	 * @param message An explanation of the problem, or <code>null</code> if no message should be used.
	 * @param cause The cause error or <code>null</code> if the cause is nonexistent or unknown.
	 */
	public CloudOperationException(@Nullable final String message, @Nullable final Throwable cause) {
		super(message, cause);
	}

}
