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

import java.util.*;
import java.util.concurrent.CompletableFuture;

import javax.annotation.*;

/**
 * Management of infrastructure deployment stacks, each created from a declarative template.
 */
public interface StackService {

	/**
	 * Describes the stacks with the given name or identifier.
	 * @param stackNameOrId The name or unique identifier of the stack.
	 * @return A future list of matching stacks, which will be empty if no such stack exists.
	 */
	CompletableFuture<List<StackRecord>> describeStacks(@Nonnull String stackNameOrId);

	/**
	 * Initiates creation of a new stack.
	 * @param stackName The name of the stack to create.
	 * @param templateBody The serialized template.
	 * @param tags Tags to apply to the stack.
	 * @return A future of the identifier of the stack being created.
	 */
	CompletableFuture<String> createStack(@Nonnull String stackName, @Nonnull String templateBody, @Nonnull Map<String, String> tags);

	/**
	 * Initiates an update of an existing stack.
	 * @param stackId The identifier of the stack to update.
	 * @param templateBody The serialized template.
	 * @return A future of the identifier of the stack being updated.
	 */
	CompletableFuture<String> updateStack(@Nonnull String stackId, @Nonnull String templateBody);

	/**
	 * A description of a deployment stack.
	 * @param stackId The unique identifier of the stack.
	 * @param stackName The name of the stack.
	 * @param status The current status of the stack, such as <code>CREATE_COMPLETE</code>.
	 */
	record StackRecord(@Nonnull String stackId, @Nonnull String stackName, @Nonnull String status) {
	}

}
