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

package dev.corefw.aggregation;

import static com.globalmentor.java.Conditions.*;
import static java.util.Objects.*;
import static java.util.concurrent.TimeUnit.*;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;

import javax.annotation.*;

import dev.corefw.*;
import dev.corefw.cloud.*;
import dev.corefw.cloud.StackService.StackRecord;
import io.clogr.Clogged;

/**
 * Creates or updates a deployment stack from a template, and waits for the operation to finish.
 */
public class StackReconciler implements Clogged {

	/** The status of a successfully created stack. */
	public static final String CREATE_COMPLETE = "CREATE_COMPLETE";

	/** The status of a successfully updated stack. */
	public static final String UPDATE_COMPLETE = "UPDATE_COMPLETE";

	/** The terminal states of a stack creation. */
	public static final Set<String> CREATE_TERMINAL_STATES = Set.of(CREATE_COMPLETE, "CREATE_FAILED", "ROLLBACK_COMPLETE", "ROLLBACK_FAILED");

	/** The terminal states of a stack update. */
	public static final Set<String> UPDATE_TERMINAL_STATES = Set.of(UPDATE_COMPLETE, "UPDATE_ROLLBACK_COMPLETE", "ROLLBACK_COMPLETE", "ROLLBACK_FAILED",
			"UPDATE_ROLLBACK_FAILED");

	/** The tags applied to a newly created facade stack. */
	public static final Map<String, String> FACADE_STACK_TAGS = Map.of(Corefw.TAG_IS_FACADE, "yes");

	private final StackService stackService;

	private final Duration pollInterval;

	private final int maxAttempts;

	/**
	 * Constructor.
	 * @param stackService The service managing deployment stacks.
	 * @param pollInterval The delay before each status check.
	 * @param maxAttempts The maximum number of status checks.
	 */
	public StackReconciler(@Nonnull final StackService stackService, @Nonnull final Duration pollInterval, final int maxAttempts) {
		this.stackService = requireNonNull(stackService);
		this.pollInterval = requireNonNull(pollInterval);
		checkArgument(maxAttempts >= 1, "Maximum number of stack polling attempts must be positive; found %d.", maxAttempts);
		this.maxAttempts = maxAttempts;
	}

	/**
	 * Deploys a template, creating the named stack if it does not exist or updating it otherwise.
	 * @param stackName The name of the stack.
	 * @param template The template to deploy.
	 * @return A future of the identifier of the deployed stack, which completes exceptionally with a {@link StackOperationException} if the stack does not
	 *         reach a successful state, or with a {@link StackTimeoutException} if it does not reach a terminal state in time.
	 */
	public CompletableFuture<String> deploy(@Nonnull final String stackName, @Nonnull final Map<String, Object> template) {
		final String templateBody = Marshalling.toJson(template);
		return stackService.describeStacks(stackName).thenCompose(stacks -> {
			if(stacks.isEmpty()) {
				return createStack(stackName, templateBody);
			}
			return updateStack(stacks.get(0).stackId(), templateBody);
		});
	}

	private CompletableFuture<String> createStack(@Nonnull final String stackName, @Nonnull final String templateBody) {
		getLogger().info("Creating stack `{}`.", stackName);
		return stackService.createStack(stackName, templateBody, FACADE_STACK_TAGS).thenCompose(stackId -> {
			getLogger().info("Stack `{}` is being created; waiting for completion.", stackId);
			return waitForStates(stackId, CREATE_TERMINAL_STATES).thenApply(status -> {
				if(!CREATE_COMPLETE.equals(status)) {
					throw new StackOperationException(stackId, status, "Creation of stack `%s` failed with status `%s`.".formatted(stackId, status));
				}
				getLogger().info("Stack `{}` has been created successfully.", stackId);
				return stackId;
			});
		});
	}

	private CompletableFuture<String> updateStack(@Nonnull final String stackId, @Nonnull final String templateBody) {
		getLogger().info("Updating stack `{}`.", stackId);
		return stackService.updateStack(stackId, templateBody).thenCompose(updatedStackId -> {
			getLogger().info("Stack `{}` is updating; waiting for completion.", stackId);
			return waitForStates(stackId, UPDATE_TERMINAL_STATES).thenApply(status -> {
				if(!UPDATE_COMPLETE.equals(status)) {
					throw new StackOperationException(stackId, status, "Update of stack `%s` failed with status `%s`.".formatted(stackId, status));
				}
				getLogger().info("Stack `{}` has been updated successfully.", stackId);
				return stackId;
			});
		});
	}

	/**
	 * Polls a stack until it reaches one of the given states, waiting for the poll interval before each check.
	 * @param stackId The identifier of the stack.
	 * @param acceptStates The states to wait for.
	 * @return A future of the state reached, which completes exceptionally with a {@link StackTimeoutException} if no accepted state is reached within the
	 *         maximum number of attempts.
	 */
	public CompletableFuture<String> waitForStates(@Nonnull final String stackId, @Nonnull final Set<String> acceptStates) {
		return waitForStates(stackId, acceptStates, 1);
	}

	private CompletableFuture<String> waitForStates(@Nonnull final String stackId, @Nonnull final Set<String> acceptStates, final int attempt) {
		final Executor delayedExecutor = CompletableFuture.delayedExecutor(pollInterval.toMillis(), MILLISECONDS);
		return CompletableFuture.supplyAsync(() -> stackId, delayedExecutor).thenCompose(stackService::describeStacks).thenCompose(stacks -> {
			final StackRecord stack = stacks.stream().findFirst()
					.orElseThrow(() -> new CloudOperationException("Stack `%s` disappeared while waiting for its status.".formatted(stackId)));
			if(acceptStates.contains(stack.status())) {
				return CompletableFuture.completedFuture(stack.status());
			}
			if(attempt >= maxAttempts) {
				throw new StackTimeoutException(stackId, attempt);
			}
			getLogger().debug("Stack `{}` has status `{}`; still waiting.", stackId, stack.status());
			return waitForStates(stackId, acceptStates, attempt + 1);
		});
	}

}
