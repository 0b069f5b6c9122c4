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

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.*;

import dev.corefw.*;
import dev.corefw.cloud.*;

/**
 * Tests of {@link StackReconciler}.
 */
public class StackReconcilerTest {

	static final String STACK_NAME = "facade-develop";

	static final String STACK_ID = "arn:aws:cloudformation:us-east-1:123456789012:stack/facade-develop/0";

	static final Map<String, Object> TEMPLATE = Map.of("Resources", Map.of());

	@Test
	void testCreatesMissingStack() {
		final FakeStackService stackService = new FakeStackService().thenStates("CREATE_IN_PROGRESS", "CREATE_IN_PROGRESS", "CREATE_COMPLETE");
		final String stackId = new StackReconciler(stackService, Duration.ZERO, 5).deploy(STACK_NAME, TEMPLATE).join();
		assertThat(stackId, is("arn:aws:cloudformation:us-east-1:123456789012:stack/facade-develop/1"));
		assertThat(stackService.createCount, is(1));
		assertThat(stackService.updateCount, is(0));
		assertThat(stackService.lastTags, is(Map.of(Corefw.TAG_IS_FACADE, "yes")));
		assertThat(Marshalling.readJsonTree(stackService.lastTemplateBody), is(TEMPLATE));
	}

	@Test
	void testUpdatesExistingStack() {
		final FakeStackService stackService = new FakeStackService().withExistingStack(STACK_ID, STACK_NAME, "CREATE_COMPLETE")
				.thenStates("UPDATE_IN_PROGRESS", "UPDATE_COMPLETE_CLEANUP_IN_PROGRESS", "UPDATE_COMPLETE");
		final String stackId = new StackReconciler(stackService, Duration.ZERO, 5).deploy(STACK_NAME, TEMPLATE).join();
		assertThat(stackId, is(STACK_ID));
		assertThat(stackService.createCount, is(0));
		assertThat(stackService.updateCount, is(1));
		assertThat(stackService.lastTags, is(nullValue()));
	}

	@Test
	void testFailedCreation() {
		final FakeStackService stackService = new FakeStackService().thenStates("CREATE_IN_PROGRESS", "ROLLBACK_COMPLETE");
		final CompletionException completionException = assertThrows(CompletionException.class,
				() -> new StackReconciler(stackService, Duration.ZERO, 5).deploy(STACK_NAME, TEMPLATE).join());
		final StackOperationException stackOperationException = (StackOperationException)completionException.getCause();
		assertThat(stackOperationException.getStackStatus(), is("ROLLBACK_COMPLETE"));
		assertThat(stackOperationException.getStackId(), is(stackService.stackId));
	}

	@Test
	void testFailedUpdate() {
		final FakeStackService stackService = new FakeStackService().withExistingStack(STACK_ID, STACK_NAME, "UPDATE_COMPLETE")
				.thenStates("UPDATE_ROLLBACK_COMPLETE");
		final CompletionException completionException = assertThrows(CompletionException.class,
				() -> new StackReconciler(stackService, Duration.ZERO, 5).deploy(STACK_NAME, TEMPLATE).join());
		assertThat(completionException.getCause(), is(instanceOf(StackOperationException.class)));
	}

	/** A stack that never settles is checked exactly the maximum number of times. */
	@Test
	void testTimeout() {
		final FakeStackService stackService = new FakeStackService().thenStates("CREATE_IN_PROGRESS");
		final CompletionException completionException = assertThrows(CompletionException.class,
				() -> new StackReconciler(stackService, Duration.ZERO, 3).deploy(STACK_NAME, TEMPLATE).join());
		final StackTimeoutException stackTimeoutException = (StackTimeoutException)completionException.getCause();
		assertThat(stackTimeoutException.getAttemptCount(), is(3));
		assertThat(stackService.describeCount, is(1 + 3)); //the initial existence check plus each poll
	}

	@Test
	void testWaitForStatesReturnsFirstAcceptedState() {
		final FakeStackService stackService = new FakeStackService().withExistingStack(STACK_ID, STACK_NAME, "UPDATE_IN_PROGRESS").thenStates("UPDATE_IN_PROGRESS",
				"UPDATE_ROLLBACK_FAILED", "UPDATE_COMPLETE");
		assertThat(new StackReconciler(stackService, Duration.ZERO, 5).waitForStates(STACK_ID, StackReconciler.UPDATE_TERMINAL_STATES).join(),
				is("UPDATE_ROLLBACK_FAILED"));
	}

	@Test
	void testDisappearedStack() {
		final FakeStackService stackService = new FakeStackService();
		final CompletionException completionException = assertThrows(CompletionException.class,
				() -> new StackReconciler(stackService, Duration.ZERO, 5).waitForStates(STACK_ID, StackReconciler.CREATE_TERMINAL_STATES).join());
		assertThat(completionException.getCause(), is(instanceOf(CloudOperationException.class)));
	}

	@Test
	void testRejectsNonPositiveMaxAttempts() {
		assertThrows(IllegalArgumentException.class, () -> new StackReconciler(new FakeStackService(), Duration.ZERO, 0));
	}

}
