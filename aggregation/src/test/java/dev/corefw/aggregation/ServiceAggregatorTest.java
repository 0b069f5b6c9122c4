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

import static dev.corefw.aggregation.FakeFunctionRegistry.function;
import static java.nio.charset.StandardCharsets.*;
import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import java.io.*;
import java.nio.file.*;
import java.time.*;
import java.util.*;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import dev.corefw.*;
import dev.corefw.cloud.StackTimeoutException;

/**
 * Tests of {@link ServiceAggregator} running against in-memory cloud services.
 */
public class ServiceAggregatorTest {

	static final String BUCKET = "meta-bucket";

	static final String HASH_USERS = "0123456789ABCDEF0123456789ABCDEF";

	static final String HASH_BILLING = "fedcba9876543210fedcba9876543210";

	static final Clock CLOCK = Clock.fixed(Instant.parse("2023-07-04T09:05:07.042Z"), ZoneOffset.UTC);

	@TempDir
	Path rootPath;

	private ServiceProject project;

	private AggregationConfig config;

	private InMemoryObjectStorage objectStorage;

	private FakeFunctionRegistry functionRegistry;

	@BeforeEach
	void setUp() throws IOException {
		Files.writeString(rootPath.resolve(ServiceProject.PACKAGE_FILENAME), "{\"name\":\"sls-service-aggregator\",\"version\":\"2.1.0\"}", UTF_8);
		project = ServiceProject.load(rootPath, null, Map.of(Corefw.ENV_GIT_BRANCH, "develop"));
		config = new AggregationConfig(new AggregationConfig.MetaSourceBucket(BUCKET, "services", null),
				new AggregationConfig.FacadeApi("api-develop", "api-facade-develop"), new AggregationConfig.StackPolling(0, 5));
		objectStorage = new InMemoryObjectStorage().putString(BUCKET, "services/users/latest/serverless.json", """
				{"service": "users", "functions": {
				  "getUser": {"name": "users-develop-getUser", "environment": {"COREFW_VERSION_HASH": "%s"},
				    "events": [{"http": {"path": "users/{id}", "method": "get", "integration": "lambda-proxy"}}]}
				}}
				""".formatted(HASH_USERS));
		functionRegistry = new FakeFunctionRegistry(
				List.of(function("users-develop-getUser", HASH_USERS, "develop"), function("users-master-getUser", HASH_USERS, "master")));
	}

	@Test
	void testExecuteCreatesFacadeStack() {
		final FakeStackService stackService = new FakeStackService().thenStates("CREATE_COMPLETE");
		final String stackId = new ServiceAggregator(project, config, objectStorage, functionRegistry, stackService, CLOCK).execute().join();
		assertThat(stackId, is(stackService.stackId));
		assertThat(stackService.stackName, is("api-facade-develop"));
		assertThat(stackService.lastTags, is(StackReconciler.FACADE_STACK_TAGS));
		@SuppressWarnings("unchecked")
		final Map<String, Object> template = (Map<String, Object>)Marshalling.readJsonTree(stackService.lastTemplateBody);
		final Map<String, Object> resources = ResourceGraphAssembler.getResources(template);
		assertThat(resources.keySet(), containsInAnyOrder("ApiGatewayRestApi", "AagResourceUsers", "AagResourceUsersIdVar", "AagMethodUsersIdVarGet",
				"UsersDevelopGetUserAagPerms", "AagDeployment2023070409057042"));
	}

	/** A service whose functions are deployed only on another branch contributes path resources but no methods or permissions. */
	@Test
	void testExecuteSkipsEndpointsOfOtherBranches() {
		objectStorage.putString(BUCKET, "services/billing/latest/serverless.json", """
				{"service": "billing", "functions": {
				  "createInvoice": {"name": "billing-master-createInvoice", "environment": {"COREFW_VERSION_HASH": "%s"},
				    "events": [{"http": {"path": "invoices", "method": "post", "integration": "lambda-proxy"}}]}
				}}
				""".formatted(HASH_BILLING));
		functionRegistry = new FakeFunctionRegistry(List.of(function("users-develop-getUser", HASH_USERS, "develop"),
				function("billing-master-createInvoice", HASH_BILLING, "master")));
		final FakeStackService stackService = new FakeStackService().thenStates("CREATE_COMPLETE");
		new ServiceAggregator(project, config, objectStorage, functionRegistry, stackService, CLOCK).execute().join();
		@SuppressWarnings("unchecked")
		final Map<String, Object> template = (Map<String, Object>)Marshalling.readJsonTree(stackService.lastTemplateBody);
		final Map<String, Object> resources = ResourceGraphAssembler.getResources(template);
		assertThat(resourceNamesOfType(resources, "AWS::ApiGateway::Method"), contains("AagMethodUsersIdVarGet"));
		assertThat(resourceNamesOfType(resources, "AWS::Lambda::Permission"), contains("UsersDevelopGetUserAagPerms"));
		assertThat(resources, hasKey("AagResourceInvoices"));
		assertThat(resources, not(hasKey("AagMethodInvoicesPost")));
		assertThat(resources, not(hasKey("BillingMasterCreateInvoiceAagPerms")));
	}

	static List<String> resourceNamesOfType(final Map<String, Object> resources, final String type) {
		final List<String> names = new ArrayList<>();
		resources.forEach((name, resource) -> {
			if(resource instanceof Map<?, ?> resourceObject && type.equals(resourceObject.get("Type"))) {
				names.add(name);
			}
		});
		return names;
	}

	@Test
	void testExecuteUpdatesExistingFacadeStack() {
		final String existingStackId = "arn:aws:cloudformation:us-east-1:123456789012:stack/api-facade-develop/0";
		final FakeStackService stackService = new FakeStackService().withExistingStack(existingStackId, "api-facade-develop", "CREATE_COMPLETE")
				.thenStates("UPDATE_COMPLETE");
		assertThat(new ServiceAggregator(project, config, objectStorage, functionRegistry, stackService, CLOCK).execute().join(), is(existingStackId));
		assertThat(stackService.updateCount, is(1));
		assertThat(stackService.createCount, is(0));
	}

	@Test
	void testExecuteFailsOnStackTimeout() {
		final FakeStackService stackService = new FakeStackService().thenStates("CREATE_IN_PROGRESS");
		final CompletionException completionException = assertThrows(CompletionException.class,
				() -> new ServiceAggregator(project, config, objectStorage, functionRegistry, stackService, CLOCK).execute().join());
		assertThat(completionException.getCause(), is(instanceOf(StackTimeoutException.class)));
	}

}
