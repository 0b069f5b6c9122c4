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

package dev.corefw.cloud.aws;

import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.*;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.*;
import org.mockito.junit.jupiter.MockitoExtension;

import dev.corefw.Corefw;
import dev.corefw.cloud.FunctionRecord;
import dev.corefw.cloud.FunctionRegistry.FunctionPage;
import software.amazon.awssdk.services.lambda.LambdaAsyncClient;
import software.amazon.awssdk.services.lambda.model.EnvironmentResponse;
import software.amazon.awssdk.services.lambda.model.FunctionConfiguration;
import software.amazon.awssdk.services.lambda.model.ListFunctionsRequest;
import software.amazon.awssdk.services.lambda.model.ListFunctionsResponse;

/**
 * Tests of {@link AwsLambdaFunctionRegistry}.
 */
@ExtendWith(MockitoExtension.class)
public class AwsLambdaFunctionRegistryTest {

	private static final String HASH = "0123456789abcdef0123456789abcdef";

	@Mock
	LambdaAsyncClient lambdaClient;

	@Test
	void testToFunctionRecordReadsEnvironment() {
		final FunctionConfiguration function = FunctionConfiguration.builder().functionArn("arn:aws:lambda:us-east-1:123:function:users-get")
				.functionName("users-get")
				.environment(EnvironmentResponse.builder().variables(Map.of(Corefw.ENV_VERSION_HASH, HASH, Corefw.ENV_SERVICE_BRANCH, "master")).build()).build();
		assertThat(AwsLambdaFunctionRegistry.toFunctionRecord(function), is(new FunctionRecord("arn:aws:lambda:us-east-1:123:function:users-get", "users-get",
				Optional.of(HASH), Optional.of("master"))));
	}

	@Test
	void testToFunctionRecordWithoutEnvironment() {
		final FunctionConfiguration function = FunctionConfiguration.builder().functionArn("arn").functionName("bare").build();
		assertThat(AwsLambdaFunctionRegistry.toFunctionRecord(function), is(new FunctionRecord("arn", "bare", Optional.empty(), Optional.empty())));
	}

	@Test
	void testListFunctionsPassesMarker() {
		final ListFunctionsResponse response = ListFunctionsResponse.builder()
				.functions(FunctionConfiguration.builder().functionArn("arn").functionName("fn").build()).nextMarker("page3").build();
		when(lambdaClient.listFunctions(any(ListFunctionsRequest.class))).thenReturn(CompletableFuture.completedFuture(response));
		final FunctionPage page = new AwsLambdaFunctionRegistry(lambdaClient).listFunctions(50, "page2").join();
		assertThat(page.functions(), hasSize(1));
		assertThat(page.nextMarker(), is(Optional.of("page3")));
		final ArgumentCaptor<ListFunctionsRequest> requestCaptor = ArgumentCaptor.forClass(ListFunctionsRequest.class);
		verify(lambdaClient).listFunctions(requestCaptor.capture());
		assertThat(requestCaptor.getValue().maxItems(), is(50));
		assertThat(requestCaptor.getValue().marker(), is("page2"));
	}

}
