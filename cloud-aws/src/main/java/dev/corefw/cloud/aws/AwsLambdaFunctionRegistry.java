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

import static dev.corefw.cloud.aws.CorefwPlatformAws.*;
import static java.util.Objects.*;
import static java.util.stream.Collectors.*;

import java.util.*;
import java.util.concurrent.CompletableFuture;

import javax.annotation.*;

import dev.corefw.Corefw;
import dev.corefw.cloud.*;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.lambda.LambdaAsyncClient;
import software.amazon.awssdk.services.lambda.model.*;

/**
 * A registry of the functions deployed to <a href="https://aws.amazon.com/lambda/">AWS Lambda</a>.
 * @implNote The version hash and branch of each function are read from its {@value Corefw#ENV_VERSION_HASH} and {@value Corefw#ENV_SERVICE_BRANCH}
 *           environment variables.
 */
public class AwsLambdaFunctionRegistry implements FunctionRegistry {

	private final LambdaAsyncClient lambdaClient;

	/** @return The client for communicating with AWS Lambda. */
	protected LambdaAsyncClient getLambdaClient() {
		return lambdaClient;
	}

	/**
	 * Client constructor.
	 * @param lambdaClient The client for communicating with AWS Lambda.
	 */
	public AwsLambdaFunctionRegistry(@Nonnull final LambdaAsyncClient lambdaClient) {
		this.lambdaClient = requireNonNull(lambdaClient);
	}

	/**
	 * Creates a registry of the functions in the given region, using the default credentials provider chain.
	 * @param awsRegion The AWS region identifier, such as <code>us-east-1</code>.
	 * @return A new function registry for the region.
	 */
	public static AwsLambdaFunctionRegistry forRegion(@Nonnull final String awsRegion) {
		return new AwsLambdaFunctionRegistry(LambdaAsyncClient.builder().region(Region.of(awsRegion)).build());
	}

	@Override
	public CompletableFuture<FunctionPage> listFunctions(final int pageSize, final String marker) {
		final ListFunctionsRequest request = ListFunctionsRequest.builder().maxItems(pageSize).marker(marker).build();
		return getLambdaClient().listFunctions(request).handle((response, throwable) -> {
			if(throwable != null) {
				throw toCloudOperationException("Lambda::ListFunctions", throwable);
			}
			return new FunctionPage(response.functions().stream().map(AwsLambdaFunctionRegistry::toFunctionRecord).collect(toList()),
					Optional.ofNullable(response.nextMarker()));
		});
	}

	/**
	 * Converts an AWS Lambda function configuration to a function record.
	 * @param function The function configuration.
	 * @return A record of the function.
	 */
	static FunctionRecord toFunctionRecord(@Nonnull final FunctionConfiguration function) {
		final Map<String, String> environmentVariables = Optional.ofNullable(function.environment()).filter(EnvironmentResponse::hasVariables)
				.map(EnvironmentResponse::variables).orElse(Map.of());
		return new FunctionRecord(function.functionArn(), function.functionName(), Optional.ofNullable(environmentVariables.get(Corefw.ENV_VERSION_HASH)),
				Optional.ofNullable(environmentVariables.get(Corefw.ENV_SERVICE_BRANCH)));
	}

}
