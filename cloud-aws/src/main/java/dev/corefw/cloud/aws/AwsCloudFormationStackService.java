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

import dev.corefw.cloud.*;
import io.clogr.Clogged;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudformation.CloudFormationAsyncClient;
import software.amazon.awssdk.services.cloudformation.model.*;

/**
 * Deployment stacks managed by <a href="https://aws.amazon.com/cloudformation/">AWS CloudFormation</a>.
 */
public class AwsCloudFormationStackService implements StackService, Clogged {

	/** The text CloudFormation includes in the error message when describing a stack that does not exist. */
	static final String ERROR_MESSAGE_STACK_DOES_NOT_EXIST = "does not exist";

	private final CloudFormationAsyncClient cloudFormationClient;

	/** @return The client for communicating with CloudFormation. */
	protected CloudFormationAsyncClient getCloudFormationClient() {
		return cloudFormationClient;
	}

	/**
	 * Client constructor.
	 * @param cloudFormationClient The client for communicating with CloudFormation.
	 */
	public AwsCloudFormationStackService(@Nonnull final CloudFormationAsyncClient cloudFormationClient) {
		this.cloudFormationClient = requireNonNull(cloudFormationClient);
	}

	/**
	 * Creates a stack service for the given region, using the default credentials provider chain.
	 * @param awsRegion The AWS region identifier, such as <code>us-east-1</code>.
	 * @return A new stack service for the region.
	 */
	public static AwsCloudFormationStackService forRegion(@Nonnull final String awsRegion) {
		return new AwsCloudFormationStackService(CloudFormationAsyncClient.builder().region(Region.of(awsRegion)).build());
	}

	/**
	 * {@inheritDoc}
	 * @implNote CloudFormation reports a missing stack as a validation error rather than as an empty list; that error is converted to an empty list.
	 */
	@Override
	public CompletableFuture<List<StackRecord>> describeStacks(final String stackNameOrId) {
		final DescribeStacksRequest request = DescribeStacksRequest.builder().stackName(stackNameOrId).build();
		return getCloudFormationClient().describeStacks(request).handle((response, throwable) -> {
			if(throwable != null) {
				if(unwrap(throwable) instanceof CloudFormationException cloudFormationException && cloudFormationException.awsErrorDetails() != null
						&& String.valueOf(cloudFormationException.awsErrorDetails().errorMessage()).contains(ERROR_MESSAGE_STACK_DOES_NOT_EXIST)) {
					getLogger().atDebug().log("Stack `{}` does not exist.", stackNameOrId);
					return List.<StackRecord>of();
				}
				throw toCloudOperationException("CloudFormation::DescribeStacks of `%s`".formatted(stackNameOrId), throwable);
			}
			return response.stacks().stream().map(stack -> new StackRecord(stack.stackId(), stack.stackName(), stack.stackStatusAsString())).collect(toList());
		});
	}

	@Override
	public CompletableFuture<String> createStack(final String stackName, final String templateBody, final Map<String, String> tags) {
		final List<Tag> stackTags = tags.entrySet().stream().map(tag -> Tag.builder().key(tag.getKey()).value(tag.getValue()).build()).collect(toList());
		final CreateStackRequest request = CreateStackRequest.builder().stackName(stackName).templateBody(templateBody).tags(stackTags).build();
		return getCloudFormationClient().createStack(request).handle((response, throwable) -> {
			if(throwable != null) {
				throw toCloudOperationException("CloudFormation::CreateStack of `%s`".formatted(stackName), throwable);
			}
			return response.stackId();
		});
	}

	@Override
	public CompletableFuture<String> updateStack(final String stackId, final String templateBody) {
		final UpdateStackRequest request = UpdateStackRequest.builder().stackName(stackId).templateBody(templateBody).build();
		return getCloudFormationClient().updateStack(request).handle((response, throwable) -> {
			if(throwable != null) {
				throw toCloudOperationException("CloudFormation::UpdateStack of `%s`".formatted(stackId), throwable);
			}
			return Optional.ofNullable(response.stackId()).orElse(stackId);
		});
	}

}
