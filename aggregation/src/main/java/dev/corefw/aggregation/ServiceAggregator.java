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

import static java.util.Objects.*;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.CompletableFuture;

import javax.annotation.*;

import dev.corefw.*;
import dev.corefw.cloud.*;
import dev.corefw.cloud.aws.*;
import io.clogr.Clogged;

/**
 * Aggregates the HTTP endpoints of all services published to a metadata bucket into a single API facade, deployed as a stack.
 * <p>
 * Aggregation proceeds in stages: the service metadata is fetched; the endpoint map is built from the Serverless specifications; the functions deployed
 * from the current Git branch are retrieved; the facade template is assembled; and finally the facade stack is created or updated.
 * </p>
 */
public class ServiceAggregator implements Clogged {

	private final ServiceProject project;

	/** @return The project of the service running the aggregation. */
	public ServiceProject getProject() {
		return project;
	}

	private final AggregationConfig config;

	/** @return The aggregation configuration. */
	public AggregationConfig getConfig() {
		return config;
	}

	private final ServiceMetadataFetcher serviceMetadataFetcher;

	private final FunctionRegistryFetcher functionRegistryFetcher;

	private final EndpointGraphBuilder endpointGraphBuilder;

	private final ResourceGraphAssembler resourceGraphAssembler;

	private final StackReconciler stackReconciler;

	/**
	 * Constructor.
	 * @param project The project of the service running the aggregation.
	 * @param config The aggregation configuration.
	 * @param objectStorage Access to the metadata bucket.
	 * @param functionRegistry The registry of deployed functions.
	 * @param stackService The service managing deployment stacks.
	 * @param clock The clock providing the time of generation.
	 */
	public ServiceAggregator(@Nonnull final ServiceProject project, @Nonnull final AggregationConfig config, @Nonnull final ObjectStorage objectStorage,
			@Nonnull final FunctionRegistry functionRegistry, @Nonnull final StackService stackService, @Nonnull final Clock clock) {
		this.project = requireNonNull(project);
		this.config = requireNonNull(config);
		this.serviceMetadataFetcher = new ServiceMetadataFetcher(objectStorage);
		this.functionRegistryFetcher = new FunctionRegistryFetcher(functionRegistry);
		this.endpointGraphBuilder = new EndpointGraphBuilder();
		this.resourceGraphAssembler = new ResourceGraphAssembler(clock);
		this.stackReconciler = new StackReconciler(stackService, config.stackPolling().interval(), config.stackPolling().maxAttempts());
	}

	/**
	 * Creates an aggregator for a service project, loading its configuration and using AWS in the configured region.
	 * @param project The project of the service running the aggregation.
	 * @return A new aggregator.
	 * @throws ConfigurationException if the aggregation configuration is missing or invalid.
	 */
	public static ServiceAggregator forProject(@Nonnull final ServiceProject project) {
		final AggregationConfig config = AggregationConfig.load(project);
		final String awsRegion = config.metaSourceBucket().awsRegion();
		return new ServiceAggregator(project, config, AwsS3ObjectStorage.forRegion(awsRegion), AwsLambdaFunctionRegistry.forRegion(awsRegion),
				AwsCloudFormationStackService.forRegion(awsRegion), Clock.systemDefaultZone());
	}

	/**
	 * Runs the aggregation.
	 * @return A future of the identifier of the deployed facade stack.
	 */
	public CompletableFuture<String> execute() {
		getLogger().info("The Service Aggregator is starting for branch `{}`.", project.getGitBranch());
		final AggregationConfig.MetaSourceBucket source = config.metaSourceBucket();
		return serviceMetadataFetcher.fetchServiceBundles(source.bucket(), source.rootPath()).thenApply(endpointGraphBuilder::buildEndpointMap)
				.thenCompose(endpointMap -> functionRegistryFetcher.getRelevantFunctions(project.getGitBranch())
						.thenApply(functions -> resourceGraphAssembler.assemble(endpointMap, functions, config.facadeApi().name(), project.getCommonGlobalVariables())))
				.thenCompose(template -> stackReconciler.deploy(config.facadeApi().cfStackName(), template)).whenComplete((stackId, throwable) -> {
					if(throwable == null) {
						getLogger().info("The API facade has been deployed to stack `{}`.", stackId);
					} else {
						getLogger().error("The Service Aggregator failed.", CorefwPlatformAws.unwrap(throwable));
					}
				});
	}

	/**
	 * Runs the aggregation for the service in the working directory, waiting for it to finish.
	 * @param args The command-line arguments; an optional path to the service root.
	 */
	public static void main(@Nonnull final String[] args) {
		final ServiceProject project = ServiceProject.load(Path.of(args.length > 0 ? args[0] : "."));
		forProject(project).execute().join();
	}

}
