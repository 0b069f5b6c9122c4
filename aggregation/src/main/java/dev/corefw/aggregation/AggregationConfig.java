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

import java.time.Duration;
import java.util.*;

import javax.annotation.*;

import com.fasterxml.jackson.annotation.*;

import dev.corefw.*;
import dev.corefw.cloud.aws.CorefwPlatformAws;

/**
 * The configuration of the Service Aggregator, loaded from {@value #CONFIG_PATH} in the service root.
 * <p>
 * An example configuration:
 * </p>
 *
 * <pre>{@code
 * MetaSourceBucket:
 *   bucket: my-meta-bucket
 *   rootPath: services/
 *   awsRegion: us-east-1
 * FacadeApi:
 *   name: my-api-${gitBranch}
 *   cfStackName: my-api-facade-${gitBranch}
 * StackPolling:
 *   intervalSeconds: 5
 *   maxAttempts: 30
 * }</pre>
 * @param metaSourceBucket The object storage location of the service metadata.
 * @param facadeApi The API facade to generate.
 * @param stackPolling The deployment stack polling settings.
 */
public record AggregationConfig(@Nonnull MetaSourceBucket metaSourceBucket, @Nonnull FacadeApi facadeApi, @Nonnull StackPolling stackPolling) {

	/** The location of the configuration file, relative to the service root. */
	public static final String CONFIG_PATH = "config/aggregation-config.yml";

	/**
	 * Constructor.
	 * @param metaSourceBucket The object storage location of the service metadata.
	 * @param facadeApi The API facade to generate.
	 * @param stackPolling The deployment stack polling settings, or <code>null</code> to use the defaults.
	 * @throws ConfigurationException if a required section is missing.
	 */
	@JsonCreator
	public AggregationConfig(@JsonProperty("MetaSourceBucket") final MetaSourceBucket metaSourceBucket, @JsonProperty("FacadeApi") final FacadeApi facadeApi,
			@JsonProperty("StackPolling") @Nullable final StackPolling stackPolling) {
		if(metaSourceBucket == null) {
			throw new ConfigurationException("Missing `MetaSourceBucket` section in `%s`.".formatted(CONFIG_PATH));
		}
		if(facadeApi == null) {
			throw new ConfigurationException("Missing `FacadeApi` section in `%s`.".formatted(CONFIG_PATH));
		}
		this.metaSourceBucket = metaSourceBucket;
		this.facadeApi = facadeApi;
		this.stackPolling = stackPolling != null ? stackPolling : StackPolling.DEFAULT;
	}

	/**
	 * Loads the aggregation configuration of a service project, substituting the common global variables.
	 * @param project The service project.
	 * @return The loaded configuration.
	 * @throws ConfigurationException if the configuration file is missing, unreadable or invalid.
	 */
	public static AggregationConfig load(@Nonnull final ServiceProject project) {
		return fromTree(project.loadConfigFile(CONFIG_PATH));
	}

	/**
	 * Creates a configuration from an already loaded configuration tree.
	 * @param tree The configuration tree, with variables already substituted.
	 * @return The configuration.
	 * @throws ConfigurationException if the configuration is invalid.
	 */
	public static AggregationConfig fromTree(@Nonnull final Map<String, Object> tree) {
		try {
			return Marshalling.convertValue(tree, AggregationConfig.class);
		} catch(final IllegalArgumentException illegalArgumentException) {
			for(Throwable cause = illegalArgumentException.getCause(); cause != null; cause = cause.getCause()) {
				if(cause instanceof ConfigurationException configurationException) { //thrown from a record constructor
					throw configurationException;
				}
			}
			throw new ConfigurationException("Invalid configuration in `%s`: %s".formatted(CONFIG_PATH, illegalArgumentException.getMessage()),
					illegalArgumentException);
		}
	}

	/**
	 * The object storage location of the service metadata.
	 * @param bucket The bucket name.
	 * @param rootPath The key prefix of the service directories, normalized to have no leading slash and, unless empty, a single trailing slash.
	 * @param awsRegion The AWS region of the bucket, and of the functions and stack to manage.
	 */
	public record MetaSourceBucket(@Nonnull String bucket, @Nonnull String rootPath, @Nonnull String awsRegion) {

		/**
		 * Constructor.
		 * @param bucket The bucket name.
		 * @param rootPath The key prefix of the service directories, or <code>null</code> for the bucket root.
		 * @param awsRegion The AWS region, or <code>null</code> for {@value CorefwPlatformAws#DEFAULT_REGION}.
		 * @throws ConfigurationException if the bucket is missing.
		 */
		@JsonCreator
		public MetaSourceBucket(@JsonProperty("bucket") final String bucket, @JsonProperty("rootPath") @Nullable final String rootPath,
				@JsonProperty("awsRegion") @Nullable final String awsRegion) {
			if(bucket == null || bucket.isBlank()) {
				throw new ConfigurationException("Missing `MetaSourceBucket.bucket` in `%s`.".formatted(CONFIG_PATH));
			}
			this.bucket = bucket;
			this.rootPath = normalizeRootPath(rootPath != null ? rootPath : "");
			this.awsRegion = awsRegion != null ? awsRegion : CorefwPlatformAws.DEFAULT_REGION;
		}

		/**
		 * Normalizes a key prefix so that it has no leading slash, and exactly one trailing slash unless it is empty.
		 * @param rootPath The root path to normalize.
		 * @return The normalized root path.
		 */
		static String normalizeRootPath(@Nonnull final String rootPath) {
			int begin = 0;
			int end = rootPath.length();
			while(begin < end && rootPath.charAt(begin) == '/') {
				begin++;
			}
			while(end > begin && rootPath.charAt(end - 1) == '/') {
				end--;
			}
			return begin == end ? "" : rootPath.substring(begin, end) + "/";
		}

	}

	/**
	 * The API facade to generate.
	 * @param name The name of the generated REST API.
	 * @param cfStackName The name of the deployment stack containing the API.
	 */
	public record FacadeApi(@Nonnull String name, @Nonnull String cfStackName) {

		/**
		 * Constructor.
		 * @param name The name of the generated REST API.
		 * @param cfStackName The name of the deployment stack containing the API.
		 * @throws ConfigurationException if a value is missing.
		 */
		@JsonCreator
		public FacadeApi(@JsonProperty("name") final String name, @JsonProperty("cfStackName") final String cfStackName) {
			if(name == null || name.isBlank()) {
				throw new ConfigurationException("Missing `FacadeApi.name` in `%s`.".formatted(CONFIG_PATH));
			}
			if(cfStackName == null || cfStackName.isBlank()) {
				throw new ConfigurationException("Missing `FacadeApi.cfStackName` in `%s`.".formatted(CONFIG_PATH));
			}
			this.name = name;
			this.cfStackName = cfStackName;
		}

	}

	/**
	 * Settings for polling a deployment stack while waiting for an operation to finish.
	 * @param intervalSeconds The delay before each status check.
	 * @param maxAttempts The maximum number of status checks.
	 */
	public record StackPolling(int intervalSeconds, int maxAttempts) {

		/** The default polling interval in seconds. */
		public static final int DEFAULT_INTERVAL_SECONDS = 5;

		/** The default maximum number of polling attempts. */
		public static final int DEFAULT_MAX_ATTEMPTS = 30;

		/** The default polling settings. */
		public static final StackPolling DEFAULT = new StackPolling(DEFAULT_INTERVAL_SECONDS, DEFAULT_MAX_ATTEMPTS);

		/**
		 * Constructor.
		 * @param intervalSeconds The delay before each status check, or <code>null</code> for the default.
		 * @param maxAttempts The maximum number of status checks, or <code>null</code> for the default.
		 * @throws ConfigurationException if a value is out of range.
		 */
		@JsonCreator
		public StackPolling(@JsonProperty("intervalSeconds") @Nullable final Integer intervalSeconds,
				@JsonProperty("maxAttempts") @Nullable final Integer maxAttempts) {
			this(intervalSeconds != null ? intervalSeconds.intValue() : DEFAULT_INTERVAL_SECONDS,
					maxAttempts != null ? maxAttempts.intValue() : DEFAULT_MAX_ATTEMPTS);
		}

		/**
		 * Canonical constructor.
		 * @param intervalSeconds The delay before each status check.
		 * @param maxAttempts The maximum number of status checks.
		 * @throws ConfigurationException if a value is out of range.
		 */
		public StackPolling {
			if(intervalSeconds < 0) {
				throw new ConfigurationException("`StackPolling.intervalSeconds` must not be negative; found %d.".formatted(intervalSeconds));
			}
			if(maxAttempts < 1) {
				throw new ConfigurationException("`StackPolling.maxAttempts` must be positive; found %d.".formatted(maxAttempts));
			}
		}

		/** @return The delay before each status check. */
		public Duration interval() {
			return Duration.ofSeconds(intervalSeconds);
		}

	}

}
