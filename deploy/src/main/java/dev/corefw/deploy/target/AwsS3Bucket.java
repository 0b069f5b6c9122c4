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

package dev.corefw.deploy.target;

import static java.util.Objects.*;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import javax.annotation.*;

import com.fasterxml.jackson.annotation.*;

import dev.corefw.*;
import dev.corefw.cloud.ObjectStorage;
import dev.corefw.cloud.aws.CorefwPlatformAws;
import dev.corefw.deploy.DeployPaths;

/**
 * A deploy target storing content in an S3 bucket under a root path.
 */
public class AwsS3Bucket extends MetaDeployTarget {

	/** The type of this target in the deployment configuration. */
	public static final String TYPE = "AwsS3Bucket";

	private final Settings settings;

	/** @return The configuration of this target. */
	public Settings getSettings() {
		return settings;
	}

	private final ObjectStorage objectStorage;

	/**
	 * Constructor.
	 * @param project The project of the service being deployed.
	 * @param settings The configuration of this target.
	 * @param objectStorage Access to the bucket, in the configured region.
	 */
	public AwsS3Bucket(@Nonnull final ServiceProject project, @Nonnull final Settings settings, @Nonnull final ObjectStorage objectStorage) {
		super(project, settings.name());
		this.settings = settings;
		this.objectStorage = requireNonNull(objectStorage);
	}

	/**
	 * {@inheritDoc}
	 * @implSpec If {@link Settings#cleanFirst()} is set, all objects under the root path are deleted.
	 */
	@Override
	public CompletableFuture<Void> prepare() {
		if(!settings.cleanFirst()) {
			return CompletableFuture.completedFuture(null);
		}
		getLogger().info("Cleaning (deleting all objects at) the destination root path of `{}`.", getName());
		return deleteRemotePath(DeployPaths.SEPARATOR);
	}

	/**
	 * Deletes all objects under a path of this target.
	 * @param remoteRelativePath The path relative to the root of the target.
	 * @return A future completing when all the objects have been deleted.
	 */
	public CompletableFuture<Void> deleteRemotePath(@Nonnull final String remoteRelativePath) {
		final String remoteAbsolutePath = resolveRemoteAbs(remoteRelativePath);
		getLogger().info("Deleting objects with path `{}`.", remoteAbsolutePath);
		return deleteBatches(remoteAbsolutePath)
				.thenRun(() -> getLogger().info("All objects at path `{}` were removed.", remoteAbsolutePath));
	}

	/**
	 * Deletes the objects with a key prefix one listing at a time, continuing as long as each listing is full.
	 * @param prefix The key prefix.
	 * @return A future completing when no more batches remain.
	 */
	private CompletableFuture<Void> deleteBatches(@Nonnull final String prefix) {
		getLogger().debug("Deleting one batch of objects with prefix `{}`.", prefix);
		return objectStorage.list(settings.bucket(), prefix, null, ObjectStorage.MAX_KEYS).thenCompose(listing -> {
			final List<String> keys = listing.keys();
			if(keys.isEmpty()) {
				return CompletableFuture.completedFuture(null);
			}
			return objectStorage.deleteAll(settings.bucket(), keys)
					.thenCompose(__ -> keys.size() >= ObjectStorage.MAX_KEYS ? deleteBatches(prefix) : CompletableFuture.completedFuture(null));
		});
	}

	@Override
	protected CompletableFuture<Void> putObject(final String remoteRelativePath, final byte[] content, final String contentType) {
		final String key = resolveRemoteAbs(remoteRelativePath);
		final String location = resolveRemoteAbsFull(remoteRelativePath);
		getLogger().info("Putting `{}` ({} bytes).", location, content.length);
		return objectStorage.put(settings.bucket(), key, content, contentType).thenRun(() -> getLogger().info("Upload of `{}` completed.", location));
	}

	/**
	 * Resolves a path relative to the root of this target to an object key.
	 * @param remoteRelativePath The path relative to the root of the target.
	 * @return The object key, which never begins with a slash.
	 */
	public String resolveRemoteAbs(@Nonnull final String remoteRelativePath) {
		return DeployPaths.toRelative(DeployPaths.join(settings.rootPath(), remoteRelativePath));
	}

	/**
	 * Resolves a path relative to the root of this target to a full S3 URI.
	 * @param remoteRelativePath The path relative to the root of the target.
	 * @return The S3 URI, e.g. <code>s3://bucket/root/path/file.json</code>.
	 */
	public String resolveRemoteAbsFull(@Nonnull final String remoteRelativePath) {
		return CorefwPlatformAws.s3Uri(settings.bucket(), resolveRemoteAbs(remoteRelativePath));
	}

	/**
	 * The configuration of an S3 bucket target.
	 * @param name The name of the target for logging, or <code>null</code> to use the type.
	 * @param bucket The bucket name.
	 * @param rootPath The root path within the bucket.
	 * @param awsRegion The AWS region of the bucket.
	 * @param cleanFirst Whether all objects under the root path are deleted before deployment.
	 */
	public record Settings(@Nullable String name, @Nonnull String bucket, @Nonnull String rootPath, @Nonnull String awsRegion, boolean cleanFirst) {

		/** The default root path, which is the root of the bucket. */
		public static final String DEFAULT_ROOT_PATH = "/";

		/**
		 * Constructor.
		 * @param name The name of the target for logging, or <code>null</code> to use the type.
		 * @param bucket The bucket name.
		 * @param rootPath The root path within the bucket, or <code>null</code> for {@value #DEFAULT_ROOT_PATH}.
		 * @param awsRegion The AWS region of the bucket, or <code>null</code> for {@value CorefwPlatformAws#DEFAULT_REGION}.
		 * @param cleanFirst Whether all objects under the root path are deleted before deployment, or <code>null</code> for <code>false</code>.
		 * @throws ConfigurationException if the bucket is missing.
		 */
		@JsonCreator
		public Settings(@JsonProperty("name") @Nullable final String name, @JsonProperty("bucket") final String bucket,
				@JsonProperty("rootPath") @Nullable final String rootPath, @JsonProperty("awsRegion") @Nullable final String awsRegion,
				@JsonProperty("cleanFirst") @Nullable final Boolean cleanFirst) {
			this(name, bucket, rootPath != null ? rootPath : DEFAULT_ROOT_PATH, awsRegion != null ? awsRegion : CorefwPlatformAws.DEFAULT_REGION,
					cleanFirst != null && cleanFirst.booleanValue());
		}

		/**
		 * Canonical constructor.
		 * @param name The name of the target for logging, or <code>null</code> to use the type.
		 * @param bucket The bucket name.
		 * @param rootPath The root path within the bucket.
		 * @param awsRegion The AWS region of the bucket.
		 * @param cleanFirst Whether all objects under the root path are deleted before deployment.
		 * @throws ConfigurationException if the bucket is missing.
		 */
		public Settings {
			if(bucket == null || bucket.isBlank()) {
				throw new ConfigurationException("Deploy target `%s` requires a `bucket`.".formatted(TYPE));
			}
			requireNonNull(rootPath);
			requireNonNull(awsRegion);
		}

	}

}
