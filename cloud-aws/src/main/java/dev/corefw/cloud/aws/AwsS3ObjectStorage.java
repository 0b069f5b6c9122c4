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
import software.amazon.awssdk.core.async.*;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.model.*;

/**
 * Object storage implemented by <a href="https://aws.amazon.com/s3/">Amazon S3</a>.
 */
public class AwsS3ObjectStorage implements ObjectStorage, Clogged {

	private final S3AsyncClient s3Client;

	/** @return The client for communicating with S3. */
	protected S3AsyncClient getS3Client() {
		return s3Client;
	}

	/**
	 * Client constructor.
	 * @param s3Client The client for communicating with S3.
	 */
	public AwsS3ObjectStorage(@Nonnull final S3AsyncClient s3Client) {
		this.s3Client = requireNonNull(s3Client);
	}

	/**
	 * Creates object storage for buckets in the given region, using the default credentials provider chain.
	 * @param awsRegion The AWS region identifier, such as <code>us-east-1</code>.
	 * @return New object storage for the region.
	 */
	public static AwsS3ObjectStorage forRegion(@Nonnull final String awsRegion) {
		return new AwsS3ObjectStorage(S3AsyncClient.builder().region(Region.of(awsRegion)).build());
	}

	@Override
	public CompletableFuture<StorageListing> list(final String bucket, final String prefix, final String delimiter, final int maxKeys) {
		final ListObjectsV2Request request = ListObjectsV2Request.builder().bucket(bucket).prefix(prefix).delimiter(delimiter).maxKeys(maxKeys).build();
		return getS3Client().listObjectsV2(request).handle((response, throwable) -> {
			if(throwable != null) {
				throw toCloudOperationException("S3::ListObjectsV2 of `%s`".formatted(s3Uri(bucket, prefix)), throwable);
			}
			return new StorageListing(response.commonPrefixes().stream().map(CommonPrefix::prefix).collect(toList()),
					response.contents().stream().map(S3Object::key).collect(toList()));
		});
	}

	/**
	 * {@inheritDoc}
	 * @implSpec A {@link NoSuchKeyException} results in an empty value rather than a failure.
	 */
	@Override
	public CompletableFuture<Optional<byte[]>> get(final String bucket, final String key) {
		final GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();
		return getS3Client().getObject(request, AsyncResponseTransformer.toBytes()).handle((responseBytes, throwable) -> {
			if(throwable != null) {
				if(unwrap(throwable) instanceof NoSuchKeyException) {
					getLogger().atDebug().log("No object `{}` found.", s3Uri(bucket, key));
					return Optional.empty();
				}
				throw toCloudOperationException("S3::GetObject of `%s`".formatted(s3Uri(bucket, key)), throwable);
			}
			return Optional.of(responseBytes.asByteArray());
		});
	}

	@Override
	public CompletableFuture<Void> put(final String bucket, final String key, final byte[] content, final String contentType) {
		final PutObjectRequest request = PutObjectRequest.builder().bucket(bucket).key(key).contentType(contentType).build();
		return getS3Client().putObject(request, AsyncRequestBody.fromBytes(content)).handle((response, throwable) -> {
			if(throwable != null) {
				throw toCloudOperationException("S3::PutObject of `%s`".formatted(s3Uri(bucket, key)), throwable);
			}
			getLogger().atDebug().log("Stored `{}` ({} bytes).", s3Uri(bucket, key), content.length);
			return null;
		});
	}

	/**
	 * {@inheritDoc}
	 * @implSpec Any individual key reported as not deleted causes the operation to fail.
	 */
	@Override
	public CompletableFuture<Void> deleteAll(final String bucket, final Collection<String> keys) {
		if(keys.isEmpty()) {
			return CompletableFuture.completedFuture(null);
		}
		final List<ObjectIdentifier> objectIdentifiers = keys.stream().map(key -> ObjectIdentifier.builder().key(key).build()).collect(toList());
		final DeleteObjectsRequest request = DeleteObjectsRequest.builder().bucket(bucket).delete(Delete.builder().objects(objectIdentifiers).build()).build();
		return getS3Client().deleteObjects(request).handle((response, throwable) -> {
			if(throwable != null) {
				throw toCloudOperationException("S3::DeleteObjects in bucket `%s`".formatted(bucket), throwable);
			}
			if(response.hasErrors() && !response.errors().isEmpty()) {
				final S3Error error = response.errors().get(0);
				throw new CloudOperationException("S3::DeleteObjects could not delete %d object(s) in bucket `%s`; first `%s`: %s".formatted(response.errors().size(),
						bucket, error.key(), error.message()));
			}
			return null;
		});
	}

}
