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

import java.util.concurrent.*;

import javax.annotation.*;

import dev.corefw.cloud.CloudOperationException;
import software.amazon.awssdk.awscore.exception.AwsServiceException;

/**
 * Definitions and utilities for the AWS platform.
 * @see <a href="https://aws.amazon.com/">Amazon Web Services</a>
 */
public class CorefwPlatformAws {

	/** The region used when none is configured. */
	public static final String DEFAULT_REGION = "us-east-1";

	/** The URI scheme for identifying S3 objects, e.g. <code>s3://bucket/key</code>. */
	public static final String S3_URI_SCHEME = "s3";

	/**
	 * Returns the underlying cause of a failure reported through a {@link CompletableFuture} chain.
	 * @param throwable The failure, which may be a {@link CompletionException} or {@link ExecutionException} wrapping the actual cause.
	 * @return The innermost cause that is not a concurrency wrapper.
	 */
	public static Throwable unwrap(@Nonnull final Throwable throwable) {
		Throwable cause = throwable;
		while((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
			cause = cause.getCause();
		}
		return cause;
	}

	/**
	 * Converts a failure of an AWS operation to a cloud operation exception identifying the operation.
	 * @implSpec An existing {@link CloudOperationException} is returned unchanged.
	 * @param operation The name of the operation, such as <code>S3::GetObject</code>.
	 * @param throwable The failure, which may be wrapped in a {@link CompletionException}.
	 * @return An exception describing the failure.
	 */
	public static CloudOperationException toCloudOperationException(@Nonnull final String operation, @Nonnull final Throwable throwable) {
		final Throwable cause = unwrap(throwable);
		if(cause instanceof CloudOperationException cloudOperationException) {
			return cloudOperationException;
		}
		final String detail = cause instanceof AwsServiceException awsServiceException && awsServiceException.awsErrorDetails() != null
				? "AWS error message: `%s`; status code: `%s`".formatted(awsServiceException.awsErrorDetails().errorMessage(), awsServiceException.statusCode())
				: String.valueOf(cause.getMessage());
		return new CloudOperationException("%s failed; %s".formatted(operation, detail), cause);
	}

	/**
	 * Creates an S3 URI for an object.
	 * @param bucket The bucket name.
	 * @param key The object key, which should not begin with a slash.
	 * @return The URI in the form <code>s3://<var>bucket</var>/<var>key</var></code>.
	 */
	public static String s3Uri(@Nonnull final String bucket, @Nonnull final String key) {
		return "%s://%s/%s".formatted(S3_URI_SCHEME, bucket, key);
	}

}
