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

import static java.nio.charset.StandardCharsets.*;
import static java.util.Objects.*;
import static java.util.stream.Collectors.*;

import java.util.*;
import java.util.concurrent.CompletableFuture;

import javax.annotation.*;

import dev.corefw.*;
import dev.corefw.cloud.ObjectStorage;
import io.clogr.Clogged;

/**
 * Retrieves the metadata that services publish to object storage.
 * <p>
 * Each service publishes its metadata under <code><var>prefix</var><var>service</var>/latest/</code>, where the prefix is the configured root path of the
 * metadata bucket.
 * </p>
 */
public class ServiceMetadataFetcher implements Clogged {

	/** The directory within each service directory containing the latest metadata. */
	public static final String LATEST_DIRECTORY = "latest/";

	/** The delimiter separating service directories. */
	static final String DELIMITER = "/";

	private final ObjectStorage objectStorage;

	/**
	 * Constructor.
	 * @param objectStorage Access to the metadata bucket.
	 */
	public ServiceMetadataFetcher(@Nonnull final ObjectStorage objectStorage) {
		this.objectStorage = requireNonNull(objectStorage);
	}

	/**
	 * Lists the names of the services having directories under a prefix.
	 * @apiNote Only a single listing page of up to {@value ObjectStorage#MAX_KEYS} entries is retrieved; services beyond that are not seen.
	 * @param bucket The metadata bucket.
	 * @param prefix The normalized root path of the service directories, either empty or ending in a slash.
	 * @return A future list of service names.
	 */
	public CompletableFuture<List<String>> listServiceNames(@Nonnull final String bucket, @Nonnull final String prefix) {
		getLogger().info("Fetching the service list from `{}`.", "%s/%s".formatted(bucket, prefix));
		return objectStorage.list(bucket, prefix, DELIMITER, ObjectStorage.MAX_KEYS).thenApply(listing -> listing.commonPrefixes().stream().map(commonPrefix -> {
			String serviceName = commonPrefix.startsWith(prefix) ? commonPrefix.substring(prefix.length()) : commonPrefix;
			if(serviceName.endsWith(DELIMITER)) {
				serviceName = serviceName.substring(0, serviceName.length() - DELIMITER.length());
			}
			return serviceName;
		}).collect(toList()));
	}

	/**
	 * Fetches the latest metadata files of a single service, one after another.
	 * @param bucket The metadata bucket.
	 * @param prefix The normalized root path of the service directories.
	 * @param serviceName The name of the service.
	 * @return A future bundle of the service metadata, which completes exceptionally with a {@link MarshalException} if any file present is not a valid JSON
	 *         object.
	 */
	public CompletableFuture<ServiceBundle> fetchServiceBundle(@Nonnull final String bucket, @Nonnull final String prefix, @Nonnull final String serviceName) {
		return fetchLatestJson(bucket, prefix, serviceName, ServiceBundle.PACKAGE_FILENAME)
				.thenCompose(packageData -> fetchLatestJson(bucket, prefix, serviceName, ServiceBundle.SERVERLESS_FILENAME)
						.thenCompose(serverless -> fetchLatestJson(bucket, prefix, serviceName, ServiceBundle.OPENAPI_FILENAME)
								.thenApply(openApi -> new ServiceBundle(serviceName, packageData, serverless, openApi))));
	}

	/**
	 * Lists all services and fetches their metadata concurrently.
	 * @param bucket The metadata bucket.
	 * @param prefix The normalized root path of the service directories.
	 * @return A future list of the service bundles, in the order the services were listed.
	 */
	public CompletableFuture<List<ServiceBundle>> fetchServiceBundles(@Nonnull final String bucket, @Nonnull final String prefix) {
		getLogger().info("Fetching the service metadata.");
		return listServiceNames(bucket, prefix).thenCompose(serviceNames -> {
			final List<CompletableFuture<ServiceBundle>> futureBundles = serviceNames.stream()
					.map(serviceName -> fetchServiceBundle(bucket, prefix, serviceName)).collect(toList());
			return CompletableFuture.allOf(futureBundles.toArray(CompletableFuture[]::new))
					.thenApply(__ -> futureBundles.stream().map(CompletableFuture::join).collect(toList()));
		});
	}

	/**
	 * Fetches and parses one of the latest JSON metadata files of a service.
	 * @param bucket The metadata bucket.
	 * @param prefix The normalized root path of the service directories.
	 * @param serviceName The name of the service.
	 * @param filename The name of the metadata file.
	 * @return A future of the parsed JSON object, or empty if the file is not present.
	 */
	CompletableFuture<Optional<Map<String, Object>>> fetchLatestJson(@Nonnull final String bucket, @Nonnull final String prefix,
			@Nonnull final String serviceName, @Nonnull final String filename) {
		final String key = prefix + serviceName + DELIMITER + LATEST_DIRECTORY + filename;
		getLogger().debug("Downloading `{}` for service `{}`.", filename, serviceName);
		return objectStorage.get(bucket, key).thenApply(foundContents -> {
			if(foundContents.isEmpty()) {
				getLogger().atWarn().log("Download of `{}` failed; file not found.", "%s/%s".formatted(bucket, key));
				return Optional.empty();
			}
			final Object tree = Marshalling.readJsonTree(new String(foundContents.get(), UTF_8));
			if(!(tree instanceof Map<?, ?>)) {
				throw new MarshalException("File `%s` of service `%s` does not contain a JSON object.".formatted(filename, serviceName));
			}
			@SuppressWarnings("unchecked")
			final Map<String, Object> object = (Map<String, Object>)tree;
			return Optional.of(object);
		});
	}

}
