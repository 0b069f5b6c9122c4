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

package dev.corefw.cloud;

import java.util.*;
import java.util.concurrent.CompletableFuture;

import javax.annotation.*;

/**
 * Access to a cloud object store organized into buckets of keyed objects.
 * @apiNote Failures of the remote provider complete the returned futures exceptionally with a {@link CloudOperationException}.
 */
public interface ObjectStorage {

	/** The largest number of keys that may be requested in a single listing or deleted in a single batch. */
	int MAX_KEYS = 1000;

	/** The content type for JSON objects. */
	String CONTENT_TYPE_JSON = "application/json";

	/** The content type for YAML objects. */
	String CONTENT_TYPE_YAML = "text/yaml";

	/**
	 * Lists a single page of the objects in a bucket.
	 * @param bucket The name of the bucket.
	 * @param prefix The key prefix restricting the listing, which may be empty.
	 * @param delimiter The delimiter for grouping keys into common prefixes, or <code>null</code> if keys should not be grouped.
	 * @param maxKeys The maximum number of keys and common prefixes to return; no more than {@value #MAX_KEYS}.
	 * @return A future listing of the objects and common prefixes.
	 */
	CompletableFuture<StorageListing> list(@Nonnull String bucket, @Nonnull String prefix, @Nullable String delimiter, int maxKeys);

	/**
	 * Retrieves the contents of an object.
	 * @param bucket The name of the bucket.
	 * @param key The key of the object.
	 * @return A future of the object contents, which will be empty if there is no such object.
	 */
	CompletableFuture<Optional<byte[]>> get(@Nonnull String bucket, @Nonnull String key);

	/**
	 * Stores an object, replacing any existing object with the same key.
	 * @param bucket The name of the bucket.
	 * @param key The key of the object.
	 * @param content The object contents.
	 * @param contentType The media type of the contents, or <code>null</code> if the provider should choose.
	 * @return A future indicating completion.
	 */
	CompletableFuture<Void> put(@Nonnull String bucket, @Nonnull String key, @Nonnull byte[] content, @Nullable String contentType);

	/**
	 * Deletes a batch of objects.
	 * @param bucket The name of the bucket.
	 * @param keys The keys of the objects to delete; no more than {@value #MAX_KEYS}.
	 * @return A future indicating completion.
	 */
	CompletableFuture<Void> deleteAll(@Nonnull String bucket, @Nonnull Collection<String> keys);

	/**
	 * A single page of an object listing.
	 * @param commonPrefixes The key prefixes up to and including the delimiter, if a delimiter was given.
	 * @param keys The keys of the objects not grouped into a common prefix.
	 */
	record StorageListing(@Nonnull List<String> commonPrefixes, @Nonnull List<String> keys) {

		/**
		 * Constructor.
		 * @param commonPrefixes The key prefixes up to and including the delimiter, if a delimiter was given.
		 * @param keys The keys of the objects not grouped into a common prefix.
		 */
		public StorageListing {
			commonPrefixes = List.copyOf(commonPrefixes);
			keys = List.copyOf(keys);
		}

	}

}
