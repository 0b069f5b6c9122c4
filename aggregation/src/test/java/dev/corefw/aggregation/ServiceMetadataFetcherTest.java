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

import static com.github.npathai.hamcrestopt.OptionalMatchers.*;
import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.*;
import java.util.concurrent.CompletionException;

import org.junit.jupiter.api.*;

import dev.corefw.MarshalException;

/**
 * Tests of {@link ServiceMetadataFetcher}.
 */
public class ServiceMetadataFetcherTest {

	static final String BUCKET = "meta-bucket";

	private InMemoryObjectStorage objectStorage;

	@BeforeEach
	void setUp() {
		objectStorage = new InMemoryObjectStorage();
		objectStorage.putString(BUCKET, "services/users/latest/package.json", "{\"name\":\"sls-service-users\",\"version\":\"1.2.3\"}");
		objectStorage.putString(BUCKET, "services/users/latest/serverless.json", "{\"service\":\"users\",\"functions\":{}}");
		objectStorage.putString(BUCKET, "services/users/latest/openapi.json", "{\"openapi\":\"3.0.0\"}");
		objectStorage.putString(BUCKET, "services/users/v1/package.json", "{}");
		objectStorage.putString(BUCKET, "services/orders/latest/serverless.json", "{\"service\":\"orders\"}");
		objectStorage.putString(BUCKET, "services/readme.txt", "not a service");
		objectStorage.putString(BUCKET, "other/ignored/latest/serverless.json", "{}");
	}

	@Test
	void testListServiceNames() {
		assertThat(new ServiceMetadataFetcher(objectStorage).listServiceNames(BUCKET, "services/").join(), is(List.of("orders", "users")));
	}

	@Test
	void testListServiceNamesAtBucketRoot() {
		assertThat(new ServiceMetadataFetcher(objectStorage).listServiceNames(BUCKET, "").join(), is(List.of("other", "services")));
	}

	@Test
	void testFetchServiceBundle() {
		final ServiceBundle bundle = new ServiceMetadataFetcher(objectStorage).fetchServiceBundle(BUCKET, "services/", "users").join();
		assertThat(bundle.name(), is("users"));
		assertThat(bundle.packageData().map(packageData -> packageData.get("version")), isPresentAndIs("1.2.3"));
		assertThat(bundle.serverless().map(serverless -> serverless.get("service")), isPresentAndIs("users"));
		assertThat(bundle.openApi().map(openApi -> openApi.get("openapi")), isPresentAndIs("3.0.0"));
	}

	/** Missing files are tolerated and leave the corresponding part of the bundle empty. */
	@Test
	void testFetchServiceBundleMissingFiles() {
		final ServiceBundle bundle = new ServiceMetadataFetcher(objectStorage).fetchServiceBundle(BUCKET, "services/", "orders").join();
		assertThat(bundle.packageData(), isEmpty());
		assertThat(bundle.serverless(), isPresent());
		assertThat(bundle.openApi(), isEmpty());
	}

	@Test
	void testFetchServiceBundles() {
		final List<ServiceBundle> bundles = new ServiceMetadataFetcher(objectStorage).fetchServiceBundles(BUCKET, "services/").join();
		assertThat(bundles.stream().map(ServiceBundle::name).toList(), is(List.of("orders", "users")));
	}

	@Test
	void testFetchServiceBundlesNoServices() {
		assertThat(new ServiceMetadataFetcher(objectStorage).fetchServiceBundles(BUCKET, "missing/").join(), is(empty()));
	}

	@Test
	void testFetchLatestJsonInvalid() {
		objectStorage.putString(BUCKET, "services/broken/latest/serverless.json", "{\"service\":");
		final CompletionException completionException = assertThrows(CompletionException.class,
				() -> new ServiceMetadataFetcher(objectStorage).fetchLatestJson(BUCKET, "services/", "broken", ServiceBundle.SERVERLESS_FILENAME).join());
		assertThat(completionException.getCause(), is(instanceOf(MarshalException.class)));
	}

	@Test
	void testFetchLatestJsonNotObject() {
		objectStorage.putString(BUCKET, "services/broken/latest/serverless.json", "[1, 2]");
		final CompletionException completionException = assertThrows(CompletionException.class,
				() -> new ServiceMetadataFetcher(objectStorage).fetchLatestJson(BUCKET, "services/", "broken", ServiceBundle.SERVERLESS_FILENAME).join());
		assertThat(completionException.getCause(), is(instanceOf(MarshalException.class)));
	}

}
