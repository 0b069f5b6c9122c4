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

import java.util.*;

import javax.annotation.*;

/**
 * The latest published metadata of a single service.
 * @param name The name of the service, which is its directory in the metadata bucket.
 * @param packageData The service package descriptor, if present.
 * @param serverless The Serverless specification of the service, if present.
 * @param openApi The OpenAPI specification of the service, if present.
 */
public record ServiceBundle(@Nonnull String name, @Nonnull Optional<Map<String, Object>> packageData, @Nonnull Optional<Map<String, Object>> serverless,
		@Nonnull Optional<Map<String, Object>> openApi) {

	/** The name of the service package descriptor file. */
	public static final String PACKAGE_FILENAME = "package.json";

	/** The name of the Serverless specification file. */
	public static final String SERVERLESS_FILENAME = "serverless.json";

	/** The name of the OpenAPI specification file. */
	public static final String OPENAPI_FILENAME = "openapi.json";

	/**
	 * Constructor.
	 * @param name The name of the service, which is its directory in the metadata bucket.
	 * @param packageData The service package descriptor, if present.
	 * @param serverless The Serverless specification of the service, if present.
	 * @param openApi The OpenAPI specification of the service, if present.
	 */
	public ServiceBundle {
		requireNonNull(name);
		requireNonNull(packageData);
		requireNonNull(serverless);
		requireNonNull(openApi);
	}

}
