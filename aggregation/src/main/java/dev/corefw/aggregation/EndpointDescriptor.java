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

import java.util.Optional;

import javax.annotation.*;

/**
 * An HTTP endpoint declared by a service, and the function implementing it.
 * @param name The name of the implementing function.
 * @param shortName The key of the function in the Serverless specification.
 * @param description The description of the function, if any.
 * @param path The API path, such as <code>users/{id}</code>.
 * @param method The HTTP method.
 * @param service The name of the declaring service.
 * @param versionHash The lowercase version hash correlating the endpoint with a deployed function.
 */
public record EndpointDescriptor(@Nonnull String name, @Nonnull String shortName, @Nonnull Optional<String> description, @Nonnull String path,
		@Nonnull HttpMethod method, @Nonnull String service, @Nonnull String versionHash) {

	/**
	 * Constructor.
	 * @param name The name of the implementing function.
	 * @param shortName The key of the function in the Serverless specification.
	 * @param description The description of the function, if any.
	 * @param path The API path, such as <code>users/{id}</code>.
	 * @param method The HTTP method.
	 * @param service The name of the declaring service.
	 * @param versionHash The lowercase version hash correlating the endpoint with a deployed function.
	 */
	public EndpointDescriptor {
		requireNonNull(name);
		requireNonNull(shortName);
		requireNonNull(description);
		requireNonNull(path);
		requireNonNull(method);
		requireNonNull(service);
		requireNonNull(versionHash);
	}

}
