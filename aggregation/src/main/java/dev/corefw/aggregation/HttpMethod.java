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
 * The HTTP methods an aggregated endpoint may be mapped to.
 */
public enum HttpMethod {

	GET, PATCH, POST, DELETE;

	/** @return The lowercase token of the method as it appears in a Serverless HTTP event, e.g. <code>get</code>. */
	public String getToken() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * Finds the method identified by a token. Tokens are case-sensitive; <code>GET</code> does not identify a method.
	 * @param token The method token, such as <code>get</code>.
	 * @return The method identified by the token, or empty if the token does not identify a supported method.
	 */
	public static Optional<HttpMethod> findByToken(@Nonnull final String token) {
		requireNonNull(token);
		return Arrays.stream(values()).filter(method -> method.getToken().equals(token)).findAny();
	}

}
