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

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.regex.*;

import javax.annotation.*;

/**
 * Generation of the logical names of resources in the API facade template.
 * <p>
 * Names are deterministic: the same input always produces the same name, and names contain only ASCII letters and digits.
 * </p>
 */
public final class RefNames {

	private RefNames() {
	}

	/** The logical name of the REST API resource. */
	public static final String API_REF_NAME = "ApiGatewayRestApi";

	/** The prefix of path resource names. */
	public static final String RESOURCE_PREFIX = "AagResource";

	/** The prefix of method resource names. */
	public static final String METHOD_PREFIX = "AagMethod";

	/** The prefix of deployment resource names. */
	public static final String DEPLOYMENT_PREFIX = "AagDeployment";

	/** The suffix of function permission resource names. */
	public static final String PERMISSION_SUFFIX = "AagPerms";

	/** The format of the timestamp distinguishing each deployment, e.g. <code>2023-07-04-09-05-7-042</code>. */
	public static final DateTimeFormatter DEPLOYMENT_TIMESTAMP_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd-HH-mm-s-SSS", Locale.ROOT);

	private static final Pattern NON_ALPHANUMERIC_PATTERN = Pattern.compile("[^A-Za-z0-9]");

	/**
	 * The words of a string in start case: lowercase runs with an optional leading capital, uppercase runs, ordinals such as <code>2nd</code>, and digit runs.
	 * An uppercase run followed by a capitalized word leaves the last capital to that word, so that <code>HTTPServer</code> has the words <code>HTTP</code>
	 * and <code>Server</code>.
	 */
	private static final Pattern WORD_PATTERN = Pattern.compile(String.join("|", //
			"[A-Z]?[a-z]+(?=[^A-Za-z0-9]|[A-Z]|$)", //
			"[A-Z]+(?=[^A-Za-z0-9]|[A-Z][a-z]|$)", //
			"[A-Z]?[a-z]+", //
			"[A-Z]+", //
			"\\d*(?:1ST|2ND|3RD|(?![123])\\dTH)(?=\\b|[a-z_])", //
			"\\d*(?:1st|2nd|3rd|(?![123])\\dth)(?=\\b|[A-Z_])", //
			"\\d+"));

	/**
	 * Formats a logical resource name from arbitrary text.
	 * @implSpec A closing brace is first replaced by the word <code>Var</code>, so that a path parameter such as <code>{id}</code> is distinguished from a
	 *           literal segment; every other character that is not an ASCII letter or digit separates words. The first letter of each word is then capitalized,
	 *           and the words are joined without separators.
	 * @param prefix The prefix to add, or <code>null</code> for none.
	 * @param text The text to format.
	 * @param suffix The suffix to add, or <code>null</code> for none.
	 * @return The formatted name, e.g. <code>AagResourceUsersIdVar</code> for the prefix <code>AagResource</code> and the text <code>users/{id}</code>.
	 */
	public static String formatRefName(@Nullable final String prefix, @Nonnull final String text, @Nullable final String suffix) {
		final String spaced = NON_ALPHANUMERIC_PATTERN.matcher(text.replace("}", " Var ")).replaceAll(" ");
		final StringBuilder stringBuilder = new StringBuilder();
		if(prefix != null) {
			stringBuilder.append(prefix);
		}
		final Matcher wordMatcher = WORD_PATTERN.matcher(spaced);
		while(wordMatcher.find()) {
			final String word = wordMatcher.group();
			stringBuilder.append(Character.toUpperCase(word.charAt(0))).append(word, 1, word.length());
		}
		if(suffix != null) {
			stringBuilder.append(suffix);
		}
		return stringBuilder.toString();
	}

	/**
	 * Formats a logical resource name from arbitrary text without a suffix.
	 * @param prefix The prefix to add, or <code>null</code> for none.
	 * @param text The text to format.
	 * @return The formatted name.
	 * @see #formatRefName(String, String, String)
	 */
	public static String formatRefName(@Nullable final String prefix, @Nonnull final String text) {
		return formatRefName(prefix, text, null);
	}

	/**
	 * Returns the logical name of the resource for an API path.
	 * @param path The full API path.
	 * @return The path resource name.
	 */
	public static String resourceRefName(@Nonnull final String path) {
		return formatRefName(RESOURCE_PREFIX, path);
	}

	/**
	 * Returns the logical name of the method resource for an API path and HTTP method.
	 * @param path The full API path.
	 * @param method The HTTP method.
	 * @return The method resource name, e.g. <code>AagMethodUsersGet</code>.
	 */
	public static String methodRefName(@Nonnull final String path, @Nonnull final HttpMethod method) {
		return formatRefName(METHOD_PREFIX, path, capitalize(method.getToken()));
	}

	/**
	 * Returns the logical name of the invoke permission resource of a function.
	 * @param functionName The name of the function.
	 * @return The permission resource name.
	 */
	public static String permissionRefName(@Nonnull final String functionName) {
		return formatRefName(null, functionName, PERMISSION_SUFFIX);
	}

	/**
	 * Returns the logical name of a deployment resource.
	 * @param timestamp The time of generation.
	 * @return The deployment resource name, unique to the millisecond.
	 */
	public static String deploymentRefName(@Nonnull final LocalDateTime timestamp) {
		return formatRefName(DEPLOYMENT_PREFIX, DEPLOYMENT_TIMESTAMP_FORMATTER.format(timestamp));
	}

	/**
	 * Capitalizes a string: its first character in uppercase and the rest in lowercase.
	 * @param string The string to capitalize.
	 * @return The capitalized string.
	 */
	static String capitalize(@Nonnull final String string) {
		if(string.isEmpty()) {
			return string;
		}
		return string.substring(0, 1).toUpperCase(Locale.ROOT) + string.substring(1).toLowerCase(Locale.ROOT);
	}

}
