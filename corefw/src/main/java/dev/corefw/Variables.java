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

package dev.corefw;

import static java.util.Objects.*;

import java.util.*;

import javax.annotation.*;

/**
 * Variable substitution over arbitrary JSON/YAML trees, such as configuration files and template fragments.
 * <p>
 * A variable is referenced in a string value using the identifier <code>${<var>name</var>}</code>. Objects ({@link Map}) and arrays ({@link List}) are
 * traversed recursively, producing new containers; every string leaf is a substitution candidate; all other values are returned unchanged.
 * </p>
 * <p>
 * For each string, variables are applied in the iteration order of the variable map:
 * </p>
 * <ul>
 * <li>If the variable value is a {@link String}, every occurrence of the identifier is replaced with the value.</li>
 * <li>Otherwise, if the identifier appears anywhere in the string, the entire string is replaced by the value itself (which need not be a string, and may
 * be <code>null</code>), and no further variables are applied to it.</li>
 * </ul>
 * <p>
 * Identifiers with no corresponding variable are left verbatim.
 * </p>
 * @implNote Replacement is a single pass per variable. Identifiers introduced by a replacement value, whether its own or another variable's already
 *           processed, are not expanded again; this guarantees termination even if a value contains its own identifier. The same holds for an
 *           identifier formed by a replacement together with its surrounding text: <code>${${x}}</code> with <code>x</code> set to <code>x</code> produces
 *           <code>${x}</code>, not <code>x</code>.
 */
public final class Variables {

	private Variables() {
	}

	/** The delimiter starting a variable identifier. */
	public static final String IDENTIFIER_BEGIN = "${";

	/** The delimiter ending a variable identifier. */
	public static final String IDENTIFIER_END = "}";

	/**
	 * Returns the identifier used to reference a variable in a template.
	 * @param name The variable name.
	 * @return The identifier in the form <code>${<var>name</var>}</code>.
	 */
	public static String identifier(@Nonnull final String name) {
		return IDENTIFIER_BEGIN + requireNonNull(name) + IDENTIFIER_END;
	}

	/**
	 * Substitutes variables throughout a tree.
	 * @param tree The tree in which to substitute variables; may be any JSON-compatible value, including <code>null</code>.
	 * @param variables The variables to substitute, iterated in their natural order.
	 * @return A new tree with variables substituted; or the same value if it is neither a container nor a string.
	 */
	public static Object substitute(@Nullable final Object tree, @Nonnull final Map<String, ?> variables) {
		requireNonNull(variables);
		if(tree instanceof Map<?, ?> map) {
			return substituteMap(map, variables);
		} else if(tree instanceof List<?> list) {
			return substituteList(list, variables);
		} else if(tree instanceof String string) {
			return substituteString(string, variables);
		}
		return tree;
	}

	/**
	 * Substitutes variables throughout a tree, using some global variables that the more specific variables override.
	 * @implSpec The global variables are applied first in their own order, followed by any specific variables not already among the globals.
	 * @param tree The tree in which to substitute variables.
	 * @param globalVariables Variables available to all templates.
	 * @param variables Variables specific to this substitution, overriding any global variables with the same name.
	 * @return A new tree with variables substituted.
	 * @see #overlay(Map, Map)
	 */
	public static Object substitute(@Nullable final Object tree, @Nonnull final Map<String, ?> globalVariables, @Nonnull final Map<String, ?> variables) {
		return substitute(tree, overlay(globalVariables, variables));
	}

	/**
	 * Substitutes variables throughout an object tree, returning the new object.
	 * @param object The object in which to substitute variables.
	 * @param variables The variables to substitute.
	 * @return A new map with the same keys in the same order, and values with variables substituted.
	 */
	public static Map<String, Object> substituteObject(@Nonnull final Map<String, ?> object, @Nonnull final Map<String, ?> variables) {
		return substituteMap(object, variables);
	}

	/**
	 * Creates a new variable map in which some variables override others.
	 * @param base The base variables.
	 * @param overrides The variables to override or add to the base variables.
	 * @return A new mutable map with the base variable order, followed by any added variables in their order.
	 */
	public static Map<String, Object> overlay(@Nonnull final Map<String, ?> base, @Nonnull final Map<String, ?> overrides) {
		final Map<String, Object> result = new LinkedHashMap<>(base);
		result.putAll(overrides);
		return result;
	}

	static Map<String, Object> substituteMap(@Nonnull final Map<?, ?> map, @Nonnull final Map<String, ?> variables) {
		final Map<String, Object> result = new LinkedHashMap<>(map.size() * 4 / 3 + 1);
		map.forEach((key, value) -> result.put(String.valueOf(key), substitute(value, variables)));
		return result;
	}

	static List<Object> substituteList(@Nonnull final List<?> list, @Nonnull final Map<String, ?> variables) {
		final List<Object> result = new ArrayList<>(list.size());
		list.forEach(element -> result.add(substitute(element, variables)));
		return result;
	}

	/**
	 * Substitutes variables in a single string.
	 * @param string The string potentially containing variable identifiers.
	 * @param variables The variables to substitute.
	 * @return The string with string variables substituted, or the value of the first non-string variable whose identifier appears in the string.
	 */
	static Object substituteString(@Nonnull final String string, @Nonnull final Map<String, ?> variables) {
		if(!string.contains(IDENTIFIER_BEGIN)) { //quick check; nothing could match
			return string;
		}
		String result = string;
		for(final Map.Entry<String, ?> variable : variables.entrySet()) {
			final String identifier = identifier(variable.getKey());
			if(!result.contains(identifier)) {
				continue;
			}
			final Object value = variable.getValue();
			if(!(value instanceof String stringValue)) {
				return value; //type-changing substitution of the whole node
			}
			result = result.replace(identifier, stringValue);
		}
		return result;
	}

}
