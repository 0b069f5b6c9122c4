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

package dev.corefw.deploy;

import static java.util.function.Predicate.*;
import static java.util.stream.Collectors.*;

import java.util.*;
import java.util.stream.Stream;

import javax.annotation.*;

/**
 * Utilities for working with the slash-separated paths of deployment destinations.
 */
public final class DeployPaths {

	private DeployPaths() {
	}

	/** The path separator. */
	public static final String SEPARATOR = "/";

	/**
	 * Joins path parts with slashes and normalizes the result.
	 * <p>
	 * Normalization removes empty and <code>.</code> segments and resolves <code>..</code> segments. A leading slash is kept, as is a trailing slash if any
	 * segments remain. For example <code>join("/", "static/", "./css//site.css")</code> returns <code>/static/css/site.css</code>.
	 * </p>
	 * @param parts The parts to join; empty parts are ignored.
	 * @return The joined, normalized path; empty if there were no non-empty parts.
	 */
	public static String join(@Nonnull final String... parts) {
		final String joined = Stream.of(parts).filter(not(String::isEmpty)).collect(joining(SEPARATOR));
		if(joined.isEmpty()) {
			return joined;
		}
		final boolean isAbsolute = joined.startsWith(SEPARATOR);
		final Deque<String> segments = new ArrayDeque<>();
		for(final String segment : joined.split(SEPARATOR)) {
			if(segment.isEmpty() || segment.equals(".")) {
				continue;
			}
			if(segment.equals("..")) {
				if(!segments.isEmpty() && !segments.peekLast().equals("..")) {
					segments.removeLast();
				} else if(!isAbsolute) { //the root has no parent
					segments.addLast(segment);
				}
				continue;
			}
			segments.addLast(segment);
		}
		final StringBuilder pathBuilder = new StringBuilder();
		if(isAbsolute) {
			pathBuilder.append(SEPARATOR);
		}
		pathBuilder.append(String.join(SEPARATOR, segments));
		if(joined.endsWith(SEPARATOR) && !segments.isEmpty()) {
			pathBuilder.append(SEPARATOR);
		}
		return pathBuilder.toString();
	}

	/**
	 * Removes any leading slashes from a path, making it relative.
	 * @param path The path.
	 * @return The path without leading slashes.
	 */
	public static String toRelative(@Nonnull final String path) {
		int begin = 0;
		while(begin < path.length() && path.startsWith(SEPARATOR, begin)) {
			begin++;
		}
		return path.substring(begin);
	}

}
