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

import static com.globalmentor.java.Conditions.*;
import static java.util.Objects.*;

import java.util.*;
import java.util.concurrent.CompletableFuture;

import javax.annotation.*;

import dev.corefw.Corefw;
import dev.corefw.cloud.*;
import io.clogr.Clogged;

/**
 * Retrieves the deployed functions and selects those relevant to a branch.
 */
public class FunctionRegistryFetcher implements Clogged {

	/** The number of functions requested in each page. */
	public static final int PAGE_SIZE = 50;

	/** The default maximum number of pages to retrieve. */
	public static final int DEFAULT_MAX_PAGES = 1000;

	private final FunctionRegistry functionRegistry;

	private final int maxPages;

	/**
	 * Function registry constructor using the {@link #DEFAULT_MAX_PAGES}.
	 * @param functionRegistry The registry of deployed functions.
	 */
	public FunctionRegistryFetcher(@Nonnull final FunctionRegistry functionRegistry) {
		this(functionRegistry, DEFAULT_MAX_PAGES);
	}

	/**
	 * Function registry and page limit constructor.
	 * @param functionRegistry The registry of deployed functions.
	 * @param maxPages The maximum number of pages to retrieve.
	 * @throws IllegalArgumentException if the maximum number of pages is not positive.
	 */
	public FunctionRegistryFetcher(@Nonnull final FunctionRegistry functionRegistry, final int maxPages) {
		this.functionRegistry = requireNonNull(functionRegistry);
		checkArgument(maxPages >= 1, "Maximum number of function pages must be positive; found %d.", maxPages);
		this.maxPages = maxPages;
	}

	/**
	 * Retrieves all deployed functions by following the continuation marker of each page.
	 * @return A future list of all deployed functions, which completes exceptionally with a {@link CloudOperationException} if there are more than the maximum
	 *         number of pages.
	 */
	public CompletableFuture<List<FunctionRecord>> listAllFunctions() {
		return listFunctions(null, 1, new ArrayList<>());
	}

	private CompletableFuture<List<FunctionRecord>> listFunctions(@Nullable final String marker, final int pageNumber,
			@Nonnull final List<FunctionRecord> functions) {
		if(pageNumber > maxPages) {
			return CompletableFuture.failedFuture(new CloudOperationException(
					"More than %d pages of functions were found; refusing to continue with an incomplete function list.".formatted(maxPages)));
		}
		getLogger().debug("Fetching page {} of up to {} functions.", pageNumber, PAGE_SIZE);
		return functionRegistry.listFunctions(PAGE_SIZE, marker).thenCompose(page -> {
			functions.addAll(page.functions());
			return page.nextMarker().map(nextMarker -> listFunctions(nextMarker, pageNumber + 1, functions))
					.orElseGet(() -> CompletableFuture.completedFuture(functions));
		});
	}

	/**
	 * Retrieves the deployed functions that were deployed from a branch and carry a valid version hash.
	 * @implSpec A function is relevant if its version hash is a string of {@value Corefw#VERSION_HASH_LENGTH} characters and its branch is exactly the given
	 *           branch. If several functions have the same version hash, the last one listed wins.
	 * @param gitBranch The Git branch being aggregated.
	 * @return A future map of the relevant functions keyed by lowercase version hash, in listing order; empty if no function is relevant.
	 */
	public CompletableFuture<Map<String, FunctionRecord>> getRelevantFunctions(@Nonnull final String gitBranch) {
		requireNonNull(gitBranch);
		getLogger().info("Fetching function data from the function registry.");
		return listAllFunctions().thenApply(functions -> {
			getLogger().info("Found {} functions in total.", functions.size());
			final Map<String, FunctionRecord> relevantFunctions = new LinkedHashMap<>();
			for(final FunctionRecord function : functions) {
				final Optional<String> foundVersionHash = function.versionHash().filter(Corefw::isVersionHash);
				if(foundVersionHash.isPresent() && function.branch().filter(gitBranch::equals).isPresent()) {
					relevantFunctions.put(foundVersionHash.get().toLowerCase(Locale.ROOT), function);
				}
			}
			if(relevantFunctions.isEmpty()) {
				getLogger().error("No valid functions were found for branch `{}`; the API facade will contain no methods.", gitBranch);
			} else {
				getLogger().info("Found {} relevant functions for branch `{}`.", relevantFunctions.size(), gitBranch);
			}
			return relevantFunctions;
		});
	}

}
