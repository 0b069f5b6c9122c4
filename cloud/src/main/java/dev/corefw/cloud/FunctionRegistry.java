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
 * The registry of compute functions deployed in a cloud account.
 */
public interface FunctionRegistry {

	/**
	 * Lists a single page of deployed functions.
	 * @param pageSize The maximum number of functions to return.
	 * @param marker The continuation marker returned with the previous page, or <code>null</code> for the first page.
	 * @return A future page of function records.
	 */
	CompletableFuture<FunctionPage> listFunctions(int pageSize, @Nullable String marker);

	/**
	 * A single page of deployed functions.
	 * @param functions The functions in this page.
	 * @param nextMarker The marker for retrieving the next page, or empty if this is the last page.
	 */
	record FunctionPage(@Nonnull List<FunctionRecord> functions, @Nonnull Optional<String> nextMarker) {

		/**
		 * Constructor.
		 * @param functions The functions in this page.
		 * @param nextMarker The marker for retrieving the next page, or empty if this is the last page.
		 */
		public FunctionPage {
			functions = List.copyOf(functions);
			nextMarker = nextMarker.filter(marker -> !marker.isEmpty());
		}

	}

}
