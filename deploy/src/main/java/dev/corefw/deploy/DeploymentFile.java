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

import static java.util.Objects.*;

import javax.annotation.*;

/**
 * A local file to be deployed to a remote location.
 * @param localRelativePath The path of the file relative to the service root.
 * @param remoteRelativePath The destination path relative to the root of the deployment target.
 */
public record DeploymentFile(@Nonnull String localRelativePath, @Nonnull String remoteRelativePath) {

	/**
	 * Constructor.
	 * @param localRelativePath The path of the file relative to the service root.
	 * @param remoteRelativePath The destination path relative to the root of the deployment target.
	 */
	public DeploymentFile {
		requireNonNull(localRelativePath);
		requireNonNull(remoteRelativePath);
	}

}
