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

package dev.corefw.deploy.module;

import javax.annotation.*;

import com.fasterxml.jackson.annotation.*;

import dev.corefw.ServiceProject;

/**
 * Deploys the service package descriptor.
 */
public class PackageFile extends ObjectFileModule {

	/** The type of this module in the deployment configuration. */
	public static final String TYPE = "PackageFile";

	/** The default destination of the JSON file. */
	public static final String DEFAULT_JSON_FILENAME = ServiceProject.PACKAGE_FILENAME;

	/**
	 * Constructor.
	 * @param project The project of the service being deployed.
	 * @param settings The configuration of this module.
	 */
	public PackageFile(@Nonnull final ServiceProject project, @Nonnull final Settings settings) {
		super(project, settings.name(), DEFAULT_JSON_FILENAME, settings.jsonFilename(), settings.yamlFilename());
	}

	@Override
	protected Object loadObject() {
		return getProject().getPackageData();
	}

	/**
	 * The configuration of a package file module.
	 * @param name The name of the module for logging, or <code>null</code> to use the type.
	 * @param jsonFilename The destination of the JSON file, or <code>null</code> for the default.
	 * @param yamlFilename The destination of the YAML file, or <code>null</code> for none.
	 */
	public record Settings(@JsonProperty("name") @Nullable String name, @JsonProperty("jsonFilename") @Nullable String jsonFilename,
			@JsonProperty("yamlFilename") @Nullable String yamlFilename) {
	}

}
