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
 * Deploys the OpenAPI specification of the service.
 */
public class OpenApiSpec extends ObjectFileModule {

	/** The type of this module in the deployment configuration. */
	public static final String TYPE = "OpenApiSpec";

	/** The default destination of the JSON file. */
	public static final String DEFAULT_JSON_FILENAME = "openapi.json";

	/** The default location of the specification in the service root. */
	public static final String DEFAULT_SOURCE_PATH = "openapi.json";

	private final String sourcePathRel;

	/**
	 * Constructor.
	 * @param project The project of the service being deployed.
	 * @param settings The configuration of this module.
	 */
	public OpenApiSpec(@Nonnull final ServiceProject project, @Nonnull final Settings settings) {
		super(project, settings.name(), DEFAULT_JSON_FILENAME, settings.jsonFilename(), settings.yamlFilename());
		this.sourcePathRel = settings.sourcePathRel() != null ? settings.sourcePathRel() : DEFAULT_SOURCE_PATH;
	}

	@Override
	protected Object loadObject() {
		return loadObjectFile(sourcePathRel);
	}

	/**
	 * The configuration of an OpenAPI specification module.
	 * @param name The name of the module for logging, or <code>null</code> to use the type.
	 * @param sourcePathRel The location of the specification relative to the service root, or <code>null</code> for {@value OpenApiSpec#DEFAULT_SOURCE_PATH}.
	 * @param jsonFilename The destination of the JSON file, or <code>null</code> for the default.
	 * @param yamlFilename The destination of the YAML file, or <code>null</code> for none.
	 */
	public record Settings(@JsonProperty("name") @Nullable String name, @JsonProperty("sourcePathRel") @Nullable String sourcePathRel,
			@JsonProperty("jsonFilename") @Nullable String jsonFilename, @JsonProperty("yamlFilename") @Nullable String yamlFilename) {
	}

}
