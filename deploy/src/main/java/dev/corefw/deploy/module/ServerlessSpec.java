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

import java.util.Map;

import javax.annotation.*;

import com.fasterxml.jackson.annotation.*;

import dev.corefw.ServiceProject;

/**
 * Deploys the Serverless specification of the service.
 * <p>
 * By default the provider environment is removed before deployment, as it may contain secrets.
 * </p>
 */
public class ServerlessSpec extends ObjectFileModule {

	/** The type of this module in the deployment configuration. */
	public static final String TYPE = "ServerlessSpec";

	/** The default destination of the JSON file. */
	public static final String DEFAULT_JSON_FILENAME = "serverless.json";

	/** The default location of the specification in the service root. */
	public static final String DEFAULT_SOURCE_PATH = "serverless.json";

	private final String sourcePathRel;

	private final boolean truncateEnvironment;

	/** @return Whether the <code>provider.environment</code> section is removed before deployment. */
	public boolean isTruncateEnvironment() {
		return truncateEnvironment;
	}

	/**
	 * Constructor.
	 * @param project The project of the service being deployed.
	 * @param settings The configuration of this module.
	 */
	public ServerlessSpec(@Nonnull final ServiceProject project, @Nonnull final Settings settings) {
		super(project, settings.name(), DEFAULT_JSON_FILENAME, settings.jsonFilename(), settings.yamlFilename());
		this.sourcePathRel = settings.sourcePathRel() != null ? settings.sourcePathRel() : DEFAULT_SOURCE_PATH;
		this.truncateEnvironment = settings.truncateEnvironment() == null || settings.truncateEnvironment().booleanValue();
	}

	@Override
	protected Object loadObject() {
		final Map<String, Object> serverlessSpec = loadObjectFile(sourcePathRel);
		if(truncateEnvironment && serverlessSpec.get("provider") instanceof Map<?, ?> provider) {
			provider.remove("environment");
		}
		return serverlessSpec;
	}

	/**
	 * The configuration of a Serverless specification module.
	 * @param name The name of the module for logging, or <code>null</code> to use the type.
	 * @param sourcePathRel The location of the specification relative to the service root, or <code>null</code> for
	 *          {@value ServerlessSpec#DEFAULT_SOURCE_PATH}.
	 * @param jsonFilename The destination of the JSON file, or <code>null</code> for the default.
	 * @param yamlFilename The destination of the YAML file, or <code>null</code> for none.
	 * @param truncateEnvironment Whether the provider environment is removed, or <code>null</code> for <code>true</code>.
	 */
	public record Settings(@JsonProperty("name") @Nullable String name, @JsonProperty("sourcePathRel") @Nullable String sourcePathRel,
			@JsonProperty("jsonFilename") @Nullable String jsonFilename, @JsonProperty("yamlFilename") @Nullable String yamlFilename,
			@JsonProperty("truncateEnvironment") @Nullable Boolean truncateEnvironment) {
	}

}
