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

package dev.corefw.deploy.target;

import static java.nio.charset.StandardCharsets.*;
import static java.util.stream.Collectors.*;
import static org.zalando.fauxpas.FauxPas.*;

import java.nio.file.*;
import java.util.*;
import java.util.concurrent.CompletableFuture;

import javax.annotation.*;

import dev.corefw.*;
import dev.corefw.cloud.ObjectStorage;
import dev.corefw.deploy.*;

/**
 * A destination to which service metadata is deployed.
 * @implSpec Objects are serialized with their comment entries removed; see {@link MetaDeployHelper#withoutComments(Object)}.
 */
public abstract class MetaDeployTarget extends MetaDeployHelper {

	/**
	 * Constructor.
	 * @param project The project of the service being deployed.
	 * @param name The name of this target, or <code>null</code> to use the simple name of the class.
	 */
	protected MetaDeployTarget(@Nonnull final ServiceProject project, @Nullable final String name) {
		super(project, name);
		getLogger().info("Initializing deploy target `{}`.", getName());
	}

	/**
	 * Prepares the target to receive deployed content, before any module runs.
	 * @return A future completing when the target is ready.
	 */
	public abstract CompletableFuture<Void> prepare();

	/**
	 * Stores content at a path of the target.
	 * @param remoteRelativePath The destination path relative to the root of the target.
	 * @param content The content to store.
	 * @param contentType The media type of the content, or <code>null</code> if not known.
	 * @return A future completing when the content is stored.
	 */
	protected abstract CompletableFuture<Void> putObject(@Nonnull String remoteRelativePath, @Nonnull byte[] content, @Nullable String contentType);

	/**
	 * Stores an object serialized as JSON.
	 * @param remoteRelativePath The destination path relative to the root of the target.
	 * @param object The tree to serialize.
	 * @return A future completing when the JSON is stored.
	 */
	public CompletableFuture<Void> putObjectAsJson(@Nonnull final String remoteRelativePath, @Nullable final Object object) {
		final byte[] json;
		try {
			json = Marshalling.toPrettyJson(withoutComments(object)).getBytes(UTF_8);
		} catch(final MarshalException marshalException) {
			return CompletableFuture.failedFuture(marshalException);
		}
		return putObject(remoteRelativePath, json, ObjectStorage.CONTENT_TYPE_JSON);
	}

	/**
	 * Stores an object serialized as YAML.
	 * @param remoteRelativePath The destination path relative to the root of the target.
	 * @param object The tree to serialize.
	 * @return A future completing when the YAML is stored.
	 */
	public CompletableFuture<Void> putObjectAsYaml(@Nonnull final String remoteRelativePath, @Nullable final Object object) {
		final byte[] yaml;
		try {
			yaml = Marshalling.toYaml(withoutComments(object)).getBytes(UTF_8);
		} catch(final MarshalException marshalException) {
			return CompletableFuture.failedFuture(marshalException);
		}
		return putObject(remoteRelativePath, yaml, ObjectStorage.CONTENT_TYPE_YAML);
	}

	/**
	 * Deploys a single local file.
	 * @param localRelativePath The path of the file relative to the service root.
	 * @param remoteRelativePath The destination path relative to the root of the target.
	 * @return A future completing when the file is stored, or completing exceptionally with an {@link java.io.IOException} if the file cannot be read.
	 */
	public CompletableFuture<Void> deployFile(@Nonnull final String localRelativePath, @Nonnull final String remoteRelativePath) {
		final Path localAbsolutePath = resolveLocalAbs(localRelativePath);
		getLogger().info("Deploying `{}` to `/{}`.", localAbsolutePath, DeployPaths.toRelative(remoteRelativePath));
		return CompletableFuture.completedFuture(localAbsolutePath).thenApply(throwingFunction(Files::readAllBytes))
				.thenCompose(content -> putObject(remoteRelativePath, content, null));
	}

	/**
	 * Deploys several local files concurrently.
	 * @param files The files to deploy.
	 * @return A future completing when all the files are stored.
	 */
	public CompletableFuture<Void> deployFiles(@Nonnull final Collection<DeploymentFile> files) {
		final List<CompletableFuture<Void>> futureDeployments = files.stream()
				.map(file -> deployFile(file.localRelativePath(), file.remoteRelativePath())).collect(toList());
		return CompletableFuture.allOf(futureDeployments.toArray(CompletableFuture[]::new));
	}

}
