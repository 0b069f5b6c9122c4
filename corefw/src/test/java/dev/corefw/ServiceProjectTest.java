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

import static java.nio.charset.StandardCharsets.*;
import static org.hamcrest.MatcherAssert.*;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.*;
import java.util.*;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests of {@link ServiceProject}.
 */
public class ServiceProjectTest {

	@TempDir
	Path rootPath;

	private void writePackage(final String json) throws IOException {
		Files.writeString(rootPath.resolve(ServiceProject.PACKAGE_FILENAME), json, UTF_8);
	}

	@Test
	void testVersionComponents() throws IOException {
		writePackage("{\"name\": \"sls-service-users\", \"version\": \"2.5.17\"}");
		final ServiceProject project = ServiceProject.load(rootPath, null, Map.of(Corefw.ENV_GIT_BRANCH, "master"));
		assertThat(project.getVersionFull(), is("2.5.17"));
		assertThat(project.getVersionMajor(), is("2"));
		assertThat(project.getVersionMinor(), is("5"));
		assertThat(project.getVersionRevision(), is("17"));
	}

	@Test
	void testMissingVersionComponentsDefaultToZero() throws IOException {
		writePackage("{\"name\": \"users\", \"version\": \"3\"}");
		final ServiceProject project = ServiceProject.load(rootPath, null, Map.of(Corefw.ENV_GIT_BRANCH, "master"));
		assertThat(project.getVersionMajor(), is("3"));
		assertThat(project.getVersionMinor(), is("0"));
		assertThat(project.getVersionRevision(), is("0"));
	}

	@Test
	void testMissingVersionThrows() throws IOException {
		writePackage("{\"name\": \"users\"}");
		assertThrows(ConfigurationException.class, () -> ServiceProject.load(rootPath, null, Map.of(Corefw.ENV_GIT_BRANCH, "master")));
	}

	@Test
	void testMissingPackageThrows() {
		assertThrows(ConfigurationException.class, () -> ServiceProject.load(rootPath, null, Map.of(Corefw.ENV_GIT_BRANCH, "master")));
	}

	@Test
	void testServiceNames() throws IOException {
		writePackage("{\"name\": \"sls-service-users\", \"version\": \"1.0.0\"}");
		final ServiceProject project = ServiceProject.load(rootPath, null, Map.of(Corefw.ENV_GIT_BRANCH, "master"));
		assertThat(project.getServiceName(), is("sls-service-users"));
		assertThat(project.getServiceNameShort(), is("users"));
		final ServiceProject overridden = ServiceProject.load(rootPath, "sls-service-billing", Map.of(Corefw.ENV_GIT_BRANCH, "master"));
		assertThat(overridden.getServiceName(), is("sls-service-billing"));
		assertThat(overridden.getServiceNameShort(), is("billing"));
	}

	@Test
	void testGitBranchFromEnvironmentPrecedence() throws IOException {
		writePackage("{\"name\": \"users\", \"version\": \"1.0.0\"}");
		assertThat(ServiceProject.load(rootPath, null, Map.of(Corefw.ENV_GIT_BRANCH, "feature", Corefw.ENV_TRAVIS_BRANCH, "travis")).getGitBranch(),
				is("feature"));
		assertThat(ServiceProject.load(rootPath, null, Map.of(Corefw.ENV_TRAVIS_BRANCH, "travis")).getGitBranch(), is("travis"));
	}

	@Test
	void testGitBranchFromHeadFile() throws IOException {
		writePackage("{\"name\": \"users\", \"version\": \"1.0.0\"}");
		Files.createDirectories(rootPath.resolve(".git"));
		Files.writeString(rootPath.resolve(ServiceProject.GIT_HEAD_PATH), "ref: refs/heads/develop\n", UTF_8);
		assertThat(ServiceProject.load(rootPath, null, Map.of()).getGitBranch(), is("develop"));
	}

	@Test
	void testGitBranchMissingHeadFileThrows() throws IOException {
		writePackage("{\"name\": \"users\", \"version\": \"1.0.0\"}");
		assertThrows(ConfigurationException.class, () -> ServiceProject.load(rootPath, null, Map.of()));
	}

	@Test
	void testParseGitBranch() {
		assertThat(ServiceProject.parseGitBranch("ref: refs/heads/master\n"), is("master"));
		assertThat(ServiceProject.parseGitBranch("ref: refs/heads/release-2.1\r\n"), is("release-2.1"));
		assertThrows(ConfigurationException.class, () -> ServiceProject.parseGitBranch("4f2b9c1a0d3e5f6a7b8c9d0e1f2a3b4c5d6e7f80\n"));
	}

	@Test
	void testCommonGlobalVariables() throws IOException {
		writePackage("{\"name\": \"sls-service-users\", \"version\": \"1.2.3\"}");
		final Map<String, Object> variables = ServiceProject.load(rootPath, null, Map.of(Corefw.ENV_GIT_BRANCH, "develop")).getCommonGlobalVariables();
		assertThat(new ArrayList<>(variables.keySet()),
				is(List.of("versionMajor", "versionMinor", "versionRevision", "versionFull", "serviceName", "serviceNameShort", "gitBranch")));
		assertThat(variables.get("versionFull"), is("1.2.3"));
		assertThat(variables.get("serviceNameShort"), is("users"));
		assertThat(variables.get("gitBranch"), is("develop"));
	}

	@Test
	void testLoadConfigFileSubstitutesGlobals() throws IOException {
		writePackage("{\"name\": \"sls-service-users\", \"version\": \"1.2.3\"}");
		Files.createDirectories(rootPath.resolve("config"));
		Files.writeString(rootPath.resolve("config/test.yml"), "Stage: ${gitBranch}\nName: ${serviceNameShort}-v${versionMajor}\n", UTF_8);
		final ServiceProject project = ServiceProject.load(rootPath, null, Map.of(Corefw.ENV_GIT_BRANCH, "develop"));
		assertThat(project.loadConfigFile("config/test.yml"), is(Map.of("Stage", "develop", "Name", "users-v1")));
		assertThat(project.loadYamlFile("config/test.yml"), is(Map.of("Stage", "${gitBranch}", "Name", "${serviceNameShort}-v${versionMajor}")));
		assertThat(project.loadJsonFile(ServiceProject.PACKAGE_FILENAME), is(Map.of("name", "sls-service-users", "version", "1.2.3")));
		assertThrows(ConfigurationException.class, () -> project.loadConfigFile("config/missing.yml"));
	}

}
