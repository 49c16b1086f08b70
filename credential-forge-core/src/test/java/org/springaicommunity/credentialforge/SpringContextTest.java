package org.springaicommunity.credentialforge;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Spring context tests for the optional {@link CredentialForgeConfig}.
 *
 * Uses @SpringJUnitConfig with a minimal context; documents are written to a temporary
 * directory only.
 */
@SpringJUnitConfig(CredentialForgeConfig.class)
@TestPropertySource(properties = { "credentialforge.batch-size=5", "credentialforge.embed-strategy=metadata-field",
		"credentialforge.memory-limit-mb=4096", "credentialforge.credentials-per-file=2" })
@DisplayName("Credential Forge - Spring Context Tests")
class SpringContextTest {

	@Autowired
	private ForgeProperties forgeProperties;

	@Autowired
	private ObjectMapper forgeObjectMapper;

	@Autowired
	private BatchOrchestrator batchOrchestrator;

	@TempDir
	Path tempDir;

	@Nested
	@DisplayName("Spring Bean Wiring Validation")
	class SpringBeanWiringTest {

		@Test
		@DisplayName("Should bind properties from the environment")
		void shouldBindProperties() {
			assertThat(forgeProperties.getBatchSize()).isEqualTo(5);
			assertThat(forgeProperties.getEmbedStrategy()).isEqualTo("metadata-field");
			assertThat(forgeProperties.getMemoryLimitBytes()).isEqualTo(4096L * 1024 * 1024);
			assertThat(forgeProperties.getCredentialsPerFile()).isEqualTo(2);
			assertThat(forgeProperties.getRegexDbPath()).isNull();
		}

		@Test
		@DisplayName("Should wire the orchestrator and object mapper")
		void shouldWireBeans() {
			assertThat(batchOrchestrator).isNotNull();
			assertThat(forgeObjectMapper.getPropertyNamingStrategy()).isNotNull();
		}

	}

	@Test
	@DisplayName("Should run a batch through the wired orchestrator")
	void shouldRunBatch() {
		BatchReport report = batchOrchestrator.run(BatchConfiguration.builder(forgeProperties)
			.outputDirectory(tempDir)
			.fileCount(2)
			.formats("docx")
			.credentialTypes("aws_access_key", "github_token")
			.topics("vendor onboarding")
			.build());

		assertThat(report.allSucceeded()).isTrue();
		assertThat(report.totalCredentials()).isEqualTo(4);
		assertThat(report.successes())
			.allMatch(success -> success.embedding().mode() == EmbeddingMode.METADATA_FIELD);
	}

}
