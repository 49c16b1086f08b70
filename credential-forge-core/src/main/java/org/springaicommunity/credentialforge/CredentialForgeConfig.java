package org.springaicommunity.credentialforge;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration exposing a ready {@link BatchOrchestrator}.
 *
 * <p>
 * Optional: the library and the CLI work without Spring. Property keys live under the
 * {@code credentialforge} prefix and all have defaults.
 */
@Configuration
public class CredentialForgeConfig {

	@Value("${credentialforge.output-dir:./output}")
	private String outputDir;

	@Value("${credentialforge.batch-size:10}")
	private int batchSize;

	@Value("${credentialforge.embed-strategy:random}")
	private String embedStrategy;

	@Value("${credentialforge.concurrent:true}")
	private boolean concurrent;

	@Value("${credentialforge.memory-limit-mb:0}")
	private long memoryLimitMb;

	@Value("${credentialforge.credentials-per-file:1}")
	private int credentialsPerFile;

	@Value("${credentialforge.regex-db:}")
	private String regexDb;

	@Bean
	public ForgeProperties forgeProperties() {
		ForgeProperties properties = new ForgeProperties();
		properties.setOutputDir(outputDir);
		properties.setBatchSize(batchSize);
		properties.setEmbedStrategy(embedStrategy);
		properties.setConcurrent(concurrent);
		if (memoryLimitMb > 0) {
			properties.setMemoryLimitBytes(memoryLimitMb * 1024 * 1024);
		}
		properties.setCredentialsPerFile(credentialsPerFile);
		if (!regexDb.isBlank()) {
			properties.setRegexDbPath(regexDb);
		}
		return properties;
	}

	@Bean
	public ObjectMapper forgeObjectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public BatchOrchestrator batchOrchestrator(ForgeProperties forgeProperties, ObjectMapper forgeObjectMapper) {
		return CredentialForgeBuilder.create().properties(forgeProperties).objectMapper(forgeObjectMapper).build();
	}

}
