package org.springaicommunity.credentialforge;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a single {@link GenerationJob} through content generation, credential generation,
 * embedding and synthesis.
 *
 * <p>
 * {@link #execute(GenerationJob)} never throws: every failure is captured as a
 * {@link GenerationResult.Failure} carrying the stage and error kind. Stages:
 * <ol>
 * <li>Content: content strategies are tried in rank order and the first success serves
 * the content. If none succeeds the job fails with
 * {@link ErrorKind#CONTENT_GENERATION}.</li>
 * <li>Credentials: each requested type is generated independently. Types that fail are
 * recorded on the success; if none succeeds the job fails with
 * {@link ErrorKind#CREDENTIAL_GENERATION}.</li>
 * <li>Embedding: the {@link EmbeddingStrategyEngine} decides placement for the
 * credentials actually generated.</li>
 * <li>Synthesis: a single attempt; any failure is {@link ErrorKind#SYNTHESIS}.</li>
 * </ol>
 * Calls exceeding the guard's timeout are reported as {@link ErrorKind#TIMEOUT} once no
 * other alternative remains.
 *
 * <p>
 * An executor holds collaborator instances that are not shared with other workers.
 */
public class JobExecutor implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(JobExecutor.class);

	private final CredentialGenerator credentialGenerator;

	private final List<ContentStrategy> contentStrategies;

	private final DocumentSynthesizer synthesizer;

	private final EmbeddingStrategyEngine embeddingEngine;

	private final CollaboratorCallGuard callGuard;

	private final String embedStrategy;

	private final long batchStartTime;

	public JobExecutor(CredentialGenerator credentialGenerator, List<ContentStrategy> contentStrategies,
			DocumentSynthesizer synthesizer, EmbeddingStrategyEngine embeddingEngine, CollaboratorCallGuard callGuard,
			String embedStrategy, long batchStartTime) {
		if (contentStrategies.isEmpty()) {
			throw new IllegalArgumentException("At least one content strategy is required");
		}
		this.credentialGenerator = credentialGenerator;
		this.contentStrategies = List.copyOf(contentStrategies);
		this.synthesizer = synthesizer;
		this.embeddingEngine = embeddingEngine;
		this.callGuard = callGuard;
		this.embedStrategy = embedStrategy;
		this.batchStartTime = batchStartTime;
	}

	/**
	 * Execute a job.
	 * @param job the job
	 * @return a success or a failure, never {@code null}
	 */
	public GenerationResult execute(GenerationJob job) {
		JobStage stage = JobStage.CONTENT;
		try {
			Map<String, Object> context = buildContext(job);

			ContentOutcome content = generateContent(job, context);
			if (content.failure() != null) {
				return content.failure();
			}

			stage = JobStage.CREDENTIALS;
			List<GeneratedCredential> credentials = new ArrayList<>();
			List<String> failedTypes = new ArrayList<>();
			GenerationResult.Failure credentialFailure = generateCredentials(job, context, credentials, failedTypes);
			if (credentialFailure != null) {
				return credentialFailure;
			}

			stage = JobStage.EMBEDDING;
			List<String> embeddedTypes = credentials.stream().map(GeneratedCredential::type).toList();
			EmbeddingDecision decision = embeddingEngine.decide(job.format(), embeddedTypes, content.text().length(),
					embedStrategy, job.seed());
			if (decision.fallbackApplied()) {
				logger.info("Job {}: {}", job.jobIndex(), decision.fallbackReason());
			}

			stage = JobStage.SYNTHESIS;
			Path written;
			try {
				written = callGuard.call(() -> synthesizer.synthesize(job.format(), content.text(), credentials, decision,
						job.targetPath()), "synthesis of " + job.targetPath().getFileName());
			}
			catch (CollaboratorTimeoutException e) {
				return failure(job, stage, ErrorKind.TIMEOUT, e.getMessage());
			}
			catch (RuntimeException e) {
				logger.warn("Job {}: synthesis failed: {}", job.jobIndex(), e.getMessage());
				return failure(job, stage, ErrorKind.SYNTHESIS, describe(e));
			}

			logger.debug("Job {}: wrote {} with {} credentials ({})", job.jobIndex(), written, credentials.size(),
					decision.mode().id());
			return new GenerationResult.Success(job.jobIndex(), written.toString(), job.format(), job.topic(),
					embeddedTypes, credentials.size(), decision, content.source(), failedTypes);
		}
		catch (RuntimeException e) {
			logger.error("Job {}: unexpected error during {}", job.jobIndex(), stage, e);
			return failure(job, stage, ErrorKind.UNEXPECTED, describe(e));
		}
	}

	@Override
	public void close() {
		callGuard.close();
	}

	Map<String, Object> buildContext(GenerationJob job) {
		Map<String, Object> context = new LinkedHashMap<>();
		context.put("file_index", job.jobIndex());
		context.put("unique_seed", job.seed());
		context.put("generation_timestamp", Instant.ofEpochMilli(batchStartTime).toString());
		context.put("language", job.language());
		context.put("format", job.format());
		return context;
	}

	private ContentOutcome generateContent(GenerationJob job, Map<String, Object> context) {
		int timeouts = 0;
		List<String> errors = new ArrayList<>();
		for (ContentStrategy strategy : contentStrategies) {
			try {
				String text = callGuard.call(() -> strategy.generate(job.topic(), job.format(), context),
						"content from " + strategy.name());
				if (text == null || text.isBlank()) {
					errors.add(strategy.name() + ": empty content");
					continue;
				}
				return new ContentOutcome(text, strategy.name(), null);
			}
			catch (CollaboratorTimeoutException e) {
				timeouts++;
				errors.add(strategy.name() + ": " + e.getMessage());
			}
			catch (RuntimeException e) {
				logger.debug("Job {}: content strategy {} failed: {}", job.jobIndex(), strategy.name(), e.getMessage());
				errors.add(strategy.name() + ": " + describe(e));
			}
		}

		ErrorKind kind = timeouts == contentStrategies.size() ? ErrorKind.TIMEOUT : ErrorKind.CONTENT_GENERATION;
		logger.warn("Job {}: no content strategy succeeded for topic '{}'", job.jobIndex(), job.topic());
		return new ContentOutcome("", "",
				failure(job, JobStage.CONTENT, kind, "All content strategies failed: " + String.join("; ", errors)));
	}

	private GenerationResult.@Nullable Failure generateCredentials(GenerationJob job, Map<String, Object> context,
			List<GeneratedCredential> credentials, List<String> failedTypes) {
		int timeouts = 0;
		List<String> errors = new ArrayList<>();
		for (String type : job.credentialTypes()) {
			try {
				String value = callGuard.call(() -> credentialGenerator.generateCredential(type, context),
						"credential " + type);
				credentials.add(new GeneratedCredential(type, value));
			}
			catch (CollaboratorTimeoutException e) {
				timeouts++;
				failedTypes.add(type);
				errors.add(type + ": " + e.getMessage());
			}
			catch (RuntimeException e) {
				logger.debug("Job {}: credential type {} failed: {}", job.jobIndex(), type, e.getMessage());
				failedTypes.add(type);
				errors.add(type + ": " + describe(e));
			}
		}

		if (!credentials.isEmpty()) {
			if (!failedTypes.isEmpty()) {
				logger.warn("Job {}: skipped credential types {}", job.jobIndex(), failedTypes);
			}
			return null;
		}
		ErrorKind kind = timeouts == job.credentialTypes().size() && timeouts > 0 ? ErrorKind.TIMEOUT
				: ErrorKind.CREDENTIAL_GENERATION;
		return failure(job, JobStage.CREDENTIALS, kind,
				"No credential could be generated: " + String.join("; ", errors));
	}

	private static GenerationResult.Failure failure(GenerationJob job, JobStage stage, ErrorKind kind,
			String message) {
		return new GenerationResult.Failure(job.jobIndex(), stage, kind, message);
	}

	private static String describe(RuntimeException e) {
		return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
	}

	private record ContentOutcome(String text, String source, GenerationResult.@Nullable Failure failure) {
	}

}
