package org.springaicommunity.credentialforge;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;
import java.util.function.IntSupplier;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Builder for creating a {@link BatchOrchestrator} without Spring dependencies.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Built-in regex database, template content and text documents
 * BatchOrchestrator orchestrator = CredentialForgeBuilder.create().build();
 *
 * // With a custom regex database and configuration
 * ForgeProperties props = new ForgeProperties();
 * props.setCredentialsPerFile(3);
 *
 * BatchOrchestrator orchestrator = CredentialForgeBuilder.create()
 *     .properties(props)
 *     .regexDatabase(Path.of("patterns.json"))
 *     .build();
 *
 * BatchReport report = orchestrator.run(BatchConfiguration.builder(props)
 *     .fileCount(100)
 *     .formats("eml", "xlsx")
 *     .credentialTypes("aws_access_key", "github_token")
 *     .topics("quarterly planning")
 *     .build());
 *
 * // For testing with mock collaborators
 * BatchOrchestrator testOrchestrator = CredentialForgeBuilder.create()
 *     .credentialGenerator(() -> mockGenerator)
 *     .synthesizer(() -> mockSynthesizer)
 *     .build();
 * }
 * </pre>
 *
 * Collaborators are given as factories; the orchestrator calls each factory once per
 * worker.
 */
public class CredentialForgeBuilder {

	private ForgeProperties properties;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private Path regexDatabasePath;

	@Nullable
	private Supplier<CredentialGenerator> credentialGenerator;

	@Nullable
	private Supplier<List<ContentStrategy>> contentStrategies;

	@Nullable
	private Supplier<DocumentSynthesizer> synthesizer;

	@Nullable
	private ReportRepository reportRepository;

	@Nullable
	private IntSupplier cpuCount;

	@Nullable
	private LongSupplier clock;

	private CredentialForgeBuilder() {
		this.properties = new ForgeProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new CredentialForgeBuilder
	 */
	public static CredentialForgeBuilder create() {
		return new CredentialForgeBuilder();
	}

	/**
	 * Set forge properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public CredentialForgeBuilder properties(@Nullable ForgeProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper used for the regex database and the report.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public CredentialForgeBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Load credential patterns from a file instead of the built-in database. Ignored when a
	 * custom credential generator is set.
	 * @param path JSON regex database (null to use the properties or the built-in one)
	 * @return this builder
	 */
	public CredentialForgeBuilder regexDatabase(@Nullable Path path) {
		this.regexDatabasePath = path;
		return this;
	}

	/**
	 * Set a custom credential generator factory.
	 * @param credentialGenerator factory called once per worker (null to use default)
	 * @return this builder
	 */
	public CredentialForgeBuilder credentialGenerator(@Nullable Supplier<CredentialGenerator> credentialGenerator) {
		this.credentialGenerator = credentialGenerator;
		return this;
	}

	/**
	 * Set the ranked content strategies. The first strategy that succeeds serves a job's
	 * content.
	 * @param contentStrategies factory called once per worker (null to use the template
	 * strategy alone)
	 * @return this builder
	 */
	public CredentialForgeBuilder contentStrategies(@Nullable Supplier<List<ContentStrategy>> contentStrategies) {
		this.contentStrategies = contentStrategies;
		return this;
	}

	/**
	 * Set a custom document synthesizer factory.
	 * @param synthesizer factory called once per worker (null to use default)
	 * @return this builder
	 */
	public CredentialForgeBuilder synthesizer(@Nullable Supplier<DocumentSynthesizer> synthesizer) {
		this.synthesizer = synthesizer;
		return this;
	}

	/**
	 * Set a custom ReportRepository implementation.
	 * @param reportRepository custom repository (null to use default)
	 * @return this builder
	 */
	public CredentialForgeBuilder reportRepository(@Nullable ReportRepository reportRepository) {
		this.reportRepository = reportRepository;
		return this;
	}

	/**
	 * Override the logical CPU count used for pool sizing.
	 * @param cpuCount CPU count source (null to ask the runtime)
	 * @return this builder
	 */
	public CredentialForgeBuilder cpuCount(@Nullable IntSupplier cpuCount) {
		this.cpuCount = cpuCount;
		return this;
	}

	/**
	 * Override the clock that supplies batch start times.
	 * @param clock epoch-millis source (null to use the system clock)
	 * @return this builder
	 */
	public CredentialForgeBuilder clock(@Nullable LongSupplier clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Build a BatchOrchestrator.
	 * @return configured BatchOrchestrator
	 * @throws ConfigurationException if the regex database cannot be loaded
	 */
	public BatchOrchestrator build() {
		Components components = buildComponents();
		return new BatchOrchestrator(components.credentialGenerator, components.contentStrategies,
				components.synthesizer, new EmbeddingStrategyEngine(), new JobPlanner(), components.reportRepository,
				cpuCount != null ? cpuCount : () -> Runtime.getRuntime().availableProcessors(),
				clock != null ? clock : System::currentTimeMillis);
	}

	private Components buildComponents() {
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();

		Supplier<CredentialGenerator> generators = this.credentialGenerator;
		if (generators == null) {
			RegexCredentialDatabase database = loadDatabase(mapper);
			generators = () -> new PatternCredentialGenerator(database);
		}
		Supplier<List<ContentStrategy>> strategies = this.contentStrategies != null ? this.contentStrategies
				: () -> List.of(new TemplateContentStrategy());
		Supplier<DocumentSynthesizer> synthesizers = this.synthesizer != null ? this.synthesizer
				: TextDocumentSynthesizer::new;
		ReportRepository repository = this.reportRepository != null ? this.reportRepository
				: new FileSystemReportRepository(mapper);

		return new Components(generators, strategies, synthesizers, repository);
	}

	private RegexCredentialDatabase loadDatabase(ObjectMapper mapper) {
		Path path = regexDatabasePath;
		if (path == null && properties.getRegexDbPath() != null) {
			path = Path.of(properties.getRegexDbPath());
		}
		return path != null ? RegexCredentialDatabase.load(path, mapper) : RegexCredentialDatabase.loadDefault(mapper);
	}

	/**
	 * Internal record to hold built components.
	 */
	private record Components(Supplier<CredentialGenerator> credentialGenerator,
			Supplier<List<ContentStrategy>> contentStrategies, Supplier<DocumentSynthesizer> synthesizer,
			ReportRepository reportRepository) {
	}

}
