package org.springaicommunity.credentialforge;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line argument parser for the generate command. Pure Java implementation with no
 * Spring dependencies.
 */
public class ForgeArgumentParser {

	private final ForgeProperties defaultProperties;

	public ForgeArgumentParser(ForgeProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-o", "--output-dir":
					config.outputDir = getRequiredValue(args, i, "output-dir");
					i++;
					break;

				case "-n", "--num-files":
					config.numFiles = parseInt(getRequiredValue(args, i, "num-files"), "number of files", true);
					i++;
					break;

				case "-f", "--formats":
					config.formats = splitList(getRequiredValue(args, i, "formats"));
					i++;
					break;

				case "-c", "--credential-types":
					config.credentialTypes = splitList(getRequiredValue(args, i, "credential-types"));
					i++;
					break;

				case "-t", "--topics":
					config.topics = splitList(getRequiredValue(args, i, "topics"));
					i++;
					break;

				case "-l", "--language":
					config.languages = splitList(getRequiredValue(args, i, "language"));
					i++;
					break;

				case "-e", "--embed-strategy":
					String strategy = getRequiredValue(args, i, "embed-strategy").toLowerCase();
					if (!EmbeddingMode.isKnownStrategy(strategy)) {
						throw new IllegalArgumentException("Invalid embed strategy '" + strategy
								+ "': must be 'random', 'inline-body', 'attachment-blob', 'metadata-field' or 'distributed-sections'");
					}
					config.embedStrategy = strategy;
					i++;
					break;

				case "--credentials-per-file":
					config.credentialsPerFile = parseInt(getRequiredValue(args, i, "credentials-per-file"),
							"credentials per file", false);
					i++;
					break;

				case "--topics-per-file":
					config.topicsPerFile = parseInt(getRequiredValue(args, i, "topics-per-file"), "topics per file",
							false);
					i++;
					break;

				case "--selection":
					config.selectionPolicy = SelectionPolicy.fromId(getRequiredValue(args, i, "selection").toLowerCase());
					i++;
					break;

				case "--regex-db":
					config.regexDb = getRequiredValue(args, i, "regex-db");
					i++;
					break;

				case "--add-type":
					config.addType = getRequiredValue(args, i, "add-type").trim();
					i++;
					break;

				case "--regex":
					config.addRegex = getRequiredValue(args, i, "regex");
					i++;
					break;

				case "--description":
					config.addDescription = getRequiredValue(args, i, "description");
					i++;
					break;

				case "--generator":
					config.addGenerator = getRequiredValue(args, i, "generator");
					i++;
					break;

				case "-b", "--batch-size":
					config.batchSize = parseInt(getRequiredValue(args, i, "batch-size"), "batch size", false);
					i++;
					break;

				case "--sequential":
					config.concurrent = false;
					break;

				case "--memory-limit-mb":
					config.memoryLimitBytes = megabytes(
							parseInt(getRequiredValue(args, i, "memory-limit-mb"), "memory limit", false));
					i++;
					break;

				case "--worker-memory-mb":
					config.perWorkerMemoryBytes = megabytes(
							parseInt(getRequiredValue(args, i, "worker-memory-mb"), "worker memory", false));
					i++;
					break;

				case "--max-workers":
					config.maxWorkers = parseInt(getRequiredValue(args, i, "max-workers"), "max workers", false);
					i++;
					break;

				case "--timeout":
					config.jobTimeout = Duration
						.ofSeconds(parseInt(getRequiredValue(args, i, "timeout"), "timeout seconds", false));
					i++;
					break;

				case "--seed":
					String seedStr = getRequiredValue(args, i, "seed");
					try {
						config.seed = Long.parseLong(seedStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException("Invalid seed '" + seedStr + "': must be an integer");
					}
					i++;
					break;

				case "--clean":
					config.clean = true;
					break;

				case "--no-report":
					config.writeReport = false;
					break;

				case "--list-types":
					config.listCredentialTypes = true;
					break;

				case "--list-formats":
					config.listFormats = true;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		if (config.isInformationOnly()) {
			return config;
		}
		if (config.isDatabaseUpdate()) {
			validateDatabaseUpdate(config);
		}
		else {
			validateConfiguration(config);
		}

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: credential-forge [OPTIONS]\n");
		help.append("\n");
		help.append("Generate synthetic documents carrying fake credentials for security tool testing.\n");
		help.append("\n");
		help.append("REQUIRED:\n");
		help.append("    -n, --num-files N           Number of documents to generate\n");
		help.append("    -f, --formats LIST          Comma-separated formats, e.g. eml,xlsx,pdf\n");
		help.append("    -c, --credential-types LIST Comma-separated credential types\n");
		help.append("    -t, --topics LIST           Comma-separated topics\n");
		help.append("\n");
		help.append("GENERATION OPTIONS:\n");
		help.append("    -o, --output-dir DIR        Output directory (default: ")
			.append(defaultProperties.getOutputDir())
			.append(")\n");
		help.append("    -l, --language LIST         Content languages (default: ")
			.append(defaultProperties.getDefaultLanguage())
			.append(")\n");
		help.append("    -e, --embed-strategy NAME   random, inline-body, attachment-blob, metadata-field,\n");
		help.append("                                distributed-sections (default: ")
			.append(defaultProperties.getEmbedStrategy())
			.append(")\n");
		help.append("    --credentials-per-file K    Distinct credential types per document (default: ")
			.append(defaultProperties.getCredentialsPerFile())
			.append(")\n");
		help.append("    --topics-per-file K         Combine up to K topics per document (default: ")
			.append(defaultProperties.getMaxTopicsPerFile())
			.append(")\n");
		help.append("    --selection POLICY          round-robin or random (default: ")
			.append(defaultProperties.getSelectionPolicy().id())
			.append(")\n");
		help.append("    --regex-db FILE             Regex database JSON (default: built-in)\n");
		help.append("    --seed MILLIS               Fixed batch start time; replays a previous batch\n");
		help.append("\n");
		help.append("EXECUTION OPTIONS:\n");
		help.append("    -b, --batch-size N          Log progress every N documents (default: ")
			.append(defaultProperties.getBatchSize())
			.append(")\n");
		help.append("    --sequential                Run jobs one at a time\n");
		help.append("    --memory-limit-mb MB        Memory ceiling for the worker pool\n");
		help.append("    --worker-memory-mb MB       Memory estimate per worker (default: ")
			.append(defaultProperties.getPerWorkerMemoryBytes() / (1024 * 1024))
			.append(")\n");
		help.append("    --max-workers N             Upper bound on workers (default: ")
			.append(defaultProperties.getMaxWorkers())
			.append(")\n");
		help.append("    --timeout SECONDS           Abandon a collaborator call after SECONDS\n");
		help.append("\n");
		help.append("OUTPUT OPTIONS:\n");
		help.append("    --clean                     Empty the output directory before generating\n");
		help.append("    --no-report                 Do not write generation_report.json\n");
		help.append("    -v, --verbose               Enable verbose logging\n");
		help.append("\n");
		help.append("REGEX DATABASE:\n");
		help.append("    --add-type TYPE             Add a credential type to the --regex-db file and exit\n");
		help.append("    --regex REGEX               Pattern of the new type\n");
		help.append("    --description TEXT          Description of the new type\n");
		help.append("    --generator HINT            Optional generator hint, e.g. jwt\n");
		help.append("\n");
		help.append("INFORMATION:\n");
		help.append("    --list-types                List the credential types of the regex database\n");
		help.append("    --list-formats              List supported formats and embedding modes\n");
		help.append("    -h, --help                  Show this help message\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    ").append(EnvironmentSupport.REGEX_DB).append("     Regex database file\n");
		help.append("    ").append(EnvironmentSupport.MEMORY_LIMIT_MB).append("  Memory ceiling in MB\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    credential-forge -n 10 -f eml,xlsx -c aws_access_key,github_token -t \"cloud migration\"\n");
		help.append("    credential-forge -n 100 -f pdf,pptx -c aws_access_key -t \"audit,planning\" \\\n");
		help.append("        --credentials-per-file 2 --embed-strategy distributed-sections --clean\n");
		help.append("    credential-forge -n 5 -f docx -c jwt -t onboarding --seed 1700000000000\n");
		help.append("    credential-forge --regex-db my-db.json --add-type acme_key --regex \"acme_[a-f0-9]{32}\" \\\n");
		help.append("        --description \"ACME API key\"\n");
		help.append("\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private static int parseInt(String value, String name, boolean allowZero) {
		try {
			int parsed = Integer.parseInt(value);
			if (parsed < 0 || (parsed == 0 && !allowZero)) {
				throw new IllegalArgumentException(
						"Invalid " + name + " '" + value + "': must be " + (allowZero ? "zero or more" : "positive"));
			}
			return parsed;
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be an integer");
		}
	}

	private static long megabytes(int value) {
		return (long) value * 1024 * 1024;
	}

	private static List<String> splitList(String value) {
		return Arrays.stream(value.split(","))
			.map(String::trim)
			.filter(s -> !s.isEmpty())
			.collect(ArrayList::new, ArrayList::add, ArrayList::addAll);
	}

	private void validateDatabaseUpdate(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.addType == null || config.addType.isEmpty()) {
			errors.add("Credential type must not be empty (--add-type)");
		}
		if (config.addRegex == null || config.addRegex.isBlank()) {
			errors.add("A regex is required (--regex)");
		}
		if (config.addDescription == null || config.addDescription.isBlank()) {
			errors.add("A description is required (--description)");
		}
		if (config.regexDb == null) {
			errors.add("A database file is required (--regex-db or " + EnvironmentSupport.REGEX_DB + ")");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Regex database update validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.numFiles == null) {
			errors.add("Number of files is required (--num-files)");
		}
		boolean hasWork = config.numFiles != null && config.numFiles > 0;
		if (hasWork && config.formats.isEmpty()) {
			errors.add("At least one format is required (--formats)");
		}
		if (hasWork && config.credentialTypes.isEmpty()) {
			errors.add("At least one credential type is required (--credential-types)");
		}
		if (hasWork && config.topics.isEmpty()) {
			errors.add("At least one topic is required (--topics)");
		}
		for (String format : config.formats) {
			if (!FormatCatalog.isSupported(format)) {
				errors.add("Unsupported format: " + format);
			}
		}
		if (config.perWorkerMemoryBytes <= 0) {
			errors.add("Worker memory must be positive");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
