package org.springaicommunity.credentialforge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Expands a batch configuration into a flat, ordered list of generation jobs.
 *
 * <p>
 * With {@link SelectionPolicy#ROUND_ROBIN} each dimension cycles independently
 * ({@code index mod size}), so every requested format, topic and credential type is
 * covered evenly instead of skewing toward the first element. With
 * {@link SelectionPolicy#RANDOM} every choice is a uniform draw from a random source
 * seeded by the job's uniqueness seed, which keeps planning reproducible for a fixed
 * batch start time.
 *
 * <p>
 * Target paths follow {@code <output>/<format>/<index>-<slug(topic)>.<ext>}; the job index
 * makes them unique within a batch.
 */
public class JobPlanner {

	private static final Logger logger = LoggerFactory.getLogger(JobPlanner.class);

	private static final int MAX_SLUG_LENGTH = 48;

	/**
	 * Plan the jobs of a batch.
	 * @param config validated batch configuration
	 * @param batchStartTime batch start in epoch millis, captured once per batch
	 * @return exactly {@code config.fileCount()} jobs ordered by job index
	 * @throws ConfigurationException if the file count is missing or a required set is
	 * empty while jobs are requested
	 */
	public List<GenerationJob> plan(BatchConfiguration config, long batchStartTime) {
		if (config.fileCount() == null || config.fileCount() < 0) {
			throw new ConfigurationException("Number of files must be specified and not negative");
		}
		int fileCount = config.fileCount();
		if (fileCount == 0) {
			return List.of();
		}
		requireNonEmpty(config.formats(), "formats");
		requireNonEmpty(config.credentialTypes(), "credential types");
		requireNonEmpty(config.topics(), "topics");

		List<String> languages = config.languages().isEmpty() ? List.of("en") : config.languages();
		int typesPerJob = Math.min(config.credentialsPerFile(), config.credentialTypes().size());

		boolean roundRobin = config.selectionPolicy() == SelectionPolicy.ROUND_ROBIN;

		List<GenerationJob> jobs = new ArrayList<>(fileCount);
		for (int index = 0; index < fileCount; index++) {
			long seed = UniquenessSeeder.seed(index, batchStartTime);
			Random random = UniquenessSeeder.random(seed, UniquenessSeeder.PLANNING_STREAM);
			String format = pick(config.formats(), index, random, roundRobin);
			String topic = pickTopic(config.topics(), config.maxTopicsPerFile(), index, random, roundRobin);
			List<String> types = pickSeveral(config.credentialTypes(), typesPerJob, index, random, roundRobin);
			String language = pick(languages, index, random, roundRobin);
			Path targetPath = targetPath(config.outputDirectory(), index, format, topic);

			jobs.add(new GenerationJob(index, format, topic, types, seed, language, targetPath));
		}

		logger.info("Planned {} jobs across {} formats, {} topics and {} credential types ({} selection)", jobs.size(),
				config.formats().size(), config.topics().size(), config.credentialTypes().size(),
				config.selectionPolicy().id());
		return jobs;
	}

	private void requireNonEmpty(List<String> values, String name) {
		if (values.isEmpty()) {
			throw new ConfigurationException("At least one entry is required for " + name);
		}
	}

	private String pick(List<String> values, int index, Random random, boolean roundRobin) {
		if (roundRobin) {
			return values.get(index % values.size());
		}
		return values.get(random.nextInt(values.size()));
	}

	List<String> pickSeveral(List<String> values, int count, int index, Random random, boolean roundRobin) {
		if (roundRobin) {
			List<String> picked = new ArrayList<>(count);
			int start = (int) Math.floorMod((long) index * count, (long) values.size());
			for (int i = 0; i < count; i++) {
				picked.add(values.get((start + i) % values.size()));
			}
			return picked;
		}
		List<String> shuffled = new ArrayList<>(values);
		Collections.shuffle(shuffled, random);
		return List.copyOf(shuffled.subList(0, count));
	}

	private String pickTopic(List<String> topics, int maxTopicsPerFile, int index, Random random,
			boolean roundRobin) {
		int limit = Math.min(maxTopicsPerFile, topics.size());
		if (limit <= 1) {
			return pick(topics, index, random, roundRobin);
		}
		int count = 1 + random.nextInt(limit);
		return String.join(", ", pickSeveral(topics, count, index, random, roundRobin));
	}

	/**
	 * Build the target path of a job.
	 * @param outputDirectory batch output root
	 * @param index job index
	 * @param format output format
	 * @param topic job topic
	 * @return {@code <output>/<format>/<index>-<slug>.<ext>}
	 */
	public static Path targetPath(Path outputDirectory, int index, String format, String topic) {
		String fileName = index + "-" + slug(topic) + "." + FormatCatalog.extensionOf(format);
		return outputDirectory.resolve(format).resolve(fileName);
	}

	/**
	 * Reduce a topic to a lower-case, hyphen-separated file name fragment.
	 * @param topic topic text
	 * @return slug, "document" when nothing usable remains
	 */
	public static String slug(String topic) {
		String slug = topic.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("^-+|-+$", "");
		if (slug.length() > MAX_SLUG_LENGTH) {
			slug = slug.substring(0, MAX_SLUG_LENGTH).replaceAll("-+$", "");
		}
		return slug.isEmpty() ? "document" : slug;
	}

}
