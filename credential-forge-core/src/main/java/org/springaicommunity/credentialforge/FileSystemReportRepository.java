package org.springaicommunity.credentialforge;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * File system implementation of {@link ReportRepository}.
 */
public class FileSystemReportRepository implements ReportRepository {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemReportRepository.class);

	private final ObjectMapper objectMapper;

	public FileSystemReportRepository(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	@Override
	public Path prepareOutputDirectory(Path outputDir) {
		try {
			Files.createDirectories(outputDir);
			logger.debug("Output directory ready: {}", outputDir);
			return outputDir;
		}
		catch (IOException e) {
			throw new ConfigurationException("Failed to create output directory: " + outputDir + " (" + e.getMessage()
					+ ")", e);
		}
	}

	@Override
	public void cleanOutputDirectory(Path outputDir) {
		if (!Files.exists(outputDir)) {
			prepareOutputDirectory(outputDir);
			return;
		}

		List<Path> paths;
		try (Stream<Path> walk = Files.walk(outputDir)) {
			paths = walk.sorted(Comparator.reverseOrder()).toList();
		}
		catch (IOException e) {
			throw new CredentialForgeException("Failed to list output directory: " + outputDir, e);
		}

		for (Path path : paths) {
			try {
				Files.delete(path);
			}
			catch (IOException e) {
				throw new CredentialForgeException("Failed to delete: " + path, e);
			}
		}

		prepareOutputDirectory(outputDir);
		logger.info("Cleaned output directory: {}", outputDir);
	}

	@Override
	public Path saveReport(Path outputDir, BatchReport report) {
		Path reportPath = prepareOutputDirectory(outputDir).resolve(REPORT_FILE_NAME);
		try {
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(reportPath.toFile(), report);
			logger.info("Saved batch report with {} results to {}", report.completedJobs(), reportPath);
			return reportPath;
		}
		catch (IOException e) {
			throw new CredentialForgeException("Failed to save batch report to " + reportPath, e);
		}
	}

}
