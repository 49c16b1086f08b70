package org.springaicommunity.credentialforge;

import java.nio.file.Path;

/**
 * Repository interface for output directory and batch report persistence.
 *
 * <p>
 * Abstracts file system operations to enable testability and alternative storage
 * implementations.
 */
public interface ReportRepository {

	/**
	 * File name of the persisted report inside the output directory.
	 */
	String REPORT_FILE_NAME = "generation_report.json";

	/**
	 * Create the output directory if it does not exist.
	 * @param outputDir the output directory
	 * @return the directory
	 */
	Path prepareOutputDirectory(Path outputDir);

	/**
	 * Delete the contents of an output directory and recreate it empty.
	 * @param outputDir the directory to clean
	 */
	void cleanOutputDirectory(Path outputDir);

	/**
	 * Persist a batch report.
	 * @param outputDir the output directory
	 * @param report the report
	 * @return path of the written report
	 */
	Path saveReport(Path outputDir, BatchReport report);

}
