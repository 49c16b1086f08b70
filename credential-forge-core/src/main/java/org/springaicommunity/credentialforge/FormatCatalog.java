package org.springaicommunity.credentialforge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Registry of supported output formats and the family each belongs to.
 */
public final class FormatCatalog {

	private static final Map<String, FormatFamily> FORMATS = createFormats();

	private FormatCatalog() {
	}

	private static Map<String, FormatFamily> createFormats() {
		Map<String, FormatFamily> formats = new LinkedHashMap<>();
		register(formats, FormatFamily.EMAIL, "eml", "msg");
		register(formats, FormatFamily.SPREADSHEET, "xlsx", "xlsm", "xltm", "xls", "xlsb", "ods");
		register(formats, FormatFamily.DOCUMENT, "docx", "doc", "docm", "rtf", "odf", "odt");
		register(formats, FormatFamily.PRESENTATION, "pptx", "ppt", "odp");
		register(formats, FormatFamily.PDF, "pdf");
		register(formats, FormatFamily.IMAGE, "png", "jpg", "jpeg", "bmp");
		register(formats, FormatFamily.DIAGRAM, "vsd", "vsdx", "vsdm", "vssx", "vssm", "vstx", "vstm");
		return Collections.unmodifiableMap(formats);
	}

	private static void register(Map<String, FormatFamily> formats, FormatFamily family, String... names) {
		for (String name : names) {
			formats.put(name, family);
		}
	}

	/**
	 * Look up the family of a format.
	 * @param format format name, e.g. "eml" (case-insensitive)
	 * @return the format family
	 * @throws ConfigurationException if the format is not supported
	 */
	public static FormatFamily familyOf(String format) {
		FormatFamily family = FORMATS.get(normalize(format));
		if (family == null) {
			throw new ConfigurationException(
					"Unsupported format: " + format + ". Supported formats: " + String.join(", ", FORMATS.keySet()));
		}
		return family;
	}

	public static boolean isSupported(String format) {
		return FORMATS.containsKey(normalize(format));
	}

	/**
	 * Returns the file extension written for a format. Every supported format uses its
	 * own name as extension.
	 */
	public static String extensionOf(String format) {
		familyOf(format);
		return normalize(format);
	}

	public static Set<String> supportedFormats() {
		return FORMATS.keySet();
	}

	static String normalize(String format) {
		String normalized = format.trim().toLowerCase(Locale.ROOT);
		return normalized.startsWith(".") ? normalized.substring(1) : normalized;
	}

}
