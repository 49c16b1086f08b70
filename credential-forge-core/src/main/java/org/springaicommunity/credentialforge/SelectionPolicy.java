package org.springaicommunity.credentialforge;

import java.util.Locale;

/**
 * How the job planner picks format, topic and credential types for each job.
 */
public enum SelectionPolicy {

	/**
	 * Cycle through each requested set so every element is covered evenly.
	 */
	ROUND_ROBIN("round-robin"),

	/**
	 * Uniform draw per job, seeded by the job's uniqueness seed.
	 */
	RANDOM("random");

	private final String id;

	SelectionPolicy(String id) {
		this.id = id;
	}

	public String id() {
		return id;
	}

	/**
	 * Resolve a policy from its command-line identifier.
	 * @param value "round-robin" or "random" (case-insensitive)
	 * @return the matching policy
	 * @throws IllegalArgumentException if the value is not recognised
	 */
	public static SelectionPolicy fromId(String value) {
		String normalized = value.trim().toLowerCase(Locale.ROOT);
		for (SelectionPolicy policy : values()) {
			if (policy.id.equals(normalized)) {
				return policy;
			}
		}
		throw new IllegalArgumentException(
				"Invalid selection policy '" + value + "': must be 'round-robin' or 'random'");
	}

}
