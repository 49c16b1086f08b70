package org.springaicommunity.credentialforge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link RegexValueGenerator}.
 */
@DisplayName("RegexValueGenerator Tests")
class RegexValueGeneratorTest {

	@ParameterizedTest
	@ValueSource(strings = { "AKIA[0-9A-Z]{16}", "ghp_[A-Za-z0-9]{36}",
			"xox[baprs]-[0-9]{10,12}-[0-9]{10,12}-[A-Za-z0-9]{24}", "AIza[0-9A-Za-z\\-_]{35}",
			"[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}", "(?:sk|pk)_(test|live)_\\w{8,}",
			"^token=\\d+\\.\\d{2}$", "a.b*c+d?", "\\bkey\\s[A-F]{2,4}?" })
	@DisplayName("Should generate values matching the pattern")
	void shouldGenerateMatchingValues(String regex) {
		RegexValueGenerator generator = RegexValueGenerator.compile(regex);
		Pattern pattern = Pattern.compile(regex);
		Random random = new Random(42);

		for (int i = 0; i < 50; i++) {
			String value = generator.generate(random);
			assertThat(pattern.matcher(value).matches()).as("'%s' matches %s", value, regex).isTrue();
		}
	}

	@Test
	@DisplayName("Should be reproducible for the same random seed")
	void shouldBeReproducible() {
		RegexValueGenerator generator = RegexValueGenerator.compile("[A-Za-z0-9]{32}");

		assertThat(generator.generate(new Random(7))).isEqualTo(generator.generate(new Random(7)));
		assertThat(generator.generate(new Random(7))).isNotEqualTo(generator.generate(new Random(8)));
	}

	@ParameterizedTest
	@ValueSource(strings = { "[^a-z]{4}", "\\D+", "(?=abc)def", "(abc", "[abc", "a{2,1}", "a{x}" })
	@DisplayName("Should reject unsupported or malformed patterns")
	void shouldRejectUnsupportedPatterns(String regex) {
		assertThatThrownBy(() -> RegexValueGenerator.compile(regex)).isInstanceOf(IllegalArgumentException.class)
			.hasMessageStartingWith("Cannot generate from pattern '" + regex + "'");
	}

}
