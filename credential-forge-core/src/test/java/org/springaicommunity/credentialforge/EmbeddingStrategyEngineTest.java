package org.springaicommunity.credentialforge;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link EmbeddingStrategyEngine}.
 */
@DisplayName("EmbeddingStrategyEngine Tests")
class EmbeddingStrategyEngineTest {

	private static final List<String> ONE_TYPE = List.of("aws_access_key");

	private EmbeddingStrategyEngine engine;

	@BeforeEach
	void setUp() {
		engine = new EmbeddingStrategyEngine();
	}

	@Nested
	@DisplayName("Named Strategy Tests")
	class NamedStrategyTest {

		@Test
		@DisplayName("Should use a supported named mode without fallback")
		void shouldUseSupportedMode() {
			EmbeddingDecision decision = engine.decide("eml", ONE_TYPE, 500, "attachment-blob", 1L);

			assertThat(decision.mode()).isEqualTo(EmbeddingMode.ATTACHMENT_BLOB);
			assertThat(decision.fallbackApplied()).isFalse();
			assertThat(decision.fallbackReason()).isNull();
			assertThat(decision.requestedStrategy()).isEqualTo("attachment-blob");
		}

		@Test
		@DisplayName("Should fall back to the first supported mode and record why")
		void shouldFallBackForUnsupportedMode() {
			EmbeddingDecision decision = engine.decide("xlsx", ONE_TYPE, 500, "inline-body", 1L);

			assertThat(decision.mode()).isEqualTo(EmbeddingMode.METADATA_FIELD);
			assertThat(decision.fallbackApplied()).isTrue();
			assertThat(decision.fallbackReason()).contains("xlsx").contains("inline-body");
		}

		@Test
		@DisplayName("Should accept short strategy aliases")
		void shouldAcceptAliases() {
			assertThat(engine.decide("docx", ONE_TYPE, 500, "body", 1L).mode()).isEqualTo(EmbeddingMode.INLINE_BODY);
			assertThat(engine.decide("docx", ONE_TYPE, 500, "metadata", 1L).mode())
				.isEqualTo(EmbeddingMode.METADATA_FIELD);
		}

		@Test
		@DisplayName("Should reject an unknown strategy")
		void shouldRejectUnknownStrategy() {
			assertThatThrownBy(() -> engine.decide("eml", ONE_TYPE, 500, "steganography", 1L))
				.isInstanceOf(ConfigurationException.class);
		}

		@Test
		@DisplayName("Should reject an unknown format")
		void shouldRejectUnknownFormat() {
			assertThatThrownBy(() -> engine.decide("exe", ONE_TYPE, 500, "random", 1L))
				.isInstanceOf(ConfigurationException.class)
				.hasMessageContaining("Unsupported format");
		}

	}

	@Nested
	@DisplayName("Random Strategy Tests")
	class RandomStrategyTest {

		@ParameterizedTest
		@EnumSource(FormatFamily.class)
		@DisplayName("Should only choose modes the family supports")
		void shouldOnlyChooseSupportedModes(FormatFamily family) {
			String format = FormatCatalog.supportedFormats()
				.stream()
				.filter(f -> FormatCatalog.familyOf(f) == family)
				.findFirst()
				.orElseThrow();

			for (long seed = 0; seed < 200; seed++) {
				EmbeddingDecision decision = engine.decide(format, ONE_TYPE, 2000, "random", seed);
				assertThat(family.supports(decision.mode())).isTrue();
				assertThat(decision.fallbackApplied()).isFalse();
			}
		}

		@Test
		@DisplayName("Should be reproducible for the same seed")
		void shouldBeReproducible() {
			for (long seed = 0; seed < 50; seed++) {
				assertThat(engine.decide("pdf", ONE_TYPE, 500, "random", seed))
					.isEqualTo(engine.decide("pdf", ONE_TYPE, 500, "random", seed));
			}
		}

		@Test
		@DisplayName("Should eventually use every supported mode")
		void shouldUseEverySupportedMode() {
			Set<EmbeddingMode> seen = EnumSet.noneOf(EmbeddingMode.class);
			for (long seed = 0; seed < 500; seed++) {
				seen.add(engine.decide("eml", ONE_TYPE, 500, "random", UniquenessSeeder.seed((int) seed, 42L)).mode());
			}

			assertThat(seen).containsExactlyInAnyOrderElementsOf(FormatFamily.EMAIL.supportedModes());
		}

	}

	@Nested
	@DisplayName("Distributed Sections Tests")
	class DistributedSectionsTest {

		@Test
		@DisplayName("Should size sections by content length bucket")
		void shouldSizeSectionsByLength() {
			assertThat(engine.sectionsFor(999)).isEqualTo(2);
			assertThat(engine.sectionsFor(1000)).isEqualTo(4);
			assertThat(engine.sectionsFor(3999)).isEqualTo(4);
			assertThat(engine.sectionsFor(4000)).isEqualTo(8);
		}

		@Test
		@DisplayName("Should spread credentials round robin across sections")
		void shouldSpreadCredentials() {
			List<String> types = List.of("a", "b", "c", "d", "e");

			EmbeddingDecision decision = engine.decide("pptx", types, 200, "distributed-sections", 1L);

			assertThat(decision.sectionCount()).isEqualTo(2);
			assertThat(decision.sectionAssignments()).containsExactlyInAnyOrderEntriesOf(
					Map.of(0, 0, 1, 1, 2, 0, 3, 1, 4, 0));
		}

		@Test
		@DisplayName("Should keep every section within ceil(count / sections)")
		void shouldBalanceSections() {
			List<String> types = List.of("a", "b", "c", "d", "e", "f", "g", "h", "i", "j", "k");

			EmbeddingDecision decision = engine.decide("vsdx", types, 5000, "random", 3L);

			Map<Integer, Integer> perSection = new HashMap<>();
			for (int i = 0; i < types.size(); i++) {
				perSection.merge(decision.sectionOf(i), 1, Integer::sum);
			}
			int ceiling = (types.size() + decision.sectionCount() - 1) / decision.sectionCount();
			assertThat(perSection.values()).allMatch(count -> count <= ceiling);
		}

		@Test
		@DisplayName("Should not assign sections for other modes")
		void shouldNotAssignSectionsForOtherModes() {
			EmbeddingDecision decision = engine.decide("eml", List.of("a", "b"), 5000, "inline-body", 1L);

			assertThat(decision.sectionCount()).isEqualTo(1);
			assertThat(decision.sectionAssignments()).isEmpty();
			assertThat(decision.sectionOf(1)).isZero();
		}

	}

}
