package org.springaicommunity.github.commitwatch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("WatchProperties Tests")
class WatchPropertiesTest {

	private static WatchProperties fromMap(Map<String, String> variables) {
		return WatchProperties.fromEnvironment(variables::get);
	}

	@Nested
	@DisplayName("Environment")
	class EnvironmentTest {

		@Test
		@DisplayName("Should use defaults when nothing is set")
		void shouldUseDefaults() {
			WatchProperties properties = fromMap(Map.of());

			assertThat(properties.getGithubToken()).isNull();
			assertThat(properties.getAdminIds()).isEmpty();
			assertThat(properties.getCheckInterval()).isEqualTo(Duration.ofSeconds(60));
			assertThat(properties.getStateDir()).isEqualTo(".commit-watch");
			assertThat(properties.getNotFoundThreshold()).isEqualTo(3);
			assertThat(properties.getMaxCommitMessages()).isEqualTo(5);
			assertThat(properties.getTransientAlertThreshold()).isEqualTo(5);
		}

		@Test
		@DisplayName("Should read every supported variable")
		void shouldReadVariables() {
			WatchProperties properties = fromMap(Map.of("GITHUB_TOKEN", " ghp_abc ", "BOT_TOKEN", "123:xyz",
					"ADMIN_CHAT_IDS", "42", "CHECK_INTERVAL", "120", "STATE_DIR", "/var/lib/watch",
					"NOT_FOUND_THRESHOLD", "5", "MAX_CONCURRENT_CHECKS", "8", "TRANSIENT_ALERT_THRESHOLD", "10"));

			assertThat(properties.requireGithubToken()).isEqualTo("ghp_abc");
			assertThat(properties.getBotToken()).isEqualTo("123:xyz");
			assertThat(properties.getAdminIds()).containsExactly("42");
			assertThat(properties.getCheckInterval()).isEqualTo(Duration.ofSeconds(120));
			assertThat(properties.getStateDir()).isEqualTo("/var/lib/watch");
			assertThat(properties.getNotFoundThreshold()).isEqualTo(5);
			assertThat(properties.getMaxConcurrentChecks()).isEqualTo(8);
			assertThat(properties.getTransientAlertThreshold()).isEqualTo(10);
		}

		@Test
		@DisplayName("Should raise the interval to the minimum")
		void shouldClampInterval() {
			assertThat(fromMap(Map.of("CHECK_INTERVAL", "5")).getCheckInterval())
				.isEqualTo(WatchProperties.MIN_CHECK_INTERVAL);
		}

		@ParameterizedTest
		@ValueSource(strings = { "abc", "0", "-10", "1.5" })
		@DisplayName("Should reject malformed numbers")
		void shouldRejectMalformedNumbers(String value) {
			assertThatThrownBy(() -> fromMap(Map.of("CHECK_INTERVAL", value)))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("CHECK_INTERVAL");
		}

		@Test
		@DisplayName("Should treat a blank token as missing")
		void shouldTreatBlankTokenAsMissing() {
			WatchProperties properties = fromMap(Map.of("GITHUB_TOKEN", "   "));

			assertThatThrownBy(properties::requireGithubToken).isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("GITHUB_TOKEN");
		}

	}

	@Nested
	@DisplayName("Admin ids")
	class AdminIdsTest {

		@Test
		@DisplayName("Should accept a plain list")
		void shouldAcceptPlainList() {
			assertThat(WatchProperties.parseAdminIds("1, 2,3")).containsExactly("1", "2", "3");
		}

		@Test
		@DisplayName("Should accept a bracketed and quoted list")
		void shouldAcceptBracketedList() {
			assertThat(WatchProperties.parseAdminIds("[\"1\", '-100200']")).containsExactly("1", "-100200");
		}

		@Test
		@DisplayName("Should ignore blanks and duplicates")
		void shouldIgnoreBlanks() {
			assertThat(WatchProperties.parseAdminIds(" , 7,,7 ")).containsExactly("7");
			assertThat(WatchProperties.parseAdminIds(null)).isEmpty();
		}

		@Test
		@DisplayName("Should authorize everyone without an admin list")
		void shouldAuthorizeEveryoneWithoutList() {
			WatchProperties properties = new WatchProperties();
			assertThat(properties.isAuthorized("anyone")).isTrue();

			properties.setAdminIds(Set.of("7"));
			assertThat(properties.isAuthorized("anyone")).isFalse();
			assertThat(properties.isAuthorized("7")).isTrue();
		}

	}

	@Test
	@DisplayName("Should reject non-positive durations")
	void shouldRejectNonPositiveDurations() {
		WatchProperties properties = new WatchProperties();

		assertThatThrownBy(() -> properties.setCheckInterval(Duration.ZERO))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> properties.setMaxBackoff(Duration.ofSeconds(-1)))
			.isInstanceOf(IllegalArgumentException.class);
	}

}
