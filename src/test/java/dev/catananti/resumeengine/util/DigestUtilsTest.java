package dev.catananti.resumeengine.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DigestUtils")
class DigestUtilsTest {

    @Test
    @DisplayName("Should match String.hashCode rendered as unsigned hex")
    void shouldMatchStringHashCode() {
        String content = "{\"html\":\"<p>Ada</p>\",\"css\":\"p{}\"}";

        assertThat(DigestUtils.rollingHashHex(content)).isEqualTo(Integer.toHexString(content.hashCode()));
    }

    @Test
    @DisplayName("Should return 0 for empty input")
    void shouldReturnZeroForEmptyInput() {
        assertThat(DigestUtils.rollingHashHex("")).isEqualTo("0");
    }

    @Test
    @DisplayName("Should never produce a sign for overflowing hashes")
    void shouldBeUnsigned() {
        String hash = DigestUtils.rollingHashHex("polygenelubricants".repeat(10));

        assertThat(hash).matches("[0-9a-f]{1,8}");
    }

    @Test
    @DisplayName("Should differ when content changes")
    void shouldDifferWhenContentChanges() {
        assertThat(DigestUtils.rollingHashHex("resume-a")).isNotEqualTo(DigestUtils.rollingHashHex("resume-b"));
    }

    @Test
    @DisplayName("Should reject null input")
    void shouldRejectNull() {
        assertThatThrownBy(() -> DigestUtils.rollingHashHex(null)).isInstanceOf(NullPointerException.class);
    }
}
