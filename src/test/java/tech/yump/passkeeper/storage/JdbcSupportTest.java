package tech.yump.passkeeper.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcSupportTest {

    @Test
    @DisplayName("ParseUuid should accept canonical ids and map malformed ones to empty")
    void parseUuid() {
        assertThat(JdbcSupport.parseUuid("9b1d2c3e-4f50-4a6b-8c7d-0e1f2a3b4c5d"))
                .contains(UUID.fromString("9b1d2c3e-4f50-4a6b-8c7d-0e1f2a3b4c5d"));
        assertThat(JdbcSupport.parseUuid("not-a-uuid")).isEmpty();
        assertThat(JdbcSupport.parseUuid("")).isEmpty();
        assertThat(JdbcSupport.parseUuid(null)).isEmpty();
    }

    @Test
    @DisplayName("ContainsPattern should wrap the substring and escape LIKE wildcards")
    void containsPattern() {
        assertThat(JdbcSupport.containsPattern("mail")).isEqualTo("%mail%");
        assertThat(JdbcSupport.containsPattern("")).isEqualTo("%%");
        assertThat(JdbcSupport.containsPattern(null)).isEqualTo("%%");
        assertThat(JdbcSupport.containsPattern("50%_off\\")).isEqualTo("%50\\%\\_off\\\\%");
    }
}
