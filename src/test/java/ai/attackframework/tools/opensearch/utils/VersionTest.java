package ai.attackframework.tools.opensearch.utils;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VersionTest {

    private String previous;

    @BeforeEach
    void rememberProperty() {
        previous = System.getProperty("attackframework.version");
    }

    @AfterEach
    void restoreProperty() {
        if (previous == null) {
            System.clearProperty("attackframework.version");
        } else {
            System.setProperty("attackframework.version", previous);
        }
    }

    @Test
    void get_uses_system_property_override_in_tests() {
        System.setProperty("attackframework.version", "9.9.9-test");
        assertThat(Version.get()).isEqualTo("9.9.9-test");
        assertThat(Version.find()).contains("9.9.9-test");
    }

    @Test
    void get_returns_build_injected_version_when_override_not_changed() {
        // Surefire sets -Dattackframework.version=<project.version>
        String injected = System.getProperty("attackframework.version");
        assertThat(injected).isNotBlank();
        assertThat(Version.get()).isEqualTo(injected);
    }

    @Test
    void find_isEmpty_andGetThrows_withoutManifestOrOverride() {
        System.clearProperty("attackframework.version");
        // Classes compiled by the test run carry no manifest version.
        assertThat(Version.find()).isEmpty();
        assertThatThrownBy(Version::get)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Implementation-Version");
    }

    @Test
    void userAgent_includesVersionWhenKnown() {
        System.setProperty("attackframework.version", "1.2.3");
        assertThat(Version.userAgent()).isEqualTo("core-opensearch/1.2.3");

        System.clearProperty("attackframework.version");
        assertThat(Version.userAgent()).isEqualTo("core-opensearch");
    }
}
