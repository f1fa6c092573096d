package ai.attackframework.tools.opensearch.utils.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import ai.attackframework.tools.opensearch.errors.ConfigurationException;

class OpenSearchConfigTest {

    @Test
    void defaults_areApplied() {
        OpenSearchConfig c = OpenSearchConfig.builder().host("localhost:9200").build();

        assertThat(c.hosts()).containsExactly("https://localhost:9200");
        assertThat(c.useSsl()).isTrue();
        assertThat(c.verifyCerts()).isTrue();
        assertThat(c.timeoutSeconds()).isEqualTo(OpenSearchDefaults.TIMEOUT_SECONDS);
        assertThat(c.maxRetries()).isEqualTo(OpenSearchDefaults.MAX_RETRIES);
        assertThat(c.retryOnTimeout()).isTrue();
        assertThat(c.isAws()).isFalse();
        assertThat(c.hasBasicAuth()).isFalse();
    }

    @Test
    void hosts_withoutScheme_followSslFlag_andLoseTrailingSlash() {
        OpenSearchConfig c = OpenSearchConfig.builder()
                .hosts(List.of("node1:9200/", " http://node2:9200 ", "", "https://node3"))
                .useSsl(false)
                .build();

        assertThat(c.hosts()).containsExactly("http://node1:9200", "http://node2:9200", "https://node3");
    }

    @Test
    void awsEndpoint_detectsRegionAndService() {
        OpenSearchConfig managed = OpenSearchConfig.builder()
                .host("https://search-shop.eu-west-1.es.amazonaws.com")
                .build();
        assertThat(managed.isAws()).isTrue();
        assertThat(managed.awsRegion()).isEqualTo("eu-west-1");
        assertThat(managed.awsService()).isEqualTo("es");

        OpenSearchConfig serverless = OpenSearchConfig.builder()
                .host("https://abc123.us-east-2.aoss.amazonaws.com")
                .build();
        assertThat(serverless.awsRegion()).isEqualTo("us-east-2");
        assertThat(serverless.awsService()).isEqualTo("aoss");
    }

    @Test
    void explicitRegion_winsOverDetection() {
        OpenSearchConfig c = OpenSearchConfig.builder()
                .host("https://search-shop.eu-west-1.es.amazonaws.com")
                .awsRegion("ap-south-1")
                .build();

        assertThat(c.awsRegion()).isEqualTo("ap-south-1");
    }

    @Test
    void detectRegion_fallsBackForShortHosts() {
        assertThat(OpenSearchConfig.Builder.detectRegion("https://amazonaws.com"))
                .isEqualTo(OpenSearchDefaults.AWS_DEFAULT_REGION);
        assertThat(OpenSearchConfig.Builder.detectRegion("https://x.us-west-2.es.amazonaws.com:443/path"))
                .isEqualTo("us-west-2");
    }

    @Test
    void build_rejectsInvalidSettings() {
        assertThatThrownBy(() -> OpenSearchConfig.builder().build())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("host");
        assertThatThrownBy(() -> OpenSearchConfig.builder().host("h").timeoutSeconds(0).build())
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> OpenSearchConfig.builder().host("h").maxRetries(-1).build())
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> OpenSearchConfig.builder().host("h").asyncPoolSize(0).build())
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void toString_neverShowsPassword() {
        OpenSearchConfig c = OpenSearchConfig.builder().host("h").basicAuth("admin", "s3cret").build();

        assertThat(c.toString()).contains("auth=basic").doesNotContain("s3cret");
    }

    @Test
    void cacheKey_equalForEquivalentConfigs_differentForOtherCredentials() {
        OpenSearchConfig a = OpenSearchConfig.builder().host("h:9200").basicAuth("u", "p").build();
        OpenSearchConfig b = OpenSearchConfig.builder().host("https://h:9200").basicAuth("u", "p").build();
        OpenSearchConfig c = OpenSearchConfig.builder().host("h:9200").basicAuth("u", "other").build();

        assertThat(a.cacheKey()).isEqualTo(b.cacheKey());
        assertThat(a.cacheKey()).isNotEqualTo(c.cacheKey());
    }

    @Test
    void toBuilder_copiesEverything() {
        OpenSearchConfig original = OpenSearchConfig.builder()
                .host("h")
                .basicAuth("u", "p")
                .header("X-Tenant", "t1")
                .maxRetries(7)
                .build();

        OpenSearchConfig copy = original.toBuilder().timeoutSeconds(5).build();

        assertThat(copy.password()).isEqualTo("p");
        assertThat(copy.headers()).containsEntry("X-Tenant", "t1");
        assertThat(copy.maxRetries()).isEqualTo(7);
        assertThat(copy.timeoutSeconds()).isEqualTo(5);
    }
}
