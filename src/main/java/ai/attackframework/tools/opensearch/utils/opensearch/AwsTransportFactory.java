package ai.attackframework.tools.opensearch.utils.opensearch;

import java.net.URI;
import java.time.Duration;

import ai.attackframework.tools.opensearch.utils.config.OpenSearchConfig;
import org.opensearch.client.json.jackson.JacksonJsonpMapper;
import org.opensearch.client.transport.OpenSearchTransport;
import org.opensearch.client.transport.aws.AwsSdk2Transport;
import org.opensearch.client.transport.aws.AwsSdk2TransportOptions;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;

/**
 * SigV4-signed transport for AWS OpenSearch Service and Serverless.
 *
 * <p>Isolated so the optional AWS SDK is only loaded when a region is configured.</p>
 */
final class AwsTransportFactory {

    private AwsTransportFactory() {}

    /** Transport plus the SDK HTTP client it borrows, which the caller must close. */
    record AwsTransport(OpenSearchTransport transport, SdkHttpClient httpClient) {}

    static AwsTransport build(OpenSearchConfig config) {
        SdkHttpClient httpClient = ApacheHttpClient.builder()
                .maxConnections(config.connectionPoolSize())
                .socketTimeout(Duration.ofSeconds(config.timeoutSeconds()))
                .build();
        String host = URI.create(config.hosts().get(0)).getHost();
        AwsSdk2TransportOptions options = AwsSdk2TransportOptions.builder()
                .setCredentials(credentials(config))
                .setMapper(new JacksonJsonpMapper())
                .build();
        OpenSearchTransport transport = new AwsSdk2Transport(
                httpClient, host, config.awsService(), Region.of(config.awsRegion()), options);
        return new AwsTransport(transport, httpClient);
    }

    /** Static keys when given, otherwise the default provider chain (env, profile, instance role). */
    static AwsCredentialsProvider credentials(OpenSearchConfig config) {
        String key = config.awsAccessKeyId();
        String secret = config.awsSecretAccessKey();
        if (key != null && secret != null) {
            String token = config.awsSessionToken();
            if (token != null) {
                return StaticCredentialsProvider.create(AwsSessionCredentials.create(key, secret, token));
            }
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(key, secret));
        }
        return DefaultCredentialsProvider.create();
    }
}
