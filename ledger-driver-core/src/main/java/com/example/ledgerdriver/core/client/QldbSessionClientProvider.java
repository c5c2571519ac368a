package com.example.ledgerdriver.core.client;

import java.net.URI;
import java.util.Optional;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.client.config.SdkAdvancedClientOption;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.qldbsession.QldbSessionClient;

/**
 * Builds the low level {@link QldbSessionClient} used by the driver when the application does not
 * supply one.
 *
 * <p>Configuration can be supplied via system properties or environment variables:
 *
 * <ul>
 *   <li>aws.region / AWS_REGION (default us-east-1)
 *   <li>aws.qldb.endpoint / AWS_QLDB_ENDPOINT (endpoint override, e.g. a local stub)
 *   <li>aws.accessKeyId / AWS_ACCESS_KEY_ID
 *   <li>aws.secretAccessKey / AWS_SECRET_ACCESS_KEY
 * </ul>
 *
 * <p>SDK-level retries are disabled because the driver retries whole transactions itself, and the
 * HTTP connection pool is sized to the driver's session pool.
 */
public final class QldbSessionClientProvider {

  /** Default connection limit of the SDK's Apache HTTP client. */
  public static final int DEFAULT_MAX_CONNECTIONS = 50;

  static final String USER_AGENT_SUFFIX = "LedgerDriver/1.0";

  private QldbSessionClientProvider() {}

  /**
   * Builds a client honoring region, endpoint and credentials overrides.
   *
   * @param maxConnections HTTP connection pool size, must be >= 1
   * @return configured client, owned by the caller
   */
  public static QldbSessionClient buildClient(final int maxConnections) {
    if (maxConnections < 1) throw new IllegalArgumentException("maxConnections must be >= 1");

    final var builder =
        QldbSessionClient.builder()
            .region(resolveRegion())
            .credentialsProvider(resolveCredentials())
            .httpClientBuilder(ApacheHttpClient.builder().maxConnections(maxConnections))
            .overrideConfiguration(
                ClientOverrideConfiguration.builder()
                    .retryPolicy(software.amazon.awssdk.core.retry.RetryPolicy.none())
                    .putAdvancedOption(SdkAdvancedClientOption.USER_AGENT_SUFFIX, USER_AGENT_SUFFIX)
                    .build());

    resolveEndpoint().ifPresent(builder::endpointOverride);
    return builder.build();
  }

  static Region resolveRegion() {
    return property("aws.region", "AWS_REGION").map(Region::of).orElse(Region.US_EAST_1);
  }

  static Optional<URI> resolveEndpoint() {
    return property("aws.qldb.endpoint", "AWS_QLDB_ENDPOINT").map(URI::create);
  }

  // static credentials when both keys are configured, otherwise the default provider chain
  static AwsCredentialsProvider resolveCredentials() {
    return property("aws.accessKeyId", "AWS_ACCESS_KEY_ID")
        .flatMap(
            accessKey ->
                property("aws.secretAccessKey", "AWS_SECRET_ACCESS_KEY")
                    .map(secretKey -> AwsBasicCredentials.create(accessKey, secretKey)))
        .<AwsCredentialsProvider>map(StaticCredentialsProvider::create)
        .orElseGet(() -> DefaultCredentialsProvider.builder().build());
  }

  private static Optional<String> property(final String systemProperty, final String envVariable) {
    return Optional.ofNullable(System.getProperty(systemProperty))
        .or(() -> Optional.ofNullable(System.getenv(envVariable)))
        .map(String::trim)
        .filter(value -> !value.isEmpty());
  }
}
