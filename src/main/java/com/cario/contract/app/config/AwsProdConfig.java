package com.cario.contract.app.config;

import com.cario.contract.app.repository.ContractRecordGateway;
import com.cario.contract.app.repository.dynamodb.ContractRecordRepository;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.textract.TextractClient;

/**
 * AWS configuration for the production environment.
 *
 * <p>Clients resolve credentials through the default provider chain (instance role, environment,
 * profile). Active only when the {@code production} Spring profile is enabled.
 */
@Configuration
@Profile("production")
@Import({ServiceConfig.class, ChatClientConfig.class, SchedulerConfig.class})
public class AwsProdConfig {

  /**
   * AWS region in which the clients will operate. Injected from the application configuration
   * property {@code aws.region}.
   */
  @Value("${aws.region}")
  private String region;

  @Value("${aws.dynamodb.contracts.table}")
  private String tableName;

  /**
   * Creates an Amazon S3 client.
   *
   * @return a configured {@link S3Client} for the specified AWS region.
   */
  @Bean
  public S3Client s3Client() {
    return S3Client.builder().region(Region.of(region)).build();
  }

  @Bean
  S3Presigner s3Presigner() {
    return S3Presigner.builder().region(Region.of(region)).build();
  }

  /**
   * Creates an Amazon Textract client.
   *
   * @return a configured {@link TextractClient} for the specified AWS region.
   */
  @Bean
  public TextractClient textractClient() {
    return TextractClient.builder().region(Region.of(region)).build();
  }

  @Bean
  public DynamoDbClient dynamoDbClient() {
    return DynamoDbClient.builder()
        .region(Region.of(region))
        .credentialsProvider(DefaultCredentialsProvider.create())
        .build();
  }

  @Bean
  public ContractRecordGateway contractRecordRepository(DynamoDbClient ddb, Clock clock) {
    return new ContractRecordRepository(ddb, tableName, clock);
  }
}
