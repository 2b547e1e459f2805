package com.cario.contract.app.config;

import com.cario.contract.app.repository.ContractRecordGateway;
import com.cario.contract.app.repository.dynamodb.ContractRecordRepository;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.textract.TextractClient;

/**
 * AWS configuration for the local environment.
 *
 * <p>Uses static credentials from the application properties. Defines the AWS client beans:
 *
 * <ul>
 *   <li>{@link S3Client} / {@link S3Presigner} - contract document storage and downloads
 *   <li>{@link TextractClient} - text detection
 *   <li>{@link DynamoDbClient} - contract records
 * </ul>
 *
 * <p>Active only when the {@code local} Spring profile is enabled.
 *
 * @author Shaji Nair
 * @version 1.0
 */
@Configuration
@Profile("local")
@Import({ServiceConfig.class, ChatClientConfig.class, SchedulerConfig.class})
public class AwsLocalConfig {

  /** AWS region in which the clients will operate. */
  @Value("${aws.region}")
  private String region;

  /** AWS access key ID for local development. */
  @Value("${aws.accessKeyId}")
  private String accessKeyId;

  /** AWS secret access key for local development. */
  @Value("${aws.secretAccessKey}")
  private String secretAccessKey;

  @Value("${aws.dynamodb.contracts.table}")
  private String tableName;

  @Bean
  StaticCredentialsProvider awsCreds() {
    return StaticCredentialsProvider.create(
        AwsBasicCredentials.create(accessKeyId, secretAccessKey));
  }

  @Bean
  public S3Client s3Client(StaticCredentialsProvider creds) {
    return S3Client.builder().region(Region.of(region)).credentialsProvider(creds).build();
  }

  @Bean
  S3Presigner s3Presigner(StaticCredentialsProvider creds) {
    return S3Presigner.builder().region(Region.of(region)).credentialsProvider(creds).build();
  }

  @Bean
  public TextractClient textractClient(StaticCredentialsProvider creds) {
    return TextractClient.builder().region(Region.of(region)).credentialsProvider(creds).build();
  }

  @Bean
  public DynamoDbClient dynamoDbClient(StaticCredentialsProvider creds) {
    return DynamoDbClient.builder().region(Region.of(region)).credentialsProvider(creds).build();
  }

  @Bean
  public ContractRecordGateway contractRecordRepository(DynamoDbClient ddb, Clock clock) {
    return new ContractRecordRepository(ddb, tableName, clock);
  }
}
