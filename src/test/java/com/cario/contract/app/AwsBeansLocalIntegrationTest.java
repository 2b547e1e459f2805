package com.cario.contract.app;

import static org.junit.jupiter.api.Assertions.assertNotNull;

import com.cario.contract.app.repository.ContractRecordGateway;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.HeadBucketResponse;

/** Talks to real AWS; runs only when local credentials are exported. */
@SpringBootTest
@ActiveProfiles("local")
@EnabledIfEnvironmentVariable(named = "AWS_ACCESS_KEY_ID", matches = ".+")
@EnabledIfEnvironmentVariable(named = "OPENAI_API_KEY", matches = ".+")
class AwsBeansLocalIntegrationTest {

  @Autowired private S3Client s3Client;

  @Autowired private DynamoDbClient dynamoDbClient;

  @Autowired private ContractRecordGateway contractRecordGateway;

  @Value("${aws.s3.bucket}")
  private String bucket;

  @Value("${aws.dynamodb.contracts.table}")
  private String tableName;

  @Test
  void testContractBucketReachable() {
    HeadBucketResponse head = s3Client.headBucket(b -> b.bucket(bucket));
    assertNotNull(head);
  }

  @Test
  void testContractTableReachable() {
    DescribeTableResponse table = dynamoDbClient.describeTable(t -> t.tableName(tableName));
    assertNotNull(table.table());
    System.out.println("Table status: " + table.table().tableStatusAsString());
  }

  @Test
  void testUnknownContractIsEmpty() {
    assertNotNull(contractRecordGateway.get("integration-test-missing-id"));
  }
}
