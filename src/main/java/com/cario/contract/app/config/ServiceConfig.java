package com.cario.contract.app.config;

import com.cario.contract.app.repository.ContractRecordGateway;
import com.cario.contract.app.scheduler.ContractProcessingDispatcher;
import com.cario.contract.app.service.*;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.textract.TextractClient;

@Configuration
@RequiredArgsConstructor
public class ServiceConfig {

  private final S3Client s3Client;
  private final S3Presigner s3Presigner;
  private final TextractClient textractClient;
  private final ChatClient.Builder chatClientBuilder;

  @Value("${aws.s3.bucket}")
  private String bucket;

  @Value("${aws.s3.input-prefix:contracts/}")
  private String inputPrefix;

  @Value("${app.textract.min-line-confidence:0}")
  private float minLineConfidence;

  @Value("${app.textract.poll-interval:5s}")
  private Duration textractPollInterval;

  @Value("${app.textract.max-polls:100}")
  private int textractMaxPolls;

  @Value("${app.upload.max-file-size:50MB}")
  private DataSize maxFileSize;

  @Value("${app.upload.allowed-content-types:application/pdf}")
  private List<String> allowedContentTypes;

  @Value("${app.upload.presign-ttl:15m}")
  private Duration presignTtl;

  @Value("${app.nlp.model:gpt-4o-mini}")
  private String nlpModel;

  @Value("${app.nlp.temperature:0.1}")
  private double nlpTemperature;

  @Value("${app.nlp.prompt-location:classpath:prompts/contract-extraction.yaml}")
  private String promptLocation;

  // -------------------
  // Utility
  // -------------------

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public PromptLoaderService promptLoaderService() {
    return new PromptLoaderService(s3Client);
  }

  // -------------------
  // Extraction
  // -------------------

  @Bean
  public TextractService textractService() {
    return new TextractService(
        textractClient, minLineConfidence, textractPollInterval, textractMaxPolls);
  }

  @Bean
  public ContractParserService contractParserService(PromptLoaderService promptLoaderService) {
    return new ContractParserService(
        chatClientBuilder.build(), promptLoaderService, promptLocation, nlpModel, nlpTemperature);
  }

  @Bean
  public ContractExtractor contractExtractor(
      TextractService textractService,
      ContractParserService contractParserService,
      ContractProcessingProperties properties) {
    return new ContractExtractionPipeline(
        textractService, contractParserService, properties.getExtractedTextMaxChars());
  }

  // -------------------
  // Core Services
  // -------------------

  @Bean
  public ScoringService scoringService() {
    return new ScoringService();
  }

  @Bean
  public ContractProcessingOrchestrator contractProcessingOrchestrator(
      ContractRecordGateway contractRecordGateway,
      ContractExtractor contractExtractor,
      ScoringService scoringService,
      ContractProcessingProperties properties,
      Clock clock) {
    return new ContractProcessingOrchestrator(
        contractRecordGateway, contractExtractor, scoringService, properties, clock);
  }

  @Bean
  public DocumentStorageService documentStorageService() {
    return new DocumentStorageService(
        s3Client,
        s3Presigner,
        bucket,
        inputPrefix,
        maxFileSize.toBytes(),
        allowedContentTypes,
        presignTtl);
  }

  @Bean
  public ContractStatusService contractStatusService(
      ContractRecordGateway contractRecordGateway) {
    return new ContractStatusService(contractRecordGateway);
  }

  @Bean
  public ContractSubmissionService contractSubmissionService(
      DocumentStorageService documentStorageService,
      ContractRecordGateway contractRecordGateway,
      ContractProcessingDispatcher contractProcessingDispatcher,
      Clock clock) {
    return new ContractSubmissionService(
        documentStorageService, contractRecordGateway, contractProcessingDispatcher, clock);
  }
}
