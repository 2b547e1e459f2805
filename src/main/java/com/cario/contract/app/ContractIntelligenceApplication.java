package com.cario.contract.app;

import com.cario.contract.app.config.ContractProcessingProperties;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Entry point for the Contract Intelligence Service Spring Boot application.
 *
 * <p>This service ingests contract PDFs, extracts structured fields with AWS Textract and an LLM,
 * and scores how complete each contract is. Run with a profile that provides AWS clients:
 *
 * <pre>
 *   mvn spring-boot:run -Dspring-boot.run.profiles=local
 * </pre>
 *
 * @author Shaji Nair
 */
@Log4j2
@SpringBootApplication
@EnableConfigurationProperties(ContractProcessingProperties.class)
public class ContractIntelligenceApplication {

  /**
   * Main entry point for the Spring Boot application.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    log.info("Starting Contract Intelligence Service application...");
    SpringApplication.run(ContractIntelligenceApplication.class, args);
    log.info("Contract Intelligence Service application started successfully.");
  }
}
