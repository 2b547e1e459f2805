package com.cario.contract.app.repository.dynamodb;

import com.cario.contract.app.error.DuplicateContractException;
import com.cario.contract.app.error.PersistenceException;
import com.cario.contract.app.model.ContractRecord;
import com.cario.contract.app.model.ContractRecordUpdate;
import com.cario.contract.app.model.ProcessingStatus;
import com.cario.contract.app.model.ScoreBreakdown;
import com.cario.contract.app.repository.ContractRecordGateway;
import java.time.Clock;
import java.util.*;
import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.enhanced.dynamodb.*;
import software.amazon.awssdk.enhanced.dynamodb.model.PutItemEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

/**
 * DynamoDB-backed {@link ContractRecordGateway}.
 *
 * <p>Merge updates go through the enhanced client with {@code ignoreNulls(true)}, so only the
 * attributes present on the partial item are written. When an update asks to clear the failure
 * fields the write is issued as one low-level {@code UpdateItem} combining {@code SET} and {@code
 * REMOVE}, keeping the status change and the cleanup in a single atomic request.
 */
@Log4j2
public class ContractRecordRepository implements ContractRecordGateway {

  private static final List<String> FAILURE_ATTRIBUTES =
      List.of(
          ContractRecordItem.ATTR_ERROR_MESSAGE,
          ContractRecordItem.ATTR_PROCESSING_ENDED_AT,
          ContractRecordItem.ATTR_PROCESSING_TIME_SECONDS);

  private final DynamoDbClient ddb;
  private final DynamoDbTable<ContractRecordItem> table;
  private final String tableName;
  private final Clock clock;

  public ContractRecordRepository(DynamoDbClient ddb, String tableName, Clock clock) {
    this.ddb = ddb;
    this.tableName = tableName;
    this.clock = clock;
    DynamoDbEnhancedClient enhanced = DynamoDbEnhancedClient.builder().dynamoDbClient(ddb).build();
    this.table = enhanced.table(tableName, TableSchema.fromBean(ContractRecordItem.class));
  }

  // -------- Gateway --------

  @Override
  public Optional<ContractRecord> get(String contractId) {
    if (contractId == null) return Optional.empty();
    try {
      ContractRecordItem item = table.getItem(Key.builder().partitionValue(contractId).build());
      return Optional.ofNullable(item).map(ContractRecordRepository::toModel);
    } catch (SdkException e) {
      log.error("contracts.get error contractId={} msg={}", contractId, e.getMessage(), e);
      throw new PersistenceException("Failed to read contract " + contractId, e);
    }
  }

  @Override
  public void create(ContractRecord record) {
    Objects.requireNonNull(record, "record");
    Objects.requireNonNull(record.getContractId(), "contractId");
    ContractRecordItem item = toItem(record);
    if (item.getUpdatedAt() == null) item.setUpdatedAt(clock.instant());
    try {
      table.putItem(
          PutItemEnhancedRequest.builder(ContractRecordItem.class)
              .item(item)
              .conditionExpression(
                  Expression.builder()
                      .expression("attribute_not_exists(#id)")
                      .putExpressionName("#id", ContractRecordItem.ATTR_CONTRACT_ID)
                      .build())
              .build());
      log.info("contracts.create contractId={} status={}", item.getContractId(), item.getStatus());
    } catch (ConditionalCheckFailedException e) {
      throw new DuplicateContractException(record.getContractId(), e);
    } catch (SdkException e) {
      log.error(
          "contracts.create error contractId={} msg={}", record.getContractId(), e.getMessage(), e);
      throw new PersistenceException("Failed to create contract " + record.getContractId(), e);
    }
  }

  @Override
  public void upsert(String contractId, ContractRecordUpdate update) {
    Objects.requireNonNull(contractId, "contractId");
    Objects.requireNonNull(update, "update");
    ContractRecordItem partial = toPartialItem(contractId, update);
    try {
      if (update.isClearFailure()) {
        updateClearingFailure(contractId, partial);
      } else {
        table.updateItem(r -> r.item(partial).ignoreNulls(true));
      }
      log.debug(
          "contracts.upsert contractId={} status={} progress={} clearFailure={}",
          contractId,
          partial.getStatus(),
          partial.getProgress(),
          update.isClearFailure());
    } catch (SdkException e) {
      log.error("contracts.upsert error contractId={} msg={}", contractId, e.getMessage(), e);
      throw new PersistenceException("Failed to update contract " + contractId, e);
    }
  }

  // -------- Internals --------

  private void updateClearingFailure(String contractId, ContractRecordItem partial) {
    Map<String, AttributeValue> attrs =
        new LinkedHashMap<>(table.tableSchema().itemToMap(partial, true));
    attrs.remove(ContractRecordItem.ATTR_CONTRACT_ID);
    FAILURE_ATTRIBUTES.forEach(attrs::remove);

    Map<String, String> names = new HashMap<>();
    Map<String, AttributeValue> values = new HashMap<>();
    List<String> sets = new ArrayList<>();
    int i = 0;
    for (Map.Entry<String, AttributeValue> e : attrs.entrySet()) {
      names.put("#s" + i, e.getKey());
      values.put(":s" + i, e.getValue());
      sets.add("#s" + i + " = :s" + i);
      i++;
    }
    List<String> removes = new ArrayList<>();
    for (int r = 0; r < FAILURE_ATTRIBUTES.size(); r++) {
      names.put("#r" + r, FAILURE_ATTRIBUTES.get(r));
      removes.add("#r" + r);
    }

    String expression = "SET " + String.join(", ", sets) + " REMOVE " + String.join(", ", removes);
    ddb.updateItem(
        UpdateItemRequest.builder()
            .tableName(tableName)
            .key(Map.of(ContractRecordItem.ATTR_CONTRACT_ID, AttributeValue.fromS(contractId)))
            .updateExpression(expression)
            .expressionAttributeNames(names)
            .expressionAttributeValues(values)
            .build());
  }

  private ContractRecordItem toPartialItem(String contractId, ContractRecordUpdate u) {
    return ContractRecordItem.builder()
        .contractId(contractId)
        .status(u.getStatus() == null ? null : u.getStatus().name())
        .progress(u.getProgress())
        .attempt(u.getAttempt())
        .completenessScore(u.getCompletenessScore())
        .scoreBreakdown(toItem(u.getScoreBreakdown()))
        .missingFields(u.getMissingFields())
        .draft(u.getDraft())
        .errorMessage(u.getErrorMessage())
        .processingStartedAt(u.getProcessingStartedAt())
        .processingEndedAt(u.getProcessingEndedAt())
        .processingTimeSeconds(u.getProcessingTimeSeconds())
        .updatedAt(clock.instant())
        .build();
  }

  static ContractRecordItem toItem(ContractRecord r) {
    return ContractRecordItem.builder()
        .contractId(r.getContractId())
        .filename(r.getFilename())
        .contentType(r.getContentType())
        .fileSize(r.getFileSize())
        .documentKey(r.getDocumentKey())
        .documentUri(r.getDocumentUri())
        .status(r.getStatus() == null ? null : r.getStatus().name())
        .progress(r.getProgress())
        .attempt(r.getAttempt())
        .completenessScore(r.getCompletenessScore())
        .scoreBreakdown(toItem(r.getScoreBreakdown()))
        .missingFields(r.getMissingFields())
        .draft(r.getDraft())
        .errorMessage(r.getErrorMessage())
        .submittedAt(r.getSubmittedAt())
        .processingStartedAt(r.getProcessingStartedAt())
        .processingEndedAt(r.getProcessingEndedAt())
        .processingTimeSeconds(r.getProcessingTimeSeconds())
        .updatedAt(r.getUpdatedAt())
        .build();
  }

  static ContractRecord toModel(ContractRecordItem i) {
    return ContractRecord.builder()
        .contractId(i.getContractId())
        .filename(i.getFilename())
        .contentType(i.getContentType())
        .fileSize(i.getFileSize())
        .documentKey(i.getDocumentKey())
        .documentUri(i.getDocumentUri())
        .status(i.getStatus() == null ? null : ProcessingStatus.valueOf(i.getStatus()))
        .progress(i.getProgress())
        .attempt(i.getAttempt())
        .completenessScore(i.getCompletenessScore())
        .scoreBreakdown(toModel(i.getScoreBreakdown()))
        .missingFields(i.getMissingFields())
        .draft(i.getDraft())
        .errorMessage(i.getErrorMessage())
        .submittedAt(i.getSubmittedAt())
        .processingStartedAt(i.getProcessingStartedAt())
        .processingEndedAt(i.getProcessingEndedAt())
        .processingTimeSeconds(i.getProcessingTimeSeconds())
        .updatedAt(i.getUpdatedAt())
        .build();
  }

  private static ScoreBreakdownItem toItem(ScoreBreakdown b) {
    if (b == null) return null;
    return ScoreBreakdownItem.builder()
        .financialCompleteness(b.getFinancialCompleteness())
        .partyIdentification(b.getPartyIdentification())
        .paymentTerms(b.getPaymentTerms())
        .slaDefinition(b.getSlaDefinition())
        .contactInformation(b.getContactInformation())
        .build();
  }

  private static ScoreBreakdown toModel(ScoreBreakdownItem b) {
    if (b == null) return null;
    return ScoreBreakdown.builder()
        .financialCompleteness(zeroIfNull(b.getFinancialCompleteness()))
        .partyIdentification(zeroIfNull(b.getPartyIdentification()))
        .paymentTerms(zeroIfNull(b.getPaymentTerms()))
        .slaDefinition(zeroIfNull(b.getSlaDefinition()))
        .contactInformation(zeroIfNull(b.getContactInformation()))
        .build();
  }

  private static double zeroIfNull(Double d) {
    return d == null ? 0.0 : d;
  }
}
