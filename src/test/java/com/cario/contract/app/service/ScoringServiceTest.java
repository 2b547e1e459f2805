package com.cario.contract.app.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.cario.contract.app.model.AccountInfo;
import com.cario.contract.app.model.CompletenessScore;
import com.cario.contract.app.model.ContactInfo;
import com.cario.contract.app.model.ContractDraft;
import com.cario.contract.app.model.FinancialDetails;
import com.cario.contract.app.model.LineItem;
import com.cario.contract.app.model.PartyInfo;
import com.cario.contract.app.model.PaymentSchedule;
import com.cario.contract.app.model.PaymentStructure;
import com.cario.contract.app.model.PerformanceMetric;
import com.cario.contract.app.model.ScoreBreakdown;
import com.cario.contract.app.model.ServiceLevelTerms;
import com.cario.contract.app.model.Signatory;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

class ScoringServiceTest {

  private final ScoringService scoring = new ScoringService();

  @Test
  void customerNameAndPaymentTermsOnly() {
    ContractDraft draft =
        ContractDraft.builder()
            .customer(PartyInfo.builder().name("Acme").build())
            .paymentStructure(PaymentStructure.builder().paymentTerms("Net 30").build())
            .build();

    CompletenessScore score = scoring.score(draft);

    assertEquals(4.0, score.getBreakdown().getPartyIdentification());
    assertEquals(0.0, score.getBreakdown().getFinancialCompleteness());
    assertEquals(8.0, score.getBreakdown().getPaymentTerms());
    assertEquals(0.0, score.getBreakdown().getSlaDefinition());
    assertEquals(0.0, score.getBreakdown().getContactInformation());
    assertEquals(12.0, score.getTotal());
    assertThat(score.getMissingFields())
        .containsExactly(
            ScoringService.MISSING_FINANCIAL_SECTION,
            ScoringService.MISSING_TOTAL_VALUE,
            ScoringService.MISSING_CURRENCY,
            ScoringService.MISSING_LINE_ITEMS,
            ScoringService.MISSING_VENDOR_NAME,
            ScoringService.MISSING_PAYMENT_SCHEDULE,
            ScoringService.MISSING_ACCOUNT_INFO,
            ScoringService.MISSING_BILLING_CONTACT,
            ScoringService.MISSING_SLA);
  }

  @Test
  void emptyDraftReportsEveryChecklistEntryOnce() {
    CompletenessScore score = scoring.score(ContractDraft.empty());

    assertEquals(0.0, score.getTotal());
    assertEquals(0.0, score.getBreakdown().total());
    assertThat(score.getMissingFields()).hasSize(12).doesNotHaveDuplicates();
    assertThat(score.getMissingFields())
        .contains("Payment terms (e.g., Net 30)", "Service Level Agreement (SLA)");
  }

  @Test
  void nullDraftScoresLikeEmptyDraft() {
    CompletenessScore score = scoring.score(null);

    assertEquals(0.0, score.getTotal());
    assertThat(score.getMissingFields()).hasSize(12);
  }

  @Test
  void financialCategoryCapsAtThirty() {
    FinancialDetails financial =
        FinancialDetails.builder()
            .lineItems(
                List.of(fullLineItem("Licenses"), fullLineItem("Support"), fullLineItem("Setup")))
            .totalValue(120_000.0)
            .currency("USD")
            .taxInfo("VAT 20%")
            .build();

    assertEquals(30.0, scoring.scoreFinancial(financial));
  }

  @Test
  void nullLineItemsCountTowardsTheAverage() {
    FinancialDetails financial =
        FinancialDetails.builder().lineItems(Arrays.asList(fullLineItem("Licenses"), null)).build();

    assertEquals(7.5, scoring.scoreFinancial(financial));
  }

  @Test
  void lineItemListOfOnlyNullsIsMissing() {
    ContractDraft draft =
        ContractDraft.builder()
            .financialDetails(
                FinancialDetails.builder().lineItems(Arrays.asList(null, null)).build())
            .build();

    CompletenessScore score = scoring.score(draft);

    assertEquals(0.0, score.getBreakdown().getFinancialCompleteness());
    assertThat(score.getMissingFields())
        .contains(ScoringService.MISSING_LINE_ITEMS)
        .doesNotContain(ScoringService.MISSING_FINANCIAL_SECTION);
  }

  @Test
  void blankTextDoesNotCountAsPresent() {
    PartyInfo customer = PartyInfo.builder().name("   ").legalEntity("").build();

    assertEquals(0.0, scoring.scoreParties(customer, null));
    assertThat(scoring.score(ContractDraft.builder().customer(customer).build()).getMissingFields())
        .contains(ScoringService.MISSING_CUSTOMER_NAME);
  }

  @Test
  void schedulesAndDueDatesShareOneSlot() {
    PaymentStructure withDueDates =
        PaymentStructure.builder().dueDates(List.of("2025-01-31", "2025-02-28")).build();
    PaymentStructure withOneSchedule =
        PaymentStructure.builder()
            .schedules(List.of(PaymentSchedule.builder().amount(10.0).build()))
            .build();
    PaymentStructure withBoth =
        PaymentStructure.builder()
            .schedules(List.of(PaymentSchedule.builder().amount(10.0).build()))
            .dueDates(List.of("2025-01-31"))
            .build();

    assertEquals(5.0, scoring.scorePayment(withDueDates));
    assertEquals(2.0, scoring.scorePayment(withOneSchedule));
    assertEquals(5.0, scoring.scorePayment(withBoth));
  }

  @Test
  void fillingAnAbsentFieldNeverLowersACategory() {
    List<Supplier<ContractDraft>> bases =
        List.of(
            ContractDraft::empty,
            ScoringServiceTest::dueDatesOnlyDraft,
            ScoringServiceTest::partialDraft);

    for (Supplier<ContractDraft> base : bases) {
      ScoreBreakdown before = scoring.score(base.get()).getBreakdown();
      for (Map.Entry<String, Consumer<ContractDraft>> filler : fillers().entrySet()) {
        ContractDraft draft = base.get();
        filler.getValue().accept(draft);
        ScoreBreakdown after = scoring.score(draft).getBreakdown();

        String field = filler.getKey();
        assertThat(after.getFinancialCompleteness())
            .as(field)
            .isGreaterThanOrEqualTo(before.getFinancialCompleteness());
        assertThat(after.getPartyIdentification())
            .as(field)
            .isGreaterThanOrEqualTo(before.getPartyIdentification());
        assertThat(after.getPaymentTerms())
            .as(field)
            .isGreaterThanOrEqualTo(before.getPaymentTerms());
        assertThat(after.getSlaDefinition())
            .as(field)
            .isGreaterThanOrEqualTo(before.getSlaDefinition());
        assertThat(after.getContactInformation())
            .as(field)
            .isGreaterThanOrEqualTo(before.getContactInformation());
      }
    }
  }

  @Test
  void scheduleAndMetricCreditIsCapped() {
    PaymentStructure payment =
        PaymentStructure.builder()
            .schedules(
                List.of(
                    PaymentSchedule.builder().dueDate("2025-01-01").build(),
                    PaymentSchedule.builder().dueDate("2025-02-01").build(),
                    PaymentSchedule.builder().dueDate("2025-03-01").build(),
                    PaymentSchedule.builder().dueDate("2025-04-01").build()))
            .build();
    ServiceLevelTerms sla =
        ServiceLevelTerms.builder()
            .performanceMetrics(
                List.of(metric("uptime"), metric("latency"), metric("mttr"), metric("csat")))
            .build();

    assertEquals(7.0, scoring.scorePayment(payment));
    assertEquals(6.0, scoring.scoreSla(sla));
  }

  @Test
  void completeDraftScoresOneHundred() {
    CompletenessScore score = scoring.score(completeDraft());

    assertEquals(30.0, score.getBreakdown().getFinancialCompleteness());
    assertEquals(25.0, score.getBreakdown().getPartyIdentification());
    assertEquals(20.0, score.getBreakdown().getPaymentTerms());
    assertEquals(15.0, score.getBreakdown().getSlaDefinition());
    assertEquals(10.0, score.getBreakdown().getContactInformation());
    assertEquals(100.0, score.getTotal());
    assertThat(score.getMissingFields()).isEmpty();
  }

  @Test
  void scoringIsDeterministic() {
    ContractDraft draft = completeDraft();

    assertEquals(scoring.score(draft), scoring.score(draft));
  }

  // -------- fixtures --------

  private static ContractDraft dueDatesOnlyDraft() {
    return ContractDraft.builder()
        .paymentStructure(PaymentStructure.builder().dueDates(List.of("2025-01-01")).build())
        .build();
  }

  private static ContractDraft partialDraft() {
    return ContractDraft.builder()
        .customer(PartyInfo.builder().name("Acme").build())
        .financialDetails(
            FinancialDetails.builder()
                .lineItems(List.of(LineItem.builder().description("Licenses").build()))
                .build())
        .paymentStructure(PaymentStructure.builder().paymentTerms("Net 30").build())
        .sla(ServiceLevelTerms.builder().performanceMetrics(List.of(metric("uptime"))).build())
        .accountInfo(
            AccountInfo.builder()
                .billingContact(ContactInfo.builder().email("ap@example.com").build())
                .build())
        .build();
  }

  /** Each entry sets one scored field, and only when that field is still absent. */
  private static Map<String, Consumer<ContractDraft>> fillers() {
    Map<String, Consumer<ContractDraft>> f = new LinkedHashMap<>();
    f.put("lineItems", d -> setIfAbsent(financial(d).getLineItems(), () ->
        financial(d).setLineItems(List.of(fullLineItem("Support")))));
    f.put("totalValue", d -> setIfAbsent(financial(d).getTotalValue(), () ->
        financial(d).setTotalValue(500.0)));
    f.put("currency", d -> setIfAbsent(financial(d).getCurrency(), () ->
        financial(d).setCurrency("EUR")));
    f.put("taxAmount", d -> setIfAbsent(financial(d).getTaxAmount(), () ->
        financial(d).setTaxAmount(20.0)));
    f.put("customer", d -> setIfAbsent(d.getCustomer(), () -> d.setCustomer(fullParty("Acme"))));
    f.put("vendor", d -> setIfAbsent(d.getVendor(), () -> d.setVendor(fullParty("Globex"))));
    f.put("paymentTerms", d -> setIfAbsent(payment(d).getPaymentTerms(), () ->
        payment(d).setPaymentTerms("Net 45")));
    f.put("schedules", d -> setIfAbsent(payment(d).getSchedules(), () ->
        payment(d).setSchedules(List.of(PaymentSchedule.builder().amount(10.0).build()))));
    f.put("dueDates", d -> setIfAbsent(payment(d).getDueDates(), () ->
        payment(d).setDueDates(List.of("2025-06-30"))));
    f.put("methods", d -> setIfAbsent(payment(d).getMethods(), () ->
        payment(d).setMethods(List.of("ACH"))));
    f.put("bankingDetails", d -> setIfAbsent(payment(d).getBankingDetails(), () ->
        payment(d).setBankingDetails("IBAN DE00")));
    f.put("performanceMetrics", d -> setIfAbsent(sla(d).getPerformanceMetrics(), () ->
        sla(d).setPerformanceMetrics(List.of(metric("latency")))));
    f.put("supportTerms", d -> setIfAbsent(sla(d).getSupportTerms(), () ->
        sla(d).setSupportTerms("Business hours")));
    f.put("penaltyClauses", d -> setIfAbsent(sla(d).getPenaltyClauses(), () ->
        sla(d).setPenaltyClauses(List.of("Service credits"))));
    f.put("billingContact", d -> setIfAbsent(account(d).getBillingContact(), () ->
        account(d).setBillingContact(fullContact())));
    f.put("technicalContact", d -> setIfAbsent(account(d).getTechnicalContact(), () ->
        account(d).setTechnicalContact(fullContact())));
    f.put("contactInfo", d -> setIfAbsent(account(d).getContactInfo(), () ->
        account(d).setContactInfo(fullContact())));
    return f;
  }

  private static void setIfAbsent(Object current, Runnable fill) {
    if (current == null) fill.run();
  }

  private static FinancialDetails financial(ContractDraft d) {
    if (d.getFinancialDetails() == null) d.setFinancialDetails(new FinancialDetails());
    return d.getFinancialDetails();
  }

  private static PaymentStructure payment(ContractDraft d) {
    if (d.getPaymentStructure() == null) d.setPaymentStructure(new PaymentStructure());
    return d.getPaymentStructure();
  }

  private static ServiceLevelTerms sla(ContractDraft d) {
    if (d.getSla() == null) d.setSla(new ServiceLevelTerms());
    return d.getSla();
  }

  private static AccountInfo account(ContractDraft d) {
    if (d.getAccountInfo() == null) d.setAccountInfo(new AccountInfo());
    return d.getAccountInfo();
  }

  private static LineItem fullLineItem(String description) {
    return LineItem.builder()
        .description(description)
        .quantity(2.0)
        .unitPrice(100.0)
        .totalPrice(200.0)
        .build();
  }

  private static PerformanceMetric metric(String name) {
    return PerformanceMetric.builder().name(name).target("99%").build();
  }

  private static PartyInfo fullParty(String name) {
    return PartyInfo.builder()
        .name(name)
        .legalEntity(name + " Ltd")
        .address("1 Main St")
        .signatories(List.of(Signatory.builder().name("J. Doe").title("CEO").build()))
        .build();
  }

  private static ContactInfo fullContact() {
    return ContactInfo.builder().email("ops@example.com").phone("+1 555 0100").build();
  }

  static ContractDraft completeDraft() {
    return ContractDraft.builder()
        .contractTitle("Master Services Agreement")
        .customer(fullParty("Acme"))
        .vendor(fullParty("Globex"))
        .financialDetails(
            FinancialDetails.builder()
                .lineItems(List.of(fullLineItem("Licenses")))
                .totalValue(200.0)
                .currency("USD")
                .taxAmount(40.0)
                .build())
        .paymentStructure(
            PaymentStructure.builder()
                .paymentTerms("Net 30")
                .schedules(
                    List.of(
                        PaymentSchedule.builder().dueDate("2025-01-01").amount(50.0).build(),
                        PaymentSchedule.builder().dueDate("2025-02-01").amount(50.0).build(),
                        PaymentSchedule.builder().dueDate("2025-03-01").amount(50.0).build(),
                        PaymentSchedule.builder().dueDate("2025-04-01").amount(50.0).build()))
                .methods(List.of("Wire transfer"))
                .bankingDetails("IBAN GB00 0000")
                .build())
        .sla(
            ServiceLevelTerms.builder()
                .performanceMetrics(List.of(metric("uptime"), metric("latency"), metric("mttr")))
                .supportTerms("24x7 support")
                .penaltyClauses(List.of("5% credit per hour of downtime"))
                .responseTime("1 hour")
                .build())
        .accountInfo(
            AccountInfo.builder()
                .billingContact(fullContact())
                .technicalContact(fullContact())
                .contactInfo(fullContact())
                .build())
        .build();
  }
}
