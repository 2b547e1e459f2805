package com.cario.contract.app.service;

import com.cario.contract.app.model.AccountInfo;
import com.cario.contract.app.model.CompletenessScore;
import com.cario.contract.app.model.ContactInfo;
import com.cario.contract.app.model.ContractDraft;
import com.cario.contract.app.model.FinancialDetails;
import com.cario.contract.app.model.LineItem;
import com.cario.contract.app.model.PartyInfo;
import com.cario.contract.app.model.PaymentStructure;
import com.cario.contract.app.model.ScoreBreakdown;
import com.cario.contract.app.model.ServiceLevelTerms;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import org.springframework.util.StringUtils;

/**
 * Completeness scoring for extracted contract drafts.
 *
 * <p>Five weighted categories, each clamped to its maximum:
 *
 * <ul>
 *   <li>Financial completeness – 30
 *   <li>Party identification – 25
 *   <li>Payment terms – 20
 *   <li>SLA definition – 15
 *   <li>Contact information – 10
 * </ul>
 *
 * <p>The missing-fields checklist is a separate pass over the draft and does not look at the
 * category scores. Every checklist entry is evaluated on its own, so an absent financial section
 * also reports the total value, currency and line items as missing.
 *
 * <p>Stateless and thread-safe. A {@code null} or empty draft scores 0 with every checklist entry.
 */
@Log4j2
public class ScoringService {

  public static final String MISSING_FINANCIAL_SECTION = "Financial details section";
  public static final String MISSING_TOTAL_VALUE = "Total contract value";
  public static final String MISSING_CURRENCY = "Currency";
  public static final String MISSING_LINE_ITEMS = "Line items/services description";
  public static final String MISSING_CUSTOMER_NAME = "Customer name";
  public static final String MISSING_VENDOR_NAME = "Vendor name";
  public static final String MISSING_PAYMENT_SECTION = "Payment structure section";
  public static final String MISSING_PAYMENT_TERMS = "Payment terms (e.g., Net 30)";
  public static final String MISSING_PAYMENT_SCHEDULE = "Payment schedule or due dates";
  public static final String MISSING_ACCOUNT_INFO = "Account/contact information";
  public static final String MISSING_BILLING_CONTACT = "Billing contact information";
  public static final String MISSING_SLA = "Service Level Agreement (SLA)";

  private static final double LINE_ITEMS_MAX = 15.0;
  private static final double SCHEDULES_MAX = 7.0;
  private static final double DUE_DATES_CREDIT = 5.0;
  private static final double METRICS_MAX = 6.0;

  /**
   * Scores a draft.
   *
   * @param draft extraction output, may be {@code null}
   * @return total, clamped breakdown and missing fields; never {@code null}
   */
  public CompletenessScore score(ContractDraft draft) {
    ContractDraft d = draft == null ? ContractDraft.empty() : draft;

    ScoreBreakdown breakdown =
        ScoreBreakdown.builder()
            .financialCompleteness(scoreFinancial(d.getFinancialDetails()))
            .partyIdentification(scoreParties(d.getCustomer(), d.getVendor()))
            .paymentTerms(scorePayment(d.getPaymentStructure()))
            .slaDefinition(scoreSla(d.getSla()))
            .contactInformation(scoreContact(d.getAccountInfo()))
            .build();

    List<String> missing = missingFields(d);
    double total = breakdown.total();
    log.debug("scoring.done total={} missing={}", total, missing.size());
    return CompletenessScore.builder()
        .total(total)
        .breakdown(breakdown)
        .missingFields(missing)
        .build();
  }

  // ---------------------------------------------------------------------
  // Categories
  // ---------------------------------------------------------------------

  double scoreFinancial(FinancialDetails financial) {
    if (financial == null) return 0.0;

    double score = 0.0;
    List<LineItem> items = financial.getLineItems();
    if (hasItems(items)) {
      double itemScore = 0.0;
      for (LineItem item : items) {
        if (item == null) continue;
        if (StringUtils.hasText(item.getDescription())) itemScore += 5;
        if (item.getQuantity() != null && item.getUnitPrice() != null) itemScore += 5;
        if (item.getTotalPrice() != null) itemScore += 5;
      }
      // null elements still count in the divisor
      score += Math.min(itemScore / items.size(), LINE_ITEMS_MAX);
    }
    if (financial.getTotalValue() != null) score += 10;
    if (StringUtils.hasText(financial.getCurrency())) score += 3;
    if (StringUtils.hasText(financial.getTaxInfo()) || financial.getTaxAmount() != null) {
      score += 2;
    }
    return clamp(score, ScoreBreakdown.FINANCIAL_MAX);
  }

  double scoreParties(PartyInfo customer, PartyInfo vendor) {
    return clamp(scoreParty(customer) + scoreParty(vendor), ScoreBreakdown.PARTY_MAX);
  }

  private static double scoreParty(PartyInfo party) {
    if (party == null) return 0.0;
    double score = 0.0;
    if (StringUtils.hasText(party.getName())) score += 4;
    if (StringUtils.hasText(party.getLegalEntity())) score += 3;
    if (StringUtils.hasText(party.getAddress())) score += 2.5;
    if (hasItems(party.getSignatories())) score += 3;
    return score;
  }

  double scorePayment(PaymentStructure payment) {
    if (payment == null) return 0.0;

    double score = 0.0;
    if (StringUtils.hasText(payment.getPaymentTerms())) score += 8;
    // schedules and due dates share one slot, the larger credit counts
    double scheduleCredit =
        hasItems(payment.getSchedules())
            ? Math.min(countNonNull(payment.getSchedules()) * 2.0, SCHEDULES_MAX)
            : 0.0;
    double dueDateCredit = hasItems(payment.getDueDates()) ? DUE_DATES_CREDIT : 0.0;
    score += Math.max(scheduleCredit, dueDateCredit);
    if (hasItems(payment.getMethods())) score += 3;
    if (StringUtils.hasText(payment.getBankingDetails())) score += 2;
    return clamp(score, ScoreBreakdown.PAYMENT_MAX);
  }

  double scoreSla(ServiceLevelTerms sla) {
    if (sla == null) return 0.0;

    double score = 0.0;
    if (hasItems(sla.getPerformanceMetrics())) {
      score += Math.min(countNonNull(sla.getPerformanceMetrics()) * 2.0, METRICS_MAX);
    }
    if (StringUtils.hasText(sla.getSupportTerms())) score += 4;
    if (hasItems(sla.getPenaltyClauses())) score += 3;
    if (StringUtils.hasText(sla.getResponseTime())
        || StringUtils.hasText(sla.getResolutionTime())) {
      score += 2;
    }
    return clamp(score, ScoreBreakdown.SLA_MAX);
  }

  double scoreContact(AccountInfo account) {
    if (account == null) return 0.0;

    double score =
        scoreContactPair(account.getBillingContact(), 2.0)
            + scoreContactPair(account.getTechnicalContact(), 1.5)
            + scoreContactPair(account.getContactInfo(), 1.5);
    return clamp(score, ScoreBreakdown.CONTACT_MAX);
  }

  private static double scoreContactPair(ContactInfo contact, double pointsEach) {
    if (contact == null) return 0.0;
    double score = 0.0;
    if (StringUtils.hasText(contact.getEmail())) score += pointsEach;
    if (StringUtils.hasText(contact.getPhone())) score += pointsEach;
    return score;
  }

  // ---------------------------------------------------------------------
  // Checklist
  // ---------------------------------------------------------------------

  List<String> missingFields(ContractDraft d) {
    List<String> missing = new ArrayList<>(12);

    FinancialDetails financial = d.getFinancialDetails();
    addIf(missing, financial == null, MISSING_FINANCIAL_SECTION);
    addIf(missing, financial == null || financial.getTotalValue() == null, MISSING_TOTAL_VALUE);
    addIf(
        missing,
        financial == null || !StringUtils.hasText(financial.getCurrency()),
        MISSING_CURRENCY);
    addIf(missing, financial == null || !hasItems(financial.getLineItems()), MISSING_LINE_ITEMS);

    addIf(missing, !hasName(d.getCustomer()), MISSING_CUSTOMER_NAME);
    addIf(missing, !hasName(d.getVendor()), MISSING_VENDOR_NAME);

    PaymentStructure payment = d.getPaymentStructure();
    addIf(missing, payment == null, MISSING_PAYMENT_SECTION);
    addIf(
        missing,
        payment == null || !StringUtils.hasText(payment.getPaymentTerms()),
        MISSING_PAYMENT_TERMS);
    addIf(
        missing,
        payment == null || (!hasItems(payment.getSchedules()) && !hasItems(payment.getDueDates())),
        MISSING_PAYMENT_SCHEDULE);

    AccountInfo account = d.getAccountInfo();
    addIf(missing, account == null, MISSING_ACCOUNT_INFO);
    addIf(missing, account == null || account.getBillingContact() == null, MISSING_BILLING_CONTACT);

    addIf(missing, d.getSla() == null, MISSING_SLA);
    return missing;
  }

  // -------- helpers --------

  private static void addIf(List<String> missing, boolean condition, String entry) {
    if (condition) missing.add(entry);
  }

  private static boolean hasName(PartyInfo party) {
    return party != null && StringUtils.hasText(party.getName());
  }

  /** Non-empty with at least one non-null element. */
  private static boolean hasItems(Collection<?> c) {
    return c != null && c.stream().anyMatch(Objects::nonNull);
  }

  private static long countNonNull(Collection<?> c) {
    return c.stream().filter(Objects::nonNull).count();
  }

  private static double clamp(double value, double max) {
    return Math.max(0.0, Math.min(value, max));
  }
}
