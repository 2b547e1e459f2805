package com.cario.contract.app.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Identification of one contract party (customer or vendor).
 *
 * <ul>
 *   <li>{@code name} – Trading or common name of the party
 *   <li>{@code legalEntity} – Registered legal entity name
 *   <li>{@code registrationDetails} – Company number, tax id or similar
 *   <li>{@code signatories} – People who signed on behalf of the party
 * </ul>
 *
 * @author Shaji Nair
 * @version 1.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PartyInfo {

  /** Trading or common name of the party. */
  private String name;

  /** Registered legal entity (e.g., "Acme Holdings Ltd."). */
  private String legalEntity;

  private String registrationDetails;

  /** Postal address as a single free-form string. */
  private String address;

  private List<Signatory> signatories;

  /** Extraction confidence for this group (0.0 .. 1.0). */
  private Double confidenceScore;
}
