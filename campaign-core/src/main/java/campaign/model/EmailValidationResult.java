package campaign.model;

import java.time.Instant;
import java.util.Objects;

public record EmailValidationResult(
    String tenantId,
    String email,
    boolean valid,
    String reason,
    Instant checkedAt) {

  public EmailValidationResult {
    Objects.requireNonNull(tenantId, "tenantId");
    Objects.requireNonNull(email, "email");
    Objects.requireNonNull(checkedAt, "checkedAt");
  }
}
