package campaign.schedule;

import campaign.CampaignValidationException;
import campaign.model.CampaignPlanVersion;
import campaign.model.CampaignStepTemplate;
import campaign.model.CampaignTemplate;
import campaign.model.PlanStep;
import campaign.spi.CampaignCatalogStore;
import campaign.spi.ConnectionProvider;
import campaign.util.Ids;
import campaign.util.JsonCodec;
import campaign.util.Transactions;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Campaign templates, their steps and the immutable plan versions published from them.
 *
 * <p>Enrollments always reference a plan version, so editing a template never changes what
 * already-enrolled contacts receive. A step template that a plan version references can
 * no longer be replaced.
 */
public final class CampaignCatalog {
  private static final Logger logger = Logger.getLogger(CampaignCatalog.class.getName());

  private final ConnectionProvider connectionProvider;
  private final CampaignCatalogStore store;
  private final JsonCodec jsonCodec;
  private final Clock clock;

  public CampaignCatalog(ConnectionProvider connectionProvider, CampaignCatalogStore store, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.jsonCodec = JsonCodec.getDefault();
  }

  /**
   * @param tenantId owning tenant, or {@code null} for a global template
   */
  public CampaignTemplate createTemplate(String tenantId, String name) {
    if (name == null || name.isBlank()) {
      throw new CampaignValidationException("Template name is required");
    }
    CampaignTemplate template = new CampaignTemplate(Ids.newId(), tenantId, name, clock.instant());
    Transactions.run(connectionProvider, conn -> store.insertTemplate(conn, template));
    return template;
  }

  public CampaignStepTemplate addStep(String tenantId, String templateId, StepDefinition definition) {
    Objects.requireNonNull(definition, "definition");
    return Transactions.inTransaction(connectionProvider, conn -> {
      requireTemplate(conn, tenantId, templateId);
      boolean taken = store.listSteps(conn, templateId).stream()
          .anyMatch(s -> s.stepOrder() == definition.stepOrder());
      if (taken) {
        throw new CampaignValidationException("Template " + templateId + " already has step "
            + definition.stepOrder());
      }
      CampaignStepTemplate step = toStep(Ids.newId(), templateId, definition, clock.instant());
      store.insertStep(conn, step);
      return step;
    });
  }

  /**
   * @throws CampaignValidationException if the step is referenced by a published plan version
   */
  public CampaignStepTemplate replaceStep(String tenantId, String templateId, String stepTemplateId,
      StepDefinition definition) {
    Objects.requireNonNull(definition, "definition");
    return Transactions.inTransaction(connectionProvider, conn -> {
      requireTemplate(conn, tenantId, templateId);
      CampaignStepTemplate existing = store.findStep(conn, templateId, stepTemplateId)
          .orElseThrow(() -> new CampaignValidationException("Unknown step template: " + stepTemplateId));
      if (store.isStepReferenced(conn, stepTemplateId)) {
        throw new CampaignValidationException("Step template " + stepTemplateId
            + " is referenced by a published plan version");
      }
      CampaignStepTemplate replacement = toStep(existing.id(), templateId, definition, existing.createdAt());
      store.updateStep(conn, replacement);
      return replacement;
    });
  }

  /**
   * Snapshots the template's current steps as a new plan version. Publishing an unchanged
   * template returns the latest version.
   */
  public CampaignPlanVersion publish(String tenantId, String templateId) {
    return Transactions.inTransaction(connectionProvider, conn -> {
      requireTemplate(conn, tenantId, templateId);
      List<PlanStep> steps = store.listSteps(conn, templateId).stream()
          .map(CampaignStepTemplate::toPlanStep)
          .toList();
      if (steps.isEmpty()) {
        throw new CampaignValidationException("Template " + templateId + " has no steps");
      }
      String hash = planHash(steps);
      Optional<CampaignPlanVersion> latest = store.latestPlanVersion(conn, tenantId, templateId);
      if (latest.isPresent() && latest.get().planHash().equals(hash)) {
        return latest.get();
      }
      int version = latest.map(v -> v.version() + 1).orElse(1);
      CampaignPlanVersion planVersion = new CampaignPlanVersion(Ids.newId(), tenantId, templateId, version, hash,
          steps, clock.instant());
      store.insertPlanVersion(conn, planVersion);
      logger.log(Level.INFO, "Published plan version {0} of campaign {1}", new Object[]{version, templateId});
      return planVersion;
    });
  }

  public Optional<CampaignPlanVersion> planVersion(String tenantId, String planVersionId) {
    return Transactions.inTransaction(connectionProvider, conn -> store.findPlanVersion(conn, tenantId, planVersionId));
  }

  public Optional<CampaignPlanVersion> latestPlanVersion(String tenantId, String campaignId) {
    return Transactions.inTransaction(connectionProvider, conn -> store.latestPlanVersion(conn, tenantId, campaignId));
  }

  public List<CampaignStepTemplate> steps(String templateId) {
    return Transactions.inTransaction(connectionProvider, conn -> store.listSteps(conn, templateId));
  }

  String planHash(List<PlanStep> steps) {
    StringBuilder canonical = new StringBuilder();
    for (PlanStep step : steps) {
      canonical.append(step.stepOrder()).append('|')
          .append(step.stepTemplateId()).append('|')
          .append(step.channel().value()).append('|')
          .append(step.delay()).append('|')
          .append(step.anchor()).append('|')
          .append(step.condition()).append('|')
          .append(step.sendWindow()).append('|')
          .append(jsonCodec.toJson(step.config()))
          .append('\n');
    }
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private void requireTemplate(Connection conn, String tenantId, String templateId) {
    Objects.requireNonNull(templateId, "templateId");
    store.findTemplate(conn, tenantId, templateId)
        .orElseThrow(() -> new CampaignValidationException("Unknown campaign template: " + templateId));
  }

  private static CampaignStepTemplate toStep(String id, String templateId, StepDefinition definition,
      Instant createdAt) {
    try {
      return new CampaignStepTemplate(id, templateId, definition.stepOrder(), definition.channel(),
          definition.config(), definition.delay(), definition.anchor(), definition.condition(),
          definition.sendWindow(), createdAt);
    } catch (IllegalArgumentException e) {
      throw new CampaignValidationException(e.getMessage());
    }
  }
}
