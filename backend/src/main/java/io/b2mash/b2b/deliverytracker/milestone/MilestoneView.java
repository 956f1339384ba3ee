package io.b2mash.b2b.deliverytracker.milestone;

import io.b2mash.b2b.deliverytracker.baseline.BaselineStatus;
import io.b2mash.b2b.deliverytracker.certificate.CertificateStatus;
import io.b2mash.b2b.deliverytracker.signature.SignatureStage;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Read model of a milestone. Assembled from current rows on every read and never persisted; status
 * and progress come from {@link MilestoneAggregation}.
 *
 * @param baselineVersion latest baseline version number, null before the first commitment
 * @param certificateStatus null while no certificate exists
 * @param certificateStage signature stage of the certificate, null while no certificate exists
 * @param baselineEndDate end date of the latest baseline version, null before the first commitment
 * @param breachingDeliverables item refs of live deliverables ending after {@code baselineEndDate}
 */
public record MilestoneView(
    UUID id,
    UUID projectId,
    String itemRef,
    String wbs,
    String name,
    String description,
    LocalDate startDate,
    LocalDate endDate,
    BigDecimal value,
    MilestoneStatus status,
    int progress,
    int deliverableCount,
    int deliveredCount,
    BaselineStatus baselineStatus,
    Integer baselineVersion,
    CertificateStatus certificateStatus,
    String certificateNumber,
    SignatureStage certificateStage,
    MilestoneHealth health,
    LocalDate baselineEndDate,
    List<String> breachingDeliverables) {}
