package com.digitalgroup.crm.domain.campaign.entity;

import com.digitalgroup.crm.domain.campaign.enums.CampaignStatus;
import com.digitalgroup.crm.domain.campaign.enums.CampaignType;
import com.digitalgroup.crm.domain.template.entity.EmailTemplate;
import io.hypersistence.utils.hibernate.type.json.JsonType;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Type;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Campaign Entity
 * Counter columns are a cache of the campaign's engagement records and are
 * only written through {@link #applyCounters}.
 */
@Entity
@Table(name = "campaigns", indexes = {
    @Index(name = "index_campaigns_on_owner_id", columnList = "owner_id"),
    @Index(name = "index_campaigns_on_status", columnList = "status"),
    @Index(name = "index_campaigns_on_type", columnList = "type"),
    @Index(name = "index_campaigns_on_start_date", columnList = "start_date")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Campaign {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name must not exceed 255 characters")
    @Column(nullable = false)
    private String name;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 30)
    @Builder.Default
    private CampaignType type = CampaignType.EMAIL;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private CampaignStatus status = CampaignStatus.DRAFT;

    // Scheduling
    @Column(name = "start_date")
    private LocalDateTime startDate;

    @Column(name = "end_date")
    private LocalDateTime endDate;

    @Column(name = "actual_start_date")
    private LocalDateTime actualStartDate;

    @Column(name = "actual_end_date")
    private LocalDateTime actualEndDate;

    @Column(name = "last_executed_at")
    private LocalDateTime lastExecutedAt;

    // Financials
    @Column(name = "budget", precision = 12, scale = 2)
    private BigDecimal budget;

    @Column(name = "actual_cost", precision = 12, scale = 2)
    @Builder.Default
    private BigDecimal actualCost = BigDecimal.ZERO;

    @Column(name = "expected_revenue", precision = 12, scale = 2)
    private BigDecimal expectedRevenue;

    @Column(name = "actual_revenue", precision = 12, scale = 2)
    @Builder.Default
    @Setter(AccessLevel.NONE)
    private BigDecimal actualRevenue = BigDecimal.ZERO;

    // Targets
    @Column(name = "target_audience_size")
    @Builder.Default
    private Integer targetAudienceSize = 0;

    @Column(name = "target_response_rate")
    private Double targetResponseRate;

    @Column(name = "target_conversion_rate")
    private Double targetConversionRate;

    // Cached counters
    @Column(name = "sent_count", nullable = false)
    @Builder.Default
    @Setter(AccessLevel.NONE)
    private int sentCount = 0;

    @Column(name = "delivered_count", nullable = false)
    @Builder.Default
    @Setter(AccessLevel.NONE)
    private int deliveredCount = 0;

    @Column(name = "opened_count", nullable = false)
    @Builder.Default
    @Setter(AccessLevel.NONE)
    private int openedCount = 0;

    @Column(name = "clicked_count", nullable = false)
    @Builder.Default
    @Setter(AccessLevel.NONE)
    private int clickedCount = 0;

    @Column(name = "responded_count", nullable = false)
    @Builder.Default
    @Setter(AccessLevel.NONE)
    private int respondedCount = 0;

    @Column(name = "bounced_count", nullable = false)
    @Builder.Default
    @Setter(AccessLevel.NONE)
    private int bouncedCount = 0;

    @Column(name = "unsubscribed_count", nullable = false)
    @Builder.Default
    @Setter(AccessLevel.NONE)
    private int unsubscribedCount = 0;

    @Column(name = "converted_count", nullable = false)
    @Builder.Default
    @Setter(AccessLevel.NONE)
    private int convertedCount = 0;

    @Column(name = "prospects_generated", nullable = false)
    @Builder.Default
    @Setter(AccessLevel.NONE)
    private int prospectsGenerated = 0;

    // Email configuration
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "email_template_id")
    private EmailTemplate emailTemplate;

    @Column(name = "email_subject", length = 500)
    private String emailSubject;

    @Column(name = "email_from_name")
    private String emailFromName;

    @Column(name = "email_from_email")
    private String emailFromEmail;

    // Targeting / automation
    @Type(JsonType.class)
    @Column(name = "audience_filters", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Object> audienceFilters = new HashMap<>();

    @Column(name = "is_automated")
    @Builder.Default
    private Boolean automated = false;

    @Type(JsonType.class)
    @Column(name = "automation_config", columnDefinition = "jsonb")
    @Builder.Default
    private Map<String, Object> automationConfig = new HashMap<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "campaign_tags", joinColumns = @JoinColumn(name = "campaign_id"))
    @Column(name = "tag", length = 100)
    @Builder.Default
    private Set<String> tags = new HashSet<>();

    @Column(name = "category", length = 100)
    private String category;

    @Column(name = "notes", columnDefinition = "text")
    private String notes;

    // Ownership
    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(name = "created_by")
    private Long createdBy;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (status == null) status = CampaignStatus.DRAFT;
        if (type == null) type = CampaignType.EMAIL;
        if (actualCost == null) actualCost = BigDecimal.ZERO;
        if (actualRevenue == null) actualRevenue = BigDecimal.ZERO;
        if (targetAudienceSize == null) targetAudienceSize = 0;
    }

    public boolean isOwnedBy(Long userId) {
        return ownerId != null && ownerId.equals(userId);
    }

    public void applyCounters(CampaignCounters counters, BigDecimal revenue) {
        this.sentCount = counters.sent();
        this.deliveredCount = counters.delivered();
        this.openedCount = counters.opened();
        this.clickedCount = counters.clicked();
        this.respondedCount = counters.responded();
        this.bouncedCount = counters.bounced();
        this.unsubscribedCount = counters.unsubscribed();
        this.convertedCount = counters.converted();
        this.prospectsGenerated = counters.prospectsGenerated();
        this.actualRevenue = revenue != null ? revenue : BigDecimal.ZERO;
    }

    /**
     * Stamp a completed send pass. First execution also records the actual
     * start and moves a not-yet-running campaign to ACTIVE.
     */
    public void markExecuted(LocalDateTime when) {
        this.lastExecutedAt = when;
        if (actualStartDate == null) {
            actualStartDate = when;
        }
        if (status == CampaignStatus.DRAFT || status == CampaignStatus.SCHEDULED) {
            status = CampaignStatus.ACTIVE;
        }
    }

    public void scheduleFor(LocalDateTime when) {
        this.status = CampaignStatus.SCHEDULED;
        this.startDate = when;
    }

    // Derived rates, percentages rounded to two decimals

    public double getDeliveryRate() {
        return rate(deliveredCount, sentCount);
    }

    public double getOpenRate() {
        return rate(openedCount, deliveredCount);
    }

    public double getClickRate() {
        return rate(clickedCount, openedCount);
    }

    public double getResponseRate() {
        return rate(respondedCount, deliveredCount);
    }

    public double getConversionRate() {
        return rate(convertedCount, deliveredCount);
    }

    public double getBounceRate() {
        return rate(bouncedCount, sentCount);
    }

    public double getRoi() {
        if (actualCost == null || actualCost.signum() <= 0) {
            return 0.0;
        }
        BigDecimal revenue = actualRevenue != null ? actualRevenue : BigDecimal.ZERO;
        return revenue.subtract(actualCost)
                .multiply(BigDecimal.valueOf(100))
                .divide(actualCost, 2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    public Long getDaysRemaining() {
        if (endDate == null) {
            return null;
        }
        long days = ChronoUnit.DAYS.between(LocalDate.now(), endDate.toLocalDate());
        return Math.max(days, 0);
    }

    public static double rate(long numerator, long denominator) {
        if (denominator <= 0) {
            return 0.0;
        }
        return Math.round(numerator * 10000.0 / denominator) / 100.0;
    }
}
