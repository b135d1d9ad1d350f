package com.digitalgroup.crm.domain.campaign.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * CampaignMetric Entity
 * Point-in-time snapshot of a campaign's counters, one row per campaign and day
 */
@Entity
@Table(name = "campaign_metrics",
        indexes = {
            @Index(name = "idx_campaign_metrics_campaign_date", columnList = "campaign_id, metric_date")
        },
        uniqueConstraints = {
            @UniqueConstraint(name = "uk_campaign_metrics_period",
                    columnNames = {"campaign_id", "metric_date", "period_type"})
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CampaignMetric {

    public static final String PERIOD_DAILY = "daily";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "campaign_id", nullable = false)
    private Campaign campaign;

    @Column(name = "metric_date", nullable = false)
    private LocalDate metricDate;

    @Column(name = "period_type", nullable = false, length = 10)
    @Builder.Default
    private String periodType = PERIOD_DAILY;

    @Column(name = "sent_count")
    private int sentCount;

    @Column(name = "delivered_count")
    private int deliveredCount;

    @Column(name = "opened_count")
    private int openedCount;

    @Column(name = "clicked_count")
    private int clickedCount;

    @Column(name = "responded_count")
    private int respondedCount;

    @Column(name = "bounced_count")
    private int bouncedCount;

    @Column(name = "unsubscribed_count")
    private int unsubscribedCount;

    @Column(name = "converted_count")
    private int convertedCount;

    @Column(name = "prospects_generated")
    private int prospectsGenerated;

    @Column(name = "open_rate")
    private double openRate;

    @Column(name = "click_rate")
    private double clickRate;

    @Column(name = "conversion_rate")
    private double conversionRate;

    @Column(name = "bounce_rate")
    private double bounceRate;

    @Column(name = "cost_to_date", precision = 12, scale = 2)
    private BigDecimal costToDate;

    @Column(name = "revenue_to_date", precision = 12, scale = 2)
    private BigDecimal revenueToDate;

    @Column(name = "roi")
    private double roi;

    @CreationTimestamp
    @Column(name = "recorded_at", nullable = false, updatable = false)
    private LocalDateTime recordedAt;

    /**
     * Copy the campaign's current counters and rates into this snapshot.
     */
    public void captureFrom(Campaign source) {
        this.sentCount = source.getSentCount();
        this.deliveredCount = source.getDeliveredCount();
        this.openedCount = source.getOpenedCount();
        this.clickedCount = source.getClickedCount();
        this.respondedCount = source.getRespondedCount();
        this.bouncedCount = source.getBouncedCount();
        this.unsubscribedCount = source.getUnsubscribedCount();
        this.convertedCount = source.getConvertedCount();
        this.prospectsGenerated = source.getProspectsGenerated();
        this.openRate = source.getOpenRate();
        this.clickRate = source.getClickRate();
        this.conversionRate = source.getConversionRate();
        this.bounceRate = source.getBounceRate();
        this.costToDate = source.getActualCost();
        this.revenueToDate = source.getActualRevenue();
        this.roi = source.getRoi();
    }
}
