package com.digitalgroup.crm.domain.prospect.entity;

import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import com.digitalgroup.crm.domain.campaign.entity.CampaignEngagement;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.LocalDateTime;

/**
 * Append-only audit row for one lead score change.
 */
@Entity
@Immutable
@Table(name = "lead_score_history", indexes = {
    @Index(name = "idx_lead_score_history_prospect", columnList = "prospect_id, created_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class LeadScoreHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "prospect_id", nullable = false, updatable = false)
    private Prospect prospect;

    @Column(name = "old_score", nullable = false, updatable = false)
    private int oldScore;

    @Column(name = "new_score", nullable = false, updatable = false)
    private int newScore;

    @Column(name = "score_change", nullable = false, updatable = false)
    private int scoreChange;

    @Column(name = "reason", nullable = false, updatable = false)
    private String reason;

    @Column(name = "activity_type", length = 50, updatable = false)
    private String activityType;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "campaign_id", updatable = false)
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private Campaign campaign;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "campaign_engagement_id", updatable = false)
    @OnDelete(action = OnDeleteAction.SET_NULL)
    private CampaignEngagement campaignEngagement;

    @Column(name = "changed_by", updatable = false)
    private Long changedBy;

    @Column(name = "notes", columnDefinition = "text", updatable = false)
    private String notes;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
