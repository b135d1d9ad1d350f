package com.digitalgroup.crm.domain.campaign.entity;

import com.digitalgroup.crm.domain.campaign.enums.BounceType;
import com.digitalgroup.crm.domain.campaign.enums.EngagementStatus;
import com.digitalgroup.crm.domain.contact.entity.Contact;
import com.digitalgroup.crm.domain.deal.entity.Deal;
import com.digitalgroup.crm.domain.prospect.entity.Prospect;
import io.hypersistence.utils.hibernate.type.json.JsonType;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Type;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * One recipient's progress through a campaign. The recipient is either a
 * contact or a prospect, never both and never neither.
 */
@Entity
@Table(name = "campaign_engagements",
        indexes = {
            @Index(name = "idx_engagement_campaign_status", columnList = "campaign_id, status"),
            @Index(name = "idx_engagement_contact", columnList = "contact_id"),
            @Index(name = "idx_engagement_prospect", columnList = "prospect_id")
        },
        uniqueConstraints = {
            @UniqueConstraint(name = "uk_engagement_campaign_contact", columnNames = {"campaign_id", "contact_id"}),
            @UniqueConstraint(name = "uk_engagement_campaign_prospect", columnNames = {"campaign_id", "prospect_id"})
        })
@Check(constraints = "(contact_id IS NULL) <> (prospect_id IS NULL)")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CampaignEngagement {

    public static final int MAX_ERROR_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Setter
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "campaign_id", nullable = false, updatable = false)
    private Campaign campaign;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "contact_id")
    private Contact contact;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "prospect_id")
    private Prospect prospect;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private EngagementStatus status = EngagementStatus.PENDING;

    @Column(name = "sent_at")
    private LocalDateTime sentAt;

    @Column(name = "delivered_at")
    private LocalDateTime deliveredAt;

    @Column(name = "opened_at")
    private LocalDateTime openedAt;

    @Column(name = "clicked_at")
    private LocalDateTime clickedAt;

    @Column(name = "responded_at")
    private LocalDateTime respondedAt;

    @Column(name = "bounced_at")
    private LocalDateTime bouncedAt;

    @Column(name = "unsubscribed_at")
    private LocalDateTime unsubscribedAt;

    @Column(name = "converted_at")
    private LocalDateTime convertedAt;

    @Column(name = "open_count", nullable = false)
    private int openCount = 0;

    @Column(name = "click_count", nullable = false)
    private int clickCount = 0;

    @Column(name = "lead_score_change", nullable = false)
    private int leadScoreChange = 0;

    @Column(name = "email_sent_to")
    @Setter
    private String emailSentTo;

    @Column(name = "email_message_id")
    private String emailMessageId;

    @Column(name = "email_subject", length = 500)
    private String emailSubject;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "deal_id")
    private Deal deal;

    @Column(name = "conversion_value", precision = 12, scale = 2)
    private BigDecimal conversionValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "bounce_type", length = 10)
    private BounceType bounceType;

    @Column(name = "error_message", length = MAX_ERROR_LENGTH)
    private String errorMessage;

    @Column(name = "notes", columnDefinition = "text")
    @Setter
    private String notes;

    @Type(JsonType.class)
    @Column(name = "custom_metadata", columnDefinition = "jsonb")
    @Setter
    private Map<String, Object> customMetadata = new HashMap<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static CampaignEngagement forContact(Campaign campaign, Contact contact, String sendTo) {
        if (contact == null) {
            throw new IllegalArgumentException("Contact is required");
        }
        CampaignEngagement engagement = newRecord(campaign);
        engagement.contact = contact;
        engagement.emailSentTo = sendTo != null ? sendTo : contact.getEmail();
        return engagement;
    }

    public static CampaignEngagement forProspect(Campaign campaign, Prospect prospect, String sendTo) {
        if (prospect == null) {
            throw new IllegalArgumentException("Prospect is required");
        }
        CampaignEngagement engagement = newRecord(campaign);
        engagement.prospect = prospect;
        engagement.emailSentTo = sendTo != null ? sendTo : prospect.getEmail();
        return engagement;
    }

    private static CampaignEngagement newRecord(Campaign campaign) {
        if (campaign == null) {
            throw new IllegalArgumentException("Campaign is required");
        }
        CampaignEngagement engagement = new CampaignEngagement();
        engagement.campaign = campaign;
        return engagement;
    }

    @PrePersist
    @PreUpdate
    protected void validateRecipient() {
        if ((contact == null) == (prospect == null)) {
            throw new IllegalStateException("Engagement must reference exactly one of contact or prospect");
        }
        if (status == null) status = EngagementStatus.PENDING;
    }

    public boolean isContactRecipient() {
        return contact != null;
    }

    public String getRecipientType() {
        return contact != null ? "contact" : "prospect";
    }

    public Long getRecipientId() {
        return contact != null ? contact.getId() : prospect.getId();
    }

    public boolean belongsTo(Long campaignId) {
        return campaign != null && campaign.getId() != null && campaign.getId().equals(campaignId);
    }

    /**
     * Weighted score: delivered +1, opened +2, clicked +3, responded +5,
     * converted into a deal +10.
     */
    public int getEngagementScore() {
        int score = 0;
        if (deliveredAt != null) score += 1;
        if (openedAt != null) score += 2;
        if (clickedAt != null) score += 3;
        if (respondedAt != null) score += 5;
        if (convertedAt != null && deal != null) score += 10;
        return score;
    }

    // State transitions

    public void markSent(String sentTo, String subject, String messageId) {
        LocalDateTime now = LocalDateTime.now();
        if (sentAt == null) sentAt = now;
        if (sentTo != null) emailSentTo = sentTo;
        emailSubject = subject;
        emailMessageId = messageId;
        advanceTo(EngagementStatus.SENT, false);
    }

    public void markDelivered() {
        if (deliveredAt == null) deliveredAt = LocalDateTime.now();
        advanceTo(EngagementStatus.DELIVERED, false);
    }

    public void markOpened() {
        requireSent("open");
        if (openedAt == null) openedAt = LocalDateTime.now();
        openCount++;
        advanceTo(EngagementStatus.OPENED, false);
    }

    public void markClicked() {
        requireSent("click");
        if (clickedAt == null) clickedAt = LocalDateTime.now();
        clickCount++;
        advanceTo(EngagementStatus.CLICKED, false);
    }

    public void markResponded() {
        if (respondedAt == null) respondedAt = LocalDateTime.now();
        advanceTo(EngagementStatus.RESPONDED, true);
    }

    public void markConverted(Deal deal, BigDecimal value) {
        if (convertedAt == null) convertedAt = LocalDateTime.now();
        this.deal = deal;
        this.conversionValue = value;
        advanceTo(EngagementStatus.CONVERTED, true);
    }

    public void markBounced(BounceType type, String error) {
        if (bouncedAt == null) bouncedAt = LocalDateTime.now();
        this.status = EngagementStatus.BOUNCED;
        this.bounceType = type != null ? type : BounceType.HARD;
        this.errorMessage = error != null && error.length() > MAX_ERROR_LENGTH
                ? error.substring(0, MAX_ERROR_LENGTH) : error;
    }

    public void markUnsubscribed() {
        if (unsubscribedAt == null) unsubscribedAt = LocalDateTime.now();
        this.status = EngagementStatus.UNSUBSCRIBED;
    }

    public void resetForResend() {
        status = EngagementStatus.PENDING;
        sentAt = null;
        deliveredAt = null;
        openedAt = null;
        clickedAt = null;
        respondedAt = null;
        bouncedAt = null;
        unsubscribedAt = null;
        convertedAt = null;
        openCount = 0;
        clickCount = 0;
        errorMessage = null;
        bounceType = null;
        emailMessageId = null;
    }

    public boolean isAwaitingSend() {
        return status == EngagementStatus.PENDING;
    }

    public void addLeadScoreChange(int delta) {
        this.leadScoreChange += delta;
    }

    /**
     * Point the record at the contact a prospect was converted into.
     */
    public void relinkToContact(Contact newContact) {
        if (newContact == null) {
            throw new IllegalArgumentException("Contact is required");
        }
        this.contact = newContact;
        this.prospect = null;
    }

    private void requireSent(String event) {
        if (isAwaitingSend()) {
            throw new IllegalStateException("Cannot record " + event + " before the message is sent");
        }
    }

    // Status only moves forward through the progression. Side states are
    // left alone unless the event overrides them.
    private void advanceTo(EngagementStatus target, boolean overridesSideState) {
        if (!status.isProgression()) {
            if (overridesSideState) {
                status = target;
            }
            return;
        }
        if (status.isBefore(target)) {
            status = target;
        }
    }
}
