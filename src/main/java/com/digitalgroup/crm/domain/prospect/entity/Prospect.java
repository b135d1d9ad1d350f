package com.digitalgroup.crm.domain.prospect.entity;

import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import com.digitalgroup.crm.domain.contact.entity.Contact;
import com.digitalgroup.crm.domain.prospect.enums.ProspectSource;
import com.digitalgroup.crm.domain.prospect.enums.ProspectStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Prospect Entity
 * A lead that has not yet become a contact. Conversion is the CONVERTED
 * status; the lead score is only changed through the lead score tracker.
 */
@Entity
@Table(name = "prospects", indexes = {
    @Index(name = "index_prospects_on_email", columnList = "email", unique = true),
    @Index(name = "index_prospects_on_phone", columnList = "phone", unique = true),
    @Index(name = "index_prospects_on_campaign_id", columnList = "campaign_id"),
    @Index(name = "index_prospects_on_assigned_to", columnList = "assigned_to"),
    @Index(name = "index_prospects_on_status", columnList = "status")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Prospect {

    public static final int MIN_LEAD_SCORE = 0;
    public static final int MAX_LEAD_SCORE = 100;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "first_name", nullable = false, length = 100)
    private String firstName;

    @Column(name = "last_name", length = 100)
    private String lastName;

    @Column(unique = true)
    private String email;

    @Column(unique = true, length = 50)
    private String phone;

    @Column(name = "company_name")
    private String companyName;

    @Column(name = "job_title")
    private String jobTitle;

    @Column(name = "industry", length = 100)
    private String industry;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @Column(name = "notes", columnDefinition = "text")
    private String notes;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 30)
    @Builder.Default
    private ProspectSource source = ProspectSource.MANUAL_ENTRY;

    @Column(name = "source_details")
    private String sourceDetails;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    @Setter(AccessLevel.NONE)
    private ProspectStatus status = ProspectStatus.NEW;

    @Column(name = "lead_score", nullable = false)
    @Builder.Default
    @Setter(AccessLevel.NONE)
    private int leadScore = 0;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "campaign_id")
    private Campaign campaign;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "converted_to_contact_id")
    @Setter(AccessLevel.NONE)
    private Contact convertedToContact;

    @Column(name = "converted_at")
    @Setter(AccessLevel.NONE)
    private LocalDateTime convertedAt;

    @Column(name = "assigned_to")
    private Long assignedTo;

    @Column(name = "created_by")
    private Long createdBy;

    @Column(name = "last_contacted_at")
    private LocalDateTime lastContactedAt;

    @Column(name = "linkedin_url", length = 500)
    private String linkedinUrl;

    @Column(name = "twitter_handle", length = 100)
    private String twitterHandle;

    @Column(name = "website", length = 500)
    private String website;

    @Column(name = "city", length = 100)
    private String city;

    @Column(name = "state", length = 100)
    private String state;

    @Column(name = "country", length = 100)
    private String country;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public String getFullName() {
        String first = firstName != null ? firstName : "";
        String last = lastName != null ? lastName : "";
        return (first + " " + last).trim();
    }

    public boolean isConverted() {
        return status == ProspectStatus.CONVERTED;
    }

    public boolean isOwnedBy(Long userId) {
        return userId != null && (userId.equals(assignedTo) || userId.equals(createdBy));
    }

    /**
     * Non-terminal status change. Conversion goes through {@link #markConverted}.
     */
    public void changeStatus(ProspectStatus newStatus) {
        if (newStatus == ProspectStatus.CONVERTED) {
            throw new IllegalArgumentException("Use markConverted to convert a prospect");
        }
        if (isConverted()) {
            throw new IllegalStateException("Converted prospects cannot change status");
        }
        this.status = newStatus;
    }

    public void markConverted(Contact contact, LocalDateTime when) {
        this.status = ProspectStatus.CONVERTED;
        this.convertedToContact = contact;
        this.convertedAt = when;
    }

    /**
     * Written only by LeadScoreTracker, which records the history row.
     * Returns the score after clamping to 0..100.
     */
    public int applyLeadScore(int requestedScore) {
        this.leadScore = Math.max(MIN_LEAD_SCORE, Math.min(MAX_LEAD_SCORE, requestedScore));
        return this.leadScore;
    }
}
