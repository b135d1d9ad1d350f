package com.digitalgroup.crm.domain.prospect.service;

import com.digitalgroup.crm.domain.prospect.dto.ScoreContext;
import com.digitalgroup.crm.domain.prospect.entity.LeadScoreHistory;
import com.digitalgroup.crm.domain.prospect.entity.Prospect;
import com.digitalgroup.crm.domain.prospect.repository.LeadScoreHistoryRepository;
import com.digitalgroup.crm.domain.prospect.repository.ProspectRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Lead Score Tracker
 * The single writer of Prospect.leadScore. Every change is persisted
 * together with a history row holding old score, new score and delta.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeadScoreTracker {

    public static final String REASON_CREATED = "Initial prospect creation";
    public static final String ACTIVITY_CREATED = "created";
    public static final String REASON_MANUAL = "Manual score adjustment";
    public static final String ACTIVITY_MANUAL = "manual_adjustment";

    private final ProspectRepository prospectRepository;
    private final LeadScoreHistoryRepository historyRepository;

    /**
     * Add {@code scoreChange} to the prospect's score, clamped to 0..100.
     * The history row records the change actually applied.
     */
    @Transactional
    public LeadScoreHistory applyDelta(Prospect prospect, int scoreChange, String reason,
                                       String activityType, ScoreContext context) {
        ScoreContext ctx = context != null ? context : ScoreContext.by(null);
        int oldScore = prospect.getLeadScore();
        int newScore = prospect.applyLeadScore(oldScore + scoreChange);
        prospectRepository.save(prospect);

        LeadScoreHistory history = LeadScoreHistory.builder()
                .prospect(prospect)
                .oldScore(oldScore)
                .newScore(newScore)
                .scoreChange(newScore - oldScore)
                .reason(reason)
                .activityType(activityType)
                .campaign(ctx.campaign())
                .campaignEngagement(ctx.engagement())
                .changedBy(ctx.changedBy())
                .notes(ctx.notes())
                .build();

        history = historyRepository.save(history);

        log.debug("Lead score for prospect {} changed {} -> {} ({})",
                prospect.getId(), oldScore, newScore, reason);

        return history;
    }

    /**
     * Move the score to an absolute value, recorded as a delta.
     */
    @Transactional
    public LeadScoreHistory setScore(Prospect prospect, int targetScore, String reason,
                                     String activityType, ScoreContext context) {
        return applyDelta(prospect, targetScore - prospect.getLeadScore(), reason, activityType, context);
    }

    @Transactional(readOnly = true)
    public List<LeadScoreHistory> getHistory(Long prospectId) {
        return historyRepository.findByProspectIdOrderByCreatedAtDescIdDesc(prospectId);
    }
}
