package com.digitalgroup.crm.domain.campaign.repository;

import com.digitalgroup.crm.domain.campaign.dto.CampaignSearchCriteria;
import com.digitalgroup.crm.domain.campaign.entity.Campaign;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;

public final class CampaignSpecifications {

    private CampaignSpecifications() {
    }

    public static Specification<Campaign> matching(CampaignSearchCriteria criteria) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (criteria.search() != null && !criteria.search().isBlank()) {
                String like = "%" + criteria.search().trim().toLowerCase() + "%";
                predicates.add(cb.or(
                        cb.like(cb.lower(root.get("name")), like),
                        cb.like(cb.lower(root.get("description")), like)));
            }
            if (criteria.statuses() != null && !criteria.statuses().isEmpty()) {
                predicates.add(root.get("status").in(criteria.statuses()));
            }
            if (criteria.types() != null && !criteria.types().isEmpty()) {
                predicates.add(root.get("type").in(criteria.types()));
            }
            if (criteria.ownerId() != null) {
                predicates.add(cb.equal(root.get("ownerId"), criteria.ownerId()));
            }
            if (criteria.category() != null && !criteria.category().isBlank()) {
                predicates.add(cb.equal(root.get("category"), criteria.category()));
            }
            if (criteria.tags() != null && !criteria.tags().isEmpty()) {
                Join<Campaign, String> tags = root.join("tags");
                predicates.add(tags.in(criteria.tags()));
                query.distinct(true);
            }
            if (criteria.startFrom() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("startDate"), criteria.startFrom()));
            }
            if (criteria.startTo() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("startDate"), criteria.startTo()));
            }
            if (criteria.endFrom() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("endDate"), criteria.endFrom()));
            }
            if (criteria.endTo() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("endDate"), criteria.endTo()));
            }
            if (criteria.minBudget() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("budget"), criteria.minBudget()));
            }
            if (criteria.maxBudget() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("budget"), criteria.maxBudget()));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
