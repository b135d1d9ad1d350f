package com.digitalgroup.crm.domain.prospect.repository;

import com.digitalgroup.crm.domain.prospect.dto.ProspectSearchCriteria;
import com.digitalgroup.crm.domain.prospect.entity.Prospect;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;

public final class ProspectSpecifications {

    private ProspectSpecifications() {
    }

    public static Specification<Prospect> matching(ProspectSearchCriteria criteria) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (criteria.search() != null && !criteria.search().isBlank()) {
                String like = "%" + criteria.search().trim().toLowerCase() + "%";
                predicates.add(cb.or(
                        cb.like(cb.lower(root.get("firstName")), like),
                        cb.like(cb.lower(root.get("lastName")), like),
                        cb.like(cb.lower(root.get("email")), like),
                        cb.like(cb.lower(root.get("companyName")), like),
                        cb.like(root.get("phone"), like)));
            }
            if (criteria.statuses() != null && !criteria.statuses().isEmpty()) {
                predicates.add(root.get("status").in(criteria.statuses()));
            }
            if (criteria.sources() != null && !criteria.sources().isEmpty()) {
                predicates.add(root.get("source").in(criteria.sources()));
            }
            if (criteria.campaignId() != null) {
                predicates.add(cb.equal(root.get("campaign").get("id"), criteria.campaignId()));
            }
            if (criteria.assignedTo() != null) {
                predicates.add(cb.equal(root.get("assignedTo"), criteria.assignedTo()));
            }
            if (criteria.minLeadScore() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("leadScore"), criteria.minLeadScore()));
            }
            if (criteria.maxLeadScore() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("leadScore"), criteria.maxLeadScore()));
            }
            if (criteria.createdFrom() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("createdAt"), criteria.createdFrom()));
            }
            if (criteria.createdTo() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("createdAt"), criteria.createdTo()));
            }
            // Own-only visibility: assigned to or created by the user
            if (criteria.visibleTo() != null) {
                predicates.add(cb.or(
                        cb.equal(root.get("assignedTo"), criteria.visibleTo()),
                        cb.equal(root.get("createdBy"), criteria.visibleTo())));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
