package com.digitalgroup.crm.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.function.Function;

/**
 * Pagination wrapper for list endpoints. Pages are 1-based in the response.
 *
 * @param <T> The type of items in the data list
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PagedResponse<T> {

    private List<T> data;
    private Meta meta;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Meta {
        @JsonProperty("total_items")
        private long totalItems;
        private int page;
        @JsonProperty("page_size")
        private int pageSize;
        @JsonProperty("total_pages")
        private int totalPages;
    }

    /**
     * Create a PagedResponse from a Spring Data Page, mapping each item
     */
    public static <S, T> PagedResponse<T> fromPage(Page<S> page, Function<S, T> mapper) {
        return PagedResponse.<T>builder()
                .data(page.getContent().stream().map(mapper).toList())
                .meta(Meta.builder()
                        .totalItems(page.getTotalElements())
                        .page(page.getNumber() + 1) // Convert 0-based to 1-based
                        .pageSize(page.getSize())
                        .totalPages(page.getTotalPages())
                        .build())
                .build();
    }
}
