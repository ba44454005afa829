package com.whisk.shopkeeper.dto;

import lombok.Value;
import org.springframework.data.domain.Page;

import java.util.List;

/**
 * List payload used by the paged endpoints: {@code {results, total}}.
 */
@Value
public class PageResponse<T> {
    List<T> results;
    long total;

    public static <T> PageResponse<T> from(Page<T> page) {
        return new PageResponse<>(page.getContent(), page.getTotalElements());
    }
}
