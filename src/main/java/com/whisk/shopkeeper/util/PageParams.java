package com.whisk.shopkeeper.util;

import com.whisk.shopkeeper.exception.InvalidInputException;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * Checks the {@code skip}/{@code limit} pair accepted by list endpoints and
 * turns it into a row-offset {@link Pageable}.
 */
public final class PageParams {

    private PageParams() {
    }

    public static void check(int skip, int limit, int maxLimit) {
        if (skip < 0) {
            throw new InvalidInputException("skip must be >= 0");
        }
        if (limit < 1 || limit > maxLimit) {
            throw new InvalidInputException("limit must be between 1 and " + maxLimit);
        }
    }

    public static Pageable of(int skip, int limit, Sort sort) {
        return OffsetPageRequest.of(skip, limit, sort);
    }
}
