package com.aegis.adminapi.domain;

import java.util.List;
import java.util.function.Function;

/**
 * One page of a listing plus the numbers a client needs to page through it.
 *
 * @param data the page's items
 * @param meta paging metadata
 */
public record Page<T>(List<T> data, Meta meta) {

    /**
     * @param page       1-based page number
     * @param limit      page size
     * @param totalPages 0 when there are no items
     */
    public record Meta(
            long total, int page, int limit, int totalPages, boolean hasNext, boolean hasPrevious) {

        public static Meta of(long total, int page, int limit) {
            int totalPages = (int) ((total + limit - 1) / limit);
            return new Meta(total, page, limit, totalPages, page < totalPages, page > 1);
        }
    }

    public <R> Page<R> map(Function<T, R> mapper) {
        return new Page<>(data.stream().map(mapper).toList(), meta);
    }
}
