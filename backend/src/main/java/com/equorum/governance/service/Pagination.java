package com.equorum.governance.service;

import io.micronaut.http.HttpStatus;
import io.micronaut.http.exceptions.HttpStatusException;

/**
 * Page arithmetic for listings addressed by page number.
 *
 * An empty listing still has one (empty) page, so page 0 is always valid.
 *
 * @param startAt first index on the page (inclusive)
 * @param endAt   last index on the page (exclusive)
 * @param pages   number of pages for the whole listing
 */
public record Pagination(int page, int itemsPerPage, int startAt, int endAt, int pages) {

    public static final int DEFAULT_SIZE = 20;
    public static final int MAX_SIZE = 100;

    public static Pagination of(long total, int page, int itemsPerPage) {
        if (itemsPerPage <= 0 || itemsPerPage > MAX_SIZE) {
            throw new HttpStatusException(HttpStatus.BAD_REQUEST,
                "Page size must be between 1 and " + MAX_SIZE);
        }
        if (page < 0) {
            throw new HttpStatusException(HttpStatus.BAD_REQUEST, "Page must be >= 0");
        }
        int n = (int) Math.min(total, Integer.MAX_VALUE);
        int pages;
        if (n < itemsPerPage) {
            pages = 1;
        } else if (n % itemsPerPage == 0) {
            pages = n / itemsPerPage;
        } else {
            pages = n / itemsPerPage + 1;
        }
        if (page >= pages) {
            throw new HttpStatusException(HttpStatus.BAD_REQUEST,
                "Page out of bounds: " + page + " (pages: " + pages + ")");
        }
        int startAt = itemsPerPage * page;
        int endAt = Math.min(startAt + itemsPerPage, n);
        return new Pagination(page, itemsPerPage, startAt, endAt, pages);
    }

    public int size() {
        return endAt - startAt;
    }
}
