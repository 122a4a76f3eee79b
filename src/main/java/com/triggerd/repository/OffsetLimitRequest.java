package com.triggerd.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * A {@link Pageable} addressed by row offset instead of page number, so the
 * stores can expose plain limit/offset arguments.
 */
public final class OffsetLimitRequest implements Pageable {

    private final long offset;
    private final int limit;
    private final Sort sort;

    private OffsetLimitRequest(long offset, int limit, Sort sort) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1: " + limit);
        }
        this.offset = offset;
        this.limit = limit;
        this.sort = sort;
    }

    /**
     * Returns an unpaged request when neither bound is given.
     */
    public static Pageable of(Integer limit, Integer offset, Sort sort) {
        if (limit == null && (offset == null || offset == 0)) {
            return Pageable.unpaged();
        }
        return new OffsetLimitRequest(
                offset == null ? 0 : offset,
                limit == null ? Integer.MAX_VALUE : limit,
                sort);
    }

    @Override
    public int getPageNumber() {
        return (int) (offset / limit);
    }

    @Override
    public int getPageSize() {
        return limit;
    }

    @Override
    public long getOffset() {
        return offset;
    }

    @Override
    public Sort getSort() {
        return sort;
    }

    @Override
    public Pageable next() {
        return new OffsetLimitRequest(offset + limit, limit, sort);
    }

    @Override
    public Pageable previousOrFirst() {
        return hasPrevious() ? new OffsetLimitRequest(Math.max(0, offset - limit), limit, sort) : first();
    }

    @Override
    public Pageable first() {
        return new OffsetLimitRequest(0, limit, sort);
    }

    @Override
    public Pageable withPage(int pageNumber) {
        return new OffsetLimitRequest((long) pageNumber * limit, limit, sort);
    }

    @Override
    public boolean hasPrevious() {
        return offset > 0;
    }
}
