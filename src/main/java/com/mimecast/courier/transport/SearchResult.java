package com.mimecast.courier.transport;

import java.util.Collections;
import java.util.List;

/**
 * Result of a mailbox search.
 *
 * <p>A search the server did not acknowledge carries no ids and a detail instead.
 */
public final class SearchResult {
    private final List<Integer> ids;
    private final String detail;

    private SearchResult(List<Integer> ids, String detail) {
        this.ids = ids;
        this.detail = detail;
    }

    /**
     * Acknowledged search.
     *
     * @param ids Message ids in server order.
     * @return SearchResult instance.
     */
    public static SearchResult ok(List<Integer> ids) {
        return new SearchResult(List.copyOf(ids), null);
    }

    /**
     * Search not acknowledged.
     *
     * @param detail Server reply or error.
     * @return SearchResult instance.
     */
    public static SearchResult notOk(String detail) {
        return new SearchResult(Collections.emptyList(), detail != null ? detail : "NO");
    }

    public boolean isOk() {
        return detail == null;
    }

    public List<Integer> getIds() {
        return ids;
    }

    public String getDetail() {
        return detail;
    }
}
