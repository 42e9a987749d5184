package com.dining.reservation_service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Links to the neighbouring pages of a listing. Either side is omitted when there is no such page.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Pagination {

    private PageLink next;
    private PageLink prev;

    public Pagination() {
    }

    public Pagination(PageLink next, PageLink prev) {
        this.next = next;
        this.prev = prev;
    }

    public PageLink getNext() {
        return next;
    }

    public void setNext(PageLink next) {
        this.next = next;
    }

    public PageLink getPrev() {
        return prev;
    }

    public void setPrev(PageLink prev) {
        this.prev = prev;
    }

    public static class PageLink {

        private int page;
        private int limit;

        public PageLink() {
        }

        public PageLink(int page, int limit) {
            this.page = page;
            this.limit = limit;
        }

        public int getPage() {
            return page;
        }

        public void setPage(int page) {
            this.page = page;
        }

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }
    }
}
