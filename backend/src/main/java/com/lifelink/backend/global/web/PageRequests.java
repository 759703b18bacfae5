package com.lifelink.backend.global.web;

import org.springframework.data.domain.PageRequest;

public final class PageRequests {

    public static final int MAX_PAGE_SIZE = 50;

    private PageRequests() {
    }

    public static PageRequest of(int page, int size) {
        return PageRequest.of(safePage(page), safeSize(size));
    }

    public static int safePage(int page) {
        return Math.max(page, 0);
    }

    public static int safeSize(int size) {
        return Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
    }
}
