package com.adlanda.perema.model;

import java.util.List;
import java.util.Map;

/**
 * Response of the contact listing.
 *
 * @param contacts Selected fields of each contact, plus "id" and any included relations
 * @param total    Number of contacts matching the filters across all pages
 * @param page     Page actually served
 * @param limit    Page size actually used
 */
public record ContactPage(
        List<Map<String, Object>> contacts,
        long total,
        int page,
        int limit
) {}
