package com.adlanda.perema.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Parsed and sanitised query parameters of the contact listing.
 *
 * Invalid input never fails the request: bad paging values fall back to the
 * defaults and unknown field or include names are dropped.
 *
 * @param page     1-based page number
 * @param limit    Page size, 1 to {@value #MAX_LIMIT}
 * @param fields   Selected properties in request order (all of them when none requested)
 * @param includes Related collections to embed
 * @param search   Name filter, null for none
 * @param circle   Circle filter, null for none
 */
public record ContactListQuery(
        int page,
        int limit,
        List<ContactField> fields,
        Set<ContactInclude> includes,
        String search,
        String circle
) {
    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 25;
    public static final int MAX_LIMIT = 100;

    public static ContactListQuery of(String page, String limit, String fields,
                                      String includes, String search, String circle) {
        return new ContactListQuery(
                parsePage(page),
                parseLimit(limit),
                parseFields(fields),
                parseIncludes(includes),
                blankToNull(search),
                blankToNull(circle)
        );
    }

    static int parsePage(String value) {
        int page = parseInt(value, DEFAULT_PAGE);
        return page < 1 ? DEFAULT_PAGE : page;
    }

    static int parseLimit(String value) {
        int limit = parseInt(value, DEFAULT_LIMIT);
        return limit < 1 || limit > MAX_LIMIT ? DEFAULT_LIMIT : limit;
    }

    static List<ContactField> parseFields(String value) {
        if (value == null || value.isBlank()) {
            return List.of(ContactField.values());
        }
        Set<ContactField> selected = new LinkedHashSet<>(
                parseNames(value, ContactField::fromName));
        return List.copyOf(selected);
    }

    static Set<ContactInclude> parseIncludes(String value) {
        if (value == null || value.isBlank()) {
            return Set.of();
        }
        List<ContactInclude> named = parseNames(value, ContactInclude::fromName);
        return named.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(named));
    }

    private static <T> List<T> parseNames(String value, Function<String, Optional<T>> lookup) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .map(lookup)
                .flatMap(Optional::stream)
                .collect(Collectors.toList());
    }

    private static int parseInt(String value, int fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
