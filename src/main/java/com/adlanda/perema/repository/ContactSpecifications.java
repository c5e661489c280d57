package com.adlanda.perema.repository;

import com.adlanda.perema.entity.CirclesConverter;
import com.adlanda.perema.entity.Contact;
import org.springframework.data.jpa.domain.Specification;

import java.util.Locale;

/**
 * Query building blocks for the contact listing.
 */
public final class ContactSpecifications {

    private static final char ESCAPE = '\\';

    private ContactSpecifications() {
    }

    /**
     * Case-insensitive substring match on first name, last name or nickname.
     * Returns null (no restriction) for a blank term.
     */
    public static Specification<Contact> nameContains(String term) {
        if (term == null || term.isBlank()) {
            return null;
        }
        String pattern = "%" + escapeLike(term.trim().toLowerCase(Locale.ROOT)) + "%";
        return (root, query, cb) -> cb.or(
                cb.like(cb.lower(root.get("firstname")), pattern, ESCAPE),
                cb.like(cb.lower(root.get("lastname")), pattern, ESCAPE),
                cb.like(cb.lower(root.get("nickname")), pattern, ESCAPE)
        );
    }

    /**
     * Contacts whose circle list contains exactly {@code circle}.
     * Matches the quoted element inside the stored JSON array, escaped the way
     * {@link CirclesConverter} writes it.
     */
    public static Specification<Contact> inCircle(String circle) {
        if (circle == null || circle.isBlank()) {
            return null;
        }
        String pattern = "%" + escapeLike(CirclesConverter.toJsonElement(circle.trim())) + "%";
        return (root, query, cb) -> cb.like(root.get("circlesJson"), pattern, ESCAPE);
    }

    /**
     * Combines the listing filters. Null arguments are ignored.
     */
    public static Specification<Contact> matching(String search, String circle) {
        return Specification.where(nameContains(search)).and(inCircle(circle));
    }

    static String escapeLike(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == ESCAPE || c == '%' || c == '_') {
                escaped.append(ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
