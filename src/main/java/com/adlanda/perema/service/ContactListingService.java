package com.adlanda.perema.service;

import com.adlanda.perema.entity.Contact;
import com.adlanda.perema.model.ContactField;
import com.adlanda.perema.model.ContactInclude;
import com.adlanda.perema.model.ContactListQuery;
import com.adlanda.perema.model.ContactPage;
import com.adlanda.perema.repository.ContactRepository;
import com.adlanda.perema.repository.ContactSpecifications;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the paged contact listing.
 *
 * Orchestrates the query flow:
 * 1. Filter by name search and circle
 * 2. Fetch one page, ordered by last name, first name, id
 * 3. Project each contact onto the selected fields and embed requested relations
 */
@Service
public class ContactListingService {

    private static final Logger log = LoggerFactory.getLogger(ContactListingService.class);

    static final Sort ORDER = Sort.by("lastname", "firstname", "id");

    private final ContactRepository contactRepository;

    public ContactListingService(ContactRepository contactRepository) {
        this.contactRepository = contactRepository;
    }

    @Transactional(readOnly = true)
    public ContactPage list(ContactListQuery query) {
        long startTime = System.currentTimeMillis();
        Specification<Contact> spec = ContactSpecifications.matching(query.search(), query.circle());

        List<Map<String, Object>> rows;
        long total;
        if ((long) (query.page() - 1) * query.limit() > Integer.MAX_VALUE) {
            // Past any row the database can hold; only the total is meaningful
            rows = List.of();
            total = contactRepository.count(spec);
        } else {
            Page<Contact> page = contactRepository.findAll(
                    spec, PageRequest.of(query.page() - 1, query.limit(), ORDER));
            rows = page.getContent().stream()
                    .map(contact -> project(contact, query))
                    .toList();
            total = page.getTotalElements();
        }

        log.debug("Listed {} of {} contacts (page {}, limit {}) in {}ms",
                rows.size(), total, query.page(), query.limit(),
                System.currentTimeMillis() - startTime);

        return new ContactPage(rows, total, query.page(), query.limit());
    }

    /**
     * The "id" key comes first, then the selected fields in request order,
     * then included relations in a fixed order.
     */
    Map<String, Object> project(Contact contact, ContactListQuery query) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", contact.getId());
        for (ContactField field : query.fields()) {
            row.put(field.jsonName(), field.valueOf(contact));
        }
        for (ContactInclude include : ContactInclude.values()) {
            if (query.includes().contains(include)) {
                row.put(include.jsonName(), include.load(contact));
            }
        }
        return row;
    }
}
