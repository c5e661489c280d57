package com.adlanda.perema.model;

import com.adlanda.perema.entity.Contact;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Related collections a listing may preload and embed with {@code includes=}.
 */
public enum ContactInclude {

    NOTES("notes", contact -> contact.getNotes().stream().map(NoteResponse::from).toList()),
    ACTIVITIES("activities", contact -> contact.getActivities().stream().map(ActivityResponse::from).toList()),
    RELATIONSHIPS("relationships", contact -> contact.getRelationships().stream().map(RelationshipResponse::from).toList()),
    REMINDERS("reminders", contact -> contact.getReminders().stream().map(ReminderResponse::from).toList());

    private static final Map<String, ContactInclude> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ContactInclude::jsonName, Function.identity()));

    private final String jsonName;
    private final Function<Contact, List<?>> loader;

    ContactInclude(String jsonName, Function<Contact, List<?>> loader) {
        this.jsonName = jsonName;
        this.loader = loader;
    }

    public String jsonName() {
        return jsonName;
    }

    /**
     * Loads the collection and maps it to response records. Must run inside a transaction.
     */
    public List<?> load(Contact contact) {
        return loader.apply(contact);
    }

    public static Optional<ContactInclude> fromName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }
}
