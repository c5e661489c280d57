package com.adlanda.perema.model;

import com.adlanda.perema.entity.Contact;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Whitelist of contact properties a listing may select with {@code fields=}.
 *
 * The id is not part of the whitelist; it is always returned.
 */
public enum ContactField {

    FIRSTNAME("firstname", Contact::getFirstname),
    LASTNAME("lastname", Contact::getLastname),
    NICKNAME("nickname", Contact::getNickname),
    GENDER("gender", Contact::getGender),
    EMAIL("email", Contact::getEmail),
    PHONE("phone", Contact::getPhone),
    BIRTHDAY("birthday", Contact::getBirthday),
    ADDRESS("address", Contact::getAddress),
    HOW_WE_MET("how_we_met", Contact::getHowWeMet),
    FOOD_PREFERENCE("food_preference", Contact::getFoodPreference),
    WORK_INFORMATION("work_information", Contact::getWorkInformation),
    CONTACT_INFORMATION("contact_information", Contact::getContactInformation),
    CIRCLES("circles", contact -> List.copyOf(contact.getCircles())),
    PHOTO("photo", Contact::getPhoto);

    private static final Map<String, ContactField> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(ContactField::jsonName, Function.identity()));

    private final String jsonName;
    private final Function<Contact, Object> accessor;

    ContactField(String jsonName, Function<Contact, Object> accessor) {
        this.jsonName = jsonName;
        this.accessor = accessor;
    }

    public String jsonName() {
        return jsonName;
    }

    public Object valueOf(Contact contact) {
        return accessor.apply(contact);
    }

    /**
     * Looks up a field by its query/JSON name, e.g. {@code how_we_met}.
     */
    public static Optional<ContactField> fromName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }
}
