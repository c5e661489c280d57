package com.adlanda.perema.model;

import com.adlanda.perema.entity.Contact;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Request body for creating and updating a contact.
 *
 * On update only the properties present (non-null) are applied.
 */
public record ContactRequest(
        @NotBlank(groups = OnCreate.class, message = "Firstname is required")
        @Pattern(regexp = "(?s).*\\S.*", message = "Firstname must not be blank")
        @Size(max = 255)
        String firstname,

        @Size(max = 255) String lastname,
        @Size(max = 255) String nickname,
        @Size(max = 64) String gender,

        @Email(message = "Email must be a valid address")
        @Size(max = 255)
        String email,

        @Size(max = 64) String phone,
        LocalDate birthday,
        @Size(max = 1000) String address,
        @Size(max = 4000) String howWeMet,
        @Size(max = 4000) String foodPreference,
        @Size(max = 4000) String workInformation,
        @Size(max = 4000) String contactInformation,
        @Size(max = Contact.MAX_CIRCLES, message = "At most " + Contact.MAX_CIRCLES + " circles are allowed")
        List<@Size(max = Contact.MAX_CIRCLE_LENGTH) String> circles
) {

    /**
     * Copies every non-null property onto the given contact.
     */
    public void applyTo(Contact contact) {
        if (firstname != null) contact.setFirstname(firstname.trim());
        if (lastname != null) contact.setLastname(lastname);
        if (nickname != null) contact.setNickname(nickname);
        if (gender != null) contact.setGender(gender);
        if (email != null) contact.setEmail(email);
        if (phone != null) contact.setPhone(phone);
        if (birthday != null) contact.setBirthday(birthday);
        if (address != null) contact.setAddress(address);
        if (howWeMet != null) contact.setHowWeMet(howWeMet);
        if (foodPreference != null) contact.setFoodPreference(foodPreference);
        if (workInformation != null) contact.setWorkInformation(workInformation);
        if (contactInformation != null) contact.setContactInformation(contactInformation);
        if (circles != null) contact.setCircles(normalizeCircles(circles));
    }

    /**
     * Trims circle names, drops blanks and duplicates, keeps first-seen order.
     */
    static List<String> normalizeCircles(List<String> circles) {
        Set<String> normalized = new LinkedHashSet<>();
        circles.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .forEach(normalized::add);
        return List.copyOf(normalized);
    }
}
