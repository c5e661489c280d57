package com.adlanda.perema.repository;

import com.adlanda.perema.entity.Contact;
import com.adlanda.perema.model.ContactRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.Sort;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class ContactRepositoryTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private ContactRepository contactRepository;

    @BeforeEach
    void setUp() {
        persist("Ada", "Lovelace", "Countess", LocalDate.of(1815, 12, 10), List.of("friends", "science"));
        persist("Grace", "Hopper", "Amazing Grace", LocalDate.of(1906, 12, 9), List.of("science"));
        persist("Leap", "Day", null, LocalDate.of(2000, 2, 29), List.of("family"));
        persist("Percent", "Sign_50%", null, null, List.of("family friends"));
        entityManager.flush();
        entityManager.clear();
    }

    private void persist(String firstname, String lastname, String nickname,
                         LocalDate birthday, List<String> circles) {
        Contact contact = new Contact(firstname, lastname);
        contact.setNickname(nickname);
        contact.setBirthday(birthday);
        contact.setCircles(circles);
        entityManager.persist(contact);
    }

    private List<String> firstnames(List<Contact> contacts) {
        return contacts.stream().map(Contact::getFirstname).toList();
    }

    @Test
    void findByBirthday_matchesMonthAndDayOfAnyYear() {
        List<Contact> found = contactRepository.findByBirthdayMonthAndBirthdayDayIn(12, List.of(10));

        assertThat(firstnames(found)).containsExactly("Ada");
    }

    @Test
    void findByBirthday_multipleDays_matchesLeapDay() {
        List<Contact> found = contactRepository.findByBirthdayMonthAndBirthdayDayIn(2, List.of(28, 29));

        assertThat(firstnames(found)).containsExactly("Leap");
    }

    @Test
    void nameContains_matchesAnyNameCaseInsensitively() {
        assertThat(firstnames(contactRepository.findAll(ContactSpecifications.nameContains("LOVE"))))
                .containsExactly("Ada");
        assertThat(firstnames(contactRepository.findAll(ContactSpecifications.nameContains("amazing"))))
                .containsExactly("Grace");
    }

    @Test
    void nameContains_wildcardsAreLiteral() {
        assertThat(firstnames(contactRepository.findAll(ContactSpecifications.nameContains("_50%"))))
                .containsExactly("Percent");
        assertThat(contactRepository.findAll(ContactSpecifications.nameContains("%"))).hasSize(1);
    }

    @Test
    void inCircle_matchesWholeCircleOnly() {
        List<Contact> friends = contactRepository.findAll(ContactSpecifications.inCircle("friends"), Sort.by("id"));
        assertThat(firstnames(friends)).containsExactly("Ada");

        List<Contact> science = contactRepository.findAll(ContactSpecifications.inCircle("science"), Sort.by("id"));
        assertThat(firstnames(science)).containsExactly("Ada", "Grace");
    }

    @Test
    void inCircle_namesWithQuoteOrBackslash_matchExactly() {
        persist("Quote", "Mark", null, null, List.of("say \"hi\"", "back\\slash"));
        entityManager.flush();
        entityManager.clear();

        assertThat(firstnames(contactRepository.findAll(ContactSpecifications.inCircle("say \"hi\""))))
                .containsExactly("Quote");
        assertThat(firstnames(contactRepository.findAll(ContactSpecifications.inCircle("back\\slash"))))
                .containsExactly("Quote");
        assertThat(contactRepository.findAll(ContactSpecifications.inCircle("hi"))).isEmpty();
        assertThat(contactRepository.findAll(ContactSpecifications.inCircle("back"))).isEmpty();
    }

    @Test
    void save_largestAllowedCircleList_fitsColumn() {
        // Quotes double in the stored JSON
        List<String> circles = IntStream.rangeClosed(1, Contact.MAX_CIRCLES)
                .mapToObj(i -> String.format("%02d", i) + "\"".repeat(Contact.MAX_CIRCLE_LENGTH - 2))
                .toList();
        Contact contact = new Contact();
        new ContactRequest("Many", null, null, null, null, null, null,
                null, null, null, null, null, circles).applyTo(contact);

        Long id = contactRepository.saveAndFlush(contact).getId();
        entityManager.clear();

        assertThat(contactRepository.findById(id).orElseThrow().getCircles()).isEqualTo(circles);
    }

    @Test
    void matching_combinesFilters() {
        List<Contact> found = contactRepository.findAll(ContactSpecifications.matching("grace", "science"));
        assertThat(firstnames(found)).containsExactly("Grace");

        assertThat(contactRepository.findAll(ContactSpecifications.matching(null, null))).hasSize(4);
    }

    @Test
    void findAllCircleColumns_returnsStoredJson() {
        assertThat(contactRepository.findAllCircleColumns())
                .hasSize(4)
                .contains("[\"friends\",\"science\"]");
    }

    @Test
    void escapeLike_escapesWildcardsAndEscapeChar() {
        assertThat(ContactSpecifications.escapeLike("50%_a\\b")).isEqualTo("50\\%\\_a\\\\b");
    }
}
