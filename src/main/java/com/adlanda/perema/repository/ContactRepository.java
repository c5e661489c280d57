package com.adlanda.perema.repository;

import com.adlanda.perema.entity.Contact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for contacts.
 *
 * Filtered listing goes through {@link JpaSpecificationExecutor} with the
 * specifications in {@link ContactSpecifications}.
 */
@Repository
public interface ContactRepository extends JpaRepository<Contact, Long>, JpaSpecificationExecutor<Contact> {

    /**
     * Find contacts born on the given day of the given month, any year.
     *
     * @param month Month of year, 1-12
     * @param days  Days of month to match (more than one for 29 February on non-leap years)
     * @return Matching contacts
     */
    List<Contact> findByBirthdayMonthAndBirthdayDayIn(int month, Collection<Integer> days);

    /**
     * Raw JSON circle arrays of every contact that has at least one circle.
     */
    @Query("SELECT c.circlesJson FROM Contact c WHERE c.circlesJson IS NOT NULL")
    List<String> findAllCircleColumns();
}
