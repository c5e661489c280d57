package com.adlanda.perema.service;

import com.adlanda.perema.entity.CirclesConverter;
import com.adlanda.perema.entity.Contact;
import com.adlanda.perema.exception.PhotoStorageException;
import com.adlanda.perema.exception.ResourceNotFoundException;
import com.adlanda.perema.model.ContactRequest;
import com.adlanda.perema.model.ContactResponse;
import com.adlanda.perema.repository.ContactRepository;
import com.adlanda.perema.repository.RelationshipRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.TreeSet;

/**
 * Create, read, update and delete for single contacts, plus circles and photos.
 *
 * Listing with filters and field selection lives in {@link ContactListingService}.
 */
@Service
public class ContactService {

    private static final Logger log = LoggerFactory.getLogger(ContactService.class);

    private final ContactRepository contactRepository;
    private final RelationshipRepository relationshipRepository;
    private final PhotoStorageService photoStorageService;
    private final CirclesConverter circlesConverter = new CirclesConverter();

    public ContactService(ContactRepository contactRepository,
                          RelationshipRepository relationshipRepository,
                          PhotoStorageService photoStorageService) {
        this.contactRepository = contactRepository;
        this.relationshipRepository = relationshipRepository;
        this.photoStorageService = photoStorageService;
    }

    @Transactional
    public ContactResponse create(ContactRequest request) {
        Contact contact = new Contact();
        request.applyTo(contact);
        Contact saved = contactRepository.save(contact);
        log.info("Created contact {}", saved.getId());
        return ContactResponse.from(saved);
    }

    /**
     * Returns the contact with notes, activities, relationships and reminders.
     */
    @Transactional(readOnly = true)
    public ContactResponse get(long id) {
        return ContactResponse.from(findContact(id));
    }

    /**
     * Merges the non-null properties of the request into the stored contact.
     */
    @Transactional
    public ContactResponse update(long id, ContactRequest request) {
        Contact contact = findContact(id);
        request.applyTo(contact);
        Contact saved = contactRepository.saveAndFlush(contact);
        log.info("Updated contact {}", id);
        return ContactResponse.from(saved);
    }

    /**
     * Deletes the contact with everything it owns. Relationships of other
     * contacts pointing at it are kept but lose the reference.
     */
    @Transactional
    public void delete(long id) {
        Contact contact = findContact(id);
        int detached = relationshipRepository.clearRelatedContact(id);
        contactRepository.delete(contact);
        log.info("Deleted contact {} ({} relationships detached)", id, detached);
    }

    /**
     * All distinct circle names, sorted alphabetically.
     */
    @Transactional(readOnly = true)
    public List<String> circles() {
        TreeSet<String> names = new TreeSet<>();
        for (String column : contactRepository.findAllCircleColumns()) {
            circlesConverter.convertToEntityAttribute(column).stream()
                    .filter(name -> name != null && !name.isBlank())
                    .forEach(names::add);
        }
        return List.copyOf(names);
    }

    @Transactional
    public ContactResponse attachPhoto(long id, MultipartFile photo) {
        Contact contact = findContact(id);
        String url;
        try {
            url = photoStorageService.store(photo);
        } catch (IOException e) {
            throw new PhotoStorageException("Could not write photo for contact " + id, e);
        }
        contact.setPhoto(url);
        log.info("Attached photo {} to contact {}", url, id);
        return ContactResponse.from(contactRepository.save(contact));
    }

    private Contact findContact(long id) {
        return contactRepository.findById(id)
                .orElseThrow(ResourceNotFoundException::contact);
    }
}
