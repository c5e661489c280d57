package com.adlanda.perema.service;

import com.adlanda.perema.entity.Activity;
import com.adlanda.perema.entity.Contact;
import com.adlanda.perema.exception.ResourceNotFoundException;
import com.adlanda.perema.model.ActivityRequest;
import com.adlanda.perema.model.ActivityResponse;
import com.adlanda.perema.repository.ActivityRepository;
import com.adlanda.perema.repository.ContactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@Service
public class ActivityService {

    private static final Logger log = LoggerFactory.getLogger(ActivityService.class);

    private final ActivityRepository activityRepository;
    private final ContactRepository contactRepository;
    private final Clock clock;

    public ActivityService(ActivityRepository activityRepository, ContactRepository contactRepository, Clock clock) {
        this.activityRepository = activityRepository;
        this.contactRepository = contactRepository;
        this.clock = clock;
    }

    @Transactional
    public ActivityResponse create(long contactId, ActivityRequest request) {
        Contact contact = contactRepository.findById(contactId)
                .orElseThrow(ResourceNotFoundException::contact);

        Activity activity = new Activity(request.name().trim(),
                request.date() != null ? request.date() : LocalDate.now(clock));
        activity.setDescription(request.description());
        activity.setLocation(request.location());
        contact.addActivity(activity);

        Activity saved = activityRepository.save(activity);
        log.info("Created activity {} for contact {}", saved.getId(), contactId);
        return ActivityResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public List<ActivityResponse> listForContact(long contactId) {
        if (!contactRepository.existsById(contactId)) {
            throw ResourceNotFoundException.contact();
        }
        return activityRepository.findByContact_IdOrderByDateDescIdDesc(contactId).stream()
                .map(ActivityResponse::from)
                .toList();
    }

    @Transactional
    public ActivityResponse update(long id, ActivityRequest request) {
        Activity activity = findActivity(id);
        if (request.name() != null) activity.setName(request.name().trim());
        if (request.description() != null) activity.setDescription(request.description());
        if (request.date() != null) activity.setDate(request.date());
        if (request.location() != null) activity.setLocation(request.location());
        return ActivityResponse.from(activityRepository.save(activity));
    }

    @Transactional
    public void delete(long id) {
        Activity activity = findActivity(id);
        activity.getContact().getActivities().remove(activity);
        activityRepository.delete(activity);
        log.info("Deleted activity {}", id);
    }

    private Activity findActivity(long id) {
        return activityRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Activity not found"));
    }
}
