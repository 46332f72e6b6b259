package com.safeher.sosdispatch.service;

import com.safeher.sosdispatch.dto.EmergencyContactRequest;
import com.safeher.sosdispatch.entity.EmergencyContact;
import com.safeher.sosdispatch.exception.ConflictException;
import com.safeher.sosdispatch.exception.NotFoundException;
import com.safeher.sosdispatch.exception.ValidationException;
import com.safeher.sosdispatch.repository.EmergencyContactRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Emergency contacts of a user.
 *
 * Rules:
 *  - at most MAX_CONTACTS active contacts
 *  - the same phone number cannot be active twice for one user
 *  - whenever the user has an active contact, exactly one is primary
 *  - deletion is soft (active=false) so past alert notifications keep their reference
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmergencyContactService {

    public static final int MAX_CONTACTS = 5;

    private final EmergencyContactRepository contactRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<EmergencyContact> findActiveContacts(Long userId) {
        return contactRepository.findByUserIdAndActiveTrueOrderByPrimaryContactDescCreatedAtAsc(userId);
    }

    @Transactional
    public EmergencyContact addContact(Long userId, EmergencyContactRequest request) {
        long activeCount = contactRepository.countByUserIdAndActiveTrue(userId);
        if (activeCount >= MAX_CONTACTS) {
            throw new ValidationException("Maximum " + MAX_CONTACTS + " emergency contacts allowed");
        }
        String phone = request.getPhone().trim();
        if (contactRepository.existsByUserIdAndPhoneAndActiveTrue(userId, phone)) {
            throw new ConflictException("A contact with this phone number already exists");
        }

        boolean makePrimary = activeCount == 0 || Boolean.TRUE.equals(request.getPrimary());
        EmergencyContact contact = contactRepository.save(EmergencyContact.builder()
                .userId(userId)
                .name(request.getName().trim())
                .phone(phone)
                .relation(request.getRelation())
                .primaryContact(makePrimary)
                .active(true)
                .createdAt(LocalDateTime.now(clock))
                .build());

        if (makePrimary) {
            contactRepository.clearPrimaryExcept(userId, contact.getId());
        }
        log.info("CONTACT: user #{} added contact #{} (primary={})", userId, contact.getId(), makePrimary);
        return contact;
    }

    @Transactional
    public EmergencyContact setPrimary(Long userId, Long contactId) {
        EmergencyContact contact = contactRepository.findByIdAndUserIdAndActiveTrue(contactId, userId)
                .orElseThrow(() -> new NotFoundException("Contact not found: " + contactId));

        contactRepository.clearPrimaryExcept(userId, contactId);
        // clearPrimaryExcept detached the entity; re-read before changing it
        EmergencyContact primary = contactRepository.findById(contact.getId())
                .orElseThrow(() -> new NotFoundException("Contact not found: " + contactId));
        primary.setPrimaryContact(true);
        log.info("CONTACT: user #{} set contact #{} as primary", userId, contactId);
        return contactRepository.save(primary);
    }

    @Transactional
    public void deleteContact(Long userId, Long contactId) {
        EmergencyContact contact = contactRepository.findByIdAndUserIdAndActiveTrue(contactId, userId)
                .orElseThrow(() -> new NotFoundException("Contact not found: " + contactId));

        boolean wasPrimary = contact.isPrimaryContact();
        contact.setActive(false);
        contact.setPrimaryContact(false);
        contactRepository.saveAndFlush(contact);

        if (wasPrimary) {
            contactRepository.findFirstByUserIdAndActiveTrueOrderByCreatedAtAsc(userId)
                    .ifPresent(next -> {
                        next.setPrimaryContact(true);
                        contactRepository.save(next);
                        log.info("CONTACT: contact #{} promoted to primary for user #{}", next.getId(), userId);
                    });
        }
        log.info("CONTACT: user #{} removed contact #{}", userId, contactId);
    }
}
