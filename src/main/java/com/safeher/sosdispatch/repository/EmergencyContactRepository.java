package com.safeher.sosdispatch.repository;

import com.safeher.sosdispatch.entity.EmergencyContact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EmergencyContactRepository extends JpaRepository<EmergencyContact, Long> {

    /** Active contacts, primary first, then oldest first */
    List<EmergencyContact> findByUserIdAndActiveTrueOrderByPrimaryContactDescCreatedAtAsc(Long userId);

    long countByUserIdAndActiveTrue(Long userId);

    boolean existsByUserIdAndPhoneAndActiveTrue(Long userId, String phone);

    Optional<EmergencyContact> findByIdAndUserIdAndActiveTrue(Long id, Long userId);

    Optional<EmergencyContact> findFirstByUserIdAndActiveTrueOrderByCreatedAtAsc(Long userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE EmergencyContact c SET c.primaryContact = false " +
           "WHERE c.userId = :userId AND c.id <> :keepId AND c.primaryContact = true")
    int clearPrimaryExcept(@Param("userId") Long userId, @Param("keepId") Long keepId);
}
