package com.safeher.sosdispatch.dto;

import com.safeher.sosdispatch.entity.EmergencyContact;
import lombok.*;

import java.time.LocalDateTime;

@Getter
@AllArgsConstructor
@Builder
public class EmergencyContactResponse {

    private final Long id;
    private final String name;
    private final String phone;
    private final String relation;
    private final boolean primary;
    private final LocalDateTime createdAt;

    public static EmergencyContactResponse from(EmergencyContact c) {
        return new EmergencyContactResponse(c.getId(), c.getName(), c.getPhone(),
                c.getRelation(), c.isPrimaryContact(), c.getCreatedAt());
    }
}
