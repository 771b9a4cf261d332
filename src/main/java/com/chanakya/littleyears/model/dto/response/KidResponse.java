package com.chanakya.littleyears.model.dto.response;

import com.chanakya.littleyears.model.document.KidDocument;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record KidResponse(
        String id,
        String name,
        String nickname,
        LocalDate birthdate,
        String avatarUrl,
        String parentEmail,
        List<String> allowedGrandparents,
        Instant createdAt,
        Instant updatedAt
) {
    public static KidResponse from(KidDocument kid) {
        return new KidResponse(
                kid.getId(),
                kid.getName(),
                kid.getNickname(),
                kid.getBirthdate(),
                kid.getAvatarUrl(),
                kid.getParentEmail(),
                kid.getAllowedGrandparents() != null ? kid.getAllowedGrandparents() : List.of(),
                kid.getCreatedAt(),
                kid.getUpdatedAt()
        );
    }
}
