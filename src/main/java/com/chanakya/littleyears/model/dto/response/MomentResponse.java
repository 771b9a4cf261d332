package com.chanakya.littleyears.model.dto.response;

import com.chanakya.littleyears.model.document.MomentDocument;
import com.chanakya.littleyears.model.enums.MomentType;
import com.chanakya.littleyears.model.enums.Visibility;

import java.time.Instant;
import java.util.List;

public record MomentResponse(
        String id,
        String kidId,
        MomentType type,
        String title,
        String description,
        String mediaUrl,
        String thumbnailUrl,
        Visibility visibility,
        List<String> tags,
        Instant createdAt,
        Instant updatedAt
) {
    public static MomentResponse from(MomentDocument moment) {
        return new MomentResponse(
                moment.getId(),
                moment.getKidId(),
                moment.getType(),
                moment.getTitle(),
                moment.getDescription(),
                moment.getMediaUrl(),
                moment.getThumbnailUrl(),
                moment.getVisibility(),
                moment.getTags() != null ? moment.getTags() : List.of(),
                moment.getCreatedAt(),
                moment.getUpdatedAt()
        );
    }
}
