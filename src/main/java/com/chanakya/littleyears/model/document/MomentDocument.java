package com.chanakya.littleyears.model.document;

import com.chanakya.littleyears.model.enums.MomentType;
import com.chanakya.littleyears.model.enums.Visibility;
import com.chanakya.littleyears.store.StoredDocument;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = MomentDocument.COLLECTION)
@CompoundIndex(name = "kidId_visibility", def = "{'kidId': 1, 'visibility': 1}")
public class MomentDocument implements StoredDocument {

    public static final String COLLECTION = "moment";

    @Id
    private String id;

    // Not checked against the kid collection
    @NotBlank
    private String kidId;

    @NotNull
    @Builder.Default
    private MomentType type = MomentType.PHOTO;

    @NotBlank
    private String title;

    private String description;
    private String mediaUrl;
    private String thumbnailUrl;

    @NotNull
    @Builder.Default
    private Visibility visibility = Visibility.PUBLIC;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    /**
     * Timeline sort key. Older records may lack it.
     */
    @CreatedDate
    private Instant createdAt;
    @LastModifiedDate
    private Instant updatedAt;
}
