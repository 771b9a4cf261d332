package com.chanakya.littleyears.model.document;

import com.chanakya.littleyears.store.StoredDocument;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = KidDocument.COLLECTION)
public class KidDocument implements StoredDocument {

    public static final String COLLECTION = "kid";

    @Id
    private String id;

    @NotBlank
    @Indexed
    private String name;

    private String nickname;
    private LocalDate birthdate;
    private String avatarUrl;

    @NotBlank
    private String parentEmail;

    /**
     * Emails allowed to see private moments. Order is irrelevant and entries may repeat.
     */
    @Indexed
    @Builder.Default
    private List<String> allowedGrandparents = new ArrayList<>();

    @CreatedDate
    private Instant createdAt;
    @LastModifiedDate
    private Instant updatedAt;
}
