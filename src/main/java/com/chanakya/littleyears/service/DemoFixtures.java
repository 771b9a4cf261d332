package com.chanakya.littleyears.service;

import com.chanakya.littleyears.model.document.KidDocument;
import com.chanakya.littleyears.model.document.MomentDocument;
import com.chanakya.littleyears.model.enums.MomentType;
import com.chanakya.littleyears.model.enums.Visibility;

import java.util.ArrayList;
import java.util.List;

/**
 * Demo family: kid Ava, shared with grandma, with a public photo, a private painting and a
 * public voice message.
 */
final class DemoFixtures {

    static final String KID_NAME = "Ava";
    static final String PARENT_EMAIL = "parent@littleyears.demo";
    static final String GRANDMA_EMAIL = "grandma@family.demo";

    private DemoFixtures() {
    }

    static KidDocument kid() {
        return KidDocument.builder()
                .name(KID_NAME)
                .nickname("Aves")
                .avatarUrl("https://images.unsplash.com/photo-1503454537195-1dcabb73ffb9?w=640")
                .parentEmail(PARENT_EMAIL)
                .allowedGrandparents(new ArrayList<>(List.of(GRANDMA_EMAIL)))
                .build();
    }

    static List<MomentDocument> moments(String kidId) {
        return List.of(
                MomentDocument.builder()
                        .kidId(kidId)
                        .type(MomentType.PHOTO)
                        .title("First bike ride!")
                        .description("Sunset cruise in the park")
                        .mediaUrl("https://images.unsplash.com/photo-1492724441997-5dc865305da7?w=1200")
                        .thumbnailUrl("https://images.unsplash.com/photo-1492724441997-5dc865305da7?w=400")
                        .visibility(Visibility.PUBLIC)
                        .tags(new ArrayList<>(List.of("milestone", "outdoors")))
                        .build(),
                MomentDocument.builder()
                        .kidId(kidId)
                        .type(MomentType.ART)
                        .title("Finger painting")
                        .description("Blue and yellow masterpiece")
                        .mediaUrl("https://images.unsplash.com/photo-1582719478250-c89cae4dc85b?w=1200")
                        .thumbnailUrl("https://images.unsplash.com/photo-1582719478250-c89cae4dc85b?w=400")
                        .visibility(Visibility.PRIVATE)
                        .tags(new ArrayList<>(List.of("art", "home")))
                        .build(),
                MomentDocument.builder()
                        .kidId(kidId)
                        .type(MomentType.AUDIO)
                        .title("Goodnight message")
                        .description("Ava says goodnight to Grandma")
                        .mediaUrl("https://www.soundhelix.com/examples/mp3/SoundHelix-Song-1.mp3")
                        .visibility(Visibility.PUBLIC)
                        .tags(new ArrayList<>(List.of("voice")))
                        .build()
        );
    }
}
