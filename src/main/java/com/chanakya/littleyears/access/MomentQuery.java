package com.chanakya.littleyears.access;

import com.chanakya.littleyears.model.enums.Visibility;
import com.chanakya.littleyears.store.DocumentFilter;

/**
 * The moment scopes a timeline can be built from. Every variant is bound to a single kid.
 */
public sealed interface MomentQuery permits MomentQuery.ByKid, MomentQuery.ByKidPublicOnly {

    String KID_ID = "kidId";
    String VISIBILITY = "visibility";

    String kidId();

    DocumentFilter toFilter();

    /**
     * Every moment of the kid, public and private.
     */
    record ByKid(String kidId) implements MomentQuery {
        @Override
        public DocumentFilter toFilter() {
            return DocumentFilter.where(KID_ID, kidId);
        }
    }

    /**
     * Only the kid's public moments.
     */
    record ByKidPublicOnly(String kidId) implements MomentQuery {
        @Override
        public DocumentFilter toFilter() {
            return DocumentFilter.where(KID_ID, kidId).and(VISIBILITY, Visibility.PUBLIC);
        }
    }
}
