package com.chanakya.littleyears.access;

import com.chanakya.littleyears.model.document.KidDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides which of a kid's moments a timeline request may see.
 *
 * <p>Rule: private moments are included only when the caller asked for them AND the claimed
 * grandparent email is on the kid's allowed list (exact, case-sensitive match). A request that
 * fails the check is answered like one that never asked: public moments only, with
 * {@code includesPrivate = false}. No error is raised, so callers cannot tell an unknown
 * grandparent from a kid without private content.
 */
@Component
public class TimelineAccessPolicy {

    private static final Logger log = LoggerFactory.getLogger(TimelineAccessPolicy.class);

    public AccessDecision decide(KidDocument kid, boolean includePrivate, String grandparentEmail) {
        if (!includePrivate) {
            return AccessDecision.publicOnly(kid.getId());
        }
        if (isAllowedGrandparent(kid, grandparentEmail)) {
            return AccessDecision.withPrivate(kid.getId());
        }
        log.debug("event=private_access_downgraded kidId={}", kid.getId());
        return AccessDecision.publicOnly(kid.getId());
    }

    boolean isAllowedGrandparent(KidDocument kid, String grandparentEmail) {
        if (grandparentEmail == null || grandparentEmail.isEmpty()) {
            return false;
        }
        List<String> allowed = kid.getAllowedGrandparents();
        return allowed != null && allowed.contains(grandparentEmail);
    }
}
