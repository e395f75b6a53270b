package com.feedblend.common.privacy;

import com.feedblend.common.model.PersonalizationMode;
import com.feedblend.common.model.SignalProfile;
import com.feedblend.common.model.TrackingLevel;

import java.util.Optional;

/**
 * Single authority on how much personalization data a request may touch.
 *
 * <pre>
 *   full    → FULL      complete signal profile
 *   limited → DEGRADED  anonymized profile: per-user affinity replaced by the
 *                       population average, alias dropped
 *   none    → DISABLED  no scoring; cold start only, no per-user annotations
 * </pre>
 *
 * <p>Pure mapping, no state.
 */
public final class PrivacyGate {

    private PrivacyGate() {}

    public static PersonalizationMode mode(TrackingLevel level) {
        if (level == null) {
            return PersonalizationMode.FULL;
        }
        return switch (level) {
            case FULL    -> PersonalizationMode.FULL;
            case LIMITED -> PersonalizationMode.DEGRADED;
            case NONE    -> PersonalizationMode.DISABLED;
        };
    }

    /**
     * Returns the view of {@code profile} that scoring may read under {@code mode}.
     *
     * @return the profile itself for FULL, its anonymized copy for DEGRADED, and
     *         empty for DISABLED or when there is no profile
     */
    public static Optional<SignalProfile> restrict(SignalProfile profile, PersonalizationMode mode) {
        if (profile == null || mode == PersonalizationMode.DISABLED) {
            return Optional.empty();
        }
        return Optional.of(mode == PersonalizationMode.DEGRADED ? profile.anonymizedCopy() : profile);
    }

    public static boolean allowsScoring(PersonalizationMode mode) {
        return mode != PersonalizationMode.DISABLED;
    }
}
