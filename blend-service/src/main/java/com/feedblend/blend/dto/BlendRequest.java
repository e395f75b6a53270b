package com.feedblend.blend.dto;

import com.feedblend.common.model.Item;
import com.feedblend.common.model.SignalProfile;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of a blend request. The real timeline and the candidate pool are fetched by
 * the proxy and storage collaborators; the profile and tracking level come from the
 * identity collaborator.
 */
@Data
@NoArgsConstructor
public class BlendRequest {

    private String userId;
    private String trackingLevel;

    private List<Item> realItems = new ArrayList<>();
    private List<Item> candidates = new ArrayList<>();

    /** Absent for anonymous users. */
    private SignalProfile profile;

    /** Seed for reproducible shuffling; shuffling is off when absent. */
    private Long shuffleSeed;
}
