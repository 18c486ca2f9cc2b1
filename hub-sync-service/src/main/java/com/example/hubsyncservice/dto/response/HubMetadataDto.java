package com.example.hubsyncservice.dto.response;

import java.util.List;

/**
 * Filter options derived from the issues a hub can see. Assignees are never listed.
 */
public record HubMetadataDto(List<StateDto> states, List<LabelDto> labels) {

    public static HubMetadataDto empty() {
        return new HubMetadataDto(List.of(), List.of());
    }
}
