package com.example.hubsyncservice.dto.response;

import java.time.Instant;

/**
 * Cycle of a mapped team with counts over the issues the hub can see in it.
 */
public record HubCycleDto(
        String id,
        String name,
        Integer number,
        String teamId,
        Instant startsAt,
        Instant endsAt,
        Stats stats
) {

    public record Stats(int total, int completed) {

        public static Stats empty() {
            return new Stats(0, 0);
        }
    }
}
