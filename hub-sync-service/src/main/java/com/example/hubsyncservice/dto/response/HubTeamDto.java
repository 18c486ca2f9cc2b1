package com.example.hubsyncservice.dto.response;

public record HubTeamDto(String id, String name, String key) {
}
