package com.example.hubsyncservice.dto.response;

public record StateDto(String id, String name, String color, String type) {
}
