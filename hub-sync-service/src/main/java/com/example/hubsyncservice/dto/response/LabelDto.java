package com.example.hubsyncservice.dto.response;

public record LabelDto(String id, String name, String color) {
}
