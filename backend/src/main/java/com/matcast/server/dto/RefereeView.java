package com.matcast.server.dto;

public record RefereeView(String id, String name) {
}
