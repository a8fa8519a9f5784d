package com.meetchat.client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Reaction(String userId, String emoji, Instant timestamp) {
}
