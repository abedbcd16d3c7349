package com.flagship.hospital_cash.topic;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * Message published on a channel when a record changes.
 *
 * Carries who did what to which record; subscribers look the record up
 * themselves if they need more.
 */
@Value
@Builder
@Jacksonized
public class TopicEvent {

    @JsonProperty("event")
    Topic.Event event;

    @JsonProperty("entity")
    Topic.Entity entity;

    @JsonProperty("user_id")
    Integer userId;

    /**
     * Display name of the acting user.
     */
    @JsonProperty("user")
    String user;

    @JsonProperty("uuid")
    UUID uuid;

    @JsonProperty("occurred_at")
    Instant occurredAt;
}
