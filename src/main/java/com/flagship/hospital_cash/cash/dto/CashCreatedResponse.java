package com.flagship.hospital_cash.cash.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.UUID;

@Value
public class CashCreatedResponse {

    @JsonProperty("uuid")
    UUID uuid;
}
