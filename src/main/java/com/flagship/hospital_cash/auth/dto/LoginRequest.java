package com.flagship.hospital_cash.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class LoginRequest {

    @NotBlank(message = "Username is required")
    @JsonProperty("username")
    String username;

    @NotBlank(message = "Password is required")
    @JsonProperty("password")
    String password;

    @NotNull(message = "Project is required")
    @JsonProperty("project")
    Integer project;
}
