package com.flagship.hospital_cash.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.hospital_cash.auth.SessionProject;
import com.flagship.hospital_cash.auth.SessionUser;
import lombok.Value;

@Value
public class LoginResponse {

    @JsonProperty("user")
    SessionUser user;

    @JsonProperty("project")
    SessionProject project;
}
