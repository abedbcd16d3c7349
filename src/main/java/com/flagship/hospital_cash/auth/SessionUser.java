package com.flagship.hospital_cash.auth;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.io.Serializable;

/**
 * The authenticated user, as stored in the HTTP session.
 */
@Value
public class SessionUser implements Serializable {

    private static final long serialVersionUID = 1L;

    @JsonProperty("id")
    Integer id;

    @JsonProperty("username")
    String username;

    @JsonProperty("display_name")
    String displayName;
}
