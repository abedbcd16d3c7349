package com.flagship.hospital_cash.auth;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.io.Serializable;

/**
 * The project the user logged into. Every record written during the session belongs to it.
 */
@Value
public class SessionProject implements Serializable {

    private static final long serialVersionUID = 1L;

    @JsonProperty("id")
    Integer id;

    @JsonProperty("name")
    String name;

    @JsonProperty("abbr")
    String abbr;

    @JsonProperty("enterprise_id")
    Integer enterpriseId;
}
