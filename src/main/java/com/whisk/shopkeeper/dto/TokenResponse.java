package com.whisk.shopkeeper.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class TokenResponse {
    @JsonProperty("access_token")
    String accessToken;

    @JsonProperty("token_type")
    String tokenType;

    public static TokenResponse bearer(String token) {
        return new TokenResponse(token, "bearer");
    }
}
