package com.example.tokenauth.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token pair as handed to the client. The field names are the wire contract.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"accessToken", "refreshToken", "expiresIn", "tokenType"})
public class TokenResponse {

    private String accessToken;

    private String refreshToken;

    /** Access token lifetime in seconds. */
    private long expiresIn;

    private String tokenType;
}
