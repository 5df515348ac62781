package com.deepansh.desk.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class CreateSessionRequest {

    @NotBlank(message = "requesterId must not be blank")
    private String requesterId;

    /** Optional namespace for the generated session id. */
    @Pattern(regexp = "[A-Za-z0-9-]{1,32}", message = "prefix may only contain letters, digits and '-'")
    private String prefix;
}
