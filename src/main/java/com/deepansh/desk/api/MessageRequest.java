package com.deepansh.desk.api;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class MessageRequest {

    /** Empty input is accepted and ignored, as on the console. */
    @NotNull(message = "input is required")
    private String input;

    /** Optional; identifies the requester when the session has none, e.g. after a reset. */
    private String requesterId;
}
