package com.deepansh.desk.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class IdentityRequest {

    @NotBlank(message = "requesterId must not be blank")
    private String requesterId;
}
