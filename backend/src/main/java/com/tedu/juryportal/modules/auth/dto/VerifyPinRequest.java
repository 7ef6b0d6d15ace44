package com.tedu.juryportal.modules.auth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class VerifyPinRequest {

    @NotBlank(message = "Juror id is required")
    @Size(max = 200)
    private String jurorId;

    @NotBlank(message = "PIN is required")
    @Size(max = 10)
    private String pin;
}
