package com.tedu.juryportal.modules.auth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class IssuePinRequest {

    @NotBlank(message = "Juror id is required")
    @Size(max = 200, message = "Juror id must be under 200 characters")
    private String jurorId;

    @Size(max = 100, message = "Name must be under 100 characters")
    private String name;

    @Size(max = 100, message = "Department must be under 100 characters")
    private String dept;
}
