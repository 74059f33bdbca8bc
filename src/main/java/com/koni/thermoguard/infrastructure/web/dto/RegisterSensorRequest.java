package com.koni.thermoguard.infrastructure.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class RegisterSensorRequest {

    @NotNull(message = "roomId is required")
    private UUID roomId;

    @NotBlank(message = "deviceId is required")
    @Size(max = 100, message = "deviceId must be at most 100 characters")
    private String deviceId;

    @Size(max = 100, message = "name must be at most 100 characters")
    private String name;
}
