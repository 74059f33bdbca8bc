package com.koni.thermoguard.infrastructure.web.dto;

import com.koni.thermoguard.domain.model.IrCommandType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * A learned IR signal uploaded for one command of an air conditioner.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class IrSignalRequest {

    @NotNull(message = "commandType is required")
    private IrCommandType commandType;

    @NotBlank(message = "rawSignal is required")
    @Size(max = 8192, message = "rawSignal must be at most 8192 characters")
    private String rawSignal;

    @Size(max = 50, message = "protocol must be at most 50 characters")
    private String protocol;
}
