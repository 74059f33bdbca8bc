package com.koni.thermoguard.infrastructure.web.dto;

import com.koni.thermoguard.domain.model.IrCommandType;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class IrRecordRequest {

    @NotNull(message = "commandType is required")
    private IrCommandType commandType;
}
