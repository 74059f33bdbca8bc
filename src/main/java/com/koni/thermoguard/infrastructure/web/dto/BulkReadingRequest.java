package com.koni.thermoguard.infrastructure.web.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class BulkReadingRequest {

    @NotEmpty(message = "readings is required")
    @Size(max = 1000, message = "at most 1000 readings per request")
    private List<ReadingRequest> readings;
}
