package com.koni.thermoguard.infrastructure.web.controller;

import com.koni.thermoguard.application.service.AlertService;
import com.koni.thermoguard.application.service.ReadingHousekeepingService;
import com.koni.thermoguard.application.service.SensorLivenessService;
import com.koni.thermoguard.application.service.SweepResult;
import com.koni.thermoguard.infrastructure.web.security.Caller;
import com.koni.thermoguard.tags.UnitTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@UnitTest
@WebMvcTest(HousekeepingController.class)
class HousekeepingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SensorLivenessService sensorLivenessService;

    @MockBean
    private ReadingHousekeepingService readingHousekeepingService;

    @MockBean
    private AlertService alertService;

    private final String adminId = UUID.randomUUID().toString();

    @Test
    void shouldRunSensorSweepForAdmin() throws Exception {
        // Given
        when(sensorLivenessService.checkAllSensorStatus()).thenReturn(new SweepResult(3, 2, 0));

        // When/Then
        mockMvc.perform(post("/api/v1/admin/housekeeping/sensor-status")
                        .header(Caller.USER_ID_HEADER, adminId)
                        .header(Caller.ROLE_HEADER, "admin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.job").value("sensor-status"))
                .andExpect(jsonPath("$.result.checked").value(3))
                .andExpect(jsonPath("$.result.markedOffline").value(2));
    }

    @Test
    void shouldRunReadingAggregation() throws Exception {
        // Given
        when(readingHousekeepingService.aggregateReadings()).thenReturn(48);

        // When/Then
        mockMvc.perform(post("/api/v1/admin/housekeeping/reading-aggregation")
                        .header(Caller.USER_ID_HEADER, adminId)
                        .header(Caller.ROLE_HEADER, "admin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.aggregatedHours").value(48));
    }

    @Test
    void shouldForbidOperator() throws Exception {
        mockMvc.perform(post("/api/v1/admin/housekeeping/alert-cleanup")
                        .header(Caller.USER_ID_HEADER, adminId)
                        .header(Caller.ROLE_HEADER, "operator"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(alertService);
    }

    @Test
    void shouldReturnNotFoundForUnknownJob() throws Exception {
        mockMvc.perform(post("/api/v1/admin/housekeeping/defragment")
                        .header(Caller.USER_ID_HEADER, adminId)
                        .header(Caller.ROLE_HEADER, "admin"))
                .andExpect(status().isNotFound());
    }
}
