package com.flagship.coin_ledger.health;

import com.flagship.coin_ledger.observability.IntegrityAlarm;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private IntegrityAlarm integrityAlarm;

    @Test
    @DisplayName("A ledger fault degrades /health without taking the service down")
    void testFaultDegradesHealth() throws Exception {
        integrityAlarm.raise("test_fault", "raised by health check test", null, null);

        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("DEGRADED"))
            .andExpect(jsonPath("$.database").value("UP"))
            .andExpect(jsonPath("$.ledger.integrityFaults").value(integrityAlarm.getFaultCount()))
            .andExpect(jsonPath("$.ledger.lastFaultAt").exists())
            .andExpect(jsonPath("$.outboxBacklog").isNumber());
    }
}
