package com.phillippitts.slotwatch.presentation.controller;

import com.phillippitts.slotwatch.domain.MonitorSnapshot;
import com.phillippitts.slotwatch.domain.Status;
import com.phillippitts.slotwatch.service.monitor.MonitorLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class MonitorControllerTest {

    private MonitorLoop loop;

    @BeforeEach
    void setUp() {
        loop = mock(MonitorLoop.class);
        when(loop.snapshot()).thenReturn(new MonitorSnapshot(true, 2, Status.NO_SLOTS, 1, 5, false, "BACKOFF"));
    }

    @Test
    void statusReturnsSnapshot() throws Exception {
        MockMvc mvc = MockMvcBuilders.standaloneSetup(new MonitorController(loop, true)).build();

        mvc.perform(get("/api/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(true))
                .andExpect(jsonPath("$.subscriberCount").value(2))
                .andExpect(jsonPath("$.lastStatus").value("NO_SLOTS"))
                .andExpect(jsonPath("$.failures").value(1))
                .andExpect(jsonPath("$.threshold").value(5))
                .andExpect(jsonPath("$.lastAction").value("BACKOFF"));
    }

    @Test
    void disabledStatusEndpointIsNotFound() throws Exception {
        MockMvc mvc = MockMvcBuilders.standaloneSetup(new MonitorController(loop, false)).build();

        mvc.perform(get("/api/status")).andExpect(status().isNotFound());
    }

    @Test
    void startAndStopAreAccepted() throws Exception {
        MockMvc mvc = MockMvcBuilders.standaloneSetup(new MonitorController(loop, true)).build();

        mvc.perform(post("/api/monitor/start")).andExpect(status().isAccepted());
        mvc.perform(post("/api/monitor/stop")).andExpect(status().isAccepted());

        verify(loop).start();
        verify(loop).stop();
    }
}
