package org.iceforge.s3bridge.api;

import org.iceforge.s3bridge.config.S3BridgeProperties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class HealthControllerTest {

    @Test
    void reportsActuatorStatusAndIssuingFlag() throws Exception {
        HealthEndpoint endpoint = mock(HealthEndpoint.class);
        when(endpoint.health()).thenReturn(Health.up().build());
        S3BridgeProperties props = new S3BridgeProperties();
        props.setApiKey("k");

        MockMvc mvc = MockMvcBuilders.standaloneSetup(new HealthController(endpoint, props)).build();

        mvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.issuing").value(true));
    }

    @Test
    void notIssuingWithoutApiKey() throws Exception {
        HealthEndpoint endpoint = mock(HealthEndpoint.class);
        when(endpoint.health()).thenReturn(Health.down().build());

        MockMvc mvc = MockMvcBuilders.standaloneSetup(new HealthController(endpoint, new S3BridgeProperties())).build();

        mvc.perform(get("/api/health"))
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.issuing").value(false));
    }
}
