package com.handelsregister.scraper.controller;

import com.handelsregister.scraper.config.ApiProperties;
import com.handelsregister.scraper.service.api.CallerRateLimiter;
import com.handelsregister.scraper.service.api.ServiceTokenService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = InfoController.class)
class InfoControllerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    ApiProperties props;

    @MockBean
    ServiceTokenService tokens;

    @MockBean
    CallerRateLimiter limiter;

    @BeforeEach
    void setUp() {
        when(props.getRateLimitDefault()).thenReturn("10 per minute");
        when(props.getRequestTimeout()).thenReturn(45);
        when(props.getServiceName()).thenReturn("handelsregister-api");
    }

    @Test
    void healthReportsConfiguration() throws Exception {
        mvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.service").value("handelsregister-api"))
                .andExpect(jsonPath("$.config.rate_limit").value("10 per minute"))
                .andExpect(jsonPath("$.config.request_timeout").value(45));
    }

    @Test
    void docsDescribeEndpointsAndCurrentLimits() throws Exception {
        mvc.perform(get("/api/docs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authentication.type").value("JWT"))
                .andExpect(jsonPath("$.rate_limiting.default").value("10 per minute"))
                .andExpect(jsonPath("$.request_timeout.value").value("45 seconds"))
                .andExpect(jsonPath("$.endpoints['/api/search'].authentication").value(true))
                .andExpect(jsonPath("$.endpoints['/api/token'].method").value("POST"))
                .andExpect(jsonPath("$.environment_variables.REQUEST_TIMEOUT")
                        .value("Request timeout in seconds (default: 45)"));
    }
}
