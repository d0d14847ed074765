package com.defai.backend.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "oracle.rate-limit.enabled=false")
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TokenControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void tokenLifecycle() throws Exception {
        mockMvc.perform(post("/api/v1/tokens/bonk")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"address\": \"DezXAZ8z7P\", \"dex\": \"raydium\", \"pool_address\": \"8sLbNZ\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Token BONK added"));

        mockMvc.perform(get("/api/v1/tokens/BONK"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dex").value("raydium"));

        mockMvc.perform(get("/api/v1/tokens"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tokens", hasItem("BONK")));

        mockMvc.perform(delete("/api/v1/tokens/bonk"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/v1/tokens"))
                .andExpect(jsonPath("$.tokens", not(hasItem("BONK"))));
        mockMvc.perform(get("/api/v1/tokens/BONK"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void invalidSymbolIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/tokens/bad$symbol"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void observationsRequireTrackedToken() throws Exception {
        mockMvc.perform(post("/api/v1/tokens/UNKNOWN/volume")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"volume_5m\": 1000}"))
                .andExpect(status().isBadRequest());
    }
}
