package com.strollie.planner;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "api.weather.key=")
@AutoConfigureMockMvc
class TravelPlannerApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void contextLoads() {
    }

    @Test
    void bundledCatalogsAreServed() throws Exception {
        mockMvc.perform(get("/api/recommendations/default").param("city", "Paris").param("topN", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results[0].name").value("Trocadero apartment"));

        mockMvc.perform(get("/api/attractions/top").param("city", "Rome").param("topN", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.results[0].name").value("Colosseum"));
    }

    @Test
    void cacheEndpoints() throws Exception {
        mockMvc.perform(get("/api/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maxEntries").value(200));

        mockMvc.perform(delete("/api/cache"))
                .andExpect(status().isNoContent());
    }

    @Test
    void weatherWithoutConfiguredKeyIsServerError() throws Exception {
        mockMvc.perform(get("/api/weather").param("city", "Paris"))
                .andExpect(status().isInternalServerError());
    }
}
