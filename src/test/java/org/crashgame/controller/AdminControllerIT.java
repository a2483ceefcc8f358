package org.crashgame.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.httpBasic;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class AdminControllerIT {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void adminUsers_shouldRequireCredentials() throws Exception {
        mockMvc.perform(get("/admin/users"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void adminUsers_shouldRejectWrongPassword() throws Exception {
        mockMvc.perform(get("/admin/users").with(httpBasic("admin", "nope")))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void adminUsers_shouldAnswerWithBasicAuth() throws Exception {
        mockMvc.perform(get("/admin/users").with(httpBasic("admin", "secret")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active_users").value(0));
    }

    @Test
    void adminRound_shouldShowWaitingBeforeStart() throws Exception {
        mockMvc.perform(get("/admin/round").with(httpBasic("admin", "secret")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("WAITING"));
    }

    @Test
    void verify_shouldBePublic() throws Exception {
        mockMvc.perform(post("/api/crash/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"serverSeed\":\"0000000000000000000000000000000000000000000000000000000000000000\","
                                + "\"serverSeedHash\":\"x\",\"clientSeed\":\"demo-client\",\"crashPoint\":1.17}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.expectedCrashPoint").value(1.17));
    }

    @Test
    void rounds_shouldBeEmptyBeforeAnyCrash() throws Exception {
        mockMvc.perform(get("/api/crash/rounds"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }
}
