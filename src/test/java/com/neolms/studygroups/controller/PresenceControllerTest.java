package com.neolms.studygroups.controller;

import com.neolms.studygroups.model.Viewer;
import com.neolms.studygroups.service.JwtService;
import com.neolms.studygroups.service.PresenceTracker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.security.servlet.SecurityAutoConfiguration;
import org.springframework.boot.autoconfigure.security.servlet.SecurityFilterAutoConfiguration;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static com.neolms.studygroups.testutil.TestConstants.USER_ID;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = PresenceController.class, excludeAutoConfiguration = {
    SecurityAutoConfiguration.class,
    SecurityFilterAutoConfiguration.class,
    UserDetailsServiceAutoConfiguration.class
})
@TestPropertySource(locations = "classpath:application-test.properties")
@ActiveProfiles("test")
class PresenceControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PresenceTracker presenceTracker;

    @MockitoBean
    private JwtService jwtService;

    @Test
    void setPresence_Offline_Returns204() throws Exception {
        mockMvc.perform(put("/presence")
                .requestAttr("userId", USER_ID)
                .requestAttr("displayName", "Ada")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"online\":false}"))
            .andExpect(status().isNoContent());

        verify(presenceTracker).setOnline(Viewer.of(USER_ID), false);
    }

    @Test
    void setPresence_MissingFlag_Returns400() throws Exception {
        mockMvc.perform(put("/presence")
                .requestAttr("userId", USER_ID)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(presenceTracker);
    }
}
