package com.agenthums.backend.integration.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.agenthums.backend.auth.error.AuthErrorKind;
import com.agenthums.backend.auth.error.AuthException;
import com.agenthums.backend.integration.service.IntegrationCredentialBroker;
import com.agenthums.backend.integration.service.IntegrationStatus;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import reactor.core.publisher.Mono;

@WebMvcTest(controllers = IntegrationController.class)
class IntegrationControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private IntegrationCredentialBroker broker;

  @Test
  void listsStatusForCurrentActor() throws Exception {
    UUID identityId = UUID.randomUUID();
    when(broker.currentIdentityId()).thenReturn(identityId);
    when(broker.status(identityId))
        .thenReturn(
            Mono.just(
                List.of(
                    new IntegrationStatus("calendar", true, null, null, List.of("calendar")),
                    IntegrationStatus.disconnected("drive"))));

    MvcResult result =
        mockMvc.perform(get("/api/integrations")).andExpect(request().asyncStarted()).andReturn();

    mockMvc
        .perform(asyncDispatch(result))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].serviceKind").value("calendar"))
        .andExpect(jsonPath("$[0].connected").value(true))
        .andExpect(jsonPath("$[1].connected").value(false));
  }

  @Test
  void disconnectWithoutActorIsUnauthorized() throws Exception {
    when(broker.currentIdentityId()).thenThrow(AuthException.of(AuthErrorKind.NOT_AUTHENTICATED));

    MvcResult result =
        mockMvc
            .perform(delete("/api/integrations/calendar"))
            .andExpect(request().asyncStarted())
            .andReturn();

    mockMvc
        .perform(asyncDispatch(result))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.kind").value("NOT_AUTHENTICATED"));
  }

  @Test
  void authorizationUrlIsReturned() throws Exception {
    when(broker.authorizationUrl("calendar"))
        .thenReturn(URI.create("https://accounts.example.com/auth?state=calendar"));

    mockMvc
        .perform(get("/api/integrations/calendar/authorization-url"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.url").value("https://accounts.example.com/auth?state=calendar"));
  }
}
