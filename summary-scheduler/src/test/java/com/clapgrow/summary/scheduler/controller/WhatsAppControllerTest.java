package com.clapgrow.summary.scheduler.controller;

import com.clapgrow.summary.whatsapp.exception.GatewayErrorCode;
import com.clapgrow.summary.whatsapp.exception.GatewayException;
import com.clapgrow.summary.whatsapp.model.InstanceState;
import com.clapgrow.summary.whatsapp.model.SendMessageResult;
import com.clapgrow.summary.whatsapp.model.WhatsAppGroup;
import com.clapgrow.summary.whatsapp.service.GatewayClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(WhatsAppController.class)
class WhatsAppControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private GatewayClient gatewayClient;

    @Test
    void testGetState() throws Exception {
        when(gatewayClient.getInstanceState()).thenReturn(InstanceState.AUTHORIZED);
        when(gatewayClient.isConfigured()).thenReturn(true);

        mockMvc.perform(get("/api/v1/whatsapp/state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.state").value("AUTHORIZED"))
                .andExpect(jsonPath("$.data.configured").value(true));
    }

    @Test
    void testListGroups() throws Exception {
        when(gatewayClient.listGroups()).thenReturn(List.of(new WhatsAppGroup("1-2@g.us", "Family", null)));

        mockMvc.perform(get("/api/v1/whatsapp/groups"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].id").value("1-2@g.us"))
                .andExpect(jsonPath("$.data[0].name").value("Family"));
    }

    @Test
    void testListGroups_NotAuthorized_Returns401() throws Exception {
        when(gatewayClient.listGroups())
            .thenThrow(new GatewayException(GatewayErrorCode.NOT_AUTHORIZED, "WhatsApp instance is not authorized"));

        mockMvc.perform(get("/api/v1/whatsapp/groups"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorCode").value("NOT_AUTHORIZED"));
    }

    @Test
    void testSendMessage() throws Exception {
        when(gatewayClient.sendMessage("15551234567", "hi")).thenReturn(new SendMessageResult("BAE5"));

        mockMvc.perform(post("/api/v1/whatsapp/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"chatId\":\"15551234567\",\"message\":\"hi\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.messageId").value("BAE5"));
    }

    @Test
    void testSendMessage_RateLimited_Returns429() throws Exception {
        when(gatewayClient.sendMessage("15551234567", "hi"))
            .thenThrow(new GatewayException(GatewayErrorCode.RATE_LIMITED, "Rate limited calling sendMessage"));

        mockMvc.perform(post("/api/v1/whatsapp/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"chatId\":\"15551234567\",\"message\":\"hi\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.errorCode").value("RATE_LIMITED"));
    }

    @Test
    void testSendMessage_TransportError_Returns502() throws Exception {
        when(gatewayClient.sendMessage("15551234567", "hi"))
            .thenThrow(new GatewayException(GatewayErrorCode.TRANSPORT_ERROR, "Connection refused"));

        mockMvc.perform(post("/api/v1/whatsapp/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"chatId\":\"15551234567\",\"message\":\"hi\"}"))
                .andExpect(status().isBadGateway());
    }
}
