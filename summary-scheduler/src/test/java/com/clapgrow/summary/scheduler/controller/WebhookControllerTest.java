package com.clapgrow.summary.scheduler.controller;

import com.clapgrow.summary.scheduler.dto.WebhookNotification;
import com.clapgrow.summary.scheduler.service.WebhookService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(WebhookController.class)
class WebhookControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private WebhookService webhookService;

    @Test
    void testReceive_MapsGreenApiPayload() throws Exception {
        when(webhookService.handle(any())).thenReturn(true);
        String payload = """
            {
              "typeWebhook": "incomingMessageReceived",
              "instanceData": {"idInstance": 1101, "wid": "15550000000@c.us"},
              "timestamp": 1714564800,
              "idMessage": "BAE5",
              "senderData": {"chatId": "123-456@g.us", "sender": "15551234567@c.us", "senderName": "Alice"},
              "messageData": {"typeMessage": "textMessage", "textMessageData": {"textMessage": "hello"}}
            }
            """;

        mockMvc.perform(post("/api/v1/whatsapp/webhook")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.recorded").value(true));

        ArgumentCaptor<WebhookNotification> captor = ArgumentCaptor.forClass(WebhookNotification.class);
        verify(webhookService).handle(captor.capture());
        assertEquals("123-456@g.us", captor.getValue().getSenderData().getChatId());
        assertEquals("hello", captor.getValue().getMessageData().getTextMessageData().getTextMessage());
    }
}
