package com.flamingo.ai.devicerag.api.rest;

import com.flamingo.ai.devicerag.api.dto.request.ChatRequest;
import com.flamingo.ai.devicerag.api.dto.response.ChatResponse;
import com.flamingo.ai.devicerag.service.chat.ChatService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for device questions. */
@RestController
@RequestMapping("/devices/{deviceId}/chat")
@RequiredArgsConstructor
public class ChatController {

  private final ChatService chatService;

  /** Answers a question from the device's documents. */
  @PostMapping
  public ResponseEntity<ChatResponse> chat(
      @PathVariable String deviceId, @Valid @RequestBody ChatRequest request) {
    return ResponseEntity.ok(
        ChatResponse.from(
            chatService.chat(deviceId, request.getMessage(), request.getHistory())));
  }
}
