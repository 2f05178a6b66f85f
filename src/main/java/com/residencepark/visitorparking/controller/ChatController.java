package com.residencepark.visitorparking.controller;

import com.residencepark.visitorparking.chat.ChatReply;
import com.residencepark.visitorparking.chat.ParkingAssistant;
import com.residencepark.visitorparking.dto.ApiResponse;
import com.residencepark.visitorparking.dto.ChatRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * POST /api/chat {"query": "how many spots are available?"}
 *
 * Always 200: assistant failures come back as answer text.
 */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final ParkingAssistant parkingAssistant;

    @PostMapping
    public ResponseEntity<ApiResponse> chat(@Valid @RequestBody ChatRequest req) {
        log.info("API: assistant query ({} chars)", req.getQuery().length());
        ChatReply reply = parkingAssistant.reply(req.getQuery());
        return ResponseEntity.ok(ApiResponse.success(reply, reply.getAnswer()));
    }
}
