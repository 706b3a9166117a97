package com.raava.concierge.gateway.controller;

import com.raava.concierge.gateway.dto.ChatRequest;
import com.raava.concierge.gateway.dto.ChatResponse;
import com.raava.concierge.gateway.service.GatewayService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

/**
 * Gateway REST controller - thin HTTP layer for chat requests.
 *
 * Responsibilities:
 * - Handle HTTP requests/responses
 * - Extract HTTP headers
 * - Delegate business logic to GatewayService
 */
@RestController
@RequestMapping("/api/v1/chat")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
@RequiredArgsConstructor
public class GatewayController {

    static final String SESSION_ID_HEADER = "X-Session-ID";

    private final GatewayService gatewayService;

    /**
     * Handle preflight OPTIONS requests for CORS.
     */
    @RequestMapping(method = RequestMethod.OPTIONS)
    public ResponseEntity<Void> options() {
        return ResponseEntity.ok().build();
    }

    /**
     * Chat endpoint - one conversational turn.
     *
     * @param request Chat request containing messageText
     * @param sessionIdHeader Session ID from HTTP header
     * @return Chat response with answer
     */
    @PostMapping
    public ResponseEntity<ChatResponse> chat(
            @Valid @RequestBody ChatRequest request,
            @RequestHeader(value = SESSION_ID_HEADER, required = false) String sessionIdHeader) {

        ChatResponse response = gatewayService.processChatRequest(request, sessionIdHeader);
        return ResponseEntity.ok(response);
    }

    /**
     * Reset endpoint - abandons the open funnel, keeping the session's history.
     */
    @PostMapping("/reset")
    public ResponseEntity<Map<String, String>> reset(
            @RequestHeader(value = SESSION_ID_HEADER, required = false) String sessionIdHeader) {

        gatewayService.reset(sessionIdHeader);

        Map<String, String> response = new HashMap<>();
        response.put("status", "success");
        response.put("message", "Conversation reset");
        return ResponseEntity.ok(response);
    }

    /**
     * End endpoint - removes the session entirely.
     */
    @PostMapping("/end")
    public ResponseEntity<Map<String, String>> end(
            @RequestHeader(value = SESSION_ID_HEADER, required = false) String sessionIdHeader) {

        gatewayService.endSession(sessionIdHeader);

        Map<String, String> response = new HashMap<>();
        response.put("status", "success");
        response.put("message", "Session ended");
        return ResponseEntity.ok(response);
    }
}
