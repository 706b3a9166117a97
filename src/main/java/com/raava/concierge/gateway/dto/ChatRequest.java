package com.raava.concierge.gateway.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for chat messages.
 * Contains only the message text - the session ID comes from the X-Session-ID header.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatRequest {

    @NotBlank(message = "messageText cannot be blank")
    @Size(max = 2000, message = "messageText cannot exceed 2000 characters")
    private String messageText;
}
