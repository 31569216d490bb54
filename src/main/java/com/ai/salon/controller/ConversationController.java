package com.ai.salon.controller;

import com.ai.salon.dto.ActionResponse;
import com.ai.salon.dto.AvailabilityCheckPayload;
import com.ai.salon.dto.BookingContextUpdate;
import com.ai.salon.dto.HelpQuestion;
import com.ai.salon.service.ReceptionistTools;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

/**
 * Tool calls from the conversational runtime, one session handle per conversation.
 */
@RestController
@RequestMapping("/api/conversations/{sessionId}")
public class ConversationController {

    private final ReceptionistTools tools;

    public ConversationController(ReceptionistTools tools) {
        this.tools = tools;
    }

    @GetMapping("/now")
    public ActionResponse now(@PathVariable String sessionId) {
        return tools.currentDateTime(sessionId);
    }

    @PostMapping("/booking-context")
    public ActionResponse updateBookingContext(@PathVariable String sessionId, @RequestBody BookingContextUpdate update) {
        return tools.updateBookingContext(sessionId, update);
    }

    @GetMapping("/booking-summary")
    public ActionResponse bookingSummary(@PathVariable String sessionId) {
        return tools.bookingSummary(sessionId);
    }

    @PostMapping("/book")
    public CompletableFuture<ActionResponse> book(@PathVariable String sessionId) {
        return tools.bookAppointment(sessionId);
    }

    @PostMapping("/availability")
    public CompletableFuture<ActionResponse> availability(@PathVariable String sessionId,
                                                          @Valid @RequestBody AvailabilityCheckPayload payload) {
        return tools.checkAvailability(sessionId, payload);
    }

    @PostMapping("/help")
    public CompletableFuture<ActionResponse> help(@PathVariable String sessionId, @Valid @RequestBody HelpQuestion question) {
        return tools.requestHelp(sessionId, question.question());
    }

    @DeleteMapping
    public ResponseEntity<Void> end(@PathVariable String sessionId) {
        return tools.endSession(sessionId) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }
}
