package com.ai.salon.controller;

import com.ai.salon.dto.HelpRequestCreate;
import com.ai.salon.dto.HelpRequestCreated;
import com.ai.salon.dto.HelpRequestResolution;
import com.ai.salon.dto.HelpRequestView;
import com.ai.salon.dto.SupervisorResponse;
import com.ai.salon.service.EscalationManager;
import com.ai.salon.service.HelpRequestService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Supervisor side of escalation: the pending queue and resolutions.
 */
@RestController
@RequestMapping("/api/help-requests")
public class HelpRequestController {

    private final EscalationManager escalationManager;
    private final HelpRequestService helpRequestService;

    public HelpRequestController(EscalationManager escalationManager, HelpRequestService helpRequestService) {
        this.escalationManager = escalationManager;
        this.helpRequestService = helpRequestService;
    }

    @PostMapping
    public ResponseEntity<HelpRequestCreated> create(@Valid @RequestBody HelpRequestCreate request) {
        String id = escalationManager.create(request.question(), request.roomName(), null);
        return ResponseEntity.status(HttpStatus.CREATED).body(new HelpRequestCreated(id, "pending"));
    }

    @GetMapping("/pending")
    public List<HelpRequestView> pending() {
        return helpRequestService.pending().stream().map(HelpRequestView::from).toList();
    }

    @GetMapping("/{id}")
    public HelpRequestView get(@PathVariable String id) {
        return HelpRequestView.from(helpRequestService.find(id));
    }

    @PostMapping("/{id}/resolve")
    public HelpRequestResolution resolve(@PathVariable String id, @Valid @RequestBody SupervisorResponse response) {
        return escalationManager.resolve(id, response);
    }
}
