package com.example.ecotravel.planner.api;

import com.example.ecotravel.common.turn.ClassifiedTurnRequest;
import com.example.ecotravel.common.turn.TurnRequest;
import com.example.ecotravel.common.turn.TurnResponse;
import com.example.ecotravel.planner.service.PlannerService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/planner")
public class PlannerController {

    private final PlannerService plannerService;

    public PlannerController(PlannerService plannerService) {
        this.plannerService = plannerService;
    }

    @PostMapping("/turns")
    public ResponseEntity<TurnResponse> turn(@RequestBody(required = false) TurnRequest request) {
        if (request == null || request.getMessage() == null || request.getMessage().isBlank()) {
            throw new IllegalArgumentException("Please provide a non-empty 'message'.");
        }
        return ResponseEntity.ok(plannerService.handleTurn(request.getSessionId(), request.getMessage()));
    }

    @PostMapping("/turns/classified")
    public ResponseEntity<TurnResponse> classifiedTurn(@RequestBody(required = false) ClassifiedTurnRequest request) {
        if (request == null || request.getNlu() == null) {
            throw new IllegalArgumentException("Please provide the 'nlu' classification of the message.");
        }
        return ResponseEntity.ok(plannerService.handleClassifiedTurn(request.getSessionId(), request.getMessage(), request.getNlu()));
    }
}
