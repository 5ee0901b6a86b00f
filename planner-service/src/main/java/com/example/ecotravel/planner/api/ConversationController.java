package com.example.ecotravel.planner.api;

import com.example.ecotravel.planner.service.PlannerService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/planner/conversations")
public class ConversationController {

    private final PlannerService plannerService;

    public ConversationController(PlannerService plannerService) {
        this.plannerService = plannerService;
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<Map<String, Object>> read(@PathVariable String sessionId) {
        return plannerService.describe(sessionId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> reset(@PathVariable String sessionId) {
        plannerService.reset(sessionId);
        return ResponseEntity.noContent().build();
    }
}
