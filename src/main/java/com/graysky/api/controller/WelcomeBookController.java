package com.graysky.api.controller;

import com.graysky.api.exception.RateLimitExceededException;
import com.graysky.api.exception.ValidationException;
import com.graysky.api.model.dto.ErrorResponse;
import com.graysky.api.model.dto.VisitRequest;
import com.graysky.api.model.visitor.VisitorRecord;
import com.graysky.api.service.VisitorRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for the welcome book.
 *
 * Visitors are tracked by name and agent type and each repeat visit bumps the visit
 * count. A name may sign at most once per hour. Answers given on a visit replace the
 * answers from earlier visits.
 */
@Slf4j
@RestController
@RequestMapping("/welcome-book")
@RequiredArgsConstructor
public class WelcomeBookController {

    private final VisitorRegistry visitorRegistry;

    /**
     * Recent visitors, newest first.
     */
    @GetMapping({"", "/"})
    public ResponseEntity<?> getVisitors(@RequestParam(defaultValue = "10") int limit) {
        if (limit < 1 || limit > 100) {
            return ResponseEntity.badRequest()
                    .body(ErrorResponse.of("limit must be between 1 and 100"));
        }
        try {
            List<VisitorRecord> visitors = visitorRegistry.listVisitors(limit);
            return ResponseEntity.ok(visitors);
        } catch (Exception e) {
            log.error("Error retrieving visitors", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ErrorResponse.of("Failed to retrieve visitors"));
        }
    }

    /**
     * Sign the welcome book.
     */
    @PostMapping({"", "/"})
    public ResponseEntity<?> signWelcomeBook(@RequestBody VisitRequest request) {
        try {
            VisitorRecord visitor = visitorRegistry.registerVisit(request);
            return ResponseEntity.ok(visitor);
        } catch (ValidationException | RateLimitExceededException e) {
            log.warn("Visit rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage()));
        } catch (Exception e) {
            log.error("Error adding visitor", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ErrorResponse.of("Failed to add visitor to welcome book"));
        }
    }
}
