package com.graysky.api.controller;

import com.graysky.api.exception.ValidationException;
import com.graysky.api.model.dto.ErrorResponse;
import com.graysky.api.model.dto.FeedbackRequest;
import com.graysky.api.model.feedback.FeedbackRecord;
import com.graysky.api.service.FeedbackService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for site feedback.
 */
@Slf4j
@RestController
@RequestMapping("/feedback")
@RequiredArgsConstructor
public class FeedbackController {

    private final FeedbackService feedbackService;

    @GetMapping({"", "/"})
    public ResponseEntity<?> getFeedback(@RequestParam(defaultValue = "10") int limit) {
        if (limit < 1 || limit > 100) {
            return ResponseEntity.badRequest()
                    .body(ErrorResponse.of("limit must be between 1 and 100"));
        }
        try {
            return ResponseEntity.ok(feedbackService.listFeedback(limit));
        } catch (Exception e) {
            log.error("Error retrieving feedback", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ErrorResponse.of("Failed to retrieve feedback"));
        }
    }

    @PostMapping({"", "/"})
    public ResponseEntity<?> submitFeedback(@RequestBody FeedbackRequest request) {
        try {
            FeedbackRecord feedback = feedbackService.submitFeedback(request);
            return ResponseEntity.ok(feedback);
        } catch (ValidationException e) {
            log.warn("Feedback rejected: {}", e.getMessage());
            return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage()));
        } catch (Exception e) {
            log.error("Error adding feedback", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ErrorResponse.of("Failed to submit feedback"));
        }
    }
}
