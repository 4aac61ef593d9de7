package com.marketplace.api;

import com.marketplace.listing.domain.ListingWorkflowService.ListingNotFoundException;
import com.marketplace.order.domain.OrderWorkflowService.OrderNotFoundException;
import com.marketplace.order.domain.OrderWorkflowService.OrderValidationException;
import com.marketplace.shared.workflow.RejectionReason;
import com.marketplace.shared.workflow.TransitionRejectedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Maps workflow and domain failures to RFC 7807 responses.
 *
 * Every workflow rejection carries its typed reason in the "reason" property so clients can
 * tell "too late to cancel" from "not allowed" without parsing the message.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(TransitionRejectedException.class)
    public ProblemDetail handleRejected(TransitionRejectedException ex) {
        HttpStatus status = ex.getReason() == RejectionReason.FORBIDDEN_FOR_ROLE
                ? HttpStatus.FORBIDDEN
                : HttpStatus.CONFLICT;
        log.info("Transition rejected: kind={}, id={}, reason={}", ex.getEntityKind(), ex.getEntityId(), ex.getReason());
        ProblemDetail problem = problem(status, "Transition Rejected", ex.getMessage());
        problem.setProperty("reason", ex.getReason().name());
        problem.setProperty("entityId", ex.getEntityId());
        return problem;
    }

    @ExceptionHandler({ListingNotFoundException.class, OrderNotFoundException.class})
    public ProblemDetail handleNotFound(RuntimeException ex) {
        return problem(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage());
    }

    @ExceptionHandler(OrderValidationException.class)
    public ProblemDetail handleOrderValidation(OrderValidationException ex) {
        return problem(HttpStatus.BAD_REQUEST, "Invalid Order", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleInvalidBody(MethodArgumentNotValidException ex) {
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "Invalid Request", "Request body failed validation");
        problem.setProperty("fields", ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .toList());
        return problem;
    }

    @ExceptionHandler({MissingRequestHeaderException.class, MethodArgumentTypeMismatchException.class})
    public ProblemDetail handleBadIdentity(Exception ex) {
        return problem(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage());
    }

    /** Retries exhausted against a hot entity. */
    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ProblemDetail handleConcurrentModification(OptimisticLockingFailureException ex) {
        log.warn("Concurrent modification not resolved by retries: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.CONFLICT, "Concurrent Modification",
                "The entity was modified concurrently; reload and retry");
        problem.setProperty("reason", "CONCURRENT_MODIFICATION");
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred");
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }
}
