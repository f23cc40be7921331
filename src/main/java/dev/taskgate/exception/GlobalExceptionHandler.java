package dev.taskgate.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.time.Instant;

/**
 * Maps the error taxonomy to RFC 7807 Problem Details.
 *
 * <p>Every webhook error path ends here, so the HTTP layer always answers with a structured
 * body carrying {@code success=false}. Internal exception messages are never exposed for 5xx
 * responses; they are logged server-side only.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(SignatureValidationException.class)
    public ProblemDetail handleSignature(SignatureValidationException ex) {
        log.warn("Signature rejected: {}", ex.getMessage());
        return problem(HttpStatus.UNAUTHORIZED, "invalid-signature", "Invalid Signature", ex.getMessage());
    }

    @ExceptionHandler(InstallationNotFoundException.class)
    public ProblemDetail handleInstallationNotFound(InstallationNotFoundException ex, HttpServletRequest request) {
        log.warn("Installation lookup failed: {}", ex.getMessage());
        // Webhooks from unknown tenants are an authentication failure, admin lookups a plain miss
        HttpStatus status = request.getRequestURI().startsWith("/webhooks")
                ? HttpStatus.UNAUTHORIZED : HttpStatus.NOT_FOUND;
        return problem(status, "installation-not-found", "Installation Not Found", ex.getMessage());
    }

    @ExceptionHandler(UnknownProviderException.class)
    public ProblemDetail handleUnknownProvider(UnknownProviderException ex) {
        log.warn("Unknown provider: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, "unknown-provider", "Unknown Provider", ex.getMessage());
    }

    @ExceptionHandler(TaskNotFoundException.class)
    public ProblemDetail handleTaskNotFound(TaskNotFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "task-not-found", "Task Not Found", ex.getMessage());
    }

    @ExceptionHandler(PayloadParseException.class)
    public ProblemDetail handleParse(PayloadParseException ex) {
        log.warn("Unparseable {} payload: {}", ex.getProvider(), ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "invalid-payload", "Invalid Payload", ex.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ProblemDetail handleUnreadable(Exception ex) {
        log.warn("Unreadable request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "bad-request", "Invalid Request", "Malformed request");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleBadRequest(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "bad-request", "Invalid Request", ex.getMessage());
    }

    @ExceptionHandler(DuplicateInstallationException.class)
    public ProblemDetail handleDuplicate(DuplicateInstallationException ex) {
        log.warn("Duplicate installation: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "duplicate-installation", "Duplicate Installation", ex.getMessage());
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ProblemDetail handleTransition(InvalidTransitionException ex) {
        log.warn("Rejected state transition: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "invalid-transition", "Invalid Transition", ex.getMessage());
    }

    @ExceptionHandler(TokenRefreshException.class)
    public ProblemDetail handleTokenRefresh(TokenRefreshException ex) {
        log.error("Token unavailable: {}", ex.getMessage());
        return problem(HttpStatus.BAD_GATEWAY, "token-unavailable", "Token Unavailable",
                "Provider token is unavailable. Re-authorization may be required.");
    }

    @ExceptionHandler(OAuthFlowException.class)
    public ProblemDetail handleOAuthFlow(OAuthFlowException ex) {
        log.warn("OAuth flow failed: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "oauth-failed", "Authorization Failed", ex.getMessage());
    }

    @ExceptionHandler(QueueUnavailableException.class)
    public ProblemDetail handleQueueUnavailable(QueueUnavailableException ex) {
        log.error("Queue unavailable: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "queue-unavailable", "Service Unavailable",
                "Task queue temporarily unavailable. Please retry later.");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse errorResponse) {
            // Framework errors (404 route, 405 method, ...) keep their own status
            ProblemDetail body = errorResponse.getBody();
            body.setProperty("success", false);
            return body;
        }
        log.error("Unexpected error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "internal", "Internal Server Error",
                "An unexpected error occurred. Please try again later.");
    }

    private static ProblemDetail problem(HttpStatus status, String type, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create("https://taskgate.dev/errors/" + type));
        problem.setTitle(title);
        problem.setProperty("success", false);
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }
}
