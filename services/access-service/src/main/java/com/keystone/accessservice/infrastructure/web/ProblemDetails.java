package com.keystone.accessservice.infrastructure.web;

import com.keystone.observability.RequestContextHolder;
import com.keystone.security.ErrorCode;
import com.keystone.security.ForbiddenException;
import com.keystone.security.KeystoneException;
import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

/**
 * Builds the RFC 7807 bodies of every error response:
 *
 * <pre>
 * {
 *   "type": "https://keystone.dev/errors/forbidden",
 *   "title": "Forbidden",
 *   "status": 403,
 *   "detail": "Missing required permissions",
 *   "code": "AUTH_1002",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 */
public final class ProblemDetails {

    static final String TYPE_PREFIX = "https://keystone.dev/errors/";

    private ProblemDetails() {
        // utility class
    }

    public static ProblemDetail of(KeystoneException ex) {
        ProblemDetail problem = of(ex.errorCode(), ex.getMessage());
        if (ex instanceof ForbiddenException forbidden) {
            if (!forbidden.missingPermissions().isEmpty()) {
                problem.setProperty("missingPermissions", forbidden.missingPermissions());
            }
            if (!forbidden.missingRoles().isEmpty()) {
                problem.setProperty("missingRoles", forbidden.missingRoles());
            }
        }
        return problem;
    }

    public static ProblemDetail of(ErrorCode code, String detail) {
        HttpStatus status = HttpStatus.valueOf(code.httpStatus());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(status.getReasonPhrase());
        problem.setType(URI.create(TYPE_PREFIX + code.name().toLowerCase(Locale.ROOT).replace('_', '-')));
        problem.setProperty("code", code.code());
        return enrich(problem);
    }

    /** Adds the timestamp and, inside a request, its correlation id. */
    public static ProblemDetail enrich(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        RequestContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
