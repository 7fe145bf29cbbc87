package uk.gegc.billingrecon.shared.api.problem;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

import java.net.URI;
import java.time.Instant;

/**
 * Builds RFC 7807 {@link ProblemDetail} bodies in one consistent shape.
 *
 * <p>Besides the standard members every problem carries {@code error} (the detail text) and
 * {@code timestamp}, so callers that only understand a flat {@code {"error": ...}} body,
 * payment providers deciding whether to retry among them, can still read it.
 */
public final class ProblemDetailBuilder {

    private ProblemDetailBuilder() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static ProblemDetail create(
            HttpStatus status,
            URI type,
            String title,
            String detail,
            HttpServletRequest request
    ) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(type);
        problem.setTitle(title);
        if (request != null) {
            problem.setInstance(URI.create(request.getRequestURI()));
        }
        problem.setProperty("error", detail);
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }

    /**
     * Variant for filters and entry points that run outside Spring MVC.
     */
    public static ProblemDetail create(HttpStatus status, URI type, String title, String detail) {
        return create(status, type, title, detail, null);
    }
}
