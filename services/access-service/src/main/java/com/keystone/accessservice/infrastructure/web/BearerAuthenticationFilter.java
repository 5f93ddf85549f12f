package com.keystone.accessservice.infrastructure.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.keystone.accessservice.config.KeystoneAuthProperties;
import com.keystone.audit.AuditEvent;
import com.keystone.audit.AuditLedger;
import com.keystone.observability.RequestContextHolder;
import com.keystone.observability.SpanHelper;
import com.keystone.security.AuthenticationRequiredException;
import com.keystone.security.BearerTokenExtractor;
import com.keystone.security.IdentityExtractor;
import com.keystone.security.KeystoneException;
import com.keystone.security.OrgContext;
import com.keystone.security.OrgScopedQuery;
import com.keystone.security.Principal;
import com.keystone.security.PrincipalValidator;
import com.keystone.security.TenantScope;
import com.keystone.security.TokenValidator;
import com.keystone.security.ValidationResult;
import com.nimbusds.jwt.JWTClaimsSet;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates {@code /api/**} requests and resolves their tenant.
 *
 * <ol>
 *   <li>extracts the bearer token and validates it inside an {@code auth.token.validate} span
 *   <li>maps the claims to a {@link Principal} and rejects principals without a subject
 *   <li>resolves the {@link OrgContext}, honouring the override header for system administrators
 *       and recording each granted override as an {@code admin.override} audit event
 * </ol>
 *
 * <p>The principal and its {@link OrgScopedQuery} are exposed to handlers as request attributes.
 * Failures are answered directly with a problem response; the chain is not invoked.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class BearerAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(BearerAuthenticationFilter.class);

    public static final String PRINCIPAL_ATTRIBUTE = "keystone.principal";
    public static final String SCOPED_QUERY_ATTRIBUTE = "keystone.scopedQuery";

    static final String PROTECTED_PREFIX = "/api/";
    static final String VALIDATE_SPAN = "auth.token.validate";

    private final TokenValidator tokenValidator;
    private final IdentityExtractor identityExtractor;
    private final AuditLedger auditLedger;
    private final SpanHelper spans;
    private final KeystoneAuthProperties auth;
    private final ObjectMapper objectMapper;

    public BearerAuthenticationFilter(
            TokenValidator tokenValidator,
            IdentityExtractor identityExtractor,
            AuditLedger auditLedger,
            SpanHelper spans,
            KeystoneAuthProperties auth,
            ObjectMapper objectMapper) {
        this.tokenValidator = tokenValidator;
        this.identityExtractor = identityExtractor;
        this.auditLedger = auditLedger;
        this.spans = spans;
        this.auth = auth;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return !path.startsWith(PROTECTED_PREFIX) || "OPTIONS".equalsIgnoreCase(request.getMethod());
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        Principal principal;
        OrgContext orgContext;
        try {
            principal = authenticate(request);
            orgContext = TenantScope.resolve(principal, request.getHeader(auth.overrideHeader()));
        } catch (KeystoneException e) {
            reject(response, e);
            return;
        }

        if (orgContext.override()) {
            auditLedger.append(AuditEvent.adminOverride(
                    principal, orgContext.originalOrgId(), orgContext.orgId(),
                    request.getMethod(), request.getRequestURI()));
        }

        RequestContextHolder.attachCaller(principal.subjectId(), orgContext.orgId());
        request.setAttribute(PRINCIPAL_ATTRIBUTE, principal);
        request.setAttribute(SCOPED_QUERY_ATTRIBUTE, TenantScope.scopedQuery(principal, orgContext));
        log.debug("Authenticated {} for organization {}", principal.subjectId(), orgContext.orgId());

        filterChain.doFilter(request, response);
    }

    private Principal authenticate(HttpServletRequest request) {
        String token = BearerTokenExtractor.extract(request.getHeader(HttpHeaders.AUTHORIZATION))
                .orElseThrow(() -> new AuthenticationRequiredException("Missing bearer token"));

        JWTClaimsSet claims = spans.inSpan(VALIDATE_SPAN, Map.of(), () -> tokenValidator.validate(token));
        Principal principal = identityExtractor.extract(claims, token);

        ValidationResult validation = PrincipalValidator.validate(principal);
        if (!validation.valid()) {
            throw new AuthenticationRequiredException("Token does not identify a user: "
                    + String.join("; ", validation.errors()));
        }
        return principal;
    }

    private void reject(HttpServletResponse response, KeystoneException e) throws IOException {
        ProblemDetail problem = ProblemDetails.of(e);
        response.setStatus(problem.getStatus());
        if (problem.getStatus() == HttpServletResponse.SC_UNAUTHORIZED) {
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        }
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), problem);
    }
}
