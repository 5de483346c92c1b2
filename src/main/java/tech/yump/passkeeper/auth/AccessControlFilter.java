package tech.yump.passkeeper.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;
import tech.yump.passkeeper.api.ApiError;
import tech.yump.passkeeper.auth.policy.AccessPolicyRepository;
import tech.yump.passkeeper.auth.token.TokenClaims;
import tech.yump.passkeeper.auth.token.TokenException;
import tech.yump.passkeeper.auth.token.TokenExpiredException;
import tech.yump.passkeeper.auth.token.TokenService;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Authenticates and authorizes every request against the operation access table.
 * <p>
 * Operations without a rule pass through untouched. For protected operations the bearer token is
 * verified, the token's role checked against the allowed roles, and the subject stored as the
 * request's owner id under {@link #OWNER_ID_ATTRIBUTE}. Runtime faults escaping the rest of the
 * chain become a generic 500 response.
 */
@Slf4j
@RequiredArgsConstructor
public class AccessControlFilter extends OncePerRequestFilter {

    public static final String OWNER_ID_ATTRIBUTE = "passkeeper.ownerId";
    public static final String MDC_REQUEST_ID_KEY = "requestId";
    public static final String ROLE_AUTHORITY_PREFIX = "ROLE_";

    private static final String BEARER_PREFIX = "Bearer ";

    private final AccessPolicyRepository accessPolicyRepository;
    private final TokenService tokenService;
    private final ObjectMapper objectMapper;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain) throws ServletException, IOException {

        MDC.put(MDC_REQUEST_ID_KEY, UUID.randomUUID().toString());
        try {
            authorizeAndProceed(request, response, filterChain);
        } catch (RuntimeException e) {
            containFault(request, response, e);
        } catch (ServletException e) {
            // DispatcherServlet wraps unhandled handler faults
            if (!(e.getCause() instanceof RuntimeException)) {
                throw e;
            }
            containFault(request, response, e.getCause());
        } finally {
            SecurityContextHolder.clearContext();
            MDC.remove(MDC_REQUEST_ID_KEY);
        }
    }

    private void authorizeAndProceed(HttpServletRequest request,
                                     HttpServletResponse response,
                                     FilterChain filterChain) throws ServletException, IOException {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        Optional<VaultOperation> operation = VaultOperation.resolve(request.getMethod(), path);
        Optional<Set<String>> allowedRoles = operation
                .map(VaultOperation::operationName)
                .flatMap(accessPolicyRepository::findAllowedRoles);

        if (allowedRoles.isEmpty()) {
            log.trace("{} {} is not a protected operation. Proceeding.", request.getMethod(), path);
            filterChain.doFilter(request, response);
            return;
        }
        String operationName = operation.get().operationName();

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (!StringUtils.hasText(header)) {
            log.debug("Missing {} header for operation {}", HttpHeaders.AUTHORIZATION, operationName);
            sendError(response, HttpStatus.UNAUTHORIZED, "authorization token is required");
            return;
        }

        TokenClaims claims;
        try {
            claims = tokenService.verify(stripBearerPrefix(header));
        } catch (TokenExpiredException e) {
            log.debug("Expired token presented for operation {}", operationName);
            sendError(response, HttpStatus.UNAUTHORIZED, "token expired");
            return;
        } catch (TokenException e) {
            log.warn("Invalid token presented for operation {}: {}", operationName, e.getMessage());
            sendError(response, HttpStatus.UNAUTHORIZED, "invalid token");
            return;
        }

        if (!allowedRoles.get().contains(claims.role())) {
            log.warn("Access DENIED for subject '{}' with role '{}' to operation {}", claims.subject(), claims.role(), operationName);
            sendError(response, HttpStatus.FORBIDDEN, "permission denied");
            return;
        }

        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                claims.subject(),
                null,
                List.of(new SimpleGrantedAuthority(ROLE_AUTHORITY_PREFIX + claims.role())));
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        request.setAttribute(OWNER_ID_ATTRIBUTE, claims.subject());
        log.debug("Access GRANTED for subject '{}' to operation {}", claims.subject(), operationName);

        filterChain.doFilter(request, response);
    }

    private void containFault(HttpServletRequest request, HttpServletResponse response, Throwable fault) throws IOException {
        log.error("Unhandled error while processing {} {}: {}", request.getMethod(), request.getRequestURI(), fault.getMessage(), fault);
        if (response.isCommitted()) {
            log.warn("Response already committed, cannot write error body for {} {}", request.getMethod(), request.getRequestURI());
            return;
        }
        response.reset();
        sendError(response, HttpStatus.INTERNAL_SERVER_ERROR, "internal server error");
    }

    private static String stripBearerPrefix(String header) {
        String value = header.trim();
        if (value.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return value.substring(BEARER_PREFIX.length()).trim();
        }
        return value;
    }

    private void sendError(HttpServletResponse response, HttpStatus status, String message) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(new ApiError(message)));
    }
}
