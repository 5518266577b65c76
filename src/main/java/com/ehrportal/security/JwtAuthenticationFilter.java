package com.ehrportal.security;

import com.ehrportal.entity.User;
import com.ehrportal.exception.ErrorKind;
import com.ehrportal.exception.TokenVerificationException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * Resolves the bearer token of each request to a {@link UserPrincipal}. A
 * missing or failing token leaves the request anonymous; protected endpoints
 * then answer UNAUTHENTICATED. The specific failure kind is only logged.
 * A store failure while resolving the subject ends the request with
 * INTERNAL_ERROR.
 */
@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private final TokenService tokenService;
    private final ErrorResponseWriter errorResponseWriter;

    public JwtAuthenticationFilter(TokenService tokenService, ErrorResponseWriter errorResponseWriter) {
        this.tokenService = tokenService;
        this.errorResponseWriter = errorResponseWriter;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        Optional<String> token = BearerTokenExtractor.extract(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token.isPresent()) {
            try {
                User user = tokenService.verify(token.get());
                UserPrincipal principal = UserPrincipal.from(user);
                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, null, principal.getAuthorities());
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));

                SecurityContext context = SecurityContextHolder.createEmptyContext();
                context.setAuthentication(authentication);
                SecurityContextHolder.setContext(context);
            } catch (TokenVerificationException e) {
                log.debug("Bearer token rejected on {} {}: {} ({})",
                        request.getMethod(), request.getRequestURI(), e.getKind(), e.getMessage());
                SecurityContextHolder.clearContext();
            } catch (DataAccessException e) {
                log.error("Cannot resolve bearer token on {} {}", request.getMethod(), request.getRequestURI(), e);
                SecurityContextHolder.clearContext();
                errorResponseWriter.write(response, ErrorKind.INTERNAL_ERROR, "An unexpected error occurred");
                return;
            }
        }
        filterChain.doFilter(request, response);
    }
}
