package com.whisk.shopkeeper.config;

import com.whisk.shopkeeper.service.TokenService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * Resolves {@code Authorization: Bearer <token>} into a principal. Requests
 * without a valid token continue unauthenticated and are turned away by the
 * authorization rules before reaching a controller.
 */
@Slf4j
public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenService tokenService;

    public BearerTokenAuthenticationFilter(TokenService tokenService) {
        this.tokenService = tokenService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String rawToken = header.substring(BEARER_PREFIX.length()).trim();
            Optional<Authentication> auth = rawToken.isEmpty() ? Optional.empty() : tokenService.authenticate(rawToken);
            if (auth.isPresent()) {
                Authentication authentication = auth.get();
                if (authentication instanceof AbstractAuthenticationToken) {
                    ((AbstractAuthenticationToken) authentication)
                            .setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                }
                SecurityContext context = SecurityContextHolder.createEmptyContext();
                context.setAuthentication(authentication);
                SecurityContextHolder.setContext(context);
                log.debug("Authenticated {} for {}", authentication.getName(), request.getRequestURI());
            } else {
                log.warn("Rejected bearer token on {} from {}", request.getRequestURI(), request.getRemoteAddr());
            }
        }

        filterChain.doFilter(request, response);
    }
}
