package com.tasktracker.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * JwtAuthenticationFilter - Resolves the caller's identity from the bearer token.
 * 
 * Runs inside the Spring Security filter chain, ahead of authorization:
 * 1. Read "Authorization: Bearer <token>"
 * 2. Validate the token and read its subject via {@link JwtTokenService#resolve}
 * 3. On success, bind an {@link AuthenticatedUser} into this request's SecurityContext
 * 
 * On a missing or invalid token nothing is bound. The chain's authorization rules then
 * reject every protected route with 401 (see RestAuthenticationEntryPoint) before a
 * controller or repository is reached.
 * 
 * This is the only place a token is validated. Downstream code trusts the bound principal
 * and takes the acting user id from nowhere else.
 * 
 * Not a Spring bean: it is constructed by SecurityConfig so the servlet container does not
 * register it a second time outside the security chain.
 */
@Slf4j
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private final JwtTokenService tokenService;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        Optional<String> token = BearerTokenExtractor.extract(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token.isPresent()) {
            Optional<AuthenticatedUser> user = tokenService.resolve(token.get());
            if (user.isPresent()) {
                bind(user.get(), request);
            } else {
                log.debug("Invalid bearer token on {} {}", request.getMethod(), request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }

    private void bind(AuthenticatedUser user, HttpServletRequest request) {
        UsernamePasswordAuthenticationToken authentication =
                UsernamePasswordAuthenticationToken.authenticated(user, null, List.of());
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));

        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(authentication);
        SecurityContextHolder.setContext(context);
    }
}
