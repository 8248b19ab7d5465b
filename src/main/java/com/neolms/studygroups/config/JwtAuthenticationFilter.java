package com.neolms.studygroups.config;

import com.neolms.studygroups.model.Viewer;
import com.neolms.studygroups.service.JwtService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;

/**
 * Puts the caller's identity on the request: the security context for Spring Security, and
 * the userId/displayName/avatarUrl attributes read by the controllers.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    public static final String USER_ID_ATTRIBUTE = "userId";
    public static final String DISPLAY_NAME_ATTRIBUTE = "displayName";
    public static final String AVATAR_URL_ATTRIBUTE = "avatarUrl";

    private final JwtService jwtService;

    @Autowired
    public JwtAuthenticationFilter(JwtService jwtService) {
        this.jwtService = jwtService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authHeader = request.getHeader("Authorization");

        if (authHeader != null && authHeader.startsWith("Bearer ")) {
            String token = authHeader.substring(7);

            if (jwtService.isTokenValid(token)) {
                Viewer viewer = jwtService.extractViewer(token);

                UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(viewer.getUserId(), null, new ArrayList<>());
                SecurityContextHolder.getContext().setAuthentication(authentication);

                request.setAttribute(USER_ID_ATTRIBUTE, viewer.getUserId());
                request.setAttribute(DISPLAY_NAME_ATTRIBUTE, viewer.getDisplayName());
                if (viewer.getAvatarUrl() != null) {
                    request.setAttribute(AVATAR_URL_ATTRIBUTE, viewer.getAvatarUrl());
                }
            } else {
                // No authentication set; the entry point answers 401
                logger.warn("Invalid or expired JWT token for request: {} {}", request.getMethod(), request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }
}
