package com.convsync.auth.web;

import com.convsync.auth.service.JwtService;
import com.convsync.common.api.ApiCodes;
import com.convsync.common.api.Result;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * /api/** 强制鉴权：解析 Bearer accessToken，把 userId 放到 request attribute 与 {@link AuthContext}。
 * 没有 token 或 token 无效一律 401，响应体为统一 Result JSON。
 */
@Component
public class AccessTokenInterceptor implements HandlerInterceptor {

    public static final String REQ_ATTR_USER_ID = "X-Auth-UserId";

    private static final Logger log = LoggerFactory.getLogger(AccessTokenInterceptor.class);

    private final JwtService jwtService;
    private final ObjectMapper objectMapper;

    public AccessTokenInterceptor(JwtService jwtService, ObjectMapper objectMapper) {
        this.jwtService = jwtService;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String header = request.getHeader("Authorization");
        if (header == null || !header.startsWith("Bearer ")) {
            writeUnauthorized(request, response, "missing_access_token");
            return false;
        }

        String token = header.substring("Bearer ".length()).trim();
        try {
            Jws<Claims> jws = jwtService.parseAccessToken(token);
            long userId = jwtService.getUserId(jws.getPayload());
            request.setAttribute(REQ_ATTR_USER_ID, userId);
            AuthContext.setUserId(userId);
            return true;
        } catch (Exception e) {
            log.debug("access token rejected: path={}, err={}", request.getRequestURI(), e.toString());
            writeUnauthorized(request, response, "unauthorized");
            return false;
        }
    }

    private void writeUnauthorized(HttpServletRequest request, HttpServletResponse response, String reason) {
        response.setStatus(401);
        response.setCharacterEncoding("UTF-8");
        response.setContentType("application/json;charset=UTF-8");
        try {
            String json = objectMapper.writeValueAsString(Result.fail(ApiCodes.UNAUTHORIZED, reason));
            response.getWriter().write(json);
        } catch (Exception writeErr) {
            log.debug("write unauthorized response failed: path={}, err={}", request.getRequestURI(), writeErr.toString());
        }
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        AuthContext.clear();
    }
}
