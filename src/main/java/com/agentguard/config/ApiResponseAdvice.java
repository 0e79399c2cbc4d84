package com.agentguard.config;

import com.agentguard.api.dto.response.ApiErrorResponse;
import com.agentguard.api.dto.response.ApiResponse;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps successful controller results in {@link ApiResponse}, which also stamps the
 * request's trace id. {@code /api/health} is returned bare as {@code {"status":"UP"}} so
 * load balancers can match on it.
 */
@RestControllerAdvice
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    static final String HEALTH_PATH = "/api/health";

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return true;
    }

    @Override
    public Object beforeBodyWrite(
            Object body,
            MethodParameter returnType,
            MediaType selectedContentType,
            Class<? extends HttpMessageConverter<?>> selectedConverterType,
            ServerHttpRequest request,
            ServerHttpResponse response) {

        String path = request.getURI().getPath();

        // Liveness probes, actuator and the container error page keep their own formats
        if (path.equals(HEALTH_PATH) || path.startsWith("/actuator") || path.equals("/error")) {
            return body;
        }

        if (body instanceof ApiResponse<?> || body instanceof ApiErrorResponse) {
            return body;
        }

        // StringHttpMessageConverter cannot write an ApiResponse
        if (StringHttpMessageConverter.class.isAssignableFrom(selectedConverterType)) {
            return body;
        }

        return ApiResponse.of(body);
    }
}
