package com.lendingledger.config;

import com.lendingledger.api.controller.PositionController;
import com.lendingledger.api.dto.response.ApiErrorResponse;
import com.lendingledger.api.dto.response.ApiResponse;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Puts ledger results into the {@code {success, data, timestamp}} envelope.
 *
 * <p>Scoped to the ledger controllers, so actuator and Boot's error endpoint keep their
 * own bodies. Results that are already an envelope, including rejections rendered by
 * {@link com.lendingledger.exception.GlobalExceptionHandler}, pass through.
 */
@RestControllerAdvice(basePackageClasses = PositionController.class)
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        // plain-text bodies cannot carry the JSON envelope
        return !StringHttpMessageConverter.class.isAssignableFrom(converterType);
    }

    @Override
    public Object beforeBodyWrite(
            Object body,
            MethodParameter returnType,
            MediaType selectedContentType,
            Class<? extends HttpMessageConverter<?>> selectedConverterType,
            ServerHttpRequest request,
            ServerHttpResponse response) {
        return isEnvelope(body) ? body : ApiResponse.ok(body);
    }

    private static boolean isEnvelope(Object body) {
        return body instanceof ApiResponse<?> || body instanceof ApiErrorResponse;
    }
}
