package com.offerflow.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * HTTP 链路日志过滤器：写入 traceId/requestId 到 MDC 与响应头，输出 HTTP_IN/HTTP_OUT。
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    static final String HEADER_TRACE_ID = "X-Trace-Id";
    static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final String MDC_TRACE_ID = "traceId";
    private static final String MDC_REQUEST_ID = "requestId";

    private final ObjectMapper objectMapper;
    private final ObservabilityHttpLogProperties properties;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    public RequestTraceLoggingFilter(ObjectMapper objectMapper,
                                     ObservabilityHttpLogProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request == null || !properties.isEnabled()) {
            return true;
        }
        String path = StringUtils.defaultIfBlank(request.getRequestURI(), "/").trim();
        if (matchesAny(path, properties.getExcludePathPatterns())) {
            return true;
        }
        List<String> includePatterns = properties.getIncludePathPatterns();
        return includePatterns != null && !includePatterns.isEmpty() && !matchesAny(path, includePatterns);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = resolveOrCreate(request.getHeader(HEADER_TRACE_ID));
        String requestId = resolveOrCreate(request.getHeader(HEADER_REQUEST_ID));
        String method = request.getMethod();
        String path = StringUtils.defaultIfBlank(request.getRequestURI(), "/").trim();

        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_REQUEST_ID, requestId);

        ContentCachingResponseWrapper responseWrapper = response instanceof ContentCachingResponseWrapper cached
                ? cached
                : new ContentCachingResponseWrapper(response);
        boolean sampled = shouldSample();
        long startNs = System.nanoTime();
        if (sampled) {
            log.info("HTTP_IN method={}, path={}, query={}", method, path,
                    StringUtils.defaultIfBlank(request.getQueryString(), "-"));
        }

        Throwable error = null;
        try {
            filterChain.doFilter(request, responseWrapper);
        } catch (IOException | ServletException | RuntimeException ex) {
            error = ex;
            throw ex;
        } finally {
            long costMs = (System.nanoTime() - startNs) / 1_000_000L;
            boolean slow = costMs >= properties.slowThresholdFor(path, pathMatcher);
            if (error != null) {
                log.warn("HTTP_OUT method={}, path={}, status={}, costMs={}, outcome=error, errorType={}, errorMessage={}",
                        method, path, responseWrapper.getStatus(), costMs,
                        error.getClass().getSimpleName(), StringUtils.abbreviate(error.getMessage(), 200));
            } else if (sampled || slow) {
                log.info("HTTP_OUT method={}, path={}, status={}, responseCode={}, costMs={}, slow={}",
                        method, path, responseWrapper.getStatus(),
                        StringUtils.defaultIfBlank(extractResponseCode(responseWrapper), "-"), costMs, slow);
            }
            responseWrapper.copyBodyToResponse();
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_TRACE_ID);
        }
    }

    private String resolveOrCreate(String headerValue) {
        if (StringUtils.isNotBlank(headerValue)) {
            return headerValue.trim();
        }
        return UUID.randomUUID().toString().replace("-", "");
    }

    private boolean shouldSample() {
        double rate = properties.getSampleRate();
        if (rate <= 0D) {
            return false;
        }
        return rate >= 1D || ThreadLocalRandom.current().nextDouble() <= rate;
    }

    /**
     * 读取响应信封里的业务码，非 JSON 响应返回 null。
     */
    private String extractResponseCode(ContentCachingResponseWrapper responseWrapper) {
        byte[] body = responseWrapper.getContentAsByteArray();
        String contentType = responseWrapper.getContentType();
        if (body.length == 0 || StringUtils.isBlank(contentType)
                || !contentType.toLowerCase(Locale.ROOT).contains(MediaType.APPLICATION_JSON_VALUE)) {
            return null;
        }
        try {
            JsonNode code = objectMapper.readTree(body).get("code");
            return code == null || code.isNull() ? null : code.asText();
        } catch (IOException ex) {
            log.debug("Response body is not a JSON envelope. error={}", ex.getMessage());
            return null;
        }
    }

    private boolean matchesAny(String path, List<String> patterns) {
        if (patterns == null) {
            return false;
        }
        for (String pattern : patterns) {
            if (StringUtils.isNotBlank(pattern) && pathMatcher.match(pattern.trim(), path)) {
                return true;
            }
        }
        return false;
    }
}
