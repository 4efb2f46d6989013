package com.platform.wafoperator.observability;

import com.platform.wafoperator.model.ObjectKey;
import com.platform.wafoperator.model.ResourceKind;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Logging configuration: correlation IDs for API requests and
 * reconcile context for controller workers.
 */
@Slf4j
@Configuration
public class LoggingConfig {
    
    public static final String MDC_NAMESPACE = "namespace";
    public static final String MDC_NAME = "name";
    public static final String MDC_KIND = "kind";
    public static final String MDC_RECONCILE_ID = "reconcileId";
    
    /**
     * Filter to add correlation ID to all requests.
     */
    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }
    
    public static class CorrelationIdFilter extends OncePerRequestFilter {
        
        private static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
        private static final String MDC_CORRELATION_ID = "correlationId";
        private static final String MDC_REQUEST_PATH = "requestPath";
        
        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {
            
            try {
                String correlationId = request.getHeader(CORRELATION_ID_HEADER);
                if (correlationId == null || correlationId.isBlank()) {
                    correlationId = UUID.randomUUID().toString();
                }
                
                MDC.put(MDC_CORRELATION_ID, correlationId);
                MDC.put(MDC_REQUEST_PATH, request.getRequestURI());
                response.setHeader(CORRELATION_ID_HEADER, correlationId);
                
                filterChain.doFilter(request, response);
                
            } finally {
                MDC.remove(MDC_CORRELATION_ID);
                MDC.remove(MDC_REQUEST_PATH);
            }
        }
    }
    
    /**
     * Set reconcile context in MDC for the current worker thread.
     */
    public static void setReconcileContext(ObjectKey key, String reconcileId) {
        MDC.put(MDC_NAMESPACE, key.namespace());
        MDC.put(MDC_NAME, key.name());
        MDC.put(MDC_KIND, ResourceKind.WAF_POLICY.getKindName());
        MDC.put(MDC_RECONCILE_ID, reconcileId);
    }
    
    /**
     * Clear reconcile context.
     */
    public static void clearReconcileContext() {
        MDC.remove(MDC_NAMESPACE);
        MDC.remove(MDC_NAME);
        MDC.remove(MDC_KIND);
        MDC.remove(MDC_RECONCILE_ID);
    }
}
