package com.platform.failover.observability;

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
 * Logging configuration: correlation IDs on the operator API and MDC helpers for
 * decision processing.
 */
@Slf4j
@Configuration
public class LoggingConfig {
    
    public static final String MDC_SERVICE_ID = "serviceId";
    public static final String MDC_REGION_ID = "regionId";
    public static final String MDC_FAILOVER_EVENT_ID = "failoverEventId";
    
    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }
    
    public static class CorrelationIdFilter extends OncePerRequestFilter {
        
        private static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
        private static final String MDC_CORRELATION_ID = "correlationId";
        
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
                response.setHeader(CORRELATION_ID_HEADER, correlationId);
                
                filterChain.doFilter(request, response);
                
            } finally {
                MDC.remove(MDC_CORRELATION_ID);
            }
        }
    }
    
    /**
     * Set service/region context in MDC for logging.
     */
    public static void setDecisionContext(String serviceId, String regionId) {
        MDC.put(MDC_SERVICE_ID, serviceId);
        if (regionId != null) {
            MDC.put(MDC_REGION_ID, regionId);
        }
    }
    
    public static void clearDecisionContext() {
        MDC.remove(MDC_SERVICE_ID);
        MDC.remove(MDC_REGION_ID);
        MDC.remove(MDC_FAILOVER_EVENT_ID);
    }
    
    public static void setFailoverContext(String failoverEventId) {
        MDC.put(MDC_FAILOVER_EVENT_ID, failoverEventId);
    }
}
