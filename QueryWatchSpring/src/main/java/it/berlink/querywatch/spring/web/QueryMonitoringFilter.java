package it.berlink.querywatch.spring.web;

import it.berlink.querywatch.QueryWatchEngine;
import it.berlink.querywatch.log.StatementLog;
import it.berlink.querywatch.log.ThreadLocalStatementLog;
import it.berlink.querywatch.model.ScopeReport;
import it.berlink.querywatch.scope.ScopeHandle;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Monitors the statements executed while serving each HTTP request.
 *
 * One scope is opened per request, labelled "METHOD path". When the engine reads
 * the per-thread log, the calling thread's buffer is cleared once the request
 * completes, so pooled threads start each request with an empty log.
 */
@Slf4j
public class QueryMonitoringFilter extends OncePerRequestFilter {

    public static final String QUERY_COUNT_HEADER = "X-DB-Query-Count";
    public static final String QUERY_TIME_HEADER = "X-DB-Query-Time";

    private final QueryWatchEngine engine;
    private final StatementLog statementLog;
    private final List<String> ignoredPathPrefixes;
    private final boolean exposeHeaders;

    public QueryMonitoringFilter(QueryWatchEngine engine,
                                 StatementLog statementLog,
                                 List<String> ignoredPathPrefixes,
                                 boolean exposeHeaders) {
        this.engine = engine;
        this.statementLog = statementLog;
        this.ignoredPathPrefixes = List.copyOf(ignoredPathPrefixes);
        this.exposeHeaders = exposeHeaders;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = pathOf(request);
        for (String prefix : ignoredPathPrefixes) {
            if (path.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        ScopeHandle handle = engine.begin(request.getMethod() + " " + pathOf(request));
        try {
            filterChain.doFilter(request, response);
        } finally {
            try {
                Optional<ScopeReport> report = engine.end(handle);
                if (exposeHeaders && report.isPresent()) {
                    writeHeaders(response, report.get());
                }
            } finally {
                if (statementLog instanceof ThreadLocalStatementLog) {
                    ((ThreadLocalStatementLog) statementLog).clear();
                }
            }
        }
    }

    private void writeHeaders(HttpServletResponse response, ScopeReport report) {
        // Headers can no longer be added once the body has been flushed
        if (response.isCommitted()) {
            log.debug("Response already committed, skipping query headers for {}", report.getLabel());
            return;
        }
        response.setHeader(QUERY_COUNT_HEADER, String.valueOf(report.getTotalStatementCount()));
        response.setHeader(QUERY_TIME_HEADER, String.format(Locale.ROOT, "%.3f", report.getTotalTime()));
    }

    public StatementLog getStatementLog() {
        return statementLog;
    }

    static String pathOf(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (uri == null) {
            return "";
        }
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }
}
