package it.berlink.querywatch.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * QueryLogAnalyzer - offline SQL log analysis.
 *
 * Reads a log file of executed statements, groups them by normalized pattern
 * and reports slow statements, suspected N+1 patterns and recommendations.
 *
 * Usage:
 * query-log-analyzer &lt;log-file&gt; [--threshold=&lt;ms&gt;] [--output=&lt;file&gt;] [--format=text|json] [--top=&lt;n&gt;]
 */
@SpringBootApplication
public class QueryLogAnalyzerApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(QueryLogAnalyzerApplication.class, args)));
    }
}
