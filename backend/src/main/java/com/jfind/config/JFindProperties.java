package com.jfind.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "jfind")
public class JFindProperties {
    private static final int DEFAULT_MAX_LIMIT = 500;

    private Api api = new Api();
    private Cors cors = new Cors();

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Cors getCors() {
        return cors;
    }

    public void setCors(Cors cors) {
        this.cors = cors;
    }

    public static class Api {
        private int defaultScanLimit = 10;
        private int defaultHistoryLimit = 0;
        private int defaultOracleLimit = 10;
        private int maxLimit = DEFAULT_MAX_LIMIT;

        public int getDefaultScanLimit() {
            return Math.max(1, defaultScanLimit);
        }

        public void setDefaultScanLimit(int defaultScanLimit) {
            this.defaultScanLimit = Math.max(1, defaultScanLimit);
        }

        /**
         * Signed history limit used when a host query omits one: negative returns every scan,
         * zero only the current scan, positive the most recent N.
         */
        public int getDefaultHistoryLimit() {
            return defaultHistoryLimit;
        }

        public void setDefaultHistoryLimit(int defaultHistoryLimit) {
            this.defaultHistoryLimit = defaultHistoryLimit;
        }

        public int getDefaultOracleLimit() {
            return Math.max(1, defaultOracleLimit);
        }

        public void setDefaultOracleLimit(int defaultOracleLimit) {
            this.defaultOracleLimit = Math.max(1, defaultOracleLimit);
        }

        public int getMaxLimit() {
            return Math.max(1, maxLimit);
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = Math.max(1, maxLimit);
        }
    }

    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
        private boolean allowCredentials = true;

        public List<String> getAllowedOrigins() {
            if (allowedOrigins == null || allowedOrigins.isEmpty()) {
                return List.of("*");
            }
            return allowedOrigins;
        }

        public void setAllowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }

        public boolean isAllowCredentials() {
            return allowCredentials;
        }

        public void setAllowCredentials(boolean allowCredentials) {
            this.allowCredentials = allowCredentials;
        }
    }
}
