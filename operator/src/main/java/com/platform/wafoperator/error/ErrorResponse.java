package com.platform.wafoperator.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Body of every error returned by the operations API.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /**
     * Operator error code, e.g. WAF-300.
     */
    private String code;

    private String message;

    private String detail;

    /**
     * True when a later pass or a repeated request can succeed without intervention.
     */
    private boolean recoverable;

    private int status;

    private Instant timestamp;

    private String path;

    private String correlationId;

    /**
     * Cluster object the failure is about, absent for plain request errors.
     */
    private InvolvedObject involvedObject;

    /**
     * Schema rules a rejected WAFPolicy broke.
     */
    private List<Violation> violations;

    @Data
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class InvolvedObject {
        private String kind;
        private String namespace;
        private String name;

        /**
         * Splits a {@code namespace/name} key; a key without a slash is taken as a bare name.
         */
        public static InvolvedObject of(String kind, String key) {
            InvolvedObjectBuilder builder = InvolvedObject.builder().kind(kind);
            if (key == null) {
                return builder.build();
            }
            int slash = key.indexOf('/');
            if (slash < 0) {
                return builder.name(key).build();
            }
            return builder
                .namespace(key.substring(0, slash))
                .name(key.substring(slash + 1))
                .build();
        }
    }

    @Data
    @Builder
    public static class Violation {
        private String field;
        private String message;
        private Object rejectedValue;
    }
}
