package com.platform.wafoperator.reconciliation;

/**
 * Operator-level defaults used when translating a WAFPolicy into an Engine.
 * These are not part of the user-facing policy spec.
 *
 * @param envoyClusterName reserved for data-plane drivers that address the
 *                         rule set cache server by cluster name; not used in synthesis
 */
public record TranslatorConfig(
    String defaultWasmImage,
    int defaultPollInterval,
    String envoyClusterName
) {
    
    public static final String FALLBACK_WASM_IMAGE =
        "oci://ghcr.io/networking-incubator/coraza-proxy-wasm:179ea90b2617f557f805fe672daf880c14c6b8b7";
    
    public static final int DEFAULT_POLL_INTERVAL_SECONDS = 5;
    
    public TranslatorConfig {
        if (defaultWasmImage == null || defaultWasmImage.isBlank()) {
            defaultWasmImage = FALLBACK_WASM_IMAGE;
        }
        if (defaultPollInterval <= 0) {
            defaultPollInterval = DEFAULT_POLL_INTERVAL_SECONDS;
        }
    }
    
    public static TranslatorConfig defaults() {
        return new TranslatorConfig(FALLBACK_WASM_IMAGE, DEFAULT_POLL_INTERVAL_SECONDS, null);
    }
}
