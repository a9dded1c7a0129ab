package com.policyparser.discovery.fetch;

import java.util.Optional;

/**
 * Renders a page in an external headless browser and returns the resulting HTML.
 */
public interface PageRenderer {

    Optional<String> render(String url, long timeoutMs);
}
