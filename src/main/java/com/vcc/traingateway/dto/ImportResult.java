package com.vcc.traingateway.dto;

import java.util.List;

/**
 * Outcome of a credential file import run.
 */
public record ImportResult(
        int created,
        int updated,
        List<String> failed
) {
    public int total() {
        return created + updated + failed.size();
    }
}
