package io.warden.model;

import java.util.Map;

public record AnchorRecord(
        String ledgerId,
        String latestHash,
        long entryCount,
        String timestamp,
        Map<String, Object> anchorData
) {
}
