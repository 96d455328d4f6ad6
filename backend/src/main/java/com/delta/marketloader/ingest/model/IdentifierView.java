package com.delta.marketloader.ingest.model;

import com.delta.marketloader.ingest.identifier.SecurityType;

public record IdentifierView(long sid, SecurityType type, String displayName, long sequence) {
}
