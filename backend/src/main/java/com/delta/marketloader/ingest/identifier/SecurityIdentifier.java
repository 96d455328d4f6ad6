package com.delta.marketloader.ingest.identifier;

public record SecurityIdentifier(SecurityType type, long sequence) {

    public long encode() {
        return IdentifierCodec.encode(type, sequence);
    }

    public static SecurityIdentifier decode(long id) {
        return IdentifierCodec.decode(id);
    }
}
