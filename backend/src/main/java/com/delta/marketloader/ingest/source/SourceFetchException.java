package com.delta.marketloader.ingest.source;

import java.util.EnumSet;
import java.util.Set;

public class SourceFetchException extends RuntimeException {
    private final FetchErrorKind kind;
    private final DataSource source;
    private final Integer httpStatus;

    public SourceFetchException(FetchErrorKind kind, DataSource source, Integer httpStatus, String message) {
        this(kind, source, httpStatus, message, null);
    }

    public SourceFetchException(
        FetchErrorKind kind,
        DataSource source,
        Integer httpStatus,
        String message,
        Throwable cause
    ) {
        super(message, cause);
        this.kind = kind;
        this.source = source;
        this.httpStatus = httpStatus;
    }

    public static SourceFetchException dataIntegrity(DataSource source, String message, Throwable cause) {
        return new SourceFetchException(FetchErrorKind.DATA_INTEGRITY, source, null, message, cause);
    }

    public static SourceFetchException unsupported(DataSource source, String message) {
        return new SourceFetchException(FetchErrorKind.UNSUPPORTED, source, null, message);
    }

    public FetchErrorKind getKind() {
        return kind;
    }

    public DataSource getSource() {
        return source;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }

    /**
     * Kinds of this error and of every suppressed source error attached to it.
     */
    public Set<FetchErrorKind> observedKinds() {
        Set<FetchErrorKind> kinds = EnumSet.of(kind);
        for (Throwable suppressed : getSuppressed()) {
            if (suppressed instanceof SourceFetchException sourceError) {
                kinds.add(sourceError.getKind());
            }
        }
        return kinds;
    }

    @Override
    public String getMessage() {
        String base = super.getMessage();
        return (source == null ? "" : source.key() + ": ") + kind + (base == null ? "" : " " + base);
    }
}
