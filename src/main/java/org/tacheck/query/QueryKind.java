package org.tacheck.query;

import java.util.Optional;

public enum QueryKind {

    REFINEMENT("refinement"),
    CONSISTENCY("consistency"),
    DETERMINISM("determinism"),
    REACHABILITY("reachability"),
    GET_COMPONENTS("get-components"),
    PRUNE("prune");

    private final String keyword;

    QueryKind(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }

    public static Optional<QueryKind> fromKeyword(String keyword) {
        for (QueryKind kind : values()) {
            if (kind.keyword.equals(keyword)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
