package com.stagegate.core.collaborator;

import java.util.List;

public record ReviewVerdict(boolean approved, List<String> reasons) {

    public ReviewVerdict {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static ReviewVerdict approve() {
        return new ReviewVerdict(true, List.of());
    }

    public static ReviewVerdict reject(String... reasons) {
        return new ReviewVerdict(false, List.of(reasons));
    }
}
