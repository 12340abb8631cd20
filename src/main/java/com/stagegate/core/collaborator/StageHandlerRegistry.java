package com.stagegate.core.collaborator;

import com.stagegate.core.model.Stage;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Resolves the handler for a stage from the ordered list of handler beans.
 */
@Component
public class StageHandlerRegistry {

    private final List<StageHandler> handlers;

    public StageHandlerRegistry(List<StageHandler> handlers) {
        this.handlers = List.copyOf(handlers);
    }

    public StageHandler handlerFor(Stage stage) {
        return handlers.stream()
                .filter(h -> h.supports(stage))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No stage handler for " + stage));
    }
}
