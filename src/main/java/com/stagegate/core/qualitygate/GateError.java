package com.stagegate.core.qualitygate;

/**
 * One failed check, tagged with the schema it concerns.
 *
 * @param kind    category of failure
 * @param schema  schema name the check belongs to
 * @param message what was wrong
 */
public record GateError(GateErrorKind kind, String schema, String message) {

    public String render() {
        return String.format("%s [%s] %s", kind.label(), schema, message);
    }

    @Override
    public String toString() {
        return render();
    }
}
