package io.atelier.application.service;

/**
 * Outcome of executing an action. {@code result} is only set on success,
 * {@code error} only on failure.
 */
public record ActionResult(
    boolean success,
    Object result,
    String error
) {
    public static ActionResult ok() {
        return new ActionResult(true, null, null);
    }

    public static ActionResult ok(Object result) {
        return new ActionResult(true, result, null);
    }

    public static ActionResult failure(String error) {
        return new ActionResult(false, null, error);
    }
}
