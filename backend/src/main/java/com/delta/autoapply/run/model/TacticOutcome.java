package com.delta.autoapply.run.model;

/**
 * Result of one best-effort form tactic. {@code NOT_FOUND} means "try the next tactic";
 * {@code ERROR} means the control was found but the driver rejected the interaction.
 */
public record TacticOutcome(Kind kind, String tactic, String detail) {

    public enum Kind {
        FOUND,
        NOT_FOUND,
        ERROR
    }

    public static TacticOutcome found(String tactic, String detail) {
        return new TacticOutcome(Kind.FOUND, tactic, detail);
    }

    public static TacticOutcome notFound(String tactic) {
        return new TacticOutcome(Kind.NOT_FOUND, tactic, null);
    }

    public static TacticOutcome error(String tactic, Throwable error) {
        String detail = error == null ? null : error.getClass().getSimpleName() + ": " + error.getMessage();
        return new TacticOutcome(Kind.ERROR, tactic, detail);
    }

    public boolean isFound() {
        return kind == Kind.FOUND;
    }
}
