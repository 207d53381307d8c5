package in.co.pricematch.pojos;

/**
 * Outcome of the forbidden-match rules for one pair: whether it is disallowed, and why.
 */
public final class ForbiddenCheck {

    private static final ForbiddenCheck ALLOWED = new ForbiddenCheck(false, "");

    private final boolean forbidden;
    private final String reason;

    private ForbiddenCheck(boolean forbidden, String reason) {
        this.forbidden = forbidden;
        this.reason = reason;
    }

    public static ForbiddenCheck allowed() {
        return ALLOWED;
    }

    public static ForbiddenCheck forbidden(String reason) {
        return new ForbiddenCheck(true, reason);
    }

    public boolean isForbidden() { return forbidden; }
    public String getReason() { return reason; }

    @Override
    public String toString() {
        return forbidden ? "FORBIDDEN(" + reason + ")" : "ALLOWED";
    }
}
